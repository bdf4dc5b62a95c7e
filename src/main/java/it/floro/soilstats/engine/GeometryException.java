package it.floro.soilstats.engine;

/**
 * Geometria non supportata o malformata.
 * Interrompe l'intero join prima dell'apertura di qualsiasi raster.
 */
public class GeometryException extends RuntimeException {

    /** Posizione della geometria nell'input, -1 se non nota. */
    private final int featureIndex;

    public GeometryException(String message) {
        this(-1, message);
    }

    public GeometryException(int featureIndex, String message) {
        super(featureIndex >= 0 ? "Geometria #" + featureIndex + ": " + message : message);
        this.featureIndex = featureIndex;
    }

    public int getFeatureIndex() {
        return featureIndex;
    }
}
