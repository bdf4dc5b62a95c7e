package it.floro.soilstats.domain;

/**
 * Intervallo semiaperto di colonne [colStart, colEnd) su una riga del raster,
 * appartenente all'impronta rasterizzata di una feature.
 */
public record PixelRange(
        int row,                            // Riga del raster (scanline)
        int colStart,                       // Prima colonna inclusa
        int colEnd,                         // Prima colonna esclusa
        int featureIndex                    // Posizione della geometria nell'array del chiamante
) {

    public PixelRange {
        if (colStart >= colEnd) {
            throw new IllegalArgumentException("Intervallo vuoto [" + colStart + ", " + colEnd + ")");
        }
    }

    /** Numero di celle coperte. */
    public int length() {
        return colEnd - colStart;
    }
}
