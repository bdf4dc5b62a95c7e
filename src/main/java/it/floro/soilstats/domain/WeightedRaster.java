package it.floro.soilstats.domain;

import java.nio.file.Path;

/**
 * Raster con il peso dei suoi valori nel join pesato.
 *
 * Per i layer di suolo il peso è lo spessore in cm dello strato di
 * profondità a cui appartiene il file (es. 5_15_compressed → 10).
 */
public record WeightedRaster(
        Path path,                          // File raster
        double weight                       // Peso dei valori, > 0
) {

    public WeightedRaster {
        if (path == null) {
            throw new IllegalArgumentException("Percorso raster nullo");
        }
        if (!(weight > 0) || Double.isInfinite(weight)) {
            throw new IllegalArgumentException("Peso non valido per " + path + ": " + weight);
        }
    }
}
