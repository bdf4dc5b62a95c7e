package it.floro.soilstats.domain;

import org.locationtech.jts.geom.Envelope;

/**
 * Record che descrive la griglia di un raster: trasformazione modello → pixel,
 * dimensioni in celle e valore nodata.
 *
 * L'origine (x0, y0) è l'angolo superiore sinistro della cella (0,0) in coordinate
 * del modello. Per i raster "north-up" sy è negativo.
 */
public record RasterGrid(
        double x0,                          // Origine X: bordo sinistro della colonna 0
        double y0,                          // Origine Y: bordo superiore della riga 0
        double sx,                          // Dimensione pixel lungo X (unità del modello)
        double sy,                          // Dimensione pixel lungo Y (negativa se north-up)
        int width,                          // Numero di colonne
        int height,                         // Numero di righe
        float nodata                        // Valore sentinella "nessuna misura" (NaN se assente)
) {

    public RasterGrid {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Dimensioni griglia non valide: " + width + "x" + height);
        }
        if (sx == 0 || sy == 0 || !Double.isFinite(sx) || !Double.isFinite(sy)) {
            throw new IllegalArgumentException("Dimensione pixel non valida: " + sx + ", " + sy);
        }
    }

    /**
     * Converte una X del modello in colonna frazionaria (0.5 = centro della colonna 0).
     */
    public double modelToGridX(double x) {
        return (x - x0) / sx;
    }

    /**
     * Converte una Y del modello in riga frazionaria (0.5 = centro della riga 0).
     */
    public double modelToGridY(double y) {
        return (y - y0) / sy;
    }

    /**
     * Estensione del raster in coordinate del modello.
     */
    public Envelope extent() {
        return new Envelope(x0, x0 + sx * width, y0, y0 + sy * height);
    }

    /**
     * Verifica se il valore di una cella è da scartare.
     * Le celle NaN sono sempre considerate nodata.
     */
    public boolean isNodata(float value) {
        return Float.isNaN(value) || value == nodata;
    }
}
