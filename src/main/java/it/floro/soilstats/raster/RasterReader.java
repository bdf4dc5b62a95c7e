package it.floro.soilstats.raster;

import it.floro.soilstats.domain.RasterGrid;

import java.io.Closeable;
import java.io.IOException;

/**
 * Handle aperto su un raster, limitato a una singola banda.
 *
 * Le implementazioni non sono thread-safe: ogni join apre i propri handle.
 */
public interface RasterReader extends Closeable {

    /**
     * Griglia del raster (trasformazione, dimensioni, nodata).
     */
    RasterGrid grid();

    /**
     * Legge un'intera riga della banda selezionata.
     *
     * @param row Riga da leggere, in [0, height)
     * @param buffer Destinazione, lunghezza almeno pari a width
     * @throws IOException se la lettura fallisce
     */
    void readRow(int row, float[] buffer) throws IOException;
}
