package it.floro.soilstats.raster;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Apre un raster su disco selezionando una banda.
 */
@FunctionalInterface
public interface RasterOpener {

    RasterReader open(Path path, int band) throws IOException;
}
