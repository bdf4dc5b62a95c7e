package it.floro.soilstats.raster;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * Apertura dei raster in base all'estensione del file.
 *
 * Formati supportati:
 * - .tif / .tiff → GeoTiffRasterReader
 * - .asc         → AsciiGridReader (una sola banda)
 */
public final class RasterReaders {

    /** Estensioni riconosciute, in minuscolo e senza punto. */
    public static final Set<String> SUPPORTED_EXTENSIONS = Set.of("tif", "tiff", "asc");

    private RasterReaders() {}

    /**
     * Implementazione di default di {@link RasterOpener}.
     */
    public static RasterReader open(Path path, int band) throws IOException {
        if (!Files.exists(path)) {
            throw new NoSuchFileException(path.toString());
        }
        String ext = extension(path);
        return switch (ext) {
            case "tif", "tiff" -> new GeoTiffRasterReader(path, band);
            case "asc" -> {
                if (band != 0) {
                    throw new IOException("Il formato ASCII grid ha una sola banda, richiesta banda " + band);
                }
                yield new AsciiGridReader(path);
            }
            default -> throw new IOException("Formato raster non supportato: " + path);
        };
    }

    public static boolean isSupported(Path path) {
        return SUPPORTED_EXTENSIONS.contains(extension(path));
    }

    static String extension(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
