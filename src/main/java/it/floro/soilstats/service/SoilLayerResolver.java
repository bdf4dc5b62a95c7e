package it.floro.soilstats.service;

import it.floro.soilstats.config.ZonalStatsProperties;
import it.floro.soilstats.domain.WeightedRaster;
import it.floro.soilstats.raster.RasterReaders;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Risolve un layer di suolo e un intervallo di profondità nei file raster corrispondenti.
 *
 * Struttura attesa della directory dati:
 * <pre>
 * &lt;data-dir&gt;/&lt;layer&gt;/&lt;da&gt;_&lt;a&gt;_compressed/*.tif
 * </pre>
 * Una sottodirectory viene selezionata se il suo intervallo [da, a] si
 * sovrappone a quello richiesto (estremi inclusi).
 */
@Service
public class SoilLayerResolver {

    private static final Logger logger = LoggerFactory.getLogger(SoilLayerResolver.class);

    private static final Pattern DEPTH_DIR = Pattern.compile("(\\d+)_(\\d+)_compressed");
    private static final Pattern DEPTH_QUERY = Pattern.compile("\\s*(\\d+)\\s*-\\s*(\\d+)\\s*");

    // ========================================================================
    // CONFIGURAZIONE
    // ========================================================================

    /** Directory dati assoluta, contiene una sottodirectory per layer. */
    private final Path dataDir;

    /**
     * Layer ammessi (soilstats.soil-layers).
     * Utilizzato per: rifiutare layer sconosciuti prima di accedere al filesystem.
     */
    private final List<String> supportedLayers;

    /**
     * Costruttore con dependency injection della configurazione.
     *
     * @param properties Configurazione soilstats.*: directory dati e layer ammessi
     */
    public SoilLayerResolver(ZonalStatsProperties properties) {
        this.dataDir = properties.dataDir().toAbsolutePath().normalize();
        this.supportedLayers = List.copyOf(properties.soilLayers());
    }

    /**
     * Intervallo di profondità in centimetri, estremi inclusi.
     */
    public record DepthRange(int from, int to) {

        public DepthRange {
            if (from > to) {
                throw new IllegalArgumentException("Intervallo di profondità invertito: " + from + "-" + to);
            }
        }

        /**
         * Interpreta una stringa "da-a", es. "0-60".
         */
        public static DepthRange parse(String value) {
            Matcher m = value == null ? null : DEPTH_QUERY.matcher(value);
            if (m == null || !m.matches()) {
                throw new IllegalArgumentException("Formato profondità non valido: " + value + " (atteso 'da-a')");
            }
            return new DepthRange(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
        }

        public boolean overlaps(DepthRange other) {
            return from <= other.to && to >= other.from;
        }
    }

    public List<String> supportedLayers() {
        return supportedLayers;
    }

    /**
     * Elenca i raster di un layer le cui profondità si sovrappongono alla richiesta.
     *
     * Ogni raster riceve come peso lo spessore (a − da) del suo strato;
     * gli strati di spessore nullo vengono ignorati.
     *
     * @param layer Nome del layer, deve essere tra quelli configurati
     * @param depth Intervallo richiesto
     * @return Raster pesati, ordinati per directory e nome file
     * @throws IllegalArgumentException se il layer non è supportato
     * @throws NoSuchFileException se la directory del layer non esiste
     */
    public List<WeightedRaster> resolve(String layer, DepthRange depth) throws IOException {
        if (layer == null || !supportedLayers.contains(layer)) {
            throw new IllegalArgumentException("Layer di suolo non supportato: " + layer);
        }
        Path layerDir = dataDir.resolve(layer);
        if (!Files.isDirectory(layerDir)) {
            throw new NoSuchFileException(layerDir.toString());
        }

        List<Path> depthDirs;
        try (Stream<Path> children = Files.list(layerDir)) {
            depthDirs = children
                    .filter(Files::isDirectory)
                    .filter(dir -> matchesDepth(dir, depth))
                    .sorted()
                    .collect(Collectors.toList());
        }

        List<WeightedRaster> rasters = new ArrayList<>();
        for (Path dir : depthDirs) {
            DepthRange layerDepth = depthOf(dir);
            int thickness = layerDepth.to() - layerDepth.from();
            if (thickness == 0) {
                logger.debug("Strato {} di spessore nullo ignorato", dir.getFileName());
                continue;
            }
            try (Stream<Path> files = Files.list(dir)) {
                files.filter(Files::isRegularFile)
                        .filter(RasterReaders::isSupported)
                        .sorted()
                        .forEach(file -> rasters.add(new WeightedRaster(file, thickness)));
            }
        }
        logger.debug("Layer {} profondità {}-{}: {} directory, {} raster",
                layer, depth.from(), depth.to(), depthDirs.size(), rasters.size());
        return rasters;
    }

    // ===================== Helpers =====================

    private static boolean matchesDepth(Path dir, DepthRange query) {
        DepthRange layerDepth = depthOf(dir);
        return layerDepth != null && layerDepth.overlaps(query);
    }

    /**
     * Intervallo di una directory "da_a_compressed", null se il nome non è valido.
     */
    private static DepthRange depthOf(Path dir) {
        Matcher m = DEPTH_DIR.matcher(dir.getFileName().toString());
        if (!m.matches()) {
            return null;
        }
        int from = Integer.parseInt(m.group(1));
        int to = Integer.parseInt(m.group(2));
        return from <= to ? new DepthRange(from, to) : null;
    }
}
