package it.floro.soilstats.service;

import it.floro.soilstats.config.ZonalStatsProperties;
import it.floro.soilstats.domain.WeightedRaster;
import it.floro.soilstats.engine.CancellationCheck;
import it.floro.soilstats.engine.JoinDriver;
import it.floro.soilstats.engine.JoinResult;
import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Service che espone il join raster-vettore al livello web.
 *
 * Responsabilità:
 * - Risolvere i percorsi dei raster rispetto alla directory dati configurata
 *   (nessun percorso può uscirne)
 * - Trasformare il timeout configurato in un controllo di cancellazione a scadenza
 * - Scegliere join sequenziale o parallelo in base a soilstats.parallelism
 * - Gestire il ciclo di vita del pool di thread del join parallelo
 *
 * Casi d'uso:
 * - POST /api/zonal-stats → {@link #computeStatistics}
 * - POST /api/soil/stats → {@link #joinWeighted} con i raster pesati per spessore
 *
 * Non mantiene stato tra le richieste: ogni chiamata riceve tutti gli input
 * e restituisce un esito nuovo.
 */
@Service
public class ZonalStatisticsService implements DisposableBean {

    private static final Logger logger = LoggerFactory.getLogger(ZonalStatisticsService.class);

    // ========================================================================
    // DIPENDENZE E STATO
    // ========================================================================

    /**
     * Motore di join, stateless e condiviso tra le richieste.
     * Delegato per: join sequenziale, parallelo e pesato.
     */
    private final JoinDriver joinDriver;

    /**
     * Configurazione soilstats.*.
     * Utilizzata per: banda di default, timeout, parallelismo.
     */
    private final ZonalStatsProperties properties;

    /** Orologio da cui si calcola la scadenza di ogni richiesta. */
    private final Clock clock;

    /** Directory dati assoluta e normalizzata: radice di tutti i percorsi ammessi. */
    private final Path dataDir;

    /** Pool per il join parallelo; null se parallelism ≤ 1. */
    private final ExecutorService executor;

    // ========================================================================
    // COSTRUTTORE
    // ========================================================================

    /**
     * Costruttore con dependency injection.
     *
     * Se soilstats.parallelism è maggiore di 1 crea un pool fisso di thread
     * daemon "zonal-join-N", chiuso in {@link #destroy()}.
     *
     * @param joinDriver Motore di join (bean di EngineConfig)
     * @param properties Configurazione soilstats.*
     * @param clock Orologio per le scadenze (bean di EngineConfig)
     */
    public ZonalStatisticsService(JoinDriver joinDriver, ZonalStatsProperties properties, Clock clock) {
        this.joinDriver = joinDriver;
        this.properties = properties;
        this.clock = clock;
        this.dataDir = properties.dataDir().toAbsolutePath().normalize();
        this.executor = properties.parallelism() > 1
                ? Executors.newFixedThreadPool(properties.parallelism(), joinThreadFactory())
                : null;
    }

    // ========================================================================
    // JOIN
    // ========================================================================

    /**
     * Statistiche zonali su raster indicati per percorso relativo alla directory dati.
     *
     * @param rasters Percorsi dei raster (relativi a soilstats.data-dir)
     * @param geometries Geometrie nel sistema di riferimento dei raster
     * @param band Banda da leggere, null per la banda di default
     * @return Esito del join
     * @throws IOException se un raster manca o non è leggibile
     * @throws IllegalArgumentException se un percorso esce dalla directory dati
     */
    public JoinResult computeStatistics(List<String> rasters, List<Geometry> geometries, Integer band)
            throws IOException {
        return join(resolveRasterPaths(rasters), geometries, band != null ? band : properties.defaultBand());
    }

    /**
     * Join su percorsi già risolti, con il timeout configurato.
     */
    public JoinResult join(List<Path> rasterPaths, List<Geometry> geometries, int band) throws IOException {
        CancellationCheck check = CancellationCheck.deadline(properties.timeout(), clock);
        long start = System.nanoTime();

        JoinResult result = executor != null
                ? joinDriver.join(rasterPaths, geometries, band, check, executor)
                : joinDriver.join(rasterPaths, geometries, band, check);

        logElapsed("Statistiche zonali", rasterPaths.size(), geometries.size(), result, start);
        return result;
    }

    /**
     * Join pesato su raster già risolti, con il timeout configurato.
     * Usa il pool parallelo se configurato, altrimenti elabora un raster alla volta.
     */
    public JoinResult joinWeighted(List<WeightedRaster> rasters, List<Geometry> geometries, int band)
            throws IOException {
        CancellationCheck check = CancellationCheck.deadline(properties.timeout(), clock);
        long start = System.nanoTime();

        JoinResult result = joinDriver.joinWeighted(rasters, geometries, band, check, executor);

        logElapsed("Statistiche pesate", rasters.size(), geometries.size(), result, start);
        return result;
    }

    /**
     * Risolve i percorsi rispetto alla directory dati e rifiuta quelli che ne escono.
     */
    public List<Path> resolveRasterPaths(List<String> rasters) {
        if (rasters == null) {
            return List.of();
        }
        List<Path> paths = new ArrayList<>(rasters.size());
        for (String raw : rasters) {
            if (raw == null || raw.isBlank()) {
                throw new IllegalArgumentException("Percorso raster vuoto");
            }
            Path resolved = dataDir.resolve(raw).normalize();
            if (!resolved.startsWith(dataDir)) {
                throw new IllegalArgumentException("Percorso raster fuori dalla directory dati: " + raw);
            }
            paths.add(resolved);
        }
        return paths;
    }

    public int defaultBand() {
        return properties.defaultBand();
    }

    /**
     * Chiude il pool del join parallelo allo shutdown del contesto Spring.
     */
    @Override
    public void destroy() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    // ===================== Helpers =====================

    private static void logElapsed(String what, int rasters, int geometries, JoinResult result, long start) {
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        logger.info("{}: {} raster, {} geometrie, esito {} in {} ms",
                what, rasters, geometries, result.status(), elapsedMs);
    }

    private static ThreadFactory joinThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "zonal-join-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
