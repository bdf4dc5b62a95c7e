package it.floro.soilstats.engine;

import it.floro.soilstats.domain.PixelRange;
import it.floro.soilstats.domain.Statistics;
import it.floro.soilstats.domain.ValueSample;
import it.floro.soilstats.domain.WeightedRaster;
import it.floro.soilstats.raster.RasterOpener;
import it.floro.soilstats.raster.RasterReader;
import it.floro.soilstats.raster.RasterReaders;
import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Join raster-vettore: per ogni geometria calcola le statistiche delle celle
 * di tutti i raster che la intersecano.
 *
 * Flusso sequenziale:
 * 1. Validazione di tutte le geometrie (fail-fast, prima di aprire file)
 * 2. Per ogni raster, in ordine: apertura, indicizzazione di tutte le geometrie,
 *    scarto se non produce intervalli
 * 3. Gli stream dei raster tenuti vengono concatenati in modo lazy e passati
 *    all'aggregatore: un solo handle aperto alla volta
 * 4. Esito: COMPLETE, NO_RESULTS (nessun raster interseca) o INCOMPLETE (cancellato)
 *
 * Gli errori di I/O interrompono l'intero join senza retry.
 * La classe non ha stato mutabile: chiamate concorrenti sono sicure.
 */
public class JoinDriver {

    private static final Logger logger = LoggerFactory.getLogger(JoinDriver.class);

    // ========================================================================
    // COLLABORATORI
    // ========================================================================

    /** Rasterizzazione delle geometrie sulla griglia di ogni raster. */
    private final GridIndexer indexer;

    /** Raggruppamento per feature e calcolo delle statistiche. */
    private final StatisticsAggregator aggregator;

    /**
     * Apertura dei raster per percorso e banda.
     * Sostituibile nei test con raster in memoria.
     */
    private final RasterOpener opener;

    /**
     * Costruttore di default: raster aperti per estensione con {@link RasterReaders},
     * soglia del percorso esatto di default.
     */
    public JoinDriver() {
        this(new GridIndexer(), new StatisticsAggregator(), RasterReaders::open);
    }

    /**
     * @param indexer Rasterizzatore delle geometrie
     * @param aggregator Aggregatore con la soglia configurata
     * @param opener Apertura dei raster
     */
    public JoinDriver(GridIndexer indexer, StatisticsAggregator aggregator, RasterOpener opener) {
        this.indexer = indexer;
        this.aggregator = aggregator;
        this.opener = opener;
    }

    // ========================================================================
    // JOIN SEQUENZIALE
    // ========================================================================

    /**
     * Esegue il join in modo sequenziale.
     *
     * @param rasterPaths Raster da interrogare
     * @param geometries Geometrie, già nel sistema di riferimento dei raster
     * @param band Banda da leggere in ogni raster
     * @param cancelCheck Predicato di cancellazione (null = mai)
     * @return Esito del join
     * @throws IOException se un raster non può essere aperto o letto
     * @throws GeometryException se una geometria non è supportata
     */
    public JoinResult join(List<Path> rasterPaths, List<? extends Geometry> geometries,
                           int band, CancellationCheck cancelCheck) throws IOException {
        CancellationCheck check = cancelCheck != null ? cancelCheck : CancellationCheck.NEVER;
        validateAll(geometries);
        if (rasterPaths.isEmpty() || geometries.isEmpty()) {
            return JoinResult.noResults();
        }

        RasterStreams streams = new RasterStreams(rasterPaths, geometries, band, check);
        Map<Integer, Statistics> statistics;
        try (Sequences.Flattened<ValueSample> samples = Sequences.flatten(streams)) {
            statistics = aggregator.aggregate(samples);
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }

        if (streams.isCancelled()) {
            logger.info("Join interrotto dopo {} raster su {}", streams.visited, rasterPaths.size());
            return JoinResult.incomplete();
        }
        if (streams.kept == 0) {
            logger.info("Nessuno dei {} raster interseca le {} geometrie", rasterPaths.size(), geometries.size());
            return JoinResult.noResults();
        }
        logger.info("Join completato: {} raster su {} intersecano, {} feature su {} con campioni",
                streams.kept, rasterPaths.size(), statistics.size(), geometries.size());
        return JoinResult.complete(withSentinels(statistics, geometries.size()));
    }

    // ========================================================================
    // JOIN PARALLELO
    // ========================================================================

    /**
     * Esegue il join distribuendo i raster sull'executor.
     *
     * Ogni task indicizza e legge un raster accumulando parziali per feature;
     * i parziali vengono combinati nell'ordine dei raster. Il risultato coincide
     * con quello sequenziale. Il primo errore annulla i task rimanenti.
     */
    public JoinResult join(List<Path> rasterPaths, List<? extends Geometry> geometries,
                           int band, CancellationCheck cancelCheck,
                           ExecutorService executor) throws IOException {
        CancellationCheck check = cancelCheck != null ? cancelCheck : CancellationCheck.NEVER;
        validateAll(geometries);
        if (rasterPaths.isEmpty() || geometries.isEmpty()) {
            return JoinResult.noResults();
        }

        List<RasterPartial> partials;
        try {
            partials = collectPartials(rasterPaths, geometries, band, check, executor);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return JoinResult.incomplete();
        }

        Map<Integer, StatisticsAccumulator> merged = new TreeMap<>();
        int kept = 0;
        boolean cancelled = false;
        for (RasterPartial partial : partials) {
            cancelled |= partial.cancelled();
            if (partial.accumulators() != null) {
                kept++;
                StatisticsAggregator.mergeInto(merged, partial.accumulators());
            }
        }

        if (cancelled) {
            logger.info("Join parallelo interrotto su {} raster", rasterPaths.size());
            return JoinResult.incomplete();
        }
        if (kept == 0) {
            logger.info("Nessuno dei {} raster interseca le {} geometrie", rasterPaths.size(), geometries.size());
            return JoinResult.noResults();
        }
        Map<Integer, Statistics> statistics = StatisticsAggregator.finish(merged);
        logger.info("Join parallelo completato: {} raster su {} intersecano, {} feature su {} con campioni",
                kept, rasterPaths.size(), statistics.size(), geometries.size());
        return JoinResult.complete(withSentinels(statistics, geometries.size()));
    }

    // ========================================================================
    // JOIN PESATO
    // ========================================================================

    /**
     * Join pesato sequenziale, vedi {@link #joinWeighted(List, List, int, CancellationCheck, ExecutorService)}.
     */
    public JoinResult joinWeighted(List<WeightedRaster> rasters, List<? extends Geometry> geometries,
                                   int band, CancellationCheck cancelCheck) throws IOException {
        return joinWeighted(rasters, geometries, band, cancelCheck, null);
    }

    /**
     * Join in cui i valori di ogni raster vengono pesati.
     *
     * Algoritmo (per ogni feature f):
     * 1. Ogni valore x di un raster con peso w contribuisce come x · w
     * 2. W(f) è la somma dei pesi dei soli raster che hanno fornito almeno
     *    una cella valida a f
     * 3. Le statistiche sono calcolate sui valori x · w / W(f)
     *
     * Se a una feature contribuisce un solo raster i suoi valori restano invariati.
     *
     * Casi d'uso:
     * - Layer di suolo su più strati di profondità, pesati per spessore
     *
     * @param executor Executor per l'elaborazione parallela, null per quella sequenziale
     */
    public JoinResult joinWeighted(List<WeightedRaster> rasters, List<? extends Geometry> geometries,
                                   int band, CancellationCheck cancelCheck,
                                   ExecutorService executor) throws IOException {
        CancellationCheck check = cancelCheck != null ? cancelCheck : CancellationCheck.NEVER;
        validateAll(geometries);
        if (rasters.isEmpty() || geometries.isEmpty()) {
            return JoinResult.noResults();
        }

        List<Path> paths = rasters.stream().map(WeightedRaster::path).toList();
        List<RasterPartial> partials;
        try {
            partials = collectPartials(paths, geometries, band, check, executor);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return JoinResult.incomplete();
        }

        Map<Integer, StatisticsAccumulator> merged = new TreeMap<>();
        Map<Integer, Double> totalWeights = new TreeMap<>();
        int kept = 0;
        boolean cancelled = false;
        for (int i = 0; i < partials.size(); i++) {
            RasterPartial partial = partials.get(i);
            double weight = rasters.get(i).weight();
            cancelled |= partial.cancelled();
            if (partial.accumulators() != null) {
                kept++;
                partial.accumulators().forEach((feature, acc) -> {
                    acc.scale(weight);
                    totalWeights.merge(feature, weight, Double::sum);
                });
                StatisticsAggregator.mergeInto(merged, partial.accumulators());
            }
        }

        if (cancelled) {
            logger.info("Join pesato interrotto su {} raster", rasters.size());
            return JoinResult.incomplete();
        }
        if (kept == 0) {
            logger.info("Nessuno dei {} raster interseca le {} geometrie", rasters.size(), geometries.size());
            return JoinResult.noResults();
        }
        merged.forEach((feature, acc) -> acc.scale(1.0 / totalWeights.get(feature)));
        Map<Integer, Statistics> statistics = StatisticsAggregator.finish(merged);
        logger.info("Join pesato completato: {} raster su {} intersecano, pesi totali {}",
                kept, rasters.size(), totalWeights);
        return JoinResult.complete(withSentinels(statistics, geometries.size()));
    }

    // ===================== Helpers =====================

    private static void validateAll(List<? extends Geometry> geometries) {
        for (int i = 0; i < geometries.size(); i++) {
            GridIndexer.validate(i, geometries.get(i));
        }
    }

    private static Map<Integer, Statistics> withSentinels(Map<Integer, Statistics> statistics, int features) {
        Map<Integer, Statistics> complete = new TreeMap<>(statistics);
        for (int i = 0; i < features; i++) {
            complete.putIfAbsent(i, Statistics.EMPTY);
        }
        return complete;
    }

    /**
     * Apre e indicizza un raster. Restituisce lo stream dei valori con l'handle
     * ancora aperto, oppure null (handle già chiuso) se non ci sono intersezioni.
     */
    private CellValueStream openIndexed(Path path, List<? extends Geometry> geometries,
                                        int band, CancellationCheck check) throws IOException {
        RasterReader reader = opener.open(path, band);
        List<PixelRange> ranges;
        try {
            ranges = indexer.index(geometries, reader.grid());
        } catch (RuntimeException e) {
            try {
                reader.close();
            } catch (IOException suppressed) {
                e.addSuppressed(suppressed);
            }
            throw e;
        }
        if (ranges.isEmpty()) {
            logger.debug("Raster {} scartato: nessuna intersezione", path);
            reader.close();
            return null;
        }
        logger.debug("Raster {}: {} intervalli di pixel", path, ranges.size());
        return new CellValueStream(reader, ranges, check);
    }

    /**
     * Elabora ogni raster in un accumulatore parziale, nell'ordine dei raster.
     * Senza executor i raster sono elaborati uno alla volta e ci si ferma al
     * primo cancellato; con executor il primo errore annulla i task rimanenti.
     */
    private List<RasterPartial> collectPartials(List<Path> rasterPaths, List<? extends Geometry> geometries,
                                                int band, CancellationCheck check,
                                                ExecutorService executor) throws IOException, InterruptedException {
        List<RasterPartial> partials = new ArrayList<>(rasterPaths.size());
        if (executor == null) {
            for (Path path : rasterPaths) {
                RasterPartial partial = processRaster(path, geometries, band, check);
                partials.add(partial);
                if (partial.cancelled()) break;
            }
            return partials;
        }

        List<Future<RasterPartial>> futures = new ArrayList<>(rasterPaths.size());
        for (Path path : rasterPaths) {
            futures.add(executor.submit(() -> processRaster(path, geometries, band, check)));
        }
        try {
            for (Future<RasterPartial> future : futures) {
                partials.add(future.get());
            }
        } catch (InterruptedException e) {
            cancelAll(futures);
            throw e;
        } catch (ExecutionException e) {
            cancelAll(futures);
            throw rethrow(e.getCause());
        }
        return partials;
    }

    private RasterPartial processRaster(Path path, List<? extends Geometry> geometries,
                                        int band, CancellationCheck check) throws IOException {
        if (check.shouldStop()) {
            return new RasterPartial(null, true);
        }
        CellValueStream stream = openIndexed(path, geometries, band, check);
        if (stream == null) {
            return new RasterPartial(null, false);
        }
        try (stream) {
            Map<Integer, StatisticsAccumulator> accumulators = aggregator.accumulate(stream);
            return new RasterPartial(accumulators, stream.isCancelled());
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    private static void cancelAll(List<? extends Future<?>> futures) {
        for (Future<?> future : futures) {
            future.cancel(true);
        }
    }

    private static IOException rethrow(Throwable cause) {
        if (cause instanceof IOException io) {
            return io;
        }
        if (cause instanceof UncheckedIOException unchecked) {
            return unchecked.getCause();
        }
        if (cause instanceof RuntimeException runtime) {
            throw runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new IOException("Errore nell'elaborazione del raster", cause);
    }

    /**
     * Risultato parziale di un raster nel join parallelo.
     * accumulators è null se il raster non interseca nessuna geometria.
     */
    private record RasterPartial(Map<Integer, StatisticsAccumulator> accumulators, boolean cancelled) {}

    /**
     * Sequenza lazy degli stream dei raster che intersecano almeno una geometria.
     * La cancellazione è controllata prima di aprire ogni raster.
     */
    private final class RasterStreams implements Iterator<CellValueStream> {

        private final Iterator<Path> paths;
        private final List<? extends Geometry> geometries;
        private final int band;
        private final CancellationCheck check;

        private CellValueStream pending;
        private CellValueStream last;
        private boolean cancelled;
        int visited;
        int kept;

        RasterStreams(List<Path> rasterPaths, List<? extends Geometry> geometries,
                      int band, CancellationCheck check) {
            this.paths = rasterPaths.iterator();
            this.geometries = geometries;
            this.band = band;
            this.check = check;
        }

        @Override
        public boolean hasNext() {
            if (pending != null) return true;
            if (last != null && last.isCancelled()) {
                cancelled = true;
            }
            while (!cancelled && paths.hasNext()) {
                if (check.shouldStop()) {
                    cancelled = true;
                    break;
                }
                Path path = paths.next();
                visited++;
                try {
                    pending = openIndexed(path, geometries, band, check);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
                if (pending != null) {
                    kept++;
                    last = pending;
                    return true;
                }
            }
            return false;
        }

        @Override
        public CellValueStream next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            CellValueStream stream = pending;
            pending = null;
            return stream;
        }

        boolean isCancelled() {
            return cancelled || (last != null && last.isCancelled());
        }
    }
}
