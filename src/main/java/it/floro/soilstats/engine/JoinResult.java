package it.floro.soilstats.engine;

import it.floro.soilstats.domain.Statistics;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Esito di un join raster-vettore.
 *
 * - COMPLETE: statistiche per ogni indice di feature (sentinella se nessuna cella valida)
 * - NO_RESULTS: nessun raster interseca alcuna geometria
 * - INCOMPLETE: join interrotto dalla cancellazione, i parziali sono scartati
 */
public record JoinResult(
        Status status,                                  // Esito del join
        Map<Integer, Statistics> statistics             // Feature → statistiche, vuota se non COMPLETE
) {

    public enum Status { COMPLETE, NO_RESULTS, INCOMPLETE }

    private static final JoinResult NO_RESULTS = new JoinResult(Status.NO_RESULTS, Map.of());
    private static final JoinResult INCOMPLETE = new JoinResult(Status.INCOMPLETE, Map.of());

    public JoinResult {
        statistics = Collections.unmodifiableMap(new TreeMap<>(statistics));
    }

    public static JoinResult complete(Map<Integer, Statistics> statistics) {
        return new JoinResult(Status.COMPLETE, statistics);
    }

    public static JoinResult noResults() {
        return NO_RESULTS;
    }

    public static JoinResult incomplete() {
        return INCOMPLETE;
    }

    public boolean isComplete() {
        return status == Status.COMPLETE;
    }

    /**
     * Statistiche di una feature; la sentinella se la feature non ha campioni.
     */
    public Statistics get(int featureIndex) {
        return statistics.getOrDefault(featureIndex, Statistics.EMPTY);
    }
}
