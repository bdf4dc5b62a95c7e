package it.floro.soilstats.web.dto;

import it.floro.soilstats.engine.JoinResult;

import java.util.List;

/**
 * Risposta di POST /api/zonal-stats: esito del join e statistiche per indice di feature.
 */
public record ZonalStatsResponse(
        String status,                          // COMPLETE, NO_RESULTS, INCOMPLETE
        List<FeatureStatistics> results         // Una voce per geometria, vuota se non COMPLETE
) {

    public record FeatureStatistics(int index, StatisticsResponse stats) {}

    public static ZonalStatsResponse from(JoinResult result) {
        List<FeatureStatistics> results = result.statistics().entrySet().stream()
                .map(e -> new FeatureStatistics(e.getKey(), StatisticsResponse.from(e.getValue())))
                .toList();
        return new ZonalStatsResponse(result.status().name(), results);
    }
}
