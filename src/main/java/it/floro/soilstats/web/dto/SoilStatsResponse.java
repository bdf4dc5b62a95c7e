package it.floro.soilstats.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Risposta di POST /api/soil/stats, nel formato storico {"query": ..., "results": ...}.
 */
public record SoilStatsResponse(
        String status,
        Query query,
        StatisticsResponse results          // null se l'esito non è COMPLETE
) {

    public record Query(
            @JsonProperty("depth_range") String depthRange,
            String layer
    ) {}
}
