package it.floro.soilstats.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import it.floro.soilstats.domain.Statistics;

/**
 * DTO JSON delle statistiche di una feature.
 *
 * Le chiavi seguono il formato storico del servizio (lowerquart, upperquart).
 * I campi NaN vengono serializzati come null.
 */
@JsonPropertyOrder({"min", "max", "median", "sum", "mode", "stddev", "count", "mean", "lowerquart", "upperquart"})
public record StatisticsResponse(
        Float min,
        Float max,
        Float median,
        Float sum,
        Float mode,
        Float stddev,
        long count,
        Float mean,
        @JsonProperty("lowerquart") Float lowerQuart,
        @JsonProperty("upperquart") Float upperQuart
) {

    public static StatisticsResponse from(Statistics s) {
        return new StatisticsResponse(
                orNull(s.min()),
                orNull(s.max()),
                orNull(s.median()),
                orNull(s.sum()),
                orNull(s.mode()),
                orNull(s.stddev()),
                s.count(),
                orNull(s.mean()),
                orNull(s.lowerQuart()),
                orNull(s.upperQuart())
        );
    }

    private static Float orNull(float value) {
        return Float.isNaN(value) ? null : value;
    }
}
