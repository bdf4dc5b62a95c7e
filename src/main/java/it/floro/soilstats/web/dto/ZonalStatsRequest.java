package it.floro.soilstats.web.dto;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Corpo della richiesta POST /api/zonal-stats.
 */
public record ZonalStatsRequest(
        List<String> rasters,               // Percorsi relativi alla directory dati
        List<JsonNode> geometries,          // Geometrie GeoJSON (Polygon / MultiPolygon)
        Integer band                        // Banda da leggere, opzionale
) {}
