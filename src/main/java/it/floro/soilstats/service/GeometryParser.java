package it.floro.soilstats.service;

import com.fasterxml.jackson.databind.JsonNode;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.geojson.GeoJsonReader;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Conversione delle geometrie GeoJSON ricevute via HTTP in geometrie JTS.
 * Il controllo del tipo (solo poligoni) resta al motore di join.
 */
@Component
public class GeometryParser {

    /**
     * Converte un singolo oggetto GeoJSON.
     *
     * @param geoJson Geometria GeoJSON (Polygon, MultiPolygon, ...)
     * @return Geometria JTS, senza controllo del tipo
     * @throws IllegalArgumentException se il nodo manca o non è GeoJSON valido
     */
    public Geometry parse(JsonNode geoJson) {
        if (geoJson == null || geoJson.isNull()) {
            throw new IllegalArgumentException("Geometria GeoJSON mancante");
        }
        try {
            // GeoJsonReader non è thread-safe: un'istanza per chiamata
            return new GeoJsonReader().read(geoJson.toString());
        } catch (ParseException | RuntimeException e) {
            throw new IllegalArgumentException("GeoJSON non valido: " + e.getMessage(), e);
        }
    }

    /**
     * Converte una lista di geometrie mantenendone l'ordine: l'indice
     * nella lista diventa l'indice di feature del join.
     */
    public List<Geometry> parseAll(List<JsonNode> geoJsons) {
        if (geoJsons == null) {
            return List.of();
        }
        List<Geometry> geometries = new ArrayList<>(geoJsons.size());
        for (JsonNode node : geoJsons) {
            geometries.add(parse(node));
        }
        return geometries;
    }
}
