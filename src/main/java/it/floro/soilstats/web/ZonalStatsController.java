package it.floro.soilstats.web;

import com.fasterxml.jackson.databind.JsonNode;
import it.floro.soilstats.domain.WeightedRaster;
import it.floro.soilstats.engine.JoinResult;
import it.floro.soilstats.service.GeometryParser;
import it.floro.soilstats.service.SoilLayerResolver;
import it.floro.soilstats.service.SoilLayerResolver.DepthRange;
import it.floro.soilstats.service.ZonalStatisticsService;
import it.floro.soilstats.web.dto.SoilStatsResponse;
import it.floro.soilstats.web.dto.StatisticsResponse;
import it.floro.soilstats.web.dto.ZonalStatsRequest;
import it.floro.soilstats.web.dto.ZonalStatsResponse;
import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.util.List;

/**
 * Controller REST per le statistiche zonali raster-vettore.
 *
 * Responsabilità:
 * - Decodificare le richieste (GeoJSON, parametri di layer e profondità)
 * - Delegare il calcolo a ZonalStatisticsService
 * - Tradurre l'esito del join in stato HTTP e corpo JSON
 *
 * Mapping base: /api
 *
 * Esiti:
 * - COMPLETE → 200 con le statistiche (sentinella con count 0 per feature senza celle valide)
 * - NO_RESULTS → 200 con risultati vuoti: nessun raster interseca le geometrie
 * - INCOMPLETE → 503: il join ha superato il timeout configurato
 *
 * Gli errori (geometria non valida, raster mancante) sono gestiti da
 * ZonalStatsExceptionHandler.
 */
@RestController
@RequestMapping("/api")
public class ZonalStatsController {

    private static final Logger logger = LoggerFactory.getLogger(ZonalStatsController.class);

    // ========================================================================
    // DIPENDENZE INIETTATE
    // ========================================================================

    /**
     * Service che esegue il join con timeout e parallelismo configurati.
     * Delegato per: computeStatistics(), joinWeighted()
     */
    private final ZonalStatisticsService zonalStatisticsService;

    /**
     * Service che traduce layer e profondità nei raster pesati per spessore.
     * Utilizzato per: POST /api/soil/stats
     */
    private final SoilLayerResolver soilLayerResolver;

    /** Conversione GeoJSON → JTS. */
    private final GeometryParser geometryParser;

    // ========================================================================
    // COSTRUTTORE
    // ========================================================================

    /**
     * Costruttore con dependency injection dei service.
     *
     * @param zonalStatisticsService Service del join
     * @param soilLayerResolver Risoluzione dei layer di suolo
     * @param geometryParser Parser delle geometrie GeoJSON
     */
    public ZonalStatsController(ZonalStatisticsService zonalStatisticsService,
                                SoilLayerResolver soilLayerResolver,
                                GeometryParser geometryParser) {
        this.zonalStatisticsService = zonalStatisticsService;
        this.soilLayerResolver = soilLayerResolver;
        this.geometryParser = geometryParser;
    }

    // ========================================================================
    // ENDPOINT 1: POST - STATISTICHE SU RASTER ESPLICITI
    // ========================================================================

    /**
     * Statistiche per ogni geometria sui raster indicati.
     *
     * Metodo HTTP: POST
     * Mapping: /api/zonal-stats
     *
     * Esempio di richiesta:
     * <pre>
     * {"rasters": ["clay/0_5_compressed/tile.tif"], "geometries": [{"type": "Polygon", ...}], "band": 0}
     * </pre>
     */
    @PostMapping("/zonal-stats")
    public ResponseEntity<ZonalStatsResponse> zonalStats(@RequestBody ZonalStatsRequest request)
            throws IOException {
        List<Geometry> geometries = geometryParser.parseAll(request.geometries());
        logger.debug("Richiesta zonal-stats: {} raster, {} geometrie",
                request.rasters() == null ? 0 : request.rasters().size(), geometries.size());

        JoinResult result = zonalStatisticsService.computeStatistics(
                request.rasters(), geometries, request.band());

        return ResponseEntity.status(httpStatus(result)).body(ZonalStatsResponse.from(result));
    }

    // ========================================================================
    // ENDPOINT 2: POST - STATISTICHE DI UN LAYER DI SUOLO
    // ========================================================================

    /**
     * Statistiche di un poligono su un layer di suolo e un intervallo di profondità.
     *
     * Algoritmo:
     * 1. Interpreta l'intervallo "da-a" e il poligono GeoJSON
     * 2. Seleziona i raster degli strati che si sovrappongono all'intervallo,
     *    ciascuno pesato per lo spessore del suo strato
     * 3. Esegue il join pesato: valori x · spessore / somma degli spessori
     *    dei raster che hanno fornito celle valide
     *
     * @param layer Layer di suolo (es. "clay")
     * @param depth Intervallo di profondità in cm (es. "0-60")
     * @param polygon Poligono GeoJSON nel sistema di riferimento dei raster
     */
    @PostMapping("/soil/stats")
    public ResponseEntity<SoilStatsResponse> soilStats(@RequestParam String layer,
                                                       @RequestParam String depth,
                                                       @RequestBody JsonNode polygon) throws IOException {
        DepthRange depthRange = DepthRange.parse(depth);
        Geometry geometry = geometryParser.parse(polygon);
        List<WeightedRaster> rasters = soilLayerResolver.resolve(layer, depthRange);

        JoinResult result = zonalStatisticsService.joinWeighted(
                rasters, List.of(geometry), zonalStatisticsService.defaultBand());

        StatisticsResponse stats = result.isComplete() ? StatisticsResponse.from(result.get(0)) : null;
        SoilStatsResponse body = new SoilStatsResponse(
                result.status().name(),
                new SoilStatsResponse.Query(depth, layer),
                stats);
        return ResponseEntity.status(httpStatus(result)).body(body);
    }

    // ===================== Helpers =====================

    private static HttpStatus httpStatus(JoinResult result) {
        return result.status() == JoinResult.Status.INCOMPLETE
                ? HttpStatus.SERVICE_UNAVAILABLE
                : HttpStatus.OK;
    }
}
