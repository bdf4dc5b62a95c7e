package it.floro.soilstats.config;

import it.floro.soilstats.engine.GeometryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.Map;

/**
 * Global exception handler per le API di statistiche zonali.
 *
 * Ogni errore interrompe l'intero join (nessun risultato parziale) e viene
 * restituito come {"error": "..."}:
 * - geometria non supportata, input non valido → 400
 * - raster mancante → 404
 * - altri errori di I/O sui raster → 500
 */
@RestControllerAdvice
@Order(-1)
public class ZonalStatsExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(ZonalStatsExceptionHandler.class);

    @ExceptionHandler(GeometryException.class)
    public ResponseEntity<Map<String, String>> handleGeometry(GeometryException ex) {
        logger.warn("Geometria rifiutata: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler({IllegalArgumentException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<Map<String, String>> handleBadInput(Exception ex) {
        logger.warn("Richiesta non valida: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleUnreadable(HttpMessageNotReadableException ex) {
        logger.debug("Corpo della richiesta non leggibile: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Corpo JSON non valido");
    }

    @ExceptionHandler(NoSuchFileException.class)
    public ResponseEntity<Map<String, String>> handleMissingRaster(NoSuchFileException ex) {
        logger.warn("Raster non trovato: {}", ex.getFile());
        return error(HttpStatus.NOT_FOUND, "Raster non trovato: " + ex.getFile());
    }

    @ExceptionHandler(IOException.class)
    public ResponseEntity<Map<String, String>> handleIOException(IOException ex) {
        logger.error("Errore di lettura raster: {}", ex.getMessage(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Errore di lettura raster: " + ex.getMessage());
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message != null ? message : status.getReasonPhrase()));
    }
}
