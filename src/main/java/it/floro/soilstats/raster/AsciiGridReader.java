package it.floro.soilstats.raster;

import it.floro.soilstats.domain.RasterGrid;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reader per raster in formato ESRI ASCII Grid (.asc).
 *
 * Formato:
 * - Intestazione "chiave valore": ncols, nrows, xllcorner|xllcenter,
 *   yllcorner|yllcenter, cellsize (oppure dx/dy), NODATA_value opzionale
 * - Valori separati da spazi, riga per riga a partire dal bordo nord
 *
 * Le righe vengono lette in avanti senza caricare il file in memoria.
 * Una richiesta di riga precedente alla posizione corrente riapre il file.
 */
public class AsciiGridReader implements RasterReader {

    /** Chiavi ammesse nell'intestazione, in minuscolo. */
    private static final Set<String> HEADER_KEYS = Set.of(
            "ncols", "nrows", "xllcorner", "xllcenter", "yllcorner", "yllcenter",
            "cellsize", "dx", "dy", "nodata_value");

    private final Path path;
    private final RasterGrid grid;

    private BufferedReader reader;
    private final Deque<String> pendingTokens = new ArrayDeque<>();

    /** Prossima riga dati non ancora consumata dal reader. */
    private int nextRow;

    public AsciiGridReader(Path path) throws IOException {
        this.path = path;
        this.reader = Files.newBufferedReader(path, StandardCharsets.US_ASCII);
        try {
            this.grid = parseHeader();
        } catch (IOException | RuntimeException e) {
            reader.close();
            throw e;
        }
    }

    @Override
    public RasterGrid grid() {
        return grid;
    }

    @Override
    public void readRow(int row, float[] buffer) throws IOException {
        if (row < 0 || row >= grid.height()) {
            throw new IOException("Riga " + row + " fuori dal raster " + path);
        }
        if (reader == null) {
            throw new IOException("Reader già chiuso: " + path);
        }
        if (row < nextRow) {
            rewind();
        }
        while (nextRow < row) {
            for (int col = 0; col < grid.width(); col++) {
                nextToken();
            }
            nextRow++;
        }
        for (int col = 0; col < grid.width(); col++) {
            buffer[col] = parseValue(nextToken());
        }
        nextRow++;
    }

    @Override
    public void close() throws IOException {
        if (reader != null) {
            BufferedReader r = reader;
            reader = null;
            pendingTokens.clear();
            r.close();
        }
    }

    // ===================== Helpers =====================

    private RasterGrid parseHeader() throws IOException {
        Map<String, String> header = new HashMap<>();
        String line;
        while ((line = reader.readLine()) != null) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) continue;
            String[] parts = trimmed.split("\\s+");
            String key = parts[0].toLowerCase(Locale.ROOT);
            if (!HEADER_KEYS.contains(key)) {
                // Prima riga di dati (anche se inizia con "nan" o "inf"): i token restano in coda
                for (String p : parts) pendingTokens.addLast(p);
                break;
            }
            if (parts.length < 2) {
                throw new IOException("Intestazione non valida in " + path + ": " + trimmed);
            }
            header.put(key, parts[1]);
        }

        int ncols = (int) headerValue(header, "ncols");
        int nrows = (int) headerValue(header, "nrows");

        double dx;
        double dy;
        if (header.containsKey("cellsize")) {
            dx = dy = headerValue(header, "cellsize");
        } else {
            dx = headerValue(header, "dx");
            dy = headerValue(header, "dy");
        }

        double xll;
        double yll;
        if (header.containsKey("xllcenter")) {
            xll = headerValue(header, "xllcenter") - dx / 2;
        } else {
            xll = headerValue(header, "xllcorner");
        }
        if (header.containsKey("yllcenter")) {
            yll = headerValue(header, "yllcenter") - dy / 2;
        } else {
            yll = headerValue(header, "yllcorner");
        }

        float nodata = header.containsKey("nodata_value")
                ? (float) headerValue(header, "nodata_value")
                : Float.NaN;

        try {
            return new RasterGrid(xll, yll + dy * nrows, dx, -dy, ncols, nrows, nodata);
        } catch (IllegalArgumentException e) {
            throw new IOException("Griglia non valida in " + path + ": " + e.getMessage(), e);
        }
    }

    private double headerValue(Map<String, String> header, String key) throws IOException {
        String raw = header.get(key);
        if (raw == null) {
            throw new IOException("Chiave '" + key + "' mancante nell'intestazione di " + path);
        }
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            throw new IOException("Valore non numerico per '" + key + "' in " + path + ": " + raw, e);
        }
    }

    private String nextToken() throws IOException {
        while (pendingTokens.isEmpty()) {
            String line = reader.readLine();
            if (line == null) {
                throw new IOException("Fine file inattesa in " + path + " alla riga " + nextRow);
            }
            String trimmed = line.trim();
            if (trimmed.isEmpty()) continue;
            for (String p : trimmed.split("\\s+")) pendingTokens.addLast(p);
        }
        return pendingTokens.pollFirst();
    }

    private float parseValue(String token) throws IOException {
        try {
            return Float.parseFloat(token);
        } catch (NumberFormatException e) {
            // Grafie di GDAL/numpy non accettate da Float.parseFloat
            switch (token.toLowerCase(Locale.ROOT)) {
                case "nan", "-nan", "+nan":
                    return Float.NaN;
                case "inf", "+inf", "infinity", "+infinity":
                    return Float.POSITIVE_INFINITY;
                case "-inf", "-infinity":
                    return Float.NEGATIVE_INFINITY;
                default:
                    throw new IOException("Valore di cella non numerico in " + path + ": " + token, e);
            }
        }
    }

    private void rewind() throws IOException {
        close();
        reader = Files.newBufferedReader(path, StandardCharsets.US_ASCII);
        parseHeader();
        nextRow = 0;
    }
}
