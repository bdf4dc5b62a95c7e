package it.floro.soilstats.engine;

import it.floro.soilstats.domain.PixelRange;
import it.floro.soilstats.domain.RasterGrid;
import org.locationtech.jts.geom.CoordinateSequence;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryCollection;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.MultiPolygon;
import org.locationtech.jts.geom.Polygon;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.function.Consumer;

/**
 * Rasterizzazione scanline delle geometrie sulla griglia di un raster.
 *
 * Algoritmo:
 * 1. I vertici di ogni anello vengono convertiti in coordinate pixel frazionarie
 * 2. Per ogni lato e ogni riga r la cui linea centrale y = r + 0.5 cade in
 *    [min(y1,y2), max(y1,y2)) si registra l'ascissa dell'attraversamento
 * 3. Gli attraversamenti di una riga vengono ordinati e accoppiati da sinistra
 *    a destra (regola pari-dispari): anelli esterni, buchi e componenti di un
 *    multipoligono finiscono nella stessa lista, quindi i buchi invertono la parità
 * 4. Una coppia [xa, xb) copre le celle il cui centro cade nell'intervallo
 *
 * Una cella appartiene al poligono che contiene il suo centro.
 * Le geometrie con envelope esterno al raster non producono intervalli.
 *
 * La classe è stateless: ogni chiamata lavora solo sui propri argomenti.
 */
public class GridIndexer {

    /** Ordine di scansione del raster: riga, feature, colonna. */
    public static final Comparator<PixelRange> SCAN_ORDER = Comparator
            .comparingInt(PixelRange::row)
            .thenComparingInt(PixelRange::featureIndex)
            .thenComparingInt(PixelRange::colStart);

    /**
     * Indicizza un insieme di geometrie insieme: l'i-esima geometria riceve
     * l'indice di feature i. Il risultato è ordinato per riga, così una sola
     * scansione del raster serve tutte le feature.
     *
     * @param geometries Geometrie del chiamante
     * @param grid Griglia del raster
     * @return Intervalli ordinati secondo {@link #SCAN_ORDER}
     * @throws GeometryException se una geometria non è supportata
     */
    public List<PixelRange> index(List<? extends Geometry> geometries, RasterGrid grid) {
        List<PixelRange> ranges = new ArrayList<>();
        for (int i = 0; i < geometries.size(); i++) {
            ranges.addAll(index(i, geometries.get(i), grid));
        }
        ranges.sort(SCAN_ORDER);
        return ranges;
    }

    /**
     * Indicizza una singola geometria.
     *
     * @param featureIndex Indice con cui etichettare gli intervalli
     * @param geometry Poligono, multipoligono o collezione di poligoni
     * @param grid Griglia del raster
     * @return Intervalli della feature ordinati per riga e colonna (vuoto se fuori dal raster)
     */
    public List<PixelRange> index(int featureIndex, Geometry geometry, RasterGrid grid) {
        validate(featureIndex, geometry);
        if (geometry.isEmpty()) {
            return List.of();
        }

        Envelope envelope = geometry.getEnvelopeInternal();
        if (!envelope.intersects(grid.extent())) {
            return List.of();
        }

        double gy1 = grid.modelToGridY(envelope.getMinY());
        double gy2 = grid.modelToGridY(envelope.getMaxY());
        int rowFrom = firstCenterAtOrAfter(Math.min(gy1, gy2), grid.height());
        int rowTo = firstCenterAtOrAfter(Math.max(gy1, gy2), grid.height());
        if (rowFrom >= rowTo) {
            return List.of();
        }

        Crossings crossings = new Crossings(rowFrom, rowTo);
        forEachPolygon(geometry, polygon -> {
            appendRing(polygon.getExteriorRing(), grid, crossings);
            for (int h = 0; h < polygon.getNumInteriorRing(); h++) {
                appendRing(polygon.getInteriorRingN(h), grid, crossings);
            }
        });
        return crossings.toRanges(featureIndex, grid.width());
    }

    /**
     * Verifica che la geometria sia poligonale e ben formata.
     *
     * @throws GeometryException per geometrie nulle, non poligonali,
     *         con anelli degeneri o coordinate non finite
     */
    public static void validate(int featureIndex, Geometry geometry) {
        if (geometry == null) {
            throw new GeometryException(featureIndex, "geometria nulla");
        }
        if (!isPolygonal(geometry)) {
            throw new GeometryException(featureIndex,
                    "tipo di geometria non supportato: " + geometry.getGeometryType());
        }
        forEachPolygon(geometry, polygon -> {
            checkRing(featureIndex, polygon.getExteriorRing());
            for (int h = 0; h < polygon.getNumInteriorRing(); h++) {
                checkRing(featureIndex, polygon.getInteriorRingN(h));
            }
        });
    }

    // ===================== Helpers =====================

    private static boolean isPolygonal(Geometry geometry) {
        if (geometry instanceof Polygon || geometry instanceof MultiPolygon) {
            return true;
        }
        if (geometry instanceof GeometryCollection) {
            for (int i = 0; i < geometry.getNumGeometries(); i++) {
                if (!isPolygonal(geometry.getGeometryN(i))) return false;
            }
            return true;
        }
        return false;
    }

    private static void forEachPolygon(Geometry geometry, Consumer<Polygon> action) {
        if (geometry instanceof Polygon polygon) {
            if (!polygon.isEmpty()) action.accept(polygon);
        } else {
            for (int i = 0; i < geometry.getNumGeometries(); i++) {
                forEachPolygon(geometry.getGeometryN(i), action);
            }
        }
    }

    private static void checkRing(int featureIndex, LineString ring) {
        if (ring.isEmpty()) return;
        CoordinateSequence cs = ring.getCoordinateSequence();
        if (cs.size() < 4) {
            throw new GeometryException(featureIndex, "anello con meno di 4 vertici");
        }
        for (int i = 0; i < cs.size(); i++) {
            if (!Double.isFinite(cs.getX(i)) || !Double.isFinite(cs.getY(i))) {
                throw new GeometryException(featureIndex, "coordinata non finita al vertice " + i);
            }
        }
    }

    /**
     * Prima riga il cui centro (r + 0.5) è maggiore o uguale a y, limitata a [0, limit].
     */
    private static int firstCenterAtOrAfter(double y, int limit) {
        double r = Math.ceil(y - 0.5);
        if (r <= 0) return 0;
        if (r >= limit) return limit;
        return (int) r;
    }

    private static void appendRing(LineString ring, RasterGrid grid, Crossings crossings) {
        if (ring.isEmpty()) return;
        CoordinateSequence cs = ring.getCoordinateSequence();
        int n = cs.size();
        double x1 = grid.modelToGridX(cs.getX(0));
        double y1 = grid.modelToGridY(cs.getY(0));
        // L'ultimo lato chiude l'anello anche se il primo vertice non è ripetuto
        boolean closed = cs.getX(0) == cs.getX(n - 1) && cs.getY(0) == cs.getY(n - 1);
        int edges = closed ? n - 1 : n;
        for (int i = 1; i <= edges; i++) {
            int j = i % n;
            double x2 = grid.modelToGridX(cs.getX(j));
            double y2 = grid.modelToGridY(cs.getY(j));
            if (y1 != y2) {
                int from = Math.max(crossings.rowFrom, firstCenterAtOrAfter(Math.min(y1, y2), Integer.MAX_VALUE));
                int to = Math.min(crossings.rowTo, firstCenterAtOrAfter(Math.max(y1, y2), Integer.MAX_VALUE));
                double slope = (x2 - x1) / (y2 - y1);
                for (int row = from; row < to; row++) {
                    crossings.add(row, x1 + (row + 0.5 - y1) * slope);
                }
            }
            x1 = x2;
            y1 = y2;
        }
    }

    /**
     * Attraversamenti per riga di una singola feature.
     */
    private static final class Crossings {
        final int rowFrom;
        final int rowTo;
        final double[][] xs;
        final int[] counts;

        Crossings(int rowFrom, int rowTo) {
            this.rowFrom = rowFrom;
            this.rowTo = rowTo;
            this.xs = new double[rowTo - rowFrom][];
            this.counts = new int[rowTo - rowFrom];
        }

        void add(int row, double x) {
            int i = row - rowFrom;
            double[] values = xs[i];
            if (values == null) {
                values = xs[i] = new double[4];
            } else if (counts[i] == values.length) {
                values = xs[i] = Arrays.copyOf(values, values.length * 2);
            }
            values[counts[i]++] = x;
        }

        List<PixelRange> toRanges(int featureIndex, int width) {
            List<PixelRange> ranges = new ArrayList<>();
            for (int i = 0; i < xs.length; i++) {
                int count = counts[i];
                if (count < 2) continue;
                double[] values = xs[i];
                Arrays.sort(values, 0, count);
                int row = rowFrom + i;
                PixelRange last = null;
                for (int k = 0; k + 1 < count; k += 2) {
                    int colStart = firstCenterAtOrAfter(values[k], width);
                    int colEnd = firstCenterAtOrAfter(values[k + 1], width);
                    if (colStart >= colEnd) continue;
                    if (last != null && last.colEnd() == colStart) {
                        // Intervalli contigui sulla stessa riga: fusione
                        last = new PixelRange(row, last.colStart(), colEnd, featureIndex);
                        ranges.set(ranges.size() - 1, last);
                    } else {
                        last = new PixelRange(row, colStart, colEnd, featureIndex);
                        ranges.add(last);
                    }
                }
            }
            return ranges;
        }
    }
}
