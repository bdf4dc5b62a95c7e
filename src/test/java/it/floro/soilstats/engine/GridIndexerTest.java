package it.floro.soilstats.engine;

import it.floro.soilstats.domain.PixelRange;
import it.floro.soilstats.domain.RasterGrid;
import it.floro.soilstats.raster.TestRasters;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.io.WKTReader;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class GridIndexerTest {

    // Raster 10x10 con celle unitarie: x in [0, 10], y in [0, 10], riga 0 in alto
    private static final RasterGrid GRID = TestRasters.grid(0, 0, 1, 10, 10);

    private final GridIndexer indexer = new GridIndexer();
    private final WKTReader wkt = new WKTReader();

    private Geometry geom(String text) throws Exception {
        return wkt.read(text);
    }

    private static long cells(List<PixelRange> ranges) {
        return ranges.stream().mapToLong(PixelRange::length).sum();
    }

    @Test
    void testSquareCoversCellsWithCenterInside() throws Exception {
        var ranges = indexer.index(0, geom("POLYGON ((2 2, 5 2, 5 5, 2 5, 2 2))"), GRID);

        assertEquals(List.of(
                new PixelRange(5, 2, 5, 0),
                new PixelRange(6, 2, 5, 0),
                new PixelRange(7, 2, 5, 0)), ranges);
        assertEquals(9, cells(ranges));
    }

    @Test
    void testTriangleFollowsDiagonal() throws Exception {
        // Triangolo sotto la diagonale: nella riga r entrano le colonne [0, r)
        var ranges = indexer.index(0, geom("POLYGON ((0 0, 10 0, 0 10, 0 0))"), GRID);

        assertEquals(45, cells(ranges));
        for (PixelRange range : ranges) {
            assertEquals(0, range.colStart());
            assertEquals(range.row(), range.colEnd());
        }
    }

    @Test
    void testHoleIsExcluded() throws Exception {
        var ranges = indexer.index(0, geom(
                "POLYGON ((1 1, 9 1, 9 9, 1 9, 1 1), (4 4, 6 4, 6 6, 4 6, 4 4))"), GRID);

        assertEquals(60, cells(ranges));
        assertTrue(ranges.contains(new PixelRange(4, 1, 4, 0)));
        assertTrue(ranges.contains(new PixelRange(4, 6, 9, 0)));
        assertTrue(ranges.contains(new PixelRange(5, 1, 4, 0)));
        assertTrue(ranges.contains(new PixelRange(5, 6, 9, 0)));
        assertTrue(ranges.contains(new PixelRange(3, 1, 9, 0)));
    }

    @Test
    void testMultiPolygonComponentsShareFeature() throws Exception {
        var ranges = indexer.index(3, geom(
                "MULTIPOLYGON (((0 0, 2 0, 2 2, 0 2, 0 0)), ((7 7, 9 7, 9 9, 7 9, 7 7)))"), GRID);

        assertEquals(8, cells(ranges));
        assertTrue(ranges.stream().allMatch(r -> r.featureIndex() == 3));
        assertTrue(ranges.contains(new PixelRange(1, 7, 9, 3)));
        assertTrue(ranges.contains(new PixelRange(9, 0, 2, 3)));
    }

    @Test
    void testTinyPolygonAroundCellCenter() throws Exception {
        var ranges = indexer.index(0, geom("POLYGON ((2.4 2.4, 2.6 2.4, 2.6 2.6, 2.4 2.6, 2.4 2.4))"), GRID);
        assertEquals(List.of(new PixelRange(7, 2, 3, 0)), ranges);
    }

    @Test
    void testPolygonMissingAllCentersHasNoRanges() throws Exception {
        // Attraversa le celle della colonna 0 e 1 senza contenerne i centri
        var ranges = indexer.index(0, geom("POLYGON ((0.6 0.6, 1.4 0.6, 1.4 9.4, 0.6 9.4, 0.6 0.6))"), GRID);
        assertTrue(ranges.isEmpty());
    }

    @Test
    void testGeometryOutsideRasterHasNoRanges() throws Exception {
        var ranges = indexer.index(0, geom("POLYGON ((20 20, 30 20, 30 30, 20 30, 20 20))"), GRID);
        assertTrue(ranges.isEmpty());
    }

    @Test
    void testPartialOverlapIsClampedToRaster() throws Exception {
        var ranges = indexer.index(0, geom("POLYGON ((-5 -5, 3 -5, 3 15, -5 15, -5 -5))"), GRID);

        assertEquals(10, ranges.size());
        for (int row = 0; row < 10; row++) {
            assertEquals(new PixelRange(row, 0, 3, 0), ranges.get(row));
        }
    }

    @Test
    void testCollectionOfPolygonsIsAccepted() throws Exception {
        var collection = geom("GEOMETRYCOLLECTION (POLYGON ((2 2, 5 2, 5 5, 2 5, 2 2)))");
        var polygon = geom("POLYGON ((2 2, 5 2, 5 5, 2 5, 2 2))");

        assertEquals(indexer.index(0, polygon, GRID), indexer.index(0, collection, GRID));
    }

    @Test
    void testBatchSortedByRowThenFeature() throws Exception {
        var a = geom("POLYGON ((0 0, 10 0, 10 10, 0 10, 0 0))");
        var b = geom("POLYGON ((2 2, 5 2, 5 5, 2 5, 2 2))");

        var ranges = indexer.index(List.of(a, b), GRID);

        assertEquals(100 + 9, cells(ranges));
        for (int i = 1; i < ranges.size(); i++) {
            assertTrue(GridIndexer.SCAN_ORDER.compare(ranges.get(i - 1), ranges.get(i)) <= 0);
        }
        // Le feature sovrapposte ricevono intervalli indipendenti
        assertTrue(ranges.contains(new PixelRange(5, 0, 10, 0)));
        assertTrue(ranges.contains(new PixelRange(5, 2, 5, 1)));
    }

    @Test
    void testPointIsRejected() throws Exception {
        var ex = assertThrows(GeometryException.class,
                () -> indexer.index(2, geom("POINT (1 1)"), GRID));
        assertEquals(2, ex.getFeatureIndex());
        assertTrue(ex.getMessage().contains("Point"));
    }

    @Test
    void testLineStringIsRejectedInBatch() throws Exception {
        var polygon = geom("POLYGON ((2 2, 5 2, 5 5, 2 5, 2 2))");
        var line = geom("LINESTRING (0 0, 5 5)");

        var ex = assertThrows(GeometryException.class,
                () -> indexer.index(List.of(polygon, line), GRID));
        assertEquals(1, ex.getFeatureIndex());
    }

    @Test
    void testNonFiniteCoordinateIsRejected() {
        var polygon = new GeometryFactory().createPolygon(new Coordinate[] {
                new Coordinate(0, 0),
                new Coordinate(Double.NaN, 0),
                new Coordinate(1, 1),
                new Coordinate(0, 0)
        });
        assertThrows(GeometryException.class, () -> GridIndexer.validate(0, polygon));
    }

    @Test
    void testEmptyPolygonHasNoRanges() throws Exception {
        assertTrue(indexer.index(0, geom("POLYGON EMPTY"), GRID).isEmpty());
    }
}
