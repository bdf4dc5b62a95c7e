package it.floro.soilstats.engine;

import it.floro.soilstats.domain.RasterGrid;
import it.floro.soilstats.domain.Statistics;
import it.floro.soilstats.domain.WeightedRaster;
import it.floro.soilstats.raster.InMemoryRasterReader;
import it.floro.soilstats.raster.RasterOpener;
import it.floro.soilstats.raster.TestRasters;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.io.WKTReader;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

public class JoinDriverTest {

    @TempDir
    Path dir;

    private final JoinDriver driver = new JoinDriver();
    private final WKTReader wkt = new WKTReader();

    private Geometry geom(String text) throws Exception {
        return wkt.read(text);
    }

    /** Quadrato [x0, x1] x [y0, y1]. */
    private Geometry box(double x0, double y0, double x1, double y1) throws Exception {
        return geom(String.format(java.util.Locale.ROOT,
                "POLYGON ((%f %f, %f %f, %f %f, %f %f, %f %f))",
                x0, y0, x1, y0, x1, y1, x0, y1, x0, y0));
    }

    // ===================== Raster reali (ASCII grid) =====================

    @Test
    void testInsideAndOutsideGeometries() throws Exception {
        Path raster = TestRasters.writeFilledAscii(dir.resolve("seven.asc"), 0, 0, 1, 10, 10, 7f);

        JoinResult result = driver.join(List.of(raster),
                List.of(box(-1, -1, 11, 11), box(50, 50, 60, 60)), 0, null);

        assertEquals(JoinResult.Status.COMPLETE, result.status());
        Statistics inside = result.get(0);
        assertEquals(100, inside.count());
        assertEquals(7f, inside.min());
        assertEquals(7f, inside.max());
        assertEquals(7f, inside.mean());
        assertEquals(7f, inside.median());
        assertEquals(0f, inside.stddev());
        assertEquals(700f, inside.sum());

        assertEquals(Statistics.EMPTY, result.get(1));
        assertEquals(2, result.statistics().size());
    }

    @Test
    void testNoIntersectionIsNoResults() throws Exception {
        Path raster = TestRasters.writeFilledAscii(dir.resolve("r.asc"), 0, 0, 1, 10, 10, 7f);

        JoinResult result = driver.join(List.of(raster), List.of(box(50, 50, 60, 60)), 0, null);

        assertEquals(JoinResult.Status.NO_RESULTS, result.status());
        assertTrue(result.statistics().isEmpty());
    }

    @Test
    void testEmptyInputsAreNoResults() throws Exception {
        Path raster = TestRasters.writeFilledAscii(dir.resolve("r.asc"), 0, 0, 1, 10, 10, 7f);

        assertEquals(JoinResult.Status.NO_RESULTS,
                driver.join(List.of(), List.of(box(0, 0, 5, 5)), 0, null).status());
        assertEquals(JoinResult.Status.NO_RESULTS,
                driver.join(List.of(raster), List.of(), 0, null).status());
    }

    @Test
    void testAllNodataGivesSentinelNotNoResults() throws Exception {
        Path raster = TestRasters.writeFilledAscii(dir.resolve("empty.asc"), 0, 0, 1, 5, 5, TestRasters.NODATA);

        JoinResult result = driver.join(List.of(raster), List.of(box(0, 0, 5, 5)), 0, null);

        assertEquals(JoinResult.Status.COMPLETE, result.status());
        assertTrue(result.get(0).isEmpty());
    }

    @Test
    void testAdjacentTilesAreMerged() throws Exception {
        Path west = TestRasters.writeFilledAscii(dir.resolve("west.asc"), 0, 0, 1, 10, 10, 1f);
        Path east = TestRasters.writeFilledAscii(dir.resolve("east.asc"), 10, 0, 1, 10, 10, 3f);

        JoinResult result = driver.join(List.of(west, east), List.of(box(0, 0, 20, 10)), 0, null);

        Statistics s = result.get(0);
        assertEquals(200, s.count());
        assertEquals(1f, s.min());
        assertEquals(3f, s.max());
        assertEquals(2f, s.mean());
        assertEquals(2f, s.median());
        assertEquals(1f, s.stddev());
    }

    @Test
    void testMissingRasterFails() throws Exception {
        Path present = TestRasters.writeFilledAscii(dir.resolve("r.asc"), 0, 0, 1, 10, 10, 7f);
        Path missing = dir.resolve("missing.tif");

        assertThrows(NoSuchFileException.class,
                () -> driver.join(List.of(present, missing), List.of(box(0, 0, 5, 5)), 0, null));
    }

    @Test
    void testParallelMatchesSequential() throws Exception {
        List<Path> rasters = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            float[][] rows = new float[8][8];
            for (int r = 0; r < 8; r++) {
                for (int c = 0; c < 8; c++) {
                    rows[r][c] = (r * 8 + c + i * 3) % 11;
                }
            }
            rows[2][3] = TestRasters.NODATA;
            rasters.add(TestRasters.writeAscii(dir.resolve("tile" + i + ".asc"), i * 8, 0, 1, rows));
        }
        List<Geometry> geometries = List.of(
                box(1, 1, 30, 7),
                geom("POLYGON ((0 0, 32 0, 0 8, 0 0))"),
                box(100, 100, 101, 101));

        JoinResult sequential = driver.join(rasters, geometries, 0, null);
        ExecutorService executor = Executors.newFixedThreadPool(3);
        try {
            JoinResult parallel = driver.join(rasters, geometries, 0, null, executor);
            assertEquals(sequential, parallel);
        } finally {
            executor.shutdownNow();
        }
        assertEquals(JoinResult.Status.COMPLETE, sequential.status());
        assertTrue(sequential.get(2).isEmpty());
    }

    // ===================== Join pesato =====================

    private List<WeightedRaster> twoDepths() throws Exception {
        Path shallow = TestRasters.writeFilledAscii(dir.resolve("shallow.asc"), 0, 0, 1, 10, 10, 10f);
        Path deep = TestRasters.writeFilledAscii(dir.resolve("deep.asc"), 0, 0, 1, 5, 10, 20f);
        return List.of(new WeightedRaster(shallow, 5), new WeightedRaster(deep, 10));
    }

    @Test
    void testWeightedJoinDividesBySummedWeights() throws Exception {
        JoinResult result = driver.joinWeighted(twoDepths(), List.of(box(-1, -1, 11, 11)), 0, null);

        assertEquals(JoinResult.Status.COMPLETE, result.status());
        Statistics s = result.get(0);
        assertEquals(150, s.count());
        assertEquals(10f * 5 / 15, s.min(), 1e-4f);
        assertEquals(20f * 10 / 15, s.max(), 1e-4f);
        assertEquals(100 * (10f * 5 / 15) + 50 * (20f * 10 / 15), s.sum(), 1e-2f);
        assertEquals(10f * 5 / 15, s.median(), 1e-4f);
    }

    @Test
    void testWeightCountsOnlyContributingRasters() throws Exception {
        // Il raster profondo copre solo x < 5: la seconda geometria riceve celle dal solo strato superficiale
        JoinResult result = driver.joinWeighted(twoDepths(),
                List.of(box(-1, -1, 11, 11), box(6, 0, 10, 10)), 0, null);

        Statistics eastOnly = result.get(1);
        assertEquals(40, eastOnly.count());
        assertEquals(10f, eastOnly.min(), 1e-5f);
        assertEquals(10f, eastOnly.max(), 1e-5f);
        assertEquals(10f, eastOnly.mean(), 1e-5f);
    }

    @Test
    void testWeightedParallelMatchesSequential() throws Exception {
        List<WeightedRaster> rasters = twoDepths();
        List<Geometry> geometries = List.of(box(-1, -1, 11, 11), box(6, 0, 10, 10), box(50, 50, 60, 60));

        JoinResult sequential = driver.joinWeighted(rasters, geometries, 0, null);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            assertEquals(sequential, driver.joinWeighted(rasters, geometries, 0, null, executor));
        } finally {
            executor.shutdownNow();
        }
        assertTrue(sequential.get(2).isEmpty());
    }

    @Test
    void testWeightedOutcomes() throws Exception {
        List<WeightedRaster> rasters = twoDepths();

        assertEquals(JoinResult.Status.NO_RESULTS,
                driver.joinWeighted(rasters, List.of(box(50, 50, 60, 60)), 0, null).status());
        assertEquals(JoinResult.Status.NO_RESULTS,
                driver.joinWeighted(List.of(), List.of(box(0, 0, 5, 5)), 0, null).status());
        assertEquals(JoinResult.Status.INCOMPLETE,
                driver.joinWeighted(rasters, List.of(box(0, 0, 5, 5)), 0, () -> true).status());
        assertThrows(IllegalArgumentException.class, () -> new WeightedRaster(dir.resolve("x.asc"), 0));
    }

    // ===================== Raster in memoria =====================

    private static final RasterGrid TILE = TestRasters.grid(0, 0, 1, 10, 10);

    private final List<InMemoryRasterReader> opened = new ArrayList<>();

    private RasterOpener opener(Map<Path, Supplier<InMemoryRasterReader>> rasters) {
        return (path, band) -> {
            Supplier<InMemoryRasterReader> supplier = rasters.get(path);
            if (supplier == null) {
                throw new NoSuchFileException(path.toString());
            }
            InMemoryRasterReader reader = supplier.get();
            opened.add(reader);
            return reader;
        };
    }

    private JoinDriver inMemoryDriver(Map<Path, Supplier<InMemoryRasterReader>> rasters) {
        return new JoinDriver(new GridIndexer(), new StatisticsAggregator(), opener(rasters));
    }

    @Test
    void testEveryHandleIsClosed() throws Exception {
        Map<Path, Supplier<InMemoryRasterReader>> rasters = new HashMap<>();
        rasters.put(Path.of("a"), () -> InMemoryRasterReader.filled(TILE, 1f));
        rasters.put(Path.of("far"), () -> InMemoryRasterReader.filled(TestRasters.grid(500, 500, 1, 10, 10), 9f));
        rasters.put(Path.of("b"), () -> InMemoryRasterReader.filled(TILE, 2f));

        JoinResult result = inMemoryDriver(rasters)
                .join(List.of(Path.of("a"), Path.of("far"), Path.of("b")), List.of(box(0, 0, 2, 2)), 0, null);

        assertEquals(8, result.get(0).count());
        assertEquals(3, opened.size());
        for (InMemoryRasterReader reader : opened) {
            assertTrue(reader.isClosed());
            assertEquals(1, reader.closeCount());
        }
        assertEquals(0, opened.get(1).totalReads());
    }

    @Test
    void testInvalidGeometryFailsBeforeOpening() throws Exception {
        Map<Path, Supplier<InMemoryRasterReader>> rasters = Map.of(
                Path.of("a"), () -> InMemoryRasterReader.filled(TILE, 1f));

        assertThrows(GeometryException.class, () -> inMemoryDriver(rasters)
                .join(List.of(Path.of("a")), List.of(box(0, 0, 2, 2), geom("POINT (1 1)")), 0, null));
        assertTrue(opened.isEmpty());
    }

    @Test
    void testReadErrorAbortsAndClosesHandles() throws Exception {
        Map<Path, Supplier<InMemoryRasterReader>> rasters = Map.of(
                Path.of("a"), () -> InMemoryRasterReader.filled(TILE, 1f),
                Path.of("b"), () -> InMemoryRasterReader.filled(TILE, 1f).failAt(5));

        IOException ex = assertThrows(IOException.class, () -> inMemoryDriver(rasters)
                .join(List.of(Path.of("a"), Path.of("b")), List.of(box(0, 0, 10, 10)), 0, null));

        assertTrue(ex.getMessage().contains("riga 5"));
        assertEquals(2, opened.size());
        assertTrue(opened.stream().allMatch(InMemoryRasterReader::isClosed));
    }

    @Test
    void testCancelledBeforeStartIsIncomplete() throws Exception {
        Map<Path, Supplier<InMemoryRasterReader>> rasters = Map.of(
                Path.of("a"), () -> InMemoryRasterReader.filled(TILE, 1f));

        JoinResult result = inMemoryDriver(rasters)
                .join(List.of(Path.of("a")), List.of(box(0, 0, 10, 10)), 0, () -> true);

        assertEquals(JoinResult.Status.INCOMPLETE, result.status());
        assertTrue(result.statistics().isEmpty());
        assertTrue(opened.isEmpty());
    }

    @Test
    void testCancelledDuringReadIsIncomplete() throws Exception {
        Map<Path, Supplier<InMemoryRasterReader>> rasters = Map.of(
                Path.of("a"), () -> InMemoryRasterReader.filled(TILE, 1f),
                Path.of("b"), () -> InMemoryRasterReader.filled(TILE, 1f));
        AtomicInteger polls = new AtomicInteger();
        // Primo controllo prima di aprire "a", poi stop prima di leggere la seconda riga
        CancellationCheck check = () -> polls.incrementAndGet() > 2;

        JoinResult result = inMemoryDriver(rasters)
                .join(List.of(Path.of("a"), Path.of("b")), List.of(box(0, 0, 10, 10)), 0, check);

        assertEquals(JoinResult.Status.INCOMPLETE, result.status());
        assertEquals(1, opened.size());
        assertEquals(1, opened.get(0).totalReads());
        assertTrue(opened.get(0).isClosed());
    }

    @Test
    void testParallelCancellationIsIncomplete() throws Exception {
        Map<Path, Supplier<InMemoryRasterReader>> rasters = Map.of(
                Path.of("a"), () -> InMemoryRasterReader.filled(TILE, 1f));
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            JoinResult result = inMemoryDriver(rasters)
                    .join(List.of(Path.of("a")), List.of(box(0, 0, 10, 10)), 0, () -> true, executor);
            assertEquals(JoinResult.Status.INCOMPLETE, result.status());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testParallelErrorPropagates() throws Exception {
        Map<Path, Supplier<InMemoryRasterReader>> rasters = Map.of(
                Path.of("a"), () -> InMemoryRasterReader.filled(TILE, 1f).failAt(0));
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            assertThrows(IOException.class, () -> inMemoryDriver(rasters)
                    .join(List.of(Path.of("a"), Path.of("missing")), List.of(box(0, 0, 10, 10)), 0, null, executor));
        } finally {
            executor.shutdownNow();
        }
    }
}
