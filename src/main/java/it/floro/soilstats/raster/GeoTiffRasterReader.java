package it.floro.soilstats.raster;

import it.floro.soilstats.domain.RasterGrid;

import javax.imageio.ImageIO;
import javax.imageio.ImageReadParam;
import javax.imageio.ImageReader;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.plugins.tiff.GeoTIFFTagSet;
import javax.imageio.plugins.tiff.TIFFDirectory;
import javax.imageio.plugins.tiff.TIFFField;
import javax.imageio.plugins.tiff.TIFFImageReadParam;
import javax.imageio.stream.ImageInputStream;
import java.awt.Rectangle;
import java.awt.image.Raster;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Locale;

/**
 * Reader per GeoTIFF basato sul plugin TIFF di javax.imageio.
 *
 * Dalla directory TIFF vengono letti solo i tag necessari all'indicizzazione:
 * - ModelPixelScale + ModelTiepoint, oppure ModelTransformation
 * - GDAL_NODATA (tag 42113), se presente
 *
 * Le righe sono lette una alla volta tramite source region, così vengono
 * decodificate solo le strip/tile che contengono la riga richiesta.
 */
public class GeoTiffRasterReader implements RasterReader {

    /** Tag privato GDAL con il valore nodata in formato testo. */
    static final int TAG_GDAL_NODATA = 42113;

    private final Path path;
    private final int band;
    private final ImageInputStream input;
    private final ImageReader reader;
    private final RasterGrid grid;

    private boolean closed;

    public GeoTiffRasterReader(Path path, int band) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new NoSuchFileException(path.toString());
        }
        this.path = path;
        this.band = band;
        this.input = ImageIO.createImageInputStream(path.toFile());
        if (input == null) {
            throw new IOException("Impossibile aprire lo stream per " + path);
        }
        Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
        if (!readers.hasNext()) {
            input.close();
            throw new IOException("Formato non riconosciuto come TIFF: " + path);
        }
        this.reader = readers.next();
        try {
            reader.setInput(input, false, false);
            this.grid = readGrid();
        } catch (IOException | RuntimeException e) {
            reader.dispose();
            input.close();
            throw e;
        }
    }

    @Override
    public RasterGrid grid() {
        return grid;
    }

    @Override
    public void readRow(int row, float[] buffer) throws IOException {
        if (closed) {
            throw new IOException("Reader già chiuso: " + path);
        }
        if (row < 0 || row >= grid.height()) {
            throw new IOException("Riga " + row + " fuori dal raster " + path);
        }
        ImageReadParam param = reader.getDefaultReadParam();
        param.setSourceRegion(new Rectangle(0, row, grid.width(), 1));
        Raster raster = reader.read(0, param).getRaster();
        raster.getSamples(raster.getMinX(), raster.getMinY(), grid.width(), 1, band, buffer);
    }

    @Override
    public void close() throws IOException {
        if (!closed) {
            closed = true;
            reader.dispose();
            input.close();
        }
    }

    // ===================== Helpers =====================

    private RasterGrid readGrid() throws IOException {
        // Il plugin TIFF carica i metadati una sola volta, al primo accesso
        // all'immagine, con il read param di quel momento: la prima chiamata
        // deve essere questa lettura con readUnknownTags, altrimenti il tag
        // GDAL_NODATA viene scartato. Nessun getWidth/getHeight prima di qui.
        TIFFImageReadParam firstReadParam = new TIFFImageReadParam();
        firstReadParam.setReadUnknownTags(true);
        firstReadParam.setSourceRegion(new Rectangle(0, 0, 1, 1));
        Raster firstTile = reader.read(0, firstReadParam).getRaster();
        if (band < 0 || band >= firstTile.getNumBands()) {
            throw new IOException("Banda " + band + " non disponibile in " + path
                    + " (bande: " + firstTile.getNumBands() + ")");
        }

        int width = reader.getWidth(0);
        int height = reader.getHeight(0);

        IIOMetadata metadata = reader.getImageMetadata(0);
        TIFFDirectory directory = TIFFDirectory.createFromMetadata(metadata);

        double[] pixelScale = doubles(directory.getTIFFField(GeoTIFFTagSet.TAG_MODEL_PIXEL_SCALE));
        double[] tiePoint = doubles(directory.getTIFFField(GeoTIFFTagSet.TAG_MODEL_TIE_POINT));
        double[] transformation = doubles(directory.getTIFFField(GeoTIFFTagSet.TAG_MODEL_TRANSFORMATION));
        float nodata = parseNodata(directory.getTIFFField(TAG_GDAL_NODATA));

        try {
            return gridFromTags(pixelScale, tiePoint, transformation, width, height, nodata);
        } catch (IllegalArgumentException e) {
            throw new IOException("Georeferenziazione non valida in " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Costruisce la griglia dai tag GeoTIFF.
     * ModelTransformation ha la precedenza; rotazioni non nulle non sono supportate.
     */
    static RasterGrid gridFromTags(double[] pixelScale, double[] tiePoint, double[] transformation,
                                   int width, int height, float nodata) {
        if (transformation != null && transformation.length >= 16) {
            if (transformation[1] != 0 || transformation[4] != 0) {
                throw new IllegalArgumentException("trasformazione con rotazione non supportata");
            }
            return new RasterGrid(transformation[3], transformation[7],
                    transformation[0], transformation[5], width, height, nodata);
        }
        if (pixelScale == null || pixelScale.length < 2 || tiePoint == null || tiePoint.length < 6) {
            throw new IllegalArgumentException("mancano ModelPixelScale/ModelTiepoint");
        }
        double sx = pixelScale[0];
        double sy = -pixelScale[1];
        // Tiepoint: (I, J, K) raster → (X, Y, Z) modello
        double x0 = tiePoint[3] - tiePoint[0] * sx;
        double y0 = tiePoint[4] - tiePoint[1] * sy;
        return new RasterGrid(x0, y0, sx, sy, width, height, nodata);
    }

    static float parseNodata(TIFFField field) {
        if (field == null || field.getCount() == 0) {
            return Float.NaN;
        }
        String raw = field.getAsString(0).replace("\0", "").trim();
        if (raw.isEmpty()) {
            return Float.NaN;
        }
        try {
            return Float.parseFloat(raw);
        } catch (NumberFormatException e) {
            // "nan", "-inf" ecc. come li scrive GDAL
            return switch (raw.toLowerCase(Locale.ROOT)) {
                case "inf", "+inf" -> Float.POSITIVE_INFINITY;
                case "-inf" -> Float.NEGATIVE_INFINITY;
                default -> Float.NaN;
            };
        }
    }

    private static double[] doubles(TIFFField field) {
        return field == null ? null : field.getAsDoubles();
    }
}
