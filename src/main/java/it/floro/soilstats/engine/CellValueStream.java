package it.floro.soilstats.engine;

import it.floro.soilstats.domain.PixelRange;
import it.floro.soilstats.domain.RasterGrid;
import it.floro.soilstats.domain.ValueSample;
import it.floro.soilstats.raster.RasterReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Sequenza lazy dei valori di cella coperti da un insieme di intervalli di un raster.
 *
 * Comportamento:
 * - Gli intervalli sono ordinati per riga: ogni riga viene letta una sola volta
 *   e poi suddivisa per intervallo
 * - Le celle nodata (e NaN) non vengono emesse
 * - Prima di ogni riga viene interrogato il {@link CancellationCheck}: se segnala
 *   lo stop la sequenza termina in anticipo
 * - L'handle del raster appartiene allo stream e viene chiuso quando la sequenza
 *   è esaurita, cancellata, in errore o chiusa esplicitamente
 *
 * Single-pass, non thread-safe. Gli errori di I/O durante l'iterazione
 * vengono propagati come {@link UncheckedIOException}.
 */
public class CellValueStream implements Iterator<ValueSample>, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(CellValueStream.class);

    private static final Comparator<PixelRange> ROW_ORDER = Comparator
            .comparingInt(PixelRange::row)
            .thenComparingInt(PixelRange::colStart);

    private final RasterReader reader;
    private final RasterGrid grid;
    private final List<PixelRange> ranges;
    private final CancellationCheck cancelCheck;
    private final float[] rowBuffer;

    /** Indice del primo intervallo non ancora caricato. */
    private int nextRange;
    /** Intervalli della riga corrente: [rowRangeFrom, rowRangeTo). */
    private int rowRangeFrom;
    private int rowRangeTo;
    /** Posizione corrente nella riga caricata. */
    private int currentRange;
    private int currentCol;

    private ValueSample next;
    private boolean cancelled;
    private boolean closed;
    private int rowsRead;

    public CellValueStream(RasterReader reader, List<PixelRange> ranges, CancellationCheck cancelCheck) {
        this.reader = reader;
        this.grid = reader.grid();
        this.cancelCheck = cancelCheck != null ? cancelCheck : CancellationCheck.NEVER;
        List<PixelRange> sorted = new ArrayList<>(ranges);
        sorted.sort(ROW_ORDER);
        this.ranges = sorted;
        this.rowBuffer = new float[grid.width()];
    }

    @Override
    public boolean hasNext() {
        if (next != null) return true;
        if (closed) return false;
        try {
            next = advance();
        } catch (IOException e) {
            closeQuietly(e);
            throw new UncheckedIOException(e);
        } catch (RuntimeException e) {
            closeQuietly(e);
            throw e;
        }
        if (next == null) {
            close();
        }
        return next != null;
    }

    @Override
    public ValueSample next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        ValueSample sample = next;
        next = null;
        return sample;
    }

    /**
     * @return true se la sequenza è terminata per cancellazione
     */
    public boolean isCancelled() {
        return cancelled;
    }

    /** Numero di righe lette finora dal raster. */
    public int rowsRead() {
        return rowsRead;
    }

    /**
     * Chiude l'handle del raster. Idempotente.
     *
     * @throws UncheckedIOException se la chiusura dell'handle fallisce
     */
    @Override
    public void close() {
        if (closed) return;
        closed = true;
        next = null;
        try {
            reader.close();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    // ===================== Helpers =====================

    private ValueSample advance() throws IOException {
        while (true) {
            while (currentRange < rowRangeTo) {
                PixelRange range = ranges.get(currentRange);
                while (currentCol < range.colEnd()) {
                    float value = rowBuffer[currentCol++];
                    if (!grid.isNodata(value)) {
                        return new ValueSample(range.featureIndex(), value);
                    }
                }
                currentRange++;
                if (currentRange < rowRangeTo) {
                    currentCol = ranges.get(currentRange).colStart();
                }
            }
            if (nextRange >= ranges.size()) {
                return null;
            }
            if (cancelCheck.shouldStop()) {
                cancelled = true;
                logger.debug("Lettura interrotta per cancellazione dopo {} righe", rowsRead);
                return null;
            }
            loadNextRow();
        }
    }

    private void loadNextRow() throws IOException {
        int row = ranges.get(nextRange).row();
        rowRangeFrom = nextRange;
        while (nextRange < ranges.size() && ranges.get(nextRange).row() == row) {
            nextRange++;
        }
        rowRangeTo = nextRange;
        reader.readRow(row, rowBuffer);
        rowsRead++;
        currentRange = rowRangeFrom;
        currentCol = ranges.get(currentRange).colStart();
    }

    private void closeQuietly(Exception cause) {
        try {
            close();
        } catch (UncheckedIOException e) {
            cause.addSuppressed(e.getCause());
        }
    }
}
