package it.floro.soilstats.engine;

import it.floro.soilstats.domain.Statistics;
import it.floro.soilstats.domain.ValueSample;

import java.util.Arrays;
import java.util.stream.Collector;

/**
 * Stato di aggregazione di una feature: {min, max, sum, sum2, count} più il
 * buffer dei valori necessario al percorso esatto.
 *
 * Il buffer viene mantenuto finché count ≤ soglia e rilasciato appena la
 * soglia viene superata: da lì in poi restano solo i momenti.
 *
 * L'operazione {@link #merge} è associativa, quindi raster diversi possono
 * essere aggregati separatamente e combinati alla fine.
 */
public final class StatisticsAccumulator {

    private static final int INITIAL_CAPACITY = 16;

    private final int threshold;

    private double min = Double.POSITIVE_INFINITY;
    private double max = Double.NEGATIVE_INFINITY;
    private double sum;
    private double sum2;
    private long count;

    /** Valori raccolti; null dopo il superamento della soglia. */
    private float[] values = new float[0];

    public StatisticsAccumulator(int threshold) {
        if (threshold < 0) {
            throw new IllegalArgumentException("Soglia negativa: " + threshold);
        }
        this.threshold = threshold;
    }

    /**
     * Collector per raggruppamenti su stream di campioni.
     */
    public static Collector<ValueSample, StatisticsAccumulator, Statistics> collector(int threshold) {
        return Collector.of(
                () -> new StatisticsAccumulator(threshold),
                (acc, sample) -> acc.add(sample.value()),
                StatisticsAccumulator::merge,
                StatisticsAccumulator::toStatistics);
    }

    public void add(float x) {
        if (x < min) min = x;
        if (x > max) max = x;
        sum += x;
        sum2 += (double) x * x;
        count++;
        if (values != null) {
            if (count > threshold) {
                values = null;
            } else {
                if (count > values.length) {
                    int capacity = (int) Math.min(threshold, Math.max(INITIAL_CAPACITY, values.length * 2L));
                    values = Arrays.copyOf(values, capacity);
                }
                values[(int) count - 1] = x;
            }
        }
    }

    /**
     * Combina un altro accumulatore in questo.
     *
     * @return this, per l'uso come combiner
     */
    public StatisticsAccumulator merge(StatisticsAccumulator other) {
        if (other.count == 0) return this;
        long total = count + other.count;
        if (values != null && other.values != null && total <= threshold) {
            if (total > values.length) {
                values = Arrays.copyOf(values, (int) total);
            }
            System.arraycopy(other.values, 0, values, (int) count, (int) other.count);
        } else {
            values = null;
        }
        min = Math.min(min, other.min);
        max = Math.max(max, other.max);
        sum += other.sum;
        sum2 += other.sum2;
        count = total;
        return this;
    }

    /**
     * Moltiplica per un fattore positivo tutti i valori già accumulati.
     * Usato dal join pesato: prima per il peso del raster, poi per
     * l'inverso della somma dei pesi.
     *
     * @return this
     */
    public StatisticsAccumulator scale(double factor) {
        if (!(factor > 0) || Double.isInfinite(factor)) {
            throw new IllegalArgumentException("Fattore di scala non valido: " + factor);
        }
        if (count == 0) return this;
        min *= factor;
        max *= factor;
        sum *= factor;
        sum2 *= factor * factor;
        if (values != null) {
            for (int i = 0; i < count; i++) {
                values[i] = (float) (values[i] * factor);
            }
        }
        return this;
    }

    public long count() {
        return count;
    }

    /** true se il calcolo seguirà il percorso esatto. */
    public boolean isExact() {
        return values != null;
    }

    /**
     * Statistiche finali: sentinella se vuoto, percorso esatto se count ≤ soglia,
     * altrimenti percorso streaming.
     */
    public Statistics toStatistics() {
        if (count == 0) {
            return Statistics.EMPTY;
        }
        if (values != null) {
            return StatisticsAggregator.exact(Arrays.copyOf(values, (int) count));
        }
        return StatisticsAggregator.streaming(min, max, sum, sum2, count);
    }
}
