package it.floro.soilstats.engine;

import it.floro.soilstats.domain.Statistics;
import it.floro.soilstats.domain.ValueSample;

import java.util.Arrays;
import java.util.Iterator;
import java.util.Map;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * Calcolo delle statistiche per feature a partire dai campioni (feature, valore).
 *
 * Due algoritmi, scelti in base al numero di campioni della feature:
 *
 * PERCORSO ESATTO (count ≤ soglia):
 * - ordinamento crescente dei valori
 * - min/max: primo e ultimo elemento
 * - mediana: elemento centrale, o media dei due centrali se count è pari
 * - moda: valore della sequenza più lunga di valori uguali (a parità vince la prima)
 * - quartili: sorted[n/4] e sorted[3n/4], selezione per indice senza interpolazione
 * - stddev: deviazione media assoluta Σ|x − mean| / count
 *
 * PERCORSO STREAMING (count > soglia):
 * - un solo passaggio su min, max, sum, sum2, count
 * - stddev: (sum2 − sum²/count) / count, cioè una varianza
 * - mediana, moda e quartili non calcolabili: NaN
 *
 * In entrambi i casi mean = sum / count. Le formule di stddev sono mantenute
 * così per compatibilità con i client esistenti.
 */
public class StatisticsAggregator {

    /** Soglia oltre la quale l'ordinamento diventa troppo costoso. */
    public static final int EXACT_THRESHOLD = 5_000_000;

    private final int threshold;

    public StatisticsAggregator() {
        this(EXACT_THRESHOLD);
    }

    public StatisticsAggregator(int threshold) {
        if (threshold < 0) {
            throw new IllegalArgumentException("Soglia negativa: " + threshold);
        }
        this.threshold = threshold;
    }

    public int threshold() {
        return threshold;
    }

    /**
     * Raggruppa i campioni per feature e calcola le statistiche di ciascuna.
     * L'ordine di arrivo dei campioni non influisce sul risultato.
     *
     * @param samples Sequenza single-pass di campioni
     * @return Mappa ordinata feature → statistiche, solo per le feature presenti
     */
    public Map<Integer, Statistics> aggregate(Iterator<ValueSample> samples) {
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(samples, Spliterator.ORDERED), false)
                .collect(Collectors.groupingBy(
                        ValueSample::featureIndex,
                        TreeMap::new,
                        StatisticsAccumulator.collector(threshold)));
    }

    /**
     * Accumula i campioni senza finalizzare: usato dal join parallelo per
     * combinare i risultati parziali dei singoli raster.
     */
    public Map<Integer, StatisticsAccumulator> accumulate(Iterator<ValueSample> samples) {
        Map<Integer, StatisticsAccumulator> accumulators = new TreeMap<>();
        while (samples.hasNext()) {
            ValueSample sample = samples.next();
            accumulators.computeIfAbsent(sample.featureIndex(), k -> new StatisticsAccumulator(threshold))
                    .add(sample.value());
        }
        return accumulators;
    }

    /**
     * Combina accumulatori parziali nella mappa di destinazione.
     */
    public static void mergeInto(Map<Integer, StatisticsAccumulator> target,
                                 Map<Integer, StatisticsAccumulator> partial) {
        partial.forEach((feature, acc) -> target.merge(feature, acc, StatisticsAccumulator::merge));
    }

    /**
     * Finalizza una mappa di accumulatori.
     */
    public static Map<Integer, Statistics> finish(Map<Integer, StatisticsAccumulator> accumulators) {
        Map<Integer, Statistics> result = new TreeMap<>();
        accumulators.forEach((feature, acc) -> result.put(feature, acc.toStatistics()));
        return result;
    }

    /**
     * Statistiche di un singolo insieme di valori, con la soglia di questo aggregatore.
     * L'array non viene modificato.
     */
    public Statistics statistics(float[] values) {
        if (values.length == 0) {
            return Statistics.EMPTY;
        }
        if (values.length > threshold) {
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            double sum = 0;
            double sum2 = 0;
            for (float x : values) {
                if (x < min) min = x;
                if (x > max) max = x;
                sum += x;
                sum2 += (double) x * x;
            }
            return streaming(min, max, sum, sum2, values.length);
        }
        return exact(values.clone());
    }

    // ========================================================================
    // PERCORSI DI CALCOLO
    // ========================================================================

    /**
     * Percorso esatto. L'array viene ordinato sul posto.
     */
    static Statistics exact(float[] values) {
        int count = values.length;
        if (count == 0) {
            return Statistics.EMPTY;
        }
        Arrays.sort(values);

        float min = values[0];
        float max = values[count - 1];

        double total = 0;
        for (float x : values) total += x;
        float sum = (float) total;
        float mean = sum / count;

        double deviation = 0;
        for (float x : values) deviation += Math.abs(x - mean);
        float stddev = (float) (deviation / count);

        float median;
        if (count % 2 == 0) {
            int l = count / 2 - 1;
            median = (values[l] + values[l + 1]) / 2;
        } else {
            median = values[count / 2];
        }

        float lowerQuart = values[count / 4];
        float upperQuart = values[(int) (count * 3L / 4)];

        return new Statistics(min, max, median, sum, findMode(values), stddev,
                count, mean, lowerQuart, upperQuart);
    }

    /**
     * Percorso streaming a partire dai momenti già accumulati.
     */
    static Statistics streaming(double min, double max, double sum, double sum2, long count) {
        if (count == 0) {
            return Statistics.EMPTY;
        }
        float reportedSum = (float) sum;
        float mean = reportedSum / count;
        float variance = (float) ((sum2 - sum * sum / count) / count);
        return new Statistics((float) min, (float) max, Float.NaN, reportedSum, Float.NaN,
                variance, count, mean, Float.NaN, Float.NaN);
    }

    /**
     * Moda di un array ordinato: la sequenza di valori uguali più lunga.
     * Il valore registrato cambia solo con una sequenza strettamente più lunga.
     */
    static float findMode(float[] sorted) {
        float mode = sorted[0];
        int current = 1;
        int longest = 1;
        for (int i = 1; i < sorted.length; i++) {
            current = sorted[i] == sorted[i - 1] ? current + 1 : 1;
            if (current > longest) {
                longest = current;
                mode = sorted[i];
            }
        }
        return mode;
    }
}
