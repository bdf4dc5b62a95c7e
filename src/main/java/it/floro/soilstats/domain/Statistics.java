package it.floro.soilstats.domain;

/**
 * Record con le statistiche descrittive calcolate per una feature.
 *
 * Nota sul campo stddev: nel percorso esatto contiene la deviazione media assoluta
 * dalla media, nel percorso streaming la varianza. Il nome è mantenuto per
 * compatibilità con il formato JSON esistente.
 */
public record Statistics(
        float min,                          // Valore minimo
        float max,                          // Valore massimo
        float median,                       // Mediana (NaN nel percorso streaming)
        float sum,                          // Somma dei valori
        float mode,                         // Moda (NaN nel percorso streaming)
        float stddev,                       // Dispersione, vedi nota sopra
        long count,                         // Numero di celle valide aggregate
        float mean,                         // Media = sum / count
        float lowerQuart,                   // Elemento in posizione floor(n/4)
        float upperQuart                    // Elemento in posizione floor(3n/4)
) {

    /**
     * Sentinella "nessun campione utilizzabile": tutti i campi NaN, count = 0.
     */
    public static final Statistics EMPTY = new Statistics(
            Float.NaN, Float.NaN, Float.NaN, Float.NaN, Float.NaN,
            Float.NaN, 0, Float.NaN, Float.NaN, Float.NaN);

    public boolean isEmpty() {
        return count == 0;
    }
}
