package it.floro.soilstats.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Configurazione del motore di statistiche zonali (prefisso "soilstats").
 *
 * Esempio application.properties:
 * <pre>
 * soilstats.data-dir=/data/POLARIS
 * soilstats.timeout=30s
 * soilstats.parallelism=4
 * </pre>
 */
@ConfigurationProperties(prefix = "soilstats")
public record ZonalStatsProperties(
        @DefaultValue("data") Path dataDir,             // Radice dei raster; i percorsi richiesti non possono uscirne
        @DefaultValue({"alpha", "bd", "clay", "hb", "ksat", "lambda", "n", "om", "ph",
                "sand", "silt", "theta_r", "theta_s"})
        List<String> soilLayers,                        // Layer di suolo interrogabili
        @DefaultValue("0") int defaultBand,             // Banda letta se la richiesta non la specifica
        @DefaultValue("30s") Duration timeout,          // Tempo massimo per join, 0 = illimitato
        @DefaultValue("5000000") int exactThreshold,    // Soglia tra percorso esatto e streaming
        @DefaultValue("1") int parallelism              // 1 = join sequenziale, >1 = thread per raster
) {}
