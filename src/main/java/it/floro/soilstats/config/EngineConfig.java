package it.floro.soilstats.config;

import it.floro.soilstats.engine.GridIndexer;
import it.floro.soilstats.engine.JoinDriver;
import it.floro.soilstats.engine.StatisticsAggregator;
import it.floro.soilstats.raster.RasterReaders;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wiring del motore di join: componenti stateless condivisi da tutte le richieste.
 */
@Configuration
@EnableConfigurationProperties(ZonalStatsProperties.class)
public class EngineConfig {

    private static final Logger logger = LoggerFactory.getLogger(EngineConfig.class);

    /**
     * Motore di join con la soglia del percorso esatto presa da soilstats.exact-threshold.
     */
    @Bean
    public JoinDriver joinDriver(ZonalStatsProperties properties) {
        logger.info("Motore statistiche zonali: soglia percorso esatto {} campioni, parallelismo {}",
                properties.exactThreshold(), properties.parallelism());
        return new JoinDriver(
                new GridIndexer(),
                new StatisticsAggregator(properties.exactThreshold()),
                RasterReaders::open);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
