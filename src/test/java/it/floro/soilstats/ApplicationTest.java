package it.floro.soilstats;

import it.floro.soilstats.config.ZonalStatsProperties;
import it.floro.soilstats.engine.JoinDriver;
import it.floro.soilstats.service.SoilLayerResolver;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {"soilstats.timeout=5s", "soilstats.exact-threshold=1000"})
public class ApplicationTest {

    @Autowired
    ZonalStatsProperties properties;

    @Autowired
    JoinDriver joinDriver;

    @Autowired
    SoilLayerResolver soilLayerResolver;

    @Test
    void testPropertiesBound() {
        assertNotNull(joinDriver);
        assertEquals(Duration.ofSeconds(5), properties.timeout());
        assertEquals(1000, properties.exactThreshold());
        assertEquals(1, properties.parallelism());
        assertTrue(soilLayerResolver.supportedLayers().contains("clay"));
        assertEquals(13, soilLayerResolver.supportedLayers().size());
    }
}
