package me.golemcore.discovery.infrastructure.config;

import me.golemcore.discovery.domain.model.ScoringWeights;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AutoConfigurationTest {

    @Test
    void shouldBuildDefaultScoringWeightsFromProperties() {
        ScoringWeights weights = new AutoConfiguration(new DiscoveryProperties()).scoringWeights();

        assertEquals(ScoringWeights.DEFAULT, weights);
    }

    @Test
    void shouldFailFastOnWeightsNotSummingToOne() {
        DiscoveryProperties properties = new DiscoveryProperties();
        properties.getRanking().getWeights().setCapability(0.9);
        AutoConfiguration configuration = new AutoConfiguration(properties);

        assertThrows(IllegalStateException.class, configuration::scoringWeights);
    }

    @Test
    void shouldExposeDocumentedDefaults() {
        DiscoveryProperties properties = new DiscoveryProperties();

        assertTrue(properties.getRegistry().isEnabled());
        assertTrue(properties.getRegistry().isLocalFilterFallback());
        assertEquals(10, properties.getRegistry().getTimeoutSeconds());
        assertEquals(5, properties.getRanking().getDefaultLimit());
        assertEquals(0.3, properties.getRanking().getDefaultMinScore());
    }
}
