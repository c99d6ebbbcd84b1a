package org.carball.lca.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class EngineConfigTest {

    private ListAppender<ILoggingEvent> logAppender;
    private Logger logger;

    @BeforeEach
    void setUp() {
        logger = (Logger) LoggerFactory.getLogger(EngineConfig.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        logger.addAppender(logAppender);
        logger.setLevel(Level.DEBUG);
        logger.setAdditive(false);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(logAppender);
        logger.setAdditive(true);
    }

    @Test
    void shouldCreateDefaultConfig() {
        // When
        EngineConfig config = EngineConfig.defaults();

        // Then
        assertThat(config.getRecycledCarbonDiscount()).isEqualTo(0.3);
        assertThat(config.getRecycledEnergyDiscount()).isEqualTo(0.4);
        assertThat(config.getRecycledWaterDiscount()).isEqualTo(0.2);
        assertThat(config.getRecycledCostDiscount()).isEqualTo(0.8);
        assertThat(config.getUseGridCarbonKgPerKwh()).isEqualTo(0.475);
        assertThat(config.getGridDecarbonizationRate()).isEqualTo(0.02);
        assertThat(config.getMonteCarloTrials()).isEqualTo(1000);
        assertThat(config.getRandomSeed()).isEqualTo(42L);
        assertThat(config.getMaxHotspots()).isEqualTo(5);
        assertThat(config.getHotspotThresholdPercent()).isEqualTo(10.0);
        assertThat(config.getSubstituteStrengthFloor()).isEqualTo(0.8);
        assertThat(config.getCarbonPriceUsdPerTonne()).isEqualTo(50.0);
        assertThat(config.getProfileName()).isEqualTo("standard");
    }

    @Test
    void shouldOnlyLogDebugForValidConfig() {
        // Given
        EngineConfig config = EngineConfig.defaults();

        // When
        config.validate();

        // Then
        assertThat(logAppender.list).hasSize(1);
        assertThat(logAppender.list.get(0).getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    void shouldWarnWhenDiscountOutsideUnitRange() {
        // Given
        EngineConfig config = EngineConfig.builder()
                .recycledCarbonDiscount(1.5)
                .build();

        // When
        config.validate();

        // Then
        List<ILoggingEvent> logs = logAppender.list;
        assertThat(logs).hasSize(2);
        assertThat(logs).anyMatch(event -> event.getLevel() == Level.WARN
                && event.getFormattedMessage().contains("Recycled carbon discount (1.5) should be between 0 and 1"));
    }

    @Test
    void shouldWarnWhenMaxHotspotsAboveLimit() {
        // Given
        EngineConfig config = EngineConfig.builder().maxHotspots(8).build();

        // When
        config.validate();

        // Then
        assertThat(logAppender.list).anyMatch(event -> event.getLevel() == Level.WARN
                && event.getFormattedMessage().contains("exceeds the limit of 5"));
        assertThat(config.effectiveMaxHotspots()).isEqualTo(5);
    }

    @Test
    void shouldWarnWhenTrialCountIsLow() {
        // Given
        EngineConfig config = EngineConfig.builder().monteCarloTrials(20).build();

        // When
        config.validate();

        // Then
        assertThat(logAppender.list).anyMatch(event -> event.getLevel() == Level.WARN
                && event.getFormattedMessage().contains("Monte Carlo trials (20) is low"));
    }

    @Test
    void shouldIncludeKeySettingsInSummary() {
        // Given
        EngineConfig config = EngineConfig.builder()
                .profileName("custom")
                .monteCarloTrials(500)
                .randomSeed(7)
                .build();

        // When
        String summary = config.getConfigurationSummary();

        // Then
        assertThat(summary).contains("Profile: custom");
        assertThat(summary).contains("Trials: 500");
        assertThat(summary).contains("Seed: 7");
    }
}
