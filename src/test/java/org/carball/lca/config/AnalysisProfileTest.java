package org.carball.lca.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnalysisProfileTest {

    @Test
    void shouldBuildStandardProfileMatchingDefaults() {
        // When
        EngineConfig config = AnalysisProfile.STANDARD.buildConfig();

        // Then
        EngineConfig defaults = EngineConfig.defaults();
        assertThat(config.getMonteCarloTrials()).isEqualTo(defaults.getMonteCarloTrials());
        assertThat(config.getMaxHotspots()).isEqualTo(defaults.getMaxHotspots());
        assertThat(config.getHotspotThresholdPercent()).isEqualTo(defaults.getHotspotThresholdPercent());
        assertThat(config.getProfileName()).isEqualTo("standard");
    }

    @Test
    void shouldUseTenThousandTrialsForDetailedProfile() {
        // When
        EngineConfig config = AnalysisProfile.DETAILED.buildConfig();

        // Then
        assertThat(config.getMonteCarloTrials()).isEqualTo(10000);
        assertThat(config.getProfileName()).isEqualTo("detailed");
    }

    @Test
    void shouldApplyConservativeOverrides() {
        // When
        EngineConfig config = AnalysisProfile.CONSERVATIVE.buildConfig();

        // Then
        assertThat(config.getProcessRelativeStd()).isEqualTo(0.2);
        assertThat(config.getTransportRelativeStd()).isEqualTo(0.2);
        assertThat(config.getRecycledContentTarget()).isEqualTo(0.5);
        assertThat(config.getHighCarbonGridThreshold()).isEqualTo(450.0);
        assertThat(config.getMinimumLifetimeYears()).isEqualTo(5.0);
    }

    @Test
    void shouldKeepScreeningHotspotsWithinLimits() {
        // When
        EngineConfig config = AnalysisProfile.SCREENING.buildConfig();

        // Then
        assertThat(config.getMaxHotspots()).isBetween(3, 5);
        assertThat(config.getMonteCarloTrials()).isEqualTo(500);
    }

    @Test
    void shouldFindProfileByNameIgnoringCase() {
        assertThat(AnalysisProfile.fromName("Detailed")).isEqualTo(AnalysisProfile.DETAILED);
        assertThat(AnalysisProfile.fromName("SCREENING")).isEqualTo(AnalysisProfile.SCREENING);
    }

    @Test
    void shouldRejectUnknownProfile() {
        assertThatThrownBy(() -> AnalysisProfile.fromName("extreme"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown analysis profile: extreme")
                .hasMessageContaining("screening, standard, detailed, conservative");
    }

    @Test
    void shouldListEveryProfileInHelp() {
        String help = AnalysisProfile.getProfileHelp();

        for (AnalysisProfile profile : AnalysisProfile.values()) {
            assertThat(help).contains(profile.getName());
        }
    }
}
