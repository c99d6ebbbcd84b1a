package org.carball.lca.config;

import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

/**
 * Tunable factors and analysis settings for one engine instance.
 */
@Data
@Builder(toBuilder = true)
@Slf4j
public class EngineConfig {

    // Recycled-content discounts (fraction of the virgin factor still charged)
    @Builder.Default
    private double recycledCarbonDiscount = 0.3;

    @Builder.Default
    private double recycledEnergyDiscount = 0.4;

    @Builder.Default
    private double recycledWaterDiscount = 0.2;

    @Builder.Default
    private double recycledCostDiscount = 0.8;

    // Use phase
    @Builder.Default
    private double useGridCarbonKgPerKwh = 0.475;

    @Builder.Default
    private double gridDecarbonizationRate = 0.02;

    // End-of-life factors, expressed as magnitudes
    @Builder.Default
    private double recyclingCreditKgCo2ePerKg = 1.5;

    @Builder.Default
    private double recyclingEnergyCreditMjPerKg = 5.0;

    @Builder.Default
    private double incinerationKgCo2ePerKg = 0.5;

    @Builder.Default
    private double incinerationEnergyRecoveryMjPerKg = 10.0;

    @Builder.Default
    private double landfillKgCo2ePerKg = 0.1;

    @Builder.Default
    private double recoveryPotentialMjPerKg = 20.0;

    @Builder.Default
    private double avoidedVirginMaterialRatio = 0.8;

    // Monte Carlo
    @Builder.Default
    private int monteCarloTrials = 1000;

    @Builder.Default
    private long randomSeed = 42L;

    @Builder.Default
    private boolean perturbManufacturing = true;

    @Builder.Default
    private boolean perturbTransport = true;

    @Builder.Default
    private double processRelativeStd = 0.1;

    @Builder.Default
    private double transportRelativeStd = 0.1;

    @Builder.Default
    private boolean parallelTrials = true;

    // Hotspots and improvement rules
    @Builder.Default
    private double hotspotThresholdPercent = 10.0;

    @Builder.Default
    private int maxHotspots = 5;

    @Builder.Default
    private double substituteStrengthFloor = 0.8;

    @Builder.Default
    private double recycledContentTarget = 0.3;

    @Builder.Default
    private double minimumLifetimeYears = 3.0;

    @Builder.Default
    private double highCarbonGridThreshold = 600.0;

    @Builder.Default
    private double highCarbonTransportThreshold = 300.0;

    @Builder.Default
    private int maxRecommendations = 5;

    @Builder.Default
    private double lifetimeCeilingYears = 10.0;

    @Builder.Default
    private double carbonPriceUsdPerTonne = 50.0;

    // Yearly per-capita references for normalized totals
    @Builder.Default
    private double carbonPerCapitaKgCo2e = 5000.0;

    @Builder.Default
    private double energyPerCapitaMj = 80000.0;

    @Builder.Default
    private double waterPerCapitaL = 1_500_000.0;

    // Profile information
    @Builder.Default
    private String profileName = "standard";

    @Builder.Default
    private String profileDescription = "Standard screening LCA settings";

    public static EngineConfig defaults() {
        return EngineConfig.builder()
                .profileName("standard")
                .profileDescription("Standard screening LCA settings")
                .build();
    }

    /**
     * Hotspot lists are capped at five entries whatever the configured value.
     */
    public int effectiveMaxHotspots() {
        return Math.max(0, Math.min(maxHotspots, 5));
    }

    /**
     * Validates the configuration and logs warnings for values that will produce odd results.
     * Never throws; the engine clamps where a value would otherwise break a calculation.
     */
    public void validate() {
        warnIfOutsideUnitRange("Recycled carbon discount", recycledCarbonDiscount);
        warnIfOutsideUnitRange("Recycled energy discount", recycledEnergyDiscount);
        warnIfOutsideUnitRange("Recycled water discount", recycledWaterDiscount);
        warnIfOutsideUnitRange("Recycled cost discount", recycledCostDiscount);
        warnIfOutsideUnitRange("Grid decarbonization rate", gridDecarbonizationRate);

        if (useGridCarbonKgPerKwh < 0) {
            log.warn("Use-phase grid factor ({}) should not be negative", useGridCarbonKgPerKwh);
        }

        if (monteCarloTrials < 0) {
            log.warn("Monte Carlo trials ({}) should not be negative; uncertainty analysis will be skipped",
                    monteCarloTrials);
        } else if (monteCarloTrials > 0 && monteCarloTrials < 100) {
            log.warn("Monte Carlo trials ({}) is low; percentiles will be unstable", monteCarloTrials);
        }

        if (processRelativeStd < 0 || transportRelativeStd < 0) {
            log.warn("Relative perturbation std should not be negative (process: {}, transport: {})",
                    processRelativeStd, transportRelativeStd);
        }

        if (maxHotspots > 5) {
            log.warn("Max hotspots ({}) exceeds the limit of 5; the list will be capped", maxHotspots);
        } else if (maxHotspots < 3) {
            log.warn("Max hotspots ({}) is below the usual minimum of 3", maxHotspots);
        }

        if (hotspotThresholdPercent < 0 || hotspotThresholdPercent >= 100) {
            log.warn("Hotspot threshold ({}%) should be between 0 and 100", hotspotThresholdPercent);
        }

        warnIfOutsideUnitRange("Substitute strength floor", substituteStrengthFloor);

        if (lifetimeCeilingYears <= 0) {
            log.warn("Lifetime ceiling ({}) should be positive", lifetimeCeilingYears);
        }

        if (carbonPriceUsdPerTonne < 0) {
            log.warn("Carbon price ({}) should not be negative", carbonPriceUsdPerTonne);
        }

        if (carbonPerCapitaKgCo2e <= 0 || energyPerCapitaMj <= 0 || waterPerCapitaL <= 0) {
            log.warn("Per-capita references should be positive (carbon: {}, energy: {}, water: {})",
                    carbonPerCapitaKgCo2e, energyPerCapitaMj, waterPerCapitaL);
        }

        log.debug("Using config - Trials: {}, Seed: {}, Grid: {}, Profile: {}",
                monteCarloTrials, randomSeed, useGridCarbonKgPerKwh, profileName);
    }

    private static void warnIfOutsideUnitRange(String label, double value) {
        if (value < 0 || value > 1) {
            log.warn("{} ({}) should be between 0 and 1", label, value);
        }
    }

    /**
     * Returns a description of the current configuration for user feedback.
     */
    public String getConfigurationSummary() {
        return String.format("Profile: %s | Trials: %d | Seed: %d | Grid: %.3f kg/kWh | Max hotspots: %d | Carbon price: %.0f USD/t",
                profileName, monteCarloTrials, randomSeed, useGridCarbonKgPerKwh, maxHotspots, carbonPriceUsdPerTonne);
    }
}
