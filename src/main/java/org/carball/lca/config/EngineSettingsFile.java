package org.carball.lca.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.Data;

import java.io.IOException;
import java.nio.file.Path;

/**
 * YAML settings file. Only the keys present in the file override the configuration.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class EngineSettingsFile {

    @JsonProperty("monte_carlo_trials")
    private Integer monteCarloTrials;

    @JsonProperty("random_seed")
    private Long randomSeed;

    @JsonProperty("parallel_trials")
    private Boolean parallelTrials;

    @JsonProperty("relative_std")
    private Double relativeStd;

    @JsonProperty("use_grid_carbon_kg_per_kwh")
    private Double useGridCarbonKgPerKwh;

    @JsonProperty("grid_decarbonization_rate")
    private Double gridDecarbonizationRate;

    // End-of-life
    @JsonProperty("recycling_credit_kgco2e_per_kg")
    private Double recyclingCreditKgCo2ePerKg;

    @JsonProperty("incineration_kgco2e_per_kg")
    private Double incinerationKgCo2ePerKg;

    @JsonProperty("landfill_kgco2e_per_kg")
    private Double landfillKgCo2ePerKg;

    // Hotspots and recommendations
    @JsonProperty("hotspot_threshold_percent")
    private Double hotspotThresholdPercent;

    @JsonProperty("max_hotspots")
    private Integer maxHotspots;

    @JsonProperty("substitute_strength_floor")
    private Double substituteStrengthFloor;

    @JsonProperty("recycled_content_target")
    private Double recycledContentTarget;

    @JsonProperty("carbon_price_usd_per_tonne")
    private Double carbonPriceUsdPerTonne;

    public static EngineSettingsFile load(Path path) throws IOException {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(path.toFile(), EngineSettingsFile.class);
    }

    public void applyTo(EngineConfig.EngineConfigBuilder builder) {
        if (monteCarloTrials != null) builder.monteCarloTrials(monteCarloTrials);
        if (randomSeed != null) builder.randomSeed(randomSeed);
        if (parallelTrials != null) builder.parallelTrials(parallelTrials);
        if (relativeStd != null) {
            builder.processRelativeStd(relativeStd).transportRelativeStd(relativeStd);
        }
        if (useGridCarbonKgPerKwh != null) builder.useGridCarbonKgPerKwh(useGridCarbonKgPerKwh);
        if (gridDecarbonizationRate != null) builder.gridDecarbonizationRate(gridDecarbonizationRate);
        if (recyclingCreditKgCo2ePerKg != null) builder.recyclingCreditKgCo2ePerKg(recyclingCreditKgCo2ePerKg);
        if (incinerationKgCo2ePerKg != null) builder.incinerationKgCo2ePerKg(incinerationKgCo2ePerKg);
        if (landfillKgCo2ePerKg != null) builder.landfillKgCo2ePerKg(landfillKgCo2ePerKg);
        if (hotspotThresholdPercent != null) builder.hotspotThresholdPercent(hotspotThresholdPercent);
        if (maxHotspots != null) builder.maxHotspots(maxHotspots);
        if (substituteStrengthFloor != null) builder.substituteStrengthFloor(substituteStrengthFloor);
        if (recycledContentTarget != null) builder.recycledContentTarget(recycledContentTarget);
        if (carbonPriceUsdPerTonne != null) builder.carbonPriceUsdPerTonne(carbonPriceUsdPerTonne);
    }

    public String getDescription() {
        return String.format("Settings: trials=%s, seed=%s, relativeStd=%s, gridFactor=%s, maxHotspots=%s",
                monteCarloTrials, randomSeed, relativeStd, useGridCarbonKgPerKwh, maxHotspots);
    }
}
