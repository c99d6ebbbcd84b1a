package org.carball.lca.model.reference;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

/**
 * Catalog entry for a material. Mean/std pairs parameterize the normal
 * distributions sampled by the uncertainty analysis.
 */
@Builder(toBuilder = true)
public record MaterialRecord(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("category") String category,
        @JsonProperty("density_kg_m3") double densityKgM3,
        @JsonProperty("embodied_energy_mj_kg") double embodiedEnergyMjPerKg,
        @JsonProperty("embodied_energy_std") double embodiedEnergyStd,
        @JsonProperty("carbon_kgco2e_kg") double carbonKgCo2ePerKg,
        @JsonProperty("carbon_std") double carbonStd,
        @JsonProperty("water_l_kg") double waterLPerKg,
        @JsonProperty("recyclability_rate") double recyclabilityRate,
        @JsonProperty("recycled_content_potential") double recycledContentPotential,
        @JsonProperty("price_usd_kg") double priceUsdPerKg,
        @JsonProperty("mechanical_strength_mpa") double mechanicalStrengthMpa
) {}
