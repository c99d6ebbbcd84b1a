package org.carball.lca.model.reference;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

@Builder
public record ProcessRecord(
        @JsonProperty("id") String id,
        @JsonProperty("energy_kwh_kg") double energyKwhPerKg,
        @JsonProperty("carbon_kgco2e_kg") double carbonKgCo2ePerKg,
        @JsonProperty("scrap_rate") double scrapRate,
        @JsonProperty("water_l_kg") double waterLPerKg
) {}
