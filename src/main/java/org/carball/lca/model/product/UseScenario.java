package org.carball.lca.model.product;

import com.fasterxml.jackson.annotation.JsonProperty;

public record UseScenario(
        @JsonProperty("type") String type,
        @JsonProperty("frequency_per_year") double frequencyPerYear,
        @JsonProperty("energy_kwh_per_use") double energyKwhPerUse,
        @JsonProperty("water_l_per_use") double waterLPerUse,
        @JsonProperty("consider_grid_decarbonization") boolean considerGridDecarbonization
) {

    public static UseScenario flat(String type, double frequencyPerYear, double energyKwhPerUse, double waterLPerUse) {
        return new UseScenario(type, frequencyPerYear, energyKwhPerUse, waterLPerUse, false);
    }
}
