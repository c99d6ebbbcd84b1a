package org.carball.lca.model.product;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Split of the product mass across end-of-life routes. The three rates must sum to 1;
 * that is checked by the validator, not here, so that callers get a complete list of violations.
 */
public record EndOfLifeScenario(
        @JsonProperty("recycling_rate") double recyclingRate,
        @JsonProperty("incineration_rate") double incinerationRate,
        @JsonProperty("landfill_rate") double landfillRate,
        @JsonProperty("energy_recovery_efficiency") Double energyRecoveryEfficiency
) {

    public static final double DEFAULT_ENERGY_RECOVERY_EFFICIENCY = 0.8;

    public EndOfLifeScenario {
        if (energyRecoveryEfficiency == null) {
            energyRecoveryEfficiency = DEFAULT_ENERGY_RECOVERY_EFFICIENCY;
        }
    }

    public static EndOfLifeScenario of(double recyclingRate, double incinerationRate, double landfillRate) {
        return new EndOfLifeScenario(recyclingRate, incinerationRate, landfillRate, DEFAULT_ENERGY_RECOVERY_EFFICIENCY);
    }

    /**
     * Landfill takes whatever recycling and incineration leave.
     */
    public static EndOfLifeScenario withLandfillRemainder(double recyclingRate, double incinerationRate) {
        return of(recyclingRate, incinerationRate, 1.0 - recyclingRate - incinerationRate);
    }

    public static EndOfLifeScenario defaults() {
        return of(0.7, 0.2, 0.1);
    }

    public double rateSum() {
        return recyclingRate + incinerationRate + landfillRate;
    }
}
