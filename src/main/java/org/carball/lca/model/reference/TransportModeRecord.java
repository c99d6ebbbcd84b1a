package org.carball.lca.model.reference;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

/**
 * Transport mode factors. Carbon is expressed in grams CO2e per tonne-km.
 */
@Builder
public record TransportModeRecord(
        @JsonProperty("id") String id,
        @JsonProperty("carbon_gco2e_tkm") double carbonGCo2ePerTonneKm,
        @JsonProperty("energy_mj_tkm") double energyMjPerTonneKm,
        @JsonProperty("cost_usd_tkm") double costUsdPerTonneKm
) {}
