package org.carball.lca.model.product;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TransportLeg(
        @JsonProperty("mode_id") String modeId,
        @JsonProperty("distance_km") double distanceKm,
        @JsonProperty("load_factor") double loadFactor
) {}
