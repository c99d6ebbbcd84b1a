package org.carball.lca.model.reference;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RegionalGridRecord(
        @JsonProperty("region") String region,
        @JsonProperty("carbon_gco2e_kwh") double carbonGCo2ePerKwh,
        @JsonProperty("renewable_share") double renewableShare
) {

    public static final String GLOBAL_AVERAGE = "Global Average";

    public static RegionalGridRecord globalAverage() {
        return new RegionalGridRecord(GLOBAL_AVERAGE, 475.0, 0.25);
    }

    public double carbonKgPerKwh() {
        return carbonGCo2ePerKwh / 1000.0;
    }
}
