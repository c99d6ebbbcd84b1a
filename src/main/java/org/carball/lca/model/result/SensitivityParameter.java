package org.carball.lca.model.result;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SensitivityParameter {
    MATERIAL_MASS("material_mass"),
    RECYCLED_CONTENT("recycled_content"),
    PROCESS_EFFICIENCY("process_efficiency"),
    TRANSPORT_DISTANCE("transport_distance"),
    USE_FREQUENCY("use_frequency"),
    USE_ENERGY("use_energy"),
    RECYCLING_RATE("recycling_rate");

    private final String key;

    SensitivityParameter(String key) {
        this.key = key;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    public static SensitivityParameter fromKey(String key) {
        for (SensitivityParameter parameter : values()) {
            if (parameter.key.equalsIgnoreCase(key) || parameter.name().equalsIgnoreCase(key)) {
                return parameter;
            }
        }
        throw new IllegalArgumentException("Unknown sensitivity parameter: " + key);
    }

    @Override
    public String toString() {
        return key;
    }
}
