package org.carball.lca.model.product;

import com.fasterxml.jackson.annotation.JsonProperty;

public record MaterialEntry(
        @JsonProperty("material_id") String materialId,
        @JsonProperty("mass_kg") double massKg,
        @JsonProperty("recycled_content") double recycledContent
) {

    public static MaterialEntry virgin(String materialId, double massKg) {
        return new MaterialEntry(materialId, massKg, 0.0);
    }
}
