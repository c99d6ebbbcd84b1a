package org.carball.lca.model.product;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ProcessEntry(
        @JsonProperty("process_id") String processId,
        @JsonProperty("efficiency") double efficiency,
        @JsonProperty("technology_level") TechnologyLevel technologyLevel
) {

    public ProcessEntry {
        if (technologyLevel == null) {
            technologyLevel = TechnologyLevel.AVERAGE;
        }
    }

    public static ProcessEntry of(String processId, double efficiency) {
        return new ProcessEntry(processId, efficiency, TechnologyLevel.AVERAGE);
    }
}
