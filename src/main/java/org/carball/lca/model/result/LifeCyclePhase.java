package org.carball.lca.model.result;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

public enum LifeCyclePhase {
    MATERIAL("material", List.of(
            "Switch to lower-impact materials",
            "Increase recycled content",
            "Reduce material mass")),
    MANUFACTURING("manufacturing", List.of(
            "Improve process efficiency",
            "Switch to renewable energy",
            "Optimize production planning")),
    TRANSPORT("transport", List.of(
            "Optimize logistics",
            "Switch to low-carbon transport",
            "Reduce transportation distance")),
    USE("use", List.of(
            "Reduce energy use per cycle",
            "Design for lower water consumption")),
    END_OF_LIFE("end_of_life", List.of(
            "Design for disassembly",
            "Set up take-back and recycling"));

    private final String key;
    private final List<String> improvementLevers;

    LifeCyclePhase(String key, List<String> improvementLevers) {
        this.key = key;
        this.improvementLevers = improvementLevers;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    public List<String> getImprovementLevers() {
        return improvementLevers;
    }

    @Override
    public String toString() {
        return key;
    }
}
