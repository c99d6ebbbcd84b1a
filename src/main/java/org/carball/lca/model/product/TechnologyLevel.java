package org.carball.lca.model.product;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Equipment generation of a manufacturing step. The multiplier scales the
 * energy drawn by the step before it is converted to grid carbon.
 */
public enum TechnologyLevel {
    BASIC("basic", 1.2),
    AVERAGE("average", 1.0),
    ADVANCED("advanced", 0.8),
    STATE_OF_ART("state_of_art", 0.6);

    private final String name;
    private final double energyMultiplier;

    TechnologyLevel(String name, double energyMultiplier) {
        this.name = name;
        this.energyMultiplier = energyMultiplier;
    }

    @JsonValue
    public String getName() {
        return name;
    }

    public double getEnergyMultiplier() {
        return energyMultiplier;
    }

    @JsonCreator
    public static TechnologyLevel fromName(String name) {
        if (name == null) {
            return AVERAGE;
        }
        for (TechnologyLevel level : values()) {
            if (level.name.equalsIgnoreCase(name) || level.name().equalsIgnoreCase(name)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown technology level: " + name);
    }
}
