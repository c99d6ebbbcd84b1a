package org.carball.lca.model.result;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CircularityClass {
    HIGHLY_CIRCULAR("Highly Circular", 0.8),
    MODERATELY_CIRCULAR("Moderately Circular", 0.6),
    TRANSITIONAL("Transitional", 0.4),
    LINEAR("Linear", 0.0);

    private final String displayName;
    private final double minIndicator;

    CircularityClass(String displayName, double minIndicator) {
        this.displayName = displayName;
        this.minIndicator = minIndicator;
    }

    @JsonValue
    public String getDisplayName() {
        return displayName;
    }

    public static CircularityClass fromIndicator(double mci) {
        if (mci >= HIGHLY_CIRCULAR.minIndicator) {
            return HIGHLY_CIRCULAR;
        } else if (mci >= MODERATELY_CIRCULAR.minIndicator) {
            return MODERATELY_CIRCULAR;
        } else if (mci >= TRANSITIONAL.minIndicator) {
            return TRANSITIONAL;
        } else {
            return LINEAR;
        }
    }
}
