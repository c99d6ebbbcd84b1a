package org.carball.lca.model.result;

public enum HotspotSignificance {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW;

    public static HotspotSignificance fromPercentage(double percentage) {
        if (percentage > 50) return CRITICAL;
        if (percentage > 30) return HIGH;
        if (percentage > 15) return MEDIUM;
        return LOW;
    }
}
