package org.carball.lca.config;

import lombok.Getter;

@Getter
public enum AnalysisProfile {

    SCREENING("screening", "Quick screening - fewer trials, top hotspots only",
            500, 0.1, 15.0, 3),

    STANDARD("standard", "Standard screening LCA settings",
            1000, 0.1, 10.0, 5),

    DETAILED("detailed", "Detailed assessment - high trial count for stable percentiles",
            10000, 0.1, 10.0, 5),

    CONSERVATIVE("conservative", "Conservative assessment - wider process uncertainty, stricter rules",
            10000, 0.2, 5.0, 5) {
        @Override
        public EngineConfig buildConfig() {
            EngineConfig base = super.buildConfig();
            return base.toBuilder()
                    .recycledContentTarget(0.5) // Push harder on recycled content
                    .highCarbonGridThreshold(450.0) // Flag grids above the global average
                    .minimumLifetimeYears(5.0)
                    .build();
        }
    };

    private final String name;
    private final String description;
    private final int monteCarloTrials;
    private final double relativeStd;
    private final double hotspotThresholdPercent;
    private final int maxHotspots;

    AnalysisProfile(String name, String description,
                    int monteCarloTrials, double relativeStd,
                    double hotspotThresholdPercent, int maxHotspots) {
        this.name = name;
        this.description = description;
        this.monteCarloTrials = monteCarloTrials;
        this.relativeStd = relativeStd;
        this.hotspotThresholdPercent = hotspotThresholdPercent;
        this.maxHotspots = maxHotspots;
    }

    /**
     * Creates an EngineConfig based on this profile's settings.
     */
    public EngineConfig buildConfig() {
        return EngineConfig.builder()
                .profileName(name)
                .profileDescription(description)
                .monteCarloTrials(monteCarloTrials)
                .processRelativeStd(relativeStd)
                .transportRelativeStd(relativeStd)
                .hotspotThresholdPercent(hotspotThresholdPercent)
                .maxHotspots(maxHotspots)
                .build();
    }

    /**
     * Finds profile by name (case-insensitive).
     */
    public static AnalysisProfile fromName(String name) {
        for (AnalysisProfile profile : values()) {
            if (profile.getName().equalsIgnoreCase(name)) {
                return profile;
            }
        }
        throw new IllegalArgumentException("Unknown analysis profile: " + name +
                ". Available profiles: " + getAvailableProfiles());
    }

    public static String getAvailableProfiles() {
        StringBuilder sb = new StringBuilder();
        for (AnalysisProfile profile : values()) {
            if (!sb.isEmpty()) sb.append(", ");
            sb.append(profile.getName());
        }
        return sb.toString();
    }

    public static String getProfileHelp() {
        StringBuilder help = new StringBuilder();
        help.append("Available Analysis Profiles:\n\n");
        for (AnalysisProfile profile : values()) {
            help.append(String.format("  %-15s %s (%d trials)\n",
                    profile.getName(), profile.getDescription(), profile.getMonteCarloTrials()));
        }
        help.append("\nUse --profile <name> to select a profile.\n");
        return help.toString();
    }
}
