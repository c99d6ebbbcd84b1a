package org.carball.lca.model.result;

import java.util.List;

public record Hotspot(
        LifeCyclePhase phase,
        double carbonKgCo2e,
        double percentage,
        HotspotSignificance significance,
        List<String> improvementLevers
) {}
