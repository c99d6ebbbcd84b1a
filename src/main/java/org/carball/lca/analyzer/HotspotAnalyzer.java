package org.carball.lca.analyzer;

import org.carball.lca.config.EngineConfig;
import org.carball.lca.model.result.Hotspot;
import org.carball.lca.model.result.HotspotSignificance;
import org.carball.lca.model.result.LifeCyclePhase;
import org.carball.lca.model.result.PhaseResult;
import org.carball.lca.model.result.Totals;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public class HotspotAnalyzer {

    /**
     * Phases whose share of total carbon exceeds the configured threshold, largest first.
     * Empty when the total is not positive, since shares are meaningless then.
     */
    public List<Hotspot> analyze(Map<LifeCyclePhase, PhaseResult> phases, Totals totals, EngineConfig config) {
        double total = totals.carbonKgCo2e();
        if (total <= 0) {
            return List.of();
        }

        List<Hotspot> hotspots = new ArrayList<>();
        for (LifeCyclePhase phase : LifeCyclePhase.values()) {
            PhaseResult result = phases.get(phase);
            if (result == null) {
                continue;
            }
            double percentage = result.carbonKgCo2e() / total * 100.0;
            if (percentage > config.getHotspotThresholdPercent()) {
                hotspots.add(new Hotspot(phase, result.carbonKgCo2e(), percentage,
                        HotspotSignificance.fromPercentage(percentage), phase.getImprovementLevers()));
            }
        }

        return hotspots.stream()
                .sorted(Comparator.comparingDouble(Hotspot::percentage).reversed())
                .limit(config.effectiveMaxHotspots())
                .collect(Collectors.toList());
    }
}
