package org.carball.lca.model.result;

import java.util.List;

public record ScenarioComparison(
        List<ScenarioSummary> scenarios,
        double meanCarbonKgCo2e,
        double stdCarbonKgCo2e,
        double minCarbonKgCo2e,
        double maxCarbonKgCo2e,
        ScenarioSummary best,
        ScenarioSummary worst
) {

    public double rangeKgCo2e() {
        return maxCarbonKgCo2e - minCarbonKgCo2e;
    }
}
