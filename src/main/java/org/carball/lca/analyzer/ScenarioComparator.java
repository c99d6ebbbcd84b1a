package org.carball.lca.analyzer;

import org.carball.lca.model.result.LCAResult;
import org.carball.lca.model.result.ScenarioComparison;
import org.carball.lca.model.result.ScenarioSummary;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Side-by-side summary of several calculated product variants.
 */
public class ScenarioComparator {

    public ScenarioComparison compare(List<LCAResult> results) {
        if (results.isEmpty()) {
            throw new IllegalArgumentException("At least one scenario is required for a comparison");
        }

        List<ScenarioSummary> scenarios = results.stream()
                .map(ScenarioComparator::summarize)
                .collect(Collectors.toList());

        double[] carbon = scenarios.stream().mapToDouble(ScenarioSummary::carbonKgCo2e).toArray();
        double mean = 0.0;
        for (double c : carbon) {
            mean += c;
        }
        mean /= carbon.length;
        double variance = 0.0;
        for (double c : carbon) {
            variance += (c - mean) * (c - mean);
        }
        double std = Math.sqrt(variance / carbon.length);

        // first wins on ties
        ScenarioSummary best = scenarios.stream().min(Comparator.comparingDouble(ScenarioSummary::carbonKgCo2e)).get();
        ScenarioSummary worst = scenarios.stream().max(Comparator.comparingDouble(ScenarioSummary::carbonKgCo2e)).get();

        return new ScenarioComparison(List.copyOf(scenarios), mean, std,
                best.carbonKgCo2e(), worst.carbonKgCo2e(), best, worst);
    }

    private static ScenarioSummary summarize(LCAResult result) {
        return new ScenarioSummary(
                result.getProductId(),
                result.getProductName(),
                result.getTotals().carbonKgCo2e(),
                result.getTotals().energyMj(),
                result.getTotals().costUsd(),
                result.getCircularity().materialCircularityIndicator(),
                result.getImprovementPotential().reductionPotentialPercent());
    }
}
