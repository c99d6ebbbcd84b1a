package org.carball.lca.model.result;

public record ScenarioSummary(
        String productId,
        String productName,
        double carbonKgCo2e,
        double energyMj,
        double costUsd,
        double circularityIndicator,
        double reductionPotentialPercent
) {}
