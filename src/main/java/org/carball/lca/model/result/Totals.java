package org.carball.lca.model.result;

public record Totals(
        double carbonKgCo2e,
        double energyMj,
        double waterL,
        double costUsd,
        double massKg,
        double carbonPerKg,
        double energyPerKg,
        NormalizedImpacts normalized
) {}
