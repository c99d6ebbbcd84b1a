package org.carball.lca.model.result;

import java.util.List;

public record ImprovementPotential(
        double currentCarbonKgCo2e,
        double bestPotentialCarbonKgCo2e,
        double reductionPotentialPercent,
        double carbonCostSavingsUsd,
        List<MaterialSubstitution> substitutions,
        List<String> recommendations
) {

    public ImprovementPotential {
        substitutions = List.copyOf(substitutions);
        recommendations = List.copyOf(recommendations);
    }
}
