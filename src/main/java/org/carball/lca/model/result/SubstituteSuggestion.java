package org.carball.lca.model.result;

public record SubstituteSuggestion(
        String materialId,
        String name,
        double carbonReductionPercent,
        double costChangePercent,
        double strengthChangePercent
) {}
