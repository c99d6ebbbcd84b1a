package org.carball.lca.model.result;

public record ParameterVariation(double variationPercent, double carbonKgCo2e, double carbonChangePercent, double absoluteChangeKg) {}
