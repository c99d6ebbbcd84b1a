package org.carball.lca.model.result;

/**
 * Mass-share proxy for the influence of one material on the result.
 */
public record SensitivityIndex(String parameter, String materialId, double index, double contributionPercent) {}
