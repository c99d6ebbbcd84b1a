package org.carball.lca.model.result;

public record DistributionStats(
        double mean,
        double median,
        double std,
        double coefficientOfVariation,
        double skewness,
        double kurtosis,
        double min,
        double max,
        double range
) {}
