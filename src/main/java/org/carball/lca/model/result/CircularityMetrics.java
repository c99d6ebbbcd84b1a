package org.carball.lca.model.result;

public record CircularityMetrics(
        double materialCircularityIndicator,
        double recycledContentWeighted,
        double recyclabilityWeighted,
        double lifetimeScore,
        CircularityClass circularityClass
) {

    public static CircularityMetrics linearZero() {
        return new CircularityMetrics(0.0, 0.0, 0.0, 0.0, CircularityClass.LINEAR);
    }
}
