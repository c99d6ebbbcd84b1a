package org.carball.lca.analyzer;

import org.carball.lca.calculator.CalculationContext;
import org.carball.lca.calculator.ResolvedMaterial;
import org.carball.lca.model.result.CircularityClass;
import org.carball.lca.model.result.CircularityMetrics;

/**
 * Material Circularity Indicator: a weighted blend of recycled content, recyclability and lifetime.
 */
public class CircularityAnalyzer {

    private static final double RECYCLED_CONTENT_WEIGHT = 0.4;
    private static final double RECYCLABILITY_WEIGHT = 0.3;
    private static final double LIFETIME_WEIGHT = 0.3;

    public CircularityMetrics analyze(CalculationContext context) {
        double totalMass = context.totalMassKg();
        if (totalMass <= 0) {
            return CircularityMetrics.linearZero();
        }

        double recycledContent = 0.0;
        double recyclability = 0.0;
        for (ResolvedMaterial material : context.resolvedMaterials()) {
            recycledContent += material.massKg() * material.recycledContent();
            recyclability += material.massKg() * material.record().recyclabilityRate();
        }
        recycledContent /= totalMass;
        recyclability /= totalMass;

        double ceiling = context.config().getLifetimeCeilingYears();
        double lifetimeScore = ceiling > 0
                ? Math.min(context.specification().lifetimeYears() / ceiling, 1.0)
                : 1.0;

        double mci = RECYCLED_CONTENT_WEIGHT * recycledContent
                + RECYCLABILITY_WEIGHT * recyclability
                + LIFETIME_WEIGHT * lifetimeScore;
        mci = Math.max(0.0, Math.min(mci, 1.0));

        return new CircularityMetrics(mci, recycledContent, recyclability, lifetimeScore,
                CircularityClass.fromIndicator(mci));
    }
}
