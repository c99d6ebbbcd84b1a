package org.carball.lca.model.result;

/**
 * Totals expressed as a fraction of one person's yearly footprint.
 */
public record NormalizedImpacts(
        double carbon,
        double energy,
        double water
) {}
