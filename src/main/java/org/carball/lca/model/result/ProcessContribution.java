package org.carball.lca.model.result;

import org.carball.lca.model.product.TechnologyLevel;

public record ProcessContribution(
        String processId,
        double efficiency,
        TechnologyLevel technologyLevel,
        double energyKwh,
        double energyMj,
        double directCarbonKgCo2e,
        double gridCarbonKgCo2e,
        double waterL,
        double scrapKg
) implements PhaseDetail {

    @Override
    public String label() {
        return processId;
    }

    @Override
    public double carbonKgCo2e() {
        return directCarbonKgCo2e + gridCarbonKgCo2e;
    }
}
