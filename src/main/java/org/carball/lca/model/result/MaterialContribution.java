package org.carball.lca.model.result;

public record MaterialContribution(
        String materialId,
        double massKg,
        double recycledContent,
        double carbonKgCo2e,
        double energyMj,
        double waterL,
        double costUsd,
        double allocationFactor,
        double allocatedCarbonKgCo2e
) implements PhaseDetail {

    @Override
    public String label() {
        return materialId;
    }
}
