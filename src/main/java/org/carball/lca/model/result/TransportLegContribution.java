package org.carball.lca.model.result;

public record TransportLegContribution(
        String modeId,
        double distanceKm,
        double loadFactor,
        double effectiveDistanceKm,
        double carbonKgCo2e,
        double energyMj,
        double costUsd
) implements PhaseDetail {

    @Override
    public String label() {
        return modeId;
    }
}
