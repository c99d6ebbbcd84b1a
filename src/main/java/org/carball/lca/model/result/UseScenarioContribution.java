package org.carball.lca.model.result;

public record UseScenarioContribution(
        String type,
        double totalUses,
        boolean dynamicGrid,
        double carbonKgCo2e,
        double energyMj,
        double waterL
) implements PhaseDetail {

    @Override
    public String label() {
        return type;
    }
}
