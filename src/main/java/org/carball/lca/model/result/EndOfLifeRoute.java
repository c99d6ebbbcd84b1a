package org.carball.lca.model.result;

public record EndOfLifeRoute(
        String route,
        double massKg,
        double carbonKgCo2e,
        double energyMj
) implements PhaseDetail {

    public static final String RECYCLING = "recycling";
    public static final String INCINERATION = "incineration";
    public static final String LANDFILL = "landfill";

    @Override
    public String label() {
        return route;
    }
}
