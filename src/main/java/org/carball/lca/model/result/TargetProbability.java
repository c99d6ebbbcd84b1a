package org.carball.lca.model.result;

public record TargetProbability(String target, double targetValue, double probabilityPercent) {

    public boolean meetsTarget() {
        return probabilityPercent >= 50.0;
    }
}
