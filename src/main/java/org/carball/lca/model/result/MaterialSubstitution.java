package org.carball.lca.model.result;

/**
 * Best feasible substitute for one material entry. When nothing beats the original,
 * {@code substituteId} equals {@code materialId} and both carbon figures match.
 */
public record MaterialSubstitution(
        String materialId,
        String substituteId,
        double massKg,
        double currentCarbonKgCo2e,
        double substituteCarbonKgCo2e,
        double strengthRatio,
        double costChangePercent
) {

    public boolean isImprovement() {
        return !materialId.equals(substituteId);
    }

    public double savingKgCo2e() {
        return currentCarbonKgCo2e - substituteCarbonKgCo2e;
    }
}
