package org.carball.lca.model.result;

public record ConfidenceInterval(double levelPercent, double lower, double upper) {

    public double width() {
        return upper - lower;
    }

    public boolean contains(double value) {
        return value >= lower && value <= upper;
    }
}
