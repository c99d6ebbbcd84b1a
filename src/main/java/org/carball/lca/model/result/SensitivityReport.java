package org.carball.lca.model.result;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public record SensitivityReport(String productId, double baselineCarbonKgCo2e, Map<SensitivityParameter, ParameterSensitivity> parameters) {

    public ParameterSensitivity get(SensitivityParameter parameter) {
        return parameters.get(parameter);
    }

    public List<ParameterSensitivity> ranked() {
        return parameters.values().stream()
                .sorted(Comparator.comparingDouble(ParameterSensitivity::sensitivityIndex).reversed())
                .collect(Collectors.toList());
    }
}
