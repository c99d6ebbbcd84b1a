package org.carball.lca.model.result;

import java.util.List;

/**
 * @param sensitivityIndex mean absolute percentage change of total carbon over all variations
 */
public record ParameterSensitivity(
        SensitivityParameter parameter,
        double baselineValue,
        List<ParameterVariation> variations,
        double sensitivityIndex
) {}
