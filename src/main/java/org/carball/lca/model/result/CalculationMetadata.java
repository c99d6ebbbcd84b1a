package org.carball.lca.model.result;

import org.carball.lca.model.product.AllocationMethod;

public record CalculationMetadata(
        String calculationMethod,
        AllocationMethod allocationMethod,
        String profileName,
        DataQualityReport dataQuality
) {}
