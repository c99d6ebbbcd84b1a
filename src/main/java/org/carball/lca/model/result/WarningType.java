package org.carball.lca.model.result;

public enum WarningType {
    MATERIAL_NOT_FOUND,
    PROCESS_NOT_FOUND,
    TRANSPORT_MODE_NOT_FOUND,
    REGION_FALLBACK,
    DEGENERATE_INPUT,
    NEGATIVE_SAMPLE_CLAMPED
}
