package org.carball.lca.model.result;

/**
 * A recoverable problem met during a calculation. The calculation carried on; the
 * caller decides whether to surface it.
 */
public record DataQualityWarning(WarningType type, String reference, String message) {

    public static DataQualityWarning materialNotFound(String materialId) {
        return new DataQualityWarning(WarningType.MATERIAL_NOT_FOUND, materialId,
                "Material '" + materialId + "' not found in reference catalog; entry skipped");
    }

    public static DataQualityWarning processNotFound(String processId) {
        return new DataQualityWarning(WarningType.PROCESS_NOT_FOUND, processId,
                "Process '" + processId + "' not found in reference catalog; step skipped");
    }

    public static DataQualityWarning transportModeNotFound(String modeId) {
        return new DataQualityWarning(WarningType.TRANSPORT_MODE_NOT_FOUND, modeId,
                "Transport mode '" + modeId + "' not found in reference catalog; leg skipped");
    }

    public static DataQualityWarning regionFallback(String requested, String used) {
        return new DataQualityWarning(WarningType.REGION_FALLBACK, requested,
                "Region '" + requested + "' not found; using '" + used + "' grid factor");
    }

    public static DataQualityWarning degenerateInput(String reference, String message) {
        return new DataQualityWarning(WarningType.DEGENERATE_INPUT, reference, message);
    }

    public static DataQualityWarning negativeSamplesClamped(long count) {
        return new DataQualityWarning(WarningType.NEGATIVE_SAMPLE_CLAMPED, "monte_carlo",
                count + " negative samples clamped to zero during uncertainty analysis");
    }
}
