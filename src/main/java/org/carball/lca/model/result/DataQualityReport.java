package org.carball.lca.model.result;

import java.util.List;

public record DataQualityReport(List<DataQualityWarning> warnings, double completenessPercent) {

    public DataQualityReport {
        warnings = List.copyOf(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public long count(WarningType type) {
        return warnings.stream().filter(w -> w.type() == type).count();
    }
}
