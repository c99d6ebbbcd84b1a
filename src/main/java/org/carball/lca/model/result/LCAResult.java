package org.carball.lca.model.result;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Value
@Builder(toBuilder = true)
public class LCAResult {
    String productId;
    String productName;
    Instant timestamp;
    Map<LifeCyclePhase, PhaseResult> phases;
    Totals totals;
    UncertaintyReport uncertainty;
    CircularityMetrics circularity;
    List<Hotspot> hotspots;
    ImprovementPotential improvementPotential;
    CalculationMetadata metadata;

    public PhaseResult phase(LifeCyclePhase phase) {
        return phases.get(phase);
    }

    public List<DataQualityWarning> warnings() {
        return metadata.dataQuality().warnings();
    }
}
