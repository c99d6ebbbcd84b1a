package org.carball.lca.model.result;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;

@Value
@Builder
public class UncertaintyReport {
    int trials;
    long seed;
    DistributionStats carbonStats;
    DistributionStats energyStats;
    @Singular("carbonInterval")
    List<ConfidenceInterval> carbonIntervals;
    @Singular("energyInterval")
    List<ConfidenceInterval> energyIntervals;
    @Singular("sensitivityIndex")
    List<SensitivityIndex> sensitivityIndices;
    @Singular("targetProbability")
    List<TargetProbability> targetProbabilities;
    long clampedSamples;

    // raw trial outputs, indexed by trial number
    @JsonIgnore
    double[] carbonSamples;
    @JsonIgnore
    double[] energySamples;

    public Optional<ConfidenceInterval> carbonInterval(double levelPercent) {
        return carbonIntervals.stream()
                .filter(ci -> Double.compare(ci.levelPercent(), levelPercent) == 0)
                .findFirst();
    }
}
