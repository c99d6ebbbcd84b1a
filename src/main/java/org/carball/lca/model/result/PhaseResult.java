package org.carball.lca.model.result;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Impacts of one life-cycle phase.
 *
 * @param costUsd      null for phases that do not track cost
 * @param metrics      phase-specific scalar aggregates, e.g. {@code mass_kg}, {@code efficiency_score}
 * @param distribution named shares inside the phase: allocation factors per material, distance per transport mode
 */
public record PhaseResult(
        LifeCyclePhase phase,
        double carbonKgCo2e,
        double energyMj,
        double waterL,
        @JsonInclude(JsonInclude.Include.NON_NULL) Double costUsd,
        List<PhaseDetail> details,
        Map<String, Double> metrics,
        Map<String, Double> distribution,
        List<DataQualityWarning> warnings
) {

    public PhaseResult {
        details = List.copyOf(details);
        metrics = Collections.unmodifiableMap(new TreeMap<>(metrics));
        distribution = Collections.unmodifiableMap(new TreeMap<>(distribution));
        warnings = List.copyOf(warnings);
    }

    public double metric(String name) {
        return metrics.getOrDefault(name, 0.0);
    }

    public double costOrZero() {
        return costUsd == null ? 0.0 : costUsd;
    }

    public <T extends PhaseDetail> List<T> detailsOf(Class<T> type) {
        return details.stream().filter(type::isInstance).map(type::cast).collect(Collectors.toList());
    }
}
