package org.carball.lca.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.lca.calculator.CalculationContext;
import org.carball.lca.calculator.ResolvedMaterial;
import org.carball.lca.config.EngineConfig;
import org.carball.lca.model.product.ProductSpecification;
import org.carball.lca.model.product.TransportLeg;
import org.carball.lca.model.reference.MaterialRecord;
import org.carball.lca.model.reference.RegionalGridRecord;
import org.carball.lca.model.reference.TransportModeRecord;
import org.carball.lca.model.result.ImprovementPotential;
import org.carball.lca.model.result.MaterialSubstitution;
import org.carball.lca.model.result.SubstituteSuggestion;
import org.carball.lca.reference.ReferenceDataProvider;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Material substitution search and rule-based recommendations.
 */
@Slf4j
public class ImprovementOptimizer {

    private static final int MAX_SUGGESTIONS = 5;

    public ImprovementPotential analyze(CalculationContext context) {
        EngineConfig config = context.config();
        double current = 0.0;
        double best = 0.0;
        List<MaterialSubstitution> substitutions = new ArrayList<>();

        for (ResolvedMaterial material : context.resolvedMaterials()) {
            MaterialRecord original = material.record();
            double mass = material.massKg();
            MaterialRecord chosen = bestSubstitute(context.reference(), original, config.getSubstituteStrengthFloor())
                    .filter(candidate -> candidate.carbonKgCo2ePerKg() < original.carbonKgCo2ePerKg())
                    .orElse(original);

            double currentCarbon = mass * original.carbonKgCo2ePerKg();
            double chosenCarbon = mass * chosen.carbonKgCo2ePerKg();
            current += currentCarbon;
            best += chosenCarbon;

            substitutions.add(new MaterialSubstitution(original.id(), chosen.id(), mass, currentCarbon, chosenCarbon,
                    ratio(chosen.mechanicalStrengthMpa(), original.mechanicalStrengthMpa()),
                    percentChange(chosen.priceUsdPerKg(), original.priceUsdPerKg())));

            if (chosen != original) {
                log.debug("Substitute for {}: {} ({} -> {} kgCO2e)", original.id(), chosen.id(), currentCarbon, chosenCarbon);
            }
        }

        double reduction = current > 0 ? (current - best) / current * 100.0 : 0.0;
        double savings = (current - best) / 1000.0 * config.getCarbonPriceUsdPerTonne();

        return new ImprovementPotential(current, best, reduction, savings, substitutions, recommendations(context));
    }

    /**
     * Lowest-carbon catalog material, other than the original, that keeps at least
     * {@code strengthFloor} of its mechanical strength.
     */
    Optional<MaterialRecord> bestSubstitute(ReferenceDataProvider reference, MaterialRecord original, double strengthFloor) {
        double minimumStrength = original.mechanicalStrengthMpa() * strengthFloor;
        return reference.allMaterials().stream()
                .filter(candidate -> !candidate.id().equals(original.id()))
                .filter(candidate -> candidate.mechanicalStrengthMpa() >= minimumStrength)
                .min(Comparator.comparingDouble(MaterialRecord::carbonKgCo2ePerKg));
    }

    /**
     * Catalog materials that cut the carbon factor of {@code materialId} by at least the target, best first.
     */
    public List<SubstituteSuggestion> suggestSubstitutes(ReferenceDataProvider reference,
                                                         String materialId,
                                                         double targetReductionPercent) {
        Optional<MaterialRecord> found = reference.getMaterial(materialId);
        if (found.isEmpty()) {
            log.warn("Cannot suggest substitutes for unknown material '{}'", materialId);
            return List.of();
        }
        MaterialRecord current = found.get();
        if (current.carbonKgCo2ePerKg() <= 0) {
            return List.of();
        }

        return reference.allMaterials().stream()
                .filter(candidate -> !candidate.id().equals(materialId))
                .map(candidate -> new SubstituteSuggestion(
                        candidate.id(),
                        candidate.name(),
                        reductionPercent(current.carbonKgCo2ePerKg(), candidate.carbonKgCo2ePerKg()),
                        percentChange(candidate.priceUsdPerKg(), current.priceUsdPerKg()),
                        percentChange(candidate.mechanicalStrengthMpa(), current.mechanicalStrengthMpa())))
                .filter(suggestion -> suggestion.carbonReductionPercent() >= targetReductionPercent)
                .sorted(Comparator.comparingDouble(SubstituteSuggestion::carbonReductionPercent).reversed())
                .limit(MAX_SUGGESTIONS)
                .collect(Collectors.toList());
    }

    List<String> recommendations(CalculationContext context) {
        EngineConfig config = context.config();
        ProductSpecification spec = context.specification();
        Set<String> recommendations = new LinkedHashSet<>();

        for (ResolvedMaterial material : context.resolvedMaterials()) {
            if (material.recycledContent() < config.getRecycledContentTarget()) {
                recommendations.add(String.format("Increase recycled content in %s to at least %.0f%%",
                        material.materialId(), config.getRecycledContentTarget() * 100));
            }
        }

        if (!spec.processes().isEmpty()) {
            RegionalGridRecord grid = context.reference().getRegionalFactor(spec.manufacturingRegion());
            if (grid.carbonGCo2ePerKwh() >= config.getHighCarbonGridThreshold()) {
                recommendations.add("Consider manufacturing in regions with cleaner electricity grid");
            }
        }

        for (TransportLeg leg : spec.transportLegs()) {
            Optional<TransportModeRecord> mode = context.reference().getTransportMode(leg.modeId());
            if (mode.isPresent() && mode.get().carbonGCo2ePerTonneKm() >= config.getHighCarbonTransportThreshold()) {
                recommendations.add("Avoid " + leg.modeId().toLowerCase(Locale.ROOT) + " for high-volume products");
            }
        }

        if (spec.lifetimeYears() < config.getMinimumLifetimeYears()) {
            recommendations.add("Increase product lifetime through better design and materials");
        }

        return recommendations.stream()
                .limit(config.getMaxRecommendations())
                .collect(Collectors.toList());
    }

    private static double ratio(double value, double base) {
        return base > 0 ? value / base : 1.0;
    }

    private static double percentChange(double value, double base) {
        return base != 0 ? (value - base) / base * 100.0 : 0.0;
    }

    private static double reductionPercent(double current, double candidate) {
        return current != 0 ? (current - candidate) / current * 100.0 : 0.0;
    }
}
