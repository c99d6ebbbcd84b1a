package org.carball.lca.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.lca.calculator.CalculationContext;
import org.carball.lca.calculator.PhasePipeline;
import org.carball.lca.model.product.EndOfLifeScenario;
import org.carball.lca.model.product.MaterialEntry;
import org.carball.lca.model.product.ProcessEntry;
import org.carball.lca.model.product.ProductSpecification;
import org.carball.lca.model.product.TransportLeg;
import org.carball.lca.model.product.UseScenario;
import org.carball.lca.model.result.ParameterSensitivity;
import org.carball.lca.model.result.ParameterVariation;
import org.carball.lca.model.result.SensitivityParameter;
import org.carball.lca.model.result.SensitivityReport;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.DoubleUnaryOperator;
import java.util.stream.Collectors;

/**
 * One-at-a-time sensitivity: each parameter is scaled by -20 %, -10 %, +10 % and +20 %
 * (clamped to its valid range) and total carbon is recomputed.
 */
@Slf4j
public class SensitivityAnalyzer {

    static final double[] VARIATIONS = {-0.2, -0.1, 0.1, 0.2};

    private static final double MIN_EFFICIENCY = 1e-6;

    public SensitivityReport analyze(CalculationContext baseline,
                                     PhasePipeline pipeline,
                                     List<SensitivityParameter> parameters) {
        List<SensitivityParameter> selected = parameters == null || parameters.isEmpty()
                ? Arrays.asList(SensitivityParameter.values())
                : parameters;

        double baselineCarbon = pipeline.totalCarbon(baseline);
        ProductSpecification spec = baseline.specification();
        Map<SensitivityParameter, ParameterSensitivity> results = new EnumMap<>(SensitivityParameter.class);

        for (SensitivityParameter parameter : selected) {
            List<ParameterVariation> variations = new ArrayList<>();
            for (double variation : VARIATIONS) {
                ProductSpecification modified = vary(spec, parameter, variation);
                double carbon = pipeline.totalCarbon(baseline.withSpecification(modified));
                double change = carbon - baselineCarbon;
                double changePercent = baselineCarbon != 0 ? change / Math.abs(baselineCarbon) * 100.0 : 0.0;
                variations.add(new ParameterVariation(variation * 100.0, carbon, changePercent, change));
            }

            double index = variations.stream()
                    .mapToDouble(v -> Math.abs(v.carbonChangePercent()))
                    .average()
                    .orElse(0.0);

            results.put(parameter, new ParameterSensitivity(parameter, baselineValue(spec, parameter), variations, index));
            log.debug("Sensitivity of {}: {}", parameter, index);
        }

        return new SensitivityReport(spec.productId(), baselineCarbon, Collections.unmodifiableMap(results));
    }

    ProductSpecification vary(ProductSpecification spec, SensitivityParameter parameter, double variation) {
        DoubleUnaryOperator scale = value -> value * (1.0 + variation);
        switch (parameter) {
            case MATERIAL_MASS:
                return spec.toBuilder().clearMaterials().materials(spec.materials().stream()
                        .map(m -> new MaterialEntry(m.materialId(), scale.applyAsDouble(m.massKg()), m.recycledContent()))
                        .collect(Collectors.toList())).build();
            case RECYCLED_CONTENT:
                return spec.toBuilder().clearMaterials().materials(spec.materials().stream()
                        .map(m -> new MaterialEntry(m.materialId(), m.massKg(), clamp(scale.applyAsDouble(m.recycledContent()), 0.0, 1.0)))
                        .collect(Collectors.toList())).build();
            case PROCESS_EFFICIENCY:
                return spec.toBuilder().clearProcesses().processes(spec.processes().stream()
                        .map(p -> new ProcessEntry(p.processId(), clamp(scale.applyAsDouble(p.efficiency()), MIN_EFFICIENCY, 1.0), p.technologyLevel()))
                        .collect(Collectors.toList())).build();
            case TRANSPORT_DISTANCE:
                return spec.toBuilder().clearTransportLegs().transportLegs(spec.transportLegs().stream()
                        .map(l -> new TransportLeg(l.modeId(), scale.applyAsDouble(l.distanceKm()), l.loadFactor()))
                        .collect(Collectors.toList())).build();
            case USE_FREQUENCY:
                return spec.toBuilder().clearUseScenarios().useScenarios(spec.useScenarios().stream()
                        .map(u -> new UseScenario(u.type(), scale.applyAsDouble(u.frequencyPerYear()), u.energyKwhPerUse(),
                                u.waterLPerUse(), u.considerGridDecarbonization()))
                        .collect(Collectors.toList())).build();
            case USE_ENERGY:
                return spec.toBuilder().clearUseScenarios().useScenarios(spec.useScenarios().stream()
                        .map(u -> new UseScenario(u.type(), u.frequencyPerYear(), scale.applyAsDouble(u.energyKwhPerUse()),
                                u.waterLPerUse(), u.considerGridDecarbonization()))
                        .collect(Collectors.toList())).build();
            case RECYCLING_RATE:
                return spec.toBuilder().endOfLife(varyRecyclingRate(spec.endOfLife(), variation)).build();
            default:
                throw new IllegalArgumentException("Unsupported sensitivity parameter: " + parameter);
        }
    }

    /**
     * Scales the recycling rate and hands the remainder to incineration and landfill in their
     * original proportion, so the split still sums to 1.
     */
    static EndOfLifeScenario varyRecyclingRate(EndOfLifeScenario eol, double variation) {
        double recycling = clamp(eol.recyclingRate() * (1.0 + variation), 0.0, 1.0);
        double remainder = 1.0 - recycling;
        double others = eol.incinerationRate() + eol.landfillRate();
        double incineration = others > 0 ? remainder * eol.incinerationRate() / others : 0.0;
        return new EndOfLifeScenario(recycling, incineration, remainder - incineration, eol.energyRecoveryEfficiency());
    }

    static double baselineValue(ProductSpecification spec, SensitivityParameter parameter) {
        switch (parameter) {
            case MATERIAL_MASS:
                return spec.declaredMassKg();
            case RECYCLED_CONTENT:
                double mass = spec.declaredMassKg();
                return mass > 0
                        ? spec.materials().stream().mapToDouble(m -> m.massKg() * m.recycledContent()).sum() / mass
                        : 0.0;
            case PROCESS_EFFICIENCY:
                return spec.processes().stream().mapToDouble(ProcessEntry::efficiency).average().orElse(0.0);
            case TRANSPORT_DISTANCE:
                return spec.transportLegs().stream().mapToDouble(TransportLeg::distanceKm).sum();
            case USE_FREQUENCY:
                return spec.useScenarios().stream().mapToDouble(UseScenario::frequencyPerYear).sum();
            case USE_ENERGY:
                return spec.useScenarios().stream().mapToDouble(UseScenario::energyKwhPerUse).sum();
            case RECYCLING_RATE:
                return spec.endOfLife().recyclingRate();
            default:
                return 0.0;
        }
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
