package org.carball.lca.calculator;

import lombok.extern.slf4j.Slf4j;
import org.carball.lca.config.EngineConfig;
import org.carball.lca.model.product.AllocationMethod;
import org.carball.lca.model.result.LifeCyclePhase;
import org.carball.lca.model.result.MaterialContribution;
import org.carball.lca.model.result.PhaseDetail;
import org.carball.lca.model.result.PhaseResult;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw-material extraction and processing. Recycled content is charged at a discounted
 * fraction of the virgin factor, per impact category.
 */
@Slf4j
public class MaterialPhaseCalculator implements PhaseCalculator {

    @Override
    public LifeCyclePhase phase() {
        return LifeCyclePhase.MATERIAL;
    }

    @Override
    public PhaseResult calculate(CalculationContext context) {
        EngineConfig config = context.config();
        List<ResolvedMaterial> materials = context.resolvedMaterials();
        double[] factors = allocationFactors(materials, context.specification().allocationMethod());

        double carbon = 0.0;
        double energy = 0.0;
        double water = 0.0;
        double cost = 0.0;
        double recycledMass = 0.0;
        List<double[]> impacts = new ArrayList<>(materials.size());

        for (ResolvedMaterial material : materials) {
            double mass = material.massKg();
            double rc = material.recycledContent();

            double materialCarbon = mass * material.record().carbonKgCo2ePerKg()
                    * recycledMultiplier(rc, config.getRecycledCarbonDiscount());
            double materialEnergy = mass * material.record().embodiedEnergyMjPerKg()
                    * recycledMultiplier(rc, config.getRecycledEnergyDiscount());
            double materialWater = mass * material.record().waterLPerKg()
                    * recycledMultiplier(rc, config.getRecycledWaterDiscount());
            double materialCost = mass * material.record().priceUsdPerKg()
                    * recycledMultiplier(rc, config.getRecycledCostDiscount());

            impacts.add(new double[]{materialCarbon, materialEnergy, materialWater, materialCost});
            carbon += materialCarbon;
            energy += materialEnergy;
            water += materialWater;
            cost += materialCost;
            recycledMass += mass * rc;

            log.debug("Material {}: {} kg, {} kgCO2e", material.materialId(), mass, materialCarbon);
        }

        List<PhaseDetail> details = new ArrayList<>();
        Map<String, Double> distribution = new LinkedHashMap<>();
        for (int i = 0; i < materials.size(); i++) {
            ResolvedMaterial material = materials.get(i);
            double[] impact = impacts.get(i);
            details.add(new MaterialContribution(
                    material.materialId(),
                    material.massKg(),
                    material.recycledContent(),
                    impact[0], impact[1], impact[2], impact[3],
                    factors[i],
                    factors[i] * carbon));
            distribution.merge(material.materialId(), factors[i], Double::sum);
        }

        double totalMass = context.totalMassKg();
        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put("mass_kg", totalMass);
        metrics.put("recycled_mass_kg", recycledMass);
        metrics.put("recycled_content_share", totalMass > 0 ? recycledMass / totalMass : 0.0);
        metrics.put("material_count", (double) materials.size());

        return new PhaseResult(LifeCyclePhase.MATERIAL, carbon, energy, water, cost,
                details, metrics, distribution, context.materialWarnings());
    }

    /**
     * Fraction of the virgin factor charged for a material with the given recycled content.
     */
    public static double recycledMultiplier(double recycledContent, double discount) {
        return (1.0 - recycledContent) + recycledContent * discount;
    }

    /**
     * Allocation factors in the order of {@code materials}. They sum to 1 whenever at least one
     * material is present. Economic allocation falls back to mass when no material has a price,
     * and mass allocation to equal shares when every mass is zero.
     */
    static double[] allocationFactors(List<ResolvedMaterial> materials, AllocationMethod method) {
        int n = materials.size();
        double[] weights = new double[n];
        if (n == 0) {
            return weights;
        }

        double denominator = 0.0;
        if (method == AllocationMethod.ECONOMIC) {
            for (int i = 0; i < n; i++) {
                weights[i] = materials.get(i).massKg() * materials.get(i).record().priceUsdPerKg();
                denominator += weights[i];
            }
            if (denominator <= 0) {
                log.debug("Economic allocation denominator is zero, falling back to mass allocation");
            }
        }

        if (denominator <= 0) {
            denominator = 0.0;
            for (int i = 0; i < n; i++) {
                weights[i] = materials.get(i).massKg();
                denominator += weights[i];
            }
        }

        if (denominator <= 0) {
            Arrays.fill(weights, 1.0 / n);
            return weights;
        }

        for (int i = 0; i < n; i++) {
            weights[i] /= denominator;
        }
        return weights;
    }
}
