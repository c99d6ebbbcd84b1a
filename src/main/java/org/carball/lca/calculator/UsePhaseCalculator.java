package org.carball.lca.calculator;

import lombok.extern.slf4j.Slf4j;
import org.carball.lca.config.EngineConfig;
import org.carball.lca.model.product.UseScenario;
import org.carball.lca.model.result.LifeCyclePhase;
import org.carball.lca.model.result.PhaseDetail;
import org.carball.lca.model.result.PhaseResult;
import org.carball.lca.model.result.UseScenarioContribution;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Energy and water consumed while the product is in service.
 */
@Slf4j
public class UsePhaseCalculator implements PhaseCalculator {

    @Override
    public LifeCyclePhase phase() {
        return LifeCyclePhase.USE;
    }

    @Override
    public PhaseResult calculate(CalculationContext context) {
        EngineConfig config = context.config();
        int lifetime = context.specification().lifetimeYears();
        List<PhaseDetail> details = new ArrayList<>();

        double carbon = 0.0;
        double energy = 0.0;
        double water = 0.0;
        double uses = 0.0;

        for (UseScenario scenario : context.specification().useScenarios()) {
            double totalUses = scenario.frequencyPerYear() * lifetime;
            double totalKwh = totalUses * scenario.energyKwhPerUse();
            double scenarioCarbon = scenario.considerGridDecarbonization()
                    ? decarbonizingGridCarbon(totalUses, scenario.energyKwhPerUse(), lifetime, config)
                    : totalKwh * config.getUseGridCarbonKgPerKwh();
            double scenarioEnergy = totalKwh * ManufacturingPhaseCalculator.MJ_PER_KWH;
            double scenarioWater = totalUses * scenario.waterLPerUse();

            details.add(new UseScenarioContribution(scenario.type(), totalUses,
                    scenario.considerGridDecarbonization(), scenarioCarbon, scenarioEnergy, scenarioWater));

            carbon += scenarioCarbon;
            energy += scenarioEnergy;
            water += scenarioWater;
            uses += totalUses;

            log.debug("Use scenario {}: {} uses, {} kgCO2e", scenario.type(), totalUses, scenarioCarbon);
        }

        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put("total_uses", uses);
        metrics.put("lifetime_years", (double) lifetime);
        metrics.put("energy_kwh", energy / ManufacturingPhaseCalculator.MJ_PER_KWH);

        return new PhaseResult(LifeCyclePhase.USE, carbon, energy, water, null,
                details, metrics, Map.of(), List.of());
    }

    /**
     * Year-by-year integration with a grid factor that shrinks by a fixed rate each year.
     */
    static double decarbonizingGridCarbon(double totalUses, double kwhPerUse, int lifetime, EngineConfig config) {
        double usesPerYear = totalUses / lifetime;
        double factor = config.getUseGridCarbonKgPerKwh();
        double retained = 1.0 - config.getGridDecarbonizationRate();
        double carbon = 0.0;
        for (int year = 0; year < lifetime; year++) {
            carbon += usesPerYear * kwhPerUse * factor;
            factor *= retained;
        }
        return carbon;
    }
}
