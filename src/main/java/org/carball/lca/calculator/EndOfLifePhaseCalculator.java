package org.carball.lca.calculator;

import org.carball.lca.config.EngineConfig;
import org.carball.lca.model.product.EndOfLifeScenario;
import org.carball.lca.model.result.EndOfLifeRoute;
import org.carball.lca.model.result.LifeCyclePhase;
import org.carball.lca.model.result.PhaseDetail;
import org.carball.lca.model.result.PhaseResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Disposal split across recycling, incineration and landfill. Recycling and energy
 * recovery are credited, so the net carbon of this phase is often negative.
 */
public class EndOfLifePhaseCalculator implements PhaseCalculator {

    @Override
    public LifeCyclePhase phase() {
        return LifeCyclePhase.END_OF_LIFE;
    }

    @Override
    public PhaseResult calculate(CalculationContext context) {
        EngineConfig config = context.config();
        EndOfLifeScenario eol = context.specification().endOfLife();
        double totalMass = context.totalMassKg();

        double recycledMass = totalMass * eol.recyclingRate();
        double incineratedMass = totalMass * eol.incinerationRate();
        double landfilledMass = totalMass * eol.landfillRate();

        EndOfLifeRoute recycling = new EndOfLifeRoute(EndOfLifeRoute.RECYCLING, recycledMass,
                -recycledMass * config.getRecyclingCreditKgCo2ePerKg(),
                -recycledMass * config.getRecyclingEnergyCreditMjPerKg());
        EndOfLifeRoute incineration = new EndOfLifeRoute(EndOfLifeRoute.INCINERATION, incineratedMass,
                incineratedMass * config.getIncinerationKgCo2ePerKg(),
                -incineratedMass * config.getIncinerationEnergyRecoveryMjPerKg() * eol.energyRecoveryEfficiency());
        EndOfLifeRoute landfill = new EndOfLifeRoute(EndOfLifeRoute.LANDFILL, landfilledMass,
                landfilledMass * config.getLandfillKgCo2ePerKg(), 0.0);

        List<PhaseDetail> routes = List.of(recycling, incineration, landfill);
        double carbon = recycling.carbonKgCo2e() + incineration.carbonKgCo2e() + landfill.carbonKgCo2e();
        double energy = recycling.energyMj() + incineration.energyMj() + landfill.energyMj();

        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put("recycled_mass_kg", recycledMass);
        metrics.put("incinerated_mass_kg", incineratedMass);
        metrics.put("landfilled_mass_kg", landfilledMass);
        metrics.put("material_recovery_potential_mj", totalMass * config.getRecoveryPotentialMjPerKg());
        metrics.put("energy_recovery_mj", -incineration.energyMj());
        metrics.put("avoided_virgin_material_kg", recycledMass * config.getAvoidedVirginMaterialRatio());

        Map<String, Double> split = new LinkedHashMap<>();
        split.put(EndOfLifeRoute.RECYCLING, eol.recyclingRate());
        split.put(EndOfLifeRoute.INCINERATION, eol.incinerationRate());
        split.put(EndOfLifeRoute.LANDFILL, eol.landfillRate());

        return new PhaseResult(LifeCyclePhase.END_OF_LIFE, carbon, energy, 0.0, null,
                routes, metrics, split, List.of());
    }
}
