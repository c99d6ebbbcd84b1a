package org.carball.lca.calculator;

import org.carball.lca.config.EngineConfig;
import org.carball.lca.model.result.DataQualityWarning;
import org.carball.lca.model.result.LifeCyclePhase;
import org.carball.lca.model.result.NormalizedImpacts;
import org.carball.lca.model.result.PhaseResult;
import org.carball.lca.model.result.Totals;

import java.util.List;
import java.util.Map;

/**
 * Sums the phase results. Phases are visited in life-cycle order so the sum is
 * reproducible bit for bit.
 */
public class TotalsAggregator {

    private final EngineConfig config;

    public TotalsAggregator() {
        this(EngineConfig.defaults());
    }

    public TotalsAggregator(EngineConfig config) {
        this.config = config;
    }

    public Totals aggregate(Map<LifeCyclePhase, PhaseResult> phases, double totalMassKg) {
        double carbon = 0.0;
        double energy = 0.0;
        double water = 0.0;
        double cost = 0.0;

        for (LifeCyclePhase phase : LifeCyclePhase.values()) {
            PhaseResult result = phases.get(phase);
            if (result == null) {
                continue;
            }
            carbon += result.carbonKgCo2e();
            energy += result.energyMj();
            water += result.waterL();
            cost += result.costOrZero();
        }

        // zero mass only guards the denominator; the reported mass stays zero
        double denominator = totalMassKg > 0 ? totalMassKg : 1.0;
        return new Totals(carbon, energy, water, cost, totalMassKg, carbon / denominator, energy / denominator,
                normalize(carbon, energy, water));
    }

    NormalizedImpacts normalize(double carbon, double energy, double water) {
        return new NormalizedImpacts(
                carbon / config.getCarbonPerCapitaKgCo2e(),
                energy / config.getEnergyPerCapitaMj(),
                water / config.getWaterPerCapitaL());
    }

    public List<DataQualityWarning> warningsFor(Totals totals) {
        if (totals.massKg() > 0) {
            return List.of();
        }
        return List.of(DataQualityWarning.degenerateInput("mass_kg",
                "Total resolved material mass is zero; per-kg intensities use a denominator of 1"));
    }
}
