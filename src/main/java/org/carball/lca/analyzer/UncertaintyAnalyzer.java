package org.carball.lca.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.lca.calculator.CalculationContext;
import org.carball.lca.calculator.MaterialPhaseCalculator;
import org.carball.lca.calculator.ResolvedMaterial;
import org.carball.lca.config.EngineConfig;
import org.carball.lca.model.reference.MaterialRecord;
import org.carball.lca.model.result.LifeCyclePhase;
import org.carball.lca.model.result.PhaseDetail;
import org.carball.lca.model.result.PhaseResult;
import org.carball.lca.model.result.SensitivityIndex;
import org.carball.lca.model.result.TargetProbability;
import org.carball.lca.model.result.UncertaintyReport;

import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.IntStream;

/**
 * Monte Carlo propagation of the material factor uncertainty, plus optional multiplicative
 * noise on manufacturing and transport. Each trial owns a generator seeded from
 * (base seed, trial index), so results do not depend on how trials are scheduled.
 */
@Slf4j
public class UncertaintyAnalyzer {

    static final double[] CONFIDENCE_LEVELS = {90.0, 95.0, 99.0};

    public static final String CARBON_NEUTRAL = "carbon_neutral";
    public static final String SCIENCE_BASED_TARGET = "science_based_target";
    public static final String INDUSTRY_AVERAGE = "industry_average";
    public static final String REGULATORY_LIMIT = "regulatory_limit";

    public UncertaintyReport analyze(CalculationContext context,
                                     Map<LifeCyclePhase, PhaseResult> phases,
                                     int trials,
                                     long seed) {
        if (trials < 1) {
            throw new IllegalArgumentException("Monte Carlo trials must be at least 1, got " + trials);
        }
        EngineConfig config = context.config();
        TrialModel model = new TrialModel(context, phases);

        double[] carbon = new double[trials];
        double[] energy = new double[trials];
        long[] clamps = new long[trials];

        log.debug("Running {} Monte Carlo trials (seed {}, parallel: {})", trials, seed, config.isParallelTrials());

        IntStream indices = IntStream.range(0, trials);
        if (config.isParallelTrials()) {
            indices = indices.parallel();
        }
        indices.forEach(i -> {
            Random random = new Random(trialSeed(seed, i));
            double[] outcome = model.run(random, config);
            carbon[i] = outcome[0];
            energy[i] = outcome[1];
            clamps[i] = (long) outcome[2];
        });

        long clamped = 0;
        for (long c : clamps) {
            clamped += c;
        }
        if (clamped > 0) {
            log.warn("{} negative samples clamped to zero across {} trials", clamped, trials);
        }

        double[] sortedCarbon = DistributionStatistics.sorted(carbon);
        double[] sortedEnergy = DistributionStatistics.sorted(energy);

        UncertaintyReport.UncertaintyReportBuilder report = UncertaintyReport.builder()
                .trials(trials)
                .seed(seed)
                .carbonStats(DistributionStatistics.describe(carbon))
                .energyStats(DistributionStatistics.describe(energy))
                .clampedSamples(clamped)
                .carbonSamples(carbon)
                .energySamples(energy);

        for (double level : CONFIDENCE_LEVELS) {
            report.carbonInterval(DistributionStatistics.confidenceInterval(sortedCarbon, level));
            report.energyInterval(DistributionStatistics.confidenceInterval(sortedEnergy, level));
        }

        double totalMass = context.totalMassKg();
        for (ResolvedMaterial material : context.resolvedMaterials()) {
            double share = totalMass > 0 ? material.massKg() / totalMass : 0.0;
            report.sensitivityIndex(new SensitivityIndex("material_mass", material.materialId(), share, share * 100.0));
        }

        report.targetProbability(target(CARBON_NEUTRAL, 0.0, carbon));
        report.targetProbability(target(SCIENCE_BASED_TARGET, DistributionStatistics.percentile(sortedCarbon, 20), carbon));
        report.targetProbability(target(INDUSTRY_AVERAGE, DistributionStatistics.percentile(sortedCarbon, 50), carbon));
        report.targetProbability(target(REGULATORY_LIMIT, DistributionStatistics.percentile(sortedCarbon, 90), carbon));

        return report.build();
    }

    private static TargetProbability target(String name, double value, double[] samples) {
        return new TargetProbability(name, value, DistributionStatistics.probabilityAtOrBelow(samples, value));
    }

    /**
     * SplitMix64 finalizer over the base seed and trial index.
     */
    static long trialSeed(long baseSeed, int trialIndex) {
        long z = baseSeed + (trialIndex + 1L) * 0x9E3779B97F4A7C15L;
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }

    /**
     * The parts of a deterministic result a single trial needs, extracted once.
     */
    private static final class TrialModel {

        private final List<ResolvedMaterial> materials;
        private final double[] processCarbon;
        private final double[] processEnergy;
        private final double[] legCarbon;
        private final double[] legEnergy;
        private final double fixedCarbon;
        private final double fixedEnergy;

        TrialModel(CalculationContext context, Map<LifeCyclePhase, PhaseResult> phases) {
            this.materials = context.resolvedMaterials();

            List<PhaseDetail> processes = detailsOf(phases, LifeCyclePhase.MANUFACTURING);
            this.processCarbon = processes.stream().mapToDouble(PhaseDetail::carbonKgCo2e).toArray();
            this.processEnergy = processes.stream().mapToDouble(PhaseDetail::energyMj).toArray();

            List<PhaseDetail> legs = detailsOf(phases, LifeCyclePhase.TRANSPORT);
            this.legCarbon = legs.stream().mapToDouble(PhaseDetail::carbonKgCo2e).toArray();
            this.legEnergy = legs.stream().mapToDouble(PhaseDetail::energyMj).toArray();

            double carbon = 0.0;
            double energy = 0.0;
            for (LifeCyclePhase phase : List.of(LifeCyclePhase.USE, LifeCyclePhase.END_OF_LIFE)) {
                PhaseResult result = phases.get(phase);
                if (result != null) {
                    carbon += result.carbonKgCo2e();
                    energy += result.energyMj();
                }
            }
            this.fixedCarbon = carbon;
            this.fixedEnergy = energy;
        }

        private static List<PhaseDetail> detailsOf(Map<LifeCyclePhase, PhaseResult> phases, LifeCyclePhase phase) {
            PhaseResult result = phases.get(phase);
            return result == null ? List.of() : result.details();
        }

        /**
         * @return carbon, energy and the number of clamped draws
         */
        double[] run(Random random, EngineConfig config) {
            double carbon = fixedCarbon;
            double energy = fixedEnergy;
            int clamped = 0;

            for (ResolvedMaterial material : materials) {
                MaterialRecord record = material.record();

                double carbonFactor = record.carbonKgCo2ePerKg() + record.carbonStd() * random.nextGaussian();
                if (carbonFactor < 0) {
                    carbonFactor = 0.0;
                    clamped++;
                }
                double energyFactor = record.embodiedEnergyMjPerKg() + record.embodiedEnergyStd() * random.nextGaussian();
                if (energyFactor < 0) {
                    energyFactor = 0.0;
                    clamped++;
                }

                carbon += material.massKg() * carbonFactor
                        * MaterialPhaseCalculator.recycledMultiplier(material.recycledContent(), config.getRecycledCarbonDiscount());
                energy += material.massKg() * energyFactor
                        * MaterialPhaseCalculator.recycledMultiplier(material.recycledContent(), config.getRecycledEnergyDiscount());
            }

            for (int i = 0; i < processCarbon.length; i++) {
                double multiplier = 1.0;
                if (config.isPerturbManufacturing()) {
                    multiplier = 1.0 + config.getProcessRelativeStd() * random.nextGaussian();
                    if (multiplier < 0) {
                        multiplier = 0.0;
                        clamped++;
                    }
                }
                carbon += processCarbon[i] * multiplier;
                energy += processEnergy[i] * multiplier;
            }

            for (int i = 0; i < legCarbon.length; i++) {
                double multiplier = 1.0;
                if (config.isPerturbTransport()) {
                    multiplier = 1.0 + config.getTransportRelativeStd() * random.nextGaussian();
                    if (multiplier < 0) {
                        multiplier = 0.0;
                        clamped++;
                    }
                }
                carbon += legCarbon[i] * multiplier;
                energy += legEnergy[i] * multiplier;
            }

            return new double[]{carbon, energy, clamped};
        }
    }
}
