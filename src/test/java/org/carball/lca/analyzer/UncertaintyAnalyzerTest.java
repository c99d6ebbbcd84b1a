package org.carball.lca.analyzer;

import org.carball.lca.TestProducts;
import org.carball.lca.calculator.CalculationContext;
import org.carball.lca.calculator.PhasePipeline;
import org.carball.lca.config.EngineConfig;
import org.carball.lca.model.product.MaterialEntry;
import org.carball.lca.model.product.ProductSpecification;
import org.carball.lca.model.reference.MaterialRecord;
import org.carball.lca.model.result.ConfidenceInterval;
import org.carball.lca.model.result.LifeCyclePhase;
import org.carball.lca.model.result.PhaseResult;
import org.carball.lca.model.result.TargetProbability;
import org.carball.lca.model.result.UncertaintyReport;
import org.carball.lca.reference.ReferenceCatalog;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class UncertaintyAnalyzerTest {

    private final UncertaintyAnalyzer analyzer = new UncertaintyAnalyzer();

    @Test
    void shouldReproduceSamplesForSameSeed() {
        // Given
        CalculationContext context = context(TestProducts.simpleBottle(), EngineConfig.defaults());
        Map<LifeCyclePhase, PhaseResult> phases = new PhasePipeline().run(context);

        // When
        UncertaintyReport first = analyzer.analyze(context, phases, 500, 42L);
        UncertaintyReport second = analyzer.analyze(context, phases, 500, 42L);

        // Then
        assertThat(first.getCarbonSamples()).containsExactly(second.getCarbonSamples());
        assertThat(first.getEnergySamples()).containsExactly(second.getEnergySamples());
        assertThat(first.getCarbonStats()).isEqualTo(second.getCarbonStats());
    }

    @Test
    void shouldDifferForDifferentSeeds() {
        // Given
        CalculationContext context = context(TestProducts.simpleBottle(), EngineConfig.defaults());
        Map<LifeCyclePhase, PhaseResult> phases = new PhasePipeline().run(context);

        // When
        UncertaintyReport first = analyzer.analyze(context, phases, 200, 1L);
        UncertaintyReport second = analyzer.analyze(context, phases, 200, 2L);

        // Then
        assertThat(first.getCarbonStats().mean()).isNotEqualTo(second.getCarbonStats().mean());
    }

    @Test
    void shouldNotDependOnParallelScheduling() {
        // Given
        EngineConfig sequentialConfig = EngineConfig.builder().parallelTrials(false).build();
        EngineConfig parallelConfig = EngineConfig.builder().parallelTrials(true).build();
        CalculationContext sequential = context(TestProducts.twoMaterialProduct(), sequentialConfig);
        CalculationContext parallel = context(TestProducts.twoMaterialProduct(), parallelConfig);

        // When
        UncertaintyReport sequentialReport = analyzer.analyze(sequential, new PhasePipeline().run(sequential), 2000, 7L);
        UncertaintyReport parallelReport = analyzer.analyze(parallel, new PhasePipeline().run(parallel), 2000, 7L);

        // Then
        assertThat(parallelReport.getCarbonSamples()).containsExactly(sequentialReport.getCarbonSamples());
        assertThat(parallelReport.getCarbonStats()).isEqualTo(sequentialReport.getCarbonStats());
    }

    @Test
    void shouldCenterOnDeterministicResult() {
        // Given
        CalculationContext context = context(TestProducts.simpleBottle(), EngineConfig.defaults());
        Map<LifeCyclePhase, PhaseResult> phases = new PhasePipeline().run(context);

        // When
        UncertaintyReport report = analyzer.analyze(context, phases, 1000, 42L);

        // Then
        assertThat(report.getTrials()).isEqualTo(1000);
        assertThat(report.getSeed()).isEqualTo(42L);
        assertThat(report.getCarbonStats().mean()).isCloseTo(0.3087132, within(0.005));
        assertThat(report.getEnergyStats().mean()).isCloseTo(13.362, within(0.1));
        assertThat(report.getCarbonStats().std()).isPositive();
        assertThat(report.getClampedSamples()).isZero();
    }

    @Test
    void shouldNestConfidenceIntervals() {
        // Given
        CalculationContext context = context(TestProducts.simpleBottle(), EngineConfig.defaults());
        Map<LifeCyclePhase, PhaseResult> phases = new PhasePipeline().run(context);

        // When
        UncertaintyReport report = analyzer.analyze(context, phases, 1000, 42L);

        // Then
        ConfidenceInterval ci90 = report.carbonInterval(90).orElseThrow();
        ConfidenceInterval ci95 = report.carbonInterval(95).orElseThrow();
        ConfidenceInterval ci99 = report.carbonInterval(99).orElseThrow();
        assertThat(ci90.width()).isLessThanOrEqualTo(ci95.width());
        assertThat(ci95.width()).isLessThanOrEqualTo(ci99.width());
        assertThat(ci95.contains(report.getCarbonStats().median())).isTrue();
        assertThat(report.getEnergyIntervals()).hasSize(3);
    }

    @Test
    void shouldEvaluateTargetProbabilities() {
        // Given
        CalculationContext context = context(TestProducts.simpleBottle(), EngineConfig.defaults());
        Map<LifeCyclePhase, PhaseResult> phases = new PhasePipeline().run(context);

        // When
        UncertaintyReport report = analyzer.analyze(context, phases, 1000, 42L);

        // Then
        List<TargetProbability> targets = report.getTargetProbabilities();
        assertThat(targets).extracting(TargetProbability::target).containsExactly(
                UncertaintyAnalyzer.CARBON_NEUTRAL,
                UncertaintyAnalyzer.SCIENCE_BASED_TARGET,
                UncertaintyAnalyzer.INDUSTRY_AVERAGE,
                UncertaintyAnalyzer.REGULATORY_LIMIT);
        assertThat(targets.get(0).probabilityPercent()).isZero();
        assertThat(targets.get(1).probabilityPercent()).isCloseTo(20.0, within(0.5));
        assertThat(targets.get(2).probabilityPercent()).isCloseTo(50.0, within(0.5));
        assertThat(targets.get(3).probabilityPercent()).isCloseTo(90.0, within(0.5));
        assertThat(targets.get(3).meetsTarget()).isTrue();
    }

    @Test
    void shouldReportMassShareSensitivity() {
        // Given
        CalculationContext context = context(TestProducts.twoMaterialProduct(), EngineConfig.defaults());

        // When
        UncertaintyReport report = analyzer.analyze(context, new PhasePipeline().run(context), 100, 42L);

        // Then
        assertThat(report.getSensitivityIndices()).hasSize(2);
        assertThat(report.getSensitivityIndices().get(0).parameter()).isEqualTo("material_mass");
        assertThat(report.getSensitivityIndices().get(0).index()).isCloseTo(0.5, within(1e-12));
        assertThat(report.getSensitivityIndices().get(1).contributionPercent()).isCloseTo(50.0, within(1e-9));
    }

    @Test
    void shouldClampNegativeDraws() {
        // Given
        MaterialRecord uncertain = new MaterialRecord("FOAM", "Foam", "Polymer", 30, 1.0, 5.0,
                0.1, 1.0, 1.0, 0.5, 0.0, 1.0, 10);
        ReferenceCatalog catalog = new ReferenceCatalog("uncertain", List.of(uncertain), List.of(), List.of(), List.of());
        ProductSpecification spec = ProductSpecification.builder()
                .productId("FOAM-1")
                .material(MaterialEntry.virgin("FOAM", 1.0))
                .build();
        CalculationContext context = CalculationContext.resolve(spec, catalog, EngineConfig.defaults());
        Map<LifeCyclePhase, PhaseResult> phases = new PhasePipeline().run(context);

        // When
        UncertaintyReport report = analyzer.analyze(context, phases, 1000, 42L);

        // Then
        double endOfLife = phases.get(LifeCyclePhase.END_OF_LIFE).carbonKgCo2e();
        assertThat(report.getClampedSamples()).isPositive();
        assertThat(report.getCarbonStats().min()).isGreaterThanOrEqualTo(endOfLife - 1e-12);
    }

    @Test
    void shouldKeepProcessAndTransportFixedWhenPerturbationDisabled() {
        // Given
        EngineConfig config = EngineConfig.builder()
                .perturbManufacturing(false)
                .perturbTransport(false)
                .build();
        CalculationContext context = context(TestProducts.simpleBottle(), config);
        Map<LifeCyclePhase, PhaseResult> phases = new PhasePipeline().run(context);

        // When
        UncertaintyReport report = analyzer.analyze(context, phases, 1000, 42L);

        // Then
        double fixedPart = phases.get(LifeCyclePhase.MANUFACTURING).carbonKgCo2e()
                + phases.get(LifeCyclePhase.TRANSPORT).carbonKgCo2e()
                + phases.get(LifeCyclePhase.END_OF_LIFE).carbonKgCo2e();
        double materialStd = 0.15 * 0.1;
        assertThat(report.getCarbonStats().std()).isCloseTo(materialStd, within(materialStd * 0.15));
        assertThat(report.getCarbonStats().mean() - fixedPart).isCloseTo(0.315, within(0.002));
    }

    @Test
    void shouldRejectNonPositiveTrialCount() {
        CalculationContext context = context(TestProducts.simpleBottle(), EngineConfig.defaults());
        Map<LifeCyclePhase, PhaseResult> phases = new PhasePipeline().run(context);

        assertThatThrownBy(() -> analyzer.analyze(context, phases, 0, 42L))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at least 1");
    }

    @Test
    void shouldDeriveDistinctTrialSeeds() {
        assertThat(UncertaintyAnalyzer.trialSeed(42L, 0)).isNotEqualTo(UncertaintyAnalyzer.trialSeed(42L, 1));
        assertThat(UncertaintyAnalyzer.trialSeed(42L, 0)).isNotEqualTo(UncertaintyAnalyzer.trialSeed(43L, 0));
        assertThat(UncertaintyAnalyzer.trialSeed(42L, 5)).isEqualTo(UncertaintyAnalyzer.trialSeed(42L, 5));
    }

    private static CalculationContext context(ProductSpecification spec, EngineConfig config) {
        return CalculationContext.resolve(spec, TestProducts.defaultCatalog(), config);
    }
}
