package org.carball.lca.calculator;

import org.carball.lca.TestProducts;
import org.carball.lca.config.EngineConfig;
import org.carball.lca.model.product.MaterialEntry;
import org.carball.lca.model.product.ProductSpecification;
import org.carball.lca.model.result.DataQualityWarning;
import org.carball.lca.model.result.LifeCyclePhase;
import org.carball.lca.model.result.NormalizedImpacts;
import org.carball.lca.model.result.PhaseResult;
import org.carball.lca.model.result.Totals;
import org.carball.lca.model.result.WarningType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PhasePipelineTest {

    @Test
    void shouldProduceAllFivePhasesInOrder() {
        // Given
        CalculationContext context = context(TestProducts.simpleBottle());

        // When
        Map<LifeCyclePhase, PhaseResult> phases = new PhasePipeline().run(context);

        // Then
        assertThat(phases.keySet()).containsExactly(LifeCyclePhase.values());
    }

    @Test
    void shouldGiveSameResultsWithExecutor() {
        // Given
        CalculationContext context = context(TestProducts.twoMaterialProduct());
        ExecutorService executor = Executors.newFixedThreadPool(4);

        try {
            // When
            Map<LifeCyclePhase, PhaseResult> sequential = new PhasePipeline().run(context);
            Map<LifeCyclePhase, PhaseResult> concurrent = new PhasePipeline(executor).run(context);

            // Then
            for (LifeCyclePhase phase : LifeCyclePhase.values()) {
                assertThat(concurrent.get(phase).carbonKgCo2e()).isEqualTo(sequential.get(phase).carbonKgCo2e());
                assertThat(concurrent.get(phase).energyMj()).isEqualTo(sequential.get(phase).energyMj());
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void shouldSumPhasesIntoTotals() {
        // Given
        CalculationContext context = context(TestProducts.simpleBottle());
        Map<LifeCyclePhase, PhaseResult> phases = new PhasePipeline().run(context);

        // When
        Totals totals = new TotalsAggregator().aggregate(phases, context.totalMassKg());

        // Then
        double phaseSum = phases.values().stream().mapToDouble(PhaseResult::carbonKgCo2e).sum();
        assertThat(totals.carbonKgCo2e()).isCloseTo(phaseSum, within(1e-12));
        assertThat(totals.carbonKgCo2e()).isCloseTo(0.3087132, within(1e-6));
        assertThat(totals.costUsd()).isCloseTo(0.27 + 0.028125, within(1e-12));
        assertThat(totals.carbonPerKg()).isCloseTo(totals.carbonKgCo2e() / 0.15, within(1e-12));
        assertThat(new TotalsAggregator().warningsFor(totals)).isEmpty();
    }

    @Test
    void shouldGuardPerKgIntensityForZeroMass() {
        // Given
        ProductSpecification spec = TestProducts.simpleBottle().toBuilder()
                .clearMaterials()
                .material(MaterialEntry.virgin("PP", 0.0))
                .build();
        CalculationContext context = context(spec);
        TotalsAggregator aggregator = new TotalsAggregator();

        // When
        Totals totals = aggregator.aggregate(new PhasePipeline().run(context), context.totalMassKg());
        List<DataQualityWarning> warnings = aggregator.warningsFor(totals);

        // Then
        assertThat(totals.massKg()).isZero();
        assertThat(totals.carbonPerKg()).isEqualTo(totals.carbonKgCo2e());
        assertThat(warnings).extracting(DataQualityWarning::type).containsExactly(WarningType.DEGENERATE_INPUT);
    }

    @Test
    void shouldNormalizeTotalsAgainstPerCapitaReferences() {
        // Given
        CalculationContext context = context(TestProducts.simpleBottle());
        Map<LifeCyclePhase, PhaseResult> phases = new PhasePipeline().run(context);

        // When
        Totals totals = new TotalsAggregator().aggregate(phases, context.totalMassKg());

        // Then
        NormalizedImpacts normalized = totals.normalized();
        assertThat(normalized.carbon()).isCloseTo(0.3087132 / 5000.0, within(1e-9));
        assertThat(normalized.energy()).isCloseTo(totals.energyMj() / 80000.0, within(1e-15));
        assertThat(normalized.water()).isCloseTo(12.75 / 1_500_000.0, within(1e-9));
    }

    @Test
    void shouldUseConfiguredPerCapitaReferences() {
        // Given
        EngineConfig config = EngineConfig.builder()
                .carbonPerCapitaKgCo2e(1.0)
                .energyPerCapitaMj(2.0)
                .waterPerCapitaL(3.0)
                .build();
        CalculationContext context = context(TestProducts.simpleBottle());

        // When
        Totals totals = new TotalsAggregator(config).aggregate(new PhasePipeline().run(context), context.totalMassKg());

        // Then
        assertThat(totals.normalized().carbon()).isEqualTo(totals.carbonKgCo2e());
        assertThat(totals.normalized().energy()).isEqualTo(totals.energyMj() / 2.0);
        assertThat(totals.normalized().water()).isEqualTo(totals.waterL() / 3.0);
    }

    @Test
    void shouldReportTotalCarbon() {
        CalculationContext context = context(TestProducts.simpleBottle());

        assertThat(new PhasePipeline().totalCarbon(context)).isCloseTo(0.3087132, within(1e-6));
    }

    private static CalculationContext context(ProductSpecification spec) {
        return CalculationContext.resolve(spec, TestProducts.defaultCatalog(), EngineConfig.defaults());
    }
}
