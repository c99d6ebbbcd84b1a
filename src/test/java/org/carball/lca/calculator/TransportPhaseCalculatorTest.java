package org.carball.lca.calculator;

import org.carball.lca.TestProducts;
import org.carball.lca.config.EngineConfig;
import org.carball.lca.model.product.ProductSpecification;
import org.carball.lca.model.product.TransportLeg;
import org.carball.lca.model.result.DataQualityWarning;
import org.carball.lca.model.result.PhaseResult;
import org.carball.lca.model.result.TransportLegContribution;
import org.carball.lca.model.result.WarningType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TransportPhaseCalculatorTest {

    private final TransportPhaseCalculator calculator = new TransportPhaseCalculator();

    @Test
    void shouldChargeEffectiveDistanceForPartialLoads() {
        // Given
        CalculationContext context = context(TestProducts.simpleBottle());

        // When
        PhaseResult result = calculator.calculate(context);

        // Then
        assertThat(result.carbonKgCo2e()).isCloseTo(0.011625, within(1e-12));
        assertThat(result.energyMj()).isCloseTo(0.525, within(1e-12));
        assertThat(result.costUsd()).isCloseTo(0.028125, within(1e-12));
        assertThat(result.waterL()).isZero();
        assertThat(result.metric("distance_km")).isEqualTo(1000.0);
        assertThat(result.metric("effective_distance_km")).isCloseTo(1250.0, within(1e-9));
        assertThat(result.metric("tonne_km")).isCloseTo(0.1875, within(1e-12));
        assertThat(result.detailsOf(TransportLegContribution.class).get(0).effectiveDistanceKm())
                .isCloseTo(1250.0, within(1e-9));
    }

    @Test
    void shouldSumLegsAndReportModalMix() {
        // Given
        ProductSpecification spec = TestProducts.simpleBottle().toBuilder()
                .transportLeg(new TransportLeg("Ship", 8000, 1.0))
                .transportLeg(new TransportLeg("Truck", 500, 1.0))
                .build();

        // When
        PhaseResult result = calculator.calculate(context(spec));

        // Then
        double tonnes = 0.00015;
        double expected = tonnes * 1250 * 62 / 1000 + tonnes * 8000 * 10 / 1000 + tonnes * 500 * 62 / 1000;
        assertThat(result.carbonKgCo2e()).isCloseTo(expected, within(1e-12));
        assertThat(result.distribution()).containsEntry("Truck", 1500.0).containsEntry("Ship", 8000.0);
    }

    @Test
    void shouldSkipUnknownMode() {
        // Given
        ProductSpecification spec = TestProducts.simpleBottle().toBuilder()
                .transportLeg(new TransportLeg("Hyperloop", 100, 1.0))
                .build();

        // When
        PhaseResult result = calculator.calculate(context(spec));

        // Then
        assertThat(result.carbonKgCo2e()).isCloseTo(0.011625, within(1e-12));
        assertThat(result.warnings()).extracting(DataQualityWarning::type).containsExactly(WarningType.TRANSPORT_MODE_NOT_FOUND);
    }

    private static CalculationContext context(ProductSpecification spec) {
        return CalculationContext.resolve(spec, TestProducts.defaultCatalog(), EngineConfig.defaults());
    }
}
