package org.carball.lca.analyzer;

import org.carball.lca.TestProducts;
import org.carball.lca.calculator.CalculationContext;
import org.carball.lca.config.EngineConfig;
import org.carball.lca.model.product.MaterialEntry;
import org.carball.lca.model.product.ProductSpecification;
import org.carball.lca.model.product.TransportLeg;
import org.carball.lca.model.reference.MaterialRecord;
import org.carball.lca.model.reference.TransportModeRecord;
import org.carball.lca.model.result.ImprovementPotential;
import org.carball.lca.model.result.MaterialSubstitution;
import org.carball.lca.model.result.SubstituteSuggestion;
import org.carball.lca.reference.ReferenceCatalog;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ImprovementOptimizerTest {

    private final ImprovementOptimizer optimizer = new ImprovementOptimizer();

    @Test
    void shouldFindLowestCarbonSubstituteWithEnoughStrength() {
        // When
        ImprovementPotential potential = optimizer.analyze(context(TestProducts.simpleBottle()));

        // Then
        assertThat(potential.currentCarbonKgCo2e()).isCloseTo(0.315, within(1e-12));
        assertThat(potential.bestPotentialCarbonKgCo2e()).isCloseTo(0.045, within(1e-12));
        assertThat(potential.reductionPotentialPercent()).isCloseTo(85.714, within(0.001));
        assertThat(potential.carbonCostSavingsUsd()).isCloseTo(0.0135, within(1e-12));

        MaterialSubstitution substitution = potential.substitutions().get(0);
        assertThat(substitution.materialId()).isEqualTo("PP");
        assertThat(substitution.substituteId()).isEqualTo("BAMBOO");
        assertThat(substitution.isImprovement()).isTrue();
        assertThat(substitution.strengthRatio()).isCloseTo(30.0 / 35.0, within(1e-12));
        assertThat(substitution.costChangePercent()).isCloseTo((3.5 - 1.8) / 1.8 * 100, within(1e-9));
    }

    @Test
    void shouldKeepOriginalWhenNothingIsBetter() {
        // Given
        ProductSpecification spec = TestProducts.simpleBottle().toBuilder()
                .clearMaterials()
                .material(MaterialEntry.virgin("BAMBOO", 1.0))
                .build();

        // When
        ImprovementPotential potential = optimizer.analyze(context(spec));

        // Then
        MaterialSubstitution substitution = potential.substitutions().get(0);
        assertThat(substitution.substituteId()).isEqualTo("BAMBOO");
        assertThat(substitution.isImprovement()).isFalse();
        assertThat(potential.reductionPotentialPercent()).isZero();
        assertThat(potential.carbonCostSavingsUsd()).isZero();
    }

    @Test
    void shouldRespectStrengthFloor() {
        // Given
        MaterialRecord steel = TestProducts.defaultCatalog().getMaterial("SUS304").orElseThrow();

        // When
        Optional<MaterialRecord> best = optimizer.bestSubstitute(TestProducts.defaultCatalog(), steel, 0.8);

        // Then
        assertThat(best).isEmpty();
    }

    @Test
    void shouldRecommendRecycledContentAndLongerLifetime() {
        // When
        List<String> recommendations = optimizer.recommendations(context(TestProducts.simpleBottle()));

        // Then
        assertThat(recommendations).containsExactly(
                "Increase recycled content in PP to at least 30%",
                "Increase product lifetime through better design and materials");
    }

    @Test
    void shouldRecommendCleanerGridAndAvoidingAirFreight() {
        // Given
        ProductSpecification spec = TestProducts.simpleBottle().toBuilder()
                .clearMaterials()
                .material(new MaterialEntry("PP", 0.15, 0.5))
                .manufacturingRegion("China")
                .transportLeg(new TransportLeg("Air Freight", 2000, 1.0))
                .lifetimeYears(5)
                .build();

        // When
        List<String> recommendations = optimizer.recommendations(context(spec));

        // Then
        assertThat(recommendations).containsExactly(
                "Consider manufacturing in regions with cleaner electricity grid",
                "Avoid air freight for high-volume products");
    }

    @Test
    void shouldLowercaseModeNameIndependentlyOfDefaultLocale() {
        // Given
        TransportModeRecord airship = new TransportModeRecord("INTERCITY AIR", 600, 10.0, 1.0);
        ReferenceCatalog catalog = new ReferenceCatalog("airship", List.of(), List.of(), List.of(airship), List.of());
        ProductSpecification spec = ProductSpecification.builder()
                .productId("AIRSHIP")
                .transportLeg(new TransportLeg("INTERCITY AIR", 100, 1.0))
                .lifetimeYears(5)
                .build();
        Locale previous = Locale.getDefault();

        // When
        List<String> recommendations;
        try {
            Locale.setDefault(new Locale("tr", "TR"));
            recommendations = optimizer.recommendations(
                    CalculationContext.resolve(spec, catalog, EngineConfig.defaults()));
        } finally {
            Locale.setDefault(previous);
        }

        // Then
        assertThat(recommendations).containsExactly("Avoid intercity air for high-volume products");
    }

    @Test
    void shouldLimitNumberOfRecommendations() {
        // Given
        ProductSpecification spec = ProductSpecification.builder()
                .productId("MANY")
                .material(MaterialEntry.virgin("PP", 1.0))
                .material(MaterialEntry.virgin("PET", 1.0))
                .material(MaterialEntry.virgin("ABS", 1.0))
                .material(MaterialEntry.virgin("PC", 1.0))
                .material(MaterialEntry.virgin("HDPE", 1.0))
                .material(MaterialEntry.virgin("LDPE", 1.0))
                .build();

        // When
        List<String> recommendations = optimizer.recommendations(context(spec));

        // Then
        assertThat(recommendations).hasSize(5);
    }

    @Test
    void shouldSuggestSubstitutesMeetingTarget() {
        // When
        List<SubstituteSuggestion> suggestions = optimizer.suggestSubstitutes(TestProducts.defaultCatalog(), "PP", 40.0);

        // Then
        assertThat(suggestions).extracting(SubstituteSuggestion::materialId).containsExactly("BAMBOO", "R_PP");
        assertThat(suggestions.get(0).carbonReductionPercent()).isCloseTo(85.714, within(0.001));
        assertThat(suggestions.get(1).strengthChangePercent()).isCloseTo(0.0, within(1e-9));
    }

    @Test
    void shouldReturnAtMostFiveSuggestions() {
        List<SubstituteSuggestion> suggestions = optimizer.suggestSubstitutes(TestProducts.defaultCatalog(), "AL6061", 0.0);

        assertThat(suggestions).hasSize(5);
        assertThat(suggestions.get(0).materialId()).isEqualTo("BAMBOO");
    }

    @Test
    void shouldReturnNoSuggestionsForUnknownMaterial() {
        assertThat(optimizer.suggestSubstitutes(TestProducts.defaultCatalog(), "UNOBTAINIUM", 10.0)).isEmpty();
    }

    private static CalculationContext context(ProductSpecification spec) {
        return CalculationContext.resolve(spec, TestProducts.defaultCatalog(), EngineConfig.defaults());
    }
}
