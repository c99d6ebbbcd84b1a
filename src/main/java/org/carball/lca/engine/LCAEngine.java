package org.carball.lca.engine;

import lombok.extern.slf4j.Slf4j;
import org.carball.lca.analyzer.CircularityAnalyzer;
import org.carball.lca.analyzer.HotspotAnalyzer;
import org.carball.lca.analyzer.ImprovementOptimizer;
import org.carball.lca.analyzer.ScenarioComparator;
import org.carball.lca.analyzer.SensitivityAnalyzer;
import org.carball.lca.analyzer.UncertaintyAnalyzer;
import org.carball.lca.calculator.CalculationContext;
import org.carball.lca.calculator.PhasePipeline;
import org.carball.lca.calculator.TotalsAggregator;
import org.carball.lca.config.EngineConfig;
import org.carball.lca.model.product.ProductSpecification;
import org.carball.lca.model.result.CalculationMetadata;
import org.carball.lca.model.result.CircularityMetrics;
import org.carball.lca.model.result.DataQualityReport;
import org.carball.lca.model.result.DataQualityWarning;
import org.carball.lca.model.result.Hotspot;
import org.carball.lca.model.result.ImprovementPotential;
import org.carball.lca.model.result.LCAResult;
import org.carball.lca.model.result.LifeCyclePhase;
import org.carball.lca.model.result.PhaseResult;
import org.carball.lca.model.result.ScenarioComparison;
import org.carball.lca.model.result.SensitivityParameter;
import org.carball.lca.model.result.SensitivityReport;
import org.carball.lca.model.result.SubstituteSuggestion;
import org.carball.lca.model.result.Totals;
import org.carball.lca.model.result.UncertaintyReport;
import org.carball.lca.reference.ReferenceDataProvider;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;

/**
 * Entry point of the life-cycle assessment. Validates a product, snapshots the reference
 * data, runs the five phase calculators and the analyses built on top of them. Holds no
 * state between calls; every call returns a fresh result.
 */
@Slf4j
public class LCAEngine {

    public static final String CALCULATION_METHOD = "Attributional LCA, ISO 14040/44 screening";

    private final ReferenceDataProvider referenceData;
    private final EngineConfig config;
    private final Clock clock;

    private final ProductSpecificationValidator validator = new ProductSpecificationValidator();
    private final PhasePipeline pipeline;
    private final TotalsAggregator totalsAggregator;
    private final UncertaintyAnalyzer uncertaintyAnalyzer = new UncertaintyAnalyzer();
    private final CircularityAnalyzer circularityAnalyzer = new CircularityAnalyzer();
    private final HotspotAnalyzer hotspotAnalyzer = new HotspotAnalyzer();
    private final ImprovementOptimizer improvementOptimizer = new ImprovementOptimizer();
    private final SensitivityAnalyzer sensitivityAnalyzer = new SensitivityAnalyzer();
    private final ScenarioComparator scenarioComparator = new ScenarioComparator();

    public LCAEngine(ReferenceDataProvider referenceData) {
        this(referenceData, EngineConfig.defaults());
    }

    public LCAEngine(ReferenceDataProvider referenceData, EngineConfig config) {
        this(referenceData, config, null);
    }

    /**
     * @param executor runs the phase calculators concurrently; {@code null} runs them on the calling thread
     */
    public LCAEngine(ReferenceDataProvider referenceData, EngineConfig config, ExecutorService executor) {
        this(referenceData, config, executor, Clock.systemUTC());
    }

    public LCAEngine(ReferenceDataProvider referenceData, EngineConfig config, ExecutorService executor, Clock clock) {
        this.referenceData = Objects.requireNonNull(referenceData, "referenceData");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.pipeline = new PhasePipeline(executor);
        this.totalsAggregator = new TotalsAggregator(config);

        log.info("Initialized LCAEngine with config: {}", config.getConfigurationSummary());
    }

    /**
     * Full assessment using the configured trial count and seed. A trial count of zero skips
     * the uncertainty analysis and leaves {@link LCAResult#getUncertainty()} null.
     */
    public LCAResult calculate(ProductSpecification spec) {
        return run(spec, config.getMonteCarloTrials(), config.getRandomSeed());
    }

    public LCAResult calculateWithUncertainty(ProductSpecification spec, int trials, long seed) {
        if (trials < 1) {
            throw new IllegalArgumentException("Monte Carlo trials must be at least 1, got " + trials);
        }
        return run(spec, trials, seed);
    }

    /**
     * @param parameters parameters to vary; empty means all of them
     */
    public SensitivityReport sensitivityAnalysis(ProductSpecification spec, List<SensitivityParameter> parameters) {
        validator.validate(spec);
        CalculationContext context = CalculationContext.resolve(spec, referenceData.snapshot(), config);
        log.info("Running sensitivity analysis for product '{}'", spec.productId());
        return sensitivityAnalyzer.analyze(context, pipeline, parameters);
    }

    /**
     * Compares product variants on their deterministic results. Uncertainty is not computed.
     */
    public ScenarioComparison compareScenarios(List<ProductSpecification> specs) {
        if (specs == null || specs.isEmpty()) {
            throw new IllegalArgumentException("At least one scenario is required for a comparison");
        }
        specs.forEach(validator::validate);
        log.info("Comparing {} scenarios", specs.size());

        List<LCAResult> results = specs.stream()
                .map(spec -> run(spec, 0, config.getRandomSeed()))
                .collect(Collectors.toList());
        return scenarioComparator.compare(results);
    }

    public List<SubstituteSuggestion> suggestSubstitutes(String materialId, double targetReductionPercent) {
        return improvementOptimizer.suggestSubstitutes(referenceData.snapshot(), materialId, targetReductionPercent);
    }

    public EngineConfig getConfig() {
        return config;
    }

    private LCAResult run(ProductSpecification spec, int trials, long seed) {
        validator.validate(spec);
        log.info("Starting LCA for product '{}' ({})", spec.productId(), spec.productName());

        // Step 1: fix the reference data for the whole calculation
        ReferenceDataProvider snapshot = referenceData.snapshot();
        CalculationContext context = CalculationContext.resolve(spec, snapshot, config);
        log.debug("Resolved {} of {} materials, total mass {} kg",
                context.resolvedMaterials().size(), spec.materials().size(), context.totalMassKg());

        // Step 2: phase impacts
        Map<LifeCyclePhase, PhaseResult> phases = pipeline.run(context);

        // Step 3: totals
        Totals totals = totalsAggregator.aggregate(phases, context.totalMassKg());
        log.info("Total carbon footprint: {} kgCO2e", totals.carbonKgCo2e());

        // Step 4: analyses on top of the phase results
        UncertaintyReport uncertainty = null;
        if (trials > 0) {
            uncertainty = uncertaintyAnalyzer.analyze(context, phases, trials, seed);
            log.info("Uncertainty analysis complete: {} trials, mean {} kgCO2e",
                    trials, uncertainty.getCarbonStats().mean());
        }
        CircularityMetrics circularity = circularityAnalyzer.analyze(context);
        List<Hotspot> hotspots = hotspotAnalyzer.analyze(phases, totals, config);
        ImprovementPotential improvement = improvementOptimizer.analyze(context);

        DataQualityReport dataQuality = dataQuality(spec, context, phases, totals, uncertainty);
        if (dataQuality.hasWarnings()) {
            log.warn("Calculation for '{}' completed with {} data-quality warnings",
                    spec.productId(), dataQuality.warnings().size());
        }

        log.info("LCA complete for '{}': {} hotspots, circularity {}",
                spec.productId(), hotspots.size(), circularity.circularityClass().getDisplayName());

        return LCAResult.builder()
                .productId(spec.productId())
                .productName(spec.productName())
                .timestamp(clock.instant())
                .phases(phases)
                .totals(totals)
                .uncertainty(uncertainty)
                .circularity(circularity)
                .hotspots(hotspots)
                .improvementPotential(improvement)
                .metadata(new CalculationMetadata(CALCULATION_METHOD, spec.allocationMethod(),
                        config.getProfileName(), dataQuality))
                .build();
    }

    private DataQualityReport dataQuality(ProductSpecification spec,
                                          CalculationContext context,
                                          Map<LifeCyclePhase, PhaseResult> phases,
                                          Totals totals,
                                          UncertaintyReport uncertainty) {
        List<DataQualityWarning> warnings = new ArrayList<>();
        for (LifeCyclePhase phase : LifeCyclePhase.values()) {
            PhaseResult result = phases.get(phase);
            if (result != null) {
                warnings.addAll(result.warnings());
            }
        }
        warnings.addAll(totalsAggregator.warningsFor(totals));
        if (uncertainty != null && uncertainty.getClampedSamples() > 0) {
            warnings.add(DataQualityWarning.negativeSamplesClamped(uncertainty.getClampedSamples()));
        }

        int declared = spec.materials().size() + spec.processes().size() + spec.transportLegs().size();
        int resolved = context.resolvedMaterials().size()
                + phases.get(LifeCyclePhase.MANUFACTURING).details().size()
                + phases.get(LifeCyclePhase.TRANSPORT).details().size();
        double completeness = declared == 0 ? 100.0 : resolved * 100.0 / declared;

        return new DataQualityReport(warnings, completeness);
    }
}
