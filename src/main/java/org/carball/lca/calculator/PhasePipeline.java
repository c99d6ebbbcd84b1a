package org.carball.lca.calculator;

import lombok.extern.slf4j.Slf4j;
import org.carball.lca.model.result.LifeCyclePhase;
import org.carball.lca.model.result.PhaseResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * The fixed sequence of phase calculators. With an executor the phases run concurrently;
 * they share nothing but the read-only context, so the results are the same either way.
 */
@Slf4j
public class PhasePipeline {

    private final List<PhaseCalculator> calculators;
    private final ExecutorService executor;

    public PhasePipeline() {
        this(null);
    }

    public PhasePipeline(ExecutorService executor) {
        this(List.of(
                new MaterialPhaseCalculator(),
                new ManufacturingPhaseCalculator(),
                new TransportPhaseCalculator(),
                new UsePhaseCalculator(),
                new EndOfLifePhaseCalculator()), executor);
    }

    PhasePipeline(List<PhaseCalculator> calculators, ExecutorService executor) {
        this.calculators = List.copyOf(calculators);
        this.executor = executor;
    }

    public Map<LifeCyclePhase, PhaseResult> run(CalculationContext context) {
        Map<LifeCyclePhase, PhaseResult> results = new EnumMap<>(LifeCyclePhase.class);

        if (executor == null) {
            for (PhaseCalculator calculator : calculators) {
                results.put(calculator.phase(), calculator.calculate(context));
            }
            return Collections.unmodifiableMap(results);
        }

        List<Future<PhaseResult>> futures = new ArrayList<>();
        for (PhaseCalculator calculator : calculators) {
            futures.add(executor.submit(() -> calculator.calculate(context)));
        }
        for (Future<PhaseResult> future : futures) {
            PhaseResult result = await(future);
            results.put(result.phase(), result);
        }
        return Collections.unmodifiableMap(results);
    }

    public double totalCarbon(CalculationContext context) {
        return run(context).values().stream().mapToDouble(PhaseResult::carbonKgCo2e).sum();
    }

    private static PhaseResult await(Future<PhaseResult> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for phase calculation", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Phase calculation failed", cause);
        }
    }
}
