package org.carball.lca.calculator;

import org.carball.lca.model.result.LifeCyclePhase;
import org.carball.lca.model.result.PhaseResult;

/**
 * Computes the impacts of one life-cycle phase. Implementations are stateless and
 * read nothing outside the context they are given, so they can run on any thread.
 */
public interface PhaseCalculator {

    LifeCyclePhase phase();

    PhaseResult calculate(CalculationContext context);
}
