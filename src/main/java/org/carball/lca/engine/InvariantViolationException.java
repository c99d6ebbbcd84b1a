package org.carball.lca.engine;

import java.util.List;

/**
 * A product specification broke one or more invariants. Raised before any phase is calculated.
 */
public class InvariantViolationException extends IllegalArgumentException {

    private final List<String> violations;

    public InvariantViolationException(List<String> violations) {
        super("Invalid product specification: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
