package org.carball.lca.engine;

import org.carball.lca.model.product.EndOfLifeScenario;
import org.carball.lca.model.product.MaterialEntry;
import org.carball.lca.model.product.ProcessEntry;
import org.carball.lca.model.product.ProductSpecification;
import org.carball.lca.model.product.TransportLeg;
import org.carball.lca.model.product.UseScenario;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks the numeric invariants of a product specification and reports every violation at once.
 * Comparisons are written so that NaN fails them.
 */
public class ProductSpecificationValidator {

    static final double RATE_SUM_TOLERANCE = 1e-6;

    public void validate(ProductSpecification spec) {
        if (spec == null) {
            throw new InvariantViolationException(List.of("product specification is required"));
        }
        List<String> violations = new ArrayList<>();

        if (isBlank(spec.productId())) {
            violations.add("product_id must not be blank");
        }

        for (int i = 0; i < spec.materials().size(); i++) {
            MaterialEntry material = spec.materials().get(i);
            String at = "materials[" + i + "]";
            if (isBlank(material.materialId())) {
                violations.add(at + ".material_id must not be blank");
            }
            if (!(material.massKg() >= 0) || Double.isInfinite(material.massKg())) {
                violations.add(at + ".mass_kg must be a non-negative number, got " + material.massKg());
            }
            if (!isFraction(material.recycledContent())) {
                violations.add(at + ".recycled_content must be in [0, 1], got " + material.recycledContent());
            }
        }

        for (int i = 0; i < spec.processes().size(); i++) {
            ProcessEntry process = spec.processes().get(i);
            String at = "manufacturing_processes[" + i + "]";
            if (isBlank(process.processId())) {
                violations.add(at + ".process_id must not be blank");
            }
            if (!(process.efficiency() > 0 && process.efficiency() <= 1)) {
                violations.add(at + ".efficiency must be in (0, 1], got " + process.efficiency());
            }
        }

        for (int i = 0; i < spec.transportLegs().size(); i++) {
            TransportLeg leg = spec.transportLegs().get(i);
            String at = "transport_legs[" + i + "]";
            if (isBlank(leg.modeId())) {
                violations.add(at + ".mode_id must not be blank");
            }
            if (!(leg.distanceKm() >= 0) || Double.isInfinite(leg.distanceKm())) {
                violations.add(at + ".distance_km must be a non-negative number, got " + leg.distanceKm());
            }
            if (!(leg.loadFactor() > 0 && leg.loadFactor() <= 1)) {
                violations.add(at + ".load_factor must be in (0, 1], got " + leg.loadFactor());
            }
        }

        for (int i = 0; i < spec.useScenarios().size(); i++) {
            UseScenario use = spec.useScenarios().get(i);
            String at = "use_scenarios[" + i + "]";
            requireNonNegative(violations, at + ".frequency_per_year", use.frequencyPerYear());
            requireNonNegative(violations, at + ".energy_kwh_per_use", use.energyKwhPerUse());
            requireNonNegative(violations, at + ".water_l_per_use", use.waterLPerUse());
        }

        if (spec.lifetimeYears() < 1) {
            violations.add("lifetime_years must be at least 1, got " + spec.lifetimeYears());
        }

        validateEndOfLife(spec.endOfLife(), violations);

        if (!violations.isEmpty()) {
            throw new InvariantViolationException(violations);
        }
    }

    private static void validateEndOfLife(EndOfLifeScenario eol, List<String> violations) {
        boolean ratesValid = true;
        if (!isFraction(eol.recyclingRate())) {
            violations.add("end_of_life.recycling_rate must be in [0, 1], got " + eol.recyclingRate());
            ratesValid = false;
        }
        if (!isFraction(eol.incinerationRate())) {
            violations.add("end_of_life.incineration_rate must be in [0, 1], got " + eol.incinerationRate());
            ratesValid = false;
        }
        if (!isFraction(eol.landfillRate())) {
            violations.add("end_of_life.landfill_rate must be in [0, 1], got " + eol.landfillRate());
            ratesValid = false;
        }
        if (ratesValid && Math.abs(eol.rateSum() - 1.0) > RATE_SUM_TOLERANCE) {
            violations.add(String.format("end_of_life rates must sum to 1, got %.4f", eol.rateSum()));
        }
        if (!isFraction(eol.energyRecoveryEfficiency())) {
            violations.add("end_of_life.energy_recovery_efficiency must be in [0, 1], got "
                    + eol.energyRecoveryEfficiency());
        }
    }

    private static void requireNonNegative(List<String> violations, String field, double value) {
        if (!(value >= 0) || Double.isInfinite(value)) {
            violations.add(field + " must be a non-negative number, got " + value);
        }
    }

    private static boolean isFraction(double value) {
        return value >= 0 && value <= 1;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
