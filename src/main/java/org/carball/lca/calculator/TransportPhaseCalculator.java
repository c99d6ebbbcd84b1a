package org.carball.lca.calculator;

import lombok.extern.slf4j.Slf4j;
import org.carball.lca.model.product.TransportLeg;
import org.carball.lca.model.reference.TransportModeRecord;
import org.carball.lca.model.result.DataQualityWarning;
import org.carball.lca.model.result.LifeCyclePhase;
import org.carball.lca.model.result.PhaseDetail;
import org.carball.lca.model.result.PhaseResult;
import org.carball.lca.model.result.TransportLegContribution;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Distribution logistics. A partly empty vehicle is charged as if it drove
 * {@code distance / load factor}.
 */
@Slf4j
public class TransportPhaseCalculator implements PhaseCalculator {

    @Override
    public LifeCyclePhase phase() {
        return LifeCyclePhase.TRANSPORT;
    }

    @Override
    public PhaseResult calculate(CalculationContext context) {
        double tonnes = context.totalMassKg() / 1000.0;
        List<DataQualityWarning> warnings = new ArrayList<>();
        List<PhaseDetail> details = new ArrayList<>();
        Map<String, Double> modalMix = new LinkedHashMap<>();

        double carbon = 0.0;
        double energy = 0.0;
        double cost = 0.0;
        double distance = 0.0;
        double effectiveDistance = 0.0;

        for (TransportLeg leg : context.specification().transportLegs()) {
            Optional<TransportModeRecord> found = context.reference().getTransportMode(leg.modeId());
            if (found.isEmpty()) {
                log.warn("Transport mode '{}' not found in reference data, skipping", leg.modeId());
                warnings.add(DataQualityWarning.transportModeNotFound(leg.modeId()));
                continue;
            }
            TransportModeRecord mode = found.get();

            double legEffective = leg.distanceKm() / leg.loadFactor();
            double tonneKm = tonnes * legEffective;
            double legCarbon = tonneKm * mode.carbonGCo2ePerTonneKm() / 1000.0;
            double legEnergy = tonneKm * mode.energyMjPerTonneKm();
            double legCost = tonneKm * mode.costUsdPerTonneKm();

            details.add(new TransportLegContribution(leg.modeId(), leg.distanceKm(), leg.loadFactor(),
                    legEffective, legCarbon, legEnergy, legCost));
            modalMix.merge(leg.modeId(), leg.distanceKm(), Double::sum);

            carbon += legCarbon;
            energy += legEnergy;
            cost += legCost;
            distance += leg.distanceKm();
            effectiveDistance += legEffective;
        }

        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put("distance_km", distance);
        metrics.put("effective_distance_km", effectiveDistance);
        metrics.put("tonne_km", tonnes * effectiveDistance);

        return new PhaseResult(LifeCyclePhase.TRANSPORT, carbon, energy, 0.0, cost,
                details, metrics, modalMix, warnings);
    }
}
