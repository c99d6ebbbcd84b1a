package org.carball.lca.calculator;

import lombok.extern.slf4j.Slf4j;
import org.carball.lca.model.product.ProcessEntry;
import org.carball.lca.model.product.ProductSpecification;
import org.carball.lca.model.reference.ProcessRecord;
import org.carball.lca.model.reference.RegionalGridRecord;
import org.carball.lca.model.result.DataQualityWarning;
import org.carball.lca.model.result.LifeCyclePhase;
import org.carball.lca.model.result.PhaseDetail;
import org.carball.lca.model.result.PhaseResult;
import org.carball.lca.model.result.ProcessContribution;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Manufacturing processes applied to the whole product mass. Carbon has a direct
 * process part and a part from the electricity drawn from the regional grid.
 */
@Slf4j
public class ManufacturingPhaseCalculator implements PhaseCalculator {

    static final double MJ_PER_KWH = 3.6;

    @Override
    public LifeCyclePhase phase() {
        return LifeCyclePhase.MANUFACTURING;
    }

    @Override
    public PhaseResult calculate(CalculationContext context) {
        ProductSpecification spec = context.specification();
        double totalMass = context.totalMassKg();
        List<DataQualityWarning> warnings = new ArrayList<>();

        RegionalGridRecord grid = context.reference().getRegionalFactor(spec.manufacturingRegion());
        if (!grid.region().equals(spec.manufacturingRegion())) {
            log.warn("Region '{}' not found, using '{}' grid factor", spec.manufacturingRegion(), grid.region());
            warnings.add(DataQualityWarning.regionFallback(spec.manufacturingRegion(), grid.region()));
        }

        double energyKwh = 0.0;
        double directCarbon = 0.0;
        double gridCarbon = 0.0;
        double water = 0.0;
        double scrap = 0.0;
        List<PhaseDetail> details = new ArrayList<>();

        for (ProcessEntry entry : spec.processes()) {
            Optional<ProcessRecord> found = context.reference().getProcess(entry.processId());
            if (found.isEmpty()) {
                log.warn("Process '{}' not found in reference data, skipping", entry.processId());
                warnings.add(DataQualityWarning.processNotFound(entry.processId()));
                continue;
            }
            ProcessRecord process = found.get();

            double kwh = totalMass * process.energyKwhPerKg() / entry.efficiency()
                    * entry.technologyLevel().getEnergyMultiplier();
            double direct = totalMass * process.carbonKgCo2ePerKg();
            double fromGrid = kwh * grid.carbonKgPerKwh();
            double processWater = totalMass * process.waterLPerKg();
            double processScrap = totalMass * process.scrapRate();

            details.add(new ProcessContribution(entry.processId(), entry.efficiency(), entry.technologyLevel(),
                    kwh, kwh * MJ_PER_KWH, direct, fromGrid, processWater, processScrap));

            energyKwh += kwh;
            directCarbon += direct;
            gridCarbon += fromGrid;
            water += processWater;
            scrap += processScrap;

            log.debug("Process {}: {} kWh, {} kgCO2e direct, {} kgCO2e grid",
                    entry.processId(), kwh, direct, fromGrid);
        }

        double carbon = directCarbon + gridCarbon;

        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put("mass_kg", totalMass);
        metrics.put("energy_kwh", energyKwh);
        metrics.put("direct_carbon_kgco2e", directCarbon);
        metrics.put("grid_carbon_kgco2e", gridCarbon);
        metrics.put("scrap_kg", scrap);
        metrics.put("efficiency_score", efficiencyScore(spec.processes()));
        metrics.put("grid_intensity_gco2e_kwh", grid.carbonGCo2ePerKwh());
        metrics.put("renewable_share", grid.renewableShare());

        Map<String, Double> distribution = new LinkedHashMap<>();
        if (carbon > 0) {
            for (PhaseDetail detail : details) {
                distribution.merge(detail.label(), detail.carbonKgCo2e() / carbon, Double::sum);
            }
        }

        return new PhaseResult(LifeCyclePhase.MANUFACTURING, carbon, energyKwh * MJ_PER_KWH, water, null,
                details, metrics, distribution, warnings);
    }

    private static double efficiencyScore(List<ProcessEntry> processes) {
        return processes.stream()
                .mapToDouble(ProcessEntry::efficiency)
                .average()
                .orElse(0.0);
    }
}
