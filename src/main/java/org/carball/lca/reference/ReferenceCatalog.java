package org.carball.lca.reference;

import org.carball.lca.model.reference.MaterialRecord;
import org.carball.lca.model.reference.ProcessRecord;
import org.carball.lca.model.reference.RegionalGridRecord;
import org.carball.lca.model.reference.TransportModeRecord;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable set of reference records. Doubles as its own snapshot.
 */
public final class ReferenceCatalog implements ReferenceDataProvider {

    private final String name;
    private final Map<String, MaterialRecord> materials;
    private final Map<String, ProcessRecord> processes;
    private final Map<String, TransportModeRecord> transportModes;
    private final Map<String, RegionalGridRecord> regionalGrids;
    private final RegionalGridRecord fallbackGrid;

    public ReferenceCatalog(String name,
                            List<MaterialRecord> materials,
                            List<ProcessRecord> processes,
                            List<TransportModeRecord> transportModes,
                            List<RegionalGridRecord> regionalGrids) {
        this.name = name;
        this.materials = index(materials, MaterialRecord::id);
        this.processes = index(processes, ProcessRecord::id);
        this.transportModes = index(transportModes, TransportModeRecord::id);
        this.regionalGrids = index(regionalGrids, RegionalGridRecord::region);
        this.fallbackGrid = this.regionalGrids.getOrDefault(
                RegionalGridRecord.GLOBAL_AVERAGE, RegionalGridRecord.globalAverage());
    }

    private static <T> Map<String, T> index(List<T> records, java.util.function.Function<T, String> key) {
        Map<String, T> indexed = new LinkedHashMap<>();
        for (T record : records) {
            indexed.put(key.apply(record), record);
        }
        return Collections.unmodifiableMap(indexed);
    }

    public String getName() {
        return name;
    }

    @Override
    public Optional<MaterialRecord> getMaterial(String id) {
        return Optional.ofNullable(id == null ? null : materials.get(id));
    }

    @Override
    public Optional<ProcessRecord> getProcess(String id) {
        return Optional.ofNullable(id == null ? null : processes.get(id));
    }

    @Override
    public Optional<TransportModeRecord> getTransportMode(String id) {
        return Optional.ofNullable(id == null ? null : transportModes.get(id));
    }

    @Override
    public RegionalGridRecord getRegionalFactor(String region) {
        if (region == null) {
            return fallbackGrid;
        }
        return regionalGrids.getOrDefault(region, fallbackGrid);
    }

    @Override
    public Collection<MaterialRecord> allMaterials() {
        return materials.values();
    }

    public Collection<ProcessRecord> allProcesses() {
        return processes.values();
    }

    public Collection<TransportModeRecord> allTransportModes() {
        return transportModes.values();
    }

    public Collection<RegionalGridRecord> allRegionalGrids() {
        return regionalGrids.values();
    }

    public String getSummary() {
        return String.format("%s: %d materials, %d processes, %d transport modes, %d regions",
                name, materials.size(), processes.size(), transportModes.size(), regionalGrids.size());
    }
}
