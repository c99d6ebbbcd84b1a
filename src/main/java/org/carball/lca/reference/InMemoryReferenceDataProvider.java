package org.carball.lca.reference;

import lombok.extern.slf4j.Slf4j;
import org.carball.lca.model.reference.MaterialRecord;
import org.carball.lca.model.reference.ProcessRecord;
import org.carball.lca.model.reference.RegionalGridRecord;
import org.carball.lca.model.reference.TransportModeRecord;

import java.util.Collection;
import java.util.Objects;
import java.util.Optional;

/**
 * Provider whose catalog can be swapped at runtime. Each swap replaces the whole
 * catalog, so a snapshot never mixes records from two versions.
 */
@Slf4j
public class InMemoryReferenceDataProvider implements ReferenceDataProvider {

    private volatile ReferenceCatalog catalog;

    public InMemoryReferenceDataProvider(ReferenceCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    public void reload(ReferenceCatalog newCatalog) {
        Objects.requireNonNull(newCatalog, "newCatalog");
        log.info("Reloading reference data: {} -> {}", catalog.getSummary(), newCatalog.getSummary());
        this.catalog = newCatalog;
    }

    @Override
    public ReferenceDataProvider snapshot() {
        return catalog;
    }

    @Override
    public Optional<MaterialRecord> getMaterial(String id) {
        return catalog.getMaterial(id);
    }

    @Override
    public Optional<ProcessRecord> getProcess(String id) {
        return catalog.getProcess(id);
    }

    @Override
    public Optional<TransportModeRecord> getTransportMode(String id) {
        return catalog.getTransportMode(id);
    }

    @Override
    public RegionalGridRecord getRegionalFactor(String region) {
        return catalog.getRegionalFactor(region);
    }

    @Override
    public Collection<MaterialRecord> allMaterials() {
        return catalog.allMaterials();
    }
}
