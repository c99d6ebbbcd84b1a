package org.carball.lca.reference;

import org.carball.lca.model.reference.MaterialRecord;
import org.carball.lca.model.reference.ProcessRecord;
import org.carball.lca.model.reference.RegionalGridRecord;
import org.carball.lca.model.reference.TransportModeRecord;

import java.util.Collection;
import java.util.Optional;

/**
 * Read-only access to material, process, transport and grid reference data.
 * Lookups are expected to be fast and synchronous.
 */
public interface ReferenceDataProvider {

    Optional<MaterialRecord> getMaterial(String id);

    Optional<ProcessRecord> getProcess(String id);

    Optional<TransportModeRecord> getTransportMode(String id);

    /**
     * Never empty: unknown regions resolve to the global average grid.
     * Compare {@link RegionalGridRecord#region()} with the requested id to detect the fallback.
     */
    RegionalGridRecord getRegionalFactor(String region);

    Collection<MaterialRecord> allMaterials();

    /**
     * A view that will not change for the rest of a calculation. Immutable providers return themselves.
     */
    default ReferenceDataProvider snapshot() {
        return this;
    }
}
