package org.carball.lca.calculator;

import org.carball.lca.model.product.MaterialEntry;
import org.carball.lca.model.reference.MaterialRecord;

/**
 * A material entry of the product paired with its catalog record.
 */
public record ResolvedMaterial(MaterialEntry entry, MaterialRecord record) {

    public String materialId() {
        return entry.materialId();
    }

    public double massKg() {
        return entry.massKg();
    }

    public double recycledContent() {
        return entry.recycledContent();
    }
}
