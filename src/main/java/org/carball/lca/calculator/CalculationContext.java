package org.carball.lca.calculator;

import lombok.extern.slf4j.Slf4j;
import org.carball.lca.config.EngineConfig;
import org.carball.lca.model.product.MaterialEntry;
import org.carball.lca.model.product.ProductSpecification;
import org.carball.lca.model.reference.MaterialRecord;
import org.carball.lca.model.result.DataQualityWarning;
import org.carball.lca.reference.ReferenceDataProvider;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Everything a phase calculator may read during one calculation: the product,
 * a fixed snapshot of the reference data, the engine configuration and the
 * materials that resolved against the catalog.
 */
@Slf4j
public final class CalculationContext {

    private final ProductSpecification specification;
    private final ReferenceDataProvider reference;
    private final EngineConfig config;
    private final List<ResolvedMaterial> resolvedMaterials;
    private final List<DataQualityWarning> materialWarnings;
    private final double totalMassKg;

    private CalculationContext(ProductSpecification specification,
                               ReferenceDataProvider reference,
                               EngineConfig config,
                               List<ResolvedMaterial> resolvedMaterials,
                               List<DataQualityWarning> materialWarnings) {
        this.specification = specification;
        this.reference = reference;
        this.config = config;
        this.resolvedMaterials = List.copyOf(resolvedMaterials);
        this.materialWarnings = List.copyOf(materialWarnings);
        this.totalMassKg = this.resolvedMaterials.stream().mapToDouble(ResolvedMaterial::massKg).sum();
    }

    /**
     * Resolves the product's materials against the given reference snapshot.
     * Unknown ids are dropped and reported once, here.
     */
    public static CalculationContext resolve(ProductSpecification specification,
                                             ReferenceDataProvider reference,
                                             EngineConfig config) {
        List<ResolvedMaterial> resolved = new ArrayList<>();
        List<DataQualityWarning> warnings = new ArrayList<>();

        for (MaterialEntry entry : specification.materials()) {
            Optional<MaterialRecord> record = reference.getMaterial(entry.materialId());
            if (record.isPresent()) {
                resolved.add(new ResolvedMaterial(entry, record.get()));
            } else {
                log.warn("Material '{}' not found in reference data, skipping", entry.materialId());
                warnings.add(DataQualityWarning.materialNotFound(entry.materialId()));
            }
        }

        return new CalculationContext(specification, reference, config, resolved, warnings);
    }

    /**
     * Same reference data and configuration, different product. Used by the what-if analyses.
     */
    public CalculationContext withSpecification(ProductSpecification other) {
        return resolve(other, reference, config);
    }

    public ProductSpecification specification() {
        return specification;
    }

    public ReferenceDataProvider reference() {
        return reference;
    }

    public EngineConfig config() {
        return config;
    }

    public List<ResolvedMaterial> resolvedMaterials() {
        return resolvedMaterials;
    }

    public List<DataQualityWarning> materialWarnings() {
        return materialWarnings;
    }

    /**
     * Mass of the materials found in the catalog. Unknown entries weigh nothing.
     */
    public double totalMassKg() {
        return totalMassKg;
    }
}
