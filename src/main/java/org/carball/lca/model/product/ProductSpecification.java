package org.carball.lca.model.product;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import org.carball.lca.model.reference.RegionalGridRecord;

import java.util.List;

/**
 * Caller-supplied description of a product. Immutable once built; the engine only reads it.
 */
@Builder(toBuilder = true)
public record ProductSpecification(
        @JsonProperty("product_id") String productId,
        @JsonProperty("product_name") String productName,
        @JsonProperty("materials") @Singular("material") List<MaterialEntry> materials,
        @JsonProperty("manufacturing_processes") @Singular("process") List<ProcessEntry> processes,
        @JsonProperty("manufacturing_region") String manufacturingRegion,
        @JsonProperty("transport_legs") @Singular("transportLeg") List<TransportLeg> transportLegs,
        @JsonProperty("use_scenarios") @Singular("useScenario") List<UseScenario> useScenarios,
        @JsonProperty("lifetime_years") Integer lifetimeYears,
        @JsonProperty("end_of_life") EndOfLifeScenario endOfLife,
        @JsonProperty("allocation_method") AllocationMethod allocationMethod
) {

    public ProductSpecification {
        materials = materials == null ? List.of() : List.copyOf(materials);
        processes = processes == null ? List.of() : List.copyOf(processes);
        transportLegs = transportLegs == null ? List.of() : List.copyOf(transportLegs);
        useScenarios = useScenarios == null ? List.of() : List.copyOf(useScenarios);
        if (productName == null || productName.isBlank()) {
            productName = "Unnamed Product";
        }
        if (manufacturingRegion == null || manufacturingRegion.isBlank()) {
            manufacturingRegion = RegionalGridRecord.GLOBAL_AVERAGE;
        }
        if (lifetimeYears == null) {
            lifetimeYears = 1;
        }
        if (endOfLife == null) {
            endOfLife = EndOfLifeScenario.defaults();
        }
        if (allocationMethod == null) {
            allocationMethod = AllocationMethod.MASS;
        }
    }

    public double declaredMassKg() {
        return materials.stream().mapToDouble(MaterialEntry::massKg).sum();
    }
}
