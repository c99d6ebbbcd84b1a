package org.carball.lca.reference;

import org.carball.lca.model.reference.MaterialRecord;
import org.carball.lca.model.reference.RegionalGridRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryReferenceDataProviderTest {

    private ReferenceCatalog original;
    private ReferenceCatalog updated;

    @BeforeEach
    void setUp() {
        original = new ReferenceCatalog("v1",
                List.of(material("STEEL", 2.0)), List.of(), List.of(), List.of());
        updated = new ReferenceCatalog("v2",
                List.of(material("STEEL", 1.5), material("WOOD", 0.2)), List.of(), List.of(),
                List.of(new RegionalGridRecord("Testland", 100, 0.5)));
    }

    @Test
    void shouldServeRecordsFromCurrentCatalog() {
        // Given
        InMemoryReferenceDataProvider provider = new InMemoryReferenceDataProvider(original);

        // When
        provider.reload(updated);

        // Then
        assertThat(provider.getMaterial("STEEL").orElseThrow().carbonKgCo2ePerKg()).isEqualTo(1.5);
        assertThat(provider.getMaterial("WOOD")).isPresent();
        assertThat(provider.allMaterials()).hasSize(2);
        assertThat(provider.getRegionalFactor("Testland").carbonGCo2ePerKwh()).isEqualTo(100.0);
    }

    @Test
    void shouldKeepSnapshotStableAcrossReload() {
        // Given
        InMemoryReferenceDataProvider provider = new InMemoryReferenceDataProvider(original);
        ReferenceDataProvider snapshot = provider.snapshot();

        // When
        provider.reload(updated);

        // Then
        assertThat(snapshot.getMaterial("STEEL").orElseThrow().carbonKgCo2ePerKg()).isEqualTo(2.0);
        assertThat(snapshot.getMaterial("WOOD")).isEmpty();
        assertThat(provider.snapshot().getMaterial("WOOD")).isPresent();
    }

    @Test
    void shouldReturnCatalogItselfAsSnapshot() {
        assertThat(original.snapshot()).isSameAs(original);
    }

    private static MaterialRecord material(String id, double carbon) {
        return new MaterialRecord(id, id, "Test", 1000, 10, 1, carbon, 0.1, 10, 0.5, 0.5, 1.0, 100);
    }
}
