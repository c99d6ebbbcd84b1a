package org.carball.lca.reference;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.lca.model.reference.MaterialRecord;
import org.carball.lca.model.reference.ProcessRecord;
import org.carball.lca.model.reference.RegionalGridRecord;
import org.carball.lca.model.reference.TransportModeRecord;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads a reference catalog from JSON. The bundled default catalog lives on the classpath.
 */
@Slf4j
public class ReferenceCatalogLoader {

    public static final String DEFAULT_CATALOG_RESOURCE = "/reference-catalog.json";

    private static final String[] REQUIRED_SECTIONS = {"materials", "processes", "transport_modes", "regional_grids"};

    private final ObjectMapper objectMapper;

    public ReferenceCatalogLoader() {
        this(new ObjectMapper());
    }

    public ReferenceCatalogLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ReferenceCatalog loadDefault() throws IOException {
        try (InputStream in = ReferenceCatalogLoader.class.getResourceAsStream(DEFAULT_CATALOG_RESOURCE)) {
            if (in == null) {
                throw new IOException("Default reference catalog not found on classpath: " + DEFAULT_CATALOG_RESOURCE);
            }
            return parse(objectMapper.readTree(in));
        }
    }

    public ReferenceCatalog load(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("Reference catalog file not found: " + path);
        }
        String content = Files.readString(path);
        return parse(objectMapper.readTree(content));
    }

    public ReferenceCatalog parse(String json) throws IOException {
        return parse(objectMapper.readTree(json));
    }

    private ReferenceCatalog parse(JsonNode root) {
        validateCatalogFormat(root);

        JsonNode metadata = root.get("catalog_metadata");
        String name = metadata != null && metadata.has("name") ? metadata.get("name").asText() : "unnamed catalog";

        List<MaterialRecord> materials = objectMapper.convertValue(root.get("materials"), new TypeReference<>() {});
        List<ProcessRecord> processes = objectMapper.convertValue(root.get("processes"), new TypeReference<>() {});
        List<TransportModeRecord> modes = objectMapper.convertValue(root.get("transport_modes"), new TypeReference<>() {});
        List<RegionalGridRecord> grids = objectMapper.convertValue(root.get("regional_grids"), new TypeReference<>() {});

        ReferenceCatalog catalog = new ReferenceCatalog(name, materials, processes, modes, grids);
        log.info("Loaded reference catalog {}", catalog.getSummary());
        return catalog;
    }

    private void validateCatalogFormat(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalStateException("Invalid JSON format in reference catalog");
        }
        for (String section : REQUIRED_SECTIONS) {
            JsonNode node = root.get(section);
            if (node == null || !node.isArray()) {
                throw new IllegalStateException("Missing or invalid " + section + " section in reference catalog");
            }
        }
        for (JsonNode material : root.get("materials")) {
            if (!material.hasNonNull("id")) {
                throw new IllegalStateException("Material entry without id in reference catalog");
            }
        }
    }
}
