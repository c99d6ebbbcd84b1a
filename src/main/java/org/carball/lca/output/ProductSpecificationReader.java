package org.carball.lca.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.carball.lca.model.product.ProductSpecification;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Reads a product specification from a JSON or YAML file, chosen by extension.
 */
@Slf4j
public class ProductSpecificationReader {

    private final ObjectMapper jsonMapper = new ObjectMapper();
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public ProductSpecification read(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("Product specification file not found: " + path);
        }
        ObjectMapper mapper = isYaml(path) ? yamlMapper : jsonMapper;
        ProductSpecification spec = mapper.readValue(path.toFile(), ProductSpecification.class);
        log.info("Loaded product specification '{}' from {}", spec.productId(), path);
        return spec;
    }

    public ProductSpecification readJson(String json) throws IOException {
        return jsonMapper.readValue(json, ProductSpecification.class);
    }

    static boolean isYaml(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yml") || name.endsWith(".yaml");
    }
}
