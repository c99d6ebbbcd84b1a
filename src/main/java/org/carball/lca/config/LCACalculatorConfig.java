package org.carball.lca.config;

import lombok.Data;

import java.nio.file.Path;
import java.util.List;

/**
 * Command-line options of a single CLI run.
 */
@Data
public class LCACalculatorConfig {
    private Path specificationFile;
    private Path catalogFile;
    private Path settingsFile;
    private String profileName;
    private String outputFile;
    private OutputFormat outputFormat;
    private Integer trials;
    private Long seed;
    private List<String> sensitivityParameters;
    private boolean verbose;
}
