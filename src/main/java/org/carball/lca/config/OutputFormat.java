package org.carball.lca.config;

public enum OutputFormat {
    JSON("json"),
    YAML("yml");

    private final String extension;

    OutputFormat(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }
}
