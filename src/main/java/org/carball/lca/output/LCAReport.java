package org.carball.lca.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.lca.model.result.LCAResult;
import org.carball.lca.model.result.SensitivityReport;

/**
 * Machine-readable rendering of a calculation, optionally with its sensitivity analysis.
 */
@Slf4j
public class LCAReport {

    public static final String REPORT_VERSION = "1.0.0";

    private final LCAResult result;
    private final SensitivityReport sensitivity;
    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper;

    public LCAReport(LCAResult result) {
        this(result, null);
    }

    public LCAReport(LCAResult result, SensitivityReport sensitivity) {
        this.result = result;
        this.sensitivity = sensitivity;
        this.jsonMapper = configure(new ObjectMapper());
        this.yamlMapper = configure(new ObjectMapper(new YAMLFactory()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)));
    }

    private static ObjectMapper configure(ObjectMapper mapper) {
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        return mapper;
    }

    public String toJson() {
        try {
            return jsonMapper.writeValueAsString(buildReportData());
        } catch (Exception e) {
            log.error("Error generating JSON report", e);
            throw new RuntimeException("Failed to generate JSON report", e);
        }
    }

    public String toYaml() {
        try {
            return yamlMapper.writeValueAsString(buildReportData());
        } catch (Exception e) {
            log.error("Error generating YAML report", e);
            throw new RuntimeException("Failed to generate YAML report", e);
        }
    }

    private ReportData buildReportData() {
        return new ReportData(REPORT_VERSION, result, sensitivity);
    }

    record ReportData(
            @JsonProperty("report_version") String reportVersion,
            @JsonProperty("result") LCAResult result,
            @JsonProperty("sensitivity") SensitivityReport sensitivity
    ) {}
}
