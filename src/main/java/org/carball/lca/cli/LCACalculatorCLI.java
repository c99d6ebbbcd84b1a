package org.carball.lca.cli;

import lombok.extern.slf4j.Slf4j;
import org.carball.lca.config.AnalysisProfile;
import org.carball.lca.config.ConfigurationLoader;
import org.carball.lca.config.EngineConfig;
import org.carball.lca.config.EngineSettingsFile;
import org.carball.lca.config.LCACalculatorConfig;
import org.carball.lca.config.OutputFormat;
import org.carball.lca.engine.LCAEngine;
import org.carball.lca.model.product.ProductSpecification;
import org.carball.lca.model.result.Hotspot;
import org.carball.lca.model.result.LCAResult;
import org.carball.lca.model.result.LifeCyclePhase;
import org.carball.lca.model.result.PhaseResult;
import org.carball.lca.model.result.SensitivityParameter;
import org.carball.lca.model.result.SensitivityReport;
import org.carball.lca.output.LCAReport;
import org.carball.lca.output.ProductSpecificationReader;
import org.carball.lca.reference.ReferenceCatalog;
import org.carball.lca.reference.ReferenceCatalogLoader;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

@Slf4j
public class LCACalculatorCLI {

    private static final String VERSION = "1.0.0";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════════════════════╗
        ║          Life-Cycle Impact Assessment Engine v%s          ║
        ╚═══════════════════════════════════════════════════════════════╝
        """;

    public static void main(String[] args) {
        System.out.printf((BANNER) + "%n", VERSION);

        if (args.length < 1 || isHelpRequested(args)) {
            printUsage();
            System.exit(args.length < 1 ? 1 : 0);
        }

        try {
            LCACalculatorConfig options = parseArgs(args);

            System.out.println("\n🔍 Starting assessment...");
            System.out.println("   Product specification: " + options.getSpecificationFile());
            System.out.println("   Profile: " + options.getProfileName());
            System.out.println("   Output: " + options.getOutputFile());
            System.out.println();

            System.out.print("📚 Loading reference data... ");
            ReferenceCatalogLoader catalogLoader = new ReferenceCatalogLoader();
            ReferenceCatalog catalog = options.getCatalogFile() != null
                    ? catalogLoader.load(options.getCatalogFile())
                    : catalogLoader.loadDefault();
            System.out.println("✓");
            if (options.isVerbose()) {
                System.out.println("     - " + catalog.getSummary());
            }

            EngineConfig engineConfig = loadEngineConfig(options, args);
            ProductSpecification spec = new ProductSpecificationReader().read(options.getSpecificationFile());
            LCAEngine engine = new LCAEngine(catalog, engineConfig);

            System.out.print("🌍 Calculating life-cycle impacts... ");
            LCAResult result = options.getTrials() != null || options.getSeed() != null
                    ? engine.calculateWithUncertainty(spec,
                            options.getTrials() != null ? options.getTrials() : engineConfig.getMonteCarloTrials(),
                            options.getSeed() != null ? options.getSeed() : engineConfig.getRandomSeed())
                    : engine.calculate(spec);
            System.out.println("✓");

            SensitivityReport sensitivity = null;
            if (options.getSensitivityParameters() != null) {
                System.out.print("📈 Running sensitivity analysis... ");
                sensitivity = engine.sensitivityAnalysis(spec, parseSensitivityParameters(options.getSensitivityParameters()));
                System.out.println("✓");
            }

            System.out.print("📝 Writing results... ");
            writeReport(new LCAReport(result, sensitivity), options);
            System.out.println("✓");

            printSummary(result);

            System.out.println("\n✅ Assessment complete!");
            System.out.println("   Output file: " + options.getOutputFile());

        } catch (IllegalArgumentException e) {
            System.err.println("\n❌ Configuration error: " + e.getMessage());
            System.err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            System.exit(1);
        } catch (IOException e) {
            System.err.println("\n❌ IO error: " + e.getMessage());
            log.debug("IO error details", e);
            System.exit(1);
        } catch (Exception e) {
            System.err.println("\n❌ Unexpected error: " + e.getMessage());
            log.debug("Unexpected error details", e);
            System.exit(1);
        }
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private static void printUsage() {
        System.out.println("\nUsage: java -jar lca-engine.jar <product-spec.json|yml> [options]");
        System.out.println();
        System.out.println("Arguments:");
        System.out.println("  product-spec        Product specification file (.json, .yml or .yaml)");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --output, -o        Output file (default: lca-result.json)");
        System.out.println("  --format, -f        Output format: json|yaml (default: json)");
        System.out.println("  --catalog           Reference catalog JSON file (default: bundled catalog)");
        System.out.println("  --profile           Analysis profile: " + AnalysisProfile.getAvailableProfiles());
        System.out.println("  --settings          YAML file with engine settings (optional)");
        System.out.println("  --trials            Monte Carlo trials for this run");
        System.out.println("  --seed              Random seed for this run");
        System.out.println("  --sensitivity       Comma-separated parameters to vary, or 'all'");
        System.out.println("  --verbose, -v       Enable verbose output");
        System.out.println("  --help, -h          Show this help message");
        System.out.println();
        System.out.println("Examples:");
        System.out.println("  # Basic assessment");
        System.out.println("  java -jar lca-engine.jar bottle.json");
        System.out.println();
        System.out.println("  # Detailed profile with sensitivity analysis, YAML output");
        System.out.println("  java -jar lca-engine.jar bottle.yml --profile detailed --sensitivity all -f yaml");
        System.out.println();
        System.out.print(AnalysisProfile.getProfileHelp());
        System.out.println();
        System.out.print(ConfigurationLoader.getConfigHelp());
    }

    static LCACalculatorConfig parseArgs(String[] args) {
        LCACalculatorConfig config = new LCACalculatorConfig();
        config.setSpecificationFile(Paths.get(args[0]));

        config.setOutputFile("lca-result.json");
        config.setOutputFormat(OutputFormat.JSON);
        config.setProfileName(AnalysisProfile.STANDARD.getName());
        config.setVerbose(false);

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--output":
                case "-o":
                    config.setOutputFile(requireValue(args, ++i, "Output file not specified"));
                    break;

                case "--format":
                case "-f":
                    String format = requireValue(args, ++i, "Output format not specified");
                    try {
                        config.setOutputFormat(OutputFormat.valueOf(format.toUpperCase(Locale.ROOT)));
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException("Invalid output format. Use: json or yaml");
                    }
                    break;

                case "--catalog":
                    config.setCatalogFile(Paths.get(requireValue(args, ++i, "Catalog file not specified")));
                    break;

                case "--profile":
                    String profile = requireValue(args, ++i, "Profile not specified");
                    AnalysisProfile.fromName(profile);
                    config.setProfileName(profile);
                    break;

                case "--settings":
                    config.setSettingsFile(Paths.get(requireValue(args, ++i, "Settings file not specified")));
                    break;

                case "--trials":
                    config.setTrials(parseInt(requireValue(args, ++i, "Trial count not specified"), "--trials"));
                    break;

                case "--seed":
                    config.setSeed(parseLong(requireValue(args, ++i, "Seed not specified"), "--seed"));
                    break;

                case "--sensitivity":
                    String parameters = requireValue(args, ++i, "Sensitivity parameters not specified");
                    config.setSensitivityParameters(parameters.equalsIgnoreCase("all")
                            ? List.of()
                            : Arrays.stream(parameters.split(",")).map(String::trim).collect(Collectors.toList()));
                    break;

                case "--verbose":
                case "-v":
                    config.setVerbose(true);
                    break;

                default:
                    if (args[i].startsWith("--config.")) {
                        // handled by ConfigurationLoader
                        i++;
                        break;
                    }
                    throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }

        String baseFileName = removeFileExtension(config.getOutputFile());
        config.setOutputFile(baseFileName + "." + config.getOutputFormat().getExtension());

        validateConfig(config);
        return config;
    }

    private static String requireValue(String[] args, int index, String message) {
        if (index >= args.length) {
            throw new IllegalArgumentException(message);
        }
        return args[index];
    }

    private static int parseInt(String value, String option) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + option + ": " + value);
        }
    }

    private static long parseLong(String value, String option) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + option + ": " + value);
        }
    }

    static String removeFileExtension(String filename) {
        int lastDotIndex = filename.lastIndexOf('.');
        if (lastDotIndex > 0 && lastDotIndex < filename.length() - 1) {
            int lastSeparatorIndex = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
            if (lastDotIndex > lastSeparatorIndex) {
                return filename.substring(0, lastDotIndex);
            }
        }
        return filename;
    }

    private static void validateConfig(LCACalculatorConfig config) {
        if (!Files.exists(config.getSpecificationFile())) {
            throw new IllegalArgumentException("Product specification file not found: " + config.getSpecificationFile());
        }

        if (config.getCatalogFile() != null && !Files.exists(config.getCatalogFile())) {
            throw new IllegalArgumentException("Catalog file not found: " + config.getCatalogFile());
        }

        if (config.getSettingsFile() != null && !Files.exists(config.getSettingsFile())) {
            throw new IllegalArgumentException("Settings file not found: " + config.getSettingsFile());
        }

        if (config.getTrials() != null && config.getTrials() < 1) {
            throw new IllegalArgumentException("--trials must be at least 1");
        }

        Path outputDir = Paths.get(config.getOutputFile()).getParent();
        if (outputDir != null && !Files.exists(outputDir)) {
            throw new IllegalArgumentException("Output directory does not exist: " + outputDir);
        }
    }

    private static EngineConfig loadEngineConfig(LCACalculatorConfig options, String[] args) throws IOException {
        EngineSettingsFile settings = null;
        if (options.getSettingsFile() != null) {
            settings = EngineSettingsFile.load(options.getSettingsFile());
            log.info("Loaded engine settings from: {}", options.getSettingsFile());
        }
        return new ConfigurationLoader().loadConfigurationWithProfile(options.getProfileName(), settings, args);
    }

    private static List<SensitivityParameter> parseSensitivityParameters(List<String> names) {
        return names.stream()
                .map(SensitivityParameter::fromKey)
                .collect(Collectors.toList());
    }

    private static void writeReport(LCAReport report, LCACalculatorConfig options) throws IOException {
        String content = options.getOutputFormat() == OutputFormat.YAML ? report.toYaml() : report.toJson();
        Files.writeString(Paths.get(options.getOutputFile()), content);
    }

    private static void printSummary(LCAResult result) {
        System.out.println("\n" + "=".repeat(60));
        System.out.println("📊 ASSESSMENT SUMMARY: " + result.getProductName());
        System.out.println("=".repeat(60));

        System.out.printf("%nTotal carbon footprint: %.4f kgCO2e%n", result.getTotals().carbonKgCo2e());
        System.out.printf("Total energy: %.2f MJ%n", result.getTotals().energyMj());
        System.out.printf("Total water: %.2f L%n", result.getTotals().waterL());

        System.out.println("\nBy phase:");
        for (LifeCyclePhase phase : LifeCyclePhase.values()) {
            PhaseResult phaseResult = result.phase(phase);
            if (phaseResult != null) {
                System.out.printf("  %-15s %12.4f kgCO2e%n", phase.getKey(), phaseResult.carbonKgCo2e());
            }
        }

        if (result.getUncertainty() != null) {
            result.getUncertainty().carbonInterval(95.0).ifPresent(ci ->
                    System.out.printf("%n95%% interval: %.4f - %.4f kgCO2e (%d trials)%n",
                            ci.lower(), ci.upper(), result.getUncertainty().getTrials()));
        }

        System.out.printf("%nCircularity: %.2f (%s)%n",
                result.getCircularity().materialCircularityIndicator(),
                result.getCircularity().circularityClass().getDisplayName());

        System.out.println("\n🎯 Hotspots:");
        System.out.println("-".repeat(60));
        for (Hotspot hotspot : result.getHotspots()) {
            System.out.printf("%-15s %6.1f%%  %s%n", hotspot.phase().getKey(), hotspot.percentage(), hotspot.significance());
        }

        if (!result.getImprovementPotential().recommendations().isEmpty()) {
            System.out.println("\n💡 Recommendations:");
            result.getImprovementPotential().recommendations()
                    .forEach(recommendation -> System.out.println("  - " + recommendation));
        }

        if (!result.warnings().isEmpty()) {
            System.out.println("\n⚠️  Data-quality warnings:");
            result.warnings().forEach(warning -> System.out.println("  - " + warning.message()));
        }
    }
}
