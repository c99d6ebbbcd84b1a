package org.carball.lca.config;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;

@Slf4j
public class ConfigurationLoader {

    private final Map<String, String> environment;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > defaults
     */
    public EngineConfig loadConfiguration(String[] args) {
        log.debug("Loading configuration");

        EngineConfig.EngineConfigBuilder builder = EngineConfig.defaults().toBuilder();

        applyEnvironmentVariables(builder);
        applyCLIArguments(builder, args);

        EngineConfig config = builder.build();
        config.validate();

        log.info("Configuration loaded: {}", config.getConfigurationSummary());
        return config;
    }

    public EngineConfig loadProfile(String profileName) {
        try {
            AnalysisProfile profile = AnalysisProfile.fromName(profileName);
            EngineConfig config = profile.buildConfig();
            log.info("Loaded profile '{}': {}", profileName, config.getConfigurationSummary());
            return config;
        } catch (IllegalArgumentException e) {
            log.error("Unknown profile: {}. {}", profileName, e.getMessage());
            throw e;
        }
    }

    /**
     * Loads a profile, then overlays the settings file (if any), environment variables and CLI arguments.
     */
    public EngineConfig loadConfigurationWithProfile(String profileName, EngineSettingsFile settings, String[] args) {
        EngineConfig.EngineConfigBuilder builder = loadProfile(profileName).toBuilder();

        if (settings != null) {
            settings.applyTo(builder);
        }
        applyEnvironmentVariables(builder);
        applyCLIArguments(builder, args);

        EngineConfig config = builder.build();
        config.validate();

        log.info("Configuration loaded with profile '{}': {}", profileName, config.getConfigurationSummary());
        return config;
    }

    private void applyEnvironmentVariables(EngineConfig.EngineConfigBuilder builder) {
        for (Map.Entry<String, String> entry : environment.entrySet()) {
            String key = entry.getKey();
            String value = entry.getValue();
            try {
                switch (key) {
                    case "LCA_MONTE_CARLO_TRIALS":
                        builder.monteCarloTrials(Integer.parseInt(value));
                        break;
                    case "LCA_RANDOM_SEED":
                        builder.randomSeed(Long.parseLong(value));
                        break;
                    case "LCA_USE_GRID_FACTOR":
                        builder.useGridCarbonKgPerKwh(Double.parseDouble(value));
                        break;
                    case "LCA_GRID_DECARBONIZATION_RATE":
                        builder.gridDecarbonizationRate(Double.parseDouble(value));
                        break;
                    case "LCA_MAX_HOTSPOTS":
                        builder.maxHotspots(Integer.parseInt(value));
                        break;
                    case "LCA_CARBON_PRICE":
                        builder.carbonPriceUsdPerTonne(Double.parseDouble(value));
                        break;
                    case "LCA_PARALLEL_TRIALS":
                        builder.parallelTrials(Boolean.parseBoolean(value));
                        break;
                    default:
                        break;
                }
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for {}: {}", key, value);
            }
        }
    }

    private void applyCLIArguments(EngineConfig.EngineConfigBuilder builder, String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            String value = args[i + 1];

            try {
                switch (arg) {
                    case "--config.trials":
                        builder.monteCarloTrials(Integer.parseInt(value));
                        break;
                    case "--config.seed":
                        builder.randomSeed(Long.parseLong(value));
                        break;
                    case "--config.grid-factor":
                        builder.useGridCarbonKgPerKwh(Double.parseDouble(value));
                        break;
                    case "--config.decarbonization-rate":
                        builder.gridDecarbonizationRate(Double.parseDouble(value));
                        break;
                    case "--config.relative-std":
                        double std = Double.parseDouble(value);
                        builder.processRelativeStd(std).transportRelativeStd(std);
                        break;
                    case "--config.hotspot-threshold":
                        builder.hotspotThresholdPercent(Double.parseDouble(value));
                        break;
                    case "--config.max-hotspots":
                        builder.maxHotspots(Integer.parseInt(value));
                        break;
                    case "--config.carbon-price":
                        builder.carbonPriceUsdPerTonne(Double.parseDouble(value));
                        break;
                    case "--config.recycled-target":
                        builder.recycledContentTarget(Double.parseDouble(value));
                        break;
                }
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for {}: {}", arg, value);
            }
        }
    }

    public static String getConfigHelp() {
        return """
            Engine Configuration Options:

            CLI Arguments:
              --config.trials <num>                 Monte Carlo trial count (0 disables uncertainty)
              --config.seed <num>                   Base random seed
              --config.grid-factor <num>            Use-phase grid factor in kgCO2e/kWh
              --config.decarbonization-rate <num>   Annual grid decarbonization rate (0-1)
              --config.relative-std <num>           Relative std of process/transport perturbation
              --config.hotspot-threshold <num>      Minimum phase share (%) to report a hotspot
              --config.max-hotspots <num>           Maximum number of hotspots (capped at 5)
              --config.carbon-price <num>           Carbon price in USD per tonne CO2e
              --config.recycled-target <num>        Recycled content below which a recommendation is made

            Environment Variables:
              LCA_MONTE_CARLO_TRIALS                Same as --config.trials
              LCA_RANDOM_SEED                       Same as --config.seed
              LCA_USE_GRID_FACTOR                   Same as --config.grid-factor
              LCA_GRID_DECARBONIZATION_RATE         Same as --config.decarbonization-rate
              LCA_MAX_HOTSPOTS                      Same as --config.max-hotspots
              LCA_CARBON_PRICE                      Same as --config.carbon-price
              LCA_PARALLEL_TRIALS                   true/false, run Monte Carlo trials in parallel

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. Settings file (--settings)
              4. Profile defaults or built-in defaults
            """;
    }
}
