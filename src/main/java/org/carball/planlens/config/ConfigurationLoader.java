package org.carball.planlens.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;

@Slf4j
public class ConfigurationLoader {

    static final String ENV_PREFIX = "PLANLENS_";

    private final Map<String, String> environment;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    public ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads thresholds using the hierarchy: CLI args > env vars > threshold file > defaults.
     * The threshold file is named by {@code --config <file>}.
     */
    public AnalyzerThresholds loadConfiguration(String[] args) {
        log.debug("Loading configuration");

        AnalyzerThresholds.AnalyzerThresholdsBuilder builder = AnalyzerThresholds.builder();

        // 1. Threshold file
        String configPath = extractConfigPath(args);
        if (configPath != null) {
            loadOverrides(Paths.get(configPath)).applyTo(builder);
        }

        // 2. Environment variables
        applyEnvironmentVariables(builder);

        // 3. CLI arguments (highest priority)
        applyCLIArguments(builder, args);

        AnalyzerThresholds thresholds = builder.build();
        thresholds.validate();

        log.info("Configuration loaded: {}", thresholds.getConfigurationSummary());
        return thresholds;
    }

    /**
     * Reads a YAML threshold file.
     *
     * @throws IllegalArgumentException when the file is missing or not valid YAML
     */
    public ThresholdOverrides loadOverrides(Path configFile) {
        if (!Files.exists(configFile)) {
            throw new IllegalArgumentException("Threshold config file not found: " + configFile);
        }
        try {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            ThresholdOverrides overrides = mapper.readValue(configFile.toFile(), ThresholdOverrides.class);
            log.info("Loaded threshold configuration from: {}", configFile);
            return overrides != null ? overrides : new ThresholdOverrides();
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid threshold config file " + configFile + ": " + e.getMessage(), e);
        }
    }

    private void applyEnvironmentVariables(AnalyzerThresholds.AnalyzerThresholdsBuilder builder) {
        applyEnv("HIGH_COST_RATIO", Double::parseDouble, builder::highCostRatio);
        applyEnv("MEDIUM_COST_RATIO", Double::parseDouble, builder::mediumCostRatio);
        applyEnv("LOW_ABSOLUTE_COST", Double::parseDouble, builder::lowAbsoluteCost);
        applyEnv("SEVERE_ROW_RATIO", Double::parseDouble, builder::severeRowRatio);
        applyEnv("SIGNIFICANT_ROW_RATIO", Double::parseDouble, builder::significantRowRatio);
        applyEnv("SEQ_SCAN_ROW_THRESHOLD", Long::parseLong, builder::seqScanRowThreshold);
        applyEnv("DOCS_EXAMINED_RATIO", Double::parseDouble, builder::docsExaminedRatioThreshold);
        applyEnv("INDEX_NAME_MAX_LENGTH", Integer::parseInt, builder::indexNameMaxLength);
    }

    private <T> void applyEnv(String name, Function<String, T> parser, Consumer<T> setter) {
        String value = environment.get(ENV_PREFIX + name);
        if (value == null) {
            return;
        }
        try {
            setter.accept(parser.apply(value.trim()));
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for {}{}: {}", ENV_PREFIX, name, value);
        }
    }

    private void applyCLIArguments(AnalyzerThresholds.AnalyzerThresholdsBuilder builder, String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            String value = args[i + 1];

            try {
                switch (arg) {
                    case "--thresholds.high-cost":
                        builder.highCostRatio(Double.parseDouble(value));
                        break;
                    case "--thresholds.medium-cost":
                        builder.mediumCostRatio(Double.parseDouble(value));
                        break;
                    case "--thresholds.low-absolute-cost":
                        builder.lowAbsoluteCost(Double.parseDouble(value));
                        break;
                    case "--thresholds.severe-rows":
                        builder.severeRowRatio(Double.parseDouble(value));
                        break;
                    case "--thresholds.significant-rows":
                        builder.significantRowRatio(Double.parseDouble(value));
                        break;
                    case "--thresholds.seq-scan-rows":
                        builder.seqScanRowThreshold(Long.parseLong(value));
                        break;
                    case "--thresholds.docs-examined-ratio":
                        builder.docsExaminedRatioThreshold(Double.parseDouble(value));
                        break;
                    case "--thresholds.index-name-length":
                        builder.indexNameMaxLength(Integer.parseInt(value));
                        break;
                    default:
                        break;
                }
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for {}: {}", arg, value);
            }
        }
    }

    static String extractConfigPath(String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            if ("--config".equals(args[i])) {
                return args[i + 1];
            }
        }
        return null;
    }

    /**
     * Returns help text for threshold configuration options.
     */
    public static String getThresholdHelp() {
        return """
            Threshold Configuration Options:

            CLI Arguments:
              --config <file>                         YAML threshold file
              --thresholds.high-cost <num>            Share of max cost for HIGH (default 0.3)
              --thresholds.medium-cost <num>          Share of max cost for MEDIUM (default 0.1)
              --thresholds.low-absolute-cost <num>    Costs below this are never HIGH (default 0.1)
              --thresholds.severe-rows <num>          Severe row misestimate ratio (default 100)
              --thresholds.significant-rows <num>     Significant row misestimate ratio (default 10)
              --thresholds.seq-scan-rows <num>        PostgreSQL seq scan rows worth an index (default 1000)
              --thresholds.docs-examined-ratio <num>  MongoDB docs examined per returned doc (default 10)
              --thresholds.index-name-length <num>    Max generated index name length (default 128)

            Environment Variables:
              PLANLENS_HIGH_COST_RATIO                Same as --thresholds.high-cost
              PLANLENS_MEDIUM_COST_RATIO              Same as --thresholds.medium-cost
              PLANLENS_LOW_ABSOLUTE_COST              Same as --thresholds.low-absolute-cost
              PLANLENS_SEVERE_ROW_RATIO               Same as --thresholds.severe-rows
              PLANLENS_SIGNIFICANT_ROW_RATIO          Same as --thresholds.significant-rows
              PLANLENS_SEQ_SCAN_ROW_THRESHOLD         Same as --thresholds.seq-scan-rows
              PLANLENS_DOCS_EXAMINED_RATIO            Same as --thresholds.docs-examined-ratio
              PLANLENS_INDEX_NAME_MAX_LENGTH          Same as --thresholds.index-name-length

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. Threshold file
              4. Built-in defaults
            """;
    }
}
