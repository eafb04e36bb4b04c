package org.carball.insight.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;

@Slf4j
public class ConfigurationLoader {

    public static final String CONFIG_FILE_ARG = "--insight.config";

    private static final String ENV_PREFIX = "INSIGHT_";
    private static final String CLI_PREFIX = "--insight.";

    private final Map<String, String> environment;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > YAML file > defaults.
     * The YAML file is taken from {@code --insight.config <path>} when present.
     */
    public InsightOptions loadConfiguration(String[] args) {
        return loadConfiguration(findConfigFile(args), args);
    }

    public InsightOptions loadConfiguration(Path configFile, String[] args) {
        log.debug("Loading configuration");

        // Start with defaults
        InsightOptions.InsightOptionsBuilder builder = InsightOptions.builder();

        // 1. YAML file
        if (configFile != null) {
            applyConfigFile(builder, configFile);
        }

        // 2. Environment variables
        applyEnvironmentVariables(builder);

        // 3. CLI arguments (highest priority)
        applyCLIArguments(builder, args);

        InsightOptions options = builder.build();
        options.validate();

        log.info("Configuration loaded: {}", options.getConfigurationSummary());
        return options;
    }

    private void applyConfigFile(InsightOptions.InsightOptionsBuilder builder, Path configFile) {
        if (!Files.exists(configFile)) {
            log.warn("Configuration file not found: {}", configFile);
            return;
        }

        try {
            JsonNode root = new ObjectMapper(new YAMLFactory()).readTree(configFile.toFile());
            if (root == null) {
                return;
            }
            // Settings may sit at the top level or under an "insight" section
            JsonNode section = root.has("insight") ? root.get("insight") : root;
            Iterator<Map.Entry<String, JsonNode>> fields = section.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (field.getValue().isValueNode()) {
                    apply(builder, field.getKey().toLowerCase(Locale.ROOT), field.getValue().asText(), configFile + ":" + field.getKey());
                }
            }
            log.debug("Applied configuration file {}", configFile);
        } catch (IOException e) {
            log.warn("Could not read configuration file {}: {}", configFile, e.getMessage());
        }
    }

    private void applyEnvironmentVariables(InsightOptions.InsightOptionsBuilder builder) {
        for (Map.Entry<String, String> entry : environment.entrySet()) {
            String name = entry.getKey();
            if (name.startsWith(ENV_PREFIX)) {
                apply(builder, envToProperty(name.substring(ENV_PREFIX.length())), entry.getValue(), name);
            }
        }
    }

    private void applyCLIArguments(InsightOptions.InsightOptionsBuilder builder, String[] args) {
        if (args == null) {
            return;
        }
        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            if (arg.startsWith(CLI_PREFIX) && !arg.equals(CONFIG_FILE_ARG)) {
                apply(builder, cliToProperty(arg.substring(CLI_PREFIX.length())), args[i + 1], arg);
                i++;
            }
        }
    }

    private void apply(InsightOptions.InsightOptionsBuilder builder, String property, String value, String source) {
        try {
            switch (property) {
                case "maxstoredqueries":
                    builder.maxStoredQueries(Integer.parseInt(value.trim()));
                    break;
                case "enablequeryplananalysis":
                    builder.enableQueryPlanAnalysis(parseBoolean(value));
                    break;
                case "queryplananalysisthresholdms":
                    builder.queryPlanAnalysisThresholdMs(Integer.parseInt(value.trim()));
                    break;
                case "plantimeoutms":
                    builder.planTimeoutMs(Integer.parseInt(value.trim()));
                    break;
                case "plancachesize":
                    builder.planCacheSize(Integer.parseInt(value.trim()));
                    break;
                case "enablequeryhistory":
                    builder.enableQueryHistory(parseBoolean(value));
                    break;
                case "historyretentiondays":
                    builder.historyRetentionDays(Integer.parseInt(value.trim()));
                    break;
                case "historystoragepath":
                    builder.historyStoragePath(value.isBlank() ? null : value.trim());
                    break;
                case "n1threshold":
                    builder.n1Threshold(Integer.parseInt(value.trim()));
                    break;
                case "splitquerymaxgapms":
                    builder.splitQueryMaxGapMs(Integer.parseInt(value.trim()));
                    break;
                default:
                    log.debug("Ignoring unknown configuration key {}", source);
            }
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for {}: {}", source, value);
        } catch (IllegalArgumentException e) {
            log.warn("Invalid boolean value for {}: {}", source, value);
        }
    }

    private static boolean parseBoolean(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("true")) {
            return true;
        }
        if (normalized.equals("false")) {
            return false;
        }
        throw new IllegalArgumentException(value);
    }

    // MAX_STORED_QUERIES -> maxstoredqueries
    private static String envToProperty(String name) {
        return name.replace("_", "").toLowerCase(Locale.ROOT);
    }

    // max-stored-queries -> maxstoredqueries
    private static String cliToProperty(String name) {
        return name.replace("-", "").toLowerCase(Locale.ROOT);
    }

    private static Path findConfigFile(String[] args) {
        if (args == null) {
            return null;
        }
        for (int i = 0; i < args.length - 1; i++) {
            if (CONFIG_FILE_ARG.equals(args[i])) {
                return Path.of(args[i + 1]);
            }
        }
        return null;
    }

    /**
     * Returns help text for configuration options.
     */
    public static String getConfigurationHelp() {
        return """
            Configuration Options:

            CLI Arguments:
              --insight.config <path>                        YAML configuration file
              --insight.max-stored-queries <num>             Events kept in memory (default 1000)
              --insight.enable-query-plan-analysis <bool>    Capture execution plans (default true)
              --insight.query-plan-analysis-threshold-ms <num>  Auto-capture plans for queries this slow (default 100)
              --insight.plan-timeout-ms <num>                Plan capture timeout (default 5000)
              --insight.plan-cache-size <num>                Auto-captured plans kept (default 100)
              --insight.enable-query-history <bool>          Track pattern history (default false)
              --insight.history-retention-days <num>         Days of history kept (default 7)
              --insight.history-storage-path <path>          Directory for history.json (in memory when unset)
              --insight.n1-threshold <num>                   Repetitions that make an N+1 pattern (default 3)
              --insight.split-query-max-gap-ms <num>         Max gap inside a split query cluster (default 50)

            Environment Variables:
              INSIGHT_MAX_STORED_QUERIES, INSIGHT_ENABLE_QUERY_PLAN_ANALYSIS,
              INSIGHT_QUERY_PLAN_ANALYSIS_THRESHOLD_MS, INSIGHT_PLAN_TIMEOUT_MS,
              INSIGHT_PLAN_CACHE_SIZE, INSIGHT_ENABLE_QUERY_HISTORY,
              INSIGHT_HISTORY_RETENTION_DAYS, INSIGHT_HISTORY_STORAGE_PATH,
              INSIGHT_N1_THRESHOLD, INSIGHT_SPLIT_QUERY_MAX_GAP_MS

            YAML keys use the camelCase option names, optionally under an 'insight:' section.

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. YAML configuration file
              4. Built-in defaults
            """;
    }
}
