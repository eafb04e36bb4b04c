package org.carball.insight.cli;

import lombok.extern.slf4j.Slf4j;
import org.carball.insight.config.ConfigurationLoader;
import org.carball.insight.config.InsightOptions;
import org.carball.insight.config.OutputFormat;
import org.carball.insight.engine.InsightEngine;
import org.carball.insight.model.capture.QueryEvent;
import org.carball.insight.model.capture.QueryStats;
import org.carball.insight.model.cost.CostRecommendation;
import org.carball.insight.model.cost.CostReport;
import org.carball.insight.model.history.QueryRegression;
import org.carball.insight.output.InsightReport;
import org.carball.insight.parser.QueryEventFileLoader;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Replays a capture file through the analysis engine and writes the resulting report.
 */
@Slf4j
public class InsightCLI {

    private static final String VERSION = "1.0.0";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════════════════════╗
        ║                Query Insight Replay Tool v%s                ║
        ╚═══════════════════════════════════════════════════════════════╝
        """;

    private final PrintStream out;
    private final PrintStream err;

    InsightCLI(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new InsightCLI(System.out, System.err).run(args));
    }

    /**
     * @return process exit code
     */
    int run(String[] args) {
        out.printf((BANNER) + "%n", VERSION);

        if (args.length < 1 || isHelpRequested(args)) {
            printUsage();
            return args.length < 1 ? 1 : 0;
        }

        try {
            Path captureFile = Paths.get(args[0]);
            OutputFormat format = OutputFormat.fromString(getOption(args, "--format", "-f", "markdown"));
            String outputFile = getOption(args, "--output", "-o", null);
            InsightOptions options = new ConfigurationLoader().loadConfiguration(args);

            out.println("\n🔍 Replaying captured queries...");
            out.println("   Capture file: " + captureFile);
            out.println("   " + options.getConfigurationSummary());
            out.println();

            QueryEventFileLoader loader = new QueryEventFileLoader(captureFile);
            List<QueryEvent> events = loader.getAllQueries();

            String rendered;
            QueryStats stats;
            CostReport costReport;
            try (InsightEngine engine = new InsightEngine(options)) {
                events.forEach(engine::submit);
                out.println("   Loaded " + events.size() + " of " + loader.getQueryCount() + " queries");

                stats = engine.getStats();
                costReport = engine.getCostReport();
                List<QueryRegression> regressions = engine.isHistoryEnabled() ? engine.getRegressions() : List.of();
                InsightReport report = new InsightReport(stats, costReport, regressions);

                rendered = render(report, format);
            }

            if (outputFile != null) {
                writeOutput(rendered, format, outputFile);
            } else {
                out.println(rendered);
            }

            printSummary(stats, costReport);
            out.println("\n✅ Analysis complete!");
            return 0;

        } catch (IllegalArgumentException | IllegalStateException e) {
            err.println("\n❌ Configuration error: " + e.getMessage());
            err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            return 1;
        } catch (IOException e) {
            err.println("\n❌ IO error: " + e.getMessage());
            log.debug("IO error details", e);
            return 1;
        }
    }

    private static String render(InsightReport report, OutputFormat format) {
        if (format == OutputFormat.JSON) {
            return report.toJson();
        }
        if (format == OutputFormat.MARKDOWN) {
            return report.toMarkdown();
        }
        return report.toJson() + System.lineSeparator() + report.toMarkdown();
    }

    private void writeOutput(String rendered, OutputFormat format, String outputFile) throws IOException {
        Path path = Paths.get(outputFile);
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        Files.writeString(path, rendered);
        out.println("   Output file: " + path + " (" + format.name().toLowerCase(Locale.ROOT) + ")");
    }

    private void printSummary(QueryStats stats, CostReport costReport) {
        out.println("\n" + "=".repeat(60));
        out.println("📊 QUERY SUMMARY");
        out.println("=".repeat(60));

        out.println("\nQueries captured: " + stats.getTotalQueries());
        out.println("Errors: " + stats.getErrorCount());
        out.println("N+1 patterns: " + stats.getN1Patterns().size());
        out.println("Split query groups: " + stats.getSplitQueryGroups().size());
        out.printf(Locale.ROOT, "Potential savings: %.1f%%%n", costReport.getPotentialSavingsPercent());

        if (!costReport.getRecommendations().isEmpty()) {
            out.println("\n🎯 Top Recommendations:");
            out.println("-".repeat(60));
            costReport.getRecommendations().stream()
                    .limit(5)
                    .forEach(this::printRecommendation);
        } else {
            out.println("\n💡 No recommendations. Captured queries look healthy.");
        }
    }

    private void printRecommendation(CostRecommendation rec) {
        out.printf(Locale.ROOT, "%-20s %-8s %10.1f ms/min%n", rec.getIssueType(), rec.getSeverity(), rec.getEstimatedTimeSavedPerMinMs());
        String sql = rec.getNormalizedSql();
        out.printf("  └─ %s%n", sql.length() > 70 ? sql.substring(0, 70) + "..." : sql);
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private static String getOption(String[] args, String longName, String shortName, String defaultValue) {
        for (int i = 1; i < args.length - 1; i++) {
            if (args[i].equals(longName) || args[i].equals(shortName)) {
                return args[i + 1];
            }
        }
        return defaultValue;
    }

    private void printUsage() {
        out.println("\nUsage: java -jar query-insight.jar <capture-file> [options]");
        out.println();
        out.println("Arguments:");
        out.println("  capture-file        JSON capture file of executed queries");
        out.println();
        out.println("Options:");
        out.println("  --output, -o        Write the report to a file instead of the console");
        out.println("  --format, -f        Report format: json|markdown|both (default: markdown)");
        out.println("  --help, -h          Show this help message");
        out.println();
        out.println(ConfigurationLoader.getConfigurationHelp());
        out.println("Examples:");
        out.println("  java -jar query-insight.jar capture.json");
        out.println("  java -jar query-insight.jar capture.json -f json -o report.json --insight.n1-threshold 5");
    }
}
