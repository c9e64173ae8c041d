package org.carball.planlens.cli;

import lombok.extern.slf4j.Slf4j;
import org.carball.planlens.PlanInspector;
import org.carball.planlens.config.ConfigurationLoader;
import org.carball.planlens.config.OutputFormat;
import org.carball.planlens.config.PlanLensConfig;
import org.carball.planlens.model.InspectionResult;
import org.carball.planlens.model.diagnostic.Diagnostic;
import org.carball.planlens.model.diagnostic.Severity;
import org.carball.planlens.output.InspectionReport;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Locale;

@Slf4j
public class PlanLensCLI {

    private static final String VERSION = "1.0.0";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════════════════════╗
        ║        PlanLens Execution Plan & Deadlock Inspector v%s      ║
        ╚═══════════════════════════════════════════════════════════════╝
        """;

    public static void main(String[] args) {
        System.out.printf((BANNER) + "%n", VERSION);

        if (args.length < 1 || isHelpRequested(args)) {
            printUsage();
            System.exit(args.length < 1 ? 1 : 0);
        }

        try {
            PlanLensConfig config = parseArgs(args);

            System.out.println("\n🔍 Inspecting payload...");
            System.out.println("   Payload file: " + config.getPayloadFile());
            if (config.getOutputFormat() == OutputFormat.BOTH) {
                String baseFileName = removeFileExtension(config.getOutputFile());
                System.out.println("   Output: " + baseFileName + ".json, " + baseFileName + ".md");
            } else {
                System.out.println("   Output: " + config.getOutputFile());
            }
            if (config.isVerbose()) {
                System.out.println("   " + config.getThresholds().getConfigurationSummary());
            }
            System.out.println();

            String payload = Files.readString(config.getPayloadFile());

            System.out.print("📊 Parsing and analyzing... ");
            PlanInspector inspector = new PlanInspector(config.getThresholds());
            InspectionResult result = inspector.inspect(payload, config.getExpectedQuery());
            System.out.println("✓");

            System.out.print("📝 Writing results... ");
            outputResults(result, config);
            System.out.println("✓");

            printSummary(result);

            System.out.println("\n✅ Inspection complete!");

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
        System.out.println("\nUsage: java -jar planlens.jar <payload-file> [options]");
        System.out.println();
        System.out.println("Arguments:");
        System.out.println("  payload-file        SQL Server plan XML, PostgreSQL EXPLAIN text, MongoDB explain JSON");
        System.out.println("                      or SQL Server deadlock XML, raw or wrapped in a JSON envelope");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --output, -o        Output file for the report (default: inspection.json)");
        System.out.println("  --format, -f        Output format: json|markdown|both (default: json)");
        System.out.println("  --expected-query    Statement the plan was requested for; flags plans of another type");
        System.out.println("  --verbose, -v       Enable verbose output");
        System.out.println("  --help, -h          Show this help message");
        System.out.println();
        System.out.println(ConfigurationLoader.getThresholdHelp());
        System.out.println("Examples:");
        System.out.println("  # Inspect a SQL Server plan");
        System.out.println("  java -jar planlens.jar plan.xml");
        System.out.println();
        System.out.println("  # Markdown report with a stricter cost threshold");
        System.out.println("  java -jar planlens.jar explain.txt -f markdown --thresholds.high-cost 0.5");
        System.out.println();
        System.out.println("  # Check that the plan belongs to the statement that was asked for");
        System.out.println("  java -jar planlens.jar plan.json --expected-query \"SELECT * FROM Orders\"");
    }

    static PlanLensConfig parseArgs(String[] args) {
        PlanLensConfig config = new PlanLensConfig();
        config.setPayloadFile(Paths.get(args[0]));

        // Set defaults
        config.setOutputFile("inspection.json");
        config.setOutputFormat(OutputFormat.JSON);
        config.setVerbose(false);

        // Thresholds: file < environment < CLI
        config.setThresholds(new ConfigurationLoader().loadConfiguration(args));

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--output":
                case "-o":
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Output file not specified");
                    }
                    config.setOutputFile(args[++i]);
                    break;

                case "--format":
                case "-f":
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Output format not specified");
                    }
                    try {
                        OutputFormat format = OutputFormat.valueOf(args[++i].toUpperCase(Locale.ROOT));
                        config.setOutputFormat(format);
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException("Invalid output format. Use: json, markdown, or both");
                    }
                    break;

                case "--expected-query":
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Expected query not specified");
                    }
                    config.setExpectedQuery(args[++i]);
                    break;

                case "--config":
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Threshold config file not specified");
                    }
                    // Already applied by ConfigurationLoader
                    config.setConfigFile(Paths.get(args[++i]));
                    break;

                case "--verbose":
                case "-v":
                    config.setVerbose(true);
                    break;

                default:
                    if (args[i].startsWith("--thresholds.")) {
                        if (i + 1 >= args.length) {
                            throw new IllegalArgumentException("Value not specified for " + args[i]);
                        }
                        // Already applied by ConfigurationLoader
                        i++;
                        break;
                    }
                    throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }

        // Apply correct file extension based on format
        String baseFileName = removeFileExtension(config.getOutputFile());
        if (config.getOutputFormat() == OutputFormat.MARKDOWN) {
            config.setOutputFile(baseFileName + ".md");
        } else {
            config.setOutputFile(baseFileName + ".json");
        }

        validateConfig(config);
        return config;
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

    private static void validateConfig(PlanLensConfig config) {
        if (!Files.exists(config.getPayloadFile())) {
            throw new IllegalArgumentException("Payload file not found: " + config.getPayloadFile());
        }
        if (Files.isDirectory(config.getPayloadFile())) {
            throw new IllegalArgumentException("Payload path must be a file");
        }

        Path outputDir = Paths.get(config.getOutputFile()).getParent();
        if (outputDir != null && !Files.exists(outputDir)) {
            throw new IllegalArgumentException("Output directory does not exist: " + outputDir);
        }
    }

    private static void outputResults(InspectionResult result, PlanLensConfig config) throws IOException {
        InspectionReport report = new InspectionReport(result);
        String baseFileName = removeFileExtension(config.getOutputFile());

        if (config.getOutputFormat() == OutputFormat.JSON || config.getOutputFormat() == OutputFormat.BOTH) {
            Files.writeString(Paths.get(baseFileName + ".json"), report.toJson());
        }
        if (config.getOutputFormat() == OutputFormat.MARKDOWN || config.getOutputFormat() == OutputFormat.BOTH) {
            Files.writeString(Paths.get(baseFileName + ".md"), report.toMarkdown());
        }
    }

    private static void printSummary(InspectionResult result) {
        System.out.println("\n" + "=".repeat(60));
        System.out.println("📊 INSPECTION SUMMARY");
        System.out.println("=".repeat(60));

        System.out.println("\nPayload: " + result.getPayloadKind());
        System.out.println("Outcome: " + result.getOutcome());
        if (result.getPlan() != null) {
            System.out.println("Engine: " + result.getPlan().getEngine().getDisplayName());
            System.out.println("Plan nodes: " + result.getPlan().getNodes().size());
        }
        if (result.getDeadlock() != null) {
            System.out.println("Deadlock participants: " + result.getDeadlock().getParticipants().size());
        }
        if (!result.getMissingIndexes().isEmpty()) {
            System.out.println("Missing indexes: " + result.getMissingIndexes().size());
        }

        System.out.println("\nFindings:");
        System.out.println("  🔴 Critical: " + result.countBySeverity(Severity.CRITICAL));
        System.out.println("  🟡 Warning: " + result.countBySeverity(Severity.WARNING));
        System.out.println("  ⚪ Info: " + result.countBySeverity(Severity.INFO));

        if (result.getDiagnostics().isEmpty()) {
            System.out.println("\n💡 No issues found.");
            return;
        }

        System.out.println("\n🎯 Top Findings:");
        System.out.println("-".repeat(60));
        result.getDiagnostics().stream()
                .sorted(Comparator.comparing(Diagnostic::severity).reversed())
                .limit(5)
                .forEach(d -> System.out.printf("[%-8s] %s%n", d.severity().getLabel(), d.message()));
    }
}
