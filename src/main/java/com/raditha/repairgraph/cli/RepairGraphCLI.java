package com.raditha.repairgraph.cli;

import com.raditha.repairgraph.analyzer.BatchAnalyzer;
import com.raditha.repairgraph.analyzer.BugInstance;
import com.raditha.repairgraph.analyzer.InstanceReport;
import com.raditha.repairgraph.config.AnalysisConfig;
import com.raditha.repairgraph.config.AnalysisSettings;
import com.raditha.repairgraph.extraction.FilePair;
import com.raditha.repairgraph.ged.GedResult;
import com.raditha.repairgraph.metrics.BasicMetrics;
import com.raditha.repairgraph.metrics.GraphMetric;
import com.raditha.repairgraph.metrics.GraphMetricsCalculator;
import com.raditha.repairgraph.metrics.GraphMetricsReport;
import com.raditha.repairgraph.metrics.MetricsExporter;
import com.raditha.repairgraph.metrics.SyntaxMetrics;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command-line interface for repair distance measurement.
 * <p>
 * Usage:
 * java -jar repairgraph.jar --before Old.java --after New.java
 * java -jar repairgraph.jar --batch instances.json --export csv
 * <p>
 * Configuration priority: CLI arguments > repairgraph.yml > defaults
 */
@Command(name = "repairgraph", mixinStandardHelpOptions = true, version = "RepairGraph v1.0.0",
        description = "Graph edit distances between program versions")
@SuppressWarnings("java:S106")
public class RepairGraphCLI implements Callable<Integer> {

    @Option(names = "--before", description = "Source file before the change", paramLabel = "<path>")
    private String beforeFile;

    @Option(names = "--after", description = "Source file after the change", paramLabel = "<path>")
    private String afterFile;

    @Option(names = "--batch", description = "JSON manifest of bug instances", paramLabel = "<path>")
    private String batchFile;

    @Option(names = "--config-file", description = "Use custom configuration file", paramLabel = "<path>")
    private String configFile;

    @Option(names = "--preset", description = "Configuration preset: default, fast or thorough", paramLabel = "<name>")
    private String preset;

    @Option(names = "--beam-width", description = "Force a beam width (default: adaptive)", paramLabel = "<n>")
    private int beamWidth = 0; // 0 = use YAML/default

    @Option(names = "--timeout", description = "GED time budget in seconds (default: 120)", paramLabel = "<s>")
    private int timeout = 0; // 0 = use YAML/default

    @Option(names = "--kinds", description = "Comma separated graph kinds (cfg,dfg,callgraph,pdg,cpg)",
            paramLabel = "<list>")
    private String kinds;

    @Option(names = "--json", description = "Output results in JSON format")
    private boolean jsonOutput = false;

    @Option(names = "--export", description = "Export metrics (csv, json, or both)", paramLabel = "<format>")
    private String exportFormat;

    @Option(names = "--output", description = "Directory for exported metrics", paramLabel = "<path>")
    private String outputPath;

    /**
     * Picocli call method - executes the main logic.
     *
     * @return exit code (0 for success, non-zero for errors)
     */
    @Override
    public Integer call() throws Exception {
        validateConfiguration();

        AnalysisConfig config = AnalysisSettings.loadConfig(
                configFile != null ? Paths.get(configFile) : null,
                new AnalysisSettings.Overrides(preset, beamWidth, timeout, kinds));

        List<InstanceReport> reports;
        String batchName;
        if (batchFile != null) {
            List<BugInstance> instances = BatchInput.read(Paths.get(batchFile));
            batchName = Paths.get(batchFile).getFileName().toString();
            reports = new BatchAnalyzer(config).analyze(instances);
        } else {
            batchName = Paths.get(afterFile).getFileName().toString();
            reports = List.of(runPair(config, batchName));
        }

        if (jsonOutput) {
            System.out.println(new MetricsExporter().toJson(reports));
        } else {
            reports.forEach(RepairGraphCLI::printTextReport);
        }

        if (exportFormat != null && !exportFormat.isEmpty()) {
            exportMetrics(reports, batchName);
        }
        return 0;
    }

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * The command line with exit codes mapped from exception types: 2 for invalid input,
     * 3 for I/O errors, 4 for interruption and 1 for anything else.
     */
    static CommandLine commandLine() {
        CommandLine cmd = new CommandLine(new RepairGraphCLI());

        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return 2;
            } else if (ex instanceof IOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return 3;
            } else if (ex instanceof InterruptedException) {
                commandLine.getErr().println("Process interrupted: " + ex.getMessage());
                return 4;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return 1;
            }
        });

        cmd.setParameterExceptionHandler((ex, args1) -> {
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            cmd.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, cmd.getErr());
            cmd.getErr().print(cmd.getUsageMessage(colorScheme));
            return 2;
        });
        return cmd;
    }

    /**
     * Validate CLI configuration before execution.
     *
     * @throws IllegalArgumentException if configuration is invalid
     */
    void validateConfiguration() {
        boolean pair = beforeFile != null || afterFile != null;
        if (pair && batchFile != null) {
            throw new IllegalArgumentException("Use either --before/--after or --batch, not both");
        }
        if (!pair && batchFile == null) {
            throw new IllegalArgumentException("Nothing to analyze: give --before and --after, or --batch");
        }
        if (pair && (beforeFile == null || afterFile == null)) {
            throw new IllegalArgumentException("--before and --after must be given together");
        }

        if (beamWidth < 0) {
            throw new IllegalArgumentException("Beam width must be positive, got: " + beamWidth);
        }
        if (timeout < 0) {
            throw new IllegalArgumentException("Timeout must be positive, got: " + timeout);
        }

        if (exportFormat != null && !exportFormat.isEmpty()) {
            String format = exportFormat.toLowerCase();
            if (!format.equals("csv") && !format.equals("json") && !format.equals("both")) {
                throw new IllegalArgumentException(
                        "Export format must be 'csv', 'json', or 'both', got: " + exportFormat);
            }
        }

        if (configFile != null && !new File(configFile).exists()) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }

        if (outputPath != null) {
            File outputDir = new File(outputPath);
            if (outputDir.exists() && !outputDir.isDirectory()) {
                throw new IllegalArgumentException("Output path exists but is not a directory: " + outputPath);
            }
            if (!outputDir.exists() && !outputDir.mkdirs()) {
                throw new IllegalArgumentException("Cannot create output directory: " + outputPath);
            }
        }
    }

    private InstanceReport runPair(AnalysisConfig config, String name) throws IOException {
        String before = Files.readString(Paths.get(beforeFile));
        String after = Files.readString(Paths.get(afterFile));
        long started = System.nanoTime();
        GraphMetricsReport report = new GraphMetricsCalculator(config)
                .compute(name, List.of(new FilePair(name, before, after)));
        return InstanceReport.succeeded(name, report, (System.nanoTime() - started) / 1_000_000);
    }

    private static void printTextReport(InstanceReport instance) {
        System.out.println("=".repeat(80));
        System.out.println("REPAIR DISTANCES: " + instance.instanceId());
        System.out.println("=".repeat(80));
        if (!instance.isSuccess()) {
            System.out.printf("%s: %s%n%n", instance.status(), instance.message());
            return;
        }

        GraphMetricsReport report = instance.metrics();
        System.out.printf("%-10s %8s %10s %12s %12s %-12s %6s%n",
                "kind", "ged", "normalized", "nodes", "edges", "method", "width");
        for (GraphMetric metric : report.all()) {
            if (!metric.isAvailable()) {
                System.out.printf("%-10s unavailable (%s)%n", metric.kind().key(), metric.unavailableReason());
                continue;
            }
            GedResult r = metric.result();
            System.out.printf("%-10s %8.1f %10.4f %12s %12s %-12s %6s%n",
                    metric.kind().key(),
                    r.ged(),
                    r.normalized(),
                    r.nodesBefore() + "->" + r.nodesAfter(),
                    r.edgesBefore() + "->" + r.edgesAfter(),
                    r.method(),
                    r.beamWidth() + (r.timedOut() ? "*" : ""));
        }

        BasicMetrics basic = report.basic();
        System.out.printf("%nLines: +%d -%d, token distance: %s, complexity: %s%n",
                basic.linesAdded(), basic.linesDeleted(), known(basic.tokenDistance()),
                basic.hasComplexityDelta()
                        ? String.format("%d -> %d (%+d)", basic.complexityBefore(), basic.complexityAfter(),
                                basic.complexityDelta())
                        : "n/a");
        SyntaxMetrics syntax = report.syntax();
        if (syntax != null) {
            System.out.printf("AST distance: %d (%.4f), Halstead volume: %.1f -> %.1f, effort %+.1f%n",
                    syntax.ast().distance(), syntax.ast().normalized(),
                    syntax.halsteadBefore().volume(), syntax.halsteadAfter().volume(), syntax.effortDelta());
            System.out.printf("Exception handling changes: %d, type changes: %d, scope changes: %d%n",
                    syntax.exceptions().totalChanges(), syntax.types().totalChanges(),
                    syntax.scopes().totalChanges());
        } else {
            System.out.println("Syntax measures: n/a");
        }
        if (report.hasDefUseChains()) {
            System.out.printf("Def-use chains: %d -> %d%n", report.defUseBefore(), report.defUseAfter());
        }
        if (report.filesDropped() > 0) {
            System.out.printf("%d of %d files not analysed (scope limit)%n",
                    report.filesDropped(), report.filesAnalysed() + report.filesDropped());
        }
        if (report.all().stream().anyMatch(m -> m.isAvailable() && m.result().timedOut())) {
            System.out.println("* time budget exceeded, width reduced");
        }
        System.out.println();
    }

    private static String known(int value) {
        return value == BasicMetrics.UNAVAILABLE ? "n/a" : String.valueOf(value);
    }

    private void exportMetrics(List<InstanceReport> reports, String batchName) throws IOException {
        MetricsExporter exporter = new MetricsExporter();
        MetricsExporter.BatchMetrics metrics = exporter.buildMetrics(reports, batchName);

        Path outputDir = outputPath != null
                ? Paths.get(outputPath)
                : Paths.get(".");

        String format = exportFormat.toLowerCase();
        if ("csv".equals(format) || "both".equals(format)) {
            Path csvPath = outputDir.resolve("repair-metrics.csv");
            exporter.exportToCsv(metrics, csvPath);
            System.out.println("Metrics exported to: " + csvPath.toAbsolutePath());
        }
        if ("json".equals(format) || "both".equals(format)) {
            Path jsonPath = outputDir.resolve("repair-metrics.json");
            exporter.exportToJson(metrics, jsonPath);
            System.out.println("Metrics exported to: " + jsonPath.toAbsolutePath());
        }
    }
}
