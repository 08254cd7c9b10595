package com.repo.cccp;

import com.repo.cccp.core.*;
import com.repo.cccp.metrics.AlgorithmVariant;
import com.repo.cccp.report.ControlTreeGraphGenerator;
import com.repo.cccp.report.CsvReporter;
import com.repo.cccp.sources.JsonAstSource;
import com.repo.cccp.sources.PythonSyntaxSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Computes Plan Depth and Maximum Plan Index for every source file under a
 * directory.
 *
 * Usage: java -jar cccp-analyzer.jar --root <dir> [--output <file>] [--config
 * <file>] [--variant <name>] [--units <mode>] [--graphs <dir>]
 */
public class App {

    public static void main(String[] args) {
        System.out.println("=== CCCP Plan Complexity ===");

        CliArgs cliArgs;
        try {
            cliArgs = parseArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            cliArgs = null;
        }
        if (cliArgs == null) {
            printUsage();
            System.exit(1);
        }

        try {
            new App().run(cliArgs);
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    private static void printUsage() {
        System.err.println("""
                Usage: java -jar cccp-analyzer.jar --root <dir> [options]

                Arguments:
                  --root <dir>       Directory to scan for source files (required)
                  --output <file>    CSV file for the results (default: cccp-results.csv)
                  --config <file>    YAML configuration (default: <root>/cccp.yaml if present)
                  --variant <name>   Rule set: canonical, targets_counted or legacy
                  --units <mode>     module (one unit per file) or function (one per top-level def)
                  --graphs <dir>     Write a Graphviz file of each unit's control tree
                """);
    }

    record CliArgs(
            Path root,
            Path outputFile,
            Path configFile,
            AlgorithmVariant variant,
            UnitMode unitMode,
            Path graphsDir) {
    }

    static CliArgs parseArgs(String[] args) {
        Path root = null;
        Path outputFile = Path.of("cccp-results.csv");
        Path configFile = null;
        AlgorithmVariant variant = null;
        UnitMode unitMode = null;
        Path graphsDir = null;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--root" -> {
                    if (i + 1 < args.length)
                        root = Path.of(args[++i]);
                }
                case "--output" -> {
                    if (i + 1 < args.length)
                        outputFile = Path.of(args[++i]);
                }
                case "--config" -> {
                    if (i + 1 < args.length)
                        configFile = Path.of(args[++i]);
                }
                case "--variant" -> {
                    if (i + 1 < args.length)
                        variant = AlgorithmVariant.fromName(args[++i]);
                }
                case "--units" -> {
                    if (i + 1 < args.length)
                        unitMode = UnitMode.fromName(args[++i]);
                }
                case "--graphs" -> {
                    if (i + 1 < args.length)
                        graphsDir = Path.of(args[++i]);
                }
                default -> throw new IllegalArgumentException("Unknown argument: " + args[i]);
            }
        }

        if (root == null) {
            return null;
        }

        return new CliArgs(root, outputFile, configFile, variant, unitMode, graphsDir);
    }

    static AnalyzerConfig buildConfig(CliArgs args) {
        AnalyzerConfig config = args.configFile() != null
                ? AnalyzerConfig.loadFile(args.configFile())
                : AnalyzerConfig.load(args.root());
        if (args.variant() != null) {
            config.withVariant(args.variant());
        }
        if (args.unitMode() != null) {
            config.withUnitMode(args.unitMode());
        }
        return config;
    }

    static SourceRegistry buildRegistry(AnalyzerConfig config) {
        List<SyntaxSource> sources = new ArrayList<>();
        sources.add(new PythonSyntaxSource(config.getPythonCommand()));
        sources.add(new JsonAstSource());
        return new SourceRegistry(sources);
    }

    void run(CliArgs args) throws IOException {
        if (!Files.isDirectory(args.root())) {
            throw new IOException("Not a directory: " + args.root());
        }
        AnalyzerConfig config = buildConfig(args);
        System.out.println("Variant: " + config.getVariant() + " | Units: " + config.getUnitMode());

        System.out.println("\n>>> INITIALIZING SOURCES <<<");
        SourceRegistry registry = buildRegistry(config);
        registry.printSummary();

        System.out.println("\n>>> SCANNING " + args.root() + " <<<");
        List<Path> files = collectFiles(args.root(), registry, config);
        System.out.println("Found " + files.size() + " source files.");

        System.out.println("\n>>> SCORING <<<");
        AnalysisRun result = analyzeAll(files, registry, new UnitAnalyzer(config));

        System.out.printf("%nAnalyzed: %d units | Failed: %d%n",
                result.scores().size(), result.failures().size());

        System.out.println("\n>>> GENERATING REPORTS <<<");
        new CsvReporter().generate(result.scores(), args.outputFile());
        if (args.graphsDir() != null) {
            writeGraphs(result.scores(), args.graphsDir());
        }

        printSummary(result);
    }

    /**
     * Scores and failure messages of one run. Failures are keyed by unit id, or
     * by file path when the file could not be parsed at all.
     */
    record AnalysisRun(List<UnitScores> scores, Map<String, String> failures) {
    }

    static List<Path> collectFiles(Path root, SourceRegistry registry, AnalyzerConfig config) throws IOException {
        try (Stream<Path> walk = Files.walk(root)) {
            return walk
                    .filter(Files::isRegularFile)
                    .filter(registry::supports)
                    .filter(p -> !config.shouldExclude(p))
                    .sorted()
                    .toList();
        }
    }

    static AnalysisRun analyzeAll(List<Path> files, SourceRegistry registry, UnitAnalyzer analyzer) {
        List<UnitScores> scores = new ArrayList<>();
        Map<String, String> failures = new LinkedHashMap<>();

        System.out.println("\n| %-60s | %-5s | %-5s |".formatted("Unit", "PD", "MPI"));
        System.out.println("|" + "-".repeat(62) + "|" + "-".repeat(7) + "|" + "-".repeat(7) + "|");

        for (Path file : files) {
            Optional<SyntaxSource> source = registry.getSource(file);
            if (source.isEmpty()) {
                continue;
            }
            UnitResults results;
            try {
                results = analyzer.analyze(file, source.get());
            } catch (SyntaxSourceException e) {
                System.err.println("  [FAIL] " + file + ": " + e.getMessage());
                failures.put(file.toString(), e.getMessage());
                continue;
            }
            for (UnitScores unit : results.scores()) {
                System.out.println("| %-60s | %-5d | %-5d |".formatted(
                        truncate(unit.unitId(), 60), unit.planDepth(), unit.maxPlanIndex()));
            }
            scores.addAll(results.scores());
            results.failures().forEach((unitId, e) -> {
                System.err.println("  [FAIL] " + unitId + ": " + e.getMessage());
                failures.put(unitId, e.getMessage());
            });
        }
        return new AnalysisRun(scores, failures);
    }

    private void writeGraphs(List<UnitScores> scores, Path graphsDir) throws IOException {
        Files.createDirectories(graphsDir);
        ControlTreeGraphGenerator generator = new ControlTreeGraphGenerator();
        for (UnitScores unit : scores) {
            String fileName = unit.unitId().replaceAll("[^A-Za-z0-9._-]", "_") + ".dot";
            Files.writeString(graphsDir.resolve(fileName), generator.generateDot(unit.unitId(), unit.tree()));
        }
        System.out.println("Control tree graphs written to: " + graphsDir.toAbsolutePath());
    }

    private static String truncate(String s, int len) {
        if (s.length() <= len)
            return s;
        return "..." + s.substring(s.length() - (len - 3));
    }

    private void printSummary(AnalysisRun result) {
        System.out.println("\n=== SUMMARY ===");

        if (!result.failures().isEmpty()) {
            Map<String, Long> reasons = result.failures().values().stream()
                    .collect(Collectors.groupingBy(m -> m.replaceAll(" at line \\d+", ""), Collectors.counting()));
            System.out.println("Failure reasons:");
            reasons.entrySet().stream()
                    .sorted((a, b) -> Long.compare(b.getValue(), a.getValue()))
                    .forEach(e -> System.out.printf("  %-50s: %d%n", truncate(e.getKey(), 50), e.getValue()));
        }

        List<UnitScores> top = result.scores().stream()
                .sorted(Comparator.comparingInt(UnitScores::maxPlanIndex).reversed())
                .limit(5)
                .toList();

        if (!top.isEmpty()) {
            System.out.println("\nTop 5 Units by MPI:");
            for (int i = 0; i < top.size(); i++) {
                UnitScores d = top.get(i);
                System.out.printf("  %d. %s (MPI: %d, PD: %d)%n",
                        i + 1,
                        truncate(d.unitId(), 60),
                        d.maxPlanIndex(),
                        d.planDepth());
            }
        }
    }
}
