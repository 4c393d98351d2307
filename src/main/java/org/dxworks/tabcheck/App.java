package org.dxworks.tabcheck;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.tabcheck.analyzer.CSharpFileAnalyzer;
import org.dxworks.tabcheck.model.Diagnostic;
import org.dxworks.tabcheck.model.FileReport;
import org.dxworks.tabcheck.model.Severity;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

public class App {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    public static void main(String[] args) throws Exception {
        int status = run(args, TabcheckConfig.load());
        if (status != 0) {
            System.exit(status);
        }
    }

    static int run(String[] args, TabcheckConfig config) throws IOException {
        if (args.length < 2) {
            System.err.println("Usage: java -jar tabcheck.jar <input-folder> <output-file>");
            System.err.println("  <input-folder>: Path to a C# source directory or file");
            System.err.println("  <output-file>:  Path to output JSONL file");
            return 2;
        }

        Path input = Paths.get(args[0]);
        if (!Files.exists(input)) {
            System.err.println("Error: Input path does not exist: " + input);
            return 1;
        }

        Path jsonlOutput = Paths.get(args[1]);
        // Create parent directories if they don't exist
        if (jsonlOutput.getParent() != null) {
            Files.createDirectories(jsonlOutput.getParent());
        }

        System.out.println("Starting tab order analysis...");
        System.out.println("Input: " + input.toAbsolutePath());

        RunSummary summary = analyze(input, jsonlOutput, config);

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Analysis complete!");
        System.out.println("Successfully analyzed: " + summary.filesAnalyzed + " files");
        if (summary.filesWithErrors > 0) {
            System.out.println("Errors: " + summary.filesWithErrors);
        }
        System.out.println("Diagnostics: " + summary.totalDiagnostics() + " " + summary.diagnosticsBySeverity);
        System.out.println("Output written to: " + jsonlOutput.toAbsolutePath());
        System.out.println("=".repeat(60));
        return 0;
    }

    static RunSummary analyze(Path input, Path jsonlOutput, TabcheckConfig config) throws IOException {
        List<Path> files = collectSourceFiles(input, config);
        System.out.println("Found " + files.size() + " C# source files");

        CSharpFileAnalyzer analyzer = new CSharpFileAnalyzer(config);
        Instant startTime = Instant.now();
        AtomicInteger successCount = new AtomicInteger(0);
        AtomicInteger errorCount = new AtomicInteger(0);
        AtomicInteger progressCounter = new AtomicInteger(0);
        Map<Severity, AtomicInteger> severityCounts = new ConcurrentHashMap<>();

        try (BufferedWriter writer = Files.newBufferedWriter(jsonlOutput, StandardCharsets.UTF_8)) {
            Map<String, Object> runInfo = new LinkedHashMap<>();
            runInfo.put("kind", "run");
            runInfo.put("started_at", startTime.toString());
            runInfo.put("input_path", input.toString());
            runInfo.put("total_files", files.size());
            writer.write(MAPPER.writeValueAsString(runInfo));
            writer.newLine();

            // Process files in parallel with progress reporting
            files.parallelStream().forEach(file -> {
                int current = progressCounter.incrementAndGet();
                synchronized (System.out) {
                    System.out.println("[" + current + "/" + files.size() + "] Analyzing " + file.getFileName());
                }

                try {
                    FileReport report = analyzer.analyzeFile(file);
                    for (Diagnostic diagnostic : report.diagnostics) {
                        severityCounts.computeIfAbsent(diagnostic.severity, s -> new AtomicInteger()).incrementAndGet();
                    }

                    // Files without an initialization method have nothing to report
                    if (!report.scopes.isEmpty()) {
                        synchronized (writer) {
                            writer.write(MAPPER.writeValueAsString(report));
                            writer.newLine();
                            writer.flush();
                        }
                    }

                    successCount.incrementAndGet();
                } catch (Exception e) {
                    Map<String, String> error = new LinkedHashMap<>();
                    error.put("kind", "error");
                    error.put("file", file.toString());
                    error.put("error", String.valueOf(e.getMessage()));

                    try {
                        synchronized (writer) {
                            writer.write(MAPPER.writeValueAsString(error));
                            writer.newLine();
                            writer.flush();
                        }
                    } catch (IOException ioException) {
                        System.err.println("Failed to write error for " + file + ": " + ioException.getMessage());
                    }

                    errorCount.incrementAndGet();
                    synchronized (System.err) {
                        System.err.println("  Error analyzing " + file.getFileName() + ": " + e.getMessage());
                    }
                }
            });

            RunSummary summary = new RunSummary(successCount.get(), errorCount.get(), toCounts(severityCounts));

            Instant endTime = Instant.now();
            Map<String, Object> doneInfo = new LinkedHashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("files_analyzed", summary.filesAnalyzed);
            doneInfo.put("files_with_errors", summary.filesWithErrors);
            doneInfo.put("diagnostics", summary.diagnosticsBySeverity);
            doneInfo.put("duration_seconds", Duration.between(startTime, endTime).getSeconds());
            writer.write(MAPPER.writeValueAsString(doneInfo));
            writer.newLine();
            return summary;
        }
    }

    private static Map<String, Integer> toCounts(Map<Severity, AtomicInteger> severityCounts) {
        Map<Severity, Integer> ordered = new EnumMap<>(Severity.class);
        severityCounts.forEach((severity, count) -> ordered.put(severity, count.get()));
        Map<String, Integer> counts = new LinkedHashMap<>();
        ordered.forEach((severity, count) -> counts.put(severity.name(), count));
        return counts;
    }

    static List<Path> collectSourceFiles(Path input, TabcheckConfig config) throws IOException {
        List<Path> files = new ArrayList<>();
        List<PathMatcher> excludes = new ArrayList<>();
        for (String pattern : config.getExcludes()) {
            excludes.add(FileSystems.getDefault().getPathMatcher("glob:" + pattern));
        }

        if (Files.isDirectory(input)) {
            try (Stream<Path> stream = Files.walk(input)) {
                stream.filter(Files::isRegularFile)
                      .filter(App::isCSharpSource)
                      .filter(p -> !isExcluded(p, excludes))
                      .filter(p -> withinMaxLines(p, config.getMaxFileLines()))
                      .sorted()
                      .forEach(files::add);
            }
        } else if (Files.isRegularFile(input)) {
            if (isCSharpSource(input)
                    && !isExcluded(input, excludes)
                    && withinMaxLines(input, config.getMaxFileLines())) {
                files.add(input);
            }
        }

        return files;
    }

    static boolean isCSharpSource(Path filePath) {
        return filePath.getFileName().toString().toLowerCase().endsWith(".cs");
    }

    private static boolean isExcluded(Path path, List<PathMatcher> excludes) {
        Path absolute = path.toAbsolutePath();
        for (PathMatcher matcher : excludes) {
            if (matcher.matches(absolute) || matcher.matches(path)) {
                return true;
            }
        }
        return false;
    }

    private static boolean withinMaxLines(Path path, int maxFileLines) {
        try (Stream<String> lines = Files.lines(path, StandardCharsets.UTF_8)) {
            long count = lines.limit((long) maxFileLines + 1L).count();
            return count <= maxFileLines;
        } catch (Exception e) {
            // Let the analysis report unreadable files
            return true;
        }
    }

    static class RunSummary {
        final int filesAnalyzed;
        final int filesWithErrors;
        final Map<String, Integer> diagnosticsBySeverity;

        RunSummary(int filesAnalyzed, int filesWithErrors, Map<String, Integer> diagnosticsBySeverity) {
            this.filesAnalyzed = filesAnalyzed;
            this.filesWithErrors = filesWithErrors;
            this.diagnosticsBySeverity = new LinkedHashMap<>(diagnosticsBySeverity);
        }

        int totalDiagnostics() {
            return diagnosticsBySeverity.values().stream().mapToInt(Integer::intValue).sum();
        }
    }
}
