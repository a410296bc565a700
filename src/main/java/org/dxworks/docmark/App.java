package org.dxworks.docmark;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.docmark.model.ConversionRecord;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

public class App {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    static final String REPORT_FILE_NAME = "docmark-report.jsonl";

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Usage: java -jar docmark.jar <input-path> <output-dir>");
            System.err.println("  <input-path>: Markdown or Word file, or a directory containing them");
            System.err.println("  <output-dir>: Directory for converted files and " + REPORT_FILE_NAME);
            System.err.println("Supported formats: .md, .markdown (to .docx), .docx (to .md)");
            System.exit(2);
        }

        Path input = Paths.get(args[0]);
        if (!Files.exists(input)) {
            System.err.println("Error: Input path does not exist: " + input);
            System.exit(1);
        }

        Path outputDir = Paths.get(args[1]);
        Files.createDirectories(outputDir);

        System.out.println("Starting conversion...");
        System.out.println("Input: " + input.toAbsolutePath());

        DocmarkConfig config = DocmarkConfig.load();
        Summary summary = run(input, outputDir, config);

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Conversion complete!");
        System.out.println("Successfully converted: " + summary.converted + " files");
        if (summary.errors > 0) {
            System.out.println("Errors: " + summary.errors);
        }
        System.out.println("Report written to: " + outputDir.resolve(REPORT_FILE_NAME).toAbsolutePath());
        System.out.println("=".repeat(60));
    }

    /** Converts every supported file under {@code input} and writes the JSONL report into {@code outputDir}. */
    public static Summary run(Path input, Path outputDir, DocmarkConfig config) throws IOException {
        List<Path> files = collectInputFiles(input);
        System.out.println("Found " + files.size() + " convertible files");

        BidirectionalConverter converter = new BidirectionalConverter(config.toConvertOptions(), config.toExportOptions());
        Path baseDir = Files.isDirectory(input) ? input : input.toAbsolutePath().getParent();

        Instant startTime = Instant.now();
        AtomicInteger successCount = new AtomicInteger(0);
        AtomicInteger errorCount = new AtomicInteger(0);
        AtomicInteger progressCounter = new AtomicInteger(0);

        Path report = outputDir.resolve(REPORT_FILE_NAME);
        try (BufferedWriter writer = Files.newBufferedWriter(report, StandardCharsets.UTF_8)) {
            Map<String, Object> runInfo = new HashMap<>();
            runInfo.put("kind", "run");
            runInfo.put("started_at", startTime.toString());
            runInfo.put("input_path", input.toString());
            runInfo.put("total_files", files.size());
            writer.write(MAPPER.writeValueAsString(runInfo));
            writer.newLine();

            Stream<Path> stream = config.getParallelism() > 1 ? files.parallelStream() : files.stream();
            stream.forEach(file -> {
                Format format = FormatDetector.detectFormat(file).orElseThrow();
                int current = progressCounter.incrementAndGet();

                synchronized (System.out) {
                    System.out.println("[" + current + "/" + files.size() + "] Converting " +
                                     format.getName() + ": " + file.getFileName());
                }

                Path output = outputPath(file, baseDir, outputDir);
                Instant fileStart = Instant.now();
                try {
                    converter.autoConvert(file, output);

                    ConversionRecord record = new ConversionRecord();
                    record.file = file.toString();
                    record.format = format.getName();
                    record.output = output.toString();
                    record.durationMillis = Duration.between(fileStart, Instant.now()).toMillis();
                    writeLine(writer, MAPPER.writeValueAsString(record));

                    successCount.incrementAndGet();
                } catch (ConversionException | IOException e) {
                    Map<String, String> error = new HashMap<>();
                    error.put("kind", "error");
                    error.put("file", file.toString());
                    error.put("format", format.getName());
                    error.put("error", e.getMessage());
                    if (e instanceof ConversionException conversionException) {
                        error.put("category", conversionException.getCategory().getName());
                    }

                    try {
                        writeLine(writer, MAPPER.writeValueAsString(error));
                    } catch (IOException ioException) {
                        System.err.println("Failed to write error for " + file + ": " + ioException.getMessage());
                    }

                    errorCount.incrementAndGet();
                    synchronized (System.err) {
                        System.err.println("  Error converting " + file.getFileName() + ": " + e.getMessage());
                    }
                }
            });

            Instant endTime = Instant.now();
            Map<String, Object> doneInfo = new HashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("files_converted", successCount.get());
            doneInfo.put("files_with_errors", errorCount.get());
            doneInfo.put("duration_seconds", Duration.between(startTime, endTime).getSeconds());
            writer.write(MAPPER.writeValueAsString(doneInfo));
            writer.newLine();
        }

        return new Summary(successCount.get(), errorCount.get());
    }

    private static void writeLine(BufferedWriter writer, String line) throws IOException {
        synchronized (writer) {
            writer.write(line);
            writer.newLine();
            writer.flush();
        }
    }

    static List<Path> collectInputFiles(Path input) throws IOException {
        List<Path> files = new ArrayList<>();

        if (Files.isDirectory(input)) {
            try (Stream<Path> stream = Files.walk(input)) {
                stream.filter(Files::isRegularFile)
                      .filter(p -> FormatDetector.detectFormat(p).isPresent())
                      .sorted()
                      .forEach(files::add);
            }
        } else if (Files.isRegularFile(input) && FormatDetector.detectFormat(input).isPresent()) {
            files.add(input);
        }

        return files;
    }

    /** Mirrors the input's location relative to {@code baseDir} under {@code outputDir}. */
    static Path outputPath(Path file, Path baseDir, Path outputDir) {
        Optional<String> name = BidirectionalConverter.outputFileName(file);
        Path relativeParent = baseDir != null
                ? baseDir.toAbsolutePath().relativize(file.toAbsolutePath()).getParent()
                : null;
        Path dir = relativeParent != null ? outputDir.resolve(relativeParent) : outputDir;
        return dir.resolve(name.orElseThrow());
    }

    public static final class Summary {
        public final int converted;
        public final int errors;

        Summary(int converted, int errors) {
            this.converted = converted;
            this.errors = errors;
        }
    }
}
