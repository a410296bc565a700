package org.dxworks.docmark.export;

import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.dxworks.docmark.ConversionException;
import org.dxworks.docmark.ErrorCategory;
import org.dxworks.docmark.batch.BatchResult;
import org.dxworks.docmark.batch.BatchRunner;
import org.dxworks.docmark.batch.CancellationToken;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Word to Markdown export. Errors raised here are passed to the error
 * callback once before being thrown.
 */
public class MarkdownExporter {

    private final ExportOptions options;

    public MarkdownExporter() {
        this(ExportOptions.defaults());
    }

    public MarkdownExporter(ExportOptions options) {
        this.options = options;
    }

    public ExportOptions getOptions() {
        return options;
    }

    /** Pictures are referenced but not written anywhere. */
    public String exportToString(XWPFDocument document) throws ConversionException {
        return new MarkdownWriter(options).write(document);
    }

    public byte[] exportToBytes(XWPFDocument document) throws ConversionException {
        return exportToString(document).getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Exports a .docx file. Extracted pictures go to the configured image
     * directory, or next to the Markdown file.
     */
    public void exportToFile(Path input, Path output) throws ConversionException {
        XWPFDocument document;
        try (InputStream in = Files.newInputStream(input)) {
            document = new XWPFDocument(in);
        } catch (IOException | RuntimeException e) {
            throw reported(new ConversionException(ErrorCategory.IO, "FileRead", "cannot open " + input, e));
        }

        options.logger.debug("Exporting {} to {}", input, output);
        MarkdownWriter writer = new MarkdownWriter(options);
        String markdown;
        try (document) {
            markdown = writer.write(document);
        } catch (IOException e) {
            throw reported(new ConversionException(ErrorCategory.IO, "FileRead", "cannot close " + input, e));
        }

        Path outputDir = output.toAbsolutePath().getParent();
        try {
            if (outputDir != null) {
                Files.createDirectories(outputDir);
            }
            Files.writeString(output, markdown, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw reported(new ConversionException(ErrorCategory.IO, "FileWrite", "cannot write " + output, e));
        }

        writeImages(writer.getExtractedImages(), outputDir);
    }

    /** Exports every input to {@code <outputDir>/<name>.md}. */
    public BatchResult batchExport(List<Path> inputs, Path outputDir) throws ConversionException {
        return batchExport(inputs, outputDir, null);
    }

    public BatchResult batchExport(List<Path> inputs, Path outputDir, CancellationToken token)
            throws ConversionException {
        BatchRunner runner = new BatchRunner(options.parallelism, options.ignoreErrors,
                options.progressCallback, options.logger);
        return runner.run(new ArrayList<>(inputs), input -> {
            Path output = outputDir.resolve(baseName(input) + ".md");
            exportToFile(input, output);
            return output;
        }, token);
    }

    private void writeImages(List<ExtractedImage> images, Path markdownDir) throws ConversionException {
        if (images.isEmpty()) {
            return;
        }
        Path imageDir = options.imageOutputDir != null ? Paths.get(options.imageOutputDir) : markdownDir;
        if (imageDir == null) {
            imageDir = Paths.get(".");
        }
        try {
            Files.createDirectories(imageDir);
            for (ExtractedImage image : images) {
                Files.write(imageDir.resolve(image.fileName), image.data);
            }
        } catch (IOException e) {
            throw reported(new ConversionException(ErrorCategory.IO, "ImageWrite", "cannot write images to " + imageDir, e));
        }
    }

    private ConversionException reported(ConversionException error) {
        options.logger.warn("{}", error.getMessage());
        options.report(error);
        return error;
    }

    private static String baseName(Path input) {
        String name = input.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
