package org.dxworks.docmark;

import org.dxworks.docmark.convert.ConvertOptions;
import org.dxworks.docmark.convert.MarkdownConverter;
import org.dxworks.docmark.export.ExportOptions;
import org.dxworks.docmark.export.MarkdownExporter;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Picks the conversion direction from the input file's extension.
 */
public class BidirectionalConverter {

    private final MarkdownConverter converter;
    private final MarkdownExporter exporter;

    public BidirectionalConverter() {
        this(ConvertOptions.defaults(), ExportOptions.defaults());
    }

    public BidirectionalConverter(ConvertOptions convertOptions, ExportOptions exportOptions) {
        this.converter = new MarkdownConverter(convertOptions);
        this.exporter = new MarkdownExporter(exportOptions);
    }

    /** Returns the format of the input that was converted. */
    public Format autoConvert(Path input, Path output) throws ConversionException {
        Optional<Format> format = FormatDetector.detectFormat(input);
        if (format.isEmpty()) {
            throw new ConversionException(ErrorCategory.IO, "AutoConvert",
                    "unsupported file type: " + input.getFileName());
        }

        switch (format.get()) {
            case MARKDOWN:
                converter.convertFile(input, output);
                break;
            case DOCX:
                exporter.exportToFile(input, output);
                break;
        }
        return format.get();
    }

    /** Output file name for an input: {@code .md} becomes {@code .docx} and vice versa. */
    public static Optional<String> outputFileName(Path input) {
        String name = input.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return FormatDetector.detectFormat(input)
                .map(format -> format == Format.MARKDOWN ? base + ".docx" : base + ".md");
    }
}
