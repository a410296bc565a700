package org.dxworks.docmark.convert;

import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.commonmark.Extension;
import org.commonmark.ext.footnotes.FootnotesExtension;
import org.commonmark.ext.front.matter.YamlFrontMatterExtension;
import org.commonmark.ext.gfm.strikethrough.StrikethroughExtension;
import org.commonmark.ext.gfm.tables.TablesExtension;
import org.commonmark.ext.task.list.items.TaskListItemsExtension;
import org.commonmark.node.Node;
import org.commonmark.parser.IncludeSourceSpans;
import org.commonmark.parser.Parser;
import org.dxworks.docmark.ConversionException;
import org.dxworks.docmark.ErrorCategory;
import org.dxworks.docmark.batch.BatchResult;
import org.dxworks.docmark.batch.BatchRunner;
import org.dxworks.docmark.batch.CancellationToken;
import org.dxworks.docmark.document.WordDocument;
import org.dxworks.docmark.markdown.MathExtension;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Markdown to Word conversion. Errors raised here are passed to the error
 * callback once before being thrown; element-level errors are reported by
 * the renderer.
 */
public class MarkdownConverter {

    private final ConvertOptions options;
    private final Parser parser;

    public MarkdownConverter() {
        this(ConvertOptions.defaults());
    }

    public MarkdownConverter(ConvertOptions options) {
        this.options = options;
        this.parser = Parser.builder()
                .extensions(extensions(options))
                .includeSourceSpans(IncludeSourceSpans.BLOCKS)
                .build();
    }

    public ConvertOptions getOptions() {
        return options;
    }

    public XWPFDocument convertString(String markdown) throws ConversionException {
        return convert(markdown, options);
    }

    /** Decodes strict UTF-8; malformed input is a parse failure. */
    public XWPFDocument convertBytes(byte[] markdown) throws ConversionException {
        return convert(decode(markdown), options);
    }

    /**
     * Converts a Markdown file and writes the document to {@code output}.
     * Relative image paths resolve against the input's directory unless an
     * image base path is configured.
     */
    public void convertFile(Path input, Path output) throws ConversionException {
        ConvertOptions fileOptions = options;
        if (options.imageBasePath == null && input.toAbsolutePath().getParent() != null) {
            fileOptions = options.copy();
            fileOptions.imageBasePath = input.toAbsolutePath().getParent().toString();
        }

        byte[] bytes;
        try {
            bytes = Files.readAllBytes(input);
        } catch (IOException e) {
            throw reported(new ConversionException(ErrorCategory.IO, "FileRead",
                    "cannot read " + input, e));
        }

        options.logger.debug("Converting {} to {}", input, output);
        XWPFDocument document = convert(decode(bytes), fileOptions);
        try (document) {
            if (output.toAbsolutePath().getParent() != null) {
                Files.createDirectories(output.toAbsolutePath().getParent());
            }
            try (OutputStream out = Files.newOutputStream(output)) {
                document.write(out);
            }
        } catch (IOException e) {
            throw reported(new ConversionException(ErrorCategory.IO, "FileWrite",
                    "cannot write " + output, e));
        }
    }

    /** Converts every input to {@code <outputDir>/<name>.docx}. */
    public BatchResult batchConvert(List<Path> inputs, Path outputDir) throws ConversionException {
        return batchConvert(inputs, outputDir, null);
    }

    public BatchResult batchConvert(List<Path> inputs, Path outputDir, CancellationToken token)
            throws ConversionException {
        BatchRunner runner = new BatchRunner(options.parallelism, options.ignoreErrors,
                options.progressCallback, options.logger);
        return runner.run(new ArrayList<>(inputs), input -> {
            Path output = outputDir.resolve(baseName(input) + ".docx");
            convertFile(input, output);
            return output;
        }, token);
    }

    private XWPFDocument convert(String markdown, ConvertOptions callOptions) throws ConversionException {
        Node ast;
        try {
            ast = parser.parse(markdown);
        } catch (RuntimeException e) {
            throw reported(new ConversionException(ErrorCategory.PARSE, "Parse", String.valueOf(e.getMessage()), e));
        }

        WordDocument document = new WordDocument();
        try {
            new DocumentRenderer(callOptions, document).render(ast);
        } catch (ConversionException e) {
            closeQuietly(document);
            throw e;
        }
        return document.getDocument();
    }

    private String decode(byte[] bytes) throws ConversionException {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw reported(new ConversionException(ErrorCategory.PARSE, "Parse", "input is not valid UTF-8", e));
        }
    }

    private ConversionException reported(ConversionException error) {
        options.logger.warn("{}", error.getMessage());
        options.report(error);
        return error;
    }

    private void closeQuietly(WordDocument document) {
        try {
            document.close();
        } catch (IOException e) {
            options.logger.debug("Failed to close abandoned document", e);
        }
    }

    static String baseName(Path input) {
        String name = input.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static List<Extension> extensions(ConvertOptions options) {
        List<Extension> extensions = new ArrayList<>();
        extensions.add(YamlFrontMatterExtension.create());
        if (options.enableGfm) {
            extensions.add(StrikethroughExtension.create());
            if (options.enableTables) {
                extensions.add(TablesExtension.create());
            }
            if (options.enableTaskList) {
                extensions.add(TaskListItemsExtension.create());
            }
        }
        if (options.enableFootnotes) {
            extensions.add(FootnotesExtension.create());
        }
        if (options.enableMath) {
            extensions.add(MathExtension.create());
        }
        return extensions;
    }
}
