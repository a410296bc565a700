package org.dxworks.docmark.export;

import org.dxworks.docmark.ConversionException;
import org.dxworks.docmark.batch.ProgressListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Consumer;

/**
 * Per-call settings for Word to Markdown export.
 */
public class ExportOptions {
    public boolean useGfmTables = true;
    public boolean preserveFootnotes = true;
    public boolean wrapLongLines = false;
    public int maxLineLength = 80;

    public boolean extractImages = true;
    /** Where extracted pictures are written; null means next to the Markdown output. */
    public String imageOutputDir;
    public String imageNamePattern = "image_%d.png";

    public boolean convertHyperlinks = true;
    public String defaultCodeLang = "";
    public boolean includeMetadata = false;
    public boolean useSetext = false;
    public String bulletListMarker = "-";
    public String emphasisMarker = "*";

    public boolean strictMode = false;
    public boolean ignoreErrors = true;
    public Consumer<ConversionException> errorCallback;
    public ProgressListener progressCallback;
    public int parallelism = 1;
    public Logger logger = LoggerFactory.getLogger(MarkdownExporter.class);

    public static ExportOptions defaults() {
        return new ExportOptions();
    }

    public static ExportOptions highQuality() {
        ExportOptions options = new ExportOptions();
        options.includeMetadata = true;
        options.ignoreErrors = false;
        return options;
    }

    void report(ConversionException error) {
        if (errorCallback != null) {
            errorCallback.accept(error);
        }
    }
}
