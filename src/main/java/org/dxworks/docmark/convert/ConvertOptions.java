package org.dxworks.docmark.convert;

import org.dxworks.docmark.ConversionException;
import org.dxworks.docmark.batch.ProgressListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Consumer;

/**
 * Per-call settings for Markdown to Word conversion. Start from
 * {@link #defaults()} or {@link #highQuality()} and adjust fields.
 */
public class ConvertOptions {
    public boolean enableGfm = true;
    public boolean enableFootnotes = true;
    public boolean enableTables = true;
    public boolean enableTaskList = true;
    public boolean enableMath = true;
    /** Embed formulas as Word equations instead of Cambria Math text runs. */
    public boolean nativeMath = false;

    public String defaultFontFamily = "Calibri";
    public double defaultFontSize = 11.0;

    /** Directory relative image paths are resolved against; null means as-is. */
    public String imageBasePath;
    public boolean embedImages = false;
    public double maxImageWidth = 6.0;

    public boolean generateToc = true;
    public int tocMaxLevel = 3;

    public boolean strictMode = false;
    public boolean ignoreErrors = true;
    public Consumer<ConversionException> errorCallback;
    public ProgressListener progressCallback;
    public int parallelism = 1;
    public Logger logger = LoggerFactory.getLogger(MarkdownConverter.class);

    public static ConvertOptions defaults() {
        return new ConvertOptions();
    }

    public static ConvertOptions highQuality() {
        ConvertOptions options = new ConvertOptions();
        options.embedImages = true;
        options.strictMode = true;
        options.ignoreErrors = false;
        return options;
    }

    /** Shallow copy, for per-file adjustments during batch runs. */
    public ConvertOptions copy() {
        ConvertOptions copy = new ConvertOptions();
        copy.enableGfm = enableGfm;
        copy.enableFootnotes = enableFootnotes;
        copy.enableTables = enableTables;
        copy.enableTaskList = enableTaskList;
        copy.enableMath = enableMath;
        copy.nativeMath = nativeMath;
        copy.defaultFontFamily = defaultFontFamily;
        copy.defaultFontSize = defaultFontSize;
        copy.imageBasePath = imageBasePath;
        copy.embedImages = embedImages;
        copy.maxImageWidth = maxImageWidth;
        copy.generateToc = generateToc;
        copy.tocMaxLevel = tocMaxLevel;
        copy.strictMode = strictMode;
        copy.ignoreErrors = ignoreErrors;
        copy.errorCallback = errorCallback;
        copy.progressCallback = progressCallback;
        copy.parallelism = parallelism;
        copy.logger = logger;
        return copy;
    }

    void report(ConversionException error) {
        if (errorCallback != null) {
            errorCallback.accept(error);
        }
    }
}
