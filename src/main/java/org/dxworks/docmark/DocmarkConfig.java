package org.dxworks.docmark;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.docmark.convert.ConvertOptions;
import org.dxworks.docmark.export.ExportOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * CLI settings read from {@code docmark-config.yml} in the working directory.
 * Absent keys keep their defaults.
 */
public class DocmarkConfig {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocmarkConfig.class);

    private static final String CONFIG_FILE_NAME = "docmark-config.yml";
    private static final int DEFAULT_PARALLELISM = 1;
    private static final boolean DEFAULT_IGNORE_ERRORS = true;

    private final int parallelism;
    private final boolean ignoreErrors;
    private final YamlConfig values;

    private DocmarkConfig(int parallelism, boolean ignoreErrors, YamlConfig values) {
        this.parallelism = parallelism;
        this.ignoreErrors = ignoreErrors;
        this.values = values;
    }

    public int getParallelism() {
        return parallelism;
    }

    public boolean isIgnoreErrors() {
        return ignoreErrors;
    }

    public static DocmarkConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static DocmarkConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                int effectiveParallelism = (yamlConfig.parallelism != null && yamlConfig.parallelism > 0)
                        ? yamlConfig.parallelism
                        : DEFAULT_PARALLELISM;
                boolean effectiveIgnoreErrors = yamlConfig.ignoreErrors != null
                        ? yamlConfig.ignoreErrors
                        : DEFAULT_IGNORE_ERRORS;
                return new DocmarkConfig(effectiveParallelism, effectiveIgnoreErrors, yamlConfig);
            }
        } catch (IOException e) {
            LOGGER.warn("Ignoring unreadable {}: {}", configPath, e.getMessage());
        }

        return defaults();
    }

    public static DocmarkConfig defaults() {
        return new DocmarkConfig(DEFAULT_PARALLELISM, DEFAULT_IGNORE_ERRORS, new YamlConfig());
    }

    public ConvertOptions toConvertOptions() {
        ConvertOptions options = ConvertOptions.defaults();
        options.parallelism = parallelism;
        options.ignoreErrors = ignoreErrors;
        if (values.strictMode != null) options.strictMode = values.strictMode;
        if (values.generateToc != null) options.generateToc = values.generateToc;
        if (values.tocMaxLevel != null && values.tocMaxLevel > 0) options.tocMaxLevel = values.tocMaxLevel;
        if (values.defaultFontFamily != null && !values.defaultFontFamily.isBlank()) {
            options.defaultFontFamily = values.defaultFontFamily;
        }
        if (values.defaultFontSize != null && values.defaultFontSize > 0) options.defaultFontSize = values.defaultFontSize;
        if (values.embedImages != null) options.embedImages = values.embedImages;
        if (values.nativeMath != null) options.nativeMath = values.nativeMath;
        return options;
    }

    public ExportOptions toExportOptions() {
        ExportOptions options = ExportOptions.defaults();
        options.parallelism = parallelism;
        options.ignoreErrors = ignoreErrors;
        if (values.strictMode != null) options.strictMode = values.strictMode;
        if (values.useSetext != null) options.useSetext = values.useSetext;
        if (values.useGfmTables != null) options.useGfmTables = values.useGfmTables;
        if (values.includeMetadata != null) options.includeMetadata = values.includeMetadata;
        if (values.defaultCodeLang != null) options.defaultCodeLang = values.defaultCodeLang;
        if (values.wrapLongLines != null) options.wrapLongLines = values.wrapLongLines;
        if (values.maxLineLength != null && values.maxLineLength > 0) options.maxLineLength = values.maxLineLength;
        return options;
    }

    private static class YamlConfig {
        public Integer parallelism;
        public Boolean ignoreErrors;
        public Boolean strictMode;

        public Boolean generateToc;
        public Integer tocMaxLevel;
        public String defaultFontFamily;
        public Double defaultFontSize;
        public Boolean embedImages;
        public Boolean nativeMath;

        public Boolean useSetext;
        public Boolean useGfmTables;
        public Boolean includeMetadata;
        public String defaultCodeLang;
        public Boolean wrapLongLines;
        public Integer maxLineLength;
    }
}
