package org.dxworks.docmark;

import java.nio.file.Path;
import java.util.Optional;

public class FormatDetector {

    public static Optional<Format> detectFormat(Path filePath) {
        String fileName = filePath.getFileName().toString().toLowerCase();

        if (fileName.endsWith(".md") || fileName.endsWith(".markdown")) {
            return Optional.of(Format.MARKDOWN);
        } else if (fileName.endsWith(".docx")) {
            return Optional.of(Format.DOCX);
        }

        return Optional.empty();
    }
}
