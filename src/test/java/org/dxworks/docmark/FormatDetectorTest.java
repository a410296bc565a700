package org.dxworks.docmark;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class FormatDetectorTest {

    @Test
    void detectFormat() {
        assertEquals(Optional.of(Format.MARKDOWN), FormatDetector.detectFormat(Path.of("README.md")));
        assertEquals(Optional.of(Format.MARKDOWN), FormatDetector.detectFormat(Path.of("notes.Markdown")));
        assertEquals(Optional.of(Format.DOCX), FormatDetector.detectFormat(Path.of("dir", "Report.DOCX")));
        assertEquals(Optional.empty(), FormatDetector.detectFormat(Path.of("legacy.doc")));
        assertEquals(Optional.empty(), FormatDetector.detectFormat(Path.of("Makefile")));
    }

    @Test
    void outputFileName() {
        assertEquals(Optional.of("a.docx"), BidirectionalConverter.outputFileName(Path.of("a.md")));
        assertEquals(Optional.of("b.md"), BidirectionalConverter.outputFileName(Path.of("b.docx")));
        assertEquals(Optional.empty(), BidirectionalConverter.outputFileName(Path.of("c.txt")));
    }
}
