package org.dxworks.docmark;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class BidirectionalConverterTest {

    @TempDir
    Path tempDir;

    @Test
    void autoConvert_BothDirections() throws Exception {
        Path markdown = tempDir.resolve("note.md");
        Files.writeString(markdown, "# Note\n\nSome **text**.", StandardCharsets.UTF_8);
        Path docx = tempDir.resolve("note.docx");
        Path back = tempDir.resolve("back/note.md");
        BidirectionalConverter converter = new BidirectionalConverter();

        assertEquals(Format.MARKDOWN, converter.autoConvert(markdown, docx));
        assertEquals(Format.DOCX, converter.autoConvert(docx, back));

        assertEquals("# Note\n\nSome **text**.\n\n", Files.readString(back, StandardCharsets.UTF_8));
    }

    @Test
    void autoConvert_UnsupportedExtension() throws Exception {
        Path text = tempDir.resolve("plain.txt");
        Files.writeString(text, "hello");

        ConversionException error = assertThrows(ConversionException.class,
                () -> new BidirectionalConverter().autoConvert(text, tempDir.resolve("plain.out")));

        assertEquals(ErrorCategory.IO, error.getCategory());
        assertEquals("AutoConvert", error.getOperation());
    }

    @Test
    void conversionException_Message() {
        ConversionException positioned = new ConversionException(ErrorCategory.PARSE, "Parse", "bad input", 3, 7, null);
        ConversionException plain = new ConversionException(ErrorCategory.IO, "FileRead", "missing");

        assertEquals("Parse at line 3, column 7: bad input", positioned.getMessage());
        assertEquals("FileRead: missing", plain.getMessage());
        assertEquals("missing", plain.getDetail());
        assertEquals("unsupported_node", ErrorCategory.UNSUPPORTED_NODE.getName());
    }
}
