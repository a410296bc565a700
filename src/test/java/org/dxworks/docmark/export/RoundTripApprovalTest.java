package org.dxworks.docmark.export;

import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.approvaltests.Approvals;
import org.dxworks.docmark.convert.MarkdownConverter;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class RoundTripApprovalTest {
    private static final String SAMPLES_BASE_PATH = "src/test/resources/samples/markdown/";

    @Test
    void roundTrip_Mixed() throws Exception {
        verify("Mixed.md");
    }

    @Test
    void roundTrip_ParagraphsSurviveUnchanged() throws Exception {
        assertEquals("**bold** and *italic*\n\nplain second\n\n", roundTrip("**bold** and *italic*\n\nplain second"));
    }

    @Test
    void roundTrip_UnderscoreEmphasisNormalized() throws Exception {
        assertEquals("*x* y\n\n", roundTrip("_x_ y"));
    }

    @Test
    void roundTrip_HeadingAndList() throws Exception {
        assertEquals("## Plan\n\n- one\n- two\n\n", roundTrip("## Plan\n\n- one\n- two"));
    }

    private static String roundTrip(String markdown) throws Exception {
        try (XWPFDocument document = new MarkdownConverter().convertString(markdown)) {
            return new MarkdownExporter().exportToString(document);
        }
    }

    private static void verify(String fileName) throws Exception {
        Path filePath = Paths.get(SAMPLES_BASE_PATH + fileName);
        Approvals.verify(roundTrip(Files.readString(filePath)));
    }
}
