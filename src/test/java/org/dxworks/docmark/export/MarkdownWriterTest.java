package org.dxworks.docmark.export;

import org.apache.poi.xwpf.usermodel.Borders;
import org.apache.poi.xwpf.usermodel.Document;
import org.apache.poi.xwpf.usermodel.XWPFAbstractNum;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFFootnote;
import org.apache.poi.xwpf.usermodel.XWPFNumbering;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFStyle;
import org.apache.poi.xwpf.usermodel.XWPFStyles;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.dxworks.docmark.ConversionException;
import org.dxworks.docmark.ErrorCategory;
import org.dxworks.docmark.TestUtils;
import org.junit.jupiter.api.Test;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTAbstractNum;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTLvl;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTSdtBlock;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTStyle;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STNumberFormat;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STStyleType;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MarkdownWriterTest {

    private static String write(XWPFDocument document) throws Exception {
        return new MarkdownWriter(ExportOptions.defaults()).write(document);
    }

    private static String write(XWPFDocument document, ExportOptions options) throws Exception {
        return new MarkdownWriter(options).write(document);
    }

    private static XWPFParagraph styled(XWPFDocument document, String style, String text) {
        XWPFParagraph paragraph = TestUtils.paragraph(document, text);
        paragraph.setStyle(style);
        return paragraph;
    }

    private static BigInteger numbering(XWPFDocument document, STNumberFormat.Enum format) {
        CTAbstractNum abstractNum = CTAbstractNum.Factory.newInstance();
        abstractNum.setAbstractNumId(BigInteger.ZERO);
        CTLvl level = abstractNum.addNewLvl();
        level.setIlvl(BigInteger.ZERO);
        level.addNewNumFmt().setVal(format);

        XWPFNumbering numbering = document.createNumbering();
        BigInteger abstractId = numbering.addAbstractNum(new XWPFAbstractNum(abstractNum));
        return numbering.addNum(abstractId);
    }

    private static void setCell(XWPFTable table, int row, int col, String text, boolean bold) {
        XWPFRun run = table.getRow(row).getCell(col).getParagraphs().get(0).createRun();
        run.setText(text);
        run.setBold(bold);
    }

    /** A reloaded document with a block content control between two paragraphs. */
    private static XWPFDocument withContentControl() throws Exception {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (XWPFDocument document = new XWPFDocument()) {
            TestUtils.paragraph(document, "before");
            CTSdtBlock sdt = document.getDocument().getBody().addNewSdt();
            sdt.addNewSdtPr();
            sdt.addNewSdtContent().addNewP().addNewR().addNewT().setStringValue("inside");
            TestUtils.paragraph(document, "after");
            document.write(bytes);
        }
        return new XWPFDocument(new ByteArrayInputStream(bytes.toByteArray()));
    }

    @Test
    void write_SingleParagraph() throws Exception {
        try (XWPFDocument document = new XWPFDocument()) {
            TestUtils.paragraph(document, "T");

            assertEquals("T\n\n", write(document));
        }
    }

    @Test
    void write_BlankParagraphAndRule() throws Exception {
        try (XWPFDocument document = new XWPFDocument()) {
            TestUtils.paragraph(document, "a");
            document.createParagraph();
            document.createParagraph().setBorderBottom(Borders.SINGLE);
            TestUtils.paragraph(document, "b");

            assertEquals("a\n\n\n---\n\nb\n\n", write(document));
        }
    }

    @Test
    void write_HeadingsFromStyleIds() throws Exception {
        try (XWPFDocument document = new XWPFDocument()) {
            styled(document, "Heading1", "Top");
            styled(document, "heading 2", "Second");
            styled(document, "Title", "Doc");

            assertEquals("# Top\n\n## Second\n\n# Doc\n\n", write(document));
        }
    }

    @Test
    void write_HeadingFromStyleName() throws Exception {
        try (XWPFDocument document = new XWPFDocument()) {
            XWPFStyles styles = document.createStyles();
            CTStyle style = CTStyle.Factory.newInstance();
            style.setStyleId("Chapter");
            style.setType(STStyleType.PARAGRAPH);
            style.addNewName().setVal("heading 3");
            styles.addStyle(new XWPFStyle(style, styles));
            styled(document, "Chapter", "Part");

            assertEquals("### Part\n\n", write(document));
        }
    }

    @Test
    void write_SetextHeadings() throws Exception {
        try (XWPFDocument document = new XWPFDocument()) {
            styled(document, "Heading1", "Title");
            styled(document, "Heading2", "Sub");
            styled(document, "Heading3", "Deep");
            ExportOptions options = ExportOptions.defaults();
            options.useSetext = true;

            assertEquals("Title\n=====\n\nSub\n---\n\n### Deep\n\n", write(document, options));
        }
    }

    @Test
    void write_Quote() throws Exception {
        try (XWPFDocument document = new XWPFDocument()) {
            XWPFParagraph quote = styled(document, "Quote", "first");
            quote.createRun().addBreak();
            quote.createRun().setText("second");

            assertEquals("> first\n> second\n\n", write(document));
        }
    }

    @Test
    void write_CodeParagraphsMergeIntoOneFence() throws Exception {
        try (XWPFDocument document = new XWPFDocument()) {
            styled(document, "CodeBlock", "int a;");
            styled(document, "CodeBlock", " ");
            styled(document, "SourceCode", "}");
            TestUtils.paragraph(document, "after");
            ExportOptions options = ExportOptions.defaults();
            options.defaultCodeLang = "java";

            assertEquals("```java\nint a;\n\n}\n```\n\nafter\n\n", write(document, options));
        }
    }

    @Test
    void write_RunFormatting() throws Exception {
        try (XWPFDocument document = new XWPFDocument()) {
            XWPFParagraph paragraph = document.createParagraph();
            TestUtils.run(paragraph, "plain ", false, false);
            TestUtils.run(paragraph, "bo", true, false);
            TestUtils.run(paragraph, "ld ", true, false);
            TestUtils.run(paragraph, "and ", false, false);
            TestUtils.run(paragraph, "it", false, true);
            TestUtils.run(paragraph, " ", false, false);
            TestUtils.run(paragraph, "both", true, true);
            TestUtils.run(paragraph, " ", false, false);
            TestUtils.run(paragraph, "gone", false, false).setStrikeThrough(true);
            TestUtils.run(paragraph, " ", false, false);
            TestUtils.run(paragraph, "x()", false, false).setFontFamily("Consolas");

            assertEquals("plain **bold** and *it* ***both*** ~~gone~~ `x()`\n\n", write(document));
        }
    }

    @Test
    void write_CodeSpanWithBacktick() throws Exception {
        try (XWPFDocument document = new XWPFDocument()) {
            XWPFParagraph paragraph = document.createParagraph();
            TestUtils.run(paragraph, "a`b", false, false).setFontFamily("Consolas");

            assertEquals("`` a`b ``\n\n", write(document));
        }
    }

    @Test
    void write_FormattedCodeSpan() throws Exception {
        try (XWPFDocument document = new XWPFDocument()) {
            XWPFParagraph paragraph = document.createParagraph();
            TestUtils.run(paragraph, "x", true, false).setFontFamily("Consolas");
            TestUtils.run(paragraph, " ", false, false);
            XWPFRun struck = TestUtils.run(paragraph, "y", false, false);
            struck.setFontFamily("Courier New");
            struck.setStrikeThrough(true);

            assertEquals("**`x`** ~~`y`~~\n\n", write(document));
        }
    }

    @Test
    void write_UnderscoreEmphasisMarker() throws Exception {
        try (XWPFDocument document = new XWPFDocument()) {
            XWPFParagraph paragraph = document.createParagraph();
            TestUtils.run(paragraph, "x", false, true);
            TestUtils.run(paragraph, " y", false, false);
            ExportOptions options = ExportOptions.defaults();
            options.emphasisMarker = "_";

            assertEquals("_x_ y\n\n", write(document, options));
        }
    }

    @Test
    void write_GlyphLists() throws Exception {
        try (XWPFDocument document = new XWPFDocument()) {
            TestUtils.paragraph(document, "• ", "one");
            TestUtils.paragraph(document, "  • ", "two");
            TestUtils.paragraph(document, "☑ ", "done");
            TestUtils.paragraph(document, "☐ ", "open");
            TestUtils.paragraph(document, "after");

            assertEquals("- one\n  - two\n- [x] done\n- [ ] open\n\nafter\n\n", write(document));
        }
    }

    @Test
    void write_NumberedParagraphs() throws Exception {
        try (XWPFDocument document = new XWPFDocument()) {
            BigInteger decimal = numbering(document, STNumberFormat.DECIMAL);
            XWPFParagraph step = TestUtils.paragraph(document, "step");
            step.setNumID(decimal);
            step.setNumILvl(BigInteger.ZERO);

            assertEquals("1. step\n\n", write(document));
        }
    }

    @Test
    void write_BulletNumberingUsesConfiguredMarker() throws Exception {
        try (XWPFDocument document = new XWPFDocument()) {
            BigInteger bullet = numbering(document, STNumberFormat.BULLET);
            XWPFParagraph item = TestUtils.paragraph(document, "item");
            item.setNumID(bullet);
            item.setNumILvl(BigInteger.ZERO);
            ExportOptions options = ExportOptions.defaults();
            options.bulletListMarker = "*";

            assertEquals("* item\n\n", write(document, options));
        }
    }

    @Test
    void write_GfmTableAfterParagraphs() throws Exception {
        try (XWPFDocument document = new XWPFDocument()) {
            TestUtils.paragraph(document, "Intro");
            XWPFTable table = document.createTable(2, 2);
            setCell(table, 0, 0, "Name", true);
            setCell(table, 0, 1, "Score", true);
            setCell(table, 1, 0, "Ann", true);
            setCell(table, 1, 1, "1|2", false);
            TestUtils.paragraph(document, "Outro");

            assertEquals("Intro\n\nOutro\n\n| Name | Score |\n|-----|-----|\n| **Ann** | 1\\|2 |\n\n", write(document));
        }
    }

    @Test
    void write_GfmTableExactLayout() throws Exception {
        try (XWPFDocument document = new XWPFDocument()) {
            XWPFTable table = document.createTable(2, 2);
            setCell(table, 0, 0, "A", false);
            setCell(table, 0, 1, "B", false);
            setCell(table, 1, 0, "1", false);
            setCell(table, 1, 1, "2", false);

            assertEquals("| A | B |\n|-----|-----|\n| 1 | 2 |\n\n", write(document));
        }
    }

    @Test
    void write_SimpleTable() throws Exception {
        try (XWPFDocument document = new XWPFDocument()) {
            XWPFTable table = document.createTable(2, 2);
            setCell(table, 0, 0, "A", false);
            setCell(table, 0, 1, "B", false);
            setCell(table, 1, 0, "1", false);
            setCell(table, 1, 1, "2", false);
            ExportOptions options = ExportOptions.defaults();
            options.useGfmTables = false;

            assertEquals("**A | B**\n1 | 2\n\n", write(document, options));
        }
    }

    @Test
    void write_Footnotes() throws Exception {
        try (XWPFDocument document = new XWPFDocument()) {
            XWPFParagraph body = TestUtils.paragraph(document, "Body");
            XWPFFootnote footnote = document.createFootnote();
            footnote.createParagraph().createRun().setText("Note.");
            body.addFootnoteReference(footnote);

            assertEquals("Body[^1]\n\n\n---\n\n[^1]: Note.\n", write(document));
        }
    }

    @Test
    void write_Metadata() throws Exception {
        try (XWPFDocument document = new XWPFDocument()) {
            document.getProperties().getCoreProperties().setTitle("Plan \"B\"");
            document.getProperties().getCoreProperties().setCreator("Ann");
            TestUtils.paragraph(document, "x");
            ExportOptions options = ExportOptions.highQuality();

            assertEquals("---\ntitle: \"Plan \\\"B\\\"\"\nauthor: \"Ann\"\n---\n\nx\n\n", write(document, options));
        }
    }

    @Test
    void write_MetadataDefaultsTitle() throws Exception {
        try (XWPFDocument document = new XWPFDocument()) {
            document.getProperties().getCoreProperties().setCreator("");
            ExportOptions options = ExportOptions.defaults();
            options.includeMetadata = true;

            assertEquals("---\ntitle: \"Document\"\n---\n\n", write(document, options));
        }
    }

    @Test
    void write_WrapsLongLines() throws Exception {
        try (XWPFDocument document = new XWPFDocument()) {
            TestUtils.paragraph(document, "aaa bbb ccc ddd");
            ExportOptions options = ExportOptions.defaults();
            options.wrapLongLines = true;
            options.maxLineLength = 10;

            assertEquals("aaa bbb\nccc ddd\n\n", write(document, options));
        }
    }

    @Test
    void wrapText_KeepsShortText() {
        assertEquals("short", MarkdownWriter.wrapText("short", 10));
        assertEquals("a\nverylongword\nb", MarkdownWriter.wrapText("a verylongword b", 5));
    }

    @Test
    void write_HyperlinkAfterReload() throws Exception {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (XWPFDocument document = new XWPFDocument()) {
            XWPFParagraph paragraph = TestUtils.paragraph(document, "See ");
            paragraph.createHyperlinkRun("https://example.com").setText("site");
            document.write(bytes);
        }

        try (XWPFDocument reloaded = new XWPFDocument(new ByteArrayInputStream(bytes.toByteArray()))) {
            assertEquals("See [site](https://example.com)\n\n", write(reloaded));
        }
    }

    @Test
    void write_ExtractsPictures() throws Exception {
        ByteArrayOutputStream png = new ByteArrayOutputStream();
        ImageIO.write(new BufferedImage(4, 4, BufferedImage.TYPE_INT_RGB), "png", png);

        try (XWPFDocument document = new XWPFDocument()) {
            XWPFParagraph paragraph = document.createParagraph();
            paragraph.createRun().addPicture(new ByteArrayInputStream(png.toByteArray()),
                    Document.PICTURE_TYPE_PNG, "pic.png", 10000, 10000);
            MarkdownWriter writer = new MarkdownWriter(ExportOptions.defaults());

            assertEquals("![image_1.png](image_1.png)\n\n", writer.write(document));
            List<ExtractedImage> images = writer.getExtractedImages();
            assertEquals(1, images.size());
            assertEquals("image_1.png", images.get(0).fileName);
            assertArrayEquals(png.toByteArray(), images.get(0).data);
        }
    }

    @Test
    void write_PicturesNotExtracted() throws Exception {
        ByteArrayOutputStream png = new ByteArrayOutputStream();
        ImageIO.write(new BufferedImage(4, 4, BufferedImage.TYPE_INT_RGB), "png", png);

        try (XWPFDocument document = new XWPFDocument()) {
            document.createParagraph().createRun().addPicture(new ByteArrayInputStream(png.toByteArray()),
                    Document.PICTURE_TYPE_PNG, "pic.png", 10000, 10000);
            ExportOptions options = ExportOptions.defaults();
            options.extractImages = false;

            String markdown = write(document, options);

            assertTrue(markdown.startsWith("[Image: "));
        }
    }

    @Test
    void write_UnsupportedElementIsReportedAndSkipped() throws Exception {
        List<ConversionException> errors = new ArrayList<>();
        ExportOptions options = ExportOptions.defaults();
        options.errorCallback = errors::add;

        try (XWPFDocument document = withContentControl()) {
            assertEquals("before\n\nafter\n\n", write(document, options));
        }

        assertEquals(1, errors.size());
        assertEquals(ErrorCategory.UNSUPPORTED_NODE, errors.get(0).getCategory());
        assertEquals("WriteElement", errors.get(0).getOperation());
    }

    @Test
    void write_StrictModeFailsOnUnsupportedElement() throws Exception {
        List<ConversionException> errors = new ArrayList<>();
        ExportOptions options = ExportOptions.defaults();
        options.strictMode = true;
        options.ignoreErrors = false;
        options.errorCallback = errors::add;

        try (XWPFDocument document = withContentControl()) {
            ConversionException error = assertThrows(ConversionException.class, () -> write(document, options));

            assertEquals(ErrorCategory.UNSUPPORTED_NODE, error.getCategory());
            assertEquals(List.of(error), errors);
        }
    }

    @Test
    void write_StrictModeIgnoringErrorsContinues() throws Exception {
        List<ConversionException> errors = new ArrayList<>();
        ExportOptions options = ExportOptions.defaults();
        options.strictMode = true;
        options.errorCallback = errors::add;

        try (XWPFDocument document = withContentControl()) {
            assertEquals("before\n\nafter\n\n", write(document, options));
        }

        assertEquals(1, errors.size());
        assertTrue(errors.get(0).getDetail().startsWith("unsupported element"));
    }
}
