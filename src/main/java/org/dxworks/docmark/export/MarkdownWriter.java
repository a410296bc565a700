package org.dxworks.docmark.export;

import org.apache.poi.ooxml.POIXMLProperties;
import org.apache.poi.xwpf.usermodel.Borders;
import org.apache.poi.xwpf.usermodel.IBodyElement;
import org.apache.poi.xwpf.usermodel.XWPFFootnote;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFHyperlink;
import org.apache.poi.xwpf.usermodel.XWPFHyperlinkRun;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFPicture;
import org.apache.poi.xwpf.usermodel.XWPFPictureData;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFStyle;
import org.apache.poi.xwpf.usermodel.XWPFStyles;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;
import org.dxworks.docmark.ConversionException;
import org.dxworks.docmark.ErrorCategory;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTFtnEdnRef;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Writes a Word document as Markdown: optional front matter, every body
 * paragraph, then every table, then collected footnotes. One instance
 * writes one document.
 */
public class MarkdownWriter {

    private static final Pattern HEADING_STYLE = Pattern.compile("(?i)heading\\s*([1-9])");
    private static final Pattern LIST_GLYPH = Pattern.compile("^( *)(• |☑ |☐ )");
    private static final Set<String> CODE_STYLES = Set.of("codeblock", "code", "sourcecode", "htmlpreformatted");
    private static final Set<String> QUOTE_STYLES = Set.of("quote", "intensequote", "blockquote");
    private static final Set<String> MONOSPACE_FONTS = Set.of(
            "consolas", "courier new", "courier", "menlo", "monaco", "lucida console", "source code pro", "monospace");
    private static final String SEPARATOR_CELL = "-----|";

    private final ExportOptions options;
    private final StringBuilder out = new StringBuilder();
    private final List<String> footnotes = new ArrayList<>();
    private final List<ExtractedImage> images = new ArrayList<>();

    private XWPFDocument document;
    private boolean inCodeBlock;
    private boolean inList;

    public MarkdownWriter(ExportOptions options) {
        this.options = options;
    }

    public String write(XWPFDocument source) throws ConversionException {
        this.document = source;
        if (options.includeMetadata) {
            writeMetadata();
        }

        List<XWPFTable> tables = new ArrayList<>();
        int index = 0;
        for (IBodyElement element : source.getBodyElements()) {
            index++;
            if (element instanceof XWPFParagraph paragraph) {
                try {
                    writeParagraph(paragraph);
                } catch (RuntimeException e) {
                    fail(new ConversionException(ErrorCategory.DOCUMENT_MODEL, "WriteParagraph",
                            "paragraph " + index + ": " + e.getMessage(), e));
                }
            } else if (element instanceof XWPFTable table) {
                tables.add(table);
            } else {
                unsupported(element, index);
            }
        }
        closeCodeBlock();
        closeList();

        for (XWPFTable table : tables) {
            try {
                writeTable(table);
            } catch (RuntimeException e) {
                fail(new ConversionException(ErrorCategory.DOCUMENT_MODEL, "WriteTable", String.valueOf(e.getMessage()), e));
            }
        }

        if (options.preserveFootnotes && !footnotes.isEmpty()) {
            writeFootnotes();
        }
        return out.toString();
    }

    /** Pictures collected while writing, in document order. */
    public List<ExtractedImage> getExtractedImages() {
        return List.copyOf(images);
    }

    private void writeMetadata() {
        POIXMLProperties.CoreProperties core = document.getProperties().getCoreProperties();
        String title = core.getTitle();
        out.append("---\n");
        out.append("title: \"").append(escapeQuotes(title == null || title.isBlank() ? "Document" : title)).append("\"\n");
        String author = core.getCreator();
        if (author != null && !author.isBlank()) {
            out.append("author: \"").append(escapeQuotes(author)).append("\"\n");
        }
        out.append("---\n\n");
    }

    private void writeParagraph(XWPFParagraph paragraph) {
        String style = paragraph.getStyle();
        if (isCodeStyle(style)) {
            closeList();
            writeCodeLine(paragraph);
            return;
        }
        closeCodeBlock();

        int headingLevel = headingLevel(style);
        if (headingLevel > 0) {
            closeList();
            writeHeading(paragraph.getText().strip(), headingLevel);
            return;
        }
        if (style != null && QUOTE_STYLES.contains(style.toLowerCase(Locale.ROOT))) {
            closeList();
            writeQuote(formatRuns(paragraph));
            return;
        }

        String text = formatRuns(paragraph);
        if (paragraph.getNumID() != null) {
            writeListItem(text, isNumbered(paragraph) ? "1." : options.bulletListMarker, "");
            return;
        }
        Matcher glyph = LIST_GLYPH.matcher(text);
        if (glyph.find()) {
            writeListItem(text.substring(glyph.end()), markerForGlyph(glyph.group(2)), glyph.group(1));
            return;
        }

        closeList();
        if (text.isBlank() && paragraph.getBorderBottom() != Borders.NONE) {
            out.append("---\n\n");
            return;
        }
        writeNormal(text);
    }

    private void writeHeading(String text, int level) {
        if (text.isEmpty()) {
            return;
        }
        if (options.useSetext && level <= 2) {
            String underline = level == 1 ? "=" : "-";
            out.append(text).append('\n').append(underline.repeat(text.length())).append("\n\n");
        } else {
            out.append("#".repeat(level)).append(' ').append(text).append("\n\n");
        }
    }

    private void writeQuote(String text) {
        if (text.isBlank()) {
            return;
        }
        for (String line : text.split("\n", -1)) {
            out.append("> ").append(line).append('\n');
        }
        out.append('\n');
    }

    private void writeCodeLine(XWPFParagraph paragraph) {
        if (!inCodeBlock) {
            out.append("```").append(options.defaultCodeLang).append('\n');
            inCodeBlock = true;
        }
        String line = paragraph.getText();
        out.append(" ".equals(line) ? "" : line).append('\n');
    }

    private void closeCodeBlock() {
        if (inCodeBlock) {
            out.append("```\n\n");
            inCodeBlock = false;
        }
    }

    private void writeListItem(String text, String marker, String indent) {
        if (text.isBlank()) {
            return;
        }
        out.append(indent).append(marker).append(' ').append(text).append('\n');
        inList = true;
    }

    private void closeList() {
        if (inList) {
            out.append('\n');
            inList = false;
        }
    }

    private void writeNormal(String text) {
        if (text.isBlank()) {
            out.append('\n');
            return;
        }
        if (options.wrapLongLines && text.length() > options.maxLineLength) {
            text = wrapText(text, options.maxLineLength);
        }
        out.append(text).append("\n\n");
    }

    private void writeTable(XWPFTable table) {
        List<XWPFTableRow> rows = table.getRows();
        if (rows.isEmpty()) {
            return;
        }
        if (!options.useGfmTables) {
            writeSimpleTable(rows);
            return;
        }

        XWPFTableRow header = rows.get(0);
        out.append('|');
        for (XWPFTableCell cell : header.getTableCells()) {
            out.append(' ').append(cellText(cell.getText())).append(" |");
        }
        out.append('\n');

        out.append('|');
        out.append(SEPARATOR_CELL.repeat(header.getTableCells().size()));
        out.append('\n');

        for (int i = 1; i < rows.size(); i++) {
            out.append('|');
            for (XWPFTableCell cell : rows.get(i).getTableCells()) {
                out.append(' ').append(cellText(formattedCellText(cell))).append(" |");
            }
            out.append('\n');
        }
        out.append('\n');
    }

    private void writeSimpleTable(List<XWPFTableRow> rows) {
        for (int i = 0; i < rows.size(); i++) {
            if (i == 0) {
                out.append("**");
            }
            List<XWPFTableCell> cells = rows.get(i).getTableCells();
            for (int j = 0; j < cells.size(); j++) {
                if (j > 0) {
                    out.append(" | ");
                }
                out.append(cellText(cells.get(j).getText()));
            }
            if (i == 0) {
                out.append("**");
            }
            out.append('\n');
        }
        out.append('\n');
    }

    private void writeFootnotes() {
        out.append("\n---\n\n");
        for (int i = 0; i < footnotes.size(); i++) {
            out.append("[^").append(i + 1).append("]: ").append(footnotes.get(i)).append('\n');
        }
    }

    private String formattedCellText(XWPFTableCell cell) {
        List<String> parts = new ArrayList<>();
        for (XWPFParagraph paragraph : cell.getParagraphs()) {
            parts.add(formatRuns(paragraph));
        }
        return String.join(" ", parts);
    }

    private static String cellText(String text) {
        return text.replace("\r", "").replace('\n', ' ').replace("|", "\\|").strip();
    }

    /** Paragraph text with emphasis markers rebuilt from run flags. */
    String formatRuns(XWPFParagraph paragraph) {
        List<Segment> segments = new ArrayList<>();
        for (XWPFRun run : paragraph.getRuns()) {
            addSegments(run, segments);
        }

        StringBuilder text = new StringBuilder();
        for (Segment segment : segments) {
            text.append(segment.render(options.emphasisMarker));
        }
        return text.toString();
    }

    private void addSegments(XWPFRun run, List<Segment> segments) {
        List<CTFtnEdnRef> references = run.getCTR().getFootnoteReferenceList();
        if (!references.isEmpty()) {
            for (CTFtnEdnRef reference : references) {
                segments.add(Segment.literal(footnoteMarker(reference.getId())));
            }
            return;
        }

        List<XWPFPicture> pictures = run.getEmbeddedPictures();
        if (!pictures.isEmpty()) {
            for (XWPFPicture picture : pictures) {
                segments.add(Segment.literal(pictureReference(picture)));
            }
            return;
        }

        String text = run.text();
        if (text == null || text.isEmpty()) {
            return;
        }

        if (run instanceof XWPFHyperlinkRun hyperlinkRun && options.convertHyperlinks) {
            XWPFHyperlink link = hyperlinkRun.getHyperlink(document);
            String target = link != null ? link.getURL() : null;
            if (target == null && hyperlinkRun.getAnchor() != null) {
                target = "#" + hyperlinkRun.getAnchor();
            }
            if (target != null) {
                segments.add(Segment.literal("[" + text + "](" + target + ")"));
                return;
            }
        }

        Segment segment = new Segment(text, run.isBold(), run.isItalic(), run.isStrikeThrough(), isMonospace(run));
        Segment last = segments.isEmpty() ? null : segments.get(segments.size() - 1);
        if (last != null && last.sameFormat(segment)) {
            last.text.append(text);
        } else {
            segments.add(segment);
        }
    }

    private String footnoteMarker(BigInteger id) {
        XWPFFootnote footnote = id != null ? document.getFootnoteByID(id.intValue()) : null;
        if (footnote == null) {
            return "";
        }
        List<String> parts = new ArrayList<>();
        for (XWPFParagraph paragraph : footnote.getParagraphs()) {
            String text = paragraph.getText().strip();
            if (!text.isEmpty()) {
                parts.add(text);
            }
        }
        footnotes.add(String.join(" ", parts));
        return "[^" + footnotes.size() + "]";
    }

    private String pictureReference(XWPFPicture picture) {
        XWPFPictureData data = picture.getPictureData();
        if (!options.extractImages || data == null) {
            String description = picture.getDescription();
            return "[Image: " + (description == null || description.isBlank() ? "image" : description) + "]";
        }
        String name = imageName(images.size() + 1, data.suggestFileExtension());
        images.add(new ExtractedImage(name, data.getData()));
        return "![" + name + "](" + name + ")";
    }

    private String imageName(int number, String extension) {
        String name = String.format(options.imageNamePattern, number);
        int dot = name.lastIndexOf('.');
        if (extension == null || extension.isEmpty()) {
            return name;
        }
        String base = dot > 0 ? name.substring(0, dot) : name;
        return base + "." + extension;
    }

    private void unsupported(IBodyElement element, int index) throws ConversionException {
        ConversionException error = new ConversionException(ErrorCategory.UNSUPPORTED_NODE, "WriteElement",
                "unsupported element " + element.getElementType() + " at position " + index);
        if (options.strictMode) {
            fail(error);
            return;
        }
        options.logger.debug("Skipping {}", error.getMessage());
        options.report(error);
    }

    private void fail(ConversionException error) throws ConversionException {
        options.logger.warn("{}", error.getMessage());
        options.report(error);
        if (!options.ignoreErrors) {
            throw error;
        }
    }

    private int headingLevel(String styleId) {
        if (styleId == null) {
            return 0;
        }
        int level = headingLevelFromName(styleId);
        if (level > 0) {
            return level;
        }
        XWPFStyles styles = document.getStyles();
        XWPFStyle style = styles != null ? styles.getStyle(styleId) : null;
        if (style != null && style.getName() != null) {
            level = headingLevelFromName(style.getName());
            if (level > 0) {
                return level;
            }
        }
        return "title".equalsIgnoreCase(styleId) ? 1 : 0;
    }

    private static int headingLevelFromName(String name) {
        Matcher matcher = HEADING_STYLE.matcher(name);
        if (!matcher.matches()) {
            return 0;
        }
        return Math.min(Integer.parseInt(matcher.group(1)), 6);
    }

    private static boolean isCodeStyle(String style) {
        return style != null && CODE_STYLES.contains(style.toLowerCase(Locale.ROOT));
    }

    private static boolean isNumbered(XWPFParagraph paragraph) {
        String format = paragraph.getNumFmt();
        return format != null && !"bullet".equals(format) && !"none".equals(format);
    }

    private static boolean isMonospace(XWPFRun run) {
        String font = run.getFontFamily();
        return font != null && MONOSPACE_FONTS.contains(font.toLowerCase(Locale.ROOT));
    }

    private String markerForGlyph(String glyph) {
        if (glyph.startsWith("☑")) {
            return options.bulletListMarker + " [x]";
        }
        if (glyph.startsWith("☐")) {
            return options.bulletListMarker + " [ ]";
        }
        return options.bulletListMarker;
    }

    private static String escapeQuotes(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    static String wrapText(String text, int maxLength) {
        if (text.length() <= maxLength) {
            return text;
        }
        StringBuilder result = new StringBuilder();
        StringBuilder line = new StringBuilder();
        for (String word : text.trim().split("\\s+")) {
            if (line.length() > 0 && line.length() + word.length() + 1 > maxLength) {
                result.append(line).append('\n');
                line.setLength(0);
            }
            if (line.length() > 0) {
                line.append(' ');
            }
            line.append(word);
        }
        result.append(line);
        return result.toString();
    }

    /** Run text sharing one set of flags; literal segments are emitted as-is. */
    private static final class Segment {
        private final StringBuilder text;
        private final boolean bold;
        private final boolean italic;
        private final boolean strike;
        private final boolean code;
        private final boolean literal;

        private Segment(String text, boolean bold, boolean italic, boolean strike, boolean code) {
            this(text, bold, italic, strike, code, false);
        }

        private Segment(String text, boolean bold, boolean italic, boolean strike, boolean code, boolean literal) {
            this.text = new StringBuilder(text);
            this.bold = bold;
            this.italic = italic;
            this.strike = strike;
            this.code = code;
            this.literal = literal;
        }

        static Segment literal(String text) {
            return new Segment(text, false, false, false, false, true);
        }

        boolean sameFormat(Segment other) {
            return !literal && !other.literal
                    && bold == other.bold && italic == other.italic
                    && strike == other.strike && code == other.code;
        }

        String render(String marker) {
            String value = text.toString();
            if (literal) {
                return value;
            }
            int start = 0;
            int end = value.length();
            while (start < end && Character.isWhitespace(value.charAt(start))) start++;
            while (end > start && Character.isWhitespace(value.charAt(end - 1))) end--;
            if (start == end) {
                return value;
            }

            String core = value.substring(start, end);
            if (code) {
                core = core.indexOf('`') >= 0 ? "`` " + core + " ``" : "`" + core + "`";
            }
            if (strike) {
                core = "~~" + core + "~~";
            }
            if (bold && italic) {
                core = marker.repeat(3) + core + marker.repeat(3);
            } else if (bold) {
                core = marker.repeat(2) + core + marker.repeat(2);
            } else if (italic) {
                core = marker + core + marker;
            }
            return value.substring(0, start) + core + value.substring(end);
        }
    }
}
