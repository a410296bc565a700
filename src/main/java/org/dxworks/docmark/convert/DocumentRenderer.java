package org.dxworks.docmark.convert;

import org.apache.poi.xwpf.usermodel.ParagraphAlignment;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.commonmark.ext.footnotes.FootnoteDefinition;
import org.commonmark.ext.footnotes.FootnoteReference;
import org.commonmark.ext.front.matter.YamlFrontMatterBlock;
import org.commonmark.ext.front.matter.YamlFrontMatterVisitor;
import org.commonmark.ext.gfm.strikethrough.Strikethrough;
import org.commonmark.ext.gfm.tables.TableBlock;
import org.commonmark.ext.gfm.tables.TableCell;
import org.commonmark.ext.gfm.tables.TableRow;
import org.commonmark.ext.task.list.items.TaskListItemMarker;
import org.commonmark.node.AbstractVisitor;
import org.commonmark.node.Block;
import org.commonmark.node.BlockQuote;
import org.commonmark.node.BulletList;
import org.commonmark.node.Code;
import org.commonmark.node.CustomBlock;
import org.commonmark.node.CustomNode;
import org.commonmark.node.Document;
import org.commonmark.node.Emphasis;
import org.commonmark.node.FencedCodeBlock;
import org.commonmark.node.HardLineBreak;
import org.commonmark.node.Heading;
import org.commonmark.node.HtmlBlock;
import org.commonmark.node.Image;
import org.commonmark.node.IndentedCodeBlock;
import org.commonmark.node.Link;
import org.commonmark.node.ListItem;
import org.commonmark.node.Node;
import org.commonmark.node.OrderedList;
import org.commonmark.node.Paragraph;
import org.commonmark.node.SoftLineBreak;
import org.commonmark.node.SourceSpan;
import org.commonmark.node.StrongEmphasis;
import org.commonmark.node.Text;
import org.commonmark.node.ThematicBreak;
import org.dxworks.docmark.ConversionException;
import org.dxworks.docmark.ErrorCategory;
import org.dxworks.docmark.document.CellAlignment;
import org.dxworks.docmark.document.DocumentModelException;
import org.dxworks.docmark.document.TableConfig;
import org.dxworks.docmark.document.TextFormat;
import org.dxworks.docmark.document.WordDocument;
import org.dxworks.docmark.markdown.InlineMath;
import org.dxworks.docmark.markdown.MathBlock;
import org.dxworks.docmark.math.MathTranspiler;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Walks a commonmark AST and fills a {@link WordDocument}. Block nodes are
 * visited once each; inline content is consumed by the block that owns it.
 * One instance renders one document.
 */
public class DocumentRenderer extends AbstractVisitor {

    static final String CODE_FONT = "Consolas";
    static final String CODE_COLOR = "D73A49";
    static final String LINK_COLOR = "0000FF";
    static final String MATH_FONT = "Cambria Math";
    static final double MATH_BLOCK_FONT_SIZE = 12.0;
    static final String CHECKED_GLYPH = "☑ ";
    static final String UNCHECKED_GLYPH = "☐ ";
    static final String BULLET = "• ";
    static final String LIST_INDENT = "  ";

    private static final int CODE_INDENT = 360;
    private static final int CODE_SPACING = 60;
    private static final int TABLE_WIDTH = 9000;
    private static final int HEADING_MAX_LEVEL = 6;

    private final ConvertOptions options;
    private final WordDocument target;
    private final Map<String, String> footnotes = new HashMap<>();
    private int listDepth;
    private int bookmarkCount;

    public DocumentRenderer(ConvertOptions options, WordDocument target) {
        this.options = options;
        this.target = target;
    }

    public void render(Node document) throws ConversionException {
        target.setDefaultFont(options.defaultFontFamily, options.defaultFontSize);
        collectFootnotes(document);
        applyFrontMatter(document);
        try {
            document.accept(this);
        } catch (RenderAbortedException e) {
            throw e.error;
        }
    }

    @Override
    public void visit(Document document) {
        Node child = document.getFirstChild();
        while (child != null) {
            Node next = child.getNext();
            try {
                child.accept(this);
            } catch (RenderAbortedException e) {
                throw e;
            } catch (RuntimeException e) {
                fail(error(ErrorCategory.DOCUMENT_MODEL, "Render" + child.getClass().getSimpleName(),
                        String.valueOf(e.getMessage()), child, e));
            }
            child = next;
        }
    }

    @Override
    public void visit(Heading heading) {
        int level = Math.min(heading.getLevel(), HEADING_MAX_LEVEL);
        String text = plainText(heading);
        if (options.generateToc && level <= options.tocMaxLevel) {
            target.addHeadingWithBookmark(text, level, "_Toc" + (++bookmarkCount));
        } else {
            target.addHeading(text, level);
        }
    }

    @Override
    public void visit(Paragraph paragraph) {
        XWPFParagraph p = target.addParagraph();
        appendInlines(p, paragraph, TextFormat.PLAIN);
        ensureRun(p);
    }

    @Override
    public void visit(BulletList bulletList) {
        listDepth++;
        visitChildren(bulletList);
        listDepth--;
    }

    @Override
    public void visit(OrderedList orderedList) {
        listDepth++;
        visitChildren(orderedList);
        listDepth--;
    }

    @Override
    public void visit(ListItem listItem) {
        String indent = LIST_INDENT.repeat(Math.max(0, listDepth - 1));
        String marker = BULLET;
        if (listItem.getFirstChild() instanceof TaskListItemMarker taskMarker) {
            marker = checkboxGlyph(taskMarker);
        }

        XWPFParagraph item = target.addParagraph();
        target.addRun(item, indent + marker, TextFormat.PLAIN);

        boolean itemTextUsed = false;
        for (Node child = listItem.getFirstChild(); child != null; child = child.getNext()) {
            if (child instanceof TaskListItemMarker) {
                continue;
            }
            if (child instanceof Paragraph && !itemTextUsed) {
                appendInlines(item, child, TextFormat.PLAIN);
            } else if (child instanceof Paragraph) {
                XWPFParagraph continuation = target.addParagraph();
                target.addRun(continuation, indent + LIST_INDENT, TextFormat.PLAIN);
                appendInlines(continuation, child, TextFormat.PLAIN);
            } else {
                child.accept(this);
            }
            itemTextUsed = true;
        }
    }

    @Override
    public void visit(BlockQuote blockQuote) {
        XWPFParagraph quote = target.addParagraph();
        target.setParagraphStyle(quote, WordDocument.QUOTE_STYLE);
        String[] lines = plainText(blockQuote).split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                target.addLineBreak(quote);
            }
            target.addRun(quote, lines[i], TextFormat.PLAIN);
        }
    }

    @Override
    public void visit(FencedCodeBlock fencedCodeBlock) {
        renderCode(fencedCodeBlock.getLiteral());
    }

    @Override
    public void visit(IndentedCodeBlock indentedCodeBlock) {
        renderCode(indentedCodeBlock.getLiteral());
    }

    @Override
    public void visit(ThematicBreak thematicBreak) {
        target.addHorizontalRule();
    }

    @Override
    public void visit(HtmlBlock htmlBlock) {
        unsupported(htmlBlock);
    }

    @Override
    public void visit(CustomBlock customBlock) {
        if (customBlock instanceof TableBlock tableBlock) {
            renderTable(tableBlock);
        } else if (customBlock instanceof MathBlock mathBlock) {
            renderMathBlock(mathBlock);
        } else if (customBlock instanceof YamlFrontMatterBlock || customBlock instanceof FootnoteDefinition) {
            // consumed before the walk
            return;
        } else {
            unsupported(customBlock);
        }
    }

    @Override
    public void visit(CustomNode customNode) {
        unsupported(customNode);
    }

    private void renderCode(String literal) {
        String code = literal.endsWith("\n") ? literal.substring(0, literal.length() - 1) : literal;
        for (String line : code.split("\n", -1)) {
            XWPFParagraph p = target.addParagraph();
            target.setParagraphStyle(p, WordDocument.CODE_BLOCK_STYLE);
            target.setIndentation(p, CODE_INDENT);
            target.setSpacing(p, CODE_SPACING, CODE_SPACING);
            String text = line.isBlank() ? " " : line;
            target.addRun(p, text, TextFormat.PLAIN.withFontFamily(CODE_FONT));
        }
    }

    private void renderMathBlock(MathBlock mathBlock) {
        XWPFParagraph p = target.addParagraph();
        p.setAlignment(ParagraphAlignment.CENTER);
        if (options.nativeMath) {
            try {
                target.addMath(p, MathTranspiler.toOmml(mathBlock.getLiteral(), true), true);
                ensureRun(p);
                return;
            } catch (DocumentModelException e) {
                fail(error(ErrorCategory.DOCUMENT_MODEL, e.getOperation(), e.getMessage(), mathBlock, e));
            }
        }
        target.addRun(p, MathTranspiler.toUnicode(mathBlock.getLiteral()),
                TextFormat.PLAIN.withFontFamily(MATH_FONT).withFontSize(MATH_BLOCK_FONT_SIZE));
    }

    private void renderTable(TableBlock tableBlock) {
        List<List<String>> cells = new ArrayList<>();
        List<List<Integer>> emphasis = new ArrayList<>();
        List<CellAlignment> alignments = new ArrayList<>();
        collectTableRows(tableBlock, cells, emphasis, alignments);
        if (cells.isEmpty()) {
            return;
        }

        int cols = 0;
        for (List<String> row : cells) {
            cols = Math.max(cols, row.size());
        }
        TableConfig config = new TableConfig(cells.size(), cols, cells);
        config.width = TABLE_WIDTH;

        XWPFTable table;
        try {
            table = target.addTable(config);
        } catch (DocumentModelException e) {
            fail(error(ErrorCategory.DOCUMENT_MODEL, e.getOperation(), e.getMessage(), tableBlock, e));
            return;
        }

        try {
            target.setHeaderRow(table, 0);
            for (int r = 0; r < cells.size(); r++) {
                for (int c = 0; c < cells.get(r).size(); c++) {
                    CellAlignment alignment = c < alignments.size() ? alignments.get(c) : CellAlignment.LEFT;
                    target.setCellAlignment(table, r, c, alignment);
                    int level = emphasis.get(r).get(c);
                    if (level == 2) {
                        target.setCellFormat(table, r, c, TextFormat.PLAIN.withBold(true));
                    } else if (level == 1) {
                        target.setCellFormat(table, r, c, TextFormat.PLAIN.withItalic(true));
                    }
                }
            }
        } catch (DocumentModelException e) {
            fail(error(ErrorCategory.DOCUMENT_MODEL, e.getOperation(), e.getMessage(), tableBlock, e));
        }
    }

    private void collectTableRows(TableBlock tableBlock, List<List<String>> cells,
                                  List<List<Integer>> emphasis, List<CellAlignment> alignments) {
        for (Node section = tableBlock.getFirstChild(); section != null; section = section.getNext()) {
            for (Node row = section.getFirstChild(); row != null; row = row.getNext()) {
                if (!(row instanceof TableRow)) {
                    continue;
                }
                List<String> rowText = new ArrayList<>();
                List<Integer> rowEmphasis = new ArrayList<>();
                for (Node node = row.getFirstChild(); node != null; node = node.getNext()) {
                    if (!(node instanceof TableCell cell)) {
                        continue;
                    }
                    rowText.add(plainText(cell));
                    rowEmphasis.add(cell.isHeader() ? 2 : firstEmphasisLevel(cell));
                    if (cells.isEmpty()) {
                        alignments.add(toCellAlignment(cell.getAlignment()));
                    }
                }
                cells.add(rowText);
                emphasis.add(rowEmphasis);
            }
        }
    }

    /** Level of the first emphasis node in a depth-first walk: 2 strong, 1 emphasis, 0 none. */
    static int firstEmphasisLevel(Node node) {
        for (Node child = node.getFirstChild(); child != null; child = child.getNext()) {
            if (child instanceof StrongEmphasis) {
                return 2;
            }
            if (child instanceof Emphasis) {
                return 1;
            }
            int nested = firstEmphasisLevel(child);
            if (nested > 0) {
                return nested;
            }
        }
        return 0;
    }

    private static CellAlignment toCellAlignment(TableCell.Alignment alignment) {
        if (alignment == null) {
            return CellAlignment.LEFT;
        }
        switch (alignment) {
            case CENTER:
                return CellAlignment.CENTER;
            case RIGHT:
                return CellAlignment.RIGHT;
            default:
                return CellAlignment.LEFT;
        }
    }

    private void appendInlines(XWPFParagraph paragraph, Node parent, TextFormat format) {
        for (Node child = parent.getFirstChild(); child != null; child = child.getNext()) {
            appendInline(paragraph, child, format);
        }
    }

    private void appendInline(XWPFParagraph paragraph, Node node, TextFormat format) {
        if (node instanceof Text text) {
            target.addRun(paragraph, text.getLiteral(), format);
        } else if (node instanceof StrongEmphasis) {
            appendInlines(paragraph, node, format.withBold(true));
        } else if (node instanceof Emphasis) {
            appendInlines(paragraph, node, format.withItalic(true));
        } else if (node instanceof Strikethrough) {
            appendInlines(paragraph, node, format.withStrike(true));
        } else if (node instanceof Code code) {
            target.addRun(paragraph, code.getLiteral(),
                    format.withFontFamily(CODE_FONT).withColor(CODE_COLOR));
        } else if (node instanceof Link) {
            appendInlines(paragraph, node, format.withColor(LINK_COLOR));
        } else if (node instanceof Image image) {
            appendImage(paragraph, image, format);
        } else if (node instanceof SoftLineBreak) {
            target.addRun(paragraph, " ", format);
        } else if (node instanceof HardLineBreak) {
            target.addLineBreak(paragraph);
        } else if (node instanceof InlineMath math) {
            appendInlineMath(paragraph, math, format);
        } else if (node instanceof FootnoteReference reference) {
            appendFootnoteReference(paragraph, reference, format);
        } else if (node instanceof TaskListItemMarker taskMarker) {
            target.addRun(paragraph, checkboxGlyph(taskMarker), format);
        } else {
            unsupported(node);
        }
    }

    private void appendInlineMath(XWPFParagraph paragraph, InlineMath math, TextFormat format) {
        if (options.nativeMath) {
            try {
                target.addMath(paragraph, MathTranspiler.toOmml(math.getLiteral(), false), false);
                return;
            } catch (DocumentModelException e) {
                fail(error(ErrorCategory.DOCUMENT_MODEL, e.getOperation(), e.getMessage(), math, e));
            }
        }
        target.addRun(paragraph, MathTranspiler.toUnicode(math.getLiteral()), format.withFontFamily(MATH_FONT));
    }

    private void appendFootnoteReference(XWPFParagraph paragraph, FootnoteReference reference, TextFormat format) {
        String text = footnotes.get(reference.getLabel());
        if (text == null) {
            target.addRun(paragraph, "[^" + reference.getLabel() + "]", format);
            return;
        }
        target.addFootnote(paragraph, text);
    }

    private void appendImage(XWPFParagraph paragraph, Image image, TextFormat format) {
        String alt = plainText(image);
        Path resolved = resolveImagePath(image.getDestination());

        if (options.embedImages && resolved != null) {
            if (Files.isRegularFile(resolved)) {
                try {
                    target.addPicture(paragraph, resolved, options.maxImageWidth);
                    return;
                } catch (DocumentModelException e) {
                    fail(error(ErrorCategory.DOCUMENT_MODEL, e.getOperation(), e.getMessage(), image, e));
                }
            } else {
                fail(error(ErrorCategory.IO, "ImageRead", "image not found: " + resolved, image, null));
            }
        }

        String label = alt.isEmpty() ? (resolved != null ? resolved.toString() : image.getDestination()) : alt;
        target.addRun(paragraph, "[Image: " + label + "]", format);
    }

    private Path resolveImagePath(String destination) {
        if (destination == null || destination.isEmpty() || destination.contains("://")) {
            return null;
        }
        try {
            Path path = Paths.get(destination);
            if (!path.isAbsolute() && options.imageBasePath != null) {
                return Paths.get(options.imageBasePath).resolve(path);
            }
            return path;
        } catch (RuntimeException e) {
            return null;
        }
    }

    /** Paragraphs whose inlines produced no run (native math only, skipped nodes) get an empty one. */
    private void ensureRun(XWPFParagraph paragraph) {
        if (paragraph.getRuns().isEmpty()) {
            target.addRun(paragraph, "", TextFormat.PLAIN);
        }
    }

    private static String checkboxGlyph(TaskListItemMarker marker) {
        return marker.isChecked() ? CHECKED_GLYPH : UNCHECKED_GLYPH;
    }

    private void collectFootnotes(Node document) {
        if (!options.enableFootnotes) {
            return;
        }
        for (Node child = document.getFirstChild(); child != null; child = child.getNext()) {
            if (child instanceof FootnoteDefinition definition) {
                footnotes.put(definition.getLabel(), plainText(definition));
            }
        }
    }

    private void applyFrontMatter(Node document) {
        YamlFrontMatterVisitor visitor = new YamlFrontMatterVisitor();
        document.accept(visitor);
        Map<String, List<String>> data = visitor.getData();
        if (data.isEmpty()) {
            return;
        }
        target.setCoreProperties(
                first(data, "title"),
                first(data, "author"),
                first(data, "subject"),
                data.containsKey("keywords") ? String.join(", ", data.get("keywords")) : null,
                first(data, "description"));
    }

    private static String first(Map<String, List<String>> data, String key) {
        List<String> values = data.get(key);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    /** Text content of a subtree; blocks are separated by newlines, formulas are rendered as Unicode. */
    static String plainText(Node node) {
        StringBuilder out = new StringBuilder();
        appendPlainText(node, out);
        return out.toString().strip();
    }

    private static void appendPlainText(Node node, StringBuilder out) {
        for (Node child = node.getFirstChild(); child != null; child = child.getNext()) {
            if (child instanceof Text text) {
                out.append(text.getLiteral());
            } else if (child instanceof Code code) {
                out.append(code.getLiteral());
            } else if (child instanceof InlineMath math) {
                out.append(MathTranspiler.toUnicode(math.getLiteral()));
            } else if (child instanceof MathBlock mathBlock) {
                out.append(MathTranspiler.toUnicode(mathBlock.getLiteral()));
            } else if (child instanceof SoftLineBreak) {
                out.append(' ');
            } else if (child instanceof HardLineBreak) {
                out.append('\n');
            } else if (child instanceof FencedCodeBlock fenced) {
                out.append(fenced.getLiteral().stripTrailing());
            } else if (child instanceof IndentedCodeBlock indented) {
                out.append(indented.getLiteral().stripTrailing());
            } else {
                appendPlainText(child, out);
            }
            if (child.getNext() != null && isBlock(child)) {
                out.append('\n');
            }
        }
    }

    private static boolean isBlock(Node node) {
        return node instanceof Block;
    }

    private void unsupported(Node node) {
        ConversionException error = error(ErrorCategory.UNSUPPORTED_NODE, "Render",
                "unsupported node " + node.getClass().getSimpleName(), node, null);
        if (options.strictMode) {
            fail(error);
            return;
        }
        options.logger.debug("Skipping {}", error.getMessage());
        options.report(error);
    }

    private void fail(ConversionException error) {
        options.logger.warn("{}", error.getMessage());
        options.report(error);
        if (!options.ignoreErrors) {
            throw new RenderAbortedException(error);
        }
    }

    private static ConversionException error(ErrorCategory category, String operation, String message,
                                             Node node, Throwable cause) {
        for (Node current = node; current != null; current = current.getParent()) {
            List<SourceSpan> spans = current.getSourceSpans();
            if (!spans.isEmpty()) {
                SourceSpan span = spans.get(0);
                return new ConversionException(category, operation, message,
                        span.getLineIndex() + 1, span.getColumnIndex() + 1, cause);
            }
        }
        return new ConversionException(category, operation, message, cause);
    }

    private static final class RenderAbortedException extends RuntimeException {
        private final ConversionException error;

        private RenderAbortedException(ConversionException error) {
            super(error.getMessage(), error);
            this.error = error;
        }
    }
}
