package org.dxworks.docmark.document;

import org.apache.poi.ooxml.POIXMLProperties;
import org.apache.poi.openxml4j.exceptions.InvalidFormatException;
import org.apache.poi.util.Units;
import org.apache.poi.xwpf.usermodel.Borders;
import org.apache.poi.xwpf.usermodel.Document;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFFootnote;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFStyle;
import org.apache.poi.xwpf.usermodel.XWPFStyles;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;
import org.apache.xmlbeans.XmlException;
import org.openxmlformats.schemas.officeDocument.x2006.math.CTOMath;
import org.openxmlformats.schemas.officeDocument.x2006.math.CTOMathPara;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTBookmark;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTMarkupRange;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTStyle;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STStyleType;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * The small set of mutations the converter performs on a Word document.
 * Wraps an {@link XWPFDocument}; the wrapped instance stays owned by the
 * caller and may be used directly after conversion.
 */
public class WordDocument implements Closeable {

    public static final String HEADING_STYLE_PREFIX = "Heading";
    public static final String QUOTE_STYLE = "Quote";
    public static final String CODE_BLOCK_STYLE = "CodeBlock";

    private static final double PIXELS_PER_INCH = 96.0;
    private static final double POINTS_PER_INCH = 72.0;

    private final XWPFDocument document;
    private String defaultFontFamily;
    private Double defaultFontSize;
    private int nextBookmarkId;

    public WordDocument() {
        this(new XWPFDocument());
    }

    public WordDocument(XWPFDocument document) {
        this.document = document;
    }

    public XWPFDocument getDocument() {
        return document;
    }

    /** Font applied to runs whose format does not name one. */
    public void setDefaultFont(String fontFamily, Double fontSize) {
        this.defaultFontFamily = fontFamily;
        this.defaultFontSize = fontSize;
    }

    public XWPFParagraph addParagraph() {
        return document.createParagraph();
    }

    public XWPFParagraph addHeading(String text, int level) {
        int clamped = Math.max(1, Math.min(level, 6));
        XWPFParagraph paragraph = document.createParagraph();
        setParagraphStyle(paragraph, HEADING_STYLE_PREFIX + clamped);
        addRun(paragraph, text, TextFormat.PLAIN);
        return paragraph;
    }

    /** Heading whose text is wrapped in a bookmark, for table-of-contents links. */
    public XWPFParagraph addHeadingWithBookmark(String text, int level, String bookmarkName) {
        int clamped = Math.max(1, Math.min(level, 6));
        XWPFParagraph paragraph = document.createParagraph();
        setParagraphStyle(paragraph, HEADING_STYLE_PREFIX + clamped);

        BigInteger id = BigInteger.valueOf(nextBookmarkId++);
        CTBookmark start = paragraph.getCTP().addNewBookmarkStart();
        start.setId(id);
        start.setName(bookmarkName);
        addRun(paragraph, text, TextFormat.PLAIN);
        CTMarkupRange end = paragraph.getCTP().addNewBookmarkEnd();
        end.setId(id);
        return paragraph;
    }

    public XWPFRun addRun(XWPFParagraph paragraph, String text, TextFormat format) {
        XWPFRun run = paragraph.createRun();
        run.setText(text);
        applyFormat(run, format);
        return run;
    }

    public void addLineBreak(XWPFParagraph paragraph) {
        paragraph.createRun().addBreak();
    }

    public void setParagraphStyle(XWPFParagraph paragraph, String styleId) {
        ensureParagraphStyle(styleId);
        paragraph.setStyle(styleId);
    }

    public XWPFParagraph addHorizontalRule() {
        XWPFParagraph paragraph = document.createParagraph();
        paragraph.setBorderBottom(Borders.SINGLE);
        setSpacing(paragraph, 120, 120);
        addRun(paragraph, "", TextFormat.PLAIN);
        return paragraph;
    }

    /** Spacing in twentieths of a point. */
    public void setSpacing(XWPFParagraph paragraph, int before, int after) {
        paragraph.setSpacingBefore(before);
        paragraph.setSpacingAfter(after);
    }

    public void setIndentation(XWPFParagraph paragraph, int left) {
        paragraph.setIndentationLeft(left);
    }

    public XWPFTable addTable(TableConfig config) throws DocumentModelException {
        if (config.rows <= 0 || config.cols <= 0) {
            throw new DocumentModelException("AddTable",
                    "invalid table size " + config.rows + "x" + config.cols);
        }

        XWPFTable table = document.createTable(config.rows, config.cols);
        table.setWidth(config.width);
        // every cell gets a run, empty or not, so cell formatting always has a target
        for (int r = 0; r < config.rows; r++) {
            List<String> rowData = r < config.data.size() ? config.data.get(r) : List.of();
            XWPFTableRow row = table.getRow(r);
            for (int c = 0; c < config.cols; c++) {
                String value = c < rowData.size() ? rowData.get(c) : null;
                addRun(cellParagraph(row.getCell(c)), value == null ? "" : value, TextFormat.PLAIN);
            }
        }
        return table;
    }

    public void setHeaderRow(XWPFTable table, int rowIndex) throws DocumentModelException {
        XWPFTableRow row = table.getRow(rowIndex);
        if (row == null) {
            throw new DocumentModelException("CellFormat", "no row " + rowIndex);
        }
        row.setRepeatHeader(true);
    }

    public void setCellAlignment(XWPFTable table, int rowIndex, int colIndex, CellAlignment alignment)
            throws DocumentModelException {
        XWPFTableCell cell = cell(table, rowIndex, colIndex);
        for (XWPFParagraph paragraph : cell.getParagraphs()) {
            paragraph.setAlignment(alignment.getParagraphAlignment());
        }
    }

    public void setCellFormat(XWPFTable table, int rowIndex, int colIndex, TextFormat format)
            throws DocumentModelException {
        XWPFTableCell cell = cell(table, rowIndex, colIndex);
        for (XWPFParagraph paragraph : cell.getParagraphs()) {
            for (XWPFRun run : paragraph.getRuns()) {
                applyFormat(run, format);
            }
        }
    }

    /** Adds a native footnote holding {@code text} and references it at the end of the paragraph. */
    public XWPFFootnote addFootnote(XWPFParagraph paragraph, String text) {
        XWPFFootnote footnote = document.createFootnote();
        XWPFParagraph footnoteParagraph = footnote.createParagraph();
        addRun(footnoteParagraph, text, TextFormat.PLAIN);
        paragraph.addFootnoteReference(footnote);
        return footnote;
    }

    /** Embeds a PNG, JPEG, GIF or BMP picture, scaled down to {@code maxWidthInches}. */
    public XWPFRun addPicture(XWPFParagraph paragraph, Path imageFile, double maxWidthInches)
            throws DocumentModelException {
        int pictureType = pictureType(imageFile);
        if (pictureType < 0) {
            throw new DocumentModelException("AddPicture", "unsupported picture format: " + imageFile.getFileName());
        }

        try {
            BufferedImage image = ImageIO.read(imageFile.toFile());
            if (image == null) {
                throw new DocumentModelException("AddPicture", "unreadable picture: " + imageFile.getFileName());
            }
            double widthPt = image.getWidth() * POINTS_PER_INCH / PIXELS_PER_INCH;
            double heightPt = image.getHeight() * POINTS_PER_INCH / PIXELS_PER_INCH;
            double maxWidthPt = maxWidthInches * POINTS_PER_INCH;
            if (maxWidthPt > 0 && widthPt > maxWidthPt) {
                heightPt = heightPt * maxWidthPt / widthPt;
                widthPt = maxWidthPt;
            }

            XWPFRun run = paragraph.createRun();
            try (InputStream in = Files.newInputStream(imageFile)) {
                run.addPicture(in, pictureType, imageFile.getFileName().toString(),
                        Units.toEMU(widthPt), Units.toEMU(heightPt));
            }
            return run;
        } catch (IOException | InvalidFormatException e) {
            throw new DocumentModelException("AddPicture", "failed to embed " + imageFile.getFileName(), e);
        }
    }

    /** Appends OMML produced by the math transpiler as a native equation. */
    public void addMath(XWPFParagraph paragraph, String omml, boolean block) throws DocumentModelException {
        try {
            if (block) {
                paragraph.getCTP().addNewOMathPara().set(CTOMathPara.Factory.parse(omml));
            } else {
                paragraph.getCTP().addNewOMath().set(CTOMath.Factory.parse(omml));
            }
        } catch (XmlException e) {
            throw new DocumentModelException("AddMath", "invalid equation markup", e);
        }
    }

    public void setCoreProperties(String title, String author, String subject, String keywords, String description) {
        POIXMLProperties.CoreProperties core = document.getProperties().getCoreProperties();
        if (title != null) core.setTitle(title);
        if (author != null) core.setCreator(author);
        if (subject != null) core.setSubjectProperty(subject);
        if (keywords != null) core.setKeywords(keywords);
        if (description != null) core.setDescription(description);
    }

    public void write(OutputStream out) throws IOException {
        document.write(out);
    }

    public byte[] toBytes() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        document.write(out);
        return out.toByteArray();
    }

    @Override
    public void close() throws IOException {
        document.close();
    }

    private void applyFormat(XWPFRun run, TextFormat format) {
        if (format.isBold()) run.setBold(true);
        if (format.isItalic()) run.setItalic(true);
        if (format.isStrike()) run.setStrikeThrough(true);

        String fontFamily = format.getFontFamily() != null ? format.getFontFamily() : defaultFontFamily;
        if (fontFamily != null) run.setFontFamily(fontFamily);
        Double fontSize = format.getFontSize() != null ? format.getFontSize() : defaultFontSize;
        if (fontSize != null) run.setFontSize(fontSize);
        if (format.getColor() != null) run.setColor(format.getColor());
    }

    private void ensureParagraphStyle(String styleId) {
        XWPFStyles styles = document.createStyles();
        if (styles.styleExist(styleId)) {
            return;
        }

        CTStyle ctStyle = CTStyle.Factory.newInstance();
        ctStyle.setStyleId(styleId);
        ctStyle.setType(STStyleType.PARAGRAPH);
        ctStyle.addNewQFormat();
        if (styleId.startsWith(HEADING_STYLE_PREFIX)) {
            int level = Integer.parseInt(styleId.substring(HEADING_STYLE_PREFIX.length()));
            ctStyle.addNewName().setVal("heading " + level);
            ctStyle.addNewPPr().addNewOutlineLvl().setVal(BigInteger.valueOf(level - 1L));
            ctStyle.addNewRPr().addNewB();
        } else {
            ctStyle.addNewName().setVal(styleId);
        }
        styles.addStyle(new XWPFStyle(ctStyle, styles));
    }

    private static XWPFParagraph cellParagraph(XWPFTableCell cell) {
        return cell.getParagraphs().isEmpty() ? cell.addParagraph() : cell.getParagraphs().get(0);
    }

    private static XWPFTableCell cell(XWPFTable table, int rowIndex, int colIndex) throws DocumentModelException {
        XWPFTableRow row = table.getRow(rowIndex);
        XWPFTableCell cell = row != null ? row.getCell(colIndex) : null;
        if (cell == null) {
            throw new DocumentModelException("CellFormat", "no cell at row " + rowIndex + ", column " + colIndex);
        }
        return cell;
    }

    private static int pictureType(Path imageFile) {
        String name = imageFile.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".png")) return Document.PICTURE_TYPE_PNG;
        if (name.endsWith(".jpg") || name.endsWith(".jpeg")) return Document.PICTURE_TYPE_JPEG;
        if (name.endsWith(".gif")) return Document.PICTURE_TYPE_GIF;
        if (name.endsWith(".bmp")) return Document.PICTURE_TYPE_BMP;
        return -1;
    }
}
