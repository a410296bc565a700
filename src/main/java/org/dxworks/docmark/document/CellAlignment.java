package org.dxworks.docmark.document;

import org.apache.poi.xwpf.usermodel.ParagraphAlignment;

public enum CellAlignment {
    LEFT(ParagraphAlignment.LEFT),
    CENTER(ParagraphAlignment.CENTER),
    RIGHT(ParagraphAlignment.RIGHT);

    private final ParagraphAlignment paragraphAlignment;

    CellAlignment(ParagraphAlignment paragraphAlignment) {
        this.paragraphAlignment = paragraphAlignment;
    }

    public ParagraphAlignment getParagraphAlignment() {
        return paragraphAlignment;
    }
}
