package org.dxworks.docmark.markdown;

import org.commonmark.node.CustomBlock;

/**
 * Display formula written between {@code $$} lines.
 */
public class MathBlock extends CustomBlock {

    private String literal;

    public String getLiteral() {
        return literal;
    }

    public void setLiteral(String literal) {
        this.literal = literal;
    }
}
