package org.dxworks.docmark.markdown;

import org.commonmark.node.CustomNode;

/**
 * Formula inside a paragraph, {@code $x$} or {@code $$x$$}.
 */
public class InlineMath extends CustomNode {

    private final String literal;
    private final boolean display;

    public InlineMath(String literal, boolean display) {
        this.literal = literal;
        this.display = display;
    }

    public String getLiteral() {
        return literal;
    }

    /** True when written with double dollars. */
    public boolean isDisplay() {
        return display;
    }
}
