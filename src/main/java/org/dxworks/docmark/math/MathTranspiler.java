package org.dxworks.docmark.math;

/**
 * Entry point for formula conversion. Every call parses once and renders the
 * resulting tree; nothing here throws for malformed input.
 */
public final class MathTranspiler {

    private MathTranspiler() {}

    public static MathNode.Group parse(String latex) {
        return LatexParser.parse(latex);
    }

    public static String toUnicode(String latex) {
        return UnicodeMathRenderer.render(parse(latex));
    }

    public static MathMarkup toMarkup(String latex, boolean block) {
        return OmmlRenderer.render(parse(latex), block);
    }

    public static String toOmml(String latex, boolean block) {
        return toMarkup(latex, block).toXml();
    }
}
