package org.dxworks.docmark.math;

/**
 * Renders a formula tree as OMML, the equation markup Word stores natively.
 * The element tree mirrors the formula tree: {@code m:f} holds
 * {@code m:num}/{@code m:den}, {@code m:rad} holds {@code m:deg}/{@code m:e},
 * scripts hold {@code m:e} plus {@code m:sub}/{@code m:sup}.
 */
public final class OmmlRenderer {

    private OmmlRenderer() {}

    /** Wraps the formula in {@code m:oMath}, or {@code m:oMathPara/m:oMath} for display math. */
    public static MathMarkup render(MathNode.Group formula, boolean block) {
        MathMarkup oMath = new MathMarkup("oMath");
        appendChildren(formula, oMath);
        if (!block) {
            return oMath;
        }
        return new MathMarkup("oMathPara").add(oMath);
    }

    private static void appendChildren(MathNode.Group group, MathMarkup parent) {
        for (MathNode child : group.children()) {
            append(child, parent);
        }
    }

    private static void append(MathNode node, MathMarkup parent) {
        if (node instanceof MathNode.Run run) {
            appendRun(run.text(), parent);
        } else if (node instanceof MathNode.Group group) {
            appendChildren(group, parent);
        } else if (node instanceof MathNode.Frac frac) {
            parent.add(new MathMarkup("f")
                    .add(container("num", frac.numerator()))
                    .add(container("den", frac.denominator())));
        } else if (node instanceof MathNode.Radical radical) {
            MathMarkup rad = new MathMarkup("rad");
            if (radical.hasDegree()) {
                rad.add(container("deg", radical.degree()));
            } else {
                rad.add(new MathMarkup("radPr").add(new MathMarkup("degHide").attribute("val", "1")));
                rad.add(new MathMarkup("deg"));
            }
            rad.add(container("e", radical.radicand()));
            parent.add(rad);
        } else if (node instanceof MathNode.Superscript sup) {
            parent.add(new MathMarkup("sSup")
                    .add(base(sup.base()))
                    .add(container("sup", sup.exponent())));
        } else if (node instanceof MathNode.Subscript sub) {
            parent.add(new MathMarkup("sSub")
                    .add(base(sub.base()))
                    .add(container("sub", sub.subscript())));
        } else if (node instanceof MathNode.SubSup subSup) {
            parent.add(new MathMarkup("sSubSup")
                    .add(base(subSup.base()))
                    .add(container("sub", subSup.subscript()))
                    .add(container("sup", subSup.superscript())));
        }
    }

    private static MathMarkup container(String name, MathNode.Group content) {
        MathMarkup element = new MathMarkup(name);
        appendChildren(content, element);
        return element;
    }

    private static MathMarkup base(String text) {
        MathMarkup e = new MathMarkup("e");
        appendRun(text, e);
        return e;
    }

    private static void appendRun(String text, MathMarkup parent) {
        if (text == null || text.isEmpty()) {
            return;
        }
        parent.add(new MathMarkup("r")
                .add(new MathMarkup("t").attribute("xml:space", "preserve").text(text)));
    }
}
