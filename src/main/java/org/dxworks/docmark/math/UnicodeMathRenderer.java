package org.dxworks.docmark.math;

import java.util.Map;

/**
 * Renders a formula tree as a plain-text Unicode approximation, e.g.
 * {@code \frac{1}{2}} as {@code (1)/(2)} and {@code x^2} as {@code x²}.
 */
public final class UnicodeMathRenderer {

    private static final Map<Character, Character> SUPERSCRIPTS = Map.ofEntries(
            Map.entry('0', '⁰'), Map.entry('1', '¹'), Map.entry('2', '²'), Map.entry('3', '³'),
            Map.entry('4', '⁴'), Map.entry('5', '⁵'), Map.entry('6', '⁶'), Map.entry('7', '⁷'),
            Map.entry('8', '⁸'), Map.entry('9', '⁹'),
            Map.entry('+', '⁺'), Map.entry('-', '⁻'), Map.entry('=', '⁼'), Map.entry('(', '⁽'), Map.entry(')', '⁾'),
            Map.entry('a', 'ᵃ'), Map.entry('b', 'ᵇ'), Map.entry('c', 'ᶜ'), Map.entry('d', 'ᵈ'), Map.entry('e', 'ᵉ'),
            Map.entry('f', 'ᶠ'), Map.entry('g', 'ᵍ'), Map.entry('h', 'ʰ'), Map.entry('i', 'ⁱ'), Map.entry('j', 'ʲ'),
            Map.entry('k', 'ᵏ'), Map.entry('l', 'ˡ'), Map.entry('m', 'ᵐ'), Map.entry('n', 'ⁿ'), Map.entry('o', 'ᵒ'),
            Map.entry('p', 'ᵖ'), Map.entry('r', 'ʳ'), Map.entry('s', 'ˢ'), Map.entry('t', 'ᵗ'), Map.entry('u', 'ᵘ'),
            Map.entry('v', 'ᵛ'), Map.entry('w', 'ʷ'), Map.entry('x', 'ˣ'), Map.entry('y', 'ʸ'), Map.entry('z', 'ᶻ'));

    private static final Map<Character, Character> SUBSCRIPTS = Map.ofEntries(
            Map.entry('0', '₀'), Map.entry('1', '₁'), Map.entry('2', '₂'), Map.entry('3', '₃'),
            Map.entry('4', '₄'), Map.entry('5', '₅'), Map.entry('6', '₆'), Map.entry('7', '₇'),
            Map.entry('8', '₈'), Map.entry('9', '₉'),
            Map.entry('+', '₊'), Map.entry('-', '₋'), Map.entry('=', '₌'), Map.entry('(', '₍'), Map.entry(')', '₎'),
            Map.entry('a', 'ₐ'), Map.entry('e', 'ₑ'), Map.entry('h', 'ₕ'), Map.entry('i', 'ᵢ'), Map.entry('j', 'ⱼ'),
            Map.entry('k', 'ₖ'), Map.entry('l', 'ₗ'), Map.entry('m', 'ₘ'), Map.entry('n', 'ₙ'), Map.entry('o', 'ₒ'),
            Map.entry('p', 'ₚ'), Map.entry('r', 'ᵣ'), Map.entry('s', 'ₛ'), Map.entry('t', 'ₜ'), Map.entry('u', 'ᵤ'),
            Map.entry('v', 'ᵥ'), Map.entry('x', 'ₓ'));

    private UnicodeMathRenderer() {}

    public static String render(MathNode node) {
        StringBuilder out = new StringBuilder();
        append(node, out);
        return out.toString();
    }

    private static void append(MathNode node, StringBuilder out) {
        if (node instanceof MathNode.Run run) {
            out.append(run.text());
        } else if (node instanceof MathNode.Group group) {
            for (MathNode child : group.children()) {
                append(child, out);
            }
        } else if (node instanceof MathNode.Frac frac) {
            out.append('(').append(render(frac.numerator())).append(")/(")
                    .append(render(frac.denominator())).append(')');
        } else if (node instanceof MathNode.Radical radical) {
            if (radical.hasDegree()) {
                out.append(toSuperscript(render(radical.degree())));
            }
            out.append("√(").append(render(radical.radicand())).append(')');
        } else if (node instanceof MathNode.Superscript sup) {
            out.append(sup.base()).append(toSuperscript(render(sup.exponent())));
        } else if (node instanceof MathNode.Subscript sub) {
            out.append(sub.base()).append(toSubscript(render(sub.subscript())));
        } else if (node instanceof MathNode.SubSup subSup) {
            out.append(subSup.base())
                    .append(toSubscript(render(subSup.subscript())))
                    .append(toSuperscript(render(subSup.superscript())));
        }
    }

    static String toSuperscript(String text) {
        return mapCharacters(text, SUPERSCRIPTS);
    }

    static String toSubscript(String text) {
        return mapCharacters(text, SUBSCRIPTS);
    }

    private static String mapCharacters(String text, Map<Character, Character> mapping) {
        StringBuilder out = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            out.append(mapping.getOrDefault(c, c));
        }
        return out.toString();
    }
}
