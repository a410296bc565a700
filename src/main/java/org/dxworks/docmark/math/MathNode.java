package org.dxworks.docmark.math;

import java.util.List;

/**
 * Node of a parsed formula. Trees are built per formula by {@link LatexParser}
 * and consumed right away by {@link UnicodeMathRenderer} or {@link OmmlRenderer}.
 *
 * Script bases are a single alphanumeric character, or empty when a script
 * follows something that is not a plain base (e.g. {@code \sum_{i=1}}).
 */
public sealed interface MathNode
        permits MathNode.Run, MathNode.Group, MathNode.Frac, MathNode.Radical,
                MathNode.Superscript, MathNode.Subscript, MathNode.SubSup {

    record Run(String text) implements MathNode {
    }

    record Group(List<MathNode> children) implements MathNode {
        public Group {
            children = List.copyOf(children);
        }

        public boolean isEmpty() {
            return children.isEmpty();
        }
    }

    record Frac(Group numerator, Group denominator) implements MathNode {
    }

    /** {@code degree} is null for a square root (hidden degree). */
    record Radical(Group degree, Group radicand) implements MathNode {
        public boolean hasDegree() {
            return degree != null;
        }
    }

    record Superscript(String base, Group exponent) implements MathNode {
    }

    record Subscript(String base, Group subscript) implements MathNode {
    }

    record SubSup(String base, Group subscript, Group superscript) implements MathNode {
    }
}
