package org.dxworks.docmark.math;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class LatexParserTest {

    private static MathNode.Group group(MathNode... nodes) {
        return new MathNode.Group(List.of(nodes));
    }

    private static MathNode.Run run(String text) {
        return new MathNode.Run(text);
    }

    @Test
    void parse_Superscript() {
        assertEquals(group(new MathNode.Superscript("x", group(run("2")))), LatexParser.parse("x^2"));
    }

    @Test
    void parse_Fraction_WithNestedBraces() {
        MathNode.Group parsed = LatexParser.parse("\\frac{x^{2}}{a+b}");

        MathNode.Frac frac = assertInstanceOf(MathNode.Frac.class, parsed.children().get(0));
        assertEquals(group(new MathNode.Superscript("x", group(run("2")))), frac.numerator());
        assertEquals(group(run("a+b")), frac.denominator());
    }

    @Test
    void parse_SquareRoot_HidesDegree() {
        MathNode.Radical radical = assertInstanceOf(MathNode.Radical.class, LatexParser.parse("\\sqrt{x}").children().get(0));

        assertFalse(radical.hasDegree());
        assertEquals(group(run("x")), radical.radicand());
    }

    @Test
    void parse_RadicalWithDegree() {
        MathNode.Radical radical = assertInstanceOf(MathNode.Radical.class, LatexParser.parse("\\sqrt[3]{8}").children().get(0));

        assertTrue(radical.hasDegree());
        assertEquals(group(run("3")), radical.degree());
        assertEquals(group(run("8")), radical.radicand());
    }

    @Test
    void parse_SubSup_InEitherOrder() {
        MathNode expected = new MathNode.SubSup("x", group(run("i")), group(run("2")));

        assertEquals(group(expected), LatexParser.parse("x_{i}^{2}"));
        assertEquals(group(expected), LatexParser.parse("x^2_i"));
    }

    @Test
    void parse_ScriptAfterCommand_HasEmptyBase() {
        MathNode.Group parsed = LatexParser.parse("\\sum_{i=1}^n");

        assertEquals(run("∑"), parsed.children().get(0));
        assertEquals(new MathNode.SubSup("", group(run("i=1")), group(run("n"))), parsed.children().get(1));
    }

    @Test
    void parse_CommandIsMatchedWhole() {
        assertEquals(group(run("∞")), LatexParser.parse("\\infty"));
        assertEquals(group(run("∈")), LatexParser.parse("\\in"));
    }

    @Test
    void parse_BraceGroupIsSpliced() {
        assertEquals(group(run("ab")), LatexParser.parse("{ab}"));
    }

    @Test
    void parse_BlankInput() {
        assertTrue(LatexParser.parse("   ").isEmpty());
        assertTrue(LatexParser.parse(null).isEmpty());
    }

    @Test
    void parse_UnbalancedInput_DegradesToText() {
        assertEquals("\\frac1{", UnicodeMathRenderer.render(LatexParser.parse("\\frac{1}{")));
        assertEquals("x^", UnicodeMathRenderer.render(LatexParser.parse("x^")));
    }
}
