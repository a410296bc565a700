package org.dxworks.docmark.math;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class OmmlRendererTest {

    @Test
    void render_Fraction_MirrorsTree() {
        MathMarkup root = MathTranspiler.toMarkup("\\frac{1}{2}", false);

        assertEquals("oMath", root.getName());
        MathMarkup fraction = root.child("f");
        assertNotNull(fraction);
        assertEquals("1", fraction.child("num").child("r").child("t").getText());
        assertEquals("2", fraction.child("den").child("r").child("t").getText());
    }

    @Test
    void render_SquareRoot_HidesDegree() {
        MathMarkup radical = MathTranspiler.toMarkup("\\sqrt{x}", false).child("rad");

        assertEquals("1", radical.child("radPr").child("degHide").getAttributes().get("val"));
        assertTrue(radical.child("deg").getChildren().isEmpty());
        assertEquals("x", radical.child("e").child("r").child("t").getText());
    }

    @Test
    void render_SubSup() {
        MathMarkup subSup = MathTranspiler.toMarkup("x_i^2", false).child("sSubSup");

        assertEquals("x", subSup.child("e").child("r").child("t").getText());
        assertEquals("i", subSup.child("sub").child("r").child("t").getText());
        assertEquals("2", subSup.child("sup").child("r").child("t").getText());
    }

    @Test
    void render_Block_WrapsInMathParagraph() {
        MathMarkup root = MathTranspiler.toMarkup("a", true);

        assertEquals("oMathPara", root.getName());
        assertNotNull(root.child("oMath"));
    }

    @Test
    void toOmml_Serializes() {
        String xml = MathTranspiler.toOmml("\\sqrt{x^2}", false);

        assertTrue(xml.startsWith("<m:oMath"));
        assertTrue(xml.contains("xmlns:m=\"" + MathMarkup.NAMESPACE + "\""));
        assertTrue(xml.contains("<m:sSup>"));
        assertTrue(xml.contains("m:val=\"1\""));
        assertTrue(xml.contains("xml:space=\"preserve\""));
    }

    @Test
    void toOmml_EscapesText() {
        assertTrue(MathTranspiler.toOmml("a<b", false).contains("a&lt;b"));
    }
}
