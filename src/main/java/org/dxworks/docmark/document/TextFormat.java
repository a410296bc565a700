package org.dxworks.docmark.document;

/**
 * Run formatting. Instances are immutable; the {@code with*} methods return
 * modified copies so a parent format can be shared by nested inline nodes.
 */
public final class TextFormat {

    public static final TextFormat PLAIN = new TextFormat(false, false, false, null, null, null);

    private final boolean bold;
    private final boolean italic;
    private final boolean strike;
    private final String fontFamily;
    private final String color;
    private final Double fontSize;

    private TextFormat(boolean bold, boolean italic, boolean strike, String fontFamily, String color, Double fontSize) {
        this.bold = bold;
        this.italic = italic;
        this.strike = strike;
        this.fontFamily = fontFamily;
        this.color = color;
        this.fontSize = fontSize;
    }

    public TextFormat withBold(boolean value) {
        return new TextFormat(value, italic, strike, fontFamily, color, fontSize);
    }

    public TextFormat withItalic(boolean value) {
        return new TextFormat(bold, value, strike, fontFamily, color, fontSize);
    }

    public TextFormat withStrike(boolean value) {
        return new TextFormat(bold, italic, value, fontFamily, color, fontSize);
    }

    public TextFormat withFontFamily(String value) {
        return new TextFormat(bold, italic, strike, value, color, fontSize);
    }

    public TextFormat withColor(String value) {
        return new TextFormat(bold, italic, strike, fontFamily, value, fontSize);
    }

    public TextFormat withFontSize(Double value) {
        return new TextFormat(bold, italic, strike, fontFamily, color, value);
    }

    public boolean isBold() {
        return bold;
    }

    public boolean isItalic() {
        return italic;
    }

    public boolean isStrike() {
        return strike;
    }

    public String getFontFamily() {
        return fontFamily;
    }

    public String getColor() {
        return color;
    }

    public Double getFontSize() {
        return fontSize;
    }
}
