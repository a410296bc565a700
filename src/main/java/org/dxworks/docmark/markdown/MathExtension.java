package org.dxworks.docmark.markdown;

import org.commonmark.Extension;
import org.commonmark.parser.Parser;

/**
 * Adds {@code $...$} ({@link InlineMath}) and {@code $$...$$} ({@link MathBlock})
 * to a commonmark parser.
 */
public class MathExtension implements Parser.ParserExtension {

    private MathExtension() {
    }

    public static Extension create() {
        return new MathExtension();
    }

    @Override
    public void extend(Parser.Builder parserBuilder) {
        parserBuilder.customBlockParserFactory(new MathBlockParser.Factory());
        parserBuilder.customInlineContentParserFactory(new InlineMathParser.Factory());
    }
}
