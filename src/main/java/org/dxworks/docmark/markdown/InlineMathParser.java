package org.dxworks.docmark.markdown;

import org.commonmark.parser.beta.InlineContentParser;
import org.commonmark.parser.beta.InlineContentParserFactory;
import org.commonmark.parser.beta.InlineParserState;
import org.commonmark.parser.beta.ParsedInline;
import org.commonmark.parser.beta.Position;
import org.commonmark.parser.beta.Scanner;

import java.util.Set;

/**
 * Parses {@code $x$} and {@code $$x$$} inside paragraphs. A single-dollar
 * formula must not start or end with whitespace and must not be followed by a
 * digit, so amounts like {@code $5 and $10} stay plain text.
 */
public class InlineMathParser implements InlineContentParser {

    @Override
    public ParsedInline tryParse(InlineParserState inlineParserState) {
        Scanner scanner = inlineParserState.scanner();
        int openers = scanner.matchMultiple('$');
        if (openers > 2) {
            return ParsedInline.none();
        }
        if (openers == 1 && (!scanner.hasNext() || Character.isWhitespace(scanner.peek()))) {
            return ParsedInline.none();
        }

        Position contentStart = scanner.position();
        while (scanner.find('$') != -1) {
            Position contentEnd = scanner.position();
            int closers = scanner.matchMultiple('$');
            if (closers != openers) {
                continue;
            }

            String content = scanner.getSource(contentStart, contentEnd).getContent();
            if (content.isEmpty() || content.endsWith("\\")) {
                continue;
            }
            if (openers == 1) {
                boolean spaceBeforeCloser = Character.isWhitespace(content.charAt(content.length() - 1));
                boolean digitAfterCloser = scanner.hasNext() && Character.isDigit(scanner.peek());
                if (spaceBeforeCloser || digitAfterCloser) {
                    continue;
                }
            }
            return ParsedInline.of(new InlineMath(content.strip(), openers == 2), scanner.position());
        }
        return ParsedInline.none();
    }

    public static class Factory implements InlineContentParserFactory {

        @Override
        public Set<Character> getTriggerCharacters() {
            return Set.of('$');
        }

        @Override
        public InlineContentParser create() {
            return new InlineMathParser();
        }
    }
}
