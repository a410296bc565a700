package org.dxworks.docmark.markdown;

import org.commonmark.node.Block;
import org.commonmark.parser.SourceLine;
import org.commonmark.parser.block.AbstractBlockParser;
import org.commonmark.parser.block.AbstractBlockParserFactory;
import org.commonmark.parser.block.BlockContinue;
import org.commonmark.parser.block.BlockStart;
import org.commonmark.parser.block.MatchedBlockParser;
import org.commonmark.parser.block.ParserState;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses a {@code $$} block. The opening line may hold content and may also
 * close the block ({@code $$x$$}); otherwise the block runs until a line
 * ending in {@code $$}.
 */
public class MathBlockParser extends AbstractBlockParser {

    private static final String DELIMITER = "$$";

    private final MathBlock block = new MathBlock();
    private final List<String> lines = new ArrayList<>();
    private boolean openingLineSeen;
    private boolean closed;

    @Override
    public Block getBlock() {
        return block;
    }

    @Override
    public BlockContinue tryContinue(ParserState state) {
        if (closed) {
            return BlockContinue.none();
        }

        String line = state.getLine().getContent().toString();
        String content = line.substring(Math.min(state.getNextNonSpaceIndex(), line.length())).stripTrailing();
        if (content.endsWith(DELIMITER)) {
            String beforeClose = content.substring(0, content.length() - DELIMITER.length());
            if (!beforeClose.isBlank()) {
                lines.add(beforeClose);
            }
            closed = true;
            return BlockContinue.finished();
        }
        return BlockContinue.atIndex(state.getIndex());
    }

    @Override
    public void addLine(SourceLine line) {
        String content = line.getContent().toString();
        if (!openingLineSeen) {
            openingLineSeen = true;
            int close = content.indexOf(DELIMITER);
            if (close >= 0) {
                content = content.substring(0, close);
                closed = true;
            }
            if (!content.isBlank()) {
                lines.add(content.strip());
            }
            return;
        }
        lines.add(content);
    }

    @Override
    public void closeBlock() {
        block.setLiteral(String.join("\n", lines).strip());
    }

    public static class Factory extends AbstractBlockParserFactory {

        @Override
        public BlockStart tryStart(ParserState state, MatchedBlockParser matchedBlockParser) {
            if (state.getIndent() >= 4) {
                return BlockStart.none();
            }
            int nextNonSpace = state.getNextNonSpaceIndex();
            CharSequence line = state.getLine().getContent();
            if (!line.toString().startsWith(DELIMITER, nextNonSpace)) {
                return BlockStart.none();
            }
            return BlockStart.of(new MathBlockParser()).atIndex(nextNonSpace + DELIMITER.length());
        }
    }
}
