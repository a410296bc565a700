package org.dxworks.docmark.math;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for the LaTeX subset used in Markdown formulas.
 *
 * At every position the alternatives are tried in this order:
 * - base with subscript and superscript ({@code x_{a}^{b}})
 * - {@code \frac{A}{B}}
 * - {@code \sqrt{A}} and {@code \sqrt[n]{A}}
 * - base with superscript or subscript ({@code x^2}, {@code x_{ij}})
 * - backslash command, looked up in {@link MathSymbols}
 * - brace group, spliced into the current sequence
 * - maximal run of plain characters
 * - any single character
 *
 * Parsing never fails: anything not understood ends up as literal text.
 */
public final class LatexParser {

    private static final Set<String> FRACTION_COMMANDS = Set.of("frac", "dfrac", "tfrac");
    private static final String PLAIN_PUNCTUATION = ".,;:!?+-*/=()[]<>|'\"";

    private final String source;
    private int pos;

    private LatexParser(String source) {
        this.source = source;
    }

    public static MathNode.Group parse(String latex) {
        if (latex == null || latex.isBlank()) {
            return new MathNode.Group(List.of());
        }
        return new MathNode.Group(new LatexParser(latex.trim()).parseSequence());
    }

    private List<MathNode> parseSequence() {
        List<MathNode> nodes = new ArrayList<>();
        while (pos < source.length()) {
            MathNode node = parseSubSup();
            if (node == null) node = parseFraction();
            if (node == null) node = parseRadical();
            if (node == null) node = parseScript();
            if (node != null) {
                nodes.add(node);
                continue;
            }
            if (parseCommand(nodes)) continue;
            if (parseBraceGroup(nodes)) continue;
            if (parseText(nodes)) continue;
            parseSingleCharacter(nodes);
        }
        return nodes;
    }

    private MathNode parseSubSup() {
        int start = pos;
        String base = readScriptBase();
        if (base == null) {
            return null;
        }

        char first = source.charAt(pos);
        char second = first == '_' ? '^' : '_';
        pos++;
        MathNode.Group firstArg = parseScriptArgument();
        if (firstArg == null || !peek(second)) {
            pos = start;
            return null;
        }
        pos++;
        MathNode.Group secondArg = parseScriptArgument();
        if (secondArg == null) {
            pos = start;
            return null;
        }

        return first == '_'
                ? new MathNode.SubSup(base, firstArg, secondArg)
                : new MathNode.SubSup(base, secondArg, firstArg);
    }

    private MathNode parseScript() {
        int start = pos;
        String base = readScriptBase();
        if (base == null) {
            return null;
        }

        char op = source.charAt(pos);
        pos++;
        MathNode.Group argument = parseScriptArgument();
        if (argument == null) {
            pos = start;
            return null;
        }
        return op == '^'
                ? new MathNode.Superscript(base, argument)
                : new MathNode.Subscript(base, argument);
    }

    /**
     * Reads the base of a scripted expression and leaves the cursor on the
     * {@code ^} or {@code _}. A script operator without a preceding base
     * yields an empty base.
     */
    private String readScriptBase() {
        if (pos >= source.length()) return null;
        char c = source.charAt(pos);
        if (isScriptOperator(c)) {
            return "";
        }
        if (isAsciiAlphanumeric(c) && pos + 1 < source.length() && isScriptOperator(source.charAt(pos + 1))) {
            pos++;
            return String.valueOf(c);
        }
        return null;
    }

    private MathNode.Group parseScriptArgument() {
        if (pos >= source.length()) return null;

        char c = source.charAt(pos);
        if (c == '{') {
            return parseBracedArgument();
        }
        if (isAsciiAlphanumeric(c)) {
            pos++;
            return new MathNode.Group(List.of(new MathNode.Run(String.valueOf(c))));
        }
        if (c == '\\') {
            int start = pos;
            String command = readCommandName();
            if (command != null) {
                return new MathNode.Group(List.of(new MathNode.Run(MathSymbols.resolve(command))));
            }
            pos = start;
        }
        return null;
    }

    private MathNode parseFraction() {
        int start = pos;
        String command = readCommandName();
        if (command == null || !FRACTION_COMMANDS.contains(command)) {
            pos = start;
            return null;
        }

        skipWhitespace();
        MathNode.Group numerator = parseBracedArgument();
        skipWhitespace();
        MathNode.Group denominator = numerator != null ? parseBracedArgument() : null;
        if (denominator == null) {
            pos = start;
            return null;
        }
        return new MathNode.Frac(numerator, denominator);
    }

    private MathNode parseRadical() {
        int start = pos;
        String command = readCommandName();
        if (!"sqrt".equals(command)) {
            pos = start;
            return null;
        }

        skipWhitespace();
        MathNode.Group degree = null;
        if (peek('[')) {
            int close = source.indexOf(']', pos);
            if (close < 0) {
                pos = start;
                return null;
            }
            degree = parse(source.substring(pos + 1, close));
            pos = close + 1;
            skipWhitespace();
        }

        MathNode.Group radicand;
        if (peek('{')) {
            radicand = parseBracedArgument();
        } else if (pos < source.length() && isAsciiAlphanumeric(source.charAt(pos))) {
            radicand = new MathNode.Group(List.of(new MathNode.Run(String.valueOf(source.charAt(pos)))));
            pos++;
        } else {
            radicand = null;
        }

        if (radicand == null) {
            pos = start;
            return null;
        }
        return new MathNode.Radical(degree, radicand);
    }

    private boolean parseCommand(List<MathNode> nodes) {
        if (!peek('\\')) return false;
        String command = readCommandName();
        if (command == null) return false;
        nodes.add(new MathNode.Run(MathSymbols.resolve(command)));
        return true;
    }

    private boolean parseBraceGroup(List<MathNode> nodes) {
        if (!peek('{')) return false;
        int close = matchingBrace(pos);
        if (close < 0) return false;
        nodes.addAll(parse(source.substring(pos + 1, close)).children());
        pos = close + 1;
        return true;
    }

    private boolean parseText(List<MathNode> nodes) {
        StringBuilder text = new StringBuilder();
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (!isPlain(c)) break;
            // leave a script base for parseScript
            if (isAsciiAlphanumeric(c) && pos + 1 < source.length() && isScriptOperator(source.charAt(pos + 1))) {
                break;
            }
            text.append(c);
            pos++;
        }
        if (text.length() == 0) return false;
        nodes.add(new MathNode.Run(text.toString()));
        return true;
    }

    private void parseSingleCharacter(List<MathNode> nodes) {
        int codePoint = source.codePointAt(pos);
        int width = Character.charCount(codePoint);
        nodes.add(new MathNode.Run(source.substring(pos, pos + width)));
        pos += width;
    }

    private MathNode.Group parseBracedArgument() {
        if (!peek('{')) return null;
        int close = matchingBrace(pos);
        if (close < 0) return null;
        MathNode.Group group = parse(source.substring(pos + 1, close));
        pos = close + 1;
        return group;
    }

    /**
     * Reads {@code \name} (letters) or {@code \c} (one non-letter) at the cursor.
     * Returns null and leaves the cursor alone when there is no command.
     */
    private String readCommandName() {
        if (!peek('\\') || pos + 1 >= source.length()) return null;

        char first = source.charAt(pos + 1);
        if (!isAsciiLetter(first)) {
            pos += 2;
            return String.valueOf(first);
        }

        int end = pos + 1;
        while (end < source.length() && isAsciiLetter(source.charAt(end))) {
            end++;
        }
        String name = source.substring(pos + 1, end);
        pos = end;
        return name;
    }

    /** Index of the brace closing the one at {@code open}, or -1 when unbalanced. */
    private int matchingBrace(int open) {
        int depth = 0;
        for (int i = open; i < source.length(); i++) {
            char c = source.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) return i;
            }
        }
        return -1;
    }

    private void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }

    private boolean peek(char expected) {
        return pos < source.length() && source.charAt(pos) == expected;
    }

    private static boolean isPlain(char c) {
        return Character.isLetterOrDigit(c) || Character.isWhitespace(c) || PLAIN_PUNCTUATION.indexOf(c) >= 0;
    }

    private static boolean isScriptOperator(char c) {
        return c == '^' || c == '_';
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isAsciiAlphanumeric(char c) {
        return isAsciiLetter(c) || (c >= '0' && c <= '9');
    }
}
