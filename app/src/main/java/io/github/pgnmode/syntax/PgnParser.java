package io.github.pgnmode.syntax;

import java.util.ArrayList;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Error-tolerant recursive-descent parser producing the PGN concrete syntax tree.
 *
 * <p>Parsing never fails: text that fits no token category becomes an {@link NodeType#ERROR} node. Span conventions
 * mirror the tree-sitter grammar the navigation code was written against: tag pairs and rest-of-line comments own
 * their terminating line break, every other node ends at its last significant character.
 */
final class PgnParser {
    private static final Logger logger = LogManager.getLogger(PgnParser.class);

    private final String text;
    private final int length;
    private int pos;

    PgnParser(String text) {
        this.text = text;
        this.length = text.length();
    }

    PgnNode parse() {
        var games = new ArrayList<PgnNode>();
        skipWhitespace();
        while (pos < length) {
            games.add(parseGame());
            skipWhitespace();
        }
        logger.debug("Parsed {} game(s) from {} chars", games.size(), length);
        return new PgnNode(NodeType.SERIES_OF_GAMES, 0, length, games);
    }

    private PgnNode parseGame() {
        int gameStart = pos;
        var children = new ArrayList<PgnNode>();
        if (peek() == '[') {
            children.add(parseHeader());
        }

        var elements = new ArrayList<PgnNode>();
        @Nullable PgnNode result = null;
        while (true) {
            skipWhitespace();
            if (pos >= length || (peek() == '[' && atLineStart(pos))) {
                break;
            }
            int resultEnd = matchResult();
            if (resultEnd >= 0) {
                result = PgnNode.leaf(NodeType.RESULT_CODE, pos, resultEnd);
                pos = resultEnd;
                break;
            }
            elements.add(parseElement());
        }

        if (!elements.isEmpty()) {
            children.add(new PgnNode(
                    NodeType.MOVETEXT,
                    elements.get(0).startOffset(),
                    elements.get(elements.size() - 1).endOffset(),
                    elements));
        }
        if (result != null) {
            children.add(result);
        }
        if (children.isEmpty()) {
            // unreachable for well-formed dispatch, but guarantees progress
            children.add(PgnNode.leaf(NodeType.ERROR, pos, ++pos));
        }
        return new PgnNode(
                NodeType.GAME, gameStart, children.get(children.size() - 1).endOffset(), children);
    }

    private PgnNode parseHeader() {
        var tagpairs = new ArrayList<PgnNode>();
        while (true) {
            int save = pos;
            skipWhitespace();
            if (pos >= length || peek() != '[') {
                pos = save;
                break;
            }
            tagpairs.add(parseTagpair());
        }
        return new PgnNode(
                NodeType.HEADER,
                tagpairs.get(0).startOffset(),
                tagpairs.get(tagpairs.size() - 1).endOffset(),
                tagpairs);
    }

    private PgnNode parseTagpair() {
        int start = pos;
        pos++; // '['
        boolean inString = false;
        while (pos < length) {
            char c = text.charAt(pos);
            if (c == '\n') {
                // unterminated tag: the rest of the line is an error
                return PgnNode.leaf(NodeType.ERROR, start, pos);
            }
            if (inString && c == '\\' && pos + 1 < length) {
                pos += 2;
                continue;
            }
            if (c == '"') {
                inString = !inString;
            } else if (c == ']' && !inString) {
                pos++;
                consumeLineEnd();
                return PgnNode.leaf(NodeType.TAGPAIR, start, pos);
            }
            pos++;
        }
        return PgnNode.leaf(NodeType.ERROR, start, pos);
    }

    /** Consumes trailing blanks and a single line break, but only when nothing else follows on the line. */
    private void consumeLineEnd() {
        int p = pos;
        while (p < length && (text.charAt(p) == ' ' || text.charAt(p) == '\t' || text.charAt(p) == '\r')) {
            p++;
        }
        if (p >= length) {
            pos = p;
        } else if (text.charAt(p) == '\n') {
            pos = p + 1;
        }
    }

    private PgnNode parseElement() {
        char c = peek();
        int start = pos;
        switch (c) {
            case '{' -> {
                int close = text.indexOf('}', pos + 1);
                pos = close < 0 ? length : close + 1;
                return PgnNode.leaf(NodeType.INLINE_COMMENT, start, pos);
            }
            case ';' -> {
                return parseRestOfLine(start);
            }
            case '(' -> {
                return parseVariation();
            }
            default -> {
                // fall through to the token checks below
            }
        }
        if (c == '%' && atColumnZero(pos)) {
            return parseRestOfLine(start);
        }

        int end;
        if ((end = lookingAt(SanPatterns.LAN_PATTERN)) >= 0) {
            pos = end;
            return PgnNode.leaf(NodeType.LAN_MOVE, start, end);
        }
        if ((end = lookingAt(SanPatterns.SAN_PATTERN)) >= 0) {
            pos = end;
            return PgnNode.leaf(NodeType.SAN_MOVE, start, end);
        }
        if ((end = lookingAt(SanPatterns.MOVE_NUMBER_PATTERN)) >= 0) {
            pos = end;
            return PgnNode.leaf(NodeType.MOVE_NUMBER, start, end);
        }
        if ((end = lookingAt(SanPatterns.NAG_PATTERN)) >= 0
                || (end = lookingAt(SanPatterns.SUFFIX_ANNOTATION_PATTERN)) >= 0) {
            pos = end;
            return PgnNode.leaf(NodeType.ANNOTATION, start, end);
        }

        // unrecognized: one delimiter, or a run of token characters
        if (SanPatterns.isTokenChar(c)) {
            while (pos < length && SanPatterns.isTokenChar(text.charAt(pos))) {
                pos++;
            }
        } else {
            pos++;
        }
        logger.trace("Unrecognized text at {}: '{}'", start, text.substring(start, pos));
        return PgnNode.leaf(NodeType.ERROR, start, pos);
    }

    private PgnNode parseRestOfLine(int start) {
        int newline = text.indexOf('\n', pos);
        pos = newline < 0 ? length : newline + 1;
        return PgnNode.leaf(NodeType.REST_OF_LINE_COMMENT, start, pos);
    }

    private PgnNode parseVariation() {
        int start = pos;
        pos++; // '('
        var children = new ArrayList<PgnNode>();
        while (true) {
            skipWhitespace();
            if (pos >= length) {
                break;
            }
            if (peek() == ')') {
                pos++;
                break;
            }
            int resultEnd = matchResult();
            if (resultEnd >= 0) {
                children.add(PgnNode.leaf(NodeType.RESULT_CODE, pos, resultEnd));
                pos = resultEnd;
                continue;
            }
            children.add(parseElement());
        }
        return new PgnNode(NodeType.VARIATION, start, pos, children);
    }

    /** Returns the end of a result code token at the current position, or -1. */
    private int matchResult() {
        int end = lookingAt(SanPatterns.RESULT_PATTERN);
        if (end < 0) {
            return -1;
        }
        if (end < length && SanPatterns.isTokenChar(text.charAt(end))) {
            return -1;
        }
        return end;
    }

    private int lookingAt(Pattern pattern) {
        var m = pattern.matcher(text).region(pos, length);
        return m.lookingAt() ? m.end() : -1;
    }

    private char peek() {
        return text.charAt(pos);
    }

    private void skipWhitespace() {
        while (pos < length && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
    }

    private boolean atColumnZero(int offset) {
        return offset == 0 || text.charAt(offset - 1) == '\n';
    }

    private boolean atLineStart(int offset) {
        for (int p = offset - 1; p >= 0; p--) {
            char c = text.charAt(p);
            if (c == '\n') {
                return true;
            }
            if (!Character.isWhitespace(c)) {
                return false;
            }
        }
        return true;
    }
}
