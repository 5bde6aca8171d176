package io.github.pgnmode.navigation;

import io.github.pgnmode.syntax.NodeType;
import io.github.pgnmode.syntax.PgnDocument;
import io.github.pgnmode.syntax.PgnNode;
import io.github.pgnmode.syntax.SanPatterns;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;

/**
 * Classifies positions of a PGN document: which region a position falls in and which token it is looking at.
 *
 * <p>Every predicate is a pure function of (document, view, position). Predicates that match text return the matched
 * span explicitly instead of leaving it in shared state. Nesting predicates (variation, comment) only count nodes that
 * lie below the view root, so a context narrowed to the interior of a variation treats that variation as its top
 * level.
 */
public final class PgnContext {
    private static final Pattern RESULT_AT_LINE_END =
            Pattern.compile("(?:1-0|0-1|1/2-1/2|\\*)(?=[ \\t\\r]*$)", Pattern.MULTILINE);
    private static final Pattern RELAXED_WITH_TOKEN =
            Pattern.compile("[0-9]*(?:\\.+|…)?\\s*(" + SanPatterns.MOVE + ")");
    private static final Set<NodeType> GROUPS = EnumSet.of(NodeType.VARIATION, NodeType.INLINE_COMMENT);

    private final NodeLocator locator;
    private final PgnDocument document;
    private final String text;

    public PgnContext(NodeLocator locator) {
        this.locator = locator;
        this.document = locator.document();
        this.text = document.text();
    }

    public static PgnContext of(PgnDocument document) {
        return new PgnContext(new NodeLocator(document));
    }

    public NodeLocator locator() {
        return locator;
    }

    public PgnDocument document() {
        return document;
    }

    public PgnContext narrowTo(PgnNode node) {
        return new PgnContext(locator.narrowTo(node));
    }

    public PgnContext narrowToInterior(PgnNode node) {
        return new PgnContext(locator.narrowToInterior(node));
    }

    public PgnContext narrow(PgnNode root, int start, int end) {
        return new PgnContext(locator.narrow(root, start, end));
    }

    public int viewStart() {
        return locator.viewStart();
    }

    public int viewEnd() {
        return locator.viewEnd();
    }

    public int trueFirst(PgnNode node) {
        return locator.trueFirst(node);
    }

    public int trueAfter(PgnNode node) {
        return locator.trueAfter(node);
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Regions
    // ---------------------------------------------------------------------------------------------------------------

    /**
     * Innermost in-view node of one of {@code types} that has {@code pos} strictly inside its delimiters. A position
     * on the opening delimiter is outside, a position on the closing delimiter is inside. An unterminated node at the
     * end of the text also contains the end position.
     */
    public @Nullable PgnNode innermostEnclosing(Set<NodeType> types, int pos) {
        @Nullable PgnNode found = null;
        PgnNode current = locator.viewRoot();
        descend:
        while (true) {
            for (var child : current.children()) {
                if (child.startOffset() >= pos) {
                    break;
                }
                if (pos < child.endOffset() || (pos == child.endOffset() && isUnterminatedAtEnd(child))) {
                    current = child;
                    if (types.contains(child.type()) && locator.isNestedInView(child)) {
                        found = child;
                    }
                    continue descend;
                }
            }
            return found;
        }
    }

    private boolean isUnterminatedAtEnd(PgnNode node) {
        if (node.endOffset() != text.length()) {
            return false;
        }
        return switch (node.type()) {
            case VARIATION -> !closedBy(node, ')');
            case INLINE_COMMENT -> !closedBy(node, '}');
            case REST_OF_LINE_COMMENT -> !closedBy(node, '\n');
            case GAME, MOVETEXT -> true;
            default -> false;
        };
    }

    private boolean closedBy(PgnNode node, char closer) {
        return node.endOffset() - node.startOffset() >= 2 && text.charAt(node.endOffset() - 1) == closer;
    }

    public @Nullable PgnNode innermostVariation(int pos) {
        return innermostEnclosing(EnumSet.of(NodeType.VARIATION), pos);
    }

    public @Nullable PgnNode innermostComment(int pos) {
        return innermostEnclosing(NodeType.COMMENTS, pos);
    }

    public @Nullable PgnNode innermostNested(int pos) {
        return innermostEnclosing(NodeType.NESTED, pos);
    }

    public boolean insideVariation(int pos) {
        return innermostVariation(pos) != null;
    }

    public boolean insideComment(int pos) {
        return innermostComment(pos) != null;
    }

    public boolean insideNested(int pos) {
        return innermostNested(pos) != null;
    }

    /** Inside a line that starts with the PGN escape marker {@code %}. */
    public boolean insideEscapedLine(int pos) {
        int lineStart = lineStart(pos);
        return lineStart < text.length() && text.charAt(lineStart) == '%' && pos > lineStart;
    }

    public Optional<PgnNode> headerAt(int pos) {
        return locator.locate(NodeType.HEADER, pos);
    }

    public boolean insideHeader(int pos) {
        return headerAt(pos).isPresent();
    }

    /**
     * Inside the whitespace gap between a header and its movetext, or between games, at a point where the game has
     * not reached its result code.
     */
    public boolean insideSeparator(int pos) {
        if (insideHeader(pos)) {
            return false;
        }
        var node = locator.nodeAt(pos);
        if (node.is(NodeType.SERIES_OF_GAMES)) {
            return true;
        }
        if (!node.is(NodeType.GAME)) {
            return false;
        }
        return node.firstChild(c -> c.is(NodeType.RESULT_CODE))
                .map(result -> result.startOffset() >= pos)
                .orElse(true);
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Tokens
    // ---------------------------------------------------------------------------------------------------------------

    /** A result code starting at {@code pos} and followed only by blanks up to the end of the line. */
    public Optional<TextMatch> resultCodeAt(int pos) {
        return lookingAt(RESULT_AT_LINE_END, pos);
    }

    public boolean lookingAtResultCode(int pos) {
        return resultCodeAt(pos).isPresent();
    }

    public Optional<TextMatch> suffixAnnotationAt(int pos) {
        return lookingAt(SanPatterns.SUFFIX_ANNOTATION_PATTERN, pos);
    }

    public boolean lookingAtSuffixAnnotation(int pos) {
        return suffixAnnotationAt(pos).isPresent();
    }

    /**
     * A move at {@code pos}, optionally preceded by a move number, its punctuation and whitespace. The returned span
     * covers the whole match; see {@link #relaxedMoveTokenAt} for the move token alone.
     */
    public Optional<TextMatch> relaxedMoveAt(int pos) {
        return relaxedMatcher(pos).map(m -> new TextMatch(m.start(), m.end()));
    }

    public Optional<TextMatch> relaxedMoveTokenAt(int pos) {
        return relaxedMatcher(pos).map(m -> new TextMatch(m.start(1), m.end(1)));
    }

    private Optional<Matcher> relaxedMatcher(int pos) {
        if (pos >= viewEnd() || guarded(pos)) {
            return Optional.empty();
        }
        var m = RELAXED_WITH_TOKEN.matcher(text).region(pos, viewEnd());
        return m.lookingAt() ? Optional.of(m) : Optional.empty();
    }

    /** A move token starting exactly at {@code pos}. */
    public Optional<TextMatch> strictMoveAt(int pos) {
        if (guarded(pos)) {
            return Optional.empty();
        }
        return lookingAt(SanPatterns.MOVE_PATTERN, pos);
    }

    public boolean lookingAtRelaxedMove(int pos) {
        return relaxedMoveAt(pos).isPresent();
    }

    public boolean lookingAtStrictMove(int pos) {
        return strictMoveAt(pos).isPresent();
    }

    /**
     * A strict move ending right at {@code pos} (or right before a suffix annotation at {@code pos}), provided the text
     * at {@code pos} is whitespace, the end of the view, or a suffix annotation.
     */
    public Optional<TextMatch> moveBefore(int pos) {
        boolean boundary =
                pos >= viewEnd() || Character.isWhitespace(text.charAt(pos)) || lookingAtSuffixAnnotation(pos);
        if (!boundary) {
            return Optional.empty();
        }
        int end = pos;
        while (end > viewStart() && isSuffixGlyph(text.charAt(end - 1))) {
            end--;
        }
        int start = end;
        while (start > viewStart() && isMoveChar(text.charAt(start - 1))) {
            start--;
        }
        if (start == end) {
            return Optional.empty();
        }
        final int moveEnd = end;
        return strictMoveAt(start).filter(m -> m.end() == moveEnd);
    }

    public boolean lookingBackAtMove(int pos) {
        return moveBefore(pos).isPresent();
    }

    /** The move-token node containing {@code pos}, if any. */
    public Optional<PgnNode> moveNodeAt(int pos) {
        return locator.locate(NodeType.MOVES, pos);
    }

    /** A match of a candidate move start is rejected when it continues a token already in progress. */
    private boolean guarded(int pos) {
        return pos > viewStart() && pos <= text.length() && SanPatterns.isMoveGuardChar(text.charAt(pos - 1));
    }

    private Optional<TextMatch> lookingAt(Pattern pattern, int pos) {
        if (pos < viewStart() || pos >= viewEnd()) {
            return Optional.empty();
        }
        var m = pattern.matcher(text).region(pos, viewEnd());
        return m.lookingAt() ? Optional.of(new TextMatch(m.start(), m.end())) : Optional.empty();
    }

    /** First relaxed move match starting in {@code [pos, bound)} and ending by {@code bound}. */
    public Optional<TextMatch> searchRelaxedMove(int pos, int bound) {
        int limit = Math.min(bound, viewEnd());
        if (pos >= limit) {
            return Optional.empty();
        }
        var m = SanPatterns.RELAXED_MOVE_PATTERN.matcher(text).region(pos, limit);
        return m.find() ? Optional.of(new TextMatch(m.start(), m.end())) : Optional.empty();
    }

    private static boolean isSuffixGlyph(char c) {
        return c == '!' || c == '?' || c == '‼' || c == '⁇' || c == '⁉' || c == '⁈';
    }

    private static boolean isMoveChar(char c) {
        return Character.isLetterOrDigit(c) || c == '-' || c == '=' || c == '+' || c == '#';
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Text motion, bounded by the view
    // ---------------------------------------------------------------------------------------------------------------

    public boolean isWhitespaceAt(int pos) {
        return pos >= viewStart() && pos < viewEnd() && Character.isWhitespace(text.charAt(pos));
    }

    public boolean afterWhitespace(int pos) {
        return pos > viewStart() && Character.isWhitespace(text.charAt(pos - 1));
    }

    /** Immediately after a closing {@code )} or <code>}</code>. */
    public boolean afterCloser(int pos) {
        return pos > viewStart() && (text.charAt(pos - 1) == ')' || text.charAt(pos - 1) == '}');
    }

    public boolean lookingAtCloser(int pos) {
        return pos >= viewStart() && pos < viewEnd() && text.charAt(pos) == ')';
    }

    public int skipWhitespaceForward(int pos) {
        int p = pos;
        while (p < viewEnd() && Character.isWhitespace(text.charAt(p))) {
            p++;
        }
        return p;
    }

    public int skipWhitespaceBackward(int pos) {
        int p = pos;
        while (p > viewStart() && Character.isWhitespace(text.charAt(p - 1))) {
            p--;
        }
        return p;
    }

    /** Skips backward across move numbers, their punctuation and whitespace. */
    public int skipMoveNumberBackward(int pos) {
        int p = pos;
        while (p > viewStart()) {
            char c = text.charAt(p - 1);
            if (!(Character.isDigit(c) || c == '.' || c == '…' || Character.isWhitespace(c))) {
                break;
            }
            p--;
        }
        return p;
    }

    /**
     * Moves backward over one lexical unit: a delimited group (variation, brace comment, tag pair, quoted string) as a
     * whole, or a run of token characters. Returns {@code pos} unchanged at an opening delimiter or the view start.
     */
    public int backwardUnit(int pos) {
        int q = skipWhitespaceBackward(pos);
        if (q <= viewStart()) {
            return q;
        }
        char c = text.charAt(q - 1);
        if (c == ')' || c == '}') {
            return Math.max(viewStart(), groupStartBefore(q));
        }
        if (c == ']') {
            int open = text.lastIndexOf('[', q - 2);
            return open >= viewStart() ? open : q - 1;
        }
        if (c == '"') {
            int open = text.lastIndexOf('"', q - 2);
            return open >= viewStart() ? open : q - 1;
        }
        if (SanPatterns.isTokenChar(c)) {
            while (q > viewStart() && SanPatterns.isTokenChar(text.charAt(q - 1))) {
                q--;
            }
            return q;
        }
        return pos;
    }

    /** Start of the variation or brace comment whose closing delimiter ends right before {@code pos}. */
    public int groupStartBefore(int pos) {
        @Nullable PgnNode found = null;
        PgnNode current = document.root();
        descend:
        while (true) {
            for (var child : current.children()) {
                if (child.startOffset() > pos - 1) {
                    break;
                }
                if (child.spans(pos - 1)) {
                    if (GROUPS.contains(child.type()) && child.endOffset() == pos) {
                        found = child;
                    }
                    current = child;
                    continue descend;
                }
            }
            break;
        }
        return found != null ? found.startOffset() : pos - 1;
    }

    public int lineStart(int pos) {
        int p = Math.min(pos, text.length());
        while (p > viewStart() && text.charAt(p - 1) != '\n') {
            p--;
        }
        return p;
    }

    public int lineEnd(int pos) {
        int p = pos;
        while (p < viewEnd() && text.charAt(p) != '\n') {
            p++;
        }
        return p;
    }

    public int nextLineStart(int pos) {
        int end = lineEnd(pos);
        return end < viewEnd() ? end + 1 : end;
    }

    public boolean atLineEnd(int pos) {
        return pos >= viewEnd() || text.charAt(pos) == '\n' || text.charAt(pos) == '\r';
    }

    public boolean atLineStart(int pos) {
        return pos <= viewStart() || text.charAt(pos - 1) == '\n';
    }

    /** End of the run of token characters containing or starting at {@code pos}. */
    public int wordEnd(int pos) {
        int p = pos;
        while (p < viewEnd() && SanPatterns.isTokenChar(text.charAt(p))) {
            p++;
        }
        return p;
    }
}
