package io.github.pgnmode.navigation;

import io.github.pgnmode.syntax.NodeType;
import io.github.pgnmode.syntax.PgnDocument;
import io.github.pgnmode.syntax.PgnNode;
import java.util.List;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Computes the single-game PGN implied by a position in a document.
 *
 * <p>The result always starts at the true start of the game containing the position and ends at a position derived
 * from the kind of text the position is on. Trailing partial text (an unclosed variation, half a header) is tolerated:
 * the backend normalizes or rejects it.
 */
public final class PgnExtractor {
    private static final Logger logger = LogManager.getLogger(PgnExtractor.class);

    private final PgnDocument document;
    private final PgnContext documentContext;

    public PgnExtractor(PgnDocument document) {
        this.document = document;
        this.documentContext = PgnContext.of(document);
    }

    /** The PGN of the game at {@code pos}, truncated literally at the position (extended to cover a move under it). */
    public String extractAt(int pos) {
        checkPosition(pos);
        var gameView = gameViewFor(pos);
        if (gameView.isEmpty()) {
            return "";
        }
        var ctx = gameView.get();
        int start = ctx.trueFirst(ctx.locator().viewRoot());
        int end = literalEnd(ctx, pos);
        return end > start ? document.substring(start, end) : "";
    }

    /**
     * The PGN of the game at {@code pos} as if the variation containing the position had been played instead of the
     * mainline. Outside any variation this is {@link #extractAt}. Only the innermost variation is promoted.
     */
    public String extractAsVariation(int pos) {
        checkPosition(pos);
        if (!documentContext.insideVariation(pos)) {
            return extractAt(pos);
        }
        var gameView = gameViewFor(pos);
        if (gameView.isEmpty()) {
            return "";
        }
        var ctx = gameView.get();
        var variation = ctx.innermostVariation(pos);
        int start = ctx.trueFirst(ctx.locator().viewRoot());
        int end = variationEnd(ctx, variation, pos);
        if (end <= start) {
            return "";
        }
        return promote(document.substring(start, end));
    }

    private int literalEnd(PgnContext ctx, int pos) {
        Optional<PgnNode> header = ctx.headerAt(pos);
        if (header.isPresent()) {
            if (!ctx.atLineEnd(pos) && ctx.lineStart(pos) <= ctx.trueFirst(header.get())) {
                logger.debug("Position {} is on the opening header line, extending to the next line", pos);
                return ctx.nextLineStart(pos);
            }
            return pos;
        }
        if (ctx.insideSeparator(pos)) {
            return pos;
        }
        if (ctx.insideVariation(pos) || ctx.insideComment(pos)) {
            return pos;
        }
        if (ctx.lookingAtResultCode(pos)) {
            return pos;
        }
        if (ctx.lookingBackAtMove(pos)) {
            return pos;
        }
        if (ctx.afterCloser(pos)) {
            return pos;
        }
        var move = ctx.relaxedMoveAt(pos);
        if (move.isPresent()) {
            return move.get().end();
        }
        if (ctx.atLineStart(pos) || ctx.afterWhitespace(pos)) {
            return pos;
        }
        int bound = Math.min(ctx.wordEnd(pos), ctx.trueAfter(ctx.locator().viewRoot()));
        return fallbackEnd(ctx, pos, bound);
    }

    private int variationEnd(PgnContext ctx, @Nullable PgnNode variation, int pos) {
        if (ctx.afterCloser(pos) || ctx.lookingAtCloser(pos)) {
            return pos;
        }
        if (ctx.insideComment(pos)) {
            return pos;
        }
        if (ctx.lookingBackAtMove(pos)) {
            return pos;
        }
        var move = ctx.relaxedMoveAt(pos);
        if (move.isPresent()) {
            return move.get().end();
        }
        int groupEnd = variation != null ? variation.endOffset() : ctx.viewEnd();
        return fallbackEnd(ctx, pos, Math.min(ctx.wordEnd(pos), groupEnd));
    }

    private static int fallbackEnd(PgnContext ctx, int pos, int bound) {
        var found = ctx.searchRelaxedMove(pos, bound);
        if (found.isEmpty()) {
            // ambiguous position: leave it unchanged
            logger.debug("No move found in [{}, {}), keeping position", pos, bound);
            return pos;
        }
        return found.get().end();
    }

    /**
     * Rewrites a truncated game whose end lies inside a variation so the variation reads as the game continuation.
     * Removed are the opening delimiter, the nested content and whitespace before it, and the mainline text from the
     * nearest preceding mainline move number (or, lacking one, the last mainline move) up to the variation.
     */
    static String promote(String pgn) {
        var ctx = PgnContext.of(PgnDocument.parse(pgn));
        var variation = ctx.innermostVariation(pgn.length());
        if (variation == null) {
            return pgn;
        }
        int open = variation.startOffset();
        var rewritten = new StringBuilder(pgn).deleteCharAt(open);

        var unwrapped = PgnDocument.parse(rewritten.toString());
        var unwrappedCtx = PgnContext.of(unwrapped);
        int unwound = unwrappedCtx.skipWhitespaceBackward(
                MoveNavigator.exitNested(unwrappedCtx, unwrappedCtx.skipWhitespaceBackward(open)));
        int cut = mainlineCutStart(unwrapped, unwound);
        rewritten.delete(cut, open);
        logger.debug("Promoted variation opened at {}, mainline cut at {}", open, cut);
        return rewritten.toString();
    }

    private static int mainlineCutStart(PgnDocument doc, int pos) {
        var movetext = new NodeLocator(doc).locate(NodeType.MOVETEXT, Math.max(0, pos - 1));
        if (movetext.isEmpty()) {
            return pos;
        }
        @Nullable PgnNode moveNumber = null;
        @Nullable PgnNode move = null;
        for (var child : movetext.get().children()) {
            if (child.endOffset() > pos) {
                break;
            }
            if (child.is(NodeType.MOVE_NUMBER)) {
                moveNumber = child;
            } else if (child.type().isMove()) {
                move = child;
            }
        }
        if (moveNumber != null) {
            return moveNumber.startOffset();
        }
        return move != null ? move.startOffset() : pos;
    }

    /**
     * A context narrowed to the game at {@code pos}: the game's raw span plus any whitespace trailing it up to the next
     * game. A position in whitespace after a game belongs to that game; a position before the first game belongs to
     * none.
     */
    private Optional<PgnContext> gameViewFor(int pos) {
        List<PgnNode> games = document.games();
        for (int i = games.size() - 1; i >= 0; i--) {
            var game = games.get(i);
            if (game.startOffset() <= pos) {
                int end = i + 1 < games.size() ? games.get(i + 1).startOffset() : document.length();
                return Optional.of(documentContext.narrow(game, game.startOffset(), end));
            }
        }
        return Optional.empty();
    }

    private void checkPosition(int pos) {
        if (pos < 0 || pos > document.length()) {
            throw new IndexOutOfBoundsException(
                    "Position %d outside document of length %d".formatted(pos, document.length()));
        }
    }
}
