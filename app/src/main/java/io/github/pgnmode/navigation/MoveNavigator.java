package io.github.pgnmode.navigation;

import io.github.pgnmode.syntax.NodeType;
import io.github.pgnmode.syntax.PgnDocument;
import io.github.pgnmode.syntax.PgnNode;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Steps between move tokens of a PGN document.
 *
 * <p>The navigator holds no cursor: every call takes a position and returns the new one, so a failed call leaves the
 * caller's position untouched. From the mainline, variations and comments are stepped over as whole regions. Starting
 * inside a variation, navigation is confined to that variation and its ends count as the ends of the line.
 */
public final class MoveNavigator {
    private static final Logger logger = LogManager.getLogger(MoveNavigator.class);

    private final PgnDocument document;
    private final PgnContext documentContext;

    public MoveNavigator(PgnDocument document) {
        this.document = document;
        this.documentContext = PgnContext.of(document);
    }

    /** Start of the move {@code count} moves after {@code pos}. */
    public int nextMove(int pos, int count) throws NoMoreMovesException {
        checkArguments(pos, count);
        var locator = documentContext.locator();
        int p = pos;
        if (locator.nodeAt(p).is(NodeType.SERIES_OF_GAMES)) {
            // past a result code the game is over; only a separator of an unfinished game leads on
            var previous = gameAtOrBefore(p);
            if (previous != null && previous.endOffset() <= p && endsWithResult(previous)) {
                throw new NoMoreMovesException(pos);
            }
            p = followingGameStart(p).orElse(p);
        }
        var game = locator.locate(NodeType.GAME, p).orElseThrow(() -> new NoMoreMovesException(pos));
        var ctx = documentContext.narrowTo(game);

        boolean jumped = false;
        var variation = ctx.innermostVariation(p);
        if (variation != null) {
            ctx = ctx.narrowToInterior(variation);
        } else {
            var body = game.firstChild(n -> n.is(NodeType.MOVETEXT) || n.is(NodeType.RESULT_CODE));
            if (body.isPresent() && p < ctx.trueFirst(body.get())) {
                p = ctx.trueFirst(body.get());
                jumped = true;
            }
            if (ctx.locator().locate(NodeType.MOVETEXT, p).isEmpty()) {
                throw new NoMoreMovesException(pos);
            }
        }

        int limit = ctx.trueAfter(ctx.locator().viewRoot());
        for (int i = 0; i < count; i++) {
            p = stepForward(ctx, p, limit, pos, i == 0 && jumped);
        }
        logger.debug("nextMove({}, {}) -> {}", pos, count, p);
        return ctx.skipWhitespaceForward(p);
    }

    private static int stepForward(PgnContext ctx, int from, int limit, int origin, boolean acceptCurrent)
            throws NoMoreMovesException {
        int p = from;
        Optional<PgnNode> move = ctx.moveNodeAt(p);
        if (move.isPresent()) {
            if (acceptCurrent) {
                return ctx.trueFirst(move.get());
            }
            p = ctx.trueAfter(move.get());
        }
        while ((move = ctx.moveNodeAt(p)).isEmpty()) {
            if (p >= limit) {
                throw new NoMoreMovesException(origin);
            }
            var nested = ctx.innermostNested(p);
            if (nested != null) {
                p = Math.max(p + 1, Math.min(nested.endOffset(), ctx.viewEnd()));
            } else if (ctx.isWhitespaceAt(p)) {
                p = ctx.skipWhitespaceForward(p);
            } else {
                var node = ctx.locator().nodeAt(p);
                var sibling = node == ctx.locator().viewRoot() ? null : node.nextSibling();
                int target = sibling != null ? ctx.trueFirst(sibling) : p + 1;
                p = Math.max(target, p + 1);
            }
        }
        return ctx.trueFirst(move.get());
    }

    /** Start of the move {@code count} moves before {@code pos}. */
    public int previousMove(int pos, int count) throws NoMoreMovesException {
        checkArguments(pos, count);
        var game = gameAtOrBefore(pos);
        if (game == null) {
            throw new NoMoreMovesException(pos);
        }
        var ctx = documentContext.narrowTo(game);
        int p = Math.min(pos, ctx.trueAfter(game));
        if (ctx.insideHeader(p)) {
            throw new NoMoreMovesException(pos);
        }
        var variation = ctx.innermostVariation(p);
        if (variation != null) {
            ctx = ctx.narrowToInterior(variation);
        }

        int start = p;
        int thumb = p;
        for (int i = 0; i < count; i++) {
            thumb = p;
            if (ctx.lookingAtRelaxedMove(p)) {
                p = Math.max(ctx.viewStart(), ctx.skipMoveNumberBackward(p) - 1);
            }
            while (!isMoveBefore(ctx, p, thumb)) {
                int before = p;
                if (ctx.insideNested(p)) {
                    p = exitNested(ctx, p);
                } else {
                    p = ctx.backwardUnit(ctx.skipMoveNumberBackward(p));
                }
                if (p == before) {
                    break;
                }
            }
        }
        if (!isMoveBefore(ctx, p, thumb)) {
            p = thumb;
            if (thumb == start) {
                throw new NoMoreMovesException(pos);
            }
        }
        // a thumb may sit on the move number; report the move token itself
        p = ctx.relaxedMoveTokenAt(p).map(TextMatch::start).orElse(p);
        logger.debug("previousMove({}, {}) -> {}", pos, count, p);
        return p;
    }

    /** Looking at a move outside nested content whose token starts before {@code limit}. */
    private static boolean isMoveBefore(PgnContext ctx, int p, int limit) {
        if (ctx.insideNested(p)) {
            return false;
        }
        return ctx.relaxedMoveTokenAt(p).map(m -> m.start() < limit).orElse(false);
    }

    /**
     * Unwinds backward out of every variation and comment enclosing {@code pos}, and over closed variations and
     * comments immediately before it, landing just after the preceding mainline text.
     */
    public int exitNested(int pos) {
        if (pos < 0 || pos > document.length()) {
            throw new IndexOutOfBoundsException(pos);
        }
        return exitNested(documentContext, pos);
    }

    static int exitNested(PgnContext ctx, int pos) {
        int p = pos;
        while (true) {
            int next;
            var variation = ctx.innermostVariation(p);
            @Nullable PgnNode comment;
            if (variation != null) {
                next = variation.startOffset();
            } else if ((comment = ctx.innermostComment(p)) != null) {
                next = comment.startOffset();
            } else {
                int q = ctx.skipWhitespaceBackward(p);
                if (!ctx.afterCloser(q)) {
                    break;
                }
                next = Math.max(ctx.viewStart(), ctx.groupStartBefore(q));
            }
            // newlines count as whitespace, so a landing at a line start continues at the previous line's end
            next = ctx.skipWhitespaceBackward(next);
            if (next >= p) {
                break;
            }
            p = next;
        }
        return p;
    }

    private Optional<Integer> followingGameStart(int pos) {
        for (var game : document.games()) {
            if (game.startOffset() >= pos) {
                int first = documentContext.trueFirst(game);
                return documentContext.skipWhitespaceForward(pos) == first ? Optional.of(first) : Optional.empty();
            }
        }
        return Optional.empty();
    }

    private static boolean endsWithResult(PgnNode game) {
        return game.childCount() > 0 && game.child(game.childCount() - 1).is(NodeType.RESULT_CODE);
    }

    private @Nullable PgnNode gameAtOrBefore(int pos) {
        @Nullable PgnNode found = null;
        for (var game : document.games()) {
            if (game.startOffset() > pos) {
                break;
            }
            found = game;
        }
        return found;
    }

    private void checkArguments(int pos, int count) {
        if (pos < 0 || pos > document.length()) {
            throw new IndexOutOfBoundsException(
                    "Position %d outside document of length %d".formatted(pos, document.length()));
        }
        if (count < 1) {
            throw new IllegalArgumentException("count must be positive: " + count);
        }
    }
}
