package io.github.pgnmode.navigation;

import io.github.pgnmode.syntax.NodeType;
import io.github.pgnmode.syntax.PgnDocument;
import io.github.pgnmode.syntax.PgnNode;
import java.util.Optional;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * Finds syntax nodes by position, using whitespace-trimmed "true" node boundaries.
 *
 * <p>A locator works over a view of the document: the whole text, or a sub-range bounded by a view root node (a game,
 * or the interior of a variation). Trimming and root substitution are computed against the view, never against the
 * whole document.
 */
public final class NodeLocator {
    private final PgnDocument document;
    private final PgnNode viewRoot;
    private final int viewStart;
    private final int viewEnd;

    public NodeLocator(PgnDocument document) {
        this(document, document.root(), 0, document.length());
    }

    private NodeLocator(PgnDocument document, PgnNode viewRoot, int viewStart, int viewEnd) {
        if (viewStart < 0 || viewEnd > document.length() || viewStart > viewEnd) {
            throw new IllegalArgumentException(
                    "Invalid view [%d, %d) for document of length %d".formatted(viewStart, viewEnd, document.length()));
        }
        this.document = document;
        this.viewRoot = viewRoot;
        this.viewStart = viewStart;
        this.viewEnd = viewEnd;
    }

    /** Narrows the view to the raw span of {@code node}, clipped to the current view. */
    public NodeLocator narrowTo(PgnNode node) {
        return narrow(node, node.startOffset(), node.endOffset());
    }

    /** Narrows the view to the text between the delimiters of a variation or inline comment. */
    public NodeLocator narrowToInterior(PgnNode node) {
        int start = Math.min(node.startOffset() + 1, node.endOffset());
        int end = node.endOffset();
        char last = end > start ? document.charAt(end - 1) : 0;
        if ((node.is(NodeType.VARIATION) && last == ')') || (node.is(NodeType.INLINE_COMMENT) && last == '}')) {
            end--;
        }
        return narrow(node, start, end);
    }

    /** Narrows the view to an explicit range whose root substitute is {@code root}. */
    public NodeLocator narrow(PgnNode root, int start, int end) {
        int clippedStart = Math.max(start, viewStart);
        int clippedEnd = Math.max(clippedStart, Math.min(end, viewEnd));
        return new NodeLocator(document, root, clippedStart, clippedEnd);
    }

    public PgnDocument document() {
        return document;
    }

    public PgnNode viewRoot() {
        return viewRoot;
    }

    public int viewStart() {
        return viewStart;
    }

    public int viewEnd() {
        return viewEnd;
    }

    /** True for the view root and for the document root, both of which are clamped to the view. */
    private boolean isRootLike(PgnNode node) {
        return node == viewRoot || node.is(NodeType.SERIES_OF_GAMES);
    }

    /** True if {@code node} lies strictly below the view root. */
    public boolean isNestedInView(PgnNode node) {
        return node != viewRoot && node.isDescendantOf(viewRoot);
    }

    /** First position of {@code node} after skipping leading whitespace. */
    public int trueFirst(PgnNode node) {
        int p = isRootLike(node) ? viewStart : Math.max(node.startOffset(), viewStart);
        int limit = isRootLike(node) ? viewEnd : Math.min(node.endOffset(), viewEnd);
        while (p < limit && Character.isWhitespace(document.charAt(p))) {
            p++;
        }
        return p;
    }

    /** Last position of {@code node} after retreating past trailing whitespace. */
    public int trueLast(PgnNode node) {
        int floor = isRootLike(node) ? viewStart : Math.max(node.startOffset(), viewStart);
        int p = (isRootLike(node) ? viewEnd : Math.min(node.endOffset(), viewEnd)) - 1;
        while (p >= floor && Character.isWhitespace(document.charAt(p))) {
            p--;
        }
        return p;
    }

    /** One past {@link #trueLast}, clamped to the view end. */
    public int trueAfter(PgnNode node) {
        return Math.max(trueFirst(node), Math.min(trueLast(node) + 1, viewEnd));
    }

    public boolean trulyContains(PgnNode node, int pos) {
        return pos >= trueFirst(node) && pos < trueAfter(node);
    }

    /** The smallest node whose true span contains {@code pos}, or the view root if none does. */
    public PgnNode nodeAt(int pos) {
        PgnNode current = viewRoot;
        descend:
        while (true) {
            for (var child : current.children()) {
                if (child.startOffset() > pos) {
                    break;
                }
                if (trulyContains(child, pos)) {
                    current = child;
                    continue descend;
                }
            }
            return current;
        }
    }

    /**
     * Locates the node containing {@code pos} with one of the given types.
     *
     * <p>With no types, this is {@link #nodeAt}. With one type, it walks upward from the node at {@code pos}. With
     * several types, one upward walk is made per type and the match with the latest true start wins, which is the most
     * narrowly nested of the candidates.
     */
    public Optional<PgnNode> locate(Set<NodeType> types, int pos) {
        var start = nodeAt(pos);
        if (types.isEmpty()) {
            return Optional.of(start);
        }
        @Nullable PgnNode best = null;
        int bestFirst = -1;
        for (var type : types) {
            var candidate = climb(start, type);
            if (candidate == null) {
                continue;
            }
            int first = trueFirst(candidate);
            if (best == null || first > bestFirst || (first == bestFirst && candidate.isDescendantOf(best))) {
                best = candidate;
                bestFirst = first;
            }
        }
        return Optional.ofNullable(best);
    }

    public Optional<PgnNode> locate(NodeType type, int pos) {
        return Optional.ofNullable(climb(nodeAt(pos), type));
    }

    private static @Nullable PgnNode climb(PgnNode from, NodeType type) {
        for (PgnNode n = from; n != null; n = n.parent()) {
            if (n.is(type)) {
                return n;
            }
        }
        return null;
    }
}
