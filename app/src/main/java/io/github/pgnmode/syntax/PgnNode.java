package io.github.pgnmode.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import org.jetbrains.annotations.Nullable;

/**
 * A typed node of the PGN syntax tree.
 *
 * <p>Nodes reference offsets into the document text, never copies of it. The start offset is inclusive and the end
 * offset exclusive. Parent links are back-references established once when the tree is assembled; after that the
 * tree is never mutated.
 */
public final class PgnNode {
    private final NodeType type;
    private final int startOffset;
    private final int endOffset;
    private final List<PgnNode> children;

    @Nullable
    private PgnNode parent;

    private int indexInParent = -1;

    PgnNode(NodeType type, int startOffset, int endOffset, List<PgnNode> children) {
        if (startOffset < 0 || endOffset < startOffset) {
            throw new IllegalArgumentException(
                    "Invalid span [%d, %d) for %s".formatted(startOffset, endOffset, type.grammarName()));
        }
        this.type = type;
        this.startOffset = startOffset;
        this.endOffset = endOffset;
        this.children = Collections.unmodifiableList(new ArrayList<>(children));
        for (int i = 0; i < this.children.size(); i++) {
            var child = this.children.get(i);
            child.parent = this;
            child.indexInParent = i;
        }
    }

    static PgnNode leaf(NodeType type, int startOffset, int endOffset) {
        return new PgnNode(type, startOffset, endOffset, List.of());
    }

    public NodeType type() {
        return type;
    }

    public boolean is(NodeType candidate) {
        return type == candidate;
    }

    public int startOffset() {
        return startOffset;
    }

    public int endOffset() {
        return endOffset;
    }

    public @Nullable PgnNode parent() {
        return parent;
    }

    public List<PgnNode> children() {
        return children;
    }

    public int childCount() {
        return children.size();
    }

    public PgnNode child(int index) {
        return children.get(index);
    }

    public @Nullable PgnNode nextSibling() {
        if (parent == null || indexInParent + 1 >= parent.children.size()) {
            return null;
        }
        return parent.children.get(indexInParent + 1);
    }

    public @Nullable PgnNode previousSibling() {
        if (parent == null || indexInParent <= 0) {
            return null;
        }
        return parent.children.get(indexInParent - 1);
    }

    /** Returns the first child of one of the given types. */
    public Optional<PgnNode> firstChild(Predicate<PgnNode> predicate) {
        return children.stream().filter(predicate).findFirst();
    }

    /** True if {@code other} is this node or one of its ancestors. */
    public boolean isDescendantOf(PgnNode other) {
        for (PgnNode n = this; n != null; n = n.parent) {
            if (n == other) {
                return true;
            }
        }
        return false;
    }

    /** Raw containment test against the parser-reported span. */
    public boolean spans(int offset) {
        return offset >= startOffset && offset < endOffset;
    }

    public String text(PgnDocument document) {
        return document.text().substring(startOffset, endOffset);
    }

    @Override
    public String toString() {
        return "%s[%d, %d)".formatted(type.grammarName(), startOffset, endOffset);
    }
}
