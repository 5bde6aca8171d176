package io.github.pgnmode.syntax;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Immutable PGN text together with its syntax tree. The tree is built once on construction and owned by the
 * document; navigation code receives both through this value instead of consulting any ambient parser state.
 */
public final class PgnDocument {
    private final String text;
    private final PgnNode root;

    private PgnDocument(String text, PgnNode root) {
        this.text = text;
        this.root = root;
    }

    public static PgnDocument parse(String text) {
        return new PgnDocument(text, new PgnParser(text).parse());
    }

    public String text() {
        return text;
    }

    public int length() {
        return text.length();
    }

    public char charAt(int offset) {
        return text.charAt(offset);
    }

    /** The {@code series_of_games} node spanning the whole text. */
    public PgnNode root() {
        return root;
    }

    public List<PgnNode> games() {
        return root.children().stream().filter(n -> n.is(NodeType.GAME)).toList();
    }

    public String substring(int start, int end) {
        return text.substring(start, end);
    }

    /** Renders the tree in the parenthesized form tree-sitter uses for its own test corpus. */
    public String toSExpression() {
        return toSExpression(root);
    }

    private static String toSExpression(PgnNode node) {
        if (node.childCount() == 0) {
            return "(" + node.type().grammarName() + ")";
        }
        return node.children().stream()
                .map(PgnDocument::toSExpression)
                .collect(Collectors.joining(" ", "(" + node.type().grammarName() + " ", ")"));
    }
}
