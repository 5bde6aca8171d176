package io.github.pgnmode.syntax;

import java.util.EnumSet;
import java.util.Set;

/** Node types of the PGN concrete syntax tree, named after the grammar rules that produce them. */
public enum NodeType {
    SERIES_OF_GAMES("series_of_games"),
    GAME("game"),
    HEADER("header"),
    TAGPAIR("tagpair"),
    MOVETEXT("movetext"),
    VARIATION("variation"),
    SAN_MOVE("san_move"),
    LAN_MOVE("lan_move"),
    MOVE_NUMBER("move_number"),
    ANNOTATION("annotation"),
    INLINE_COMMENT("inline_comment"),
    REST_OF_LINE_COMMENT("rest_of_line_comment"),
    RESULT_CODE("result_code"),
    ERROR("error");

    public static final Set<NodeType> MOVES = EnumSet.of(SAN_MOVE, LAN_MOVE);
    public static final Set<NodeType> COMMENTS = EnumSet.of(INLINE_COMMENT, REST_OF_LINE_COMMENT);
    public static final Set<NodeType> NESTED = EnumSet.of(VARIATION, INLINE_COMMENT, REST_OF_LINE_COMMENT);

    private final String grammarName;

    NodeType(String grammarName) {
        this.grammarName = grammarName;
    }

    public String grammarName() {
        return grammarName;
    }

    public boolean isMove() {
        return MOVES.contains(this);
    }

    public boolean isComment() {
        return COMMENTS.contains(this);
    }
}
