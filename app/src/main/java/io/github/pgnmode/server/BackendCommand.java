package io.github.pgnmode.server;

import java.util.Set;

/** Requests understood by the backend, with the reply tags each may produce. */
public enum BackendCommand {
    PGN_TO_FEN(":pgn-to-fen", Set.of(":fen")),
    PGN_TO_BOARD(":pgn-to-board", Set.of(":board-svg", ":board-text")),
    PGN_TO_MAINLINE(":pgn-to-mainline", Set.of(":san")),
    PGN_TO_SCORE(":pgn-to-score", Set.of(":score"));

    /** The only payload type the protocol defines. */
    public static final String PGN_PAYLOAD = ":pgn";

    private final String token;
    private final Set<String> replyTags;

    BackendCommand(String token, Set<String> replyTags) {
        this.token = token;
        this.replyTags = replyTags;
    }

    public String token() {
        return token;
    }

    public Set<String> replyTags() {
        return replyTags;
    }

    public boolean acceptsTag(String tag) {
        return replyTags.contains(tag);
    }
}
