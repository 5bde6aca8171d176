package io.github.pgnmode.syntax;

import java.util.regex.Pattern;

/** Regular expressions for the lexical pieces of PGN movetext. */
public final class SanPatterns {
    private SanPatterns() {}

    private static final String CHECK = "[+#]?";
    private static final String CASTLE = "(?:O-O-O|O-O|0-0-0|0-0)";
    private static final String PIECE_MOVE = "[KQRBN][a-h]?[1-8]?x?[a-h][1-8]";
    private static final String PAWN_MOVE = "[a-h](?:x[a-h])?[1-8](?:=?[QRBN])?";

    /** Standard algebraic notation, including castling. */
    public static final String SAN = "(?:" + CASTLE + "|" + PIECE_MOVE + "|" + PAWN_MOVE + ")" + CHECK;

    /** Long algebraic notation: {@code e2e4}, {@code Ng1-f3}, {@code e7xd8=Q}. */
    public static final String LAN =
            "(?:[KQRBN]?[a-h][1-8][-x][a-h][1-8](?:=?[QRBN])?|[a-h][1-8][a-h][1-8][qrbnQRBN]?)" + CHECK;

    /** Any move token; LAN is tried first because a SAN pawn move is a prefix of most LAN moves. */
    public static final String MOVE = "(?:" + LAN + "|" + SAN + ")";

    /** Optional move number and punctuation, optional whitespace, then a move. */
    public static final String RELAXED_MOVE = "[0-9]*(?:\\.+|…)?\\s*" + MOVE;

    public static final Pattern SAN_PATTERN = Pattern.compile(SAN);
    public static final Pattern LAN_PATTERN = Pattern.compile(LAN);
    public static final Pattern MOVE_PATTERN = Pattern.compile(MOVE);
    public static final Pattern RELAXED_MOVE_PATTERN = Pattern.compile(RELAXED_MOVE);

    public static final Pattern MOVE_NUMBER_PATTERN = Pattern.compile("[0-9]+(?:\\.+|…)?");
    public static final Pattern RESULT_PATTERN = Pattern.compile("1-0|0-1|1/2-1/2|\\*");
    public static final Pattern NAG_PATTERN = Pattern.compile("\\$[0-9]+");
    public static final Pattern SUFFIX_ANNOTATION_PATTERN = Pattern.compile("!!|!\\?|\\?!|\\?\\?|!|\\?|[‼⁇⁉⁈]");

    /** Characters that may not directly precede a move token start. */
    public static boolean isMoveGuardChar(char c) {
        return Character.isLetterOrDigit(c) || c == '-';
    }

    /** Characters that delimit PGN tokens besides whitespace. */
    public static boolean isDelimiter(char c) {
        return c == '(' || c == ')' || c == '{' || c == '}' || c == '[' || c == ']' || c == ';' || c == '"';
    }

    public static boolean isTokenChar(char c) {
        return !Character.isWhitespace(c) && !isDelimiter(c);
    }
}
