package io.github.pgnmode.navigation;

/** Thrown when move navigation runs out of moves in the requested direction. The caller's position is unchanged. */
public class NoMoreMovesException extends Exception {
    private final int position;

    public NoMoreMovesException(int position) {
        super("No more moves");
        this.position = position;
    }

    /** The position navigation started from, which remains the caller's current position. */
    public int position() {
        return position;
    }
}
