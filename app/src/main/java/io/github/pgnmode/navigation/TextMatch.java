package io.github.pgnmode.navigation;

/** A matched span of document text, {@code [start, end)}. */
public record TextMatch(int start, int end) {
    public TextMatch {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid match span [%d, %d)".formatted(start, end));
        }
    }

    public int length() {
        return end - start;
    }
}
