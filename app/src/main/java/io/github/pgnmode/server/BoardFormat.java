package io.github.pgnmode.server;

public enum BoardFormat {
    SVG("svg"),
    TEXT("text");

    private final String optionValue;

    BoardFormat(String optionValue) {
        this.optionValue = optionValue;
    }

    /** Value of the {@code -board_format} option. */
    public String optionValue() {
        return optionValue;
    }
}
