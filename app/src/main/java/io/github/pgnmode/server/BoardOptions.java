package io.github.pgnmode.server;

import java.util.LinkedHashMap;
import java.util.Map;

/** Rendering options for {@link BackendCommand#PGN_TO_BOARD}. */
public record BoardOptions(int pixels, BoardFormat format, boolean flipped) {
    public static final int DEFAULT_PIXELS = 400;

    public static final BoardOptions DEFAULT = new BoardOptions(DEFAULT_PIXELS, BoardFormat.SVG, false);

    public BoardOptions {
        if (pixels <= 0) {
            throw new IllegalArgumentException("pixels must be positive: " + pixels);
        }
    }

    /** Options in wire order: pixels, board_format, flipped. */
    public Map<String, Object> toOptions() {
        var options = new LinkedHashMap<String, Object>();
        options.put("pixels", pixels);
        options.put("board_format", format.optionValue());
        options.put("flipped", flipped);
        return options;
    }
}
