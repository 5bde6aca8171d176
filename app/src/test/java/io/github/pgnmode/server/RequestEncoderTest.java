package io.github.pgnmode.server;

import static org.junit.jupiter.api.Assertions.*;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RequestEncoderTest {

    @Test
    void testNullOptionsAreOmitted() {
        var options = new LinkedHashMap<String, Object>();
        options.put("pixels", 400);
        options.put("board_format", "svg");
        options.put("flipped", null);
        assertEquals(" -pixels=400 -board_format=svg", RequestEncoder.encodeOptions(options));
    }

    @Test
    void testBooleanOptions() {
        var options = new LinkedHashMap<String, Object>();
        options.put("flipped", true);
        options.put("coordinates", false);
        assertEquals(" -flipped", RequestEncoder.encodeOptions(options));
        assertEquals("", RequestEncoder.encodeOptions(Map.of()));
    }

    @Test
    void testValuesAreShellQuotedWhenNeeded() {
        var options = new HashMap<String, Object>();
        options.put("engine", "/opt/Stock Fish/bin/stockfish");
        assertEquals(" -engine='/opt/Stock Fish/bin/stockfish'", RequestEncoder.encodeOptions(options));

        assertEquals("/usr/bin/stockfish", RequestEncoder.quote("/usr/bin/stockfish"));
        assertEquals("''", RequestEncoder.quote(""));
        assertEquals("'it'\"'\"'s'", RequestEncoder.quote("it's"));
        assertEquals("'a;b'", RequestEncoder.quote("a;b"));
    }

    @Test
    void testPayloadIsEscapedOntoOneLine() {
        assertEquals("1. e4\\ne5\n", RequestEncoder.escapePayload("1. e4\r\ne5\n\n"));
        assertEquals("a\\nb\\nc\n", RequestEncoder.escapePayload("a\rb\nc"));
        assertEquals("\n", RequestEncoder.escapePayload(""));
    }

    @Test
    void testEncodeFullRequest() {
        var options = new LinkedHashMap<String, Object>();
        options.put("pixels", 300);
        options.put("board_format", "text");
        assertEquals(
                ":version 0.6.0 :pgn-to-board -pixels=300 -board_format=text -- :pgn 1. e4\\n1... e5\n",
                RequestEncoder.encode("0.6.0", ":pgn-to-board", options, ":pgn", "1. e4\n1... e5"));
        assertEquals(
                ":version 0.6.0 :pgn-to-fen -- :pgn *\n",
                RequestEncoder.encode("0.6.0", ":pgn-to-fen", Map.of(), ":pgn", "*"));
    }
}
