package io.github.pgnmode.navigation;

import static org.junit.jupiter.api.Assertions.*;

import io.github.pgnmode.syntax.PgnDocument;
import java.util.List;
import org.junit.jupiter.api.Test;

class MoveNavigatorTest {
    private static final String SIMPLE = "1. e4 e5 2. Nf3 Nc6 *";
    private static final String WITH_VARIATION = "[Event \"A\"]\n\n1. e4 e5 (1... c5 2. Nf3) 2. Nf3 *";

    private final MoveNavigator simple = new MoveNavigator(PgnDocument.parse(SIMPLE));
    private final MoveNavigator withVariation = new MoveNavigator(PgnDocument.parse(WITH_VARIATION));

    @Test
    void testNextMoveStepsOverMoveNumbers() throws NoMoreMovesException {
        assertEquals(SIMPLE.indexOf("e4"), simple.nextMove(0, 1));
        assertEquals(SIMPLE.indexOf("e5"), simple.nextMove(SIMPLE.indexOf("e4"), 1));
        assertEquals(SIMPLE.indexOf("Nf3"), simple.nextMove(SIMPLE.indexOf("e5"), 1));
        assertEquals(SIMPLE.indexOf("Nc6"), simple.nextMove(SIMPLE.indexOf("e4"), 3));
    }

    @Test
    void testNextMoveAtEndOfGameFails() {
        int last = SIMPLE.indexOf("Nc6");
        var e = assertThrows(NoMoreMovesException.class, () -> simple.nextMove(last, 1));
        assertEquals(last, e.position());
        assertThrows(NoMoreMovesException.class, () -> simple.nextMove(SIMPLE.indexOf('*'), 1));
        assertThrows(NoMoreMovesException.class, () -> simple.nextMove(SIMPLE.length(), 1));
    }

    @Test
    void testNextMoveAfterResultDoesNotEnterNextGame() {
        var text = "1. e4 e5 1-0\n\n1. d4 d5 *";
        var navigator = new MoveNavigator(PgnDocument.parse(text));
        int afterResult = text.indexOf("1-0") + 3;
        var e = assertThrows(NoMoreMovesException.class, () -> navigator.nextMove(afterResult, 1));
        assertEquals(afterResult, e.position());
        assertThrows(NoMoreMovesException.class, () -> navigator.nextMove(text.indexOf("\n\n") + 1, 1));
        assertThrows(NoMoreMovesException.class, () -> navigator.nextMove(text.indexOf("e5"), 2));
    }

    @Test
    void testPreviousMove() throws NoMoreMovesException {
        assertEquals(SIMPLE.indexOf("Nf3"), simple.previousMove(SIMPLE.indexOf("Nc6"), 1));
        assertEquals(SIMPLE.indexOf("e5"), simple.previousMove(SIMPLE.indexOf("Nf3"), 1));
        assertEquals(SIMPLE.indexOf("e4"), simple.previousMove(SIMPLE.indexOf("e5"), 1));
        assertEquals(SIMPLE.indexOf("Nc6"), simple.previousMove(SIMPLE.length(), 1));
        assertEquals(SIMPLE.indexOf("e5"), simple.previousMove(SIMPLE.indexOf("Nc6"), 2));
    }

    @Test
    void testPreviousMoveStopsAtFirstMoveWhenCountExceedsAvailable() throws NoMoreMovesException {
        assertEquals(SIMPLE.indexOf("e4"), simple.previousMove(SIMPLE.indexOf("Nc6"), 5));
    }

    @Test
    void testPreviousMoveAtFirstMoveFails() {
        int first = SIMPLE.indexOf("e4");
        var e = assertThrows(NoMoreMovesException.class, () -> simple.previousMove(first, 1));
        assertEquals(first, e.position());
        assertThrows(NoMoreMovesException.class, () -> simple.previousMove(0, 1));
    }

    @Test
    void testRoundTripOnTokenBoundaries() throws NoMoreMovesException {
        for (var token : List.of("e4", "e5", "Nf3")) {
            int start = SIMPLE.indexOf(token);
            int forward = simple.nextMove(start, 1);
            assertEquals(start, simple.previousMove(forward, 1), "round trip from " + token);
        }
    }

    @Test
    void testMainlineSkipsVariations() throws NoMoreMovesException {
        int e5 = WITH_VARIATION.indexOf("e5");
        int mainlineNf3 = WITH_VARIATION.lastIndexOf("Nf3");
        assertEquals(mainlineNf3, withVariation.nextMove(e5, 1));
        assertEquals(e5, withVariation.previousMove(mainlineNf3, 1));
    }

    @Test
    void testNavigationInsideVariationIsConfined() throws NoMoreMovesException {
        int c5 = WITH_VARIATION.indexOf("c5");
        int innerNf3 = WITH_VARIATION.indexOf("Nf3");
        assertEquals(innerNf3, withVariation.nextMove(c5, 1));
        assertEquals(c5, withVariation.previousMove(innerNf3, 1));
        assertThrows(NoMoreMovesException.class, () -> withVariation.nextMove(innerNf3, 1));
        assertThrows(NoMoreMovesException.class, () -> withVariation.previousMove(c5, 1));
    }

    @Test
    void testHeaderPositions() throws NoMoreMovesException {
        assertEquals(WITH_VARIATION.indexOf("e4"), withVariation.nextMove(0, 1));
        assertThrows(NoMoreMovesException.class, () -> withVariation.previousMove(5, 1));

        var text = "[Event \"A\"]\ne4 e5 *";
        assertEquals(text.indexOf("e4"), new MoveNavigator(PgnDocument.parse(text)).nextMove(3, 1));
    }

    @Test
    void testSeparatorBetweenGames() throws NoMoreMovesException {
        // the first game has no result, so the blank line is a separator leading into the next game
        var text = "[Event \"A\"]\n1. e4\n\n[Event \"B\"]\n1. d4 *";
        var navigator = new MoveNavigator(PgnDocument.parse(text));
        assertEquals(text.indexOf("d4"), navigator.nextMove(text.indexOf("\n\n") + 1, 1));

        var trailing = "1. e4 e5 *\n\n";
        assertEquals(
                trailing.indexOf("e5"),
                new MoveNavigator(PgnDocument.parse(trailing)).previousMove(trailing.length(), 1));
    }

    @Test
    void testExitNestedLeavesAllLevels() {
        var text = "1. e4 (1. d4 (1. c4 c5) d5) e5 *";
        var doc = PgnDocument.parse(text);
        var navigator = new MoveNavigator(doc);
        var ctx = PgnContext.of(doc);
        int afterE4 = text.indexOf("e4") + 2;

        assertEquals(afterE4, navigator.exitNested(text.indexOf("c4")));
        assertEquals(afterE4, navigator.exitNested(text.indexOf("d5")));
        assertEquals(afterE4, navigator.exitNested(text.indexOf(" e5")));
        for (int pos = 0; pos <= text.length(); pos++) {
            int exited = navigator.exitNested(pos);
            assertFalse(ctx.insideNested(exited), "exit from " + pos + " landed at " + exited);
            assertTrue(exited <= pos);
        }
    }

    @Test
    void testExitNestedFromComment() {
        var text = "1. e4 {a good move} e5 *";
        var navigator = new MoveNavigator(PgnDocument.parse(text));
        assertEquals(text.indexOf("e4") + 2, navigator.exitNested(text.indexOf("good")));
        assertEquals(text.indexOf("e4"), navigator.exitNested(text.indexOf("e4")));
    }

    @Test
    void testArgumentsAreValidated() {
        assertThrows(IllegalArgumentException.class, () -> simple.nextMove(0, 0));
        assertThrows(IndexOutOfBoundsException.class, () -> simple.previousMove(SIMPLE.length() + 1, 1));
        assertThrows(IndexOutOfBoundsException.class, () -> simple.exitNested(-1));
    }
}
