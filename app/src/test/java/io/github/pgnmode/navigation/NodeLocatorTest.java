package io.github.pgnmode.navigation;

import static org.junit.jupiter.api.Assertions.*;

import io.github.pgnmode.syntax.NodeType;
import io.github.pgnmode.syntax.PgnDocument;
import java.util.EnumSet;
import java.util.Set;
import org.junit.jupiter.api.Test;

class NodeLocatorTest {
    private static final String TEXT = "[Event \"A\"]\n\n1. e4 e5 (1... c5 2. Nf3) 2. Nf3 *";

    private final PgnDocument doc = PgnDocument.parse(TEXT);
    private final NodeLocator locator = new NodeLocator(doc);

    @Test
    void testTrueBoundariesTrimWhitespace() {
        var header = doc.games().get(0).child(0);
        assertEquals(NodeType.HEADER, header.type());
        assertEquals(12, header.endOffset());
        assertEquals(0, locator.trueFirst(header));
        assertEquals(10, locator.trueLast(header));
        assertEquals(11, locator.trueAfter(header));
        assertTrue(locator.trulyContains(header, 10));
        assertFalse(locator.trulyContains(header, 11));
    }

    @Test
    void testNodeAtFallsBackToEnclosingNode() {
        assertEquals(NodeType.GAME, locator.nodeAt(11).type());
        assertEquals(NodeType.SAN_MOVE, locator.nodeAt(TEXT.indexOf("e4") + 1).type());
        assertEquals(NodeType.MOVETEXT, locator.nodeAt(TEXT.indexOf(" e5")).type());
        assertEquals(NodeType.TAGPAIR, locator.nodeAt(3).type());
    }

    @Test
    void testLocateClimbsToRequestedType() {
        int c5 = TEXT.indexOf("c5");
        var variation = locator.locate(NodeType.VARIATION, c5);
        assertTrue(variation.isPresent());
        assertEquals(TEXT.indexOf('('), variation.get().startOffset());
        assertTrue(locator.locate(NodeType.VARIATION, TEXT.indexOf("e5")).isEmpty());
        assertTrue(locator.locate(NodeType.MOVES, TEXT.indexOf(" e5")).isEmpty());
    }

    @Test
    void testLocateWithSeveralTypesPrefersInnermost() {
        int c5 = TEXT.indexOf("c5");
        var found = locator.locate(EnumSet.of(NodeType.MOVETEXT, NodeType.VARIATION), c5);
        assertEquals(NodeType.VARIATION, found.orElseThrow().type());

        var onlyMovetext = locator.locate(EnumSet.of(NodeType.MOVETEXT, NodeType.HEADER), c5);
        assertEquals(NodeType.MOVETEXT, onlyMovetext.orElseThrow().type());

        assertEquals(NodeType.SAN_MOVE, locator.locate(Set.of(), c5).orElseThrow().type());
    }

    @Test
    void testNarrowToInteriorOfVariation() {
        var variation = locator.locate(NodeType.VARIATION, TEXT.indexOf("c5")).orElseThrow();
        var inner = locator.narrowToInterior(variation);

        assertEquals(TEXT.indexOf('(') + 1, inner.viewStart());
        assertEquals(TEXT.indexOf(')'), inner.viewEnd());
        assertSame(variation, inner.viewRoot());
        assertEquals(inner.viewStart(), inner.trueFirst(variation));
        assertEquals(TEXT.indexOf(')'), inner.trueAfter(variation));
        assertFalse(inner.isNestedInView(variation));
        assertTrue(inner.isNestedInView(variation.child(1)));
        assertEquals(NodeType.MOVE_NUMBER, inner.nodeAt(inner.viewStart()).type());
    }

    @Test
    void testNarrowIsClippedToCurrentView() {
        var game = doc.games().get(0);
        var variation = locator.locate(NodeType.VARIATION, TEXT.indexOf("c5")).orElseThrow();
        var widened = locator.narrowToInterior(variation).narrowTo(game);
        assertEquals(TEXT.indexOf('(') + 1, widened.viewStart());
        assertEquals(TEXT.indexOf(')'), widened.viewEnd());
    }

    @Test
    void testRootIsClampedToView() {
        var doc = PgnDocument.parse("\n\n  1. e4 *  \n");
        var locator = new NodeLocator(doc);
        assertEquals(4, locator.trueFirst(doc.root()));
        assertEquals(11, locator.trueAfter(doc.root()));
        assertEquals(NodeType.SERIES_OF_GAMES, locator.nodeAt(1).type());
    }
}
