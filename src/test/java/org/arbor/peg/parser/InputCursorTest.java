package org.arbor.peg.parser;

import org.arbor.peg.tree.SourceLocation;
import org.arbor.peg.tree.SourceText;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InputCursorTest {

    private final InputCursor start = InputCursor.start(SourceText.of("ab\nc"));

    @Test
    void advance_returnsNewCursor() {
        var moved = start.advance(3);

        assertEquals(0, start.offset());
        assertEquals(3, moved.offset());
        assertEquals('c', moved.peek());
        assertEquals(SourceLocation.at(2, 1, 3), moved.location());
    }

    @Test
    void advance_pastEnd_throws() {
        assertThrows(IndexOutOfBoundsException.class, () -> start.advance(5));
        assertThrows(IndexOutOfBoundsException.class, () -> start.advance(-1));
    }

    @Test
    void startsWith_checksRemainingInput() {
        assertTrue(start.startsWith("ab"));
        assertFalse(start.advance(1).startsWith("ab"));
        assertEquals(1, start.moveTo(3).remaining());
        assertTrue(start.moveTo(4).isAtEnd());
    }
}
