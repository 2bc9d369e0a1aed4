package org.arbor.peg.parser;

import org.arbor.peg.tree.SourceLocation;
import org.arbor.peg.tree.SourceText;

import java.util.Objects;

/**
 * Immutable view of the input at one position. Advancing returns a new cursor.
 */
public record InputCursor(SourceText text, int offset) {

    public InputCursor {
        Objects.requireNonNull(text, "text");
        if (offset < 0 || offset > text.length()) {
            throw new IndexOutOfBoundsException("Offset " + offset + " outside [0, " + text.length() + "]");
        }
    }

    public static InputCursor start(SourceText text) {
        return new InputCursor(text, 0);
    }

    public boolean isAtEnd() {
        return offset >= text.length();
    }

    public int remaining() {
        return text.length() - offset;
    }

    public char peek() {
        return text.charAt(offset);
    }

    public boolean startsWith(String literal) {
        return text.regionMatches(offset, literal);
    }

    public InputCursor advance(int count) {
        if (count < 0 || count > remaining()) {
            throw new IndexOutOfBoundsException("Cannot advance " + count + " from offset " + offset
                                                + ", remaining " + remaining());
        }
        return count == 0 ? this : new InputCursor(text, offset + count);
    }

    public InputCursor moveTo(int newOffset) {
        return newOffset == offset ? this : new InputCursor(text, newOffset);
    }

    public SourceLocation location() {
        return text.location(offset);
    }

    @Override
    public String toString() {
        return "InputCursor@" + offset;
    }
}
