package org.arbor.peg.tree;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable input buffer shared by every node of one parse.
 *
 * <p>Line starts are indexed once so that offsets can be turned into
 * line/column locations without rescanning the text.
 */
public final class SourceText {
    private final String text;
    private final int[] lineStarts;

    private SourceText(String text) {
        this.text = text;
        this.lineStarts = indexLines(text);
    }

    public static SourceText of(String text) {
        return new SourceText(Objects.requireNonNull(text, "text"));
    }

    public int length() {
        return text.length();
    }

    public char charAt(int offset) {
        return text.charAt(offset);
    }

    public String substring(int start, int end) {
        return text.substring(start, end);
    }

    /**
     * Check whether {@code literal} occurs at {@code offset}.
     */
    public boolean regionMatches(int offset, String literal) {
        return text.startsWith(literal, offset);
    }

    /**
     * Map a 0-based offset to a line/column location.
     */
    public SourceLocation location(int offset) {
        if (offset < 0 || offset > text.length()) {
            throw new IndexOutOfBoundsException("Offset " + offset + " outside [0, " + text.length() + "]");
        }
        var index = Arrays.binarySearch(lineStarts, offset);
        var line = index >= 0 ? index : -index - 2;
        return SourceLocation.at(line + 1, offset - lineStarts[line] + 1, offset);
    }

    public SourceSpan span(int start, int end) {
        return SourceSpan.of(location(start), location(end));
    }

    public String text() {
        return text;
    }

    @Override
    public String toString() {
        return text;
    }

    private static int[] indexLines(String text) {
        var count = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                count++;
            }
        }
        var starts = new int[count];
        var line = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                starts[line++] = i + 1;
            }
        }
        return starts;
    }
}
