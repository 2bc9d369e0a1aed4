package org.arbor.peg.tree;

/**
 * A range in source text from start (inclusive) to end (exclusive).
 */
public record SourceSpan(SourceLocation start, SourceLocation end) {

    public static SourceSpan of(SourceLocation start, SourceLocation end) {
        return new SourceSpan(start, end);
    }

    public int length() {
        return end.offset() - start.offset();
    }

    public String extract(SourceText source) {
        return source.substring(start.offset(), end.offset());
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
