package org.arbor.peg.action;

import org.arbor.peg.tree.SourceSpan;

/**
 * Raised when a caller-supplied accessor fails while being evaluated on a node.
 */
public class AccessorException extends RuntimeException {
    private final String accessorName;
    private final SourceSpan span;

    public AccessorException(String accessorName, SourceSpan span, Throwable cause) {
        super("Accessor '" + accessorName + "' failed at " + span + ": " + cause.getMessage(), cause);
        this.accessorName = accessorName;
        this.span = span;
    }

    protected AccessorException(String accessorName, SourceSpan span, String message) {
        super(message);
        this.accessorName = accessorName;
        this.span = span;
    }

    public String accessorName() {
        return accessorName;
    }

    public SourceSpan span() {
        return span;
    }
}
