package org.arbor.peg.action;

import org.arbor.peg.tree.SourceSpan;

import java.util.Set;

/**
 * Raised when a node is asked for an accessor none of its bundles define.
 */
public final class NoSuchAccessorException extends AccessorException {
    public NoSuchAccessorException(String accessorName, SourceSpan span, Set<String> available) {
        super(accessorName, span, "No accessor '" + accessorName + "' on node at " + span + ", available: " + available);
    }
}
