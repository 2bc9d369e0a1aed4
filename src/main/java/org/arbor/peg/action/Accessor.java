package org.arbor.peg.action;

import org.arbor.peg.tree.SyntaxNode;

/**
 * Functional interface for computed node accessors.
 */
@FunctionalInterface
public interface Accessor {
    /**
     * Compute the accessor value for a node.
     *
     * @param node the node the accessor is evaluated against
     * @return the computed value
     */
    Object compute(SyntaxNode node);
}
