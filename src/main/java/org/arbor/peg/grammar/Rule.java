package org.arbor.peg.grammar;

import org.arbor.peg.action.Accessors;

import java.util.Objects;

/**
 * A grammar rule: Name <- Expression, with optional rule-level accessors applied to
 * every node the rule produces.
 */
public record Rule(
 String name,
 Expression expression,
 Accessors accessors) {
    public Rule {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(expression, "expression");
        Objects.requireNonNull(accessors, "accessors");
    }
}
