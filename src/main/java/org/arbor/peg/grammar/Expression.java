package org.arbor.peg.grammar;

import org.arbor.peg.action.Accessors;

import java.util.List;
import java.util.Objects;

/**
 * PEG expression types - the building blocks of grammar rules.
 *
 * <p>Expressions are immutable. Each instance carries the accessor bundle attached
 * to it with {@link #extend(Accessors...)}; every node produced by matching that
 * instance carries the bundle. Instances are told apart by identity, so two equal
 * literals with different bundles are different expressions.
 */
public sealed interface Expression {

    /**
     * Accessors attached to every node this expression produces.
     */
    Accessors accessors();

    /**
     * Copy of this expression carrying the given accessors instead of the current ones.
     */
    Expression withAccessors(Accessors accessors);

    <R> R accept(Visitor<R> visitor);

    /**
     * Short description used in diagnostics.
     */
    String describe();

    /**
     * Copy of this expression with the given bundles layered over its current accessors.
     */
    default Expression extend(Accessors... bundles) {
        var merged = accessors();
        for (var bundle : bundles) {
            merged = merged.overriddenBy(Objects.requireNonNull(bundle, "bundle"));
        }
        return withAccessors(merged);
    }

    /**
     * Exhaustive dispatch over the expression variants.
     */
    interface Visitor<R> {
        R visitTerminal(Terminal terminal);

        R visitCharClass(CharClass charClass);

        R visitAnyChar(AnyChar anyChar);

        R visitNonterminal(Nonterminal nonterminal);

        R visitSequence(Sequence sequence);

        R visitChoice(Choice choice);

        R visitZeroOrMore(ZeroOrMore zeroOrMore);

        R visitOneOrMore(OneOrMore oneOrMore);

        R visitOptional(Optional optional);

        R visitAnd(And and);

        R visitNot(Not not);
    }

    // === Factories ===

    static Terminal terminal(String literal) {
        return new Terminal(literal, Accessors.none());
    }

    static Sequence sequence(Expression... elements) {
        return new Sequence(List.of(elements), Accessors.none());
    }

    static Sequence sequence(List<? extends Expression> elements) {
        return new Sequence(List.copyOf(elements), Accessors.none());
    }

    static Choice choice(Expression... alternatives) {
        return new Choice(List.of(alternatives), Accessors.none());
    }

    static Choice choice(List<? extends Expression> alternatives) {
        return new Choice(List.copyOf(alternatives), Accessors.none());
    }

    static ZeroOrMore zeroOrMore(Expression expression) {
        return new ZeroOrMore(expression, Accessors.none());
    }

    static OneOrMore oneOrMore(Expression expression) {
        return new OneOrMore(expression, Accessors.none());
    }

    static Optional optional(Expression expression) {
        return new Optional(expression, Accessors.none());
    }

    static And and(Expression expression) {
        return new And(expression, Accessors.none());
    }

    static Not not(Expression expression) {
        return new Not(expression, Accessors.none());
    }

    static CharClass charClass(String pattern) {
        return new CharClass(pattern, false, Accessors.none());
    }

    static CharClass notCharClass(String pattern) {
        return new CharClass(pattern, true, Accessors.none());
    }

    static AnyChar any() {
        return new AnyChar(Accessors.none());
    }

    // === Terminals ===

    /**
     * Literal string match: 'text'
     */
    record Terminal(String literal, Accessors accessors) implements Expression {
        public Terminal {
            Objects.requireNonNull(literal, "literal");
            Objects.requireNonNull(accessors, "accessors");
        }

        @Override
        public Terminal withAccessors(Accessors accessors) {
            return new Terminal(literal, accessors);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTerminal(this);
        }

        @Override
        public String describe() {
            return "'" + literal + "'";
        }
    }

    /**
     * Character class: [a-z], [^a-z]
     */
    record CharClass(String pattern, boolean negated, Accessors accessors) implements Expression {
        public CharClass {
            Objects.requireNonNull(pattern, "pattern");
            Objects.requireNonNull(accessors, "accessors");
        }

        @Override
        public CharClass withAccessors(Accessors accessors) {
            return new CharClass(pattern, negated, accessors);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCharClass(this);
        }

        @Override
        public String describe() {
            return "[" + (negated ? "^" : "") + pattern + "]";
        }

        /**
         * Check a single character against the class, honoring negation.
         */
        public boolean matches(char c) {
            return matchesPattern(c) != negated;
        }

        private boolean matchesPattern(char c) {
            int i = 0;
            while (i < pattern.length()) {
                char start = pattern.charAt(i);
                int consumed = 1;
                if (start == '\\' && i + 1 < pattern.length()) {
                    start = unescape(pattern.charAt(i + 1));
                    consumed = 2;
                }
                // Range: start '-' end
                if (i + consumed + 1 < pattern.length() && pattern.charAt(i + consumed) == '-') {
                    char end = pattern.charAt(i + consumed + 1);
                    int endConsumed = 1;
                    if (end == '\\' && i + consumed + 2 < pattern.length()) {
                        end = unescape(pattern.charAt(i + consumed + 2));
                        endConsumed = 2;
                    }
                    if (c >= start && c <= end) {
                        return true;
                    }
                    i += consumed + 1 + endConsumed;
                    continue;
                }
                if (c == start) {
                    return true;
                }
                i += consumed;
            }
            return false;
        }

        private static char unescape(char escaped) {
            return switch (escaped) {
                case 'n' -> '\n';
                case 'r' -> '\r';
                case 't' -> '\t';
                default -> escaped;
            };
        }
    }

    /**
     * Any character: .
     */
    record AnyChar(Accessors accessors) implements Expression {
        public AnyChar {
            Objects.requireNonNull(accessors, "accessors");
        }

        @Override
        public AnyChar withAccessors(Accessors accessors) {
            return new AnyChar(accessors);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAnyChar(this);
        }

        @Override
        public String describe() {
            return "any character";
        }
    }

    /**
     * Rule reference by name, resolved in the owning grammar at match time.
     * Never holds the referenced body, so rules may refer to each other in cycles.
     */
    record Nonterminal(String name, Grammar grammar, Accessors accessors) implements Expression {
        public Nonterminal {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(grammar, "grammar");
            Objects.requireNonNull(accessors, "accessors");
        }

        @Override
        public Nonterminal withAccessors(Accessors accessors) {
            return new Nonterminal(name, grammar, accessors);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNonterminal(this);
        }

        @Override
        public String describe() {
            return name;
        }

        @Override
        public String toString() {
            return "Nonterminal[" + name + "]";
        }
    }

    // === Combinators ===

    /**
     * Sequence: e1 e2 e3
     */
    record Sequence(List<Expression> elements, Accessors accessors) implements Expression {
        public Sequence {
            elements = List.copyOf(elements);
            if (elements.isEmpty()) {
                throw new IllegalArgumentException("Sequence requires at least one element");
            }
            Objects.requireNonNull(accessors, "accessors");
        }

        @Override
        public Sequence withAccessors(Accessors accessors) {
            return new Sequence(elements, accessors);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSequence(this);
        }

        @Override
        public String describe() {
            return elements.get(0).describe();
        }
    }

    /**
     * Ordered choice: e1 / e2 / e3
     */
    record Choice(List<Expression> alternatives, Accessors accessors) implements Expression {
        public Choice {
            alternatives = List.copyOf(alternatives);
            if (alternatives.isEmpty()) {
                throw new IllegalArgumentException("Choice requires at least one alternative");
            }
            Objects.requireNonNull(accessors, "accessors");
        }

        @Override
        public Choice withAccessors(Accessors accessors) {
            return new Choice(alternatives, accessors);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitChoice(this);
        }

        @Override
        public String describe() {
            return "one of alternatives";
        }
    }

    // === Repetition ===

    /**
     * Zero or more: e*
     */
    record ZeroOrMore(Expression expression, Accessors accessors) implements Expression {
        public ZeroOrMore {
            Objects.requireNonNull(expression, "expression");
            Objects.requireNonNull(accessors, "accessors");
        }

        @Override
        public ZeroOrMore withAccessors(Accessors accessors) {
            return new ZeroOrMore(expression, accessors);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitZeroOrMore(this);
        }

        @Override
        public String describe() {
            return expression.describe() + "*";
        }
    }

    /**
     * One or more: e+
     */
    record OneOrMore(Expression expression, Accessors accessors) implements Expression {
        public OneOrMore {
            Objects.requireNonNull(expression, "expression");
            Objects.requireNonNull(accessors, "accessors");
        }

        @Override
        public OneOrMore withAccessors(Accessors accessors) {
            return new OneOrMore(expression, accessors);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitOneOrMore(this);
        }

        @Override
        public String describe() {
            return expression.describe() + "+";
        }
    }

    /**
     * Optional: e?
     */
    record Optional(Expression expression, Accessors accessors) implements Expression {
        public Optional {
            Objects.requireNonNull(expression, "expression");
            Objects.requireNonNull(accessors, "accessors");
        }

        @Override
        public Optional withAccessors(Accessors accessors) {
            return new Optional(expression, accessors);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitOptional(this);
        }

        @Override
        public String describe() {
            return expression.describe() + "?";
        }
    }

    // === Predicates ===

    /**
     * Positive lookahead: &e
     */
    record And(Expression expression, Accessors accessors) implements Expression {
        public And {
            Objects.requireNonNull(expression, "expression");
            Objects.requireNonNull(accessors, "accessors");
        }

        @Override
        public And withAccessors(Accessors accessors) {
            return new And(expression, accessors);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAnd(this);
        }

        @Override
        public String describe() {
            return "&" + expression.describe();
        }
    }

    /**
     * Negative lookahead: !e
     */
    record Not(Expression expression, Accessors accessors) implements Expression {
        public Not {
            Objects.requireNonNull(expression, "expression");
            Objects.requireNonNull(accessors, "accessors");
        }

        @Override
        public Not withAccessors(Accessors accessors) {
            return new Not(expression, accessors);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNot(this);
        }

        @Override
        public String describe() {
            return "not " + expression.describe();
        }
    }
}
