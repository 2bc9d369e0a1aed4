package org.arbor.peg.tree;

import org.arbor.peg.action.AccessorException;
import org.arbor.peg.action.Accessors;
import org.arbor.peg.action.NoSuchAccessorException;
import org.arbor.peg.grammar.Expression;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Syntax tree node produced by a successful match.
 *
 * <p>A node records the span it covers in the shared {@link SourceText}, its child
 * nodes in match order, the expression that produced it and the accessor bundle
 * attached to that expression. Nodes produced through a rule reference are
 * tagged with the rule name and are otherwise transparent: same span, same
 * elements as the node the rule body produced.
 */
public final class SyntaxNode {
    private final SourceText source;
    private final int start;
    private final int end;
    private final List<SyntaxNode> elements;
    private final Expression expression;
    private final Expression matchedExpression;
    private final String rule;
    private final Accessors accessors;

    private SyntaxNode(SourceText source,
                       int start,
                       int end,
                       List<SyntaxNode> elements,
                       Expression expression,
                       Expression matchedExpression,
                       String rule,
                       Accessors accessors) {
        if (start < 0 || end < start || end > source.length()) {
            throw new IllegalArgumentException("Invalid node range [" + start + ", " + end + ") for input of length "
                                               + source.length());
        }
        this.source = source;
        this.start = start;
        this.end = end;
        this.elements = elements;
        this.expression = expression;
        this.matchedExpression = matchedExpression;
        this.rule = rule;
        this.accessors = accessors;
    }

    /**
     * Leaf node without children.
     */
    public static SyntaxNode leaf(SourceText source, int start, int end, Expression expression) {
        return new SyntaxNode(source, start, end, List.of(), expression, expression, "", expression.accessors());
    }

    /**
     * Interior node over the given children.
     */
    public static SyntaxNode branch(SourceText source,
                                    int start,
                                    int end,
                                    List<SyntaxNode> elements,
                                    Expression expression) {
        return new SyntaxNode(source, start, end, List.copyOf(elements), expression, expression, "",
                              expression.accessors());
    }

    /**
     * Wrap a node produced by a rule body into a node tagged with the rule name.
     * Rule-level accessors override the ones carried by the inner node, and accessors
     * attached to the referencing expression override both.
     */
    public static SyntaxNode ruleNode(SyntaxNode inner, Expression reference, String rule, Accessors ruleAccessors) {
        var merged = inner.accessors.overriddenBy(ruleAccessors)
                                    .overriddenBy(reference.accessors());
        return new SyntaxNode(inner.source, inner.start, inner.end, inner.elements, reference,
                              inner.matchedExpression, rule, merged);
    }

    /**
     * Same node with {@code fallback} mixed in underneath its own accessors.
     */
    public SyntaxNode withFallbackAccessors(Accessors fallback) {
        if (fallback.isEmpty()) {
            return this;
        }
        return new SyntaxNode(source, start, end, elements, expression, matchedExpression, rule,
                              fallback.overriddenBy(accessors));
    }

    // === Base accessors ===

    public SourceText source() {
        return source;
    }

    public int startOffset() {
        return start;
    }

    public int endOffset() {
        return end;
    }

    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    /**
     * The input text covered by this node.
     */
    public String textValue() {
        return source.substring(start, end);
    }

    public SourceSpan span() {
        return source.span(start, end);
    }

    public List<SyntaxNode> elements() {
        return elements;
    }

    public SyntaxNode element(int index) {
        if (index < 0 || index >= elements.size()) {
            throw new IndexOutOfBoundsException("Node '" + textValue() + "' has " + elements.size()
                                                + " elements, requested #" + index);
        }
        return elements.get(index);
    }

    public boolean isTerminal() {
        return elements.isEmpty();
    }

    /**
     * Name of the rule that produced this node, empty for anonymous nodes.
     */
    public String rule() {
        return rule;
    }

    public boolean hasRule() {
        return !rule.isEmpty();
    }

    /**
     * The expression instance that produced this node.
     */
    public Expression expression() {
        return expression;
    }

    /**
     * The expression that matched this node's content. Same as {@link #expression()}
     * except for rule nodes, where it is looked up through the rule body, so for a
     * rule whose body is a choice it is the winning alternative.
     */
    public Expression matchedExpression() {
        return matchedExpression;
    }

    /**
     * Parse the node text as integer.
     */
    public int toInt() {
        return Integer.parseInt(textValue().trim());
    }

    /**
     * Parse the node text as long.
     */
    public long toLong() {
        return Long.parseLong(textValue().trim());
    }

    // === Attached accessors ===

    public Accessors accessors() {
        return accessors;
    }

    public boolean has(String accessorName) {
        return accessors.defines(accessorName);
    }

    public Set<String> accessorNames() {
        return accessors.names();
    }

    /**
     * Evaluate an attached accessor.
     *
     * <p>Note: the result is cast unchecked to the type expected at the call site,
     * the same way child values are handed to actions. Use {@link #get(String, Class)}
     * for a checked variant.
     *
     * @throws NoSuchAccessorException if no attached bundle defines the accessor
     * @throws AccessorException       if the accessor itself fails
     */
    @SuppressWarnings("unchecked")
    public <T> T get(String accessorName) {
        var accessor = accessors.lookup(accessorName)
                                .orElseThrow(() -> new NoSuchAccessorException(accessorName, span(), accessors.names()));
        try {
            return (T) accessor.compute(this);
        } catch (AccessorException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AccessorException(accessorName, span(), e);
        }
    }

    /**
     * Evaluate an attached accessor with type checking.
     * Returns an empty Optional if the accessor is not defined, yields null or
     * yields a value of another type.
     */
    public <T> Optional<T> get(String accessorName, Class<T> type) {
        Objects.requireNonNull(type, "type");
        if (!has(accessorName)) {
            return Optional.empty();
        }
        Object value = get(accessorName);
        return type.isInstance(value)
               ? Optional.of(type.cast(value))
               : Optional.empty();
    }

    @Override
    public String toString() {
        var label = hasRule() ? rule : expression.describe();
        return label + "[" + start + ", " + end + ")'" + textValue() + "'";
    }
}
