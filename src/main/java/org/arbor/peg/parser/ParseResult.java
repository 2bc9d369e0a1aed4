package org.arbor.peg.parser;

import org.arbor.peg.error.ParseError;
import org.arbor.peg.grammar.Expression;
import org.arbor.peg.tree.SourceLocation;
import org.arbor.peg.tree.SyntaxNode;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.Function;

/**
 * Outcome of a whole-input parse: the root node, or the furthest failure reached.
 * A failed parse is an ordinary value, never an exception.
 */
public sealed interface ParseResult {

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * Root node of a successful parse.
     *
     * @throws IllegalStateException if the parse failed
     */
    SyntaxNode unwrap();

    <R> R fold(Function<Failure, R> onFailure, Function<SyntaxNode, R> onSuccess);

    /**
     * Successful parse; the root node covers the whole input.
     *
     * @param node            root node
     * @param furthestFailure furthest offset at which any attempt failed, if any did
     */
    record Success(SyntaxNode node, OptionalInt furthestFailure) implements ParseResult {

        public Success {
            Objects.requireNonNull(node, "node");
            Objects.requireNonNull(furthestFailure, "furthestFailure");
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public SyntaxNode unwrap() {
            return node;
        }

        @Override
        public <R> R fold(Function<Failure, R> onFailure, Function<SyntaxNode, R> onSuccess) {
            return onSuccess.apply(node);
        }
    }

    /**
     * Failed parse.
     *
     * @param position         furthest offset reached by any failed attempt
     * @param error            description of the failure at that offset
     * @param failedExpression first expression that failed at that offset, if known
     */
    record Failure(int position, ParseError error, Optional<Expression> failedExpression) implements ParseResult {

        public Failure {
            Objects.requireNonNull(error, "error");
            Objects.requireNonNull(failedExpression, "failedExpression");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public SyntaxNode unwrap() {
            throw new IllegalStateException("Parse failed: " + error.message());
        }

        @Override
        public <R> R fold(Function<Failure, R> onFailure, Function<SyntaxNode, R> onSuccess) {
            return onFailure.apply(this);
        }

        public SourceLocation location() {
            return error.location();
        }

        public String expected() {
            return error.expected();
        }

        public String message() {
            return error.message();
        }
    }
}
