package org.arbor.peg.parser;

import org.arbor.peg.tree.SyntaxNode;

/**
 * Result of matching one expression - either success with a node or failure.
 */
public sealed interface MatchResult {

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * Successful match with the produced node and the cursor after it.
     */
    record Matched(SyntaxNode node, InputCursor end) implements MatchResult {

        @Override
        public boolean isSuccess() {
            return true;
        }

        public static Matched of(SyntaxNode node, InputCursor end) {
            return new Matched(node, end);
        }
    }

    /**
     * Failed match - carries only the furthest offset reached during the attempt.
     */
    record Failed(int position, String expected) implements MatchResult {

        @Override
        public boolean isSuccess() {
            return false;
        }

        public static Failed at(int position, String expected) {
            return new Failed(position, expected);
        }

        /**
         * The failure that reached further; ties keep this one.
         */
        public Failed furthest(Failed other) {
            return other.position > position ? other : this;
        }
    }
}
