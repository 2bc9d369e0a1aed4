package org.arbor.peg.error;

/**
 * Grammar definition faults. These are programming errors in the grammar, not
 * properties of the input, and are raised as {@link GrammarException}.
 */
public sealed interface GrammarError {
    String message();

    /**
     * Reference to a rule that was never declared.
     */
    record UndefinedRule(String ruleName) implements GrammarError {
        @Override
        public String message() {
            return "Undefined rule reference: '" + ruleName + "'";
        }
    }

    /**
     * Second declaration of an already declared rule.
     */
    record DuplicateRule(String ruleName) implements GrammarError {
        @Override
        public String message() {
            return "Rule '" + ruleName + "' is already declared";
        }
    }

    /**
     * Rule invoked again at the same position before its first invocation completed.
     */
    record LeftRecursion(String ruleName, int position) implements GrammarError {
        @Override
        public String message() {
            return "Left recursion in rule '" + ruleName + "' at offset " + position;
        }
    }

    /**
     * Grammar without rules, so no start rule can be chosen.
     */
    record NoStartRule() implements GrammarError {
        @Override
        public String message() {
            return "No start rule defined in grammar";
        }
    }

    /**
     * Matching nested deeper than the configured limit.
     */
    record DepthExceeded(int maxDepth, int position) implements GrammarError {
        @Override
        public String message() {
            return "Maximum matching depth " + maxDepth + " exceeded at offset " + position;
        }
    }
}
