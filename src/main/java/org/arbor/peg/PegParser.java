package org.arbor.peg;

import org.arbor.peg.error.GrammarException;
import org.arbor.peg.grammar.Grammar;
import org.arbor.peg.parser.Parser;
import org.arbor.peg.parser.ParserConfig;

import java.util.Objects;

/**
 * Entry point for creating PEG parsers.
 *
 * <p>Example usage:
 * <pre>{@code
 * var grammar = Grammar.create()
 *     .declareRule("number", oneOrMore(charClass("0-9")));
 *
 * var parser = PegParser.builder(grammar)
 *     .packrat(true)
 *     .build();
 *
 * var result = parser.parse("123");
 * }</pre>
 */
public final class PegParser {
    private PegParser() {}

    /**
     * Create a parser for the grammar's effective start rule.
     *
     * @throws GrammarException if the grammar is empty or references undeclared rules
     */
    public static Parser fromGrammar(Grammar grammar) {
        return fromGrammar(grammar, ParserConfig.DEFAULT);
    }

    /**
     * Create a parser for the grammar's effective start rule with custom configuration.
     */
    public static Parser fromGrammar(Grammar grammar, ParserConfig config) {
        return grammar.newParser(config);
    }

    /**
     * Create a builder for more complex parser configuration.
     */
    public static Builder builder(Grammar grammar) {
        return new Builder(grammar);
    }

    public static final class Builder {
        private final Grammar grammar;
        private String startRule;
        private boolean packratEnabled = true;
        private int maxDepth = 0;

        private Builder(Grammar grammar) {
            this.grammar = Objects.requireNonNull(grammar, "grammar");
        }

        public Builder startRule(String name) {
            this.startRule = name;
            return this;
        }

        public Builder packrat(boolean enabled) {
            this.packratEnabled = enabled;
            return this;
        }

        public Builder maxDepth(int depth) {
            this.maxDepth = depth;
            return this;
        }

        public Parser build() {
            var config = new ParserConfig(packratEnabled, maxDepth);
            return startRule == null
                   ? fromGrammar(grammar, config)
                   : grammar.newParser(startRule, config);
        }
    }
}
