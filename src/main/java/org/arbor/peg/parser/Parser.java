package org.arbor.peg.parser;

import org.arbor.peg.grammar.Grammar;
import org.arbor.peg.grammar.Rule;

/**
 * Parser interface - parses input text according to a grammar, starting at one rule.
 *
 * <p>The whole input must be consumed for a parse to succeed. Every call works on
 * its own parsing context, so one parser may be used repeatedly and from several
 * threads at once.
 */
public interface Parser {

    /**
     * Parse input and return the root node or the furthest failure.
     */
    ParseResult parse(String input);

    Grammar grammar();

    Rule startRule();

    ParserConfig config();
}
