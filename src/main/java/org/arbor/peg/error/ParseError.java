package org.arbor.peg.error;

import org.arbor.peg.tree.SourceLocation;

/**
 * Description of a failed parse: where the input diverged from every grammar path
 * and what was expected there.
 */
public sealed interface ParseError {
    SourceLocation location();

    String expected();

    String message();

    /**
     * Unexpected input error.
     */
    record UnexpectedInput(
    SourceLocation location,
    String found,
    String expected) implements ParseError {
        @Override
        public String message() {
            return "Unexpected '" + found + "' at " + location + ", expected " + expected;
        }
    }

    /**
     * Unexpected end of input.
     */
    record UnexpectedEof(
    SourceLocation location,
    String expected) implements ParseError {
        @Override
        public String message() {
            return "Unexpected end of input at " + location + ", expected " + expected;
        }
    }
}
