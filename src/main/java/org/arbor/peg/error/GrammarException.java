package org.arbor.peg.error;

import java.util.Objects;

/**
 * Fatal grammar definition fault. Raised at grammar construction, parser creation
 * or first use; never used to report input that does not match.
 */
public class GrammarException extends RuntimeException {
    private final GrammarError error;

    public GrammarException(GrammarError error) {
        super(Objects.requireNonNull(error, "error").message());
        this.error = error;
    }

    public GrammarError error() {
        return error;
    }
}
