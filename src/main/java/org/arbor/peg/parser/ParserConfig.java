package org.arbor.peg.parser;

/**
 * Parser configuration options.
 *
 * @param packratEnabled memoize match outcomes per (expression, position) within one parse
 * @param maxDepth       maximum nesting of expression matches, {@code 0} for no limit
 */
public record ParserConfig(
    boolean packratEnabled,
    int maxDepth
) {
    public static final ParserConfig DEFAULT = new ParserConfig(
        true,
        0
    );

    public ParserConfig {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must not be negative: " + maxDepth);
        }
    }

    public ParserConfig withPackrat(boolean enabled) {
        return new ParserConfig(enabled, maxDepth);
    }

    public ParserConfig withMaxDepth(int depth) {
        return new ParserConfig(packratEnabled, depth);
    }

    public boolean hasDepthLimit() {
        return maxDepth > 0;
    }
}
