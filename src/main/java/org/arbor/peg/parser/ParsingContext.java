package org.arbor.peg.parser;

import org.arbor.peg.error.GrammarError;
import org.arbor.peg.error.GrammarException;
import org.arbor.peg.grammar.Expression;
import org.arbor.peg.tree.SourceText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Mutable state of one parse call: packrat cache, furthest failure, rule
 * invocations in progress and nesting depth. Never shared between calls.
 */
public final class ParsingContext {
    private static final Logger log = LoggerFactory.getLogger(ParsingContext.class);

    private final SourceText source;
    private final ParserConfig config;
    private final Map<Long, MatchResult> packratCache;
    private final Map<Expression, Integer> expressionIds;
    private final Map<String, Integer> ruleIds;
    private final Set<Long> activeRules;

    private int furthestPos;
    private final Set<String> furthestExpected;
    private Expression furthestExpression;
    private int predicateDepth;
    private int depth;
    private int cacheHits;
    private int cacheMisses;

    private ParsingContext(SourceText source, ParserConfig config) {
        this.source = source;
        this.config = config;
        this.packratCache = config.packratEnabled() ? new HashMap<>() : null;
        this.expressionIds = config.packratEnabled() ? new IdentityHashMap<>() : null;
        this.ruleIds = new HashMap<>();
        this.activeRules = new HashSet<>();
        this.furthestPos = -1;
        this.furthestExpected = new LinkedHashSet<>();
    }

    public static ParsingContext create(SourceText source, ParserConfig config) {
        return new ParsingContext(source, config);
    }

    public SourceText source() {
        return source;
    }

    // === Error Tracking ===

    /**
     * Fold a failed attempt into the furthest-failure tracker. Failures inside
     * lookahead predicates are expected outcomes and are not tracked.
     */
    public void updateFurthest(MatchResult.Failed failed, Expression expression) {
        if (predicateDepth > 0) {
            return;
        }
        if (failed.position() > furthestPos) {
            furthestPos = failed.position();
            furthestExpected.clear();
            furthestExpected.add(failed.expected());
            furthestExpression = expression;
        } else if (failed.position() == furthestPos) {
            furthestExpected.add(failed.expected());
        }
    }

    public boolean hasFailure() {
        return furthestPos >= 0;
    }

    public int furthestPos() {
        return furthestPos;
    }

    public String furthestExpected() {
        return String.join(" or ", furthestExpected);
    }

    public Optional<Expression> furthestExpression() {
        return Optional.ofNullable(furthestExpression);
    }

    // === Predicates ===

    public void enterPredicate() {
        predicateDepth++;
    }

    public void exitPredicate() {
        predicateDepth--;
    }

    public boolean inPredicate() {
        return predicateDepth > 0;
    }

    // === Rule invocations ===

    /**
     * Mark rule {@code name} as being matched at {@code position}.
     *
     * @throws GrammarException if the rule is already being matched at that position (left recursion)
     */
    public void enterRule(String name, int position) {
        if (!activeRules.add(ruleKey(name, position))) {
            log.warn("Rule '{}' re-entered at offset {} before completing", name, position);
            throw new GrammarException(new GrammarError.LeftRecursion(name, position));
        }
    }

    public void exitRule(String name, int position) {
        activeRules.remove(ruleKey(name, position));
    }

    private long ruleKey(String name, int position) {
        int ruleId = ruleIds.computeIfAbsent(name, k -> ruleIds.size());
        return ((long) ruleId << 32) | (position & 0xFFFFFFFFL);
    }

    // === Depth ===

    /**
     * Enter one more level of nested matching.
     *
     * @throws GrammarException if the configured maximum depth is exceeded
     */
    public void enterDepth(int position) {
        depth++;
        if (config.hasDepthLimit() && depth > config.maxDepth()) {
            log.warn("Matching depth {} exceeded at offset {}", config.maxDepth(), position);
            throw new GrammarException(new GrammarError.DepthExceeded(config.maxDepth(), position));
        }
    }

    public void exitDepth() {
        depth--;
    }

    // === Packrat Cache ===

    public Optional<MatchResult> getCachedAt(Expression expression, int position) {
        if (packratCache == null) {
            return Optional.empty();
        }
        var cached = packratCache.get(packratKey(expression, position));
        if (cached == null) {
            cacheMisses++;
        } else {
            cacheHits++;
        }
        return Optional.ofNullable(cached);
    }

    public void cacheAt(Expression expression, int position, MatchResult result) {
        if (packratCache != null) {
            packratCache.put(packratKey(expression, position), result);
        }
    }

    private long packratKey(Expression expression, int position) {
        int id = expressionIds.computeIfAbsent(expression, k -> expressionIds.size());
        return ((long) id << 32) | (position & 0xFFFFFFFFL);
    }

    public int cacheHits() {
        return cacheHits;
    }

    public int cacheMisses() {
        return cacheMisses;
    }

    public int cacheSize() {
        return packratCache == null ? 0 : packratCache.size();
    }
}
