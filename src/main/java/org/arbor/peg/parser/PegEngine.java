package org.arbor.peg.parser;

import org.arbor.peg.error.ParseError;
import org.arbor.peg.grammar.Expression;
import org.arbor.peg.grammar.Grammar;
import org.arbor.peg.grammar.Rule;
import org.arbor.peg.tree.SourceText;
import org.arbor.peg.tree.SyntaxNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * PEG parsing engine - matches a grammar's expressions against input text by
 * backtracking recursive descent, memoizing outcomes per (expression, position).
 *
 * <p>Matching is synchronous and depth-first. Deep nesting consumes Java stack; with
 * no depth limit configured, exhausting it surfaces as {@link StackOverflowError}.
 */
public final class PegEngine implements Parser {
    private static final Logger log = LoggerFactory.getLogger(PegEngine.class);

    private static final String END_OF_INPUT = "end of input";

    private final Grammar grammar;
    private final Rule startRule;
    private final ParserConfig config;

    private PegEngine(Grammar grammar, Rule startRule, ParserConfig config) {
        this.grammar = grammar;
        this.startRule = startRule;
        this.config = config;
    }

    /**
     * Create an engine for an already validated grammar.
     * Use {@link Grammar#newParser(String, ParserConfig)} instead, which validates and freezes the grammar first.
     */
    public static PegEngine create(Grammar grammar, Rule startRule, ParserConfig config) {
        log.debug("Created parser for start rule '{}' (packrat: {}, max depth: {})",
                  startRule.name(), config.packratEnabled(), config.maxDepth());
        return new PegEngine(Objects.requireNonNull(grammar, "grammar"),
                             Objects.requireNonNull(startRule, "startRule"),
                             Objects.requireNonNull(config, "config"));
    }

    @Override
    public ParseResult parse(String input) {
        var ctx = ParsingContext.create(SourceText.of(input), config);
        return parse(ctx);
    }

    ParseResult parse(ParsingContext ctx) {
        var source = ctx.source();
        log.debug("Parsing {} characters from rule '{}'", source.length(), startRule.name());

        var result = match(ctx, grammar.nonterminal(startRule.name()), InputCursor.start(source));

        ParseResult outcome;
        if (result instanceof MatchResult.Matched matched) {
            if (matched.end()
                       .isAtEnd()) {
                outcome = new ParseResult.Success(matched.node(), ctx.hasFailure()
                                                                 ? OptionalInt.of(ctx.furthestPos())
                                                                 : OptionalInt.empty());
            } else {
                // Full consumption is part of the parser's contract, not the expression's
                var incomplete = MatchResult.Failed.at(matched.end()
                                                              .offset(), END_OF_INPUT);
                ctx.updateFurthest(incomplete, null);
                outcome = failure(ctx, incomplete);
            }
        } else {
            outcome = failure(ctx, (MatchResult.Failed) result);
        }

        log.debug("Parse {} (cache hits: {}, misses: {}, entries: {})",
                  outcome.isSuccess() ? "succeeded" : "failed",
                  ctx.cacheHits(), ctx.cacheMisses(), ctx.cacheSize());
        return outcome;
    }

    private ParseResult failure(ParsingContext ctx, MatchResult.Failed failed) {
        var source = ctx.source();
        var position = ctx.hasFailure() ? ctx.furthestPos() : failed.position();
        var expected = ctx.hasFailure() ? ctx.furthestExpected() : failed.expected();
        var location = source.location(position);

        ParseError error = position >= source.length()
                           ? new ParseError.UnexpectedEof(location, expected)
                           : new ParseError.UnexpectedInput(location, String.valueOf(source.charAt(position)), expected);
        return new ParseResult.Failure(position, error, ctx.furthestExpression());
    }

    // === Memoized matching ===

    /**
     * Match {@code expression} at {@code cursor}, consulting and filling the packrat cache.
     */
    MatchResult match(ParsingContext ctx, Expression expression, InputCursor cursor) {
        var position = cursor.offset();
        var cached = ctx.getCachedAt(expression, position);
        if (cached.isPresent()) {
            var hit = cached.get();
            if (hit instanceof MatchResult.Failed failed) {
                ctx.updateFurthest(failed, expression);
            }
            return hit;
        }

        ctx.enterDepth(position);
        MatchResult result;
        try {
            result = expression.accept(new ExpressionMatcher(ctx, cursor));
        } finally {
            ctx.exitDepth();
        }

        // Failures inside a lookahead are not tracked, so its outcomes cannot be replayed later
        if (!ctx.inPredicate()) {
            ctx.cacheAt(expression, position, result);
        }
        if (result instanceof MatchResult.Failed failed) {
            ctx.updateFurthest(failed, expression);
        }
        return result;
    }

    @Override
    public Grammar grammar() {
        return grammar;
    }

    @Override
    public Rule startRule() {
        return startRule;
    }

    @Override
    public ParserConfig config() {
        return config;
    }

    /**
     * Matches one expression at one cursor position.
     */
    private final class ExpressionMatcher implements Expression.Visitor<MatchResult> {
        private final ParsingContext ctx;
        private final InputCursor cursor;
        private final SourceText source;

        private ExpressionMatcher(ParsingContext ctx, InputCursor cursor) {
            this.ctx = ctx;
            this.cursor = cursor;
            this.source = ctx.source();
        }

        // === Terminal Matchers ===

        @Override
        public MatchResult visitTerminal(Expression.Terminal terminal) {
            var literal = terminal.literal();
            if (!cursor.startsWith(literal)) {
                return MatchResult.Failed.at(cursor.offset(), terminal.describe());
            }
            var end = cursor.advance(literal.length());
            var node = SyntaxNode.leaf(source, cursor.offset(), end.offset(), terminal);
            return MatchResult.Matched.of(node, end);
        }

        @Override
        public MatchResult visitCharClass(Expression.CharClass charClass) {
            if (cursor.isAtEnd() || !charClass.matches(cursor.peek())) {
                return MatchResult.Failed.at(cursor.offset(), charClass.describe());
            }
            return single(charClass);
        }

        @Override
        public MatchResult visitAnyChar(Expression.AnyChar anyChar) {
            if (cursor.isAtEnd()) {
                return MatchResult.Failed.at(cursor.offset(), anyChar.describe());
            }
            return single(anyChar);
        }

        private MatchResult single(Expression expression) {
            var end = cursor.advance(1);
            return MatchResult.Matched.of(SyntaxNode.leaf(source, cursor.offset(), end.offset(), expression), end);
        }

        // === Combinator Matchers ===

        @Override
        public MatchResult visitNonterminal(Expression.Nonterminal nonterminal) {
            var rule = nonterminal.grammar()
                                  .resolveRule(nonterminal.name());
            var position = cursor.offset();

            ctx.enterRule(rule.name(), position);
            MatchResult inner;
            try {
                inner = match(ctx, rule.expression(), cursor);
            } finally {
                ctx.exitRule(rule.name(), position);
            }

            if (inner instanceof MatchResult.Matched matched) {
                var node = SyntaxNode.ruleNode(matched.node(), nonterminal, rule.name(), rule.accessors());
                return MatchResult.Matched.of(node, matched.end());
            }
            return inner;
        }

        @Override
        public MatchResult visitSequence(Expression.Sequence sequence) {
            var children = new ArrayList<SyntaxNode>(sequence.elements()
                                                             .size());
            var current = cursor;

            for (var element : sequence.elements()) {
                var result = match(ctx, element, current);
                if (result.isFailure()) {
                    // Nothing consumed: callers resume from this sequence's entry cursor
                    return result;
                }
                var matched = (MatchResult.Matched) result;
                children.add(matched.node());
                current = matched.end();
            }

            var node = SyntaxNode.branch(source, cursor.offset(), current.offset(), children, sequence);
            return MatchResult.Matched.of(node, current);
        }

        @Override
        public MatchResult visitChoice(Expression.Choice choice) {
            MatchResult.Failed furthest = null;

            for (var alternative : choice.alternatives()) {
                var result = match(ctx, alternative, cursor);
                if (result instanceof MatchResult.Matched matched) {
                    return MatchResult.Matched.of(matched.node()
                                                         .withFallbackAccessors(choice.accessors()),
                                                  matched.end());
                }
                var failed = (MatchResult.Failed) result;
                furthest = furthest == null ? failed : furthest.furthest(failed);
            }

            return furthest;
        }

        @Override
        public MatchResult visitZeroOrMore(Expression.ZeroOrMore zeroOrMore) {
            var children = new ArrayList<SyntaxNode>();
            var end = repeat(zeroOrMore.expression(), cursor, children);
            var node = SyntaxNode.branch(source, cursor.offset(), end.offset(), children, zeroOrMore);
            return MatchResult.Matched.of(node, end);
        }

        @Override
        public MatchResult visitOneOrMore(Expression.OneOrMore oneOrMore) {
            // First match is required
            var first = match(ctx, oneOrMore.expression(), cursor);
            if (first.isFailure()) {
                return first;
            }
            var matched = (MatchResult.Matched) first;
            var children = new ArrayList<SyntaxNode>();
            children.add(matched.node());

            var end = matched.end()
                             .offset() == cursor.offset()
                      ? matched.end()
                      : repeat(oneOrMore.expression(), matched.end(), children);
            var node = SyntaxNode.branch(source, cursor.offset(), end.offset(), children, oneOrMore);
            return MatchResult.Matched.of(node, end);
        }

        /**
         * Greedily match {@code expression} from {@code start}, appending nodes to {@code children}.
         * Stops at the first failure, or after a step that consumed nothing.
         */
        private InputCursor repeat(Expression expression, InputCursor start, List<SyntaxNode> children) {
            var current = start;
            while (true) {
                var result = match(ctx, expression, current);
                if (result.isFailure()) {
                    return current;
                }
                var matched = (MatchResult.Matched) result;
                children.add(matched.node());
                if (matched.end()
                           .offset() == current.offset()) {
                    return current;
                }
                current = matched.end();
            }
        }

        @Override
        public MatchResult visitOptional(Expression.Optional optional) {
            var result = match(ctx, optional.expression(), cursor);
            if (result instanceof MatchResult.Matched matched) {
                var node = SyntaxNode.branch(source, cursor.offset(), matched.end()
                                                                             .offset(),
                                             List.of(matched.node()), optional);
                return MatchResult.Matched.of(node, matched.end());
            }
            // Optional always succeeds - empty node on no match
            return MatchResult.Matched.of(SyntaxNode.leaf(source, cursor.offset(), cursor.offset(), optional), cursor);
        }

        // === Predicate Matchers ===

        @Override
        public MatchResult visitAnd(Expression.And and) {
            var result = lookahead(and.expression());
            if (result.isSuccess()) {
                return MatchResult.Matched.of(SyntaxNode.leaf(source, cursor.offset(), cursor.offset(), and), cursor);
            }
            return MatchResult.Failed.at(cursor.offset(), and.describe());
        }

        @Override
        public MatchResult visitNot(Expression.Not not) {
            var result = lookahead(not.expression());
            if (result.isSuccess()) {
                return MatchResult.Failed.at(cursor.offset(), not.describe());
            }
            return MatchResult.Matched.of(SyntaxNode.leaf(source, cursor.offset(), cursor.offset(), not), cursor);
        }

        private MatchResult lookahead(Expression expression) {
            ctx.enterPredicate();
            try {
                return match(ctx, expression, cursor);
            } finally {
                ctx.exitPredicate();
            }
        }
    }
}
