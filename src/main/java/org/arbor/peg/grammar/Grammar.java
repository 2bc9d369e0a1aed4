package org.arbor.peg.grammar;

import org.arbor.peg.action.Accessors;
import org.arbor.peg.error.GrammarError;
import org.arbor.peg.error.GrammarException;
import org.arbor.peg.parser.Parser;
import org.arbor.peg.parser.ParserConfig;
import org.arbor.peg.parser.PegEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A PEG grammar - the named rule set plus the nonterminal placeholders referring to it.
 *
 * <p>Grammars are built incrementally. {@link #nonterminal(String)} hands out one
 * reusable placeholder per name, so rules can reference each other before their
 * bodies are declared. Declaring the same rule twice is rejected. The first
 * declared rule is the start rule unless another one is chosen with
 * {@link #startRule(String)}.
 *
 * <p>Creating a parser validates and freezes the grammar: any further declaration
 * throws {@link IllegalStateException}. A frozen grammar is read-only and may be
 * shared between threads; building one is not thread-safe.
 *
 * <pre>{@code
 * var grammar = Grammar.create();
 * var list = grammar.nonterminal("list");
 * var item = grammar.nonterminal("item");
 * grammar.declareRule(list, sequence(item, zeroOrMore(sequence(terminal(","), item))));
 * grammar.declareRule(item, charClass("a-z"));
 * var parser = grammar.newParser();
 * }</pre>
 */
public final class Grammar {
    private static final Logger log = LoggerFactory.getLogger(Grammar.class);

    private final Map<String, Expression.Nonterminal> nonterminals = new LinkedHashMap<>();
    private final Map<String, Rule> rules = new LinkedHashMap<>();
    private String startRule;
    private volatile boolean frozen;

    private Grammar() {}

    public static Grammar create() {
        return new Grammar();
    }

    // === Declaration ===

    /**
     * Get the placeholder referring to rule {@code name}, creating it if absent.
     */
    public Expression.Nonterminal nonterminal(String name) {
        Objects.requireNonNull(name, "name");
        var existing = nonterminals.get(name);
        if (existing != null) {
            return existing;
        }
        ensureMutable();
        var created = new Expression.Nonterminal(name, this, Accessors.none());
        nonterminals.put(name, created);
        return created;
    }

    /**
     * Declare rule {@code name} with the given body.
     *
     * @throws GrammarException if the rule is already declared
     */
    public Grammar declareRule(String name, Expression body) {
        return declareRule(name, body, Accessors.none());
    }

    /**
     * Declare rule {@code name} with rule-level accessors applied to every node the rule produces.
     *
     * @throws GrammarException if the rule is already declared
     */
    public Grammar declareRule(String name, Expression body, Accessors... ruleAccessors) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(body, "body");
        ensureMutable();
        if (rules.containsKey(name)) {
            throw new GrammarException(new GrammarError.DuplicateRule(name));
        }
        var merged = Accessors.none();
        for (var bundle : ruleAccessors) {
            merged = merged.overriddenBy(bundle);
        }
        nonterminal(name);
        rules.put(name, new Rule(name, body, merged));
        log.debug("Declared rule '{}' ({} rules)", name, rules.size());
        return this;
    }

    /**
     * Declare the rule a placeholder of this grammar refers to.
     */
    public Grammar declareRule(Expression.Nonterminal nonterminal, Expression body) {
        if (nonterminal.grammar() != this) {
            throw new IllegalArgumentException("Nonterminal '" + nonterminal.name() + "' belongs to another grammar");
        }
        return declareRule(nonterminal.name(), body);
    }

    /**
     * Choose the start rule explicitly instead of the first declared one.
     */
    public Grammar startRule(String name) {
        Objects.requireNonNull(name, "name");
        ensureMutable();
        this.startRule = name;
        return this;
    }

    // === Lookup ===

    /**
     * Get rule by name.
     */
    public Optional<Rule> rule(String name) {
        return Optional.ofNullable(rules.get(name));
    }

    /**
     * All rules in declaration order.
     */
    public List<Rule> rules() {
        return List.copyOf(rules.values());
    }

    /**
     * Get the effective start rule (first rule if not explicitly specified).
     */
    public Optional<Rule> effectiveStartRule() {
        if (startRule != null) {
            return rule(startRule);
        }
        return rules.values()
                    .stream()
                    .findFirst();
    }

    /**
     * Resolve a rule for matching.
     *
     * @throws GrammarException if the rule was never declared
     */
    public Rule resolveRule(String name) {
        var rule = rules.get(name);
        if (rule == null) {
            throw new GrammarException(new GrammarError.UndefinedRule(name));
        }
        return rule;
    }

    /**
     * Resolve a rule body for matching.
     *
     * @throws GrammarException if the rule was never declared
     */
    public Expression resolve(String name) {
        return resolveRule(name).expression();
    }

    public boolean isFrozen() {
        return frozen;
    }

    // === Validation ===

    /**
     * Validate the grammar for undefined references.
     *
     * @throws GrammarException describing the first undefined reference
     */
    public Grammar validate() {
        var finder = new UndefinedReferenceFinder();
        for (var rule : rules.values()) {
            var undefined = rule.expression()
                                .accept(finder);
            if (undefined.isPresent()) {
                throw new GrammarException(new GrammarError.UndefinedRule(undefined.get()
                                                                                   .name()));
            }
        }
        return this;
    }

    // === Parser creation ===

    /**
     * Create a parser starting at the effective start rule.
     */
    public Parser newParser() {
        return newParser(ParserConfig.DEFAULT);
    }

    /**
     * Create a parser starting at the effective start rule with custom configuration.
     */
    public Parser newParser(ParserConfig config) {
        var start = effectiveStartRule();
        if (start.isEmpty()) {
            throw new GrammarException(rules.isEmpty()
                                       ? new GrammarError.NoStartRule()
                                       : new GrammarError.UndefinedRule(startRule));
        }
        return newParser(start.get()
                              .name(), config);
    }

    /**
     * Create a parser starting at the given rule.
     */
    public Parser newParser(String startRuleName) {
        return newParser(startRuleName, ParserConfig.DEFAULT);
    }

    /**
     * Create a parser starting at the given rule with custom configuration.
     */
    public Parser newParser(String startRuleName, ParserConfig config) {
        Objects.requireNonNull(config, "config");
        var start = resolveRule(startRuleName);
        validate();
        if (!frozen) {
            frozen = true;
            log.debug("Grammar frozen with {} rules", rules.size());
        }
        return PegEngine.create(this, start, config);
    }

    private void ensureMutable() {
        if (frozen) {
            throw new IllegalStateException("Grammar is frozen: a parser has already been created from it");
        }
    }

    @Override
    public String toString() {
        return "Grammar" + new ArrayList<>(rules.keySet());
    }

    /**
     * Finds the first reference to an undeclared rule. References are checked by
     * name and never followed, so the walk terminates on recursive grammars.
     */
    private static final class UndefinedReferenceFinder implements Expression.Visitor<Optional<Expression.Nonterminal>> {
        @Override
        public Optional<Expression.Nonterminal> visitTerminal(Expression.Terminal terminal) {
            return Optional.empty();
        }

        @Override
        public Optional<Expression.Nonterminal> visitCharClass(Expression.CharClass charClass) {
            return Optional.empty();
        }

        @Override
        public Optional<Expression.Nonterminal> visitAnyChar(Expression.AnyChar anyChar) {
            return Optional.empty();
        }

        @Override
        public Optional<Expression.Nonterminal> visitNonterminal(Expression.Nonterminal nonterminal) {
            return nonterminal.grammar()
                              .rule(nonterminal.name())
                              .isPresent()
                   ? Optional.empty()
                   : Optional.of(nonterminal);
        }

        @Override
        public Optional<Expression.Nonterminal> visitSequence(Expression.Sequence sequence) {
            return firstUndefined(sequence.elements());
        }

        @Override
        public Optional<Expression.Nonterminal> visitChoice(Expression.Choice choice) {
            return firstUndefined(choice.alternatives());
        }

        @Override
        public Optional<Expression.Nonterminal> visitZeroOrMore(Expression.ZeroOrMore zeroOrMore) {
            return zeroOrMore.expression()
                             .accept(this);
        }

        @Override
        public Optional<Expression.Nonterminal> visitOneOrMore(Expression.OneOrMore oneOrMore) {
            return oneOrMore.expression()
                            .accept(this);
        }

        @Override
        public Optional<Expression.Nonterminal> visitOptional(Expression.Optional optional) {
            return optional.expression()
                           .accept(this);
        }

        @Override
        public Optional<Expression.Nonterminal> visitAnd(Expression.And and) {
            return and.expression()
                      .accept(this);
        }

        @Override
        public Optional<Expression.Nonterminal> visitNot(Expression.Not not) {
            return not.expression()
                      .accept(this);
        }

        private Optional<Expression.Nonterminal> firstUndefined(List<Expression> expressions) {
            return expressions.stream()
                              .map(e -> e.accept(this))
                              .filter(Optional::isPresent)
                              .findFirst()
                              .orElse(Optional.empty());
        }
    }
}
