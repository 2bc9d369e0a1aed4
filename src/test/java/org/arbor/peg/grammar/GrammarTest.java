package org.arbor.peg.grammar;

import org.arbor.peg.error.GrammarError;
import org.arbor.peg.error.GrammarException;
import org.junit.jupiter.api.Test;

import static org.arbor.peg.grammar.Expression.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class GrammarTest {

    @Test
    void nonterminal_sameName_returnsSameInstance() {
        var grammar = Grammar.create();

        assertSame(grammar.nonterminal("expr"), grammar.nonterminal("expr"));
    }

    @Test
    void declareRule_duplicate_isRejected() {
        var grammar = Grammar.create().declareRule("a", terminal("a"));

        var ex = assertThrows(GrammarException.class, () -> grammar.declareRule("a", terminal("b")));
        assertEquals(new GrammarError.DuplicateRule("a"), ex.error());
        assertEquals("'a'", grammar.resolve("a").describe());
    }

    @Test
    void declareRule_foreignNonterminal_isRejected() {
        var other = Grammar.create().nonterminal("x");

        assertThrows(IllegalArgumentException.class, () -> Grammar.create().declareRule(other, terminal("x")));
    }

    @Test
    void rules_keepDeclarationOrder() {
        var grammar = Grammar.create()
                             .declareRule("b", terminal("b"))
                             .declareRule("a", terminal("a"));

        assertThat(grammar.rules()).extracting(Rule::name).containsExactly("b", "a");
        assertEquals("Grammar[b, a]", grammar.toString());
    }

    @Test
    void startRule_defaultsToFirstDeclared() {
        var grammar = Grammar.create()
                             .declareRule("first", terminal("1"))
                             .declareRule("second", terminal("2"));

        assertEquals("first", grammar.newParser().startRule().name());
    }

    @Test
    void startRule_explicitChoice_isUsed() {
        var grammar = Grammar.create()
                             .declareRule("first", terminal("1"))
                             .declareRule("second", terminal("2"))
                             .startRule("second");

        var parser = grammar.newParser();

        assertEquals("second", parser.startRule().name());
        assertTrue(parser.parse("2").isSuccess());
    }

    @Test
    void startRule_undeclared_isRejected() {
        var grammar = Grammar.create()
                             .declareRule("first", terminal("1"))
                             .startRule("missing");

        var ex = assertThrows(GrammarException.class, grammar::newParser);
        assertEquals(new GrammarError.UndefinedRule("missing"), ex.error());
    }

    @Test
    void newParser_emptyGrammar_isRejected() {
        var ex = assertThrows(GrammarException.class, () -> Grammar.create().newParser());

        assertThat(ex.error()).isInstanceOf(GrammarError.NoStartRule.class);
    }

    @Test
    void newParser_undefinedReference_isRejected() {
        var grammar = Grammar.create();
        grammar.declareRule("start", sequence(terminal("a"), grammar.nonterminal("missing")));

        var ex = assertThrows(GrammarException.class, grammar::newParser);
        assertEquals(new GrammarError.UndefinedRule("missing"), ex.error());
        assertFalse(grammar.isFrozen());
    }

    @Test
    void resolve_undeclared_throws() {
        var ex = assertThrows(GrammarException.class, () -> Grammar.create().resolve("nope"));

        assertEquals("Undefined rule reference: 'nope'", ex.getMessage());
    }

    @Test
    void newParser_freezesGrammar() {
        var grammar = Grammar.create();
        var start = grammar.nonterminal("start");
        grammar.declareRule(start, terminal("s"));
        grammar.newParser();

        assertTrue(grammar.isFrozen());
        assertThrows(IllegalStateException.class, () -> grammar.declareRule("other", terminal("o")));
        assertThrows(IllegalStateException.class, () -> grammar.startRule("start"));
        assertThrows(IllegalStateException.class, () -> grammar.nonterminal("fresh"));
        assertSame(start, grammar.nonterminal("start"));
    }

    @Test
    void newParser_frozenGrammar_canCreateMoreParsers() {
        var grammar = Grammar.create()
                             .declareRule("a", terminal("a"))
                             .declareRule("b", terminal("b"));
        grammar.newParser();

        assertTrue(grammar.newParser("b").parse("b").isSuccess());
    }
}
