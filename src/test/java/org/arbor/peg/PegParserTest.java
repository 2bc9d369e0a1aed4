package org.arbor.peg;

import org.arbor.peg.error.GrammarError;
import org.arbor.peg.error.GrammarException;
import org.arbor.peg.grammar.Grammar;
import org.arbor.peg.parser.ParserConfig;
import org.junit.jupiter.api.Test;

import static org.arbor.peg.grammar.Expression.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class PegParserTest {

    private static Grammar grammar() {
        return Grammar.create()
                      .declareRule("number", oneOrMore(charClass("0-9")))
                      .declareRule("word", oneOrMore(charClass("a-z")));
    }

    @Test
    void fromGrammar_usesDefaultConfig() {
        var parser = PegParser.fromGrammar(grammar());

        assertEquals(ParserConfig.DEFAULT, parser.config());
        assertEquals("number", parser.startRule().name());
        assertTrue(parser.parse("123").isSuccess());
    }

    @Test
    void builder_appliesSettings() {
        var parser = PegParser.builder(grammar())
                              .startRule("word")
                              .packrat(false)
                              .maxDepth(64)
                              .build();

        assertEquals(new ParserConfig(false, 64), parser.config());
        assertEquals("word", parser.startRule().name());
        assertTrue(parser.parse("abc").isSuccess());
        assertTrue(parser.parse("123").isFailure());
    }

    @Test
    void builder_unknownStartRule_isRejected() {
        var builder = PegParser.builder(grammar()).startRule("missing");

        var ex = assertThrows(GrammarException.class, builder::build);
        assertEquals(new GrammarError.UndefinedRule("missing"), ex.error());
    }

    @Test
    void builder_negativeDepth_isRejected() {
        var builder = PegParser.builder(grammar()).maxDepth(-1);

        assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Test
    void parser_isReusableAcrossInputs() {
        var parser = PegParser.fromGrammar(Grammar.create().declareRule("foo", terminal("foo")));

        assertThat(parser.parse("bar").isFailure()).isTrue();
        assertThat(parser.parse("foo").isSuccess()).isTrue();
    }
}
