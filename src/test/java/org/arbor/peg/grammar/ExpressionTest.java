package org.arbor.peg.grammar;

import org.arbor.peg.action.Accessors;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.arbor.peg.grammar.Expression.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ExpressionTest {

    // === Character classes ===

    @Test
    void charClass_range_matchesInclusive() {
        var digits = charClass("0-9");

        assertTrue(digits.matches('0'));
        assertTrue(digits.matches('9'));
        assertFalse(digits.matches('a'));
    }

    @Test
    void charClass_multipleRangesAndSingles() {
        var ident = charClass("a-zA-Z_");

        assertTrue(ident.matches('q'));
        assertTrue(ident.matches('Q'));
        assertTrue(ident.matches('_'));
        assertFalse(ident.matches('1'));
    }

    @Test
    void charClass_escapes() {
        var whitespace = charClass(" \\t\\n\\r");
        var dash = charClass("a\\-z");

        assertTrue(whitespace.matches('\n'));
        assertTrue(whitespace.matches('\t'));
        assertTrue(dash.matches('-'));
        assertTrue(dash.matches('z'));
        assertFalse(dash.matches('b'));
    }

    @Test
    void notCharClass_negates() {
        var notQuote = notCharClass("\"");

        assertTrue(notQuote.matches('a'));
        assertFalse(notQuote.matches('"'));
        assertEquals("[^\"]", notQuote.describe());
    }

    // === Construction ===

    @Test
    void sequence_empty_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> sequence(List.of()));
        assertThrows(IllegalArgumentException.class, () -> choice(List.of()));
    }

    @Test
    void sequence_copiesElements() {
        var elements = new ArrayList<Expression>(List.of(terminal("a")));
        var sequence = sequence(elements);
        elements.add(terminal("b"));

        assertEquals(1, sequence.elements().size());
    }

    @Test
    void extend_returnsNewInstanceWithAccessors() {
        var plain = terminal("x");
        var bundle = Accessors.named("X").define("value", node -> 1);

        var extended = plain.extend(bundle);

        assertNotSame(plain, extended);
        assertTrue(plain.accessors().isEmpty());
        assertTrue(extended.accessors().defines("value"));
    }

    @Test
    void extend_laterBundlesWin() {
        var first = Accessors.named("First").define("value", node -> 1).define("kind", node -> "first");
        var second = Accessors.named("Second").define("value", node -> 2);

        var extended = terminal("x").extend(first, second);

        assertThat(extended.accessors().names()).containsExactlyInAnyOrder("value", "kind");
        assertEquals(2, extended.accessors().lookup("value").orElseThrow().compute(null));
    }

    @Test
    void describe_readsLikeGrammarNotation() {
        assertEquals("'a'", terminal("a").describe());
        assertEquals("'a'*", zeroOrMore(terminal("a")).describe());
        assertEquals("[0-9]+", oneOrMore(charClass("0-9")).describe());
        assertEquals("any character?", optional(any()).describe());
        assertEquals("&'a'", and(terminal("a")).describe());
    }
}
