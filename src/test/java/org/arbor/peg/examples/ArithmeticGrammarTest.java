package org.arbor.peg.examples;

import org.arbor.peg.PegParser;
import org.arbor.peg.error.ParseError;
import org.arbor.peg.parser.ParseResult;
import org.arbor.peg.parser.Parser;
import org.arbor.peg.tree.SyntaxNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ArithmeticGrammarTest {

    private Parser parser;

    @BeforeEach
    void setUp() {
        parser = PegParser.fromGrammar(ArithmeticGrammar.create());
    }

    // === Recognition ===

    @ParameterizedTest
    @ValueSource(strings = {"5", "5346", "0", "(53)", "45*4", "45+4", "((34*10)+(44*(6*(67+(5)))))"})
    void parse_wellFormedExpression_succeeds(String input) {
        var result = parser.parse(input);

        assertTrue(result.isSuccess(), () -> "Failed on " + input + ": " + result);
        assertEquals(input, result.unwrap().textValue());
    }

    @ParameterizedTest
    @ValueSource(strings = {"05346", "05346xs", "(53", "53*", "", "+", "4++4"})
    void parse_malformedExpression_fails(String input) {
        assertTrue(parser.parse(input).isFailure(), () -> "Unexpectedly parsed " + input);
    }

    @Test
    void parse_leadingZero_failsAfterZero() {
        var failure = (ParseResult.Failure) parser.parse("05346");

        assertEquals(1, failure.position());
        assertThat(failure.error()).isInstanceOf(ParseError.UnexpectedInput.class);
        assertThat(failure.expected()).contains("'+'", "'*'", "end of input");
    }

    @Test
    void parse_danglingOperator_reportsEndOfInput() {
        var failure = (ParseResult.Failure) parser.parse("53*");

        assertEquals(3, failure.position());
        assertThat(failure.error()).isInstanceOf(ParseError.UnexpectedEof.class);
        assertThat(failure.expected()).contains("'('");
    }

    @Test
    void parse_unclosedParenthesis_reportsMissingClose() {
        var failure = (ParseResult.Failure) parser.parse("(53");

        assertEquals(3, failure.position());
        assertThat(failure.expected()).contains("')'");
    }

    // === Values ===

    @ParameterizedTest
    @CsvSource({
        "5, 5",
        "5346, 5346",
        "0, 0",
        "(53), 53",
        "45*4, 180",
        "45+4, 49",
        "2+3*4, 14",
        "(34+(44*(6*(67+(5))))), 19042",
        "((34*10)+(44*(6*(67+(5))))), 19348"
    })
    void value_evaluatesExpression(String input, int expected) {
        int value = parser.parse(input)
                          .unwrap()
                          .get("value");

        assertEquals(expected, value);
    }

    @Test
    void value_ofParenthesizedExpression_comesFromSubexpression() {
        var root = parser.parse("(53)").unwrap();

        assertTrue(root.has("subexpression"));
        assertEquals("53", root.<SyntaxNode>get("subexpression").textValue());
    }

    @Test
    void binaryOperator_exposesOperands() {
        var root = parser.parse("45*4").unwrap();

        assertEquals("45", root.<SyntaxNode>get("left").textValue());
        assertEquals("4", root.<SyntaxNode>get("right").textValue());
    }

    @Test
    void binaryOperator_sharedBundle_servesBothOperators() {
        var sum = parser.parse("45+4").unwrap();
        var product = parser.parse("45*4").unwrap();

        assertThat(sum.accessors().name()).contains("Additive");
        assertThat(product.accessors().name()).contains("Multitive");
        assertThat(sum.accessorNames()).containsAll(ArithmeticGrammar.BINARY_OPERATOR.names());
        assertThat(product.accessorNames()).containsAll(ArithmeticGrammar.BINARY_OPERATOR.names());
    }

    // === Configuration ===

    @Test
    void parse_withoutPackrat_producesSameValues() {
        var plain = PegParser.builder(ArithmeticGrammar.create())
                             .packrat(false)
                             .build();
        var input = "((34*10)+(44*(6*(67+(5)))))";

        int memoized = parser.parse(input).unwrap().get("value");
        int unmemoized = plain.parse(input).unwrap().get("value");

        assertEquals(memoized, unmemoized);
        assertEquals(((ParseResult.Failure) parser.parse("53*")).position(),
                     ((ParseResult.Failure) plain.parse("53*")).position());
    }

    @Test
    void parse_deeplyNestedParentheses_succeeds() {
        var depth = 100;
        var input = "(".repeat(depth) + "7" + ")".repeat(depth);

        int value = parser.parse(input).unwrap().get("value");

        assertEquals(7, value);
    }

    @Test
    void parse_afterFailure_parserIsReusable() {
        assertTrue(parser.parse("53*").isFailure());
        int value = parser.parse("53*2").unwrap().get("value");

        assertEquals(106, value);
    }
}
