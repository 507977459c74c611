package com.dochelper.core.formula;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the formula parser covering precedence, calls and error reporting.
 */
class ParserTest {

    private Parser parser;

    @BeforeEach
    void setUp() {
        parser = new Parser();
    }

    private AstNode parseOk(String source) {
        Parser.ParseResult result = parser.parse(source);
        assertTrue(result.success(), () -> "Should parse: " + source + " but got " + result.error());
        return result.ast();
    }

    private static AstNode num(double value) {
        return new AstNode.Literal(Value.of(value));
    }

    private static String sum(int terms) {
        StringBuilder source = new StringBuilder("a");
        for (int i = 1; i < terms; i++) {
            source.append(" + a");
        }
        return source.toString();
    }

    private static AstNode field(String name) {
        return new AstNode.FieldReference(name);
    }

    @Nested
    @DisplayName("Literals and References")
    class LiteralTests {

        @Test
        @DisplayName("Parses number, string, boolean and null literals")
        void parsesLiterals() {
            assertEquals(num(42), parseOk("42"));
            assertEquals(new AstNode.Literal(Value.of("hi")), parseOk("'hi'"));
            assertEquals(new AstNode.Literal(Value.of(true)), parseOk("true"));
            assertEquals(new AstNode.Literal(Value.nullValue()), parseOk("NULL"));
        }

        @Test
        @DisplayName("Identifier without parentheses is a field reference")
        void parsesFieldReference() {
            AstNode ast = parseOk("unit_price");

            assertInstanceOf(AstNode.FieldReference.class, ast);
            assertEquals("unit_price", ((AstNode.FieldReference) ast).name());
        }
    }

    @Nested
    @DisplayName("Precedence")
    class PrecedenceTests {

        @Test
        @DisplayName("Multiplication binds tighter than addition")
        void multiplicationBeforeAddition() {
            AstNode ast = parseOk("1 + 2 * 3");

            assertEquals(new AstNode.BinaryOp("+", num(1), new AstNode.BinaryOp("*", num(2), num(3))), ast);
        }

        @Test
        @DisplayName("Parentheses override precedence")
        void parenthesesGroup() {
            AstNode ast = parseOk("(1 + 2) * 3");

            assertEquals(new AstNode.BinaryOp("*", new AstNode.BinaryOp("+", num(1), num(2)), num(3)), ast);
        }

        @Test
        @DisplayName("Power is right-associative")
        void powerRightAssociative() {
            AstNode ast = parseOk("2 ** 3 ** 2");

            assertEquals(new AstNode.BinaryOp("**", num(2), new AstNode.BinaryOp("**", num(3), num(2))), ast);
        }

        @Test
        @DisplayName("Subtraction is left-associative")
        void subtractionLeftAssociative() {
            AstNode ast = parseOk("10 - 4 - 3");

            assertEquals(new AstNode.BinaryOp("-", new AstNode.BinaryOp("-", num(10), num(4)), num(3)), ast);
        }

        @Test
        @DisplayName("'and' binds tighter than 'or'")
        void andBeforeOr() {
            AstNode ast = parseOk("a or b and c");

            assertInstanceOf(AstNode.BinaryOp.class, ast);
            AstNode.BinaryOp or = (AstNode.BinaryOp) ast;
            assertEquals("or", or.operator());
            assertEquals(field("a"), or.left());
            assertEquals(new AstNode.BinaryOp("and", field("b"), field("c")), or.right());
        }

        @Test
        @DisplayName("Comparison binds tighter than 'not'")
        void notAppliesToComparison() {
            AstNode ast = parseOk("not a > 5");

            assertEquals(new AstNode.UnaryOp("not", new AstNode.BinaryOp(">", field("a"), num(5))), ast);
        }

        @Test
        @DisplayName("Relational binds tighter than equality")
        void relationalBeforeEquality() {
            AstNode ast = parseOk("a < b == true");

            AstNode.BinaryOp eq = (AstNode.BinaryOp) ast;
            assertEquals("==", eq.operator());
            assertEquals(new AstNode.BinaryOp("<", field("a"), field("b")), eq.left());
        }

        @Test
        @DisplayName("Unary minus applies to the power base")
        void unaryMinusBindsTighterThanPower() {
            AstNode ast = parseOk("-2 ** 2");

            assertEquals(new AstNode.BinaryOp("**", new AstNode.UnaryOp("-", num(2)), num(2)), ast);
        }

        @Test
        @DisplayName("Parses all binary operators")
        void parsesAllOperators() {
            String[] operators = {"+", "-", "*", "/", "%", "**", "==", "!=", "<", "<=", ">", ">="};

            for (String op : operators) {
                Parser.ParseResult result = parser.parse("a " + op + " 1");
                assertTrue(result.success(), "Should parse operator: " + op);
                assertEquals(op, ((AstNode.BinaryOp) result.ast()).operator());
            }
        }
    }

    @Nested
    @DisplayName("Function Calls")
    class FunctionCallTests {

        @Test
        @DisplayName("Parses call with arguments")
        void parsesCallWithArguments() {
            AstNode ast = parseOk("max(a, b + 1, 3)");

            assertInstanceOf(AstNode.FunctionCall.class, ast);
            AstNode.FunctionCall call = (AstNode.FunctionCall) ast;
            assertEquals("max", call.name());
            assertEquals(3, call.args().size());
            assertEquals(new AstNode.BinaryOp("+", field("b"), num(1)), call.args().get(1));
        }

        @Test
        @DisplayName("Parses call without arguments")
        void parsesEmptyCall() {
            AstNode ast = parseOk("now()");

            assertEquals(new AstNode.FunctionCall("now", List.of()), ast);
        }

        @Test
        @DisplayName("Unknown function names are accepted")
        void acceptsUnknownFunction() {
            assertInstanceOf(AstNode.FunctionCall.class, parseOk("no_such_function(1)"));
        }

        @Test
        @DisplayName("Argument list is immutable")
        void argumentsImmutable() {
            AstNode.FunctionCall call = (AstNode.FunctionCall) parseOk("sum(1, 2)");

            assertThrows(UnsupportedOperationException.class, () -> call.args().add(num(3)));
        }
    }

    @Nested
    @DisplayName("Errors")
    class ErrorTests {

        @Test
        @DisplayName("Empty formula fails")
        void emptyFormula() {
            Parser.ParseResult result = parser.parse("");

            assertFalse(result.success());
            assertNull(result.ast());
            assertEquals("expression", result.error().expected());
            assertEquals("end of formula", result.error().found());
        }

        @Test
        @DisplayName("Trailing tokens fail")
        void trailingTokens() {
            Parser.ParseResult result = parser.parse("1 2");

            assertFalse(result.success());
            assertEquals("end of formula", result.error().expected());
            assertEquals("'2'", result.error().found());
            assertEquals(2, result.error().position());
        }

        @Test
        @DisplayName("Missing closing parenthesis fails")
        void missingParenthesis() {
            Parser.ParseResult result = parser.parse("(1 + 2");

            assertFalse(result.success());
            assertEquals("')'", result.error().expected());
            assertEquals(6, result.errorPosition());
        }

        @Test
        @DisplayName("Dangling operator fails")
        void danglingOperator() {
            Parser.ParseResult result = parser.parse("a +");

            assertFalse(result.success());
            assertEquals("expression", result.error().expected());
        }

        @Test
        @DisplayName("Lexical errors surface as parse errors")
        void lexicalError() {
            Parser.ParseResult result = parser.parse("a $ b");

            assertFalse(result.success());
            assertEquals("'$'", result.error().found());
            assertEquals(2, result.error().position());
        }

        @Test
        @DisplayName("Excessive nesting fails instead of overflowing the stack")
        void deepNesting() {
            String deep = "(".repeat(10_000) + "1" + ")".repeat(10_000);

            Parser.ParseResult result = parser.parse(deep);

            assertFalse(result.success());
            assertTrue(result.error().expected().startsWith("nesting depth"));
        }

        @Test
        @DisplayName("Non-ASCII digits are a syntax error, not an exception")
        void nonAsciiDigit() {
            Parser.ParseResult result = parser.parse("\u0663 + 1");

            assertFalse(result.success());
            assertEquals(0, result.error().position());
        }

        @Test
        @DisplayName("A long flat sum counts one level per operator")
        void longSum() {
            assertTrue(parser.parse(sum(Parser.DEFAULT_MAX_DEPTH)).success());

            Parser.ParseResult tooTall = parser.parse(sum(Parser.DEFAULT_MAX_DEPTH + 1));
            assertFalse(tooTall.success());
            assertTrue(tooTall.error().expected().startsWith("nesting depth"));
        }

        @Test
        @DisplayName("A very long formula fails without overflowing the stack")
        void veryLongFormula() {
            Parser.ParseResult result = parser.parse(sum(200_001));

            assertFalse(result.success());
            assertTrue(result.error().expected().startsWith("nesting depth"));
        }

        @Test
        @DisplayName("Nesting within the limit parses")
        void nestingWithinLimit() {
            String nested = "(".repeat(20) + "1" + ")".repeat(20);

            assertEquals(num(1), parseOk(nested));
        }
    }

    @Test
    @DisplayName("Parsing is deterministic")
    void deterministic() {
        String source = "if_else(a > 1 and not b, concat('x', c), -d ** 2 % 3)";

        assertEquals(parseOk(source), new Parser().parse(source).ast());
    }
}
