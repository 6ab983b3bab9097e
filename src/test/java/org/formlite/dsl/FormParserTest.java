package org.formlite.dsl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * FORM parsing tests - no evaluation involved.
 */
@DisplayName("FORM Parser Tests")
class FormParserTest {

    private static final SymbolRef X = new SymbolRef("x");

    private static FormExpression expr(String source) {
        FormStatement statement = FormParser.parse(source);
        return assertInstanceOf(FormStatement.EvalExpr.class, statement).expression();
    }

    private static NumberLiteral num(double value) {
        return new NumberLiteral(value);
    }

    @Nested
    @DisplayName("Expressions")
    class Expressions {

        @Test
        @DisplayName("Number and symbol")
        void testPrimary() {
            assertEquals(num(42), expr("42"));
            assertEquals(X, expr("x"));
        }

        @Test
        @DisplayName("Multiplication binds tighter than addition")
        void testPrecedence() {
            assertEquals(BinaryExpression.add(num(2), BinaryExpression.mul(num(3), num(4))), expr("2 + 3 * 4"));
            assertEquals(BinaryExpression.mul(BinaryExpression.add(num(2), num(3)), num(4)), expr("(2 + 3) * 4"));
        }

        @Test
        @DisplayName("Additive and multiplicative operators are left-associative")
        void testLeftAssociative() {
            FormExpression a = new SymbolRef("a");
            FormExpression b = new SymbolRef("b");
            FormExpression c = new SymbolRef("c");

            assertEquals(BinaryExpression.sub(BinaryExpression.sub(a, b), c), expr("a - b - c"));
            assertEquals(BinaryExpression.div(BinaryExpression.div(a, b), c), expr("a / b / c"));
        }

        @Test
        @DisplayName("Power is right-associative")
        void testPowerRightAssociative() {
            assertEquals(BinaryExpression.pow(num(2), BinaryExpression.pow(num(3), num(2))), expr("2 ^ 3 ^ 2"));
        }

        @Test
        @DisplayName("Unary minus applies to the power base")
        void testUnaryMinus() {
            assertEquals(UnaryExpression.negate(X), expr("-x"));
            assertEquals(UnaryExpression.negate(UnaryExpression.negate(num(1))), expr("--1"));
            assertEquals(BinaryExpression.pow(UnaryExpression.negate(X), num(2)), expr("-x ^ 2"));
        }

        @Test
        @DisplayName("Function calls with zero, one and several arguments")
        void testFunctionCalls() {
            assertEquals(new FunctionCall("f", List.of()), expr("f()"));
            assertEquals(new FunctionCall("sin", List.of(X)), expr("sin(x)"));
            assertEquals(new FunctionCall("g", List.of(X, BinaryExpression.add(num(1), num(2)))),
                    expr("g(x, 1 + 2)"));
        }

        @Test
        @DisplayName("Display form is fully parenthesized")
        void testDisplayForm() {
            assertEquals("((x + 1) * (x - 1))", expr("(x + 1) * (x - 1)").toString());
            assertEquals("(2 ^ (3 ^ 2))", expr("2 ^ 3 ^ 2").toString());
            assertEquals("f((-x), 2.5)", expr("f(-x, 2.5)").toString());
        }

        @Test
        @DisplayName("Tokens after a complete expression are ignored")
        void testTrailingTokensIgnored() {
            assertEquals(BinaryExpression.add(num(1), num(2)), expr("1 + 2 ) 7"));
        }
    }

    @Nested
    @DisplayName("Statements")
    class Statements {

        @Test
        @DisplayName("Symbols declaration")
        void testSymbols() {
            FormStatement statement = FormParser.parse("Symbols x, y, z;");

            assertEquals(new FormStatement.SymbolsDecl(List.of("x", "y", "z")), statement);
            assertEquals("Symbols x, y, z", statement.toString());
        }

        @Test
        @DisplayName("Expression and Local declarations")
        void testDeclarations() {
            FormStatement expression = FormParser.parse("Expression e = x + 1;");
            FormStatement local = FormParser.parse("Local e = x + 1");

            assertEquals(new FormStatement.ExpressionDecl("e", BinaryExpression.add(X, num(1))), expression);
            assertEquals(new FormStatement.LocalDecl("e", BinaryExpression.add(X, num(1))), local);
            assertEquals("Expression e = (x + 1)", expression.toString());
            assertEquals("Local e = (x + 1)", local.toString());
        }

        @Test
        @DisplayName("id rule")
        void testIdRule() {
            FormStatement statement = FormParser.parse("id x ^ 2 = y;");

            assertEquals(new FormStatement.IdRule(BinaryExpression.pow(X, num(2)), new SymbolRef("y")), statement);
            assertEquals("id (x ^ 2) = y", statement.toString());
        }

        @Test
        @DisplayName("Print and .sort")
        void testPrintAndSort() {
            assertEquals(new FormStatement.Print("e"), FormParser.parse("Print e;"));
            assertEquals(new FormStatement.Sort(), FormParser.parse(".sort"));
            assertEquals(".sort", FormParser.parse(".sort").toString());
        }

        @Test
        @DisplayName("Leading newlines are skipped")
        void testLeadingNewlines() {
            assertEquals(new FormStatement.Print("e"), FormParser.parse("\n\n  Print e"));
        }

        @Test
        @DisplayName("A leading comment line is skipped")
        void testLeadingComment() {
            assertEquals(new FormStatement.Print("e"), FormParser.parse("* show it\nPrint e"));
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("Empty input")
        void testEmptyInput() {
            FormParseException e = assertThrows(FormParseException.class, () -> FormParser.parse("   "));
            assertEquals("End of input", e.getMessage());
        }

        @Test
        @DisplayName("Missing closing parenthesis names expected and actual token")
        void testMissingParen() {
            FormParseException e = assertThrows(FormParseException.class, () -> FormParser.parse("(1 + 2"));

            assertTrue(e.getMessage().startsWith("Expected ')'"), e.getMessage());
            assertTrue(e.getMessage().contains("got: EOF@6"), e.getMessage());
            assertTrue(e.hasPosition());
            assertEquals(6, e.getPosition());
        }

        @Test
        @DisplayName("Dangling operator")
        void testDanglingOperator() {
            FormParseException e = assertThrows(FormParseException.class, () -> FormParser.parse("2 +"));
            assertEquals("Unexpected token: EOF@3", e.getMessage());
        }

        @Test
        @DisplayName("Declarations require a name")
        void testMissingNames() {
            assertTrue(assertThrows(FormParseException.class, () -> FormParser.parse("Expression = 3"))
                    .getMessage().startsWith("Expected identifier after Expression"));
            assertTrue(assertThrows(FormParseException.class, () -> FormParser.parse("Local 3 = 3"))
                    .getMessage().startsWith("Expected identifier after Local"));
            assertTrue(assertThrows(FormParseException.class, () -> FormParser.parse("Print 3"))
                    .getMessage().startsWith("Expected identifier after Print"));
            assertTrue(assertThrows(FormParseException.class, () -> FormParser.parse("Symbols"))
                    .getMessage().startsWith("Expected symbol name"));
        }

        @Test
        @DisplayName("Rule without '='")
        void testRuleWithoutEquals() {
            FormParseException e = assertThrows(FormParseException.class, () -> FormParser.parse("id x 2"));
            assertTrue(e.getMessage().contains("got: NUMBER(2)@5"), e.getMessage());
        }

        @Test
        @DisplayName("Malformed number is not a parse error")
        void testMalformedNumber() {
            assertEquals(num(0.0), expr("1.2.3"));
        }
    }
}
