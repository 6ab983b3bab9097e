package org.formlite.dsl;

import org.formlite.dsl.Token.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive descent parser for the FORM language.
 *
 * Parses one statement per call:
 * Symbols x, y
 * Expression e = (x + 1) * (x - 1)
 * id x = 2
 * .sort
 * Print e
 *
 * Anything that does not start with a keyword is parsed as an expression to
 * evaluate. Tokens left after the statement are ignored.
 */
public final class FormParser {

    private final List<Token> tokens;
    private int position;

    public FormParser(List<Token> tokens) {
        this.tokens = tokens;
        this.position = 0;
    }

    /**
     * Parses a FORM statement string.
     *
     * @param source The statement text
     * @return The parsed statement
     * @throws FormParseException if the statement is malformed or the input is empty
     */
    public static FormStatement parse(String source) {
        FormLexer lexer = new FormLexer(source);
        List<Token> tokens = lexer.tokenize();
        FormParser parser = new FormParser(tokens);
        return parser.parseStatement();
    }

    /**
     * Parses a single expression string, e.g. for building rules programmatically.
     */
    public static FormExpression parseExpression(String source) {
        FormParser parser = new FormParser(new FormLexer(source).tokenize());
        return parser.parseAdditive();
    }

    /**
     * Parses the statement at the current position, dispatching on the leading keyword.
     */
    public FormStatement parseStatement() {
        while (check(TokenType.NEWLINE)) {
            advance();
        }

        return switch (peek().type()) {
            case SYMBOLS -> parseSymbolsDecl();
            case EXPRESSION -> parseExpressionDecl();
            case LOCAL -> parseLocalDecl();
            case ID -> parseIdRule();
            case PRINT -> parsePrint();
            case SORT -> {
                advance();
                yield new FormStatement.Sort();
            }
            case EOF -> throw new FormParseException("End of input", peek().position());
            default -> new FormStatement.EvalExpr(parseAdditive());
        };
    }

    // ==================== Statements ====================

    /**
     * Symbols x, y, z;
     */
    private FormStatement parseSymbolsDecl() {
        consume(TokenType.SYMBOLS, "Expected 'Symbols'");
        List<String> names = new ArrayList<>();

        names.add(consume(TokenType.IDENTIFIER, "Expected symbol name").value());
        while (check(TokenType.COMMA)) {
            advance();
            names.add(consume(TokenType.IDENTIFIER, "Expected symbol name after ','").value());
        }

        skipSemicolon();
        return new FormStatement.SymbolsDecl(names);
    }

    /**
     * Expression name = expr;
     */
    private FormStatement parseExpressionDecl() {
        consume(TokenType.EXPRESSION, "Expected 'Expression'");
        String name = consume(TokenType.IDENTIFIER, "Expected identifier after Expression").value();
        consume(TokenType.EQUALS, "Expected '=' after expression name");
        FormExpression expression = parseAdditive();

        skipSemicolon();
        return new FormStatement.ExpressionDecl(name, expression);
    }

    /**
     * Local name = expr;
     */
    private FormStatement parseLocalDecl() {
        consume(TokenType.LOCAL, "Expected 'Local'");
        String name = consume(TokenType.IDENTIFIER, "Expected identifier after Local").value();
        consume(TokenType.EQUALS, "Expected '=' after local name");
        FormExpression expression = parseAdditive();

        skipSemicolon();
        return new FormStatement.LocalDecl(name, expression);
    }

    /**
     * id pattern = replacement;
     */
    private FormStatement parseIdRule() {
        consume(TokenType.ID, "Expected 'id'");
        FormExpression pattern = parseAdditive();
        consume(TokenType.EQUALS, "Expected '=' between rule pattern and replacement");
        FormExpression replacement = parseAdditive();

        skipSemicolon();
        return new FormStatement.IdRule(pattern, replacement);
    }

    /**
     * Print name;
     */
    private FormStatement parsePrint() {
        consume(TokenType.PRINT, "Expected 'Print'");
        String name = consume(TokenType.IDENTIFIER, "Expected identifier after Print").value();

        skipSemicolon();
        return new FormStatement.Print(name);
    }

    private void skipSemicolon() {
        if (check(TokenType.SEMICOLON)) {
            advance();
        }
    }

    // ==================== Expressions ====================

    /**
     * Parses additive expressions: a + b - c (left-associative)
     */
    private FormExpression parseAdditive() {
        FormExpression left = parseMultiplicative();

        while (check(TokenType.PLUS) || check(TokenType.MINUS)) {
            Token op = advance();
            FormExpression right = parseMultiplicative();
            left = op.type() == TokenType.PLUS
                    ? BinaryExpression.add(left, right)
                    : BinaryExpression.sub(left, right);
        }

        return left;
    }

    /**
     * Parses multiplicative expressions: a * b / c (left-associative)
     */
    private FormExpression parseMultiplicative() {
        FormExpression left = parsePower();

        while (check(TokenType.STAR) || check(TokenType.SLASH)) {
            Token op = advance();
            FormExpression right = parsePower();
            left = op.type() == TokenType.STAR
                    ? BinaryExpression.mul(left, right)
                    : BinaryExpression.div(left, right);
        }

        return left;
    }

    /**
     * Parses power expressions: a ^ b ^ c is a ^ (b ^ c)
     */
    private FormExpression parsePower() {
        FormExpression base = parseUnary();

        if (check(TokenType.CARET)) {
            advance();
            FormExpression exponent = parsePower();
            return BinaryExpression.pow(base, exponent);
        }

        return base;
    }

    private FormExpression parseUnary() {
        if (check(TokenType.MINUS)) {
            advance();
            return UnaryExpression.negate(parseUnary());
        }
        return parsePrimary();
    }

    /**
     * Parses primary expressions: numbers, symbols, function calls, parentheses
     */
    private FormExpression parsePrimary() {
        if (check(TokenType.NUMBER)) {
            return new NumberLiteral(advance().numberValue());
        }

        if (check(TokenType.IDENTIFIER)) {
            String name = advance().value();
            if (check(TokenType.LPAREN)) {
                return parseFunctionCall(name);
            }
            return new SymbolRef(name);
        }

        if (check(TokenType.LPAREN)) {
            advance();
            FormExpression expr = parseAdditive();
            consume(TokenType.RPAREN, "Expected ')'");
            return expr;
        }

        throw new FormParseException("Unexpected token: " + peek(), peek().position());
    }

    /**
     * Parses name(arg1, arg2, ...); the name has already been consumed.
     */
    private FunctionCall parseFunctionCall(String name) {
        consume(TokenType.LPAREN, "Expected '(' after function name");
        List<FormExpression> arguments = new ArrayList<>();

        if (!check(TokenType.RPAREN)) {
            arguments.add(parseAdditive());
            while (check(TokenType.COMMA)) {
                advance();
                arguments.add(parseAdditive());
            }
        }

        consume(TokenType.RPAREN, "Expected ')' after arguments of " + name);
        return new FunctionCall(name, arguments);
    }

    // ==================== Helper Methods ====================

    private Token peek() {
        return tokens.get(position);
    }

    private boolean check(TokenType type) {
        return position < tokens.size() && peek().type() == type;
    }

    private Token advance() {
        Token token = tokens.get(position);
        if (position < tokens.size() - 1) {
            position++;
        }
        return token;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw new FormParseException(message + " at position " + peek().position() + ", got: " + peek(),
                peek().position());
    }
}
