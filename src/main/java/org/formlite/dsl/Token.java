package org.formlite.dsl;

/**
 * Represents a token in the FORM language lexer.
 *
 * @param type     The token type
 * @param value    The token text (for numbers and identifiers, the source text)
 * @param position The position in the source string
 */
public record Token(TokenType type, String value, int position) {

    public enum TokenType {
        // Literals
        NUMBER, // 42, 3.14
        IDENTIFIER, // x, sin, e1

        // Keywords
        SYMBOLS, // Symbols
        EXPRESSION, // Expression
        LOCAL, // Local
        ID, // id
        PRINT, // Print
        SORT, // .sort

        // Operators
        PLUS, // +
        MINUS, // -
        STAR, // *
        SLASH, // /
        CARET, // ^
        EQUALS, // =

        // Delimiters
        LPAREN, // (
        RPAREN, // )
        LBRACKET, // [
        RBRACKET, // ]
        COMMA, // ,
        SEMICOLON, // ;

        // Special
        NEWLINE, // \n
        EOF, // End of input
    }

    /**
     * Numeric value of a NUMBER token. Text that is not a valid double reads as 0.0.
     */
    public double numberValue() {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }

    @Override
    public String toString() {
        return type + (value != null ? "(" + value + ")" : "") + "@" + position;
    }
}
