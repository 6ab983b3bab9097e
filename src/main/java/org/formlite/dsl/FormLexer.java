package org.formlite.dsl;

import org.formlite.dsl.Token.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexer for the FORM language.
 * Converts a statement string into a list of tokens.
 *
 * The lexer never fails: characters it does not know are skipped, and a
 * malformed number such as {@code 1.2.3} is kept as a NUMBER token whose
 * value reads as 0.0.
 */
public final class FormLexer {

    private final String input;
    private int position;

    public FormLexer(String input) {
        this.input = input;
        this.position = 0;
    }

    /**
     * Tokenizes the entire input string.
     *
     * @return List of tokens, always terminated by EOF
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();

        while (true) {
            skipWhitespace();
            if (position >= input.length())
                break;

            if (isCommentStart()) {
                skipComment();
                continue;
            }

            Token token = nextToken();
            if (token != null) {
                tokens.add(token);
            }
        }

        tokens.add(new Token(TokenType.EOF, null, position));
        return tokens;
    }

    /**
     * Newlines are tokens, so only blanks, tabs and carriage returns are skipped.
     */
    private void skipWhitespace() {
        while (position < input.length()) {
            char c = input.charAt(position);
            if (c == ' ' || c == '\t' || c == '\r') {
                position++;
            } else {
                break;
            }
        }
    }

    // '*' starts a comment only as the first character of the input, followed by a space
    private boolean isCommentStart() {
        return position == 0
                && input.charAt(0) == '*'
                && input.length() > 1
                && input.charAt(1) == ' ';
    }

    private void skipComment() {
        while (position < input.length() && input.charAt(position) != '\n') {
            position++;
        }
    }

    private Token nextToken() {
        char c = input.charAt(position);
        int start = position;

        // Dot directive: only .sort is known, anything else is dropped
        if (c == '.') {
            position++;
            String directive = readWord();
            return "sort".equals(directive) ? new Token(TokenType.SORT, ".sort", start) : null;
        }

        if (c >= '0' && c <= '9') {
            return readNumberLiteral();
        }

        if (Character.isLetter(c) || c == '_') {
            return readIdentifierOrKeyword();
        }

        TokenType singleCharType = switch (c) {
            case '+' -> TokenType.PLUS;
            case '-' -> TokenType.MINUS;
            case '*' -> TokenType.STAR;
            case '/' -> TokenType.SLASH;
            case '^' -> TokenType.CARET;
            case '=' -> TokenType.EQUALS;
            case '(' -> TokenType.LPAREN;
            case ')' -> TokenType.RPAREN;
            case '[' -> TokenType.LBRACKET;
            case ']' -> TokenType.RBRACKET;
            case ',' -> TokenType.COMMA;
            case ';' -> TokenType.SEMICOLON;
            case '\n' -> TokenType.NEWLINE;
            default -> null;
        };
        position++;
        if (singleCharType == null) {
            return null;
        }
        return new Token(singleCharType, singleCharType == TokenType.NEWLINE ? "\\n" : String.valueOf(c), start);
    }

    private Token readNumberLiteral() {
        int start = position;
        while (position < input.length()) {
            char c = input.charAt(position);
            if ((c >= '0' && c <= '9') || c == '.') {
                position++;
            } else {
                break;
            }
        }
        return new Token(TokenType.NUMBER, input.substring(start, position), start);
    }

    private Token readIdentifierOrKeyword() {
        int start = position;
        String value = readWord();

        return switch (value) {
            case "Symbols" -> new Token(TokenType.SYMBOLS, value, start);
            case "Expression" -> new Token(TokenType.EXPRESSION, value, start);
            case "Local" -> new Token(TokenType.LOCAL, value, start);
            case "id" -> new Token(TokenType.ID, value, start);
            case "Print" -> new Token(TokenType.PRINT, value, start);
            default -> new Token(TokenType.IDENTIFIER, value, start);
        };
    }

    private String readWord() {
        int start = position;
        while (position < input.length()) {
            char c = input.charAt(position);
            if (Character.isLetterOrDigit(c) || c == '_') {
                position++;
            } else {
                break;
            }
        }
        return input.substring(start, position);
    }
}
