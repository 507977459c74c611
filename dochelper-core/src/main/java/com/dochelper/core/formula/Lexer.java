package com.dochelper.core.formula;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Formula lexer - turns formula source text into a token list terminated by {@link TokenType#EOF}.
 * A lexer instance can be run repeatedly and always yields the same tokens.
 */
public class Lexer {

    // Keywords are matched case-insensitively
    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
        Map.entry("true", TokenType.TRUE),
        Map.entry("false", TokenType.FALSE),
        Map.entry("null", TokenType.NULL),
        Map.entry("and", TokenType.AND),
        Map.entry("or", TokenType.OR),
        Map.entry("not", TokenType.NOT)
    );

    private final String source;
    private int position = 0;
    private final List<Token> tokens = new ArrayList<>();

    public Lexer(String source) {
        this.source = source != null ? source : "";
    }

    /**
     * Tokenize the source string.
     *
     * @throws LexerException on an unrecognized character or an unterminated string
     */
    public List<Token> tokenize() {
        tokens.clear();
        position = 0;

        while (position < source.length()) {
            skipWhitespace();

            if (position >= source.length()) {
                break;
            }

            char c = source.charAt(position);

            switch (c) {
                case '(' -> { addToken(TokenType.LPAREN, "("); position++; continue; }
                case ')' -> { addToken(TokenType.RPAREN, ")"); position++; continue; }
                case ',' -> { addToken(TokenType.COMMA, ","); position++; continue; }
                case '+' -> { addToken(TokenType.PLUS, "+"); position++; continue; }
                case '-' -> { addToken(TokenType.MINUS, "-"); position++; continue; }
                case '/' -> { addToken(TokenType.DIVIDE, "/"); position++; continue; }
                case '%' -> { addToken(TokenType.MODULO, "%"); position++; continue; }
                default -> { }
            }

            if (c == '*') {
                if (peek(1) == '*') {
                    addToken(TokenType.POWER, "**");
                    position += 2;
                } else {
                    addToken(TokenType.MULTIPLY, "*");
                    position++;
                }
                continue;
            }

            // Comparison operators
            if (c == '>') {
                if (peek(1) == '=') {
                    addToken(TokenType.GE, ">=");
                    position += 2;
                } else {
                    addToken(TokenType.GT, ">");
                    position++;
                }
                continue;
            }

            if (c == '<') {
                if (peek(1) == '=') {
                    addToken(TokenType.LE, "<=");
                    position += 2;
                } else {
                    addToken(TokenType.LT, "<");
                    position++;
                }
                continue;
            }

            if (c == '=' && peek(1) == '=') {
                addToken(TokenType.EQ, "==");
                position += 2;
                continue;
            }

            if (c == '!' && peek(1) == '=') {
                addToken(TokenType.NE, "!=");
                position += 2;
                continue;
            }

            if (c == '"' || c == '\'') {
                readString(c);
                continue;
            }

            if (isDigit(c) || (c == '.' && isDigit(peek(1)))) {
                readNumber();
                continue;
            }

            if (isIdentifierStart(c)) {
                readIdentifier();
                continue;
            }

            throw new LexerException("Unexpected character '" + c + "' at position " + position,
                "'" + c + "'", position);
        }

        tokens.add(Token.eof(position));
        return List.copyOf(tokens);
    }

    private void skipWhitespace() {
        while (position < source.length() && Character.isWhitespace(source.charAt(position))) {
            position++;
        }
    }

    private char peek(int offset) {
        int pos = position + offset;
        if (pos >= source.length()) {
            return '\0';
        }
        return source.charAt(pos);
    }

    private void readNumber() {
        int start = position;
        boolean hasDecimal = false;

        while (position < source.length()) {
            char c = source.charAt(position);
            if (isDigit(c)) {
                position++;
            } else if (c == '.' && !hasDecimal && isDigit(peek(1))) {
                hasDecimal = true;
                position++;
            } else {
                break;
            }
        }

        tokens.add(new Token(TokenType.NUMBER, source.substring(start, position), start));
    }

    private void readString(char quote) {
        int start = position;
        position++; // opening quote
        StringBuilder value = new StringBuilder();

        while (position < source.length()) {
            char c = source.charAt(position);
            if (c == quote) {
                position++;
                tokens.add(new Token(TokenType.STRING, value.toString(), start));
                return;
            }
            if (c == '\\' && position + 1 < source.length()) {
                char escaped = source.charAt(position + 1);
                switch (escaped) {
                    case 'n' -> value.append('\n');
                    case 't' -> value.append('\t');
                    case 'r' -> value.append('\r');
                    case '\\' -> value.append('\\');
                    case '\'' -> value.append('\'');
                    case '"' -> value.append('"');
                    default -> value.append('\\').append(escaped);
                }
                position += 2;
                continue;
            }
            value.append(c);
            position++;
        }

        throw new LexerException("Unterminated string starting at position " + start,
            "unterminated string", start);
    }

    private void readIdentifier() {
        int start = position;

        while (position < source.length()) {
            char c = source.charAt(position);
            if (isIdentifierStart(c) || isDigit(c)) {
                position++;
            } else {
                break;
            }
        }

        String value = source.substring(start, position);
        TokenType keyword = KEYWORDS.get(value.toLowerCase(Locale.ROOT));
        tokens.add(new Token(keyword != null ? keyword : TokenType.IDENTIFIER, value, start));
    }

    // ASCII only: identifiers are [A-Za-z_][A-Za-z0-9_]*
    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private void addToken(TokenType type, String value) {
        tokens.add(new Token(type, value, position));
    }

    /**
     * Convenience function to tokenize a string without throwing.
     */
    public static TokenizeResult tokenize(String source) {
        try {
            return TokenizeResult.ok(new Lexer(source).tokenize());
        } catch (LexerException e) {
            return TokenizeResult.failed(e.error());
        }
    }

    // ========== Result Types ==========

    /**
     * Lexical error. {@code found} describes the offending input, {@code position} is its offset.
     */
    public record LexError(String message, String found, int position) {}

    /**
     * Result of tokenizing; exactly one of {@code tokens} and {@code error} is set.
     */
    public record TokenizeResult(boolean success, List<Token> tokens, LexError error) {
        static TokenizeResult ok(List<Token> tokens) {
            return new TokenizeResult(true, tokens, null);
        }

        static TokenizeResult failed(LexError error) {
            return new TokenizeResult(false, List.of(), error);
        }
    }

    /**
     * Exception thrown when lexer encounters an error
     */
    public static class LexerException extends RuntimeException {
        private final String found;
        private final int position;

        public LexerException(String message, String found, int position) {
            super(message);
            this.found = found;
            this.position = position;
        }

        public LexError error() {
            return new LexError(getMessage(), found, position);
        }
    }
}
