package com.dochelper.core.formula;

/**
 * Token produced by the lexer. {@code position} is the zero-based offset of the lexeme.
 */
public record Token(TokenType type, String value, int position) {

    public static Token eof(int position) {
        return new Token(TokenType.EOF, "", position);
    }
}
