package com.dochelper.core.formula;

/**
 * Token types for the formula lexer
 */
public enum TokenType {
    // Literals
    NUMBER,         // 12, 3.5
    STRING,         // 'abc', "abc"
    TRUE,           // true
    FALSE,          // false
    NULL,           // null

    // Names
    IDENTIFIER,     // field ids and function names

    // Logical keywords
    AND,            // and
    OR,             // or
    NOT,            // not

    // Arithmetic
    PLUS,           // +
    MINUS,          // -
    MULTIPLY,       // *
    DIVIDE,         // /
    MODULO,         // %
    POWER,          // **

    // Comparison
    EQ,             // ==
    NE,             // !=
    LT,             // <
    LE,             // <=
    GT,             // >
    GE,             // >=

    // Punctuation
    LPAREN,         // (
    RPAREN,         // )
    COMMA,          // ,

    // End of input
    EOF
}
