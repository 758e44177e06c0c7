package com.kbdash.formula.grammar;

public enum TokenType {
    NUMBER,     // 42, 3.14, 1e3
    STRING,     // 'status:200' or "status:200"
    WORD,       // function names and unquoted field names like response.time

    // Arithmetic operators
    PLUS,
    MINUS,
    STAR,
    SLASH,

    // Comparison operators
    GT,
    LT,
    GTE,
    LTE,
    EQ_EQ,

    // Symbols
    EQUALS,     // named argument separator
    COMMA,
    LPAREN,
    RPAREN,

    EOF
}
