package io.lighting.stencil.template;

public enum TokenKind {
    RAW,
    LDELIM,
    RDELIM,
    KEYWORD,
    IDENTIFIER,
    INTEGER,
    FLOAT,
    STRING,
    COMPARISON,
    LOGIC,
    ASSIGN,
    DOT,
    COLON,
    COMMA,
    PIPE,
    LPAREN,
    RPAREN,
    LBRACKET,
    RBRACKET,
    EOF
}
