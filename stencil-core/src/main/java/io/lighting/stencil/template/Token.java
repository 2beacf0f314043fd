package io.lighting.stencil.template;

import java.util.Objects;

/**
 * One lexical unit. {@code value} holds the decoded literal: a {@link Long} for integers, a
 * {@link Double} for floats, the unescaped text for strings and the matched text otherwise.
 */
public record Token(TokenKind kind, Object value, int offset) {
    public Token {
        Objects.requireNonNull(kind, "kind");
    }

    static Token eof(int offset) {
        return new Token(TokenKind.EOF, null, offset);
    }

    boolean is(TokenKind expected) {
        return kind == expected;
    }

    boolean is(TokenKind expected, String text) {
        return kind == expected && text.equals(value);
    }

    String text() {
        return value == null ? "" : value.toString();
    }

    String describe() {
        if (kind == TokenKind.EOF) {
            return "end of input";
        }
        if (kind == TokenKind.RAW) {
            return "raw text";
        }
        return kind.name().toLowerCase() + " '" + value + "'";
    }
}
