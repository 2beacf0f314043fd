package io.lighting.stencil.template;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.lighting.stencil.Stencil;
import io.lighting.stencil.TemplateCompileException;
import io.lighting.stencil.TemplateLexException;
import io.lighting.stencil.observe.TemplateObserver;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class TemplateLexerTest {

    @Test
    void splitsRawTextAndDirectives() {
        List<Token> tokens = tokenize("Hello {{ name }}!");
        assertEquals(
            List.of(
                new Token(TokenKind.RAW, "Hello ", 0),
                new Token(TokenKind.LDELIM, "{{", 6),
                new Token(TokenKind.IDENTIFIER, "name", 9),
                new Token(TokenKind.RDELIM, "}}", 14),
                new Token(TokenKind.RAW, "!", 16)
            ),
            tokens
        );
    }

    @Test
    void decodesLiterals() {
        List<Token> tokens = tokenize("{{ 12 3.5 -4 \"a\\\"b\" 'c\\n' }}");
        assertEquals(12L, tokens.get(1).value());
        assertEquals(TokenKind.FLOAT, tokens.get(2).kind());
        assertEquals(3.5d, tokens.get(2).value());
        assertEquals(-4L, tokens.get(3).value());
        assertEquals("a\"b", tokens.get(4).value());
        assertEquals("c\n", tokens.get(5).value());
    }

    @Test
    void keywordsRequireWordBoundary() {
        assertEquals(
            List.of(
                TokenKind.LDELIM, TokenKind.KEYWORD, TokenKind.IDENTIFIER, TokenKind.KEYWORD,
                TokenKind.IDENTIFIER, TokenKind.RDELIM
            ),
            kinds(tokenize("{{ for item in index }}"))
        );
        assertEquals(TokenKind.IDENTIFIER, tokenize("{{ endless }}").get(1).kind());
        assertEquals(TokenKind.IDENTIFIER, tokenize("{{ order }}").get(1).kind());
    }

    @Test
    void recognisesOperatorsAndPunctuation() {
        assertEquals(
            List.of(
                TokenKind.LDELIM, TokenKind.IDENTIFIER, TokenKind.COMPARISON, TokenKind.IDENTIFIER,
                TokenKind.LOGIC, TokenKind.LOGIC, TokenKind.IDENTIFIER, TokenKind.PIPE,
                TokenKind.IDENTIFIER, TokenKind.COLON, TokenKind.INTEGER, TokenKind.COMMA,
                TokenKind.INTEGER, TokenKind.RDELIM
            ),
            kinds(tokenize("{{ a == b and not c | f: 1, 2 }}"))
        );
        assertEquals(
            List.of(
                TokenKind.LDELIM, TokenKind.KEYWORD, TokenKind.IDENTIFIER, TokenKind.ASSIGN,
                TokenKind.IDENTIFIER, TokenKind.DOT, TokenKind.IDENTIFIER, TokenKind.LBRACKET,
                TokenKind.INTEGER, TokenKind.RBRACKET, TokenKind.RDELIM
            ),
            kinds(tokenize("{{ set x = a.b[0] }}"))
        );
    }

    @Test
    void dropsComments() {
        List<Token> tokens = tokenize("a{{# note {{ x }} #}}b");
        assertEquals(List.of(new Token(TokenKind.RAW, "a", 0), new Token(TokenKind.RAW, "b", 21)), tokens);
    }

    @Test
    void keepsClosingBracesOutsideDirectivesAsText() {
        assertEquals(List.of(new Token(TokenKind.RAW, "a }} { b", 0)), tokenize("a }} { b"));
    }

    @Test
    void reportsUnexpectedCharacterWithPosition() {
        TemplateLexException error = assertThrows(TemplateLexException.class, () -> tokenize("{{ a $ b }}"));
        assertEquals('$', error.character());
        assertEquals(5, error.offset());
        assertEquals(1, error.line());
        assertEquals(6, error.column());

        TemplateLexException second = assertThrows(TemplateLexException.class, () -> tokenize("ok\n{{ @ }}"));
        assertEquals(2, second.line());
        assertEquals(4, second.column());
    }

    @Test
    void reportsOutOfRangeNumberAsLexError() {
        TemplateLexException error = assertThrows(
            TemplateLexException.class,
            () -> tokenize("{{ 99999999999999999999 }}")
        );
        assertEquals("number out of range '99999999999999999999'", error.reason());
        assertEquals(3, error.offset());
        assertEquals(4, error.column());

        List<String> failures = new ArrayList<>();
        Stencil engine = Stencil.builder().observer(new TemplateObserver() {
            @Override
            public void onCompileError(String name, TemplateCompileException failure, long elapsedNanos) {
                failures.add(failure.reason());
            }
        }).build();
        assertThrows(TemplateLexException.class, () -> engine.compile("{{ -99999999999999999999 }}", "big.txt"));
        assertEquals(List.of("number out of range '-99999999999999999999'"), failures);
    }

    private static List<Token> tokenize(String source) {
        return new TemplateLexer(null, source).tokenize();
    }

    private static List<TokenKind> kinds(List<Token> tokens) {
        return tokens.stream().map(Token::kind).toList();
    }
}
