package io.lighting.stencil;

/**
 * Raised when the lexer reaches a character that no token rule accepts, or a literal it cannot
 * decode.
 */
public class TemplateLexException extends TemplateCompileException {
    private final char character;

    public TemplateLexException(String templateName, String source, int offset) {
        this("unexpected char '" + source.charAt(offset) + "'", templateName, source, offset);
    }

    public TemplateLexException(String reason, String templateName, String source, int offset) {
        super(reason, templateName, source, offset);
        this.character = source.charAt(offset);
    }

    public char character() {
        return character;
    }
}
