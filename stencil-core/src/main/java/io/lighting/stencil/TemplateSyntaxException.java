package io.lighting.stencil;

/**
 * Raised when the token stream does not match the template grammar.
 */
public class TemplateSyntaxException extends TemplateCompileException {
    public TemplateSyntaxException(String reason, String templateName, String source, int offset) {
        super(reason, templateName, source, offset);
    }
}
