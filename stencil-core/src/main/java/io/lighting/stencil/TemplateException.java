package io.lighting.stencil;

/**
 * Base type of every error raised while compiling or rendering a template.
 */
public class TemplateException extends IllegalArgumentException {
    public TemplateException(String message) {
        super(message);
    }

    public TemplateException(String message, Throwable cause) {
        super(message, cause);
    }
}
