package io.lighting.stencil;

/**
 * Raised while rendering: unbound names, unknown filters, failing filters and the like.
 * The render that raised it produces no output.
 */
public class TemplateRuntimeException extends TemplateException {
    public TemplateRuntimeException(String message) {
        super(message);
    }

    public TemplateRuntimeException(String message, Throwable cause) {
        super(message, cause);
    }
}
