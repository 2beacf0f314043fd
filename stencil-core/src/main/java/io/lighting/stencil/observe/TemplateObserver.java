package io.lighting.stencil.observe;

import io.lighting.stencil.TemplateCompileException;

/**
 * Template lifecycle listener.
 * <p>
 * Hooks fire for every compile and for every top-level render; templates rendered through
 * {@code include} are part of the including render and do not fire hooks of their own. All
 * methods have empty defaults. {@code name} is {@code null} for templates compiled from an
 * unnamed source string.
 * <p>
 * Normal order per template: {@link #afterCompile} once, then {@link #beforeRender} and
 * {@link #afterRender} per render. Failures call {@link #onCompileError} or
 * {@link #onRenderError} instead. Implementations holding state must be thread safe.
 */
public interface TemplateObserver {
    default void afterCompile(String name, long elapsedNanos) {
    }

    default void onCompileError(String name, TemplateCompileException error, long elapsedNanos) {
    }

    default void beforeRender(String name) {
    }

    /**
     * @param output       the rendered text
     * @param elapsedNanos render time, includes nested includes
     */
    default void afterRender(String name, String output, long elapsedNanos) {
    }

    default void onRenderError(String name, RuntimeException error, long elapsedNanos) {
    }
}
