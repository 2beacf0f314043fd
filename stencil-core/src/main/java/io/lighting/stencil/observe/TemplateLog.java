package io.lighting.stencil.observe;

import io.lighting.stencil.TemplateCompileException;
import java.util.Objects;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Observer that writes one line per compile and/or render.
 * <p>
 * Built through {@link Builder}; instances are immutable and thread safe. Lines go to a
 * {@code Consumer<String>} sink, an SLF4J logger at INFO unless configured otherwise:
 * <pre>
 * TEMPLATE: compiled mail/welcome.html
 * TEMPLATE: rendered mail/welcome.html (412 chars) elapsed=81234ns
 * TEMPLATE: render failed mail/welcome.html: Missing template binding: user
 * </pre>
 */
public final class TemplateLog implements TemplateObserver {
    private static final Logger LOGGER = LoggerFactory.getLogger(TemplateLog.class);
    private static final String INLINE_NAME = "<inline>";

    private final boolean enabled;
    private final boolean logOnCompile;
    private final boolean logOnRender;
    private final boolean includeElapsed;
    private final String prefix;
    private final Consumer<String> sink;

    private TemplateLog(Builder builder) {
        this.enabled = builder.enabled;
        this.logOnCompile = builder.logOnCompile;
        this.logOnRender = builder.logOnRender;
        this.includeElapsed = builder.includeElapsed;
        this.prefix = builder.prefix;
        this.sink = builder.sink;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public void afterCompile(String name, long elapsedNanos) {
        if (!enabled || !logOnCompile) {
            return;
        }
        sink.accept(withElapsed(prefix + " compiled " + displayName(name), elapsedNanos));
    }

    @Override
    public void onCompileError(String name, TemplateCompileException error, long elapsedNanos) {
        if (!enabled || !logOnCompile) {
            return;
        }
        sink.accept(prefix + " compile failed " + displayName(name) + ": " + error.getMessage());
    }

    @Override
    public void afterRender(String name, String output, long elapsedNanos) {
        if (!enabled || !logOnRender) {
            return;
        }
        String line = prefix + " rendered " + displayName(name) + " (" + output.length() + " chars)";
        sink.accept(withElapsed(line, elapsedNanos));
    }

    @Override
    public void onRenderError(String name, RuntimeException error, long elapsedNanos) {
        if (!enabled || !logOnRender) {
            return;
        }
        sink.accept(prefix + " render failed " + displayName(name) + ": " + error.getMessage());
    }

    private String withElapsed(String line, long elapsedNanos) {
        if (!includeElapsed) {
            return line;
        }
        return line + " elapsed=" + elapsedNanos + "ns";
    }

    private static String displayName(String name) {
        return name == null ? INLINE_NAME : name;
    }

    public static final class Builder {
        private boolean enabled = true;
        private boolean logOnCompile = false;
        private boolean logOnRender = true;
        private boolean includeElapsed = false;
        private String prefix = "TEMPLATE:";
        private Consumer<String> sink = LOGGER::info;

        /**
         * Master switch; a disabled log writes nothing.
         */
        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder logOnCompile(boolean enabled) {
            this.logOnCompile = enabled;
            return this;
        }

        public Builder logOnRender(boolean enabled) {
            this.logOnRender = enabled;
            return this;
        }

        /**
         * Appends {@code elapsed=...ns} to compile and render lines.
         */
        public Builder includeElapsed(boolean enabled) {
            this.includeElapsed = enabled;
            return this;
        }

        public Builder prefix(String prefix) {
            if (prefix == null || prefix.isBlank()) {
                throw new IllegalArgumentException("prefix must not be blank");
            }
            this.prefix = prefix;
            return this;
        }

        public Builder sink(Consumer<String> sink) {
            this.sink = Objects.requireNonNull(sink, "sink");
            return this;
        }

        /**
         * At least one of compile or render logging must be on.
         */
        public TemplateLog build() {
            if (!logOnCompile && !logOnRender) {
                throw new IllegalStateException("At least one of logOnCompile/logOnRender must be enabled");
            }
            return new TemplateLog(this);
        }
    }
}
