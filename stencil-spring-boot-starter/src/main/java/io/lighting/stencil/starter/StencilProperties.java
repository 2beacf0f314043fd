package io.lighting.stencil.starter;

import io.lighting.stencil.observe.TemplateLog;
import java.util.function.Consumer;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for Stencil.
 * <p>
 * Configure these properties under the "stencil" prefix in application.yml:
 * <pre>{@code
 * stencil:
 *   autoescape: true
 *   template-location: classpath:/templates/
 *   max-include-depth: 16
 *   log:
 *     enabled: true
 *     log-on-render: true
 *     include-elapsed: true
 * }</pre>
 */
@ConfigurationProperties(prefix = "stencil")
public class StencilProperties {

    private boolean autoescape = true;
    private boolean cleanLines = true;
    private String templateLocation = "classpath:/templates/";
    private String charset = "UTF-8";
    private boolean cache = true;
    private int maxIncludeDepth = 32;
    private TemplateLogProperties log = new TemplateLogProperties();

    public boolean isAutoescape() {
        return autoescape;
    }

    public void setAutoescape(boolean autoescape) {
        this.autoescape = autoescape;
    }

    public boolean isCleanLines() {
        return cleanLines;
    }

    public void setCleanLines(boolean cleanLines) {
        this.cleanLines = cleanLines;
    }

    public String getTemplateLocation() {
        return templateLocation;
    }

    public void setTemplateLocation(String templateLocation) {
        this.templateLocation = templateLocation;
    }

    public String getCharset() {
        return charset;
    }

    public void setCharset(String charset) {
        this.charset = charset;
    }

    public boolean isCache() {
        return cache;
    }

    public void setCache(boolean cache) {
        this.cache = cache;
    }

    public int getMaxIncludeDepth() {
        return maxIncludeDepth;
    }

    public void setMaxIncludeDepth(int maxIncludeDepth) {
        this.maxIncludeDepth = maxIncludeDepth;
    }

    public TemplateLogProperties getLog() {
        return log;
    }

    public void setLog(TemplateLogProperties log) {
        this.log = log;
    }

    public static class TemplateLogProperties {
        private boolean enabled = true;
        private boolean logOnCompile = false;
        private boolean logOnRender = true;
        private boolean includeElapsed = false;
        private String prefix = "TEMPLATE:";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isLogOnCompile() {
            return logOnCompile;
        }

        public void setLogOnCompile(boolean logOnCompile) {
            this.logOnCompile = logOnCompile;
        }

        public boolean isLogOnRender() {
            return logOnRender;
        }

        public void setLogOnRender(boolean logOnRender) {
            this.logOnRender = logOnRender;
        }

        public boolean isIncludeElapsed() {
            return includeElapsed;
        }

        public void setIncludeElapsed(boolean includeElapsed) {
            this.includeElapsed = includeElapsed;
        }

        public String getPrefix() {
            return prefix;
        }

        public void setPrefix(String prefix) {
            this.prefix = prefix;
        }

        /**
         * Returns {@code null} when logging is disabled or neither phase is logged.
         */
        public TemplateLog build(Consumer<String> logger) {
            if (!enabled || !logOnCompile && !logOnRender) {
                return null;
            }
            return TemplateLog.builder()
                .logOnCompile(logOnCompile)
                .logOnRender(logOnRender)
                .includeElapsed(includeElapsed)
                .prefix(prefix)
                .sink(logger)
                .build();
        }
    }
}
