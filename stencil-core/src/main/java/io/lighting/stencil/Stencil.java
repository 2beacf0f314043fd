package io.lighting.stencil;

import io.lighting.stencil.filter.FilterRegistry;
import io.lighting.stencil.filter.Filters;
import io.lighting.stencil.loader.TemplateLoader;
import io.lighting.stencil.observe.TemplateObserver;
import io.lighting.stencil.template.Template;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Template engine: compile settings, the filter registry, the loader used by {@code getTemplate}
 * and {@code include}, and a cache of loaded templates.
 * <pre>{@code
 * Stencil stencil = Stencil.builder()
 *     .loader(new FileTemplateLoader(Path.of("templates")))
 *     .global("site", "example.org")
 *     .build();
 * String html = stencil.getTemplate("mail/welcome.html").render(Map.of("user", user));
 * }</pre>
 */
public final class Stencil {
    private static final Logger LOGGER = LoggerFactory.getLogger(Stencil.class);

    private final TemplateLoader loader;
    private final FilterRegistry filters;
    private final Escaper escaper;
    private final boolean cleanLines;
    private final Map<String, Object> globals;
    private final int maxIncludeDepth;
    private final List<TemplateObserver> observers;
    private final boolean cacheEnabled;
    private final Map<String, Template> cache = new ConcurrentHashMap<>();

    private Stencil(Builder builder) {
        this.loader = builder.loader;
        this.filters = builder.filters;
        this.escaper = builder.escaper;
        this.cleanLines = builder.cleanLines;
        this.globals = Collections.unmodifiableMap(new LinkedHashMap<>(builder.globals));
        this.maxIncludeDepth = builder.maxIncludeDepth;
        this.observers = List.copyOf(builder.observers);
        this.cacheEnabled = builder.cache;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Shared engine with default settings, the global filter registry and no loader.
     */
    public static Stencil standard() {
        return StandardHolder.INSTANCE;
    }

    public Template compile(String source) {
        return compile(source, null);
    }

    /**
     * @param name used in error messages and as the base of {@code ./} includes
     */
    public Template compile(String source, String name) {
        return Template.compile(this, name, source);
    }

    public Template getTemplate(String path) {
        return getTemplate(path, null);
    }

    /**
     * Loads and compiles the template at {@code path}, resolved against {@code relativeTo}.
     *
     * @throws TemplateNotFoundException if the loader has nothing under the path
     */
    public Template getTemplate(String path, String relativeTo) {
        if (loader == null) {
            throw new TemplateRuntimeException("No template loader configured, cannot load: " + path);
        }
        String name = loader.resolve(path, relativeTo);
        if (!cacheEnabled) {
            return load(name);
        }
        Template cached = cache.get(name);
        if (cached != null) {
            return cached;
        }
        return cache.computeIfAbsent(name, this::load);
    }

    /**
     * Compiles {@code source} once and renders it.
     */
    public String render(String source, Map<String, ?> values) {
        return compile(source).render(values);
    }

    public String renderTemplate(String path, Map<String, ?> values) {
        return getTemplate(path).render(values);
    }

    public void clearCache() {
        cache.clear();
    }

    public TemplateLoader loader() {
        return loader;
    }

    public FilterRegistry filters() {
        return filters;
    }

    public Escaper escaper() {
        return escaper;
    }

    public boolean cleanLines() {
        return cleanLines;
    }

    public Map<String, Object> globals() {
        return globals;
    }

    public int maxIncludeDepth() {
        return maxIncludeDepth;
    }

    public List<TemplateObserver> observers() {
        return observers;
    }

    private Template load(String name) {
        LOGGER.debug("Loading template {}", name);
        String source = loader.load(name);
        return compile(source, name);
    }

    private static final class StandardHolder {
        private static final Stencil INSTANCE = builder().build();
    }

    public static final class Builder {
        private TemplateLoader loader;
        private FilterRegistry filters = Filters.global();
        private Escaper escaper = Escaper.html();
        private boolean cleanLines = true;
        private final Map<String, Object> globals = new LinkedHashMap<>();
        private int maxIncludeDepth = 32;
        private final List<TemplateObserver> observers = new ArrayList<>();
        private boolean cache = true;

        private Builder() {
        }

        public Builder loader(TemplateLoader loader) {
            this.loader = Objects.requireNonNull(loader, "loader");
            return this;
        }

        /**
         * Defaults to {@link Filters#global()}.
         */
        public Builder filters(FilterRegistry filters) {
            this.filters = Objects.requireNonNull(filters, "filters");
            return this;
        }

        public Builder escaper(Escaper escaper) {
            this.escaper = Objects.requireNonNull(escaper, "escaper");
            return this;
        }

        /**
         * {@code true} selects {@link Escaper#html()}, {@code false} {@link Escaper#none()}.
         */
        public Builder autoescape(boolean autoescape) {
            this.escaper = autoescape ? Escaper.html() : Escaper.none();
            return this;
        }

        public Builder cleanLines(boolean cleanLines) {
            this.cleanLines = cleanLines;
            return this;
        }

        /**
         * Values visible to every render below the render values, including included templates.
         */
        public Builder globals(Map<String, ?> globals) {
            Objects.requireNonNull(globals, "globals");
            this.globals.putAll(globals);
            return this;
        }

        public Builder global(String name, Object value) {
            Objects.requireNonNull(name, "name");
            globals.put(name, value);
            return this;
        }

        public Builder maxIncludeDepth(int maxIncludeDepth) {
            if (maxIncludeDepth < 1) {
                throw new IllegalArgumentException("maxIncludeDepth must be positive: " + maxIncludeDepth);
            }
            this.maxIncludeDepth = maxIncludeDepth;
            return this;
        }

        public Builder observers(List<? extends TemplateObserver> observers) {
            Objects.requireNonNull(observers, "observers");
            this.observers.clear();
            observers.forEach(this::observer);
            return this;
        }

        public Builder observer(TemplateObserver observer) {
            observers.add(Objects.requireNonNull(observer, "observer"));
            return this;
        }

        /**
         * Caches templates returned by {@code getTemplate} by resolved name. On by default.
         */
        public Builder cache(boolean cache) {
            this.cache = cache;
            return this;
        }

        public Stencil build() {
            return new Stencil(this);
        }
    }
}
