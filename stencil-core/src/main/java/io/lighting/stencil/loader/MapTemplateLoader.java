package io.lighting.stencil.loader;

import io.lighting.stencil.TemplateNotFoundException;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory loader, keyed by canonical name.
 */
public final class MapTemplateLoader implements TemplateLoader {
    private final Map<String, String> sources = new ConcurrentHashMap<>();

    public MapTemplateLoader() {
    }

    public MapTemplateLoader(Map<String, String> sources) {
        Objects.requireNonNull(sources, "sources");
        sources.forEach(this::put);
    }

    public MapTemplateLoader put(String path, String source) {
        Objects.requireNonNull(source, "source");
        sources.put(TemplateLoader.normalize(path, null), source);
        return this;
    }

    @Override
    public String load(String name) {
        String source = sources.get(name);
        if (source == null) {
            throw new TemplateNotFoundException(name);
        }
        return source;
    }
}
