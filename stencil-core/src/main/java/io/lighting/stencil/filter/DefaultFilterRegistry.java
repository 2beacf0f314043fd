package io.lighting.stencil.filter;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

public final class DefaultFilterRegistry implements FilterRegistry {
    private final Map<String, Filter> filters = new ConcurrentHashMap<>();

    @Override
    public DefaultFilterRegistry register(String name, Filter filter) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(filter, "filter");
        String key = name.trim();
        if (key.isEmpty()) {
            throw new IllegalArgumentException("Filter name must not be blank");
        }
        filters.put(key, filter);
        return this;
    }

    @Override
    public Filter find(String name) {
        Objects.requireNonNull(name, "name");
        return filters.get(name);
    }

    public Set<String> names() {
        return Set.copyOf(filters.keySet());
    }
}
