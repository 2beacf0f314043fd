package io.lighting.stencil.filter;

public interface FilterRegistry {
    /**
     * Returns the filter registered under {@code name}, or {@code null}.
     */
    Filter find(String name);

    /**
     * Registers {@code filter}, replacing any filter of the same name.
     */
    FilterRegistry register(String name, Filter filter);

    /**
     * A fresh registry holding only the built-in filters.
     */
    static FilterRegistry standard() {
        return BuiltinFilters.registerAll(new DefaultFilterRegistry());
    }
}
