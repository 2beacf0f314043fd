package io.lighting.stencil.filter;

/**
 * Process-wide filter registry. Built-in filters are registered when the class initialises;
 * host registrations stay visible to every template compiled afterwards.
 * <p>
 * Register custom filters before rendering starts; registering while renders are running is
 * not supported.
 */
public final class Filters {
    private static final DefaultFilterRegistry GLOBAL = BuiltinFilters.registerAll(new DefaultFilterRegistry());

    private Filters() {
    }

    public static FilterRegistry global() {
        return GLOBAL;
    }

    public static void register(String name, Filter filter) {
        GLOBAL.register(name, filter);
    }
}
