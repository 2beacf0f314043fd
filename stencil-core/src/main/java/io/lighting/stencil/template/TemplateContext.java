package io.lighting.stencil.template;

import io.lighting.stencil.TemplateException;
import io.lighting.stencil.TemplateRuntimeException;
import io.lighting.stencil.filter.Filter;
import io.lighting.stencil.filter.FilterRegistry;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Variable scopes of one render call.
 * <p>
 * Lookups walk from the innermost scope outwards and the first binding wins; assignments always
 * write the innermost scope. A context belongs to a single render and is never shared between
 * threads.
 */
final class TemplateContext {
    private final Deque<Map<String, Object>> scopes = new ArrayDeque<>();
    private final FilterRegistry filters;
    private final int includeDepth;

    TemplateContext(FilterRegistry filters, int includeDepth) {
        this.filters = Objects.requireNonNull(filters, "filters");
        this.includeDepth = includeDepth;
    }

    int includeDepth() {
        return includeDepth;
    }

    /**
     * Pushes a copy of {@code bindings} as the new innermost scope.
     */
    TemplateContext push(Map<String, ?> bindings) {
        scopes.push(new HashMap<>(bindings));
        return this;
    }

    void pop() {
        if (scopes.isEmpty()) {
            throw new IllegalStateException("No scope to pop");
        }
        scopes.pop();
    }

    void set(String name, Object value) {
        Objects.requireNonNull(name, "name");
        if (scopes.isEmpty()) {
            push(Map.of());
        }
        scopes.peek().put(name, value);
    }

    Object resolveName(String name) {
        for (Map<String, Object> scope : scopes) {
            if (scope.containsKey(name)) {
                return scope.get(name);
            }
        }
        throw new TemplateRuntimeException("Missing template binding: " + name);
    }

    Object resolveAttribute(Object target, Object key) {
        return AttributeResolver.resolve(target, key);
    }

    Object applyFilter(String name, Object value, List<Object> args) {
        Filter filter = filters.find(name);
        if (filter == null) {
            throw new TemplateRuntimeException("Unknown filter: " + name);
        }
        try {
            return filter.apply(value, args);
        } catch (TemplateException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new TemplateRuntimeException("Filter '" + name + "' failed: " + ex.getMessage(), ex);
        }
    }
}
