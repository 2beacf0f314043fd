package io.lighting.stencil.filter;

import java.util.List;

/**
 * A named transformation applied with {@code value | name: arg, arg}.
 * The piped value comes first, explicit parameters follow in order.
 */
@FunctionalInterface
public interface Filter {
    Object apply(Object value, List<Object> args);
}
