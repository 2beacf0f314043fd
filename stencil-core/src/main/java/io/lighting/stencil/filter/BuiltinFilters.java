package io.lighting.stencil.filter;

import io.lighting.stencil.Escaper;
import io.lighting.stencil.SafeString;
import io.lighting.stencil.template.Values;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.regex.Pattern;

/**
 * Filters every registry starts with.
 */
final class BuiltinFilters {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private BuiltinFilters() {
    }

    static <R extends FilterRegistry> R registerAll(R registry) {
        registry.register("strip", (value, args) -> {
            expectArgs("strip", args, 0, 0);
            return text("strip", value).strip();
        });
        registry.register("capitalize", (value, args) -> {
            expectArgs("capitalize", args, 0, 0);
            return capitalize(text("capitalize", value));
        });
        registry.register("upper", (value, args) -> {
            expectArgs("upper", args, 0, 0);
            return text("upper", value).toUpperCase();
        });
        registry.register("lower", (value, args) -> {
            expectArgs("lower", args, 0, 0);
            return text("lower", value).toLowerCase();
        });
        registry.register("escape", (value, args) -> {
            expectArgs("escape", args, 0, 0);
            if (value instanceof SafeString) {
                return value;
            }
            return SafeString.of(Escaper.escapeHtml(Values.toText(value)));
        });
        Filter noescape = (value, args) -> {
            expectArgs("noescape", args, 0, 0);
            return SafeString.of(Values.toText(value));
        };
        registry.register("noescape", noescape);
        registry.register("safe", noescape);
        registry.register("split", (value, args) -> {
            expectArgs("split", args, 0, 1);
            return split(Values.toText(value), args.isEmpty() ? null : args.get(0));
        });
        registry.register("join", (value, args) -> {
            expectArgs("join", args, 0, 1);
            String separator = args.isEmpty() ? "" : Values.toText(args.get(0));
            StringJoiner joiner = new StringJoiner(separator);
            for (Object item : Values.toIterable(value, "join")) {
                joiner.add(Values.toText(item));
            }
            return joiner.toString();
        });
        registry.register("length", (value, args) -> {
            expectArgs("length", args, 0, 0);
            return (long) length(value);
        });
        registry.register("reverse", (value, args) -> {
            expectArgs("reverse", args, 0, 0);
            if (value instanceof CharSequence sequence) {
                return new StringBuilder(sequence).reverse().toString();
            }
            List<Object> items = toList(value, "reverse");
            Collections.reverse(items);
            return items;
        });
        registry.register("first", (value, args) -> {
            expectArgs("first", args, 0, 0);
            List<Object> items = elements(value, "first");
            return items.isEmpty() ? null : items.get(0);
        });
        registry.register("last", (value, args) -> {
            expectArgs("last", args, 0, 0);
            List<Object> items = elements(value, "last");
            return items.isEmpty() ? null : items.get(items.size() - 1);
        });
        registry.register("default", (value, args) -> {
            expectArgs("default", args, 1, 1);
            return Values.isTruthy(value) ? value : args.get(0);
        });
        registry.register("add", (value, args) -> {
            expectArgs("add", args, 1, 1);
            return add(value, args.get(0));
        });
        return registry;
    }

    private static void expectArgs(String name, List<Object> args, int min, int max) {
        if (args.size() < min || args.size() > max) {
            String expected = min == max ? String.valueOf(min) : min + " to " + max;
            throw new IllegalArgumentException(
                "Filter '" + name + "' expects " + expected + " argument(s) but got " + args.size()
            );
        }
    }

    private static String text(String name, Object value) {
        if (value instanceof CharSequence sequence) {
            return sequence.toString();
        }
        throw new IllegalArgumentException(
            "Filter '" + name + "' expects text but got " + describe(value)
        );
    }

    private static String capitalize(String text) {
        if (text.isEmpty()) {
            return text;
        }
        return text.substring(0, 1).toUpperCase() + text.substring(1).toLowerCase();
    }

    private static List<String> split(String text, Object delimiter) {
        if (delimiter == null) {
            String trimmed = text.strip();
            if (trimmed.isEmpty()) {
                return List.of();
            }
            return Arrays.asList(WHITESPACE.split(trimmed));
        }
        String separator = Values.toText(delimiter);
        if (separator.isEmpty()) {
            throw new IllegalArgumentException("Filter 'split' requires a non-empty separator");
        }
        return Arrays.asList(text.split(Pattern.quote(separator), -1));
    }

    private static int length(Object value) {
        if (value instanceof CharSequence sequence) {
            return sequence.length();
        }
        if (value instanceof Collection<?> collection) {
            return collection.size();
        }
        if (value instanceof Map<?, ?> map) {
            return map.size();
        }
        if (value != null && value.getClass().isArray()) {
            return java.lang.reflect.Array.getLength(value);
        }
        return toList(value, "length").size();
    }

    private static List<Object> elements(Object value, String name) {
        if (value instanceof CharSequence sequence) {
            List<Object> chars = new ArrayList<>(sequence.length());
            sequence.chars().forEach(ch -> chars.add(String.valueOf((char) ch)));
            return chars;
        }
        return toList(value, name);
    }

    private static List<Object> toList(Object value, String name) {
        List<Object> items = new ArrayList<>();
        for (Object item : Values.toIterable(value, name)) {
            items.add(item);
        }
        return items;
    }

    private static Object add(Object left, Object right) {
        if (!(left instanceof Number leftNum) || !(right instanceof Number rightNum)) {
            throw new IllegalArgumentException(
                "Filter 'add' expects numbers but got " + describe(left) + " and " + describe(right)
            );
        }
        if (Values.isIntegral(leftNum) && Values.isIntegral(rightNum)) {
            return Math.addExact(leftNum.longValue(), rightNum.longValue());
        }
        return leftNum.doubleValue() + rightNum.doubleValue();
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
