package io.lighting.stencil.template;

import io.lighting.stencil.TemplateRuntimeException;
import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Value semantics shared by expressions, the renderer and filters: truthiness, equality,
 * ordering, string form and iteration.
 */
public final class Values {
    private Values() {
    }

    public static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof Number number) {
            return number.doubleValue() != 0.0d;
        }
        if (value instanceof CharSequence sequence) {
            return sequence.length() > 0;
        }
        if (value instanceof Collection<?> collection) {
            return !collection.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return !map.isEmpty();
        }
        if (value instanceof Iterable<?> iterable) {
            return iterable.iterator().hasNext();
        }
        if (value instanceof Optional<?> optional) {
            return optional.isPresent();
        }
        if (value.getClass().isArray()) {
            return Array.getLength(value) > 0;
        }
        return true;
    }

    /**
     * String form used for output. {@code null} renders as the empty string.
     */
    public static String toText(Object value) {
        if (value == null) {
            return "";
        }
        if (value.getClass().isArray()) {
            return toList(value).toString();
        }
        return value.toString();
    }

    public static boolean areEqual(Object left, Object right) {
        if (left instanceof Number leftNum && right instanceof Number rightNum) {
            return compareNumbers(leftNum, rightNum) == 0;
        }
        if (left instanceof CharSequence && right instanceof CharSequence) {
            return left.toString().equals(right.toString());
        }
        return Objects.equals(left, right);
    }

    public static int compare(Object left, Object right) {
        if (left == null || right == null) {
            throw new TemplateRuntimeException("Cannot compare null values");
        }
        if (left instanceof Number leftNum && right instanceof Number rightNum) {
            return compareNumbers(leftNum, rightNum);
        }
        if (left instanceof CharSequence && right instanceof CharSequence) {
            return left.toString().compareTo(right.toString());
        }
        if (left instanceof Comparable<?> comparable && left.getClass().isInstance(right)) {
            @SuppressWarnings("unchecked")
            Comparable<Object> cast = (Comparable<Object>) comparable;
            return cast.compareTo(right);
        }
        throw new TemplateRuntimeException(
            "Cannot compare values of type " + left.getClass().getSimpleName()
                + " and " + right.getClass().getSimpleName()
        );
    }

    /**
     * Returns the elements a {@code for} loop walks over: an {@link Iterable}, an array, or the
     * entries of a {@link Map}.
     */
    public static Iterable<?> toIterable(Object value, String name) {
        if (value == null) {
            throw new TemplateRuntimeException("Iterable source '" + name + "' is null");
        }
        if (value instanceof Iterable<?> iterable) {
            return iterable;
        }
        if (value instanceof Map<?, ?> map) {
            return map.entrySet();
        }
        if (value.getClass().isArray()) {
            return toList(value);
        }
        throw new TemplateRuntimeException(
            "Expected iterable for '" + name + "' but got " + value.getClass().getName()
        );
    }

    public static List<Object> toList(Object array) {
        int length = Array.getLength(array);
        List<Object> items = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            items.add(Array.get(array, i));
        }
        return items;
    }

    public static boolean isIntegral(Number number) {
        return number instanceof Long || number instanceof Integer
            || number instanceof Short || number instanceof Byte
            || number instanceof java.math.BigInteger;
    }

    private static int compareNumbers(Number left, Number right) {
        if (!isFinite(left) || !isFinite(right)) {
            return Double.compare(left.doubleValue(), right.doubleValue());
        }
        return toDecimal(left).compareTo(toDecimal(right));
    }

    private static boolean isFinite(Number number) {
        if (number instanceof Double || number instanceof Float) {
            return Double.isFinite(number.doubleValue());
        }
        return true;
    }

    static BigDecimal toDecimal(Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal;
        }
        return new BigDecimal(number.toString());
    }
}
