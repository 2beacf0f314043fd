package io.lighting.stencil;

import java.util.Objects;

/**
 * Text that is already safe for output. The active {@link Escaper} emits it unchanged.
 */
public final class SafeString implements CharSequence {
    private final String text;

    private SafeString(String text) {
        this.text = text;
    }

    public static SafeString of(Object value) {
        if (value instanceof SafeString safe) {
            return safe;
        }
        return new SafeString(value == null ? "" : value.toString());
    }

    @Override
    public int length() {
        return text.length();
    }

    @Override
    public char charAt(int index) {
        return text.charAt(index);
    }

    @Override
    public CharSequence subSequence(int start, int end) {
        return text.subSequence(start, end);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof SafeString safe && text.equals(safe.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(SafeString.class, text);
    }

    @Override
    public String toString() {
        return text;
    }
}
