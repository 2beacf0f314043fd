package io.lighting.stencil;

/**
 * Output escaping policy applied to the string form of every {@code {{ expression }}}.
 * <p>
 * Values wrapped in {@link SafeString} bypass the policy.
 */
@FunctionalInterface
public interface Escaper {
    String escape(String text);

    default String apply(Object value, String text) {
        if (value instanceof SafeString) {
            return text;
        }
        return escape(text);
    }

    /**
     * Escapes {@code & < > " '} as HTML entities.
     */
    static Escaper html() {
        return Escaper::escapeHtml;
    }

    static Escaper none() {
        return text -> text;
    }

    static String escapeHtml(String text) {
        StringBuilder out = null;
        for (int i = 0; i < text.length(); i++) {
            String entity = switch (text.charAt(i)) {
                case '&' -> "&amp;";
                case '<' -> "&lt;";
                case '>' -> "&gt;";
                case '"' -> "&#34;";
                case '\'' -> "&#39;";
                default -> null;
            };
            if (entity == null) {
                if (out != null) {
                    out.append(text.charAt(i));
                }
                continue;
            }
            if (out == null) {
                out = new StringBuilder(text.length() + 16);
                out.append(text, 0, i);
            }
            out.append(entity);
        }
        return out == null ? text : out.toString();
    }
}
