package io.lighting.stencil;

import java.util.Objects;

/**
 * A compilation failure pinned to a position in the template source.
 * <p>
 * Line and column are 1-based and derived from the character offset, so the message reads
 * {@code "unexpected token (in page.html at line 3, col 7)"}.
 */
public abstract class TemplateCompileException extends TemplateException {
    private final String reason;
    private final String templateName;
    private final int offset;
    private final int line;
    private final int column;

    protected TemplateCompileException(String reason, String templateName, String source, int offset) {
        this(reason, templateName, Objects.requireNonNull(source, "source"), offset, lineOf(source, offset));
    }

    private TemplateCompileException(String reason, String templateName, String source, int offset, int line) {
        super(reason + " (" + location(templateName, line, columnOf(source, offset)) + ")");
        this.reason = reason;
        this.templateName = templateName;
        this.offset = offset;
        this.line = line;
        this.column = columnOf(source, offset);
    }

    public String reason() {
        return reason;
    }

    public String templateName() {
        return templateName;
    }

    public int offset() {
        return offset;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }

    private static String location(String templateName, int line, int column) {
        String position = "at line " + line + ", col " + column;
        return templateName == null ? position : "in " + templateName + " " + position;
    }

    private static int lineOf(String source, int offset) {
        int end = clamp(source, offset);
        int line = 1;
        for (int i = 0; i < end; i++) {
            if (source.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }

    private static int columnOf(String source, int offset) {
        int end = clamp(source, offset);
        int lineStart = source.lastIndexOf('\n', end - 1);
        return end - lineStart;
    }

    private static int clamp(String source, int offset) {
        return Math.max(0, Math.min(offset, source.length()));
    }
}
