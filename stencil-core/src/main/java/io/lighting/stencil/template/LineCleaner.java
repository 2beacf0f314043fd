package io.lighting.stencil.template;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Removes the line that a statement tag occupies on its own, so that
 * <pre>
 * before
 * {{ if ok }}
 * X
 * {{ end }}
 * after
 * </pre>
 * renders without blank lines. Output tags ({@code {{ value }}}) are left alone.
 * <p>
 * Raw tokens are replaced in place and later tags see the edits of earlier ones.
 */
final class LineCleaner {
    private static final Pattern LINE_START = Pattern.compile("(^|\n)[ \t]*\\z");
    private static final Pattern LINE_END = Pattern.compile("^[ \t]*\r?\n");
    private static final Pattern TRAILING_BLANKS = Pattern.compile("[ \t]*\\z");

    private LineCleaner() {
    }

    static void clean(List<Token> tokens) {
        int open = -1;
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.is(TokenKind.LDELIM)) {
                open = i;
            } else if (token.is(TokenKind.RDELIM)) {
                int close = i;
                if (open >= 0 && isStatementTag(tokens, open)) {
                    trimAround(tokens, open, close);
                }
                open = -1;
            }
        }
    }

    private static boolean isStatementTag(List<Token> tokens, int open) {
        return TemplateParser.startsStatement(tokens, open + 1);
    }

    private static void trimAround(List<Token> tokens, int open, int close) {
        boolean first = open == 0;
        boolean last = close == tokens.size() - 1;
        Token before = first ? null : tokens.get(open - 1);
        Token after = last ? null : tokens.get(close + 1);

        boolean startsLine = first
            || before.is(TokenKind.RAW) && LINE_START.matcher(before.text()).find();
        boolean endsLine = last
            || after.is(TokenKind.RAW) && LINE_END.matcher(after.text()).find();
        if (!startsLine || !endsLine) {
            return;
        }
        if (!first) {
            String stripped = TRAILING_BLANKS.matcher(before.text()).replaceFirst("");
            tokens.set(open - 1, new Token(TokenKind.RAW, stripped, before.offset()));
        }
        if (!last) {
            String stripped = LINE_END.matcher(after.text()).replaceFirst("");
            tokens.set(close + 1, new Token(TokenKind.RAW, stripped, after.offset()));
        }
    }
}
