package io.lighting.stencil.template;

import io.lighting.stencil.TemplateLexException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits template source into tokens.
 * <p>
 * Outside a directive the lexer only knows comments, the opening delimiter and raw text.
 * Inside a directive it tries each rule of {@link #DIRECTIVE_RULES} in order and takes the
 * first one that matches at the current position; no rule ever backtracks over an emitted token.
 */
final class TemplateLexer {
    static final String LDELIM = "{{";
    static final String RDELIM = "}}";

    private static final Pattern COMMENT = Pattern.compile("\\{\\{#.*?#\\}\\}", Pattern.DOTALL);
    private static final Pattern OPEN = Pattern.compile("\\{\\{");
    private static final Pattern RAW = Pattern.compile(".+?(?=\\{\\{)|.+", Pattern.DOTALL);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final List<Rule> DIRECTIVE_RULES = List.of(
        new Rule(TokenKind.RDELIM, "\\}\\}"),
        new Rule(TokenKind.KEYWORD,
            "(?:if|elif|elseif|else|endif|for|in|endfor|end|set|assign|include|add|use)(?!\\w)"),
        new Rule(TokenKind.COMPARISON, "==|!=|<=|>=|<|>"),
        new Rule(TokenKind.ASSIGN, "="),
        new Rule(TokenKind.LOGIC, "(?:and|or|not)(?!\\w)"),
        new Rule(TokenKind.DOT, "\\."),
        new Rule(TokenKind.COLON, ":"),
        new Rule(TokenKind.COMMA, ","),
        new Rule(TokenKind.PIPE, "\\|"),
        new Rule(TokenKind.LPAREN, "\\("),
        new Rule(TokenKind.RPAREN, "\\)"),
        new Rule(TokenKind.LBRACKET, "\\["),
        new Rule(TokenKind.RBRACKET, "\\]"),
        new Rule(TokenKind.FLOAT, "-?\\d+\\.\\d+"),
        new Rule(TokenKind.INTEGER, "-?\\d+"),
        new Rule(TokenKind.STRING, "\"((?:[^\"\\\\]|\\\\.)*)\""),
        new Rule(TokenKind.STRING, "'((?:[^'\\\\]|\\\\.)*)'"),
        new Rule(TokenKind.IDENTIFIER, "[A-Za-z_]\\w*")
    );

    private final String name;
    private final String source;
    private int index;
    private boolean insideDirective;

    TemplateLexer(String name, String source) {
        this.name = name;
        this.source = source;
    }

    List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (!isAtEnd()) {
            if (insideDirective) {
                lexDirective(tokens);
            } else {
                lexLiteral(tokens);
            }
        }
        return tokens;
    }

    private void lexLiteral(List<Token> tokens) {
        Matcher comment = match(COMMENT);
        if (comment != null) {
            index = comment.end();
            return;
        }
        Matcher open = match(OPEN);
        if (open != null) {
            tokens.add(new Token(TokenKind.LDELIM, LDELIM, index));
            index = open.end();
            insideDirective = true;
            return;
        }
        Matcher raw = match(RAW);
        if (raw == null) {
            throw new TemplateLexException(name, source, index);
        }
        tokens.add(new Token(TokenKind.RAW, raw.group(), index));
        index = raw.end();
    }

    private void lexDirective(List<Token> tokens) {
        Matcher whitespace = match(WHITESPACE);
        if (whitespace != null) {
            index = whitespace.end();
            return;
        }
        for (Rule rule : DIRECTIVE_RULES) {
            Matcher matcher = match(rule.pattern());
            if (matcher == null) {
                continue;
            }
            tokens.add(new Token(rule.kind(), decode(rule.kind(), matcher), index));
            if (rule.kind() == TokenKind.RDELIM) {
                insideDirective = false;
            }
            index = matcher.end();
            return;
        }
        throw new TemplateLexException(name, source, index);
    }

    private Object decode(TokenKind kind, Matcher matcher) {
        try {
            return switch (kind) {
                case INTEGER -> Long.parseLong(matcher.group());
                case FLOAT -> Double.parseDouble(matcher.group());
                case STRING -> unescape(matcher.group(1));
                default -> matcher.group();
            };
        } catch (NumberFormatException ex) {
            throw new TemplateLexException("number out of range '" + matcher.group() + "'", name, source, index);
        }
    }

    private Matcher match(Pattern pattern) {
        Matcher matcher = pattern.matcher(source);
        matcher.region(index, source.length());
        matcher.useTransparentBounds(true);
        if (matcher.lookingAt() && matcher.end() > index) {
            return matcher;
        }
        return null;
    }

    private boolean isAtEnd() {
        return index >= source.length();
    }

    static String unescape(String literal) {
        if (literal.indexOf('\\') < 0) {
            return literal;
        }
        StringBuilder builder = new StringBuilder(literal.length());
        for (int i = 0; i < literal.length(); i++) {
            char ch = literal.charAt(i);
            if (ch != '\\' || i + 1 >= literal.length()) {
                builder.append(ch);
                continue;
            }
            char next = literal.charAt(++i);
            switch (next) {
                case 'n' -> builder.append('\n');
                case 't' -> builder.append('\t');
                case 'r' -> builder.append('\r');
                default -> builder.append(next);
            }
        }
        return builder.toString();
    }

    private record Rule(TokenKind kind, Pattern pattern) {
        private Rule(TokenKind kind, String regex) {
            this(kind, Pattern.compile(regex));
        }
    }
}
