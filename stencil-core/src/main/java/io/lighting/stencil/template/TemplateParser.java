package io.lighting.stencil.template;

import io.lighting.stencil.TemplateSyntaxException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Recursive-descent parser from the token list to a {@link SequenceNode}.
 * <p>
 * Expression precedence, lowest first: {@code or}, {@code and}, {@code not}, comparison, pipe,
 * attribute access, atom. Block bodies are parsed until one of a caller-supplied set of
 * terminator keywords, which is left for the caller to consume.
 */
final class TemplateParser {
    private static final Set<String> IF_TERMINATORS = Set.of("elif", "elseif", "else", "end", "endif");
    private static final Set<String> ELSE_TERMINATORS = Set.of("end", "endif");
    private static final Set<String> FOR_TERMINATORS = Set.of("end", "endfor");
    // statement aliases that stay usable as variable and filter names
    private static final Set<String> SOFT_KEYWORDS = Set.of("assign", "add", "use");

    private final String name;
    private final String source;
    private final List<Token> tokens;
    private int index;

    TemplateParser(String name, String source, List<Token> tokens) {
        this.name = name;
        this.source = source;
        this.tokens = List.copyOf(tokens);
        this.index = 0;
    }

    /**
     * Lexes, optionally cleans statement lines, and parses {@code source}.
     */
    static SequenceNode parse(String name, String source, boolean cleanLines) {
        List<Token> tokens = new TemplateLexer(name, source).tokenize();
        if (cleanLines) {
            LineCleaner.clean(tokens);
        }
        return new TemplateParser(name, source, tokens).parse();
    }

    SequenceNode parse() {
        return parseNodes(Set.of());
    }

    private SequenceNode parseNodes(Set<String> terminators) {
        List<TemplateNode> nodes = new ArrayList<>();
        while (!isAtEnd()) {
            Token token = peek();
            if (token.is(TokenKind.RAW)) {
                advance();
                if (!token.text().isEmpty()) {
                    nodes.add(new RawNode(token.text()));
                }
                continue;
            }
            expect(TokenKind.LDELIM);
            Token head = peek();
            if (!startsStatement(tokens, index)) {
                TemplateExpression expression = parseExpression();
                expect(TokenKind.RDELIM);
                nodes.add(new OutputNode(expression));
                continue;
            }
            if (terminators.contains(head.text())) {
                // leave "{{ keyword" for the enclosing block
                index--;
                return new SequenceNode(nodes);
            }
            advance();
            nodes.add(parseStatement(head));
        }
        if (!terminators.isEmpty()) {
            throw syntax("Expected one of " + describe(terminators) + " but found end of input", source.length());
        }
        return new SequenceNode(nodes);
    }

    private TemplateNode parseStatement(Token keyword) {
        return switch (keyword.text()) {
            case "if" -> parseIf();
            case "for" -> parseFor();
            case "set", "assign" -> parseAssign();
            case "include", "add", "use" -> parseInclude();
            default -> throw syntax("Unexpected keyword '" + keyword.text() + "'", keyword.offset());
        };
    }

    private TemplateNode parseIf() {
        List<IfNode.Branch> branches = new ArrayList<>();
        TemplateExpression condition = parseExpression();
        expect(TokenKind.RDELIM);
        while (true) {
            SequenceNode body = parseNodes(IF_TERMINATORS);
            branches.add(new IfNode.Branch(condition, body));
            String terminator = consumeTerminator();
            switch (terminator) {
                case "elif", "elseif" -> {
                    condition = parseExpression();
                    expect(TokenKind.RDELIM);
                }
                case "else" -> {
                    expect(TokenKind.RDELIM);
                    SequenceNode elseBody = parseNodes(ELSE_TERMINATORS);
                    consumeTerminator();
                    expect(TokenKind.RDELIM);
                    return new IfNode(branches, elseBody);
                }
                default -> {
                    expect(TokenKind.RDELIM);
                    return new IfNode(branches, null);
                }
            }
        }
    }

    private TemplateNode parseFor() {
        String variable = expectName().text();
        Token separator = peek();
        if (separator.is(TokenKind.KEYWORD, "in") || separator.is(TokenKind.COLON)) {
            advance();
        } else {
            throw syntax("Expected 'in' or ':' but found " + separator.describe(), separator.offset());
        }
        TemplateExpression iterable = parseExpression();
        expect(TokenKind.RDELIM);
        SequenceNode body = parseNodes(FOR_TERMINATORS);
        consumeTerminator();
        expect(TokenKind.RDELIM);
        return new ForNode(variable, iterable, body);
    }

    private TemplateNode parseAssign() {
        String variable = expectName().text();
        expect(TokenKind.ASSIGN);
        TemplateExpression expression = parseExpression();
        expect(TokenKind.RDELIM);
        return new AssignNode(variable, expression);
    }

    private TemplateNode parseInclude() {
        String path = expect(TokenKind.STRING).text();
        Map<String, TemplateExpression> arguments = new LinkedHashMap<>();
        while (!peek().is(TokenKind.RDELIM)) {
            Token argument = expectName();
            expect(TokenKind.ASSIGN);
            if (arguments.containsKey(argument.text())) {
                throw syntax("Duplicate include argument '" + argument.text() + "'", argument.offset());
            }
            arguments.put(argument.text(), parseExpression());
            if (peek().is(TokenKind.COMMA)) {
                advance();
            }
        }
        expect(TokenKind.RDELIM);
        return new IncludeNode(path, arguments);
    }

    private String consumeTerminator() {
        expect(TokenKind.LDELIM);
        return expect(TokenKind.KEYWORD).text();
    }

    private TemplateExpression parseExpression() {
        return parseOr();
    }

    private TemplateExpression parseOr() {
        TemplateExpression left = parseAnd();
        while (peek().is(TokenKind.LOGIC, "or")) {
            advance();
            left = new BinaryExpression(left, BinaryOp.OR, parseAnd());
        }
        return left;
    }

    private TemplateExpression parseAnd() {
        TemplateExpression left = parseNot();
        while (peek().is(TokenKind.LOGIC, "and")) {
            advance();
            left = new BinaryExpression(left, BinaryOp.AND, parseNot());
        }
        return left;
    }

    private TemplateExpression parseNot() {
        if (peek().is(TokenKind.LOGIC, "not")) {
            advance();
            return new NotExpression(parseNot());
        }
        return parseComparison();
    }

    private TemplateExpression parseComparison() {
        TemplateExpression left = parsePipe();
        if (!peek().is(TokenKind.COMPARISON)) {
            return left;
        }
        BinaryOp op = BinaryOp.fromSymbol(advance().text());
        TemplateExpression right = parsePipe();
        Token next = peek();
        if (next.is(TokenKind.COMPARISON)) {
            throw syntax("Comparison operators cannot be chained", next.offset());
        }
        return new BinaryExpression(left, op, right);
    }

    private TemplateExpression parsePipe() {
        TemplateExpression expression = parseAttribute();
        while (peek().is(TokenKind.PIPE)) {
            advance();
            Token filter = peek();
            if (!filter.is(TokenKind.IDENTIFIER) && !filter.is(TokenKind.KEYWORD)) {
                throw syntax("Expected identifier but found " + filter.describe(), filter.offset());
            }
            advance();
            List<TemplateExpression> arguments = new ArrayList<>();
            if (peek().is(TokenKind.COLON)) {
                advance();
                arguments.add(parseAttribute());
                while (peek().is(TokenKind.COMMA) && !startsIncludeArgument(index + 1)) {
                    advance();
                    arguments.add(parseAttribute());
                }
            }
            expression = new PipeExpression(expression, filter.text(), arguments);
        }
        return expression;
    }

    private TemplateExpression parseAttribute() {
        Token token = peek();
        TemplateExpression expression;
        if (token.is(TokenKind.IDENTIFIER) && !isConstant(token) || isSoftKeyword(token)) {
            advance();
            expression = new IdentifierExpression(token.text());
        } else {
            expression = parseAtom();
        }
        while (true) {
            if (peek().is(TokenKind.DOT)) {
                advance();
                expression = new AttributeExpression(expression, parseAttributeName());
            } else if (peek().is(TokenKind.LBRACKET)) {
                advance();
                TemplateExpression key = parseExpression();
                expect(TokenKind.RBRACKET);
                expression = new AttributeExpression(expression, key);
            } else {
                return expression;
            }
        }
    }

    private TemplateExpression parseAttributeName() {
        Token token = advance();
        return switch (token.kind()) {
            case IDENTIFIER, KEYWORD, LOGIC -> new LiteralExpression(token.text());
            case INTEGER -> new LiteralExpression(token.value());
            default -> throw syntax("Expected attribute name but found " + token.describe(), token.offset());
        };
    }

    private TemplateExpression parseAtom() {
        Token token = advance();
        switch (token.kind()) {
            case STRING, INTEGER, FLOAT:
                return new LiteralExpression(token.value());
            case IDENTIFIER:
                if (isConstant(token)) {
                    return new LiteralExpression(constantValue(token.text()));
                }
                break;
            case LPAREN: {
                TemplateExpression inner = parseExpression();
                expect(TokenKind.RPAREN);
                return inner;
            }
            case LBRACKET:
                return parseList();
            default:
                break;
        }
        throw syntax("Expected expression but found " + token.describe(), token.offset());
    }

    private TemplateExpression parseList() {
        List<TemplateExpression> items = new ArrayList<>();
        if (peek().is(TokenKind.RBRACKET)) {
            advance();
            return new ListExpression(items);
        }
        items.add(parseExpression());
        while (peek().is(TokenKind.COMMA)) {
            advance();
            items.add(parseExpression());
        }
        expect(TokenKind.RBRACKET);
        return new ListExpression(items);
    }

    // "name =" after a comma belongs to the include tag, not to the filter arguments
    private boolean startsIncludeArgument(int position) {
        return isName(peek(position)) && peek(position + 1).is(TokenKind.ASSIGN);
    }

    /**
     * Whether the tag whose first token sits at {@code head} is a statement. A soft keyword
     * only starts a statement in its statement form ({@code assign x = ...}, {@code use "path"}).
     */
    static boolean startsStatement(List<Token> tokens, int head) {
        if (head >= tokens.size() || !tokens.get(head).is(TokenKind.KEYWORD)) {
            return false;
        }
        Token keyword = tokens.get(head);
        if (!SOFT_KEYWORDS.contains(keyword.text())) {
            return true;
        }
        if ("assign".equals(keyword.text())) {
            return head + 2 < tokens.size()
                && isName(tokens.get(head + 1))
                && tokens.get(head + 2).is(TokenKind.ASSIGN);
        }
        return head + 1 < tokens.size() && tokens.get(head + 1).is(TokenKind.STRING);
    }

    private static boolean isSoftKeyword(Token token) {
        return token.is(TokenKind.KEYWORD) && SOFT_KEYWORDS.contains(token.text());
    }

    private static boolean isName(Token token) {
        return token.is(TokenKind.IDENTIFIER) || isSoftKeyword(token);
    }

    private Token expectName() {
        Token token = peek();
        if (!isName(token)) {
            throw syntax("Expected identifier but found " + token.describe(), token.offset());
        }
        return advance();
    }

    private static boolean isConstant(Token token) {
        String text = token.text();
        return "true".equals(text) || "false".equals(text) || "null".equals(text);
    }

    private static Object constantValue(String text) {
        return switch (text) {
            case "true" -> Boolean.TRUE;
            case "false" -> Boolean.FALSE;
            default -> null;
        };
    }

    private Token expect(TokenKind kind) {
        Token token = peek();
        if (!token.is(kind)) {
            throw syntax("Expected " + describe(kind) + " but found " + token.describe(), token.offset());
        }
        return advance();
    }

    private Token advance() {
        Token token = peek();
        if (index < tokens.size()) {
            index++;
        }
        return token;
    }

    private Token peek() {
        return peek(index);
    }

    private Token peek(int position) {
        if (position < tokens.size()) {
            return tokens.get(position);
        }
        return Token.eof(source.length());
    }

    private boolean isAtEnd() {
        return index >= tokens.size();
    }

    private TemplateSyntaxException syntax(String reason, int offset) {
        return new TemplateSyntaxException(reason, name, source, offset);
    }

    private static String describe(TokenKind kind) {
        return switch (kind) {
            case LDELIM -> "'{{'";
            case RDELIM -> "'}}'";
            case ASSIGN -> "'='";
            case COLON -> "':'";
            case RPAREN -> "')'";
            case RBRACKET -> "']'";
            default -> kind.name().toLowerCase();
        };
    }

    private static String describe(Set<String> keywords) {
        List<String> sorted = new ArrayList<>(keywords);
        sorted.sort(null);
        return String.join(", ", sorted);
    }
}
