package io.lighting.stencil.template;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

interface TemplateExpression {
    Object evaluate(TemplateContext context);
}

final class LiteralExpression implements TemplateExpression {
    private final Object value;

    LiteralExpression(Object value) {
        this.value = value;
    }

    @Override
    public Object evaluate(TemplateContext context) {
        return value;
    }
}

final class IdentifierExpression implements TemplateExpression {
    private final String name;

    IdentifierExpression(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    @Override
    public Object evaluate(TemplateContext context) {
        return context.resolveName(name);
    }
}

/**
 * {@code base.name} and {@code base[key]}; dotted access is a literal string key.
 */
final class AttributeExpression implements TemplateExpression {
    private final TemplateExpression base;
    private final TemplateExpression key;

    AttributeExpression(TemplateExpression base, TemplateExpression key) {
        this.base = Objects.requireNonNull(base, "base");
        this.key = Objects.requireNonNull(key, "key");
    }

    @Override
    public Object evaluate(TemplateContext context) {
        Object target = base.evaluate(context);
        return context.resolveAttribute(target, key.evaluate(context));
    }
}

final class NotExpression implements TemplateExpression {
    private final TemplateExpression operand;

    NotExpression(TemplateExpression operand) {
        this.operand = Objects.requireNonNull(operand, "operand");
    }

    @Override
    public Object evaluate(TemplateContext context) {
        return !Values.isTruthy(operand.evaluate(context));
    }
}

final class ListExpression implements TemplateExpression {
    private final List<TemplateExpression> items;

    ListExpression(List<TemplateExpression> items) {
        this.items = List.copyOf(items);
    }

    @Override
    public Object evaluate(TemplateContext context) {
        List<Object> values = new ArrayList<>(items.size());
        for (TemplateExpression item : items) {
            values.add(item.evaluate(context));
        }
        return values;
    }
}

final class PipeExpression implements TemplateExpression {
    private final TemplateExpression base;
    private final String filterName;
    private final List<TemplateExpression> arguments;

    PipeExpression(TemplateExpression base, String filterName, List<TemplateExpression> arguments) {
        this.base = Objects.requireNonNull(base, "base");
        this.filterName = Objects.requireNonNull(filterName, "filterName");
        this.arguments = List.copyOf(arguments);
    }

    @Override
    public Object evaluate(TemplateContext context) {
        Object value = base.evaluate(context);
        List<Object> args = new ArrayList<>(arguments.size());
        for (TemplateExpression argument : arguments) {
            args.add(argument.evaluate(context));
        }
        return context.applyFilter(filterName, value, args);
    }
}

enum BinaryOp {
    OR("or"),
    AND("and"),
    EQ("=="),
    NE("!="),
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">=");

    private final String symbol;

    BinaryOp(String symbol) {
        this.symbol = symbol;
    }

    static BinaryOp fromSymbol(String symbol) {
        for (BinaryOp op : values()) {
            if (op.symbol.equals(symbol)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown operator: " + symbol);
    }
}

final class BinaryExpression implements TemplateExpression {
    private final TemplateExpression left;
    private final TemplateExpression right;
    private final BinaryOp op;

    BinaryExpression(TemplateExpression left, BinaryOp op, TemplateExpression right) {
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
        this.op = Objects.requireNonNull(op, "op");
    }

    @Override
    public Object evaluate(TemplateContext context) {
        // and/or yield the operand that decided the result
        if (op == BinaryOp.OR) {
            Object value = left.evaluate(context);
            return Values.isTruthy(value) ? value : right.evaluate(context);
        }
        if (op == BinaryOp.AND) {
            Object value = left.evaluate(context);
            return Values.isTruthy(value) ? right.evaluate(context) : value;
        }
        Object leftValue = left.evaluate(context);
        Object rightValue = right.evaluate(context);
        return switch (op) {
            case EQ -> Values.areEqual(leftValue, rightValue);
            case NE -> !Values.areEqual(leftValue, rightValue);
            case LT -> Values.compare(leftValue, rightValue) < 0;
            case LE -> Values.compare(leftValue, rightValue) <= 0;
            case GT -> Values.compare(leftValue, rightValue) > 0;
            case GE -> Values.compare(leftValue, rightValue) >= 0;
            case OR, AND -> throw new IllegalStateException("Unexpected operator: " + op);
        };
    }
}
