package io.lighting.stencil.template;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

sealed interface TemplateNode permits RawNode, OutputNode, AssignNode, IfNode, ForNode, IncludeNode,
    SequenceNode {
}

record RawNode(String text) implements TemplateNode {
    RawNode {
        Objects.requireNonNull(text, "text");
    }
}

record OutputNode(TemplateExpression expression) implements TemplateNode {
    OutputNode {
        Objects.requireNonNull(expression, "expression");
    }
}

record AssignNode(String name, TemplateExpression expression) implements TemplateNode {
    AssignNode {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(expression, "expression");
    }
}

record IfNode(List<Branch> branches, SequenceNode elseBody) implements TemplateNode {
    IfNode {
        branches = List.copyOf(branches);
        if (branches.isEmpty()) {
            throw new IllegalArgumentException("if requires at least one branch");
        }
    }

    record Branch(TemplateExpression condition, SequenceNode body) {
        Branch {
            Objects.requireNonNull(condition, "condition");
            Objects.requireNonNull(body, "body");
        }
    }
}

record ForNode(String variable, TemplateExpression source, SequenceNode body) implements TemplateNode {
    ForNode {
        Objects.requireNonNull(variable, "variable");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(body, "body");
    }
}

record IncludeNode(String path, Map<String, TemplateExpression> arguments) implements TemplateNode {
    IncludeNode {
        Objects.requireNonNull(path, "path");
        arguments = Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }
}

record SequenceNode(List<TemplateNode> children) implements TemplateNode {
    SequenceNode {
        children = List.copyOf(children);
    }
}
