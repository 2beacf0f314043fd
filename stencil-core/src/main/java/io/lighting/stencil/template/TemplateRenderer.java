package io.lighting.stencil.template;

import io.lighting.stencil.Stencil;
import io.lighting.stencil.TemplateRuntimeException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class TemplateRenderer {
    private static final Logger LOGGER = LoggerFactory.getLogger(TemplateRenderer.class);

    private final Template template;
    private final Stencil engine;

    TemplateRenderer(Template template) {
        this.template = template;
        this.engine = template.engine();
    }

    String render(TemplateContext context) {
        StringBuilder out = new StringBuilder();
        renderNode(template.root(), context, out);
        return out.toString();
    }

    private void renderNode(TemplateNode node, TemplateContext context, StringBuilder out) {
        if (node instanceof SequenceNode sequence) {
            for (TemplateNode child : sequence.children()) {
                renderNode(child, context, out);
            }
            return;
        }
        if (node instanceof RawNode raw) {
            out.append(raw.text());
            return;
        }
        if (node instanceof OutputNode output) {
            Object value = output.expression().evaluate(context);
            out.append(engine.escaper().apply(value, Values.toText(value)));
            return;
        }
        if (node instanceof AssignNode assign) {
            context.set(assign.name(), assign.expression().evaluate(context));
            return;
        }
        if (node instanceof IfNode ifNode) {
            renderIf(ifNode, context, out);
            return;
        }
        if (node instanceof ForNode forNode) {
            renderFor(forNode, context, out);
            return;
        }
        if (node instanceof IncludeNode include) {
            renderInclude(include, context, out);
            return;
        }
        throw new IllegalStateException("Unsupported node: " + node.getClass().getSimpleName());
    }

    private void renderIf(IfNode node, TemplateContext context, StringBuilder out) {
        for (IfNode.Branch branch : node.branches()) {
            if (Values.isTruthy(branch.condition().evaluate(context))) {
                renderNode(branch.body(), context, out);
                return;
            }
        }
        if (node.elseBody() != null) {
            renderNode(node.elseBody(), context, out);
        }
    }

    private void renderFor(ForNode node, TemplateContext context, StringBuilder out) {
        Object source = node.source().evaluate(context);
        for (Object item : Values.toIterable(source, node.variable())) {
            context.push(Map.of());
            try {
                context.set(node.variable(), item);
                renderNode(node.body(), context, out);
            } finally {
                context.pop();
            }
        }
    }

    private void renderInclude(IncludeNode node, TemplateContext context, StringBuilder out) {
        int depth = context.includeDepth() + 1;
        if (depth > engine.maxIncludeDepth()) {
            throw new TemplateRuntimeException(
                "Include depth exceeds " + engine.maxIncludeDepth() + " at '" + node.path() + "'"
            );
        }
        Map<String, Object> arguments = new LinkedHashMap<>();
        for (Map.Entry<String, TemplateExpression> entry : node.arguments().entrySet()) {
            arguments.put(entry.getKey(), entry.getValue().evaluate(context));
        }
        Template included = engine.getTemplate(node.path(), template.name());
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Including {} from {} with {}", included.name(), template.name(), arguments.keySet());
        }
        out.append(included.render(arguments, depth));
    }
}
