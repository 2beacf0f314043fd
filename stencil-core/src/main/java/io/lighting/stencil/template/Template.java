package io.lighting.stencil.template;

import io.lighting.stencil.Stencil;
import io.lighting.stencil.TemplateCompileException;
import io.lighting.stencil.observe.TemplateObserver;
import java.util.Map;
import java.util.Objects;

/**
 * A compiled template. Immutable; one instance may be rendered concurrently from several threads,
 * every render works on its own scopes.
 */
public final class Template {
    private final Stencil engine;
    private final String name;
    private final SequenceNode root;

    private Template(Stencil engine, String name, SequenceNode root) {
        this.engine = engine;
        this.name = name;
        this.root = root;
    }

    /**
     * Compiles {@code source} with the shared {@link Stencil#standard()} engine.
     */
    public static Template compile(String source) {
        return Stencil.standard().compile(source);
    }

    /**
     * Compiles {@code source} against {@code engine}'s settings and notifies its observers.
     * Prefer {@link Stencil#compile(String, String)}.
     *
     * @param name template name used in diagnostics and as the base of relative includes, may be
     *             {@code null}
     */
    public static Template compile(Stencil engine, String name, String source) {
        Objects.requireNonNull(engine, "engine");
        Objects.requireNonNull(source, "source");
        long start = System.nanoTime();
        SequenceNode root;
        try {
            root = TemplateParser.parse(name, source, engine.cleanLines());
        } catch (TemplateCompileException ex) {
            long elapsed = System.nanoTime() - start;
            for (TemplateObserver observer : engine.observers()) {
                observer.onCompileError(name, ex, elapsed);
            }
            throw ex;
        }
        long elapsed = System.nanoTime() - start;
        for (TemplateObserver observer : engine.observers()) {
            observer.afterCompile(name, elapsed);
        }
        return new Template(engine, name, root);
    }

    public String name() {
        return name;
    }

    public Stencil engine() {
        return engine;
    }

    public String render(Map<String, ?> values) {
        Objects.requireNonNull(values, "values");
        for (TemplateObserver observer : engine.observers()) {
            observer.beforeRender(name);
        }
        long start = System.nanoTime();
        String output;
        try {
            output = render(values, 0);
        } catch (RuntimeException ex) {
            long elapsed = System.nanoTime() - start;
            for (TemplateObserver observer : engine.observers()) {
                observer.onRenderError(name, ex, elapsed);
            }
            throw ex;
        }
        long elapsed = System.nanoTime() - start;
        for (TemplateObserver observer : engine.observers()) {
            observer.afterRender(name, output, elapsed);
        }
        return output;
    }

    public String render() {
        return render(Map.of());
    }

    SequenceNode root() {
        return root;
    }

    String render(Map<String, ?> values, int includeDepth) {
        TemplateContext context = new TemplateContext(engine.filters(), includeDepth);
        if (!engine.globals().isEmpty()) {
            context.push(engine.globals());
        }
        context.push(values);
        return new TemplateRenderer(this).render(context);
    }

    @Override
    public String toString() {
        return "Template[" + (name == null ? "<inline>" : name) + "]";
    }
}
