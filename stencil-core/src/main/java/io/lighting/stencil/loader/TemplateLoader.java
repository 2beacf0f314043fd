package io.lighting.stencil.loader;

import io.lighting.stencil.TemplateNotFoundException;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Maps template paths to source text.
 * <p>
 * {@link #resolve} turns a path written in a template (or passed by the host) into a canonical
 * name; {@link #load} reads the source for that name. Canonical names use {@code /} separators,
 * have no leading slash and no {@code .} or {@code ..} segments.
 */
public interface TemplateLoader {
    /**
     * Resolves {@code path}. Paths starting with {@code ./} or {@code ../} are taken relative to
     * the directory of {@code relativeTo} when one is given; all others are rooted at the loader.
     *
     * @throws TemplateNotFoundException if the path is blank or climbs above the root
     */
    default String resolve(String path, String relativeTo) {
        return normalize(path, relativeTo);
    }

    /**
     * @throws TemplateNotFoundException if nothing exists under {@code name}
     */
    String load(String name);

    static String normalize(String path, String relativeTo) {
        if (path == null || path.isBlank()) {
            throw new TemplateNotFoundException(String.valueOf(path));
        }
        String combined = path.replace('\\', '/');
        if (relativeTo != null && (combined.startsWith("./") || combined.startsWith("../"))) {
            String base = relativeTo.replace('\\', '/');
            combined = base.substring(0, base.lastIndexOf('/') + 1) + combined;
        }
        Deque<String> segments = new ArrayDeque<>();
        for (String segment : combined.split("/")) {
            if (segment.isEmpty() || ".".equals(segment)) {
                continue;
            }
            if ("..".equals(segment)) {
                if (segments.isEmpty()) {
                    throw new TemplateNotFoundException(path);
                }
                segments.removeLast();
                continue;
            }
            segments.addLast(segment);
        }
        if (segments.isEmpty()) {
            throw new TemplateNotFoundException(path);
        }
        return String.join("/", segments);
    }
}
