package io.lighting.stencil.loader;

import io.lighting.stencil.TemplateNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Reads templates from class path resources under a prefix such as {@code templates/}.
 */
public final class ClassPathTemplateLoader implements TemplateLoader {
    private final ClassLoader classLoader;
    private final String prefix;
    private final Charset charset;

    public ClassPathTemplateLoader(String prefix) {
        this(Thread.currentThread().getContextClassLoader(), prefix, StandardCharsets.UTF_8);
    }

    public ClassPathTemplateLoader(ClassLoader classLoader, String prefix) {
        this(classLoader, prefix, StandardCharsets.UTF_8);
    }

    public ClassPathTemplateLoader(ClassLoader classLoader, String prefix, Charset charset) {
        this.classLoader = classLoader == null ? ClassPathTemplateLoader.class.getClassLoader() : classLoader;
        this.prefix = normalizePrefix(prefix);
        this.charset = Objects.requireNonNull(charset, "charset");
    }

    @Override
    public String load(String name) {
        String resource = prefix + name;
        try (InputStream input = classLoader.getResourceAsStream(resource)) {
            if (input == null) {
                throw new TemplateNotFoundException(name);
            }
            return new String(input.readAllBytes(), charset);
        } catch (IOException ex) {
            throw new TemplateNotFoundException(name, ex);
        }
    }

    private static String normalizePrefix(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            return "";
        }
        String trimmed = prefix.trim();
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        if (trimmed.isEmpty() || trimmed.endsWith("/")) {
            return trimmed;
        }
        return trimmed + "/";
    }
}
