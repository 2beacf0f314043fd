package io.lighting.stencil.starter;

import io.lighting.stencil.TemplateNotFoundException;
import io.lighting.stencil.loader.TemplateLoader;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.util.Objects;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.util.StreamUtils;

/**
 * Loads templates through a Spring {@link ResourceLoader} below a location such as
 * {@code classpath:/templates/} or {@code file:/srv/templates/}.
 */
public class ResourceTemplateLoader implements TemplateLoader {
    private final ResourceLoader resourceLoader;
    private final String location;
    private final Charset charset;

    public ResourceTemplateLoader(ResourceLoader resourceLoader, String location, Charset charset) {
        this.resourceLoader = Objects.requireNonNull(resourceLoader, "resourceLoader");
        Objects.requireNonNull(location, "location");
        this.location = location.endsWith("/") ? location : location + "/";
        this.charset = Objects.requireNonNull(charset, "charset");
    }

    public String location() {
        return location;
    }

    @Override
    public String load(String name) {
        Resource resource = resourceLoader.getResource(location + name);
        if (!resource.exists() || !resource.isReadable()) {
            throw new TemplateNotFoundException(name);
        }
        try (InputStream input = resource.getInputStream()) {
            return StreamUtils.copyToString(input, charset);
        } catch (IOException ex) {
            throw new TemplateNotFoundException(name, ex);
        }
    }
}
