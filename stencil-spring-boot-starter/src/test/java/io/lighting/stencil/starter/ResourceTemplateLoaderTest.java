package io.lighting.stencil.starter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.lighting.stencil.TemplateNotFoundException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

class ResourceTemplateLoaderTest {
    private final ResourceTemplateLoader loader = new ResourceTemplateLoader(
        new DefaultResourceLoader(),
        "classpath:/templates",
        StandardCharsets.UTF_8
    );

    @Test
    void appendsSeparatorToLocation() {
        assertEquals("classpath:/templates/", loader.location());
    }

    @Test
    void loadsResolvedNames() {
        assertEquals("-- {{ who | upper }}", loader.load(loader.resolve("./signature.html", "partials/x.html")));
        assertThrows(TemplateNotFoundException.class, () -> loader.load("absent.html"));
    }
}
