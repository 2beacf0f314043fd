package io.lighting.stencil.loader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.lighting.stencil.Stencil;
import io.lighting.stencil.TemplateNotFoundException;
import io.lighting.stencil.filter.FilterRegistry;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileTemplateLoaderTest {
    @TempDir
    Path dir;

    @Test
    void readsTemplatesBelowBaseDirectory() throws IOException {
        Files.createDirectories(dir.resolve("mail"));
        Files.writeString(dir.resolve("mail/welcome.html"), "Hi {{ name }}{{ include \"./footer.html\" }}", StandardCharsets.UTF_8);
        Files.writeString(dir.resolve("mail/footer.html"), " - ünïcode", StandardCharsets.UTF_8);

        Stencil stencil = Stencil.builder()
            .loader(new FileTemplateLoader(dir))
            .filters(FilterRegistry.standard())
            .build();
        assertEquals("Hi Ann - ünïcode", stencil.renderTemplate("mail/welcome.html", Map.of("name", "Ann")));
    }

    @Test
    void missingOrEscapingPathsAreNotFound() throws IOException {
        Path base = Files.createDirectories(dir.resolve("templates"));
        Files.writeString(dir.resolve("outside.txt"), "secret", StandardCharsets.UTF_8);
        Files.createDirectories(base.resolve("folder"));
        FileTemplateLoader loader = new FileTemplateLoader(base);

        assertThrows(TemplateNotFoundException.class, () -> loader.load("nope.txt"));
        assertThrows(TemplateNotFoundException.class, () -> loader.load("../outside.txt"));
        assertThrows(TemplateNotFoundException.class, () -> loader.load("folder"));
        assertThrows(TemplateNotFoundException.class, () -> loader.resolve("../outside.txt", null));
    }
}
