package io.lighting.stencil.loader;

import io.lighting.stencil.TemplateNotFoundException;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads templates below a base directory. Names never leave the base directory.
 */
public final class FileTemplateLoader implements TemplateLoader {
    private final Path baseDir;
    private final Charset charset;

    public FileTemplateLoader(Path baseDir) {
        this(baseDir, StandardCharsets.UTF_8);
    }

    public FileTemplateLoader(Path baseDir, Charset charset) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir").toAbsolutePath().normalize();
        this.charset = Objects.requireNonNull(charset, "charset");
    }

    public Path baseDir() {
        return baseDir;
    }

    @Override
    public String load(String name) {
        Path file = baseDir.resolve(name).normalize();
        if (!file.startsWith(baseDir) || !Files.isRegularFile(file)) {
            throw new TemplateNotFoundException(name);
        }
        try {
            return Files.readString(file, charset);
        } catch (IOException ex) {
            throw new TemplateNotFoundException(name, ex);
        }
    }
}
