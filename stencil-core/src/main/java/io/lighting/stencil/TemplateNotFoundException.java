package io.lighting.stencil;

public class TemplateNotFoundException extends TemplateRuntimeException {
    private final String name;

    public TemplateNotFoundException(String name) {
        super("Template not found: " + name);
        this.name = name;
    }

    public TemplateNotFoundException(String name, Throwable cause) {
        super("Template not found: " + name, cause);
        this.name = name;
    }

    public String name() {
        return name;
    }
}
