package com.scriptorium.templateregistry;

/**
 * Thrown by {@link TemplateRegistry#create(String)} when no master is registered under the
 * requested name.
 */
public class TemplateNotFoundException extends RuntimeException {

    private final String templateName;

    public TemplateNotFoundException(String templateName) {
        super("Template '%s' not found".formatted(templateName));
        this.templateName = templateName;
    }

    /** The name that was looked up. */
    public String templateName() {
        return templateName;
    }
}
