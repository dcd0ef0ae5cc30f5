package com.pulse.template;

/**
 * Thrown when a named template cannot be found or read.
 */
public class TemplateNotFoundException extends RuntimeException {

    private final String templateName;

    public TemplateNotFoundException(String templateName, String message) {
        super(message);
        this.templateName = templateName;
    }

    public TemplateNotFoundException(String templateName, String message, Throwable cause) {
        super(message, cause);
        this.templateName = templateName;
    }

    public String getTemplateName() {
        return templateName;
    }
}
