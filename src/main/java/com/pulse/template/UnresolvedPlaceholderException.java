package com.pulse.template;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Thrown in strict mode when a required placeholder survives rendering.
 */
public class UnresolvedPlaceholderException extends RuntimeException {

    private final String templateName;
    private final Set<String> placeholders;

    public UnresolvedPlaceholderException(String templateName, Set<String> placeholders) {
        super("Unresolved placeholders in " + templateName + ": " + placeholders);
        this.templateName = templateName;
        this.placeholders = Collections.unmodifiableSet(new LinkedHashSet<>(placeholders));
    }

    public String getTemplateName() {
        return templateName;
    }

    public Set<String> getPlaceholders() {
        return placeholders;
    }
}
