package com.pulse.template;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Named values for one render of a relational query template.
 *
 * Keys may be given in any case and in camelCase, snake_case or
 * UPPER_SNAKE_CASE; they are normalized to the upper-case placeholder name
 * ({@code dateFilter}, {@code date_filter} and {@code DATE_FILTER} all fill
 * {@code {{DATE_FILTER}}}). A camelCase key also remembers its plainly
 * upper-cased form, so {@code timeFilter} can still fill {@code {{TIMEFILTER}}}. Values are strings, numbers, booleans or null.
 *
 * Three keys are reserved and never substituted as placeholders:
 * {@code filterInternal} and {@code filterFree} drive the derived user filter,
 * and {@code usernamePrefix} overrides the detected column prefix.
 */
public final class TemplateContext {

    static final String FILTER_INTERNAL = "FILTER_INTERNAL";
    static final String FILTER_FREE = "FILTER_FREE";
    static final String USERNAME_PREFIX = "USERNAME_PREFIX";

    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("([a-z0-9])([A-Z])");
    private static final Pattern PLACEHOLDER_NAME = Pattern.compile("[A-Z][A-Z0-9_]*");

    private final Map<String, Object> values = new LinkedHashMap<>();
    private final Map<String, String> aliases = new HashMap<>();
    private Boolean filterInternal;
    private Boolean filterFree;
    private String usernamePrefix;

    public static TemplateContext create() {
        return new TemplateContext();
    }

    public static TemplateContext of(Map<String, ?> entries) {
        TemplateContext context = new TemplateContext();
        entries.forEach(context::put);
        return context;
    }

    /**
     * Adds a value, routing the reserved keys to their typed slots.
     *
     * @throws IllegalArgumentException if the key is not a valid placeholder
     *         name or the value is not a string, number or boolean
     */
    public TemplateContext put(String key, Object value) {
        String name = normalizeKey(key);
        switch (name) {
            case FILTER_INTERNAL:
                this.filterInternal = toBoolean(key, value);
                break;
            case FILTER_FREE:
                this.filterFree = toBoolean(key, value);
                break;
            case USERNAME_PREFIX:
                this.usernamePrefix = value == null ? null : value.toString();
                break;
            default:
                if (value != null && !(value instanceof CharSequence)
                        && !(value instanceof Number) && !(value instanceof Boolean)) {
                    throw new IllegalArgumentException("Unsupported value type for " + key + ": "
                        + value.getClass().getName());
                }
                values.put(name, value instanceof CharSequence ? value.toString() : value);
                String plain = plainKey(key);
                if (plain.equals(name)) {
                    aliases.remove(name);
                } else {
                    aliases.put(name, plain);
                }
        }
        return this;
    }

    public TemplateContext filterInternal(Boolean value) {
        this.filterInternal = value;
        return this;
    }

    public TemplateContext filterFree(Boolean value) {
        this.filterFree = value;
        return this;
    }

    public TemplateContext usernamePrefix(String value) {
        this.usernamePrefix = value;
        return this;
    }

    public Boolean getFilterInternal() {
        return filterInternal;
    }

    public Boolean getFilterFree() {
        return filterFree;
    }

    public String getUsernamePrefix() {
        return usernamePrefix;
    }

    /**
     * @return placeholder values keyed by normalized name, in insertion order
     */
    public Map<String, Object> values() {
        return Collections.unmodifiableMap(values);
    }

    /**
     * @return the plainly upper-cased form of the key stored under
     *         {@code name}, or null when it matches the name itself
     */
    public String aliasOf(String name) {
        return aliases.get(name);
    }

    /**
     * Normalizes a context key to its placeholder name.
     */
    static String normalizeKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Template context key must not be null or empty");
        }
        String name = CAMEL_BOUNDARY.matcher(key.trim()).replaceAll("$1_$2")
            .replace('-', '_')
            .toUpperCase(Locale.ROOT);
        if (!PLACEHOLDER_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid template context key: " + key);
        }
        return name;
    }

    static String plainKey(String key) {
        return key.trim().replace('-', '_').toUpperCase(Locale.ROOT);
    }

    private static Boolean toBoolean(String key, Object value) {
        if (value == null || value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof CharSequence) {
            return !"false".equalsIgnoreCase(value.toString().trim());
        }
        throw new IllegalArgumentException(key + " must be a boolean, got " + value.getClass().getName());
    }
}
