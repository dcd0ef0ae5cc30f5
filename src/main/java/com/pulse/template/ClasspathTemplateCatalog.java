package com.pulse.template;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Loads templates from Spring resource locations, {@code classpath:sql/} and
 * {@code classpath:hogql/} by default.
 */
@Component
public class ClasspathTemplateCatalog implements TemplateCatalog {

    private static final Logger log = LoggerFactory.getLogger(ClasspathTemplateCatalog.class);

    private final ResourceLoader resourceLoader;
    private final String sqlLocation;
    private final String hogqlLocation;

    public ClasspathTemplateCatalog(
            ResourceLoader resourceLoader,
            @Value("${pulse.templates.sql-location:classpath:sql/}") String sqlLocation,
            @Value("${pulse.templates.hogql-location:classpath:hogql/}") String hogqlLocation) {
        this.resourceLoader = resourceLoader;
        this.sqlLocation = withTrailingSlash(sqlLocation);
        this.hogqlLocation = withTrailingSlash(hogqlLocation);
        log.info("Template catalog initialized (sql={}, hogql={})", this.sqlLocation, this.hogqlLocation);
    }

    @Override
    public String loadSql(String name) {
        return load(sqlLocation, name);
    }

    @Override
    public String loadHogql(String name) {
        return load(hogqlLocation, name);
    }

    private String load(String location, String name) {
        if (name == null || name.isBlank() || name.contains("..") || name.startsWith("/")) {
            throw new TemplateNotFoundException(name, "Invalid template name: " + name);
        }

        Resource resource = resourceLoader.getResource(location + name);
        if (!resource.exists()) {
            throw new TemplateNotFoundException(name, "Template not found: " + location + name);
        }

        try (InputStream in = resource.getInputStream()) {
            String text = StreamUtils.copyToString(in, StandardCharsets.UTF_8);
            log.debug("Loaded template {} ({} chars)", name, text.length());
            return text;
        } catch (IOException e) {
            throw new TemplateNotFoundException(name, "Failed to read template: " + location + name, e);
        }
    }

    private static String withTrailingSlash(String location) {
        return location.endsWith("/") ? location : location + "/";
    }
}
