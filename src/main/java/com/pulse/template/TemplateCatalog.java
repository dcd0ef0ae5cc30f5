package com.pulse.template;

/**
 * Source of checked-in query template text.
 */
public interface TemplateCatalog {

    /**
     * @param name template file name relative to the SQL template root, e.g. {@code active-users.sql}
     * @return the raw template text
     * @throws TemplateNotFoundException if no such template exists
     */
    String loadSql(String name);

    /**
     * @param name template file name relative to the HogQL template root
     * @return the raw template text
     * @throws TemplateNotFoundException if no such template exists
     */
    String loadHogql(String name);
}
