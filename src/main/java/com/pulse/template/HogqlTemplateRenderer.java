package com.pulse.template;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Renders analytics-dialect (HogQL) templates sent to the hosted query service.
 *
 * Reserved placeholders:
 * <ul>
 *   <li>{@code LOGGED_IN_USER_FILTER} - always the "has an email" check</li>
 *   <li>{@code USER_FILTER} - internal / free-email exclusions from the filter flags</li>
 *   <li>{@code DATE_FILTER}, {@code USER_TYPE_FILTER}, {@code SAME_TIME_OF_DAY_FILTER},
 *       {@code PATHNAME_FILTER} - optional clauses, removed with their leading AND</li>
 *   <li>{@code LIMIT}, {@code DAYS}, {@code DATE_FUNCTION}, {@code ORDER_DIRECTION},
 *       {@code PERIOD_SELECT} - plain values</li>
 *   <li>{@code EMAIL}, {@code EVENT_NAME}, {@code DOMAIN_LIKE} - quote-escaped strings</li>
 * </ul>
 * Templates in this dialect are simple, so there is no comment stripping or
 * normalization pass.
 */
@Component
public class HogqlTemplateRenderer {

    private static final Logger log = LoggerFactory.getLogger(HogqlTemplateRenderer.class);

    static final String EMAIL_PROPERTY = "person.properties.email";

    static final String LOGGED_IN_USER_CLAUSE =
        EMAIL_PROPERTY + " IS NOT NULL AND " + EMAIL_PROPERTY + " != ''";

    private static final Pattern ORDER_DIRECTION = Pattern.compile("ASC|DESC", Pattern.CASE_INSENSITIVE);

    public String render(String templateText, HogqlTemplateContext context) {
        HogqlTemplateContext ctx = context != null ? context : HogqlTemplateContext.create();
        String rendered = templateText;

        rendered = substitute(rendered, "LOGGED_IN_USER_FILTER", LOGGED_IN_USER_CLAUSE);

        boolean filterInternal = UserFilters.resolveFilterInternal(ctx.getFilterInternal());
        boolean filterFree = UserFilters.resolveFilterFree(ctx.getFilterFree());
        rendered = clause(rendered, "USER_FILTER", buildUserFilter(filterInternal, filterFree));

        if (ctx.getLimit() != null) {
            rendered = substitute(rendered, "LIMIT", ctx.getLimit().toString());
        }
        if (ctx.getDays() != null) {
            rendered = substitute(rendered, "DAYS", ctx.getDays().toString());
        }
        if (ctx.getDateFunction() != null) {
            rendered = substitute(rendered, "DATE_FUNCTION", ctx.getDateFunction());
        }
        rendered = clause(rendered, "DATE_FILTER", ctx.getDateFilter());
        if (ctx.getOrderDirection() != null) {
            rendered = substitute(rendered, "ORDER_DIRECTION", orderDirection(ctx.getOrderDirection()));
        }
        if (ctx.getEmail() != null) {
            rendered = substitute(rendered, "EMAIL", UserFilters.escapeQuotes(ctx.getEmail()));
        }
        if (ctx.getEventName() != null) {
            rendered = substitute(rendered, "EVENT_NAME", UserFilters.escapeQuotes(ctx.getEventName()));
        }
        if (ctx.getDomain() != null) {
            rendered = substitute(rendered, "DOMAIN_LIKE", "%@" + UserFilters.escapeQuotes(ctx.getDomain()));
        }
        rendered = clause(rendered, "USER_TYPE_FILTER", ctx.getUserTypeFilter());
        if (ctx.getPeriodSelect() != null) {
            rendered = substitute(rendered, "PERIOD_SELECT", ctx.getPeriodSelect());
        }
        rendered = clause(rendered, "SAME_TIME_OF_DAY_FILTER", ctx.getSameTimeOfDayFilter());
        rendered = clause(rendered, "PATHNAME_FILTER", pathnameFilter(ctx.getPathname()));

        log.debug("Rendered HogQL template (filterInternal={}, filterFree={})", filterInternal, filterFree);
        return rendered;
    }

    /**
     * Builds the user exclusion clause in property-access syntax, one
     * {@code NOT ... LIKE} per excluded domain.
     *
     * @return the joined clause, or an empty string when both flags are off
     */
    static String buildUserFilter(boolean filterInternal, boolean filterFree) {
        List<String> clauses = new ArrayList<>();
        if (filterInternal) {
            clauses.add(notLikeDomain(UserFilters.INTERNAL_DOMAIN));
        }
        if (filterFree) {
            UserFilters.FREE_EMAIL_DOMAINS.forEach(domain -> clauses.add(notLikeDomain(domain)));
        }
        return String.join(" AND ", clauses);
    }

    /**
     * Backslashes are doubled before quotes: the dialect unescapes them once.
     */
    static String pathnameFilter(String pathname) {
        if (pathname == null || pathname.isEmpty()) {
            return null;
        }
        String escaped = UserFilters.escapeQuotes(pathname.replace("\\", "\\\\"));
        return "properties.pathname = '" + escaped + "'";
    }

    private static String notLikeDomain(String domain) {
        return "NOT " + EMAIL_PROPERTY + " LIKE '%@" + UserFilters.escapeQuotes(domain) + "'";
    }

    private static String orderDirection(String value) {
        String trimmed = value.trim();
        if (!ORDER_DIRECTION.matcher(trimmed).matches()) {
            throw new IllegalArgumentException("Order direction must be ASC or DESC, got: " + value);
        }
        return trimmed.toUpperCase(Locale.ROOT);
    }

    private static String clause(String hogql, String name, String value) {
        if (value != null && !value.isEmpty()) {
            return substitute(hogql, name, value);
        }
        String token = Pattern.quote("{{" + name + "}}");
        return hogql.replaceAll("\\s+AND\\s+" + token, "").replaceAll(token, "");
    }

    private static String substitute(String hogql, String name, String value) {
        return hogql.replace("{{" + name + "}}", value);
    }
}
