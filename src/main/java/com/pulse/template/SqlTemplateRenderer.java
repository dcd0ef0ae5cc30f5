package com.pulse.template;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Renders checked-in relational (PostgreSQL) query templates.
 *
 * Rendering is a two-pass process:
 * <ol>
 *   <li>Substitution: comment lines are stripped, {@code {{USER_FILTER}}} is
 *       derived from the filter flags, and every context value is either
 *       substituted (quote-escaped unless it is a trusted clause) or removed
 *       together with its leading {@code AND}. Escaped values are only put
 *       in place once pass 2 is done.</li>
 *   <li>Normalization: {@link SqlNormalizer} repairs the syntax the removals
 *       left behind (dangling operators, orphaned WHERE, blank lines before
 *       GROUP BY and friends).</li>
 * </ol>
 * Optional clause placeholders the caller did not supply at all are removed
 * in pass 1 as if supplied empty. Any other placeholder left over is logged,
 * or rejected with {@link UnresolvedPlaceholderException} in strict mode.
 *
 * The filter flags default from the ambient request context, see
 * {@link UserFilters}.
 */
@Component
public class SqlTemplateRenderer {

    private static final Logger log = LoggerFactory.getLogger(SqlTemplateRenderer.class);

    static final String USER_FILTER = "USER_FILTER";

    /**
     * Placeholders whose template text carries a leading {@code AND}.
     */
    static final Set<String> AND_PREFIXED_PLACEHOLDERS = Set.of(
        "DATE_FILTER", "TIME_FILTER_REACTIONS", "TIME_FILTER_VIEWS", "TIME_FILTER_SAVES",
        "TIMEFILTER", "DOMAIN_FILTER");

    /**
     * Leftovers from this set are expected and never reported.
     */
    static final Set<String> OPTIONAL_PLACEHOLDERS = Set.of(
        "DOMAIN_FILTER", "TIME_FILTER", "DATE_FILTER", "TIME_FILTER_REACTIONS",
        "TIME_FILTER_VIEWS", "TIME_FILTER_SAVES", "TIMEFILTER");

    static final String INLINE_TEMPLATE = "(inline)";

    private static final String USERS_TABLE_ALIAS = "u";

    private static final Pattern USERS_TABLE_WITH_ALIAS = Pattern.compile(
        "\\b(?:FROM|JOIN)\\s+api_server\\.users\\s+(?:AS\\s+)?" + USERS_TABLE_ALIAS + "\\b",
        Pattern.CASE_INSENSITIVE);

    private static final char VALUE_MARKER_OPEN = '\uE002';
    private static final char VALUE_MARKER_CLOSE = '\uE003';

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{([A-Z0-9_]+)\\}\\}");

    private static final Pattern LEADING_CONNECTIVE = Pattern.compile("^\\s*(AND|OR)\\s+", Pattern.CASE_INSENSITIVE);
    private static final Pattern SQL_KEYWORD = Pattern.compile(
        "\\b(WHERE|JOIN|FROM|SELECT|INSERT|UPDATE|DELETE)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern COMPARISON_WITH_LITERAL = Pattern.compile("\\w+\\s*(>=|<=|=|<|>)\\s*['\"]");

    private final boolean strictPlaceholders;

    public SqlTemplateRenderer(@Value("${pulse.templates.strict-placeholders:false}") boolean strictPlaceholders) {
        this.strictPlaceholders = strictPlaceholders;
    }

    public String render(String templateText, TemplateContext context) {
        return render(INLINE_TEMPLATE, templateText, context);
    }

    /**
     * Renders a template into final query text.
     *
     * @param templateName name used in the provenance comment and in warnings
     * @param templateText raw template text
     * @param context      values for the placeholders, may be null
     * @return query text starting with a {@code -- SQL file:} provenance line
     * @throws UnresolvedPlaceholderException in strict mode only
     */
    public String render(String templateName, String templateText, TemplateContext context) {
        TemplateContext ctx = context != null ? context : TemplateContext.create();
        String rendered = stripComments(templateText);

        String prefix = ctx.getUsernamePrefix() != null ? ctx.getUsernamePrefix() : detectUsernamePrefix(rendered);
        boolean filterInternal = UserFilters.resolveFilterInternal(ctx.getFilterInternal());
        boolean filterFree = UserFilters.resolveFilterFree(ctx.getFilterFree());

        String userFilter = buildUserFilter(prefix, filterInternal, filterFree);
        rendered = userFilter.isEmpty()
            ? removeClause(rendered, USER_FILTER)
            : substitute(rendered, USER_FILTER, userFilter);

        List<String> escapedValues = new ArrayList<>();
        Set<String> supplied = new HashSet<>();
        for (Map.Entry<String, Object> entry : ctx.values().entrySet()) {
            String name = placeholderFor(rendered, entry.getKey(), ctx);
            if (USER_FILTER.equals(name)) {
                log.warn("Ignoring caller-supplied {} in {}; it is derived from the filter flags", USER_FILTER, templateName);
                continue;
            }
            supplied.add(name);
            rendered = applyValue(rendered, name, entry.getValue(), escapedValues);
        }

        for (String name : AND_PREFIXED_PLACEHOLDERS) {
            if (!supplied.contains(name)) {
                rendered = removeClause(rendered, name);
            }
        }

        rendered = SqlNormalizer.normalize(rendered);
        checkUnresolved(templateName, rendered);
        rendered = restoreEscapedValues(rendered, escapedValues);

        log.debug("Rendered SQL template {} (filterInternal={}, filterFree={}, prefix='{}')",
            templateName, filterInternal, filterFree, prefix);
        return "-- SQL file: sql/" + templateName + "\n" + rendered;
    }

    /**
     * Builds the user exclusion clause for the relational dialect.
     *
     * @param prefix column prefix such as {@code "u."}, or empty
     * @return the joined clause, or an empty string when both flags are off
     */
    static String buildUserFilter(String prefix, boolean filterInternal, boolean filterFree) {
        String usernameRef = prefix + "username";
        String domainExpr = "SUBSTRING(" + usernameRef + " FROM POSITION('@' IN " + usernameRef + ") + 1)";

        StringBuilder clause = new StringBuilder();
        if (filterInternal) {
            clause.append(domainExpr).append(" NOT IN ('").append(UserFilters.INTERNAL_DOMAIN).append("')")
                .append(" AND ").append(usernameRef).append(" != '")
                .append(UserFilters.escapeQuotes(UserFilters.BOOTSTRAP_ACCOUNT)).append("'");
        }
        if (filterFree) {
            if (clause.length() > 0) {
                clause.append(" AND ");
            }
            String domains = UserFilters.FREE_EMAIL_DOMAINS.stream()
                .map(domain -> "'" + UserFilters.escapeQuotes(domain) + "'")
                .collect(Collectors.joining(", "));
            clause.append(domainExpr).append(" NOT IN (").append(domains).append(")");
        }
        return clause.toString();
    }

    static String detectUsernamePrefix(String sql) {
        return USERS_TABLE_WITH_ALIAS.matcher(sql).find() ? USERS_TABLE_ALIAS + "." : "";
    }

    static String stripComments(String templateText) {
        List<String> kept = Arrays.stream(templateText.split("\n", -1))
            .filter(line -> !line.trim().startsWith("--"))
            .collect(Collectors.toList());
        return String.join("\n", kept);
    }

    /**
     * A value is trusted as a pre-assembled clause when it starts with a
     * boolean connective, contains a statement keyword, or compares a column
     * to a quoted literal.
     */
    static boolean looksLikeClause(String value) {
        return LEADING_CONNECTIVE.matcher(value).find()
            || SQL_KEYWORD.matcher(value).find()
            || COMPARISON_WITH_LITERAL.matcher(value).find();
    }

    /**
     * Clauses are substituted in place. Plain values are escaped and held
     * back behind a marker until the normalizer has run, so its rules never
     * see caller data.
     */
    private String applyValue(String sql, String name, Object value, List<String> escapedValues) {
        boolean andPrefixed = AND_PREFIXED_PLACEHOLDERS.contains(name);
        if (isEmpty(value)) {
            return andPrefixed ? removeClause(sql, name) : removePlaceholder(sql, name);
        }
        String text = value.toString();
        if (andPrefixed || looksLikeClause(text)) {
            return substitute(sql, name, text);
        }
        escapedValues.add(UserFilters.escapeQuotes(text));
        return substitute(sql, name, valueMarker(escapedValues.size() - 1));
    }

    /**
     * A camelCase key normally fills its snake-cased placeholder; when the
     * template only has the plainly upper-cased form ({@code timeFilter} and
     * {@code {{TIMEFILTER}}}), that one is used instead.
     */
    private static String placeholderFor(String sql, String name, TemplateContext ctx) {
        String alias = ctx.aliasOf(name);
        if (alias != null && !sql.contains(token(name)) && sql.contains(token(alias))) {
            return alias;
        }
        return name;
    }

    private static String restoreEscapedValues(String sql, List<String> escapedValues) {
        String result = sql;
        for (int i = 0; i < escapedValues.size(); i++) {
            result = result.replace(valueMarker(i), escapedValues.get(i));
        }
        return result;
    }

    private static String valueMarker(int index) {
        return VALUE_MARKER_OPEN + Integer.toString(index) + VALUE_MARKER_CLOSE;
    }

    /**
     * Only null and the empty string count as absent; {@code 0} and
     * {@code false} are real values.
     */
    private static boolean isEmpty(Object value) {
        return value == null || (value instanceof String && ((String) value).isEmpty());
    }

    private static String substitute(String sql, String name, String value) {
        return sql.replace(token(name), value);
    }

    private static String removePlaceholder(String sql, String name) {
        return sql.replaceAll("\\s*" + Pattern.quote(token(name)), "");
    }

    /**
     * Removes a clause placeholder with its surrounding whitespace and any
     * leading {@code AND}, leaving a line break so that a following keyword
     * starts its own line. Nothing is left when the clause ends the text.
     */
    private static String removeClause(String sql, String name) {
        String clause = "\\s*(?:\\b(?i:AND)\\s+)?" + Pattern.quote(token(name));
        return sql.replaceAll(clause + "\\s*\\z", "")
            .replaceAll(clause + "[ \\t]*", "\n");
    }

    private void checkUnresolved(String templateName, String sql) {
        Set<String> unresolved = new LinkedHashSet<>();
        Matcher matcher = PLACEHOLDER.matcher(sql);
        while (matcher.find()) {
            String name = matcher.group(1);
            if (!OPTIONAL_PLACEHOLDERS.contains(name)) {
                unresolved.add(name);
            }
        }
        if (unresolved.isEmpty()) {
            return;
        }
        if (strictPlaceholders) {
            throw new UnresolvedPlaceholderException(templateName, unresolved);
        }
        log.warn("Unresolved placeholders in {}: {}. This may cause SQL syntax errors.", templateName, unresolved);
    }

    private static String token(String name) {
        return "{{" + name + "}}";
    }
}
