package com.pulse.template;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Second pass of relational rendering: a fixed, ordered list of syntax
 * clean-ups applied after every placeholder has been substituted or removed.
 *
 * The dangling-operator rule runs before the orphaned-WHERE rule, and both
 * run before the whitespace rules, so a removal that leaves
 * {@code WHERE x AND\nGROUP BY} or {@code WHERE\n\nGROUP BY} ends up as valid
 * SQL in one pass.
 *
 * Quoted string literals are masked while the rules run and put back
 * untouched afterwards.
 */
final class SqlNormalizer {

    /**
     * Keywords and tokens that terminate a WHERE clause.
     */
    private static final String TERMINATOR = "(?:GROUP BY|ORDER BY|HAVING|LIMIT)\\b|\\)|,";

    private static final Pattern STRING_LITERAL = Pattern.compile("'(?:[^']|'')*'");

    private static final char MASK_OPEN = '\uE000';
    private static final char MASK_CLOSE = '\uE001';

    private static final List<Rule> RULES = List.of(
        // x AND\nGROUP BY -> x\nGROUP BY
        new Rule("dangling operator before terminator",
            "\\s+\\b(?:AND|OR)\\b(\\s*)(?=" + TERMINATOR + ")", "$1"),
        new Rule("orphaned WHERE",
            "\\bWHERE\\b\\s*(?=" + TERMINATOR + ")", ""),
        new Rule("orphaned WHERE at end",
            "\\s*\\bWHERE\\s*\\z", ""),
        new Rule("blank line before terminator",
            "\\n[ \\t]*\\n\\s*(" + TERMINATOR + ")", "\n$1"),
        new Rule("trailing whitespace before terminator",
            "[ \\t]+\\n\\s*(" + TERMINATOR + ")", "\n$1"));

    private SqlNormalizer() {
    }

    static String normalize(String sql) {
        List<String> literals = new ArrayList<>();
        String result = mask(sql, literals);
        for (Rule rule : RULES) {
            result = rule.apply(result);
        }
        return unmask(result, literals);
    }

    private static String mask(String sql, List<String> literals) {
        Matcher matcher = STRING_LITERAL.matcher(sql);
        StringBuilder masked = new StringBuilder();
        while (matcher.find()) {
            literals.add(matcher.group());
            matcher.appendReplacement(masked, marker(literals.size() - 1));
        }
        matcher.appendTail(masked);
        return masked.toString();
    }

    private static String unmask(String sql, List<String> literals) {
        String result = sql;
        for (int i = 0; i < literals.size(); i++) {
            result = result.replace(marker(i), literals.get(i));
        }
        return result;
    }

    private static String marker(int index) {
        return MASK_OPEN + Integer.toString(index) + MASK_CLOSE;
    }

    private static final class Rule {
        private final String name;
        private final Pattern pattern;
        private final String replacement;

        Rule(String name, String regex, String replacement) {
            this.name = name;
            this.pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
            this.replacement = replacement;
        }

        String apply(String sql) {
            return pattern.matcher(sql).replaceAll(replacement);
        }

        @Override
        public String toString() {
            return name;
        }
    }
}
