package com.pulse.template;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the post-substitution clean-up rules
 */
class SqlNormalizerTest {

    @Test
    void testDanglingOperatorBeforeTerminator() {
        assertThat(SqlNormalizer.normalize("WHERE a = 1 AND\nGROUP BY a"))
            .isEqualTo("WHERE a = 1\nGROUP BY a");
        assertThat(SqlNormalizer.normalize("WHERE (a = 1 AND) LIMIT 5"))
            .isEqualTo("WHERE (a = 1) LIMIT 5");
    }

    @Test
    void testOrphanedWhere() {
        assertThat(SqlNormalizer.normalize("SELECT a FROM t WHERE\nGROUP BY a"))
            .isEqualTo("SELECT a FROM t GROUP BY a");
        assertThat(SqlNormalizer.normalize("SELECT a FROM t WHERE   "))
            .isEqualTo("SELECT a FROM t");
        assertThat(SqlNormalizer.normalize("SELECT a FROM (SELECT a FROM t WHERE) s"))
            .isEqualTo("SELECT a FROM (SELECT a FROM t ) s");
    }

    @Test
    void testBlankLineBeforeTerminator() {
        assertThat(SqlNormalizer.normalize("WHERE a = 1\n\n  ORDER BY a"))
            .isEqualTo("WHERE a = 1\nORDER BY a");
    }

    @Test
    void testTrailingWhitespaceBeforeTerminator() {
        assertThat(SqlNormalizer.normalize("WHERE a = 1   \n    HAVING count(*) > 1"))
            .isEqualTo("WHERE a = 1\nHAVING count(*) > 1");
    }

    @Test
    void testQuotedLiteralsAreLeftAlone() {
        String sql = "SELECT * FROM t WHERE team = 'R and, D' AND title = 'Where, exactly?'\n"
            + "    AND note = 'it''s done AND\n\nGROUP BY'\nORDER BY id";

        assertThat(SqlNormalizer.normalize(sql)).isEqualTo(sql);
    }

    @Test
    void testRulesStillApplyAroundLiterals() {
        assertThat(SqlNormalizer.normalize("SELECT * FROM t WHERE a = 'x, y' AND\n\nGROUP BY a"))
            .isEqualTo("SELECT * FROM t WHERE a = 'x, y'\nGROUP BY a");
    }

    @Test
    void testValidSqlIsUnchanged() {
        String sql = "SELECT a, b\nFROM t\nWHERE a = 1 AND b IN ('x', 'y')\nGROUP BY a, b\nORDER BY a";

        assertThat(SqlNormalizer.normalize(sql)).isEqualTo(sql);
    }
}
