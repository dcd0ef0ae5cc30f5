package com.pulse.query;

import com.pulse.analytics.AnalyticsQueryClient;
import com.pulse.analytics.AnalyticsQueryResponse;
import com.pulse.context.AmbientRequestContext;
import com.pulse.context.RequestContext;
import com.pulse.storage.SqlQueryRunner;
import com.pulse.template.ClasspathTemplateCatalog;
import com.pulse.template.HogqlTemplateContext;
import com.pulse.template.HogqlTemplateRenderer;
import com.pulse.template.SqlTemplateRenderer;
import com.pulse.template.TemplateContext;
import com.pulse.template.TemplateNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.io.DefaultResourceLoader;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Tests for ReportQueryService with real templates and renderers and mocked
 * execution back ends.
 */
@ExtendWith(MockitoExtension.class)
class ReportQueryServiceTest {

    @Mock
    private SqlQueryRunner sqlRunner;

    @Mock
    private AnalyticsQueryClient analyticsClient;

    private ReportQueryService service;

    @BeforeEach
    void setUp() {
        ClasspathTemplateCatalog catalog = new ClasspathTemplateCatalog(
            new DefaultResourceLoader(), "classpath:sql/", "classpath:hogql/");
        service = new ReportQueryService(catalog, new SqlTemplateRenderer(false), new HogqlTemplateRenderer(),
            sqlRunner, analyticsClient);
    }

    @Test
    void testRenderSqlNamesTheTemplate() {
        String sql = service.renderSql("active-users.sql", TemplateContext.create());

        assertThat(sql).startsWith("-- SQL file: sql/active-users.sql\n");
        assertThat(sql).contains("u.username").doesNotContain("{{");
    }

    @Test
    void testQuerySqlUsesAmbientFlags() {
        // Given
        List<Map<String, Object>> rows = List.of(Map.of("day", "2024-06-01", "active_users", 40L));
        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        when(sqlRunner.run(sql.capture(), eq("unused"))).thenReturn(rows);
        TemplateContext context = TemplateContext.create()
            .put("dateFilter", "AND a.created_at >= now() - interval '30 days'");

        // When
        Mono<List<Map<String, Object>>> result = AmbientRequestContext.runReactive(
            new RequestContext("UTC", false, false),
            service.querySql("active-users.sql", context, "unused"));

        // Then
        StepVerifier.create(result)
            .expectNext(rows)
            .verifyComplete();
        assertThat(sql.getValue())
            .contains("AND a.created_at >= now() - interval '30 days'\nGROUP BY 1")
            .doesNotContain("gridstatus.io")
            .doesNotContain("{{");
    }

    @Test
    void testQuerySqlWithoutRequestScopeAppliesAllFilters() {
        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        when(sqlRunner.run(sql.capture(), eq(7))).thenReturn(List.of());

        StepVerifier.create(service.querySql("active-users.sql", TemplateContext.create(), 7))
            .expectNext(List.of())
            .verifyComplete();

        assertThat(sql.getValue()).contains("NOT IN ('gridstatus.io')").contains("'gmail.com'");
    }

    @Test
    void testQueryAnalyticsRendersAndLabelsTheQuery() {
        // Given
        AnalyticsQueryResponse response = new AnalyticsQueryResponse(List.of(List.of("/pricing", 120, 45)));
        ArgumentCaptor<String> hogql = ArgumentCaptor.forClass(String.class);
        when(analyticsClient.executeQueryDetailed(hogql.capture(), eq("top-pages-by-views")))
            .thenReturn(Mono.just(response));
        HogqlTemplateContext context = HogqlTemplateContext.create()
            .filterInternal(true)
            .filterFree(false)
            .limit(10)
            .orderDirection("desc")
            .dateFilter("timestamp >= now() - INTERVAL 7 DAY");

        // When / Then
        StepVerifier.create(service.queryAnalytics("top-pages-by-views.hogql", context))
            .expectNext(List.of(List.of("/pricing", 120, 45)))
            .verifyComplete();

        assertThat(hogql.getValue())
            .contains("AND NOT person.properties.email LIKE '%@gridstatus.io'")
            .contains("AND timestamp >= now() - INTERVAL 7 DAY")
            .contains("ORDER BY views DESC")
            .contains("LIMIT 10")
            .doesNotContain("{{");
    }

    @Test
    void testMissingTemplateFailsTheMono() {
        StepVerifier.create(service.queryAnalytics("nope.hogql", HogqlTemplateContext.create()))
            .expectError(TemplateNotFoundException.class)
            .verify();

        verifyNoInteractions(analyticsClient);
    }

    @Test
    void testRenderHogql() {
        String hogql = service.renderHogql("event-occurrences-recent.hogql",
            HogqlTemplateContext.create().eventName("signed_up").limit(50).filterInternal(false).filterFree(false));

        assertThat(hogql).contains("WHERE event = 'signed_up'").contains("LIMIT 50").doesNotContain("USER_FILTER");
        verifyNoInteractions(analyticsClient);
    }
}
