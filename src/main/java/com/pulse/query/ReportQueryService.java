package com.pulse.query;

import com.pulse.analytics.AnalyticsQueryClient;
import com.pulse.analytics.AnalyticsQueryResponse;
import com.pulse.context.AmbientRequestContext;
import com.pulse.context.RequestContext;
import com.pulse.storage.SqlQueryRunner;
import com.pulse.template.HogqlTemplateContext;
import com.pulse.template.HogqlTemplateRenderer;
import com.pulse.template.SqlTemplateRenderer;
import com.pulse.template.TemplateCatalog;
import com.pulse.template.TemplateContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Entry point for report queries.
 *
 * Loads a named template, renders it with the caller's values and the
 * ambient request context, then runs it against the reporting database
 * or the hosted analytics service.
 */
@Service
public class ReportQueryService {

    private static final Logger log = LoggerFactory.getLogger(ReportQueryService.class);

    private final TemplateCatalog catalog;
    private final SqlTemplateRenderer sqlRenderer;
    private final HogqlTemplateRenderer hogqlRenderer;
    private final SqlQueryRunner sqlRunner;
    private final AnalyticsQueryClient analyticsClient;

    public ReportQueryService(
            TemplateCatalog catalog,
            SqlTemplateRenderer sqlRenderer,
            HogqlTemplateRenderer hogqlRenderer,
            SqlQueryRunner sqlRunner,
            AnalyticsQueryClient analyticsClient) {
        this.catalog = catalog;
        this.sqlRenderer = sqlRenderer;
        this.hogqlRenderer = hogqlRenderer;
        this.sqlRunner = sqlRunner;
        this.analyticsClient = analyticsClient;
    }

    /**
     * Loads and renders a relational template.
     *
     * @param name file name under the SQL template location, e.g. {@code active_users.sql}
     */
    public String renderSql(String name, TemplateContext context) {
        return sqlRenderer.render(name, catalog.loadSql(name), context);
    }

    /**
     * Loads and renders an analytics-dialect template.
     *
     * @param name file name under the HogQL template location
     */
    public String renderHogql(String name, HogqlTemplateContext context) {
        return hogqlRenderer.render(catalog.loadHogql(name), context);
    }

    /**
     * Renders and runs a relational template. The JDBC call runs on the
     * bounded elastic scheduler.
     */
    public Mono<List<Map<String, Object>>> querySql(String name, TemplateContext context, Object... params) {
        return inAmbientScope(() -> renderSql(name, context))
            .publishOn(Schedulers.boundedElastic())
            .map(sql -> {
                log.debug("Running SQL template {}", name);
                return sqlRunner.run(sql, params);
            });
    }

    /**
     * Renders and runs an analytics-dialect template.
     *
     * @return result rows, empty when the hosted service is not configured
     */
    public Mono<List<List<Object>>> queryAnalytics(String name, HogqlTemplateContext context) {
        return queryAnalyticsDetailed(name, context).map(AnalyticsQueryResponse::getResults);
    }

    /**
     * Like {@link #queryAnalytics} but keeps warnings and truncation flags.
     * Service notes are logged under the template's base name.
     */
    public Mono<AnalyticsQueryResponse> queryAnalyticsDetailed(String name, HogqlTemplateContext context) {
        return inAmbientScope(() -> renderHogql(name, context))
            .flatMap(query -> analyticsClient.executeQueryDetailed(query, label(name)));
    }

    /**
     * Renders on whatever thread subscribes, with the subscriber's request
     * context installed as the current one.
     */
    private <T> Mono<T> inAmbientScope(Supplier<T> work) {
        return Mono.deferContextual(ctx -> {
            RequestContext requestContext = ctx.getOrDefault(AmbientRequestContext.KEY, null);
            if (requestContext == null) {
                return Mono.fromSupplier(work);
            }
            return Mono.fromSupplier(() -> AmbientRequestContext.run(requestContext, work));
        });
    }

    private static String label(String name) {
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
