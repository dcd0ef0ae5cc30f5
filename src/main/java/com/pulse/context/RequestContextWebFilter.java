package com.pulse.context;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

/**
 * Opens an ambient {@link RequestContext} scope for every inbound request.
 *
 * Reads three query parameters:
 * <ul>
 *   <li>{@code timezone} - coerced to the whitelist by {@link Timezones#sanitize(String)}</li>
 *   <li>{@code filterInternal}, {@code filterFree} - absent means "not set";
 *       any value other than {@code false} means true</li>
 * </ul>
 * The rest of the filter chain, and every query rendered while serving the
 * request, runs inside that scope.
 */
@Component
public class RequestContextWebFilter implements WebFilter {

    private static final Logger log = LoggerFactory.getLogger(RequestContextWebFilter.class);

    static final String TIMEZONE_PARAM = "timezone";
    static final String FILTER_INTERNAL_PARAM = "filterInternal";
    static final String FILTER_FREE_PARAM = "filterFree";

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        RequestContext context = fromQueryParams(exchange.getRequest().getQueryParams());
        log.debug("Request context for {} {}: {}",
            exchange.getRequest().getMethod(), exchange.getRequest().getPath(), context);
        return AmbientRequestContext.runReactive(context, chain.filter(exchange));
    }

    static RequestContext fromQueryParams(MultiValueMap<String, String> params) {
        return new RequestContext(
            params.getFirst(TIMEZONE_PARAM),
            booleanParam(params.getFirst(FILTER_INTERNAL_PARAM)),
            booleanParam(params.getFirst(FILTER_FREE_PARAM)));
    }

    private static Boolean booleanParam(String value) {
        if (value == null) {
            return null;
        }
        return !"false".equals(value);
    }
}
