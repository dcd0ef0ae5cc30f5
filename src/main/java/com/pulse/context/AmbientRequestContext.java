package com.pulse.context;

import io.micrometer.context.ContextRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Hooks;
import reactor.core.publisher.Mono;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Request-scoped holder for the current {@link RequestContext}.
 *
 * Query renderers read the filter flags from here instead of having them
 * threaded through every call. A scope is opened with one of the {@code run}
 * methods and is closed when the callback (or the reactive pipeline) completes:
 * <ul>
 *   <li>{@link #run(RequestContext, Supplier)} binds the value to the calling
 *       thread for the duration of the callback and restores the outer value
 *       afterwards, so scopes nest;</li>
 *   <li>{@link #runReactive(RequestContext, Mono)} writes the value into the
 *       Reactor {@code Context} of the pipeline. Once
 *       {@link #enableReactivePropagation()} has been called, the value is
 *       restored into the thread-local on whichever scheduler thread runs an
 *       operator of that pipeline, including after a {@code delay} or a network
 *       call.</li>
 * </ul>
 *
 * Independent requests never see each other's value: the thread-local is
 * always reset when a scope exits, and Reactor contexts are per subscription.
 */
public final class AmbientRequestContext {

    private static final Logger log = LoggerFactory.getLogger(AmbientRequestContext.class);

    /**
     * Key under which the context is stored in a Reactor {@code Context}.
     */
    public static final String KEY = "pulse.request-context";

    private static final ThreadLocal<RequestContext> CURRENT = new ThreadLocal<>();

    private static final AtomicBoolean PROPAGATION_ENABLED = new AtomicBoolean(false);

    private AmbientRequestContext() {
        throw new UnsupportedOperationException("AmbientRequestContext is a utility class and cannot be instantiated");
    }

    /**
     * Runs the callback with {@code context} as the current request context.
     *
     * @param context  the context visible to everything the callback calls
     * @param callback the work to run
     * @return whatever the callback returns
     */
    public static <T> T run(RequestContext context, Supplier<T> callback) {
        Objects.requireNonNull(context, "context must not be null");
        RequestContext previous = CURRENT.get();
        CURRENT.set(context);
        try {
            return callback.get();
        } finally {
            if (previous == null) {
                CURRENT.remove();
            } else {
                CURRENT.set(previous);
            }
        }
    }

    /**
     * Scopes a reactive pipeline. Inner scopes written further upstream shadow
     * this one for their own subtree only.
     */
    public static <T> Mono<T> runReactive(RequestContext context, Mono<T> pipeline) {
        Objects.requireNonNull(context, "context must not be null");
        return pipeline.contextWrite(ctx -> ctx.put(KEY, context));
    }

    public static <T> Flux<T> runReactive(RequestContext context, Flux<T> pipeline) {
        Objects.requireNonNull(context, "context must not be null");
        return pipeline.contextWrite(ctx -> ctx.put(KEY, context));
    }

    /**
     * @return the context of the nearest enclosing scope, or null outside any scope
     */
    public static RequestContext current() {
        return CURRENT.get();
    }

    /**
     * Reads the context from the subscriber's Reactor {@code Context}, without
     * relying on the thread-local bridge.
     */
    public static Mono<RequestContext> currentReactive() {
        return Mono.deferContextual(ctx -> Mono.justOrEmpty(ctx.<RequestContext>getOrEmpty(KEY)));
    }

    /**
     * Registers the thread-local with Micrometer context-propagation and turns
     * on Reactor's automatic propagation. Safe to call more than once.
     */
    public static void enableReactivePropagation() {
        if (PROPAGATION_ENABLED.compareAndSet(false, true)) {
            ContextRegistry.getInstance().registerThreadLocalAccessor(
                KEY, CURRENT::get, CURRENT::set, CURRENT::remove);
            Hooks.enableAutomaticContextPropagation();
            log.info("Reactive propagation enabled for request context key '{}'", KEY);
        }
    }
}
