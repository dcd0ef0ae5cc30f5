package com.pulse.context;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for AmbientRequestContext
 */
class AmbientRequestContextTest {

    private static final RequestContext OUTER = new RequestContext("UTC", false, true);
    private static final RequestContext INNER = new RequestContext("America/Denver", true, false);

    @Test
    @DisplayName("Should return null outside any scope")
    void testCurrentOutsideScope() {
        assertThat(AmbientRequestContext.current()).isNull();
    }

    @Test
    @DisplayName("Should expose the context inside run and return the callback result")
    void testRunExposesContext() {
        // When
        String timezone = AmbientRequestContext.run(OUTER, () -> AmbientRequestContext.current().timezone());

        // Then
        assertThat(timezone).isEqualTo("UTC");
        assertThat(AmbientRequestContext.current()).isNull();
    }

    @Test
    @DisplayName("Should shadow the outer scope in a nested run and restore it afterwards")
    void testNestedScopes() {
        AmbientRequestContext.run(OUTER, () -> {
            assertThat(AmbientRequestContext.current()).isEqualTo(OUTER);

            RequestContext seenInside = AmbientRequestContext.run(INNER, AmbientRequestContext::current);

            assertThat(seenInside).isEqualTo(INNER);
            assertThat(AmbientRequestContext.current()).isEqualTo(OUTER);
            return null;
        });
    }

    @Test
    @DisplayName("Should restore the outer scope when the callback throws")
    void testScopeRestoredOnException() {
        AmbientRequestContext.run(OUTER, () -> {
            assertThatThrownBy(() -> AmbientRequestContext.run(INNER, () -> {
                throw new IllegalStateException("boom");
            })).isInstanceOf(IllegalStateException.class);

            assertThat(AmbientRequestContext.current()).isEqualTo(OUTER);
            return null;
        });
    }

    @Test
    @DisplayName("Should reject a null context")
    void testRunRejectsNull() {
        assertThatThrownBy(() -> AmbientRequestContext.run(null, () -> "x"))
            .isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("Should isolate concurrently running scopes")
    void testConcurrentScopesAreIsolated() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch bothInside = new CountDownLatch(2);
        try {
            Future<RequestContext> first = executor.submit(() -> AmbientRequestContext.run(OUTER, () -> {
                awaitQuietly(bothInside);
                return AmbientRequestContext.current();
            }));
            Future<RequestContext> second = executor.submit(() -> AmbientRequestContext.run(INNER, () -> {
                awaitQuietly(bothInside);
                return AmbientRequestContext.current();
            }));

            assertThat(first.get(5, TimeUnit.SECONDS)).isEqualTo(OUTER);
            assertThat(second.get(5, TimeUnit.SECONDS)).isEqualTo(INNER);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Should read the context from the Reactor Context")
    void testCurrentReactive() {
        Mono<RequestContext> pipeline = AmbientRequestContext.runReactive(OUTER, AmbientRequestContext.currentReactive());

        StepVerifier.create(pipeline)
            .expectNext(OUTER)
            .verifyComplete();

        StepVerifier.create(AmbientRequestContext.currentReactive())
            .verifyComplete();
    }

    @Test
    @DisplayName("Should restore the thread-local after an asynchronous boundary")
    void testPropagationAcrossAsyncBoundary() {
        // Given
        AmbientRequestContext.enableReactivePropagation();
        AmbientRequestContext.enableReactivePropagation();

        // When
        Mono<Optional<RequestContext>> pipeline = Mono.delay(Duration.ofMillis(10))
            .publishOn(Schedulers.boundedElastic())
            .handle((tick, sink) -> sink.next(Optional.ofNullable(AmbientRequestContext.current())));

        // Then
        StepVerifier.create(AmbientRequestContext.runReactive(INNER, pipeline))
            .expectNext(Optional.of(INNER))
            .verifyComplete();
    }

    @Test
    @DisplayName("Should let an inner reactive scope shadow the outer one")
    void testNestedReactiveScopes() {
        Mono<RequestContext> inner = AmbientRequestContext.runReactive(INNER, AmbientRequestContext.currentReactive());
        Mono<String> pipeline = AmbientRequestContext.runReactive(OUTER,
            inner.zipWith(AmbientRequestContext.currentReactive(),
                (in, out) -> in.timezone() + "|" + out.timezone()));

        StepVerifier.create(pipeline)
            .expectNext("America/Denver|UTC")
            .verifyComplete();
    }

    private static void awaitQuietly(CountDownLatch latch) {
        latch.countDown();
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
