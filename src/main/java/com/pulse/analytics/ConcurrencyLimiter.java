package com.pulse.analytics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.MonoSink;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Supplier;

/**
 * Non-blocking counting semaphore with FIFO hand-off.
 *
 * Bounds how many calls to the hosted analytics service are in flight. A
 * caller that finds every slot taken is queued and its {@link #acquire()}
 * Mono completes only when a {@link #release()} hands it the freed slot; no
 * thread blocks while waiting. Freed slots always go to the oldest waiter, so
 * a caller arriving later can never overtake one already queued.
 *
 * The slot counter and the waiter queue are only touched under {@code lock};
 * waiters are signalled after the lock is dropped. A waiter that is cancelled
 * while queued is removed, and one cancelled after being granted gives its
 * slot back, so cancellation never leaks a slot.
 *
 * Prefer {@link #withPermit(Supplier)}, which releases on completion, error
 * and cancellation.
 */
public class ConcurrencyLimiter {

    private static final Logger log = LoggerFactory.getLogger(ConcurrencyLimiter.class);

    private final String name;
    private final int capacity;
    private final Object lock = new Object();
    private final Deque<Waiter> waiters = new ArrayDeque<>();
    private int inUse;

    public ConcurrencyLimiter(String name, int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Limiter capacity must be at least 1, got " + capacity);
        }
        this.name = name;
        this.capacity = capacity;
        log.info("Concurrency limiter '{}' initialized with capacity {}", name, capacity);
    }

    /**
     * Completes once a slot is held by the caller. Every successful acquire
     * must be matched by exactly one {@link #release()}.
     */
    public Mono<Void> acquire() {
        return acquirePermit().then();
    }

    /**
     * Frees one slot, handing it straight to the oldest waiter if there is one.
     *
     * @throws IllegalStateException if no slot is held
     */
    public void release() {
        Waiter next;
        synchronized (lock) {
            next = waiters.pollFirst();
            if (next == null) {
                if (inUse == 0) {
                    throw new IllegalStateException("release() called on limiter '" + name + "' with no slot held");
                }
                inUse--;
                return;
            }
            next.granted = true;
        }
        log.trace("Limiter '{}' handed slot to queued waiter", name);
        next.sink.success(Boolean.TRUE);
    }

    /**
     * Runs {@code work} while holding a slot. The slot is held across the
     * whole of {@code work}, including any retries it performs.
     */
    public <T> Mono<T> withPermit(Supplier<Mono<T>> work) {
        return Mono.usingWhen(
            acquirePermit(),
            permit -> Mono.defer(work),
            permit -> Mono.fromRunnable(this::release));
    }

    public int inUse() {
        synchronized (lock) {
            return inUse;
        }
    }

    public int queued() {
        synchronized (lock) {
            return waiters.size();
        }
    }

    private Mono<Boolean> acquirePermit() {
        return Mono.create(sink -> {
            Waiter waiter = new Waiter(sink);
            sink.onCancel(() -> abandon(waiter));

            boolean immediate;
            synchronized (lock) {
                if (waiter.cancelled) {
                    return;
                }
                if (inUse < capacity) {
                    inUse++;
                    waiter.granted = true;
                    immediate = true;
                } else {
                    waiters.addLast(waiter);
                    immediate = false;
                }
            }

            if (immediate) {
                sink.success(Boolean.TRUE);
            } else {
                log.debug("Limiter '{}' saturated ({} in use), caller queued", name, capacity);
            }
        });
    }

    /**
     * Cancellation of a pending acquire. A granted waiter's sink may already
     * have dropped the success signal, so its slot is released here.
     */
    private void abandon(Waiter waiter) {
        boolean releaseSlot;
        synchronized (lock) {
            waiter.cancelled = true;
            releaseSlot = waiter.granted;
            if (!releaseSlot) {
                waiters.remove(waiter);
            }
        }
        if (releaseSlot) {
            release();
        }
    }

    private static final class Waiter {
        private final MonoSink<Boolean> sink;
        private boolean granted;
        private boolean cancelled;

        Waiter(MonoSink<Boolean> sink) {
            this.sink = sink;
        }
    }
}
