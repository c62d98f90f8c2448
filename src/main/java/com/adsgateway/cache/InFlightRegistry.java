package com.adsgateway.cache;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Collapses concurrent identical requests into one underlying call.
 *
 * The first caller for a key starts a flight on the shared executor; callers
 * arriving while it runs attach to the same flight and get the same outcome.
 * The flight belongs to no caller thread, so the caller that started it can
 * walk away without the call being dropped for everyone else. Each attached
 * caller holds a reference; the flight is cancelled only when the last one
 * lets go before it finishes.
 *
 * A finished flight leaves the registry before its outcome is published, so
 * only callers that joined while the loader was running share it. A loader
 * that populates a cache before returning leaves no window in which a second
 * flight could miss that cache.
 *
 * @param <V> result type
 */
@Slf4j
public class InFlightRegistry<V> {

    private final ExecutorService executor;
    private final ConcurrentMap<String, Flight> flights = new ConcurrentHashMap<>();

    public InFlightRegistry(ExecutorService executor) {
        this.executor = executor;
    }

    /**
     * Attach to the flight for {@code key}, starting one with {@code loader} if none is running.
     * The returned ticket must be released once the caller is done with it.
     */
    public Ticket join(String key, Callable<V> loader) {
        AtomicReference<Flight> created = new AtomicReference<>();
        Flight flight = flights.compute(key, (k, existing) -> {
            if (existing != null && existing.attach()) {
                return existing;
            }
            Flight fresh = new Flight(k);
            fresh.attach();
            created.set(fresh);
            return fresh;
        });

        if (created.get() != null) {
            log.trace("Starting flight {}", key);
            created.get().start(loader);
        } else {
            log.trace("Joined flight {}", key);
        }
        return new Ticket(flight);
    }

    /**
     * Push back the deadline of every caller waiting on the running flight for {@code key}.
     * Called from inside a loader that is about to block for a known, bounded time.
     */
    public void extendDeadline(String key, Duration extension) {
        Flight flight = flights.get(key);
        if (flight != null) {
            flight.extensionNanos.addAndGet(extension.toNanos());
        }
    }

    public int inFlight() {
        return flights.size();
    }

    /**
     * One caller's claim on a flight.
     */
    public final class Ticket {
        private final Flight flight;
        private boolean released;

        private Ticket(Flight flight) {
            this.flight = flight;
        }

        /**
         * Wait for the shared outcome. The timeout grows by any extension the flight
         * announces while it runs. Callers release the ticket afterwards whatever happened.
         *
         * @throws ExecutionException with the loader's failure as cause
         */
        public V await(long timeout, TimeUnit unit)
                throws InterruptedException, ExecutionException, TimeoutException {
            long deadline = System.nanoTime() + unit.toNanos(timeout);
            while (true) {
                long remaining = deadline + flight.extensionNanos.get() - System.nanoTime();
                if (remaining <= 0) {
                    throw new TimeoutException("Flight " + flight.key + " did not finish in time");
                }
                try {
                    return flight.result.get(remaining, TimeUnit.NANOSECONDS);
                } catch (TimeoutException e) {
                    log.trace("Deadline reached for flight {}, checking for extensions", flight.key);
                }
            }
        }

        /**
         * Let go of the flight. Cancels the underlying call when it is still running
         * and nobody else is waiting on it. Idempotent.
         */
        public void release() {
            if (!released) {
                released = true;
                flight.detach();
            }
        }
    }

    private final class Flight {
        private final String key;
        private final CompletableFuture<V> result = new CompletableFuture<>();
        private final AtomicLong extensionNanos = new AtomicLong();
        private Future<?> task;
        private int waiters;
        private boolean closed;

        private Flight(String key) {
            this.key = key;
        }

        private synchronized boolean attach() {
            if (closed) {
                return false;
            }
            waiters++;
            return true;
        }

        private void detach() {
            boolean abandon;
            synchronized (this) {
                waiters--;
                abandon = waiters == 0 && !closed;
                if (abandon) {
                    closed = true;
                }
            }
            if (abandon) {
                log.debug("Every caller abandoned flight {}, cancelling it", key);
                flights.remove(key, this);
                result.cancel(false);
                cancelTask();
            }
        }

        private void start(Callable<V> loader) {
            Future<?> submitted = executor.submit(() -> {
                V value = null;
                Throwable failure = null;
                try {
                    value = loader.call();
                } catch (Throwable t) {
                    failure = t;
                }

                synchronized (this) {
                    closed = true;
                }
                flights.remove(key, this);

                if (failure == null) {
                    result.complete(value);
                } else {
                    result.completeExceptionally(failure);
                }
            });
            synchronized (this) {
                task = submitted;
            }
            if (result.isCancelled()) {
                cancelTask();
            }
        }

        private void cancelTask() {
            Future<?> current;
            synchronized (this) {
                current = task;
            }
            if (current != null) {
                current.cancel(true);
            }
        }
    }
}
