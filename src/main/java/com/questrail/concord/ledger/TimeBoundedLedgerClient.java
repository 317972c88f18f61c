package com.questrail.concord.ledger;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * TimeBoundedLedgerClient
 * =============================================================================
 * {@link LedgerClient} decorator that enforces an upper bound on every call.
 *
 * <h2>Contract</h2>
 * Each call runs on a worker thread; the calling thread (normally the
 * coordination loop) waits at most {@code bound}, whatever the delegate does
 * with the timeout it is given.
 *
 * <h2>Failure mapping</h2>
 * <ul>
 *   <li>Overrun: the worker is interrupted and a {@link LedgerException} is thrown</li>
 *   <li>Runtime exception from the delegate: rethrown as is</li>
 *   <li>Caller interrupted: interrupt flag restored, {@link LedgerException} thrown</li>
 * </ul>
 *
 * <p>Workers are daemon threads from a cached pool; idle workers expire on
 * their own, so there is nothing to close.</p>
 */
public final class TimeBoundedLedgerClient implements LedgerClient
{
    private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();

    private final LedgerClient delegate;
    private final Duration bound;
    private final ExecutorService workers;

    public TimeBoundedLedgerClient(LedgerClient delegate, Duration bound) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.bound = Objects.requireNonNull(bound, "bound");
        if (bound.isNegative() || bound.isZero()) {
            throw new IllegalArgumentException("bound must be positive");
        }
        this.workers = Executors.newCachedThreadPool(daemonThreads("concord-ledger-" + POOL_SEQUENCE.incrementAndGet()));
    }

    /**
     * Wrap {@code client} unless it is already bounded by {@code bound}.
     */
    public static LedgerClient bounded(LedgerClient client, Duration bound) {
        if (client instanceof TimeBoundedLedgerClient b && b.bound.equals(bound)) {
            return b;
        }
        return new TimeBoundedLedgerClient(client, bound);
    }

    public Duration bound() {
        return bound;
    }

    @Override
    public long estimateCost(String target, Map<String, Object> payload) {
        return call("estimateCost", () -> delegate.estimateCost(target, payload));
    }

    @Override
    public TxHandle submit(String target, long value, Map<String, Object> payload, long costLimit) {
        return call("submit", () -> delegate.submit(target, value, payload, costLimit));
    }

    @Override
    public LedgerReceipt awaitConfirmation(TxHandle handle, Duration timeout) {
        Duration effective = timeout.compareTo(bound) < 0 ? timeout : bound;
        return call("awaitConfirmation", () -> delegate.awaitConfirmation(handle, effective));
    }

    private <T> T call(String operation, Callable<T> body) {
        Future<T> future = workers.submit(body);
        try {
            return future.get(bound.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new LedgerException(operation + " exceeded " + bound, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new LedgerException(operation + " failed", cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new LedgerException(operation + " interrupted", e);
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
