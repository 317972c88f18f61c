package com.questrail.concord.internal.exec;

import com.questrail.concord.internal.events.CoordinationEvent;
import com.questrail.concord.internal.events.CoordinationEvent.InboundPayload;
import com.questrail.concord.internal.events.CoordinationEvent.LocalCommand;
import com.questrail.concord.internal.events.CoordinationEvent.Tick;
import com.questrail.concord.internal.time.Cancellable;
import com.questrail.concord.internal.time.MonotonicClock;
import com.questrail.concord.internal.time.MonotonicScheduler;
import com.questrail.concord.internal.time.WallClock;
import com.questrail.concord.observability.CoordinationErrorEvent;
import com.questrail.concord.observability.CoordinationObservabilitySink;
import com.questrail.concord.observability.NullObservabilitySink;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * CoordinationDriver
 * =============================================================================
 * The single event loop of one peer.
 *
 * <h2>Threading Model</h2>
 * One queue, one consumer thread. Transport threads, API callers and the tick
 * scheduler only enqueue; every coordinator runs on the loop thread, so
 * coordinators need no locks.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   driver.start()             → starts loop thread and tick schedule
 *   driver.deliver(...)        → enqueues an inbound payload
 *   driver.call(name, action)  → enqueues a command, returns its future
 *   driver.stop()              → stops the loop; queued commands fail
 * </pre>
 *
 * <p>Events enqueued before {@link #start()} are kept and processed once the
 * loop runs. {@link #drainPending()} processes them on the calling thread
 * instead, for deterministic use without a loop thread.</p>
 *
 * <h2>Errors</h2>
 * An exception escaping an event is reported to the sink; the loop continues
 * with the next event.
 */
public final class CoordinationDriver {

    private final CoordinationEventHandler handler;
    private final MonotonicClock monotonicClock;
    private final MonotonicScheduler scheduler;
    private final Duration tickInterval;
    private final WallClock wallClock;
    private final CoordinationObservabilitySink observabilitySink;

    private final BlockingQueue<CoordinationEvent> eventQueue = new LinkedBlockingQueue<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private volatile Thread eventLoopThread;
    private volatile Cancellable scheduledTick;

    public CoordinationDriver(CoordinationEventHandler handler,
                              MonotonicClock monotonicClock,
                              MonotonicScheduler scheduler,
                              Duration tickInterval,
                              WallClock wallClock,
                              CoordinationObservabilitySink observabilitySink)
    {
        this.handler = Objects.requireNonNull(handler, "handler");
        this.monotonicClock = Objects.requireNonNull(monotonicClock, "monotonicClock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.tickInterval = Objects.requireNonNull(tickInterval, "tickInterval");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);

        if (tickInterval.isNegative() || tickInterval.isZero()) {
            throw new IllegalArgumentException("tickInterval must be positive");
        }
    }

    /**
     * Starts the loop thread and the tick schedule. Idempotent.
     *
     * @throws IllegalStateException if the driver was stopped
     */
    public void start() {
        if (stopped.get()) {
            throw new IllegalStateException("CoordinationDriver cannot be restarted");
        }
        if (running.compareAndSet(false, true)) {
            eventLoopThread = new Thread(this::runEventLoop, "concord-coordination-driver");
            eventLoopThread.setDaemon(true);
            eventLoopThread.start();
            scheduleNextTick();
        }
    }

    /**
     * Stops the loop and waits for the thread to finish. Commands still queued
     * complete exceptionally.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        running.set(false);

        Cancellable tick = scheduledTick;
        if (tick != null) {
            tick.cancel();
            scheduledTick = null;
        }

        Thread loop = eventLoopThread;
        if (loop != null) {
            loop.interrupt();
            try {
                loop.join(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        List<CoordinationEvent> leftover = new ArrayList<>();
        eventQueue.drainTo(leftover);
        IllegalStateException reason = new IllegalStateException("CoordinationDriver stopped");
        for (CoordinationEvent event : leftover) {
            if (event instanceof LocalCommand<?> command) {
                command.abandon(reason);
            }
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Enqueue a payload received on {@code channel}. Ignored once stopped.
     */
    public void deliver(String channel, byte[] payload) {
        submit(new InboundPayload(wallClock.now(), channel, payload));
    }

    /**
     * Run {@code action} on the loop thread.
     *
     * @return future completed with the action's result, or exceptionally with
     *         what it threw; fails immediately if the driver is stopped
     */
    public <T> CompletableFuture<T> call(String name, Supplier<T> action) {
        CompletableFuture<T> completion = new CompletableFuture<>();
        LocalCommand<T> command = new LocalCommand<>(wallClock.now(), name, action, completion);
        if (!submit(command)) {
            completion.completeExceptionally(new IllegalStateException("CoordinationDriver stopped"));
        }
        return completion;
    }

    /**
     * Enqueue a tick. Normally driven by the scheduler.
     */
    public void tick() {
        submit(new Tick(wallClock.now()));
    }

    /**
     * @return {@code false} if the driver is stopped and the event was not queued
     */
    public boolean submit(CoordinationEvent event) {
        Objects.requireNonNull(event, "event");
        if (stopped.get()) {
            return false;
        }
        return eventQueue.offer(event);
    }

    /**
     * Process every queued event on the calling thread.
     *
     * @return number of events processed
     * @throws IllegalStateException if the loop thread is running
     */
    public int drainPending() {
        if (running.get()) {
            throw new IllegalStateException("drainPending() is only available while the loop is not running");
        }
        int processed = 0;
        CoordinationEvent event;
        while ((event = eventQueue.poll()) != null) {
            processSafely(event);
            processed++;
        }
        return processed;
    }

    private void scheduleNextTick() {
        scheduledTick = scheduler.scheduleAfter(tickInterval, monotonicClock, () -> {
            if (running.get()) {
                tick();
                scheduleNextTick();
            }
        });
    }

    private void runEventLoop() {
        while (running.get()) {
            try {
                CoordinationEvent event = eventQueue.take();
                if (running.get()) {
                    processSafely(event);
                } else if (event instanceof LocalCommand<?> command) {
                    command.abandon(new IllegalStateException("CoordinationDriver stopped"));
                }
            } catch (InterruptedException e) {
                // Interrupts only signal stop(); the loop condition decides.
                if (!running.get()) {
                    return;
                }
            }
        }
    }

    private void processSafely(CoordinationEvent event) {
        try {
            process(event);
        } catch (RuntimeException e) {
            observabilitySink.onError(new CoordinationErrorEvent(
                    wallClock.now(),
                    "Event processing error: " + event.getClass().getSimpleName(),
                    e));
        }
    }

    private void process(CoordinationEvent event) {
        if (event instanceof InboundPayload inbound) {
            handler.onInbound(inbound.channel(), inbound.payload());
        } else if (event instanceof LocalCommand<?> command) {
            command.run();
        } else if (event instanceof Tick) {
            handler.onTick();
        }
    }
}
