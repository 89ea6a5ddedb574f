package com.questrail.socket.context;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * ExecutionContext
 * =============================================================================
 * Cancellation signal with an optional deadline, passed to blocking operations
 * such as {@code SocketServer.listen} and {@code SocketClient.connect}.
 *
 * <h2>Tree</h2>
 * <p>Contexts form a tree. {@link #child()} and {@link #withTimeout(Duration)}
 * derive a context that is cancelled when its parent is cancelled, when its own
 * deadline passes, or when {@link #cancel()} is called on it. Cancelling a
 * child never affects the parent. This is how a server merges caller
 * cancellation and its own {@code shutdown} into one signal.</p>
 *
 * <h2>Background</h2>
 * <p>{@link #background()} is the root: it has no deadline and cannot be
 * cancelled.</p>
 *
 * <h2>Deadlines</h2>
 * <p>Deadlines are measured on the {@link SystemMonotonicClock} and fire on a
 * shared daemon timer thread. A derived context never outlives its parent's
 * deadline.</p>
 *
 * <h2>Thread safety</h2>
 * <p>All methods are safe to call from any thread. Listeners registered with
 * {@link #onCancel(Runnable)} run exactly once, on the thread that cancels (or
 * on the caller's thread if the context is already cancelled).</p>
 */
public final class ExecutionContext
{
    private static final Logger log = LoggerFactory.getLogger(ExecutionContext.class);

    private static final MonotonicClock CLOCK = SystemMonotonicClock.INSTANCE;
    private static final long NO_DEADLINE = Long.MAX_VALUE;

    private static final ExecutionContext BACKGROUND = new ExecutionContext(false, NO_DEADLINE);

    private final boolean cancellable;
    private final long deadlineNanos;

    private final Object lock = new Object();
    private final CountDownLatch done = new CountDownLatch(1);

    // null once cancelled
    private List<Runnable> listeners = new ArrayList<>();

    private volatile Cancellable detachFromParent = () -> false;
    private volatile Cancellable timer = () -> false;

    private ExecutionContext(boolean cancellable, long deadlineNanos) {
        this.cancellable = cancellable;
        this.deadlineNanos = deadlineNanos;
    }

    /**
     * @return the root context: never cancelled, no deadline
     */
    public static ExecutionContext background() {
        return BACKGROUND;
    }

    /**
     * Derive a cancellable context that inherits this context's deadline.
     */
    public ExecutionContext child() {
        return derive(deadlineNanos);
    }

    /**
     * Derive a context cancelled after {@code timeout}, or earlier if this
     * context is cancelled first.
     */
    public ExecutionContext withTimeout(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        long now = CLOCK.nowNanos();
        long requested = saturatedAdd(now, timeout.toNanos());
        return derive(Math.min(requested, deadlineNanos));
    }

    private ExecutionContext derive(long deadline) {
        ExecutionContext c = new ExecutionContext(true, deadline);

        if (this.cancellable) {
            c.detachFromParent = this.onCancel(c::cancel);
        }
        if (deadline != NO_DEADLINE && !c.isCancelled()) {
            long delay = Math.max(0, deadline - CLOCK.nowNanos());
            ScheduledFuture<?> f = Timer.INSTANCE.executor.schedule(c::cancel, delay, TimeUnit.NANOSECONDS);
            c.timer = () -> f.cancel(false);
        }
        return c;
    }

    /**
     * Cancel this context and every context derived from it. Idempotent.
     * Has no effect on {@link #background()}.
     */
    public void cancel() {
        if (!cancellable) {
            return;
        }

        List<Runnable> toRun;
        synchronized (lock) {
            if (listeners == null) {
                return;
            }
            toRun = listeners;
            listeners = null;
        }

        done.countDown();
        timer.cancel();
        detachFromParent.cancel();

        for (Runnable r : toRun) {
            runListener(r);
        }
    }

    public boolean isCancelled() {
        return done.getCount() == 0;
    }

    /**
     * Register {@code listener} to run once on cancellation. Runs immediately
     * when the context is already cancelled.
     *
     * @return handle detaching the listener; {@code cancel()} on it returns
     *         {@code false} once the listener has run
     */
    public Cancellable onCancel(Runnable listener) {
        Objects.requireNonNull(listener, "listener");
        if (!cancellable) {
            return () -> false;
        }

        synchronized (lock) {
            if (listeners != null) {
                listeners.add(listener);
                return () -> {
                    synchronized (lock) {
                        return listeners != null && listeners.remove(listener);
                    }
                };
            }
        }

        runListener(listener);
        return () -> false;
    }

    /**
     * Block until cancelled.
     */
    public void await() throws InterruptedException {
        done.await();
    }

    /**
     * Block until cancelled or {@code timeout} elapses.
     *
     * @return {@code true} if the context was cancelled
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return done.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    public boolean hasDeadline() {
        return deadlineNanos != NO_DEADLINE;
    }

    /**
     * @return time left until the deadline (never negative), or empty when
     *         there is no deadline
     */
    public Optional<Duration> remaining() {
        if (!hasDeadline()) {
            return Optional.empty();
        }
        return Optional.of(Duration.ofNanos(Math.max(0, deadlineNanos - CLOCK.nowNanos())));
    }

    private static void runListener(Runnable r) {
        try {
            r.run();
        } catch (RuntimeException e) {
            log.warn("Cancellation listener failed", e);
        }
    }

    private static long saturatedAdd(long a, long b) {
        long r = a + b;
        if (((a ^ r) & (b ^ r)) < 0) {
            return NO_DEADLINE;
        }
        return r;
    }

    @Override
    public String toString() {
        if (!cancellable) {
            return "ExecutionContext[background]";
        }
        return "ExecutionContext[cancelled=" + isCancelled() + ", deadline=" + (hasDeadline() ? remaining().orElseThrow() : "none") + "]";
    }

    /**
     * Lazily started daemon timer shared by all deadlines.
     */
    private enum Timer {
        INSTANCE;

        private final ScheduledExecutorService executor;

        Timer() {
            AtomicInteger seq = new AtomicInteger();
            this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "execution-context-timer-" + seq.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
        }
    }
}
