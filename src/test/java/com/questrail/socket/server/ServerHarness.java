package com.questrail.socket.server;

import com.questrail.socket.api.SocketServer;
import com.questrail.socket.context.ExecutionContext;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * ServerHarness
 * -----------------------------------------------------------------------------
 * Runs {@link SocketServer#listen} on a background thread for a test.
 *
 * <p>{@link #start} returns once the server reports running (or fails if
 * {@code listen} exits first). {@link #stop()} cancels the listen context and
 * rethrows whatever {@code listen} threw.</p>
 */
public final class ServerHarness implements AutoCloseable {

    private static final Duration STARTUP = Duration.ofSeconds(5);

    private final SocketServer server;
    private final ExecutionContext ctx = ExecutionContext.background().child();
    private final CompletableFuture<Void> done = new CompletableFuture<>();

    private ServerHarness(SocketServer server) {
        this.server = server;
    }

    public static ServerHarness start(SocketServer server) throws Exception {
        ServerHarness h = new ServerHarness(server);
        Thread t = new Thread(() -> {
            try {
                server.listen(h.ctx);
                h.done.complete(null);
            } catch (Throwable e) {
                h.done.completeExceptionally(e);
            }
        }, "listen-" + server.protocol());
        t.setDaemon(true);
        t.start();

        long deadline = System.nanoTime() + STARTUP.toNanos();
        while (!server.isRunning()) {
            if (h.done.isDone()) {
                h.done.get();
                throw new AssertionError("listen returned before running");
            }
            if (System.nanoTime() >= deadline) {
                throw new AssertionError("server did not start within " + STARTUP);
            }
            Thread.sleep(2);
        }
        return h;
    }

    public SocketServer server() {
        return server;
    }

    public ExecutionContext context() {
        return ctx;
    }

    public SocketAddress address() {
        return server.boundAddress().orElseThrow();
    }

    /**
     * @return {@code 127.0.0.1:<bound port>}
     */
    public String loopback() {
        return "127.0.0.1:" + ((InetSocketAddress) address()).getPort();
    }

    public boolean isDone() {
        return done.isDone();
    }

    /**
     * Wait for {@code listen} to return on its own.
     */
    public void awaitExit(Duration timeout) throws Exception {
        unwrap(timeout);
    }

    public void stop() throws Exception {
        ctx.cancel();
        unwrap(Duration.ofSeconds(5));
    }

    private void unwrap(Duration timeout) throws Exception {
        try {
            done.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof Exception cause) {
                throw cause;
            }
            throw e;
        } catch (TimeoutException e) {
            throw new AssertionError("listen did not return within " + timeout, e);
        }
    }

    @Override
    public void close() {
        ctx.cancel();
        try {
            done.get(5, TimeUnit.SECONDS);
        } catch (Exception ignored) {
            // reported by the test that cares
        }
    }
}
