package com.questrail.socket.server;

import com.questrail.socket.api.ConnectionCustomizer;
import com.questrail.socket.api.ConnectionHandler;
import com.questrail.socket.api.ErrorCallback;
import com.questrail.socket.api.InfoCallback;
import com.questrail.socket.api.NetworkProtocol;
import com.questrail.socket.api.ServerInfoCallback;
import com.questrail.socket.api.SocketError;
import com.questrail.socket.api.SocketErrorException;
import com.questrail.socket.api.SocketServer;
import com.questrail.socket.api.TlsConfig;
import com.questrail.socket.context.ExecutionContext;
import com.questrail.socket.context.MonotonicClock;
import com.questrail.socket.context.SystemMonotonicClock;
import com.questrail.socket.core.CallbackSupport;
import com.questrail.socket.core.ServerState;
import com.questrail.socket.core.SocketDefaults;
import com.questrail.socket.transport.ListeningEndpoint;
import com.questrail.socket.transport.netty.NettyTransports;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * AbstractSocketServer
 * =============================================================================
 * Lifecycle shared by every {@link SocketServer}: validation, bind, the
 * customizer hook, cancellation wiring, teardown and shutdown.
 *
 * <h2>Listen</h2>
 * <ol>
 *   <li>Reject missing address ({@code INVALID_ADDRESS}), missing handler
 *       ({@code INVALID_HANDLER}) or an unavailable transport
 *       ({@code INVALID_PROTOCOL}).</li>
 *   <li>{@link #open} the endpoint; a bind failure is thrown unchanged.</li>
 *   <li>Run the {@link ConnectionCustomizer} once.</li>
 *   <li>Derive the run context from the caller's; {@link #shutdown} cancels
 *       the same context, so both converge on one signal.</li>
 *   <li>{@link #serve} and wait for the run context.</li>
 *   <li>Tear down: close the endpoint, {@link #released()}, then
 *       {@code running=false}, {@code gone=true} on every path.</li>
 * </ol>
 *
 * <p>Cancelling the run context closes the listening socket, which unblocks
 * accepting; the listening socket closing for any other reason cancels the run
 * context, so {@code listen} never outlives its socket.</p>
 *
 * <h2>Subclasses</h2>
 * <p>Stream and datagram servers differ only in {@link #open} and
 * {@link #serve}; see {@link AbstractStreamServer} and
 * {@link AbstractDatagramServer}.</p>
 *
 * @param <E> endpoint type produced by {@link #open}
 */
public abstract class AbstractSocketServer<E extends ListeningEndpoint> implements SocketServer
{
    private static final Logger log = LoggerFactory.getLogger(AbstractSocketServer.class);

    protected final NetworkProtocol protocol;
    protected final ConnectionHandler handler;
    protected final int readBufferSize;
    protected final ServerState state = new ServerState();
    protected final CallbackSupport callbacks;

    private final ConnectionCustomizer customizer;
    private final MonotonicClock clock = SystemMonotonicClock.INSTANCE;

    private final Object lifecycle = new Object();

    // guarded by lifecycle
    private ExecutionContext runContext;
    private boolean listening;
    private boolean pendingShutdown;

    private volatile SocketAddress address;
    private volatile SocketAddress boundAddress;
    private volatile TlsConfig tls;

    /**
     * @param customizer     optional hook run on the bound socket
     * @param handler        connection handler; {@code null} makes {@link #listen} fail
     * @param protocol       must be one of {@code accepted}
     * @param readBufferSize non-positive selects {@link SocketDefaults#DEFAULT_BUFFER_SIZE}
     */
    protected AbstractSocketServer(ConnectionCustomizer customizer, ConnectionHandler handler,
                                   NetworkProtocol protocol, int readBufferSize, Set<NetworkProtocol> accepted)
            throws SocketErrorException {
        if (protocol == null || !accepted.contains(protocol)) {
            throw new SocketErrorException(SocketError.INVALID_PROTOCOL,
                    getClass().getSimpleName() + " does not serve " + protocol);
        }
        this.protocol = protocol;
        this.customizer = customizer;
        this.handler = handler;
        this.readBufferSize = SocketDefaults.bufferSize(readBufferSize);
        this.callbacks = new CallbackSupport(protocol.code() + " server");
    }

    // -------------------------------------------------------------------------
    // Template hooks
    // -------------------------------------------------------------------------

    /**
     * Parse a bind address for this transport.
     */
    protected abstract SocketAddress parseAddress(String address) throws SocketErrorException;

    /**
     * Bind the socket at {@code local}.
     *
     * @param run cancelled when the server starts draining
     */
    protected abstract E open(SocketAddress local, ExecutionContext run) throws IOException;

    /**
     * Start serving on {@code endpoint}. Must not block: {@code listen} waits
     * for the run context itself.
     */
    protected abstract void serve(E endpoint, ExecutionContext run);

    /**
     * Called once per {@code listen}, after the endpoint is closed (or failed to open).
     */
    protected void released() {
    }

    // -------------------------------------------------------------------------
    // SocketServer
    // -------------------------------------------------------------------------

    @Override
    public NetworkProtocol protocol() {
        return protocol;
    }

    @Override
    public void registerServer(String address) throws SocketErrorException {
        this.address = parseAddress(address);
    }

    /**
     * For subclasses with their own registration entry points.
     */
    protected void registerAddress(SocketAddress address) {
        this.address = Objects.requireNonNull(address, "address");
    }

    @Override
    public void setTls(boolean enabled, TlsConfig config) throws SocketErrorException {
        if (enabled && config == null) {
            throw new SocketErrorException(SocketError.INVALID_TLS_CONFIG, "TLS enabled without a configuration");
        }
        this.tls = enabled ? config : null;
    }

    /**
     * @return the TLS configuration for the next {@code listen}, or {@code null}
     */
    protected TlsConfig tls() {
        return tls;
    }

    @Override
    public void listen(ExecutionContext ctx) throws IOException {
        Objects.requireNonNull(ctx, "ctx");

        SocketAddress local = address;
        try {
            validate(local);
        } catch (SocketErrorException e) {
            callbacks.error(e);
            state.markGone();
            throw e;
        }

        synchronized (lifecycle) {
            if (listening) {
                SocketErrorException e = new SocketErrorException(SocketError.ALREADY_RUNNING, String.valueOf(local));
                callbacks.error(e);
                throw e;
            }
            listening = true;
        }

        ExecutionContext run = ctx.child();
        E endpoint = null;
        try {
            endpoint = open(local, run);
            boundAddress = endpoint.localAddress();
            customize(endpoint);

            synchronized (lifecycle) {
                runContext = run;
                if (pendingShutdown) {
                    pendingShutdown = false;
                    run.cancel();
                }
            }

            state.markRunning();
            log.info("{} server listening on {}", protocol, boundAddress);
            callbacks.serverInfo("starting listening socket '%s %s'", protocol, boundAddress);

            E ep = endpoint;
            run.onCancel(ep::closeListener);
            ep.onListenerClosed(run::cancel);

            serve(ep, run);
            run.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("interrupted while listening on " + local);
        } catch (IOException e) {
            log.debug("{} server on {} failed", protocol, local, e);
            callbacks.error(e);
            throw e;
        } finally {
            run.cancel();
            if (endpoint != null) {
                callbacks.serverInfo("closing listening socket '%s %s'", protocol, boundAddress);
                endpoint.close();
            }
            released();

            synchronized (lifecycle) {
                runContext = null;
                boundAddress = null;
                state.markGone();
                listening = false;
            }
            log.info("{} server on {} stopped", protocol, local);
        }
    }

    private void validate(SocketAddress local) throws SocketErrorException {
        if (local == null) {
            throw new SocketErrorException(SocketError.INVALID_ADDRESS, "no address registered");
        }
        if (handler == null) {
            throw new SocketErrorException(SocketError.INVALID_HANDLER);
        }
        if (!NettyTransports.isSupported(protocol)) {
            throw new SocketErrorException(SocketError.INVALID_PROTOCOL, protocol + " is not available on this host");
        }
    }

    private void customize(E endpoint) {
        if (customizer == null) {
            return;
        }
        try {
            customizer.customize(endpoint.boundSocket());
        } catch (RuntimeException e) {
            log.warn("{} server: socket customizer failed", protocol, e);
            callbacks.error(e);
        }
    }

    @Override
    public void shutdown(ExecutionContext ctx) throws IOException {
        Objects.requireNonNull(ctx, "ctx");

        ExecutionContext run;
        synchronized (lifecycle) {
            run = runContext;
            if (run == null) {
                // Not bound yet: remembered for the listen call in progress or the next one.
                if (listening || !state.isGone()) {
                    pendingShutdown = true;
                }
                return;
            }
        }

        run.cancel();
        awaitDrained(ctx);
    }

    private void awaitDrained(ExecutionContext ctx) throws IOException {
        Duration budget = ctx.remaining()
                .filter(r -> r.compareTo(SocketDefaults.SHUTDOWN_MAX_WAIT) < 0)
                .orElse(SocketDefaults.SHUTDOWN_MAX_WAIT);
        long deadline = clock.nowNanos() + budget.toNanos();

        try {
            while (state.isRunning() || state.openConnections() > 0) {
                if (clock.nowNanos() >= deadline || ctx.await(SocketDefaults.SHUTDOWN_POLL_INTERVAL)) {
                    throw new SocketErrorException(SocketError.SHUTDOWN_TIMEOUT,
                            state.openConnections() + " connection(s) still open");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("interrupted while waiting for shutdown");
        }
    }

    @Override
    public boolean isRunning() {
        return state.isRunning();
    }

    @Override
    public boolean isGone() {
        return state.isGone();
    }

    @Override
    public long openConnections() {
        return state.openConnections();
    }

    @Override
    public Optional<SocketAddress> boundAddress() {
        return state.isRunning() ? Optional.ofNullable(boundAddress) : Optional.empty();
    }

    @Override
    public void registerInfo(InfoCallback callback) {
        callbacks.registerInfo(callback);
    }

    @Override
    public void registerError(ErrorCallback callback) {
        callbacks.registerError(callback);
    }

    @Override
    public void registerServerInfo(ServerInfoCallback callback) {
        callbacks.registerServerInfo(callback);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + protocol + " " + address + ", " + state + "]";
    }
}
