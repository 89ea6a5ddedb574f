package com.questrail.socket.server;

import com.questrail.socket.api.ConnState;
import com.questrail.socket.api.ConnectionContext;
import com.questrail.socket.api.ConnectionCustomizer;
import com.questrail.socket.api.ConnectionHandler;
import com.questrail.socket.api.NetworkProtocol;
import com.questrail.socket.api.SocketErrorException;
import com.questrail.socket.context.ExecutionContext;
import com.questrail.socket.core.HandlerThreads;
import com.questrail.socket.core.SocketDefaults;
import com.questrail.socket.transport.ListeningEndpoint;
import com.questrail.socket.transport.StreamAcceptListener;
import com.questrail.socket.transport.StreamOptions;
import com.questrail.socket.transport.netty.NettyTransports;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.SocketAddress;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * AbstractStreamServer
 * =============================================================================
 * Accept-and-dispatch server for connection-oriented transports.
 *
 * <p>Each accepted connection is counted, then handed to the handler on its
 * own thread. When the handler returns (or throws) the connection is closed,
 * {@code CLOSE} is reported and the count drops. A failing connection never
 * affects the others or the accept loop.</p>
 *
 * <p>Accepted connections outlive cancellation until the handler returns or
 * the endpoint is closed at the end of {@code listen}, at which point handlers
 * still reading see end of stream.</p>
 */
public abstract class AbstractStreamServer extends AbstractSocketServer<ListeningEndpoint>
{
    private static final Logger log = LoggerFactory.getLogger(AbstractStreamServer.class);

    private volatile Duration idleTimeout;
    private volatile ExecutorService handlers;

    protected AbstractStreamServer(ConnectionCustomizer customizer, ConnectionHandler handler,
                                   NetworkProtocol protocol, int readBufferSize, Set<NetworkProtocol> accepted)
            throws SocketErrorException {
        super(customizer, handler, protocol, readBufferSize, accepted);
    }

    /**
     * Close connections without traffic in either direction for {@code timeout}.
     * Values below one second (and {@code null}) disable the check.
     * Applies to subsequent {@code listen} calls.
     */
    public void setIdleTimeout(Duration timeout) {
        this.idleTimeout = SocketDefaults.idleTimeout(timeout);
    }

    public Duration idleTimeout() {
        return idleTimeout;
    }

    /**
     * Transport settings for the next bind. Subclasses add transport security.
     */
    protected StreamOptions streamOptions() {
        return new StreamOptions(readBufferSize, idleTimeout, null, null);
    }

    @Override
    protected ListeningEndpoint open(SocketAddress local, ExecutionContext run) throws IOException {
        handlers = HandlerThreads.perTask(protocol.code() + "-handler");
        return NettyTransports.stream(protocol, streamOptions()).listen(local, run, new Acceptor());
    }

    @Override
    protected void serve(ListeningEndpoint endpoint, ExecutionContext run) {
        // Accepting started at bind; connections arrive through the Acceptor.
    }

    @Override
    protected void released() {
        ExecutorService h = handlers;
        if (h != null) {
            h.shutdown();
        }
    }

    private void handle(ConnectionContext connection) {
        SocketAddress local = connection.localAddress();
        SocketAddress remote = connection.remoteAddress();

        callbacks.info(local, remote, ConnState.NEW);
        try {
            callbacks.info(local, remote, ConnState.HANDLER);
            handler.handle(connection);
        } catch (RuntimeException e) {
            log.error("{} server: handler failed for {}", protocol, remote, e);
            callbacks.error(e);
        } finally {
            try {
                connection.close();
            } catch (IOException e) {
                callbacks.error(e);
            }
            callbacks.info(local, remote, ConnState.CLOSE);
            state.connectionClosed();
        }
    }

    /**
     * Runs on the transport's I/O threads; only counts and hands off.
     */
    private final class Acceptor implements StreamAcceptListener
    {
        @Override
        public void onAccepted(ConnectionContext connection) {
            state.connectionOpened();
            try {
                handlers.execute(() -> handle(connection));
            } catch (RejectedExecutionException e) {
                // Listen is tearing down; closing the endpoint closes the connection too.
                state.connectionClosed();
                callbacks.error(e);
            }
        }

        @Override
        public void onError(Throwable cause) {
            callbacks.error(cause);
        }
    }
}
