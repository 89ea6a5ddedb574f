package com.questrail.socket.server;

import com.questrail.socket.api.ConnState;
import com.questrail.socket.api.ConnectionCustomizer;
import com.questrail.socket.api.ConnectionHandler;
import com.questrail.socket.api.NetworkProtocol;
import com.questrail.socket.api.SocketErrorException;
import com.questrail.socket.context.ExecutionContext;
import com.questrail.socket.core.HandlerThreads;
import com.questrail.socket.transport.DatagramEndpoint;
import com.questrail.socket.transport.netty.NettyTransports;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.SocketAddress;
import java.util.Set;
import java.util.concurrent.ExecutorService;

/**
 * AbstractDatagramServer
 * =============================================================================
 * Server for connectionless transports.
 *
 * <p>The handler is invoked exactly once, on one dedicated thread, with a
 * {@link DatagramConnectionContext} shared by every peer. Datagrams are
 * therefore processed one at a time in arrival order. That task counts as one
 * open connection while it runs.</p>
 *
 * <p>A handler that throws ends datagram processing for this server until the
 * next {@code listen}; the socket stays bound until the server is stopped.
 * Stream servers, by contrast, isolate each connection.</p>
 */
public abstract class AbstractDatagramServer extends AbstractSocketServer<DatagramEndpoint>
{
    private static final Logger log = LoggerFactory.getLogger(AbstractDatagramServer.class);

    private volatile ExecutorService worker;

    protected AbstractDatagramServer(ConnectionCustomizer customizer, ConnectionHandler handler,
                                     NetworkProtocol protocol, int readBufferSize, Set<NetworkProtocol> accepted)
            throws SocketErrorException {
        super(customizer, handler, protocol, readBufferSize, accepted);
    }

    @Override
    protected DatagramEndpoint open(SocketAddress local, ExecutionContext run) throws IOException {
        return NettyTransports.bindDatagram(protocol, local, readBufferSize);
    }

    @Override
    protected void serve(DatagramEndpoint endpoint, ExecutionContext run) {
        DatagramConnectionContext connection = new DatagramConnectionContext(endpoint, run.child());
        ExecutorService w = HandlerThreads.single(protocol.code() + "-handler");
        worker = w;

        state.connectionOpened();
        w.execute(() -> handle(connection));
    }

    @Override
    protected void released() {
        ExecutorService w = worker;
        if (w != null) {
            w.shutdown();
            worker = null;
        }
    }

    private void handle(DatagramConnectionContext connection) {
        SocketAddress local = connection.localAddress();

        callbacks.info(local, null, ConnState.NEW);
        try {
            callbacks.info(local, null, ConnState.HANDLER);
            handler.handle(connection);
        } catch (RuntimeException e) {
            log.error("{} server: handler failed, datagram processing on {} stopped", protocol, local, e);
            callbacks.error(e);
        } finally {
            connection.close();
            callbacks.info(local, connection.remoteAddress(), ConnState.CLOSE);
            state.connectionClosed();
        }
    }
}
