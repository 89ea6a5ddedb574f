package com.questrail.socket.client;

import com.questrail.socket.api.ConnState;
import com.questrail.socket.api.ConnectionContext;
import com.questrail.socket.api.ErrorCallback;
import com.questrail.socket.api.InfoCallback;
import com.questrail.socket.api.NetworkProtocol;
import com.questrail.socket.api.ResponseHandler;
import com.questrail.socket.api.SocketClient;
import com.questrail.socket.api.SocketError;
import com.questrail.socket.api.SocketErrorException;
import com.questrail.socket.api.TlsConfig;
import com.questrail.socket.context.ExecutionContext;
import com.questrail.socket.core.CallbackSupport;
import com.questrail.socket.core.SocketDefaults;
import com.questrail.socket.transport.netty.NettyTransports;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.SocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * AbstractSocketClient
 * =============================================================================
 * State machine shared by every {@link SocketClient}.
 *
 * <p>The client holds at most one {@link ConnectionContext}. {@link #connect}
 * replaces it, {@link #close()} removes it; read and write go through whatever
 * is current and fail with {@link SocketError#CONNECTION} when nothing is.
 * Failures are thrown and also passed to the error callback.</p>
 *
 * <h2>Info events</h2>
 * <pre>
 *   connect: DIAL (null, target), then NEW (local, remote)
 *   read:    READ     write: WRITE     close: CLOSE
 * </pre>
 */
public abstract class AbstractSocketClient implements SocketClient
{
    private static final Logger log = LoggerFactory.getLogger(AbstractSocketClient.class);

    /**
     * Parses the target address for a transport.
     */
    @FunctionalInterface
    protected interface AddressParser
    {
        SocketAddress parse(String address, NetworkProtocol protocol) throws SocketErrorException;
    }

    protected final NetworkProtocol protocol;
    protected final SocketAddress target;
    protected final int readBufferSize = SocketDefaults.DEFAULT_BUFFER_SIZE;
    protected final CallbackSupport callbacks;

    private final AtomicReference<ConnectionContext> connection = new AtomicReference<>();
    private volatile Duration readTimeout;

    /**
     * @throws SocketErrorException {@code INVALID_PROTOCOL} when {@code protocol}
     *         is not one of {@code accepted}; {@code INVALID_ADDRESS} when the
     *         address is empty or invalid
     */
    protected AbstractSocketClient(NetworkProtocol protocol, Set<NetworkProtocol> accepted,
                                   String address, AddressParser parser) throws SocketErrorException {
        if (protocol == null || !accepted.contains(protocol)) {
            throw new SocketErrorException(SocketError.INVALID_PROTOCOL,
                    getClass().getSimpleName() + " does not dial " + protocol);
        }
        this.protocol = protocol;
        this.target = parser.parse(address, protocol);
        this.callbacks = new CallbackSupport(protocol.code() + " client");
    }

    /**
     * Open a connection to {@link #target}.
     */
    protected abstract ConnectionContext dial(ExecutionContext ctx) throws IOException;

    @Override
    public NetworkProtocol protocol() {
        return protocol;
    }

    public SocketAddress target() {
        return target;
    }

    /**
     * Accepted and ignored; transports with a security layer override this.
     */
    @Override
    public void setTls(boolean enabled, TlsConfig config, String serverName) throws SocketErrorException {
    }

    @Override
    public void connect(ExecutionContext ctx) throws IOException {
        Objects.requireNonNull(ctx, "ctx");

        if (!NettyTransports.isSupported(protocol)) {
            SocketErrorException e = new SocketErrorException(SocketError.INVALID_PROTOCOL,
                    protocol + " is not available on this host");
            callbacks.error(e);
            throw e;
        }

        callbacks.info(null, target, ConnState.DIAL);

        ConnectionContext c;
        try {
            c = dial(ctx);
        } catch (IOException e) {
            log.debug("{} client: dial {} failed", protocol, target, e);
            callbacks.error(e);
            throw e;
        }
        c.setReadTimeout(readTimeout);

        ConnectionContext previous = connection.getAndSet(c);
        if (previous != null) {
            try {
                previous.close();
            } catch (IOException e) {
                callbacks.error(e);
            }
        }

        callbacks.info(c.localAddress(), c.remoteAddress(), ConnState.NEW);
    }

    @Override
    public boolean isConnected() {
        ConnectionContext c = connection.get();
        return c != null && c.isConnected();
    }

    @Override
    public int read(byte[] buffer) throws IOException {
        return read(buffer, 0, buffer.length);
    }

    @Override
    public int read(byte[] buffer, int offset, int length) throws IOException {
        ConnectionContext c = current();
        callbacks.info(c.localAddress(), c.remoteAddress(), ConnState.READ);
        try {
            return c.read(buffer, offset, length);
        } catch (IOException e) {
            callbacks.error(e);
            throw e;
        }
    }

    @Override
    public int write(byte[] buffer) throws IOException {
        return write(buffer, 0, buffer.length);
    }

    @Override
    public int write(byte[] buffer, int offset, int length) throws IOException {
        ConnectionContext c = current();
        callbacks.info(c.localAddress(), c.remoteAddress(), ConnState.WRITE);
        try {
            return c.write(buffer, offset, length);
        } catch (IOException e) {
            callbacks.error(e);
            throw e;
        }
    }

    @Override
    public void setReadTimeout(Duration timeout) {
        this.readTimeout = timeout;
        ConnectionContext c = connection.get();
        if (c != null) {
            c.setReadTimeout(timeout);
        }
    }

    /**
     * Connects (replacing any current connection), writes {@code request} in
     * one write, passes the response stream to {@code response} and closes.
     * The close happens on every path; a close failure is only reported to the
     * error callback.
     */
    @Override
    public void once(ExecutionContext ctx, InputStream request, ResponseHandler response) throws IOException {
        Objects.requireNonNull(ctx, "ctx");
        try {
            connect(ctx);

            if (request != null) {
                byte[] payload = request.readAllBytes();
                if (payload.length > 0) {
                    write(payload);
                }
            }
            if (response != null) {
                response.handle(new ResponseStream());
            }
        } finally {
            try {
                close();
            } catch (IOException e) {
                callbacks.error(e);
            }
        }
    }

    @Override
    public void close() throws IOException {
        ConnectionContext c = connection.getAndSet(null);
        if (c == null) {
            throw new SocketErrorException(SocketError.CONNECTION, "not connected");
        }
        callbacks.info(c.localAddress(), c.remoteAddress(), ConnState.CLOSE);
        c.close();
    }

    @Override
    public void registerInfo(InfoCallback callback) {
        callbacks.registerInfo(callback);
    }

    @Override
    public void registerError(ErrorCallback callback) {
        callbacks.registerError(callback);
    }

    private ConnectionContext current() throws SocketErrorException {
        ConnectionContext c = connection.get();
        if (c == null) {
            SocketErrorException e = new SocketErrorException(SocketError.CONNECTION, "not connected");
            callbacks.error(e);
            throw e;
        }
        return c;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + protocol + " " + target + ", connected=" + isConnected() + "]";
    }

    /**
     * Response view handed to {@link ResponseHandler}: reads through the client.
     */
    private final class ResponseStream extends InputStream
    {
        @Override
        public int read() throws IOException {
            byte[] one = new byte[1];
            int n;
            do {
                n = AbstractSocketClient.this.read(one, 0, 1);
            } while (n == 0);
            return n < 0 ? -1 : one[0] & 0xff;
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            Objects.checkFromIndexSize(off, len, b.length);
            if (len == 0) {
                return 0;
            }
            return AbstractSocketClient.this.read(b, off, len);
        }
    }
}
