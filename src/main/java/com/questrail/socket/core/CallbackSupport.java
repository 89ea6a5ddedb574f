package com.questrail.socket.core;

import com.questrail.socket.api.ConnState;
import com.questrail.socket.api.ErrorCallback;
import com.questrail.socket.api.InfoCallback;
import com.questrail.socket.api.ServerInfoCallback;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketAddress;
import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * CallbackSupport
 * =============================================================================
 * Holder for the observability callbacks of one server or client.
 *
 * <h2>Semantics</h2>
 * <ul>
 *   <li>Last registration wins; registering {@code null} disables the hook.</li>
 *   <li>Callbacks run synchronously on the thread that observed the event.</li>
 *   <li>A callback that throws is logged and otherwise ignored; it can never
 *       break the accept loop or a client operation.</li>
 *   <li>Errors that only say "socket already closed" are dropped
 *       (see {@link SocketErrors#filter(Throwable)}), as are {@code null}s.</li>
 * </ul>
 */
public final class CallbackSupport
{
    private static final Logger log = LoggerFactory.getLogger(CallbackSupport.class);

    private final String owner;

    private final AtomicReference<InfoCallback> info = new AtomicReference<>();
    private final AtomicReference<ErrorCallback> error = new AtomicReference<>();
    private final AtomicReference<ServerInfoCallback> serverInfo = new AtomicReference<>();

    /**
     * @param owner short description used in log lines, e.g. {@code "tcp server"}
     */
    public CallbackSupport(String owner) {
        this.owner = Objects.requireNonNull(owner, "owner");
    }

    public void registerInfo(InfoCallback callback) {
        info.set(callback);
    }

    public void registerError(ErrorCallback callback) {
        error.set(callback);
    }

    public void registerServerInfo(ServerInfoCallback callback) {
        serverInfo.set(callback);
    }

    public void info(SocketAddress local, SocketAddress remote, ConnState state) {
        InfoCallback f = info.get();
        if (f == null) {
            return;
        }
        try {
            f.onInfo(local, remote, state);
        } catch (RuntimeException e) {
            log.warn("{}: info callback failed for state {}", owner, state, e);
        }
    }

    public void error(Throwable... errors) {
        ErrorCallback f = error.get();
        if (f == null || errors == null) {
            return;
        }

        Throwable[] reported = Arrays.stream(errors)
                .map(SocketErrors::filter)
                .filter(Objects::nonNull)
                .toArray(Throwable[]::new);
        if (reported.length == 0) {
            return;
        }

        try {
            f.onError(reported);
        } catch (RuntimeException e) {
            log.warn("{}: error callback failed", owner, e);
        }
    }

    public void serverInfo(String format, Object... args) {
        ServerInfoCallback f = serverInfo.get();
        if (f == null) {
            return;
        }
        try {
            f.onServerInfo(String.format(format, args));
        } catch (RuntimeException e) {
            log.warn("{}: server info callback failed", owner, e);
        }
    }
}
