package com.questrail.socket.observability;

import com.questrail.socket.api.ConnState;
import com.questrail.socket.api.ErrorCallback;
import com.questrail.socket.api.InfoCallback;
import com.questrail.socket.api.ServerInfoCallback;
import com.questrail.socket.api.SocketClient;
import com.questrail.socket.api.SocketServer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketAddress;
import java.util.Objects;

/**
 * Callback implementation that emits logs via SLF4J.
 *
 * <p>Connection events go to {@code debug} (per-read and per-write events to
 * {@code trace}), server lifecycle messages to {@code info}, errors to
 * {@code warn}.</p>
 */
public final class Slf4jSocketObserver implements InfoCallback, ErrorCallback, ServerInfoCallback
{
    private final Logger log;
    private final String name;

    public Slf4jSocketObserver(String name) {
        this(name, LoggerFactory.getLogger(Slf4jSocketObserver.class));
    }

    public Slf4jSocketObserver(String name, Logger log) {
        this.name = Objects.requireNonNull(name, "name");
        this.log = Objects.requireNonNull(log, "log");
    }

    /**
     * Register this observer for every callback of {@code server}.
     */
    public Slf4jSocketObserver attach(SocketServer server) {
        server.registerInfo(this);
        server.registerError(this);
        server.registerServerInfo(this);
        return this;
    }

    public Slf4jSocketObserver attach(SocketClient client) {
        client.registerInfo(this);
        client.registerError(this);
        return this;
    }

    @Override
    public void onInfo(SocketAddress local, SocketAddress remote, ConnState state) {
        if (state == ConnState.READ || state == ConnState.WRITE) {
            log.trace("[{}] {} local={} remote={}", name, state.label(), local, remote);
        } else {
            log.debug("[{}] {} local={} remote={}", name, state.label(), local, remote);
        }
    }

    @Override
    public void onError(Throwable... errors) {
        for (Throwable e : errors) {
            log.warn("[{}] socket error: {}", name, e.toString(), e);
        }
    }

    @Override
    public void onServerInfo(String message) {
        log.info("[{}] {}", name, message);
    }
}
