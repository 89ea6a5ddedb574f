package com.questrail.socket.api;

/**
 * Hook invoked once right after a server socket is bound, for low-level tuning
 * (buffer sizes and similar socket options). The core never depends on it.
 */
@FunctionalInterface
public interface ConnectionCustomizer
{
    void customize(BoundSocket socket);
}
