package com.questrail.socket.api;

/**
 * Receives plain-text server lifecycle messages (start/stop of the listening socket).
 */
@FunctionalInterface
public interface ServerInfoCallback
{
    void onServerInfo(String message);
}
