package com.questrail.socket.core;

import java.nio.channels.ClosedChannelException;

/**
 * Classification of errors that are an expected consequence of closing a socket.
 */
public final class SocketErrors
{
    static final String CLOSED_CONNECTION_MESSAGE = "use of closed network connection";

    private SocketErrors() {
    }

    /**
     * @return {@code null} when {@code error} only reports that the socket was
     *         already closed, otherwise {@code error} unchanged
     */
    public static Throwable filter(Throwable error) {
        if (error == null || isClosedConnection(error)) {
            return null;
        }
        return error;
    }

    public static boolean isClosedConnection(Throwable error) {
        if (error instanceof ClosedChannelException) {
            return true;
        }
        return error != null && CLOSED_CONNECTION_MESSAGE.equals(error.getMessage());
    }
}
