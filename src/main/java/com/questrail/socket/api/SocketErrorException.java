package com.questrail.socket.api;

import java.io.IOException;
import java.util.Objects;

/**
 * Raised for the framework's own error conditions (configuration, state, and
 * shutdown errors).
 *
 * <p>Operating-system failures (bind, dial, read, write) are never wrapped in
 * this type; they surface as the {@link IOException} the socket layer reported.</p>
 */
public final class SocketErrorException extends IOException
{
    private final SocketError error;

    public SocketErrorException(SocketError error) {
        super(Objects.requireNonNull(error, "error").message());
        this.error = error;
    }

    public SocketErrorException(SocketError error, String detail) {
        super(Objects.requireNonNull(error, "error").message() + ": " + detail);
        this.error = error;
    }

    public SocketErrorException(SocketError error, String detail, Throwable cause) {
        super(Objects.requireNonNull(error, "error").message() + ": " + detail, cause);
        this.error = error;
    }

    public SocketError error() {
        return error;
    }
}
