package com.questrail.socket.api;

/**
 * Error codes carried by {@link SocketErrorException}.
 */
public enum SocketError
{
    /** Empty or unparsable address, or no address registered before listening. */
    INVALID_ADDRESS("invalid address"),

    /** A server was asked to listen without a handler. */
    INVALID_HANDLER("invalid handler"),

    /** Unknown protocol, or a protocol the host cannot open. */
    INVALID_PROTOCOL("invalid protocol"),

    /** Unix socket group id outside {@code [0, 32767]}. */
    INVALID_GROUP("invalid unix group id"),

    /** TLS requested without a usable configuration, or on a transport that cannot carry it. */
    INVALID_TLS_CONFIG("invalid tls config"),

    /** Client I/O attempted while not connected, or closing a client that is not connected. */
    CONNECTION("invalid connection"),

    /** The server did not drain within the shutdown bound. */
    SHUTDOWN_TIMEOUT("timeout on stopping socket"),

    /** {@code listen} called on a server that is already running. */
    ALREADY_RUNNING("server already running");

    private final String message;

    SocketError(String message) {
        this.message = message;
    }

    public String message() {
        return message;
    }
}
