package com.questrail.socket.api;

/**
 * A {@link SocketServer} bound to a filesystem socket.
 */
public interface UnixSocketServer extends SocketServer
{
    /** Highest group id accepted by {@link #registerSocket(String, int, int)}. */
    int MAX_GID = 32767;

    /** Mode applied to the socket file when none is given. */
    int DEFAULT_PERMISSION = 0770;

    /**
     * Register the socket path and the permission bits applied to the socket
     * file after binding. Bits above {@code 0777} are capped.
     */
    void registerSocket(String path, int permission) throws SocketErrorException;

    /**
     * As {@link #registerSocket(String, int)}, also changing the owning group.
     *
     * @throws SocketErrorException {@link SocketError#INVALID_GROUP} when
     *         {@code groupId} is outside {@code [0, MAX_GID]}
     */
    void registerSocket(String path, int permission, int groupId) throws SocketErrorException;
}
