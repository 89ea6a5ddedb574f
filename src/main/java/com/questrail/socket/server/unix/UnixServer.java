package com.questrail.socket.server.unix;

import com.questrail.socket.api.ConnectionCustomizer;
import com.questrail.socket.api.ConnectionHandler;
import com.questrail.socket.api.NetworkProtocol;
import com.questrail.socket.api.SocketErrorException;
import com.questrail.socket.api.UnixSocketServer;
import com.questrail.socket.context.ExecutionContext;
import com.questrail.socket.server.AbstractStreamServer;
import com.questrail.socket.server.UnixSocketFile;
import com.questrail.socket.transport.ListeningEndpoint;

import java.io.IOException;
import java.net.SocketAddress;
import java.util.EnumSet;

/**
 * UnixServer
 * =============================================================================
 * Unix domain stream socket server.
 *
 * <p>The registered path is cleared of a stale socket file before binding;
 * after binding the socket file gets the registered mode (default
 * {@code 0770}) and group, and it is deleted when {@code listen} returns.
 * TLS settings are accepted and ignored.</p>
 */
public final class UnixServer extends AbstractStreamServer implements UnixSocketServer
{
    private volatile UnixSocketFile socketFile;
    private volatile UnixSocketFile boundFile;

    public UnixServer(ConnectionCustomizer customizer, ConnectionHandler handler,
                      NetworkProtocol protocol, int readBufferSize) throws SocketErrorException {
        super(customizer, handler, protocol, readBufferSize, EnumSet.of(NetworkProtocol.UNIX));
    }

    @Override
    protected SocketAddress parseAddress(String address) throws SocketErrorException {
        return register(UnixSocketFile.of(address, DEFAULT_PERMISSION));
    }

    @Override
    public void registerSocket(String path, int permission) throws SocketErrorException {
        registerAddress(register(UnixSocketFile.of(path, permission)));
    }

    @Override
    public void registerSocket(String path, int permission, int groupId) throws SocketErrorException {
        registerAddress(register(UnixSocketFile.of(path, permission, groupId)));
    }

    private SocketAddress register(UnixSocketFile file) {
        socketFile = file;
        return file.address();
    }

    @Override
    protected ListeningEndpoint open(SocketAddress local, ExecutionContext run) throws IOException {
        UnixSocketFile file = socketFile;
        file.removeStale();

        ListeningEndpoint endpoint = super.open(local, run);
        boundFile = file;
        try {
            file.applyAttributes();
        } catch (IOException | RuntimeException e) {
            endpoint.close();
            throw e;
        }
        return endpoint;
    }

    @Override
    protected void released() {
        super.released();
        // only a file this server bound; a failed bind leaves the path alone
        UnixSocketFile file = boundFile;
        boundFile = null;
        if (file != null) {
            file.delete();
        }
    }
}
