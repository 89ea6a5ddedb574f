package com.questrail.socket.server.unixgram;

import com.questrail.socket.api.ConnectionCustomizer;
import com.questrail.socket.api.ConnectionHandler;
import com.questrail.socket.api.NetworkProtocol;
import com.questrail.socket.api.SocketErrorException;
import com.questrail.socket.api.UnixSocketServer;
import com.questrail.socket.context.ExecutionContext;
import com.questrail.socket.server.AbstractDatagramServer;
import com.questrail.socket.server.UnixSocketFile;
import com.questrail.socket.transport.DatagramEndpoint;

import java.io.IOException;
import java.net.SocketAddress;
import java.util.EnumSet;

/**
 * Unix domain datagram socket server.
 *
 * <p>Socket file handling is the same as for {@code UnixServer}. Replies can
 * only reach peers that bound their own socket path; a datagram from an
 * unbound peer leaves the handler with no address to write to.</p>
 */
public final class UnixgramServer extends AbstractDatagramServer implements UnixSocketServer
{
    private volatile UnixSocketFile socketFile;
    private volatile UnixSocketFile boundFile;

    public UnixgramServer(ConnectionCustomizer customizer, ConnectionHandler handler,
                      NetworkProtocol protocol, int readBufferSize) throws SocketErrorException {
        super(customizer, handler, protocol, readBufferSize, EnumSet.of(NetworkProtocol.UNIX_GRAM));
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
    protected DatagramEndpoint open(SocketAddress local, ExecutionContext run) throws IOException {
        UnixSocketFile file = socketFile;
        file.removeStale();

        DatagramEndpoint endpoint = super.open(local, run);
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
