package com.questrail.socket.client;

import com.questrail.socket.api.ConnectionContext;
import com.questrail.socket.api.NetworkProtocol;
import com.questrail.socket.api.SocketErrorException;
import com.questrail.socket.context.ExecutionContext;
import com.questrail.socket.transport.DatagramEndpoint;
import com.questrail.socket.transport.netty.NettyTransports;

import java.io.IOException;
import java.net.SocketAddress;
import java.util.Set;

/**
 * Client for connectionless transports.
 *
 * <p>Connecting binds a local endpoint and records the target as the default
 * destination. Nothing is sent, so connecting succeeds whether or not anyone
 * listens at the target.</p>
 */
public abstract class AbstractDatagramClient extends AbstractSocketClient
{
    protected AbstractDatagramClient(NetworkProtocol protocol, Set<NetworkProtocol> accepted,
                                     String address, AddressParser parser) throws SocketErrorException {
        super(protocol, accepted, address, parser);
    }

    /**
     * Local address to bind for one connection.
     */
    protected abstract SocketAddress localBindAddress() throws IOException;

    /**
     * Release whatever {@link #localBindAddress()} allocated. Runs once the endpoint is closed.
     */
    protected void releaseLocal(SocketAddress local) {
    }

    @Override
    protected ConnectionContext dial(ExecutionContext ctx) throws IOException {
        SocketAddress local = localBindAddress();
        DatagramEndpoint endpoint;
        try {
            endpoint = NettyTransports.bindDatagram(protocol, local, readBufferSize);
        } catch (IOException | RuntimeException e) {
            releaseLocal(local);
            throw e;
        }
        return new DatagramClientConnection(endpoint, target, ExecutionContext.background().child(),
                () -> releaseLocal(local));
    }
}
