package com.questrail.socket.client;

import com.questrail.socket.api.ConnectionContext;
import com.questrail.socket.api.NetworkProtocol;
import com.questrail.socket.api.SocketErrorException;
import com.questrail.socket.context.ExecutionContext;
import com.questrail.socket.transport.StreamOptions;
import com.questrail.socket.transport.netty.NettyTransports;

import java.io.IOException;
import java.util.Set;

/**
 * Client for connection-oriented transports. Connecting establishes a real
 * connection and fails if nobody accepts it, or when {@code ctx} is cancelled
 * or its deadline passes first.
 */
public abstract class AbstractStreamClient extends AbstractSocketClient
{
    protected AbstractStreamClient(NetworkProtocol protocol, Set<NetworkProtocol> accepted,
                                   String address, AddressParser parser) throws SocketErrorException {
        super(protocol, accepted, address, parser);
    }

    protected StreamOptions streamOptions() {
        return StreamOptions.plain(readBufferSize);
    }

    @Override
    protected ConnectionContext dial(ExecutionContext ctx) throws IOException {
        return NettyTransports.stream(protocol, streamOptions()).dial(target, ctx, callbacks::error);
    }
}
