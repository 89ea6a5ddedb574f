package com.questrail.socket.client.unix;

import com.questrail.socket.api.NetworkProtocol;
import com.questrail.socket.api.SocketErrorException;
import com.questrail.socket.client.AbstractStreamClient;
import com.questrail.socket.core.SocketAddresses;

import java.net.UnixDomainSocketAddress;
import java.util.EnumSet;

/**
 * Unix domain stream socket client. The address is the socket file path.
 * TLS settings are accepted and ignored.
 */
public final class UnixClient extends AbstractStreamClient
{
    public UnixClient(NetworkProtocol protocol, String path) throws SocketErrorException {
        super(protocol, EnumSet.of(NetworkProtocol.UNIX), path,
                (address, p) -> UnixDomainSocketAddress.of(SocketAddresses.unixPath(address)));
    }
}
