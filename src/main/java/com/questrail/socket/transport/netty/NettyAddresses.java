package com.questrail.socket.transport.netty;

import io.netty.channel.unix.DomainSocketAddress;

import java.net.SocketAddress;
import java.net.UnixDomainSocketAddress;

/**
 * Conversion between JDK and Netty address types, so that
 * {@link DomainSocketAddress} never leaves this package.
 */
final class NettyAddresses
{
    private NettyAddresses() {
    }

    static SocketAddress toNetty(SocketAddress address) {
        if (address instanceof UnixDomainSocketAddress) {
            return new DomainSocketAddress(((UnixDomainSocketAddress) address).getPath().toString());
        }
        return address;
    }

    /**
     * @return the JDK equivalent; {@code null} for {@code null} or an unnamed
     *         (unbound) Unix socket
     */
    static SocketAddress toJdk(SocketAddress address) {
        if (address instanceof DomainSocketAddress) {
            String path = ((DomainSocketAddress) address).path();
            if (path == null || path.isEmpty()) {
                return null;
            }
            return UnixDomainSocketAddress.of(path);
        }
        return address;
    }
}
