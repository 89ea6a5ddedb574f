package com.questrail.socket.client.udp;

import com.questrail.socket.api.NetworkProtocol;
import com.questrail.socket.api.SocketErrorException;
import com.questrail.socket.client.AbstractDatagramClient;
import com.questrail.socket.core.SocketAddresses;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.net.UnknownHostException;
import java.util.EnumSet;

/**
 * UDP client ({@code udp}, {@code udp4}, {@code udp6}).
 *
 * <p>Each connection binds an ephemeral port on the wildcard address of the
 * target's family. Replies are read from that port. TLS settings are accepted
 * and ignored.</p>
 */
public final class UdpClient extends AbstractDatagramClient
{
    public UdpClient(NetworkProtocol protocol, String address) throws SocketErrorException {
        super(protocol, EnumSet.of(NetworkProtocol.UDP, NetworkProtocol.UDP4, NetworkProtocol.UDP6),
                address, SocketAddresses::dialAddress);
    }

    @Override
    protected SocketAddress localBindAddress() {
        InetAddress remote = ((InetSocketAddress) target).getAddress();
        byte[] wildcard = remote instanceof Inet6Address ? new byte[16] : new byte[4];
        try {
            return new InetSocketAddress(InetAddress.getByAddress(wildcard), 0);
        } catch (UnknownHostException e) {
            // getByAddress only rejects illegal lengths
            throw new IllegalStateException(e);
        }
    }
}
