package com.questrail.socket.transport;

import java.net.SocketAddress;

/**
 * One received datagram: the sender and the exact payload.
 *
 * @param sender  origin of the datagram; {@code null} for an unbound Unix datagram peer
 * @param payload datagram bytes, owned by the receiver
 */
public record Datagram(SocketAddress sender, byte[] payload) {
}
