package com.questrail.socket.core;

import com.questrail.socket.api.NetworkProtocol;
import com.questrail.socket.api.SocketError;
import com.questrail.socket.api.SocketErrorException;

import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Address parsing shared by servers, clients and configuration validation.
 *
 * <p>IP addresses use the {@code host:port} form; IPv6 literals must be
 * bracketed ({@code [::1]:9000}). An empty host means the wildcard address when
 * binding and the loopback address when dialing. Unix addresses are filesystem
 * paths.</p>
 */
public final class SocketAddresses
{
    /** sun_path is 108 bytes including the terminating NUL on Linux. */
    static final int MAX_UNIX_PATH_BYTES = 107;

    private SocketAddresses() {
    }

    /**
     * Resolve an address for binding.
     */
    public static InetSocketAddress bindAddress(String address, NetworkProtocol protocol) throws SocketErrorException {
        return parseInet(address, protocol, true);
    }

    /**
     * Resolve an address for dialing.
     */
    public static InetSocketAddress dialAddress(String address, NetworkProtocol protocol) throws SocketErrorException {
        return parseInet(address, protocol, false);
    }

    private static InetSocketAddress parseInet(String address, NetworkProtocol protocol, boolean bind)
            throws SocketErrorException {
        if (address == null || address.isBlank()) {
            throw new SocketErrorException(SocketError.INVALID_ADDRESS, "empty address");
        }
        if (protocol.isUnix()) {
            throw new SocketErrorException(SocketError.INVALID_PROTOCOL, protocol + " is not an IP protocol");
        }

        String s = address.strip();
        String host;
        String port;

        if (s.startsWith("[")) {
            int end = s.indexOf(']');
            if (end < 0 || end + 1 >= s.length() || s.charAt(end + 1) != ':') {
                throw new SocketErrorException(SocketError.INVALID_ADDRESS, "malformed address '" + s + "'");
            }
            host = s.substring(1, end);
            port = s.substring(end + 2);
        } else {
            int colon = s.lastIndexOf(':');
            if (colon < 0 || s.indexOf(':') != colon) {
                throw new SocketErrorException(SocketError.INVALID_ADDRESS, "missing or ambiguous port in '" + s + "'");
            }
            host = s.substring(0, colon);
            port = s.substring(colon + 1);
        }

        int portNumber = parsePort(port, s);
        InetAddress ip = resolveHost(host, protocol, bind, s);
        return new InetSocketAddress(ip, portNumber);
    }

    private static int parsePort(String port, String address) throws SocketErrorException {
        try {
            int p = Integer.parseInt(port);
            if (p < 0 || p > 65535) {
                throw new SocketErrorException(SocketError.INVALID_ADDRESS, "port out of range in '" + address + "'");
            }
            return p;
        } catch (NumberFormatException e) {
            throw new SocketErrorException(SocketError.INVALID_ADDRESS, "invalid port in '" + address + "'", e);
        }
    }

    private static InetAddress resolveHost(String host, NetworkProtocol protocol, boolean bind, String address)
            throws SocketErrorException {
        try {
            if (host.isEmpty()) {
                if (protocol.isIpv4Only()) {
                    return bind ? InetAddress.getByName("0.0.0.0") : InetAddress.getByName("127.0.0.1");
                }
                if (protocol.isIpv6Only()) {
                    return bind ? InetAddress.getByName("::") : InetAddress.getByName("::1");
                }
                return bind ? new InetSocketAddress(0).getAddress() : InetAddress.getLoopbackAddress();
            }

            for (InetAddress candidate : InetAddress.getAllByName(host)) {
                if (matchesFamily(candidate, protocol)) {
                    return candidate;
                }
            }
            throw new SocketErrorException(SocketError.INVALID_ADDRESS,
                    "no " + protocol + " address for host '" + host + "' in '" + address + "'");
        } catch (UnknownHostException e) {
            throw new SocketErrorException(SocketError.INVALID_ADDRESS, "cannot resolve '" + address + "'", e);
        }
    }

    private static boolean matchesFamily(InetAddress ip, NetworkProtocol protocol) {
        if (protocol.isIpv4Only()) {
            return ip instanceof Inet4Address;
        }
        if (protocol.isIpv6Only()) {
            return ip instanceof Inet6Address;
        }
        return true;
    }

    /**
     * Validate a Unix socket path.
     */
    public static Path unixPath(String path) throws SocketErrorException {
        if (path == null || path.isBlank()) {
            throw new SocketErrorException(SocketError.INVALID_ADDRESS, "empty socket path");
        }
        String s = path.strip();
        if (s.getBytes(StandardCharsets.UTF_8).length > MAX_UNIX_PATH_BYTES) {
            throw new SocketErrorException(SocketError.INVALID_ADDRESS, "socket path too long: '" + s + "'");
        }
        try {
            return Path.of(s);
        } catch (InvalidPathException e) {
            throw new SocketErrorException(SocketError.INVALID_ADDRESS, "invalid socket path '" + s + "'", e);
        }
    }
}
