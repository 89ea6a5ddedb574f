package com.questrail.socket.api;

import java.util.Locale;
import java.util.Optional;

/**
 * NetworkProtocol
 * =============================================================================
 * The closed set of transports this framework can open.
 *
 * <p>Each constant knows whether it is connection-oriented ({@link #isStream()})
 * and which family token the socket layer expects ({@link #code()}). The
 * server and client factories reject anything that is not one of these
 * constants before a socket is touched.</p>
 *
 * <h2>Families</h2>
 * <ul>
 *   <li>{@code tcp}, {@code tcp4}, {@code tcp6}: stream over IP</li>
 *   <li>{@code udp}, {@code udp4}, {@code udp6}: datagram over IP</li>
 *   <li>{@code unix}: stream over a filesystem socket</li>
 *   <li>{@code unixgram}: datagram over a filesystem socket</li>
 * </ul>
 */
public enum NetworkProtocol
{
    TCP("tcp", true),
    TCP4("tcp4", true),
    TCP6("tcp6", true),
    UDP("udp", false),
    UDP4("udp4", false),
    UDP6("udp6", false),
    UNIX("unix", true),
    UNIX_GRAM("unixgram", false);

    private final String code;
    private final boolean stream;

    NetworkProtocol(String code, boolean stream) {
        this.code = code;
        this.stream = stream;
    }

    /**
     * @return {@code true} for connection-oriented transports (TCP, Unix stream)
     */
    public boolean isStream() {
        return stream;
    }

    /**
     * @return the network family token, e.g. {@code "tcp4"} or {@code "unixgram"}
     */
    public String code() {
        return code;
    }

    /**
     * @return {@code true} for filesystem-socket transports
     */
    public boolean isUnix() {
        return this == UNIX || this == UNIX_GRAM;
    }

    /**
     * @return {@code true} when the protocol only accepts IPv4 addresses
     */
    public boolean isIpv4Only() {
        return this == TCP4 || this == UDP4;
    }

    /**
     * @return {@code true} when the protocol only accepts IPv6 addresses
     */
    public boolean isIpv6Only() {
        return this == TCP6 || this == UDP6;
    }

    /**
     * Parse a family token.
     *
     * <p>Matching is case-insensitive; surrounding whitespace and a single pair
     * of surrounding quotes are ignored. Unknown or empty input yields
     * {@link Optional#empty()}.</p>
     */
    public static Optional<NetworkProtocol> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }

        String s = text.strip();
        if (s.length() >= 2 && (s.startsWith("\"") && s.endsWith("\"") || s.startsWith("'") && s.endsWith("'"))) {
            s = s.substring(1, s.length() - 1).strip();
        }
        s = s.toLowerCase(Locale.ROOT);

        for (NetworkProtocol p : values()) {
            if (p.code.equals(s)) {
                return Optional.of(p);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return code;
    }
}
