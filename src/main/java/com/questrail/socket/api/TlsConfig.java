package com.questrail.socket.api;

import javax.net.ssl.SNIHostName;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.SSLParameters;
import java.util.List;
import java.util.Objects;

/**
 * Opaque transport-security configuration.
 *
 * <p>Certificate loading and trust decisions are made by whoever builds the
 * {@link SSLContext}; this type only carries it, together with a few
 * connection-level switches, and produces engines for the transport.</p>
 */
public final class TlsConfig
{
    private final SSLContext sslContext;
    private final boolean hostnameVerification;
    private final boolean clientAuthRequired;
    private final List<String> protocols;
    private final List<String> cipherSuites;

    private TlsConfig(Builder b) {
        this.sslContext = Objects.requireNonNull(b.sslContext, "sslContext");
        this.hostnameVerification = b.hostnameVerification;
        this.clientAuthRequired = b.clientAuthRequired;
        this.protocols = List.copyOf(b.protocols);
        this.cipherSuites = List.copyOf(b.cipherSuites);
    }

    public static TlsConfig of(SSLContext sslContext) {
        return builder(sslContext).build();
    }

    public static Builder builder(SSLContext sslContext) {
        return new Builder(sslContext);
    }

    public SSLContext sslContext() {
        return sslContext;
    }

    public boolean hostnameVerification() {
        return hostnameVerification;
    }

    public boolean clientAuthRequired() {
        return clientAuthRequired;
    }

    /**
     * Create a client-mode engine for one connection.
     *
     * @param serverName name sent as SNI and, when hostname verification is on,
     *                   checked against the peer certificate; may be empty
     */
    public SSLEngine newClientEngine(String serverName, int port) {
        SSLEngine engine = (serverName == null || serverName.isEmpty())
                ? sslContext.createSSLEngine()
                : sslContext.createSSLEngine(serverName, port);
        engine.setUseClientMode(true);

        SSLParameters params = engine.getSSLParameters();
        if (serverName != null && !serverName.isEmpty()) {
            if (!Character.isDigit(serverName.charAt(0)) && !serverName.contains(":")) {
                params.setServerNames(List.of(new SNIHostName(serverName)));
            }
            if (hostnameVerification) {
                params.setEndpointIdentificationAlgorithm("HTTPS");
            }
        }
        applyRestrictions(params);
        engine.setSSLParameters(params);
        return engine;
    }

    /**
     * Create a server-mode engine for one accepted connection.
     */
    public SSLEngine newServerEngine() {
        SSLEngine engine = sslContext.createSSLEngine();
        engine.setUseClientMode(false);

        SSLParameters params = engine.getSSLParameters();
        params.setNeedClientAuth(clientAuthRequired);
        applyRestrictions(params);
        engine.setSSLParameters(params);
        return engine;
    }

    private void applyRestrictions(SSLParameters params) {
        if (!protocols.isEmpty()) {
            params.setProtocols(protocols.toArray(String[]::new));
        }
        if (!cipherSuites.isEmpty()) {
            params.setCipherSuites(cipherSuites.toArray(String[]::new));
        }
    }

    public static final class Builder {
        private final SSLContext sslContext;
        private boolean hostnameVerification = true;
        private boolean clientAuthRequired = false;
        private List<String> protocols = List.of();
        private List<String> cipherSuites = List.of();

        private Builder(SSLContext sslContext) {
            this.sslContext = sslContext;
        }

        public Builder withHostnameVerification(boolean enabled) {
            this.hostnameVerification = enabled;
            return this;
        }

        public Builder withClientAuthRequired(boolean required) {
            this.clientAuthRequired = required;
            return this;
        }

        public Builder withProtocols(List<String> protocols) {
            this.protocols = Objects.requireNonNull(protocols, "protocols");
            return this;
        }

        public Builder withCipherSuites(List<String> cipherSuites) {
            this.cipherSuites = Objects.requireNonNull(cipherSuites, "cipherSuites");
            return this;
        }

        public TlsConfig build() {
            return new TlsConfig(this);
        }
    }
}
