package com.proton.amqp;

import com.rabbitmq.client.ConnectionFactory;
import java.util.Objects;
import javax.net.ssl.SSLContext;

/**
 * Connection-level socket settings applied to a {@link ConnectionFactory} before the connection
 * is opened. Values left unset keep the client's defaults, or the values given as query
 * parameters of the broker URL.
 *
 * <p>Two instances with the same settings are equal; an explicit {@link SSLContext} compares by
 * identity.
 */
public class SocketOptions {
    private Integer connectionTimeout;
    private Integer handshakeTimeout;
    private Integer requestedHeartbeat;
    private Boolean noDelay;
    private Boolean keepAlive;
    private SSLContext sslContext;
    private boolean trustAllCertificates = false;

    public static SocketOptions socketOptions() {
        return new SocketOptions();
    }

    /** TCP connect timeout in milliseconds. */
    public SocketOptions connectionTimeout(int connectionTimeout) {
        this.connectionTimeout = requireNonNegative("connectionTimeout", connectionTimeout);
        return this;
    }

    /** AMQP handshake timeout in milliseconds. */
    public SocketOptions handshakeTimeout(int handshakeTimeout) {
        this.handshakeTimeout = requireNonNegative("handshakeTimeout", handshakeTimeout);
        return this;
    }

    /** Requested heartbeat in seconds, 0 disables heartbeats. */
    public SocketOptions requestedHeartbeat(int requestedHeartbeat) {
        this.requestedHeartbeat = requireNonNegative("requestedHeartbeat", requestedHeartbeat);
        return this;
    }

    public SocketOptions noDelay(boolean noDelay) {
        this.noDelay = noDelay;
        return this;
    }

    public SocketOptions keepAlive(boolean keepAlive) {
        this.keepAlive = keepAlive;
        return this;
    }

    /** TLS context used for {@code amqps://} endpoints. Takes precedence over trust-all. */
    public SocketOptions sslContext(SSLContext sslContext) {
        this.sslContext = sslContext;
        return this;
    }

    /** Skip certificate validation on {@code amqps://} endpoints. */
    public SocketOptions trustAllCertificates(boolean trustAllCertificates) {
        this.trustAllCertificates = trustAllCertificates;
        return this;
    }

    public Integer getConnectionTimeout() {
        return connectionTimeout;
    }

    public Integer getHandshakeTimeout() {
        return handshakeTimeout;
    }

    public Integer getRequestedHeartbeat() {
        return requestedHeartbeat;
    }

    public Boolean getNoDelay() {
        return noDelay;
    }

    public Boolean getKeepAlive() {
        return keepAlive;
    }

    public SSLContext getSslContext() {
        return sslContext;
    }

    public boolean isTrustAllCertificates() {
        return trustAllCertificates;
    }

    /**
     * Apply the timeouts, heartbeat and socket flags. TLS is configured separately since it
     * depends on the endpoint scheme.
     */
    public void applyTo(ConnectionFactory factory) {
        if (connectionTimeout != null) {
            factory.setConnectionTimeout(connectionTimeout);
        }
        if (handshakeTimeout != null) {
            factory.setHandshakeTimeout(handshakeTimeout);
        }
        if (requestedHeartbeat != null) {
            factory.setRequestedHeartbeat(requestedHeartbeat);
        }
        if (noDelay != null || keepAlive != null) {
            final Boolean tcpNoDelay = noDelay;
            final Boolean tcpKeepAlive = keepAlive;
            factory.setSocketConfigurator(socket -> {
                // client default is TCP_NODELAY on
                socket.setTcpNoDelay(tcpNoDelay == null || tcpNoDelay);
                if (tcpKeepAlive != null) {
                    socket.setKeepAlive(tcpKeepAlive);
                }
            });
        }
    }

    /** An independent snapshot of these settings. */
    public SocketOptions copy() {
        SocketOptions copy = new SocketOptions();
        copy.connectionTimeout = connectionTimeout;
        copy.handshakeTimeout = handshakeTimeout;
        copy.requestedHeartbeat = requestedHeartbeat;
        copy.noDelay = noDelay;
        copy.keepAlive = keepAlive;
        copy.sslContext = sslContext;
        copy.trustAllCertificates = trustAllCertificates;
        return copy;
    }

    private static int requireNonNegative(String name, int value) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must not be negative: " + value);
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SocketOptions)) {
            return false;
        }
        SocketOptions that = (SocketOptions) o;
        return trustAllCertificates == that.trustAllCertificates
            && Objects.equals(connectionTimeout, that.connectionTimeout)
            && Objects.equals(handshakeTimeout, that.handshakeTimeout)
            && Objects.equals(requestedHeartbeat, that.requestedHeartbeat)
            && Objects.equals(noDelay, that.noDelay)
            && Objects.equals(keepAlive, that.keepAlive)
            && sslContext == that.sslContext;
    }

    @Override
    public int hashCode() {
        return Objects.hash(connectionTimeout, handshakeTimeout, requestedHeartbeat, noDelay, keepAlive,
            System.identityHashCode(sslContext), trustAllCertificates);
    }

    @Override
    public String toString() {
        return String.format(
            "SocketOptions{connectionTimeout=%s, handshakeTimeout=%s, requestedHeartbeat=%s, noDelay=%s, keepAlive=%s, tls=%s}",
            connectionTimeout, handshakeTimeout, requestedHeartbeat, noDelay, keepAlive,
            sslContext != null ? "custom" : trustAllCertificates ? "trust-all" : "default");
    }
}
