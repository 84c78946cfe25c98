package com.proton.amqp;

import com.rabbitmq.client.ConnectionFactory;

/**
 * Broker address a connection factory has been configured for, read back for log and diagnostic
 * messages. Holds no credentials beyond the user name.
 */
public class AmqpEndpoint {
    private final String hostname;
    private final int port;
    private final String username;
    private final String virtualHost;
    private final boolean secure;

    public AmqpEndpoint(String hostname, int port, String username, String virtualHost, boolean secure) {
        this.hostname = hostname;
        this.port = port;
        this.username = username;
        this.virtualHost = virtualHost;
        this.secure = secure;
    }

    /**
     * Read the address from a factory whose URI has been set with {@link ConnectionFactory#setUri(String)}.
     */
    public static AmqpEndpoint fromFactory(ConnectionFactory factory, boolean secure) {
        return new AmqpEndpoint(factory.getHost(), factory.getPort(), factory.getUsername(),
            factory.getVirtualHost(), secure);
    }

    public String getHostname() {
        return this.hostname;
    }

    public int getPort() {
        return this.port;
    }

    public String getUsername() {
        return this.username;
    }

    public String getVirtualHost() {
        return this.virtualHost;
    }

    public boolean isSecure() {
        return this.secure;
    }

    @Override
    public String toString() {
        return String.format("%s://%s@%s:%d%s", secure ? "amqps" : "amqp", username, hostname, port,
            virtualHost.startsWith("/") ? virtualHost : "/" + virtualHost);
    }
}
