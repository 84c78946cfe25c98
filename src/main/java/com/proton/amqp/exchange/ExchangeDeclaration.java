package com.proton.amqp.exchange;

import com.proton.amqp.SocketOptions;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import java.util.concurrent.CompletableFuture;

/**
 * Class-level declaration of an exchange: everything {@link ExchangeBootstrap} needs before the
 * {@link AmqpExchange} instance exists.
 *
 * <p>Implementations usually live next to their exchange subclass:
 *
 * <pre>{@code
 * public class Orders extends AmqpExchange {
 *     public static final ExchangeDeclaration<Orders> DECLARATION = new ExchangeDeclaration<>() {
 *         public String name() { return "Orders"; }
 *         public String url() { return System.getenv("CLOUDAMQP_URL"); }
 *         public ExchangeType type() { return ExchangeType.TOPIC; }
 *         public Orders newExchange(Channel channel, String name) { return new Orders(channel, name); }
 *     };
 *
 *     Orders(Channel channel, String name) { super(channel, name); }
 * }
 * }</pre>
 *
 * @param <E> the exchange subclass this declaration builds
 */
public interface ExchangeDeclaration<E extends AmqpExchange> {

    /**
     * @return the exchange name
     */
    String name();

    /**
     * @return the URL of the AMQP server, {@code amqp://} or {@code amqps://}, optionally with
     *     query parameters such as {@code heartbeat} or {@code connection_timeout}
     */
    String url();

    /**
     * @return the exchange type
     */
    ExchangeType type();

    /**
     * Socket settings for the connection. {@code null} keeps the client defaults.
     */
    default SocketOptions socketOptions() {
        return null;
    }

    /**
     * Options for asserting the exchange. {@code null} means {@link ExchangeOptions#defaults()}.
     */
    default ExchangeOptions options() {
        return null;
    }

    /**
     * Invoked before the channel for this exchange is created. The bootstrap waits for the
     * returned future before creating the channel.
     *
     * <p>WARNING: the connection is shared by every channel opened for the same URL and socket
     * options, so anything registered on it affects all of them.
     */
    default CompletableFuture<Void> beforeCreateChannel(Connection connection) {
        return CompletableFuture.completedFuture(null);
    }

    /**
     * Build the exchange instance on the freshly created channel.
     */
    E newExchange(Channel channel, String name);
}
