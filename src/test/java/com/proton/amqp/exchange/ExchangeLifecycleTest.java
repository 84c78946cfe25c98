package com.proton.amqp.exchange;

import static org.junit.jupiter.api.Assertions.*;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.ShutdownSignalException;
import com.rabbitmq.http.client.Client;
import com.rabbitmq.http.client.ClientParameters;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.RabbitMQContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

/**
 * Declares and deletes exchanges on a real broker. Skipped when Docker is not available.
 */
@Testcontainers(disabledWithoutDocker = true)
class ExchangeLifecycleTest {

    @Container
    private static final RabbitMQContainer rabbit =
        new RabbitMQContainer(DockerImageName.parse("rabbitmq:3.13-management-alpine"));

    private ExchangeBootstrap bootstrap;
    private Client httpClient;

    static class Foo extends AmqpExchange {
        final List<String> events = new CopyOnWriteArrayList<>();
        final CountDownLatch closed = new CountDownLatch(1);

        Foo(Channel channel, String name) {
            super(channel, name);
        }

        @Override
        protected void onClose() {
            events.add("close");
            closed.countDown();
        }

        @Override
        protected void onError(ShutdownSignalException error) {
            events.add("error");
        }
    }

    static class FooDeclaration implements ExchangeDeclaration<Foo> {
        final List<Connection> setupConnections = new ArrayList<>();
        private final String name;
        private final List<ExchangeBinding> bindings;

        FooDeclaration(String name, List<ExchangeBinding> bindings) {
            this.name = name;
            this.bindings = bindings;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public String url() {
            return amqpUrl();
        }

        @Override
        public ExchangeType type() {
            return ExchangeType.FANOUT;
        }

        @Override
        public CompletableFuture<Void> beforeCreateChannel(Connection connection) {
            setupConnections.add(connection);
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public Foo newExchange(Channel channel, String exchangeName) {
            return new Foo(channel, exchangeName) {
                @Override
                public List<ExchangeBinding> bindings() {
                    return bindings;
                }
            };
        }
    }

    private static String amqpUrl() {
        return String.format("amqp://%s:%s@%s:%d", rabbit.getAdminUsername(), rabbit.getAdminPassword(),
            rabbit.getHost(), rabbit.getAmqpPort());
    }

    @BeforeEach
    void setUp() throws Exception {
        bootstrap = new ExchangeBootstrap();
        httpClient = new Client(new ClientParameters()
            .url(rabbit.getHttpUrl() + "/api/")
            .username(rabbit.getAdminUsername())
            .password(rabbit.getAdminPassword()));
    }

    @AfterEach
    void tearDown() {
        bootstrap.close();
    }

    @Test
    void testDeclareAndDestroyExchangeWithoutBindings() throws Exception {
        FooDeclaration declaration = new FooDeclaration("Foo", List.of());

        Foo exchange = bootstrap.declare(declaration);

        assertEquals(1, declaration.setupConnections.size());
        assertNotNull(httpClient.getExchange("/", "Foo"));
        assertEquals("fanout", httpClient.getExchange("/", "Foo").getType());

        exchange.destroy();

        assertTrue(exchange.channel().isOpen());
        assertNull(httpClient.getExchange("/", "Foo"));
        assertTrue(exchange.events.isEmpty());

        exchange.closeChannel();
        assertTrue(exchange.closed.await(10, TimeUnit.SECONDS));
        assertFalse(exchange.channel().isOpen());
        assertEquals(List.of("close"), exchange.events);
    }

    @Test
    void testDestroyIfUnusedIsRefusedWhileBound() throws Exception {
        String queue = "lifecycle.audit";
        ConnectionFactory factory = new ConnectionFactory();
        factory.setUri(amqpUrl());
        try (Connection admin = factory.newConnection("lifecycle-admin");
             Channel adminChannel = admin.createChannel()) {
            adminChannel.queueDeclare(queue, false, false, true, null);

            Foo exchange = bootstrap.declare(
                new FooDeclaration("Bound", List.of(ExchangeBinding.queue(queue, ""))));
            assertFalse(httpClient.getQueueBindingsBetween("/", "Bound", queue).isEmpty());

            IOException refusal = assertThrows(IOException.class, () -> exchange.destroy(true));

            assertTrue(refusal.getCause() instanceof ShutdownSignalException);
            assertTrue(exchange.closed.await(10, TimeUnit.SECONDS));
            assertFalse(exchange.channel().isOpen());
            assertEquals(List.of("error", "close"), exchange.events);
            assertNotNull(httpClient.getExchange("/", "Bound"));

            adminChannel.exchangeDelete("Bound");
        }
    }
}
