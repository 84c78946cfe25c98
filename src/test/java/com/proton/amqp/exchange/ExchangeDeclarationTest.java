package com.proton.amqp.exchange;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

import com.proton.amqp.SocketOptions;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.Test;

class ExchangeDeclarationTest {

    static class Minimal implements ExchangeDeclaration<AmqpExchange> {
        @Override
        public String name() {
            return "Minimal";
        }

        @Override
        public String url() {
            return "amqp://localhost";
        }

        @Override
        public ExchangeType type() {
            return ExchangeType.DIRECT;
        }

        @Override
        public AmqpExchange newExchange(Channel channel, String name) {
            throw new UnsupportedOperationException();
        }
    }

    @Test
    void testRequiredMembersReturnOverriddenValues() {
        Minimal declaration = new Minimal();

        assertEquals("Minimal", declaration.name());
        assertEquals("amqp://localhost", declaration.url());
        assertEquals(ExchangeType.DIRECT, declaration.type());
    }

    @Test
    void testOptionalMembersDefaultToNone() {
        Minimal declaration = new Minimal();

        assertNull(declaration.socketOptions());
        assertNull(declaration.options());
    }

    @Test
    void testBeforeCreateChannelDefaultsToCompletedNoOp() {
        Connection connection = mock(Connection.class);

        CompletableFuture<Void> setup = new Minimal().beforeCreateChannel(connection);

        assertTrue(setup.isDone());
        assertFalse(setup.isCompletedExceptionally());
        verifyNoInteractions(connection);
    }

    @Test
    void testOptionalMembersReturnOverriddenValues() {
        SocketOptions socketOptions = SocketOptions.socketOptions().connectionTimeout(1000);
        ExchangeOptions options = ExchangeOptions.defaults().durable(false);
        Minimal declaration = new Minimal() {
            @Override
            public SocketOptions socketOptions() {
                return socketOptions;
            }

            @Override
            public ExchangeOptions options() {
                return options;
            }
        };

        assertSame(socketOptions, declaration.socketOptions());
        assertSame(options, declaration.options());
    }
}
