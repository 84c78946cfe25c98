package com.proton.amqp.exchange;

import static org.junit.jupiter.api.Assertions.*;

import com.proton.amqp.AmqpEndpoint;
import com.rabbitmq.client.AuthenticationFailureException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.UnknownHostException;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.Test;

class ConnectionDiagnosticsTest {

    private final AmqpEndpoint endpoint =
        new AmqpEndpoint("broker.local", 5672, "app", "orders", false);

    @Test
    void testAuthenticationFailureHint() {
        String hint = ConnectionDiagnostics.hint(endpoint,
            new AuthenticationFailureException("ACCESS_REFUSED - Login was refused"));

        assertTrue(hint.contains("Authentication failed for user 'app'"));
    }

    @Test
    void testConnectionRefusedHint() {
        String hint = ConnectionDiagnostics.hint(endpoint, new ConnectException("Connection refused"));

        assertTrue(hint.contains("broker.local:5672"));
    }

    @Test
    void testNestedCauseIsInspected() {
        IOException failure = new IOException("wrapped", new UnknownHostException("broker.local"));

        assertTrue(ConnectionDiagnostics.hint(endpoint, failure).contains("cannot be resolved"));
    }

    @Test
    void testTimeoutHint() {
        assertTrue(ConnectionDiagnostics.hint(endpoint, new TimeoutException())
            .contains("connectionTimeout"));
    }

    @Test
    void testNoHintForUnknownFailures() {
        assertNull(ConnectionDiagnostics.hint(endpoint, new IOException("something else")));
        assertDoesNotThrow(() -> ConnectionDiagnostics.report(endpoint, new IOException("something else")));
    }
}
