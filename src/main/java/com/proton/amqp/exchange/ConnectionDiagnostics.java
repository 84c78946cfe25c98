package com.proton.amqp.exchange;

import com.proton.amqp.AmqpEndpoint;
import com.rabbitmq.client.AuthenticationFailureException;
import com.rabbitmq.client.ShutdownSignalException;
import java.net.ConnectException;
import java.net.UnknownHostException;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Logs a hint explaining common connection failures. Never alters the failure itself. */
final class ConnectionDiagnostics {

  private static final Logger logger = LoggerFactory.getLogger(ConnectionDiagnostics.class);

  private ConnectionDiagnostics() {}

  static void report(AmqpEndpoint endpoint, Exception failure) {
    logger.error("AMQP connection to {} failed: {}", endpoint, failure.getMessage());
    String hint = hint(endpoint, failure);
    if (hint != null) {
      logger.info(hint);
    }
  }

  /** @return a human readable hint for {@code failure}, or null when there is none */
  static String hint(AmqpEndpoint endpoint, Exception failure) {
    Throwable cause = failure;
    while (cause != null) {
      if (cause instanceof AuthenticationFailureException) {
        return "Authentication failed for user '"
            + endpoint.getUsername()
            + "'. Check username/password or create the user with: rabbitmqctl add_user "
            + endpoint.getUsername()
            + " <password>";
      }
      if (cause instanceof ShutdownSignalException) {
        String reason = String.valueOf(((ShutdownSignalException) cause).getReason());
        if (reason.contains("vhost") && reason.contains("not found")) {
          return "Virtual host '"
              + endpoint.getVirtualHost()
              + "' does not exist. Create it with: rabbitmqctl add_vhost "
              + endpoint.getVirtualHost();
        }
        if (reason.contains("ACCESS_REFUSED") || reason.contains("access to vhost")) {
          return "Access refused for user '"
              + endpoint.getUsername()
              + "'. Grant permissions with: rabbitmqctl set_permissions -p "
              + endpoint.getVirtualHost()
              + " "
              + endpoint.getUsername()
              + " \".*\" \".*\" \".*\"";
        }
      }
      if (cause instanceof ConnectException) {
        return "Nothing is listening on "
            + endpoint.getHostname()
            + ":"
            + endpoint.getPort()
            + ". Check that the broker is running and the port is correct";
      }
      if (cause instanceof UnknownHostException) {
        return "Host '" + endpoint.getHostname() + "' cannot be resolved";
      }
      if (cause instanceof TimeoutException) {
        return "Timed out connecting to "
            + endpoint.getHostname()
            + ":"
            + endpoint.getPort()
            + ". Consider raising SocketOptions.connectionTimeout";
      }
      cause = cause.getCause();
    }
    return null;
  }
}
