package com.proton.amqp.exchange;

import com.proton.amqp.AmqpEndpoint;
import com.proton.amqp.SocketOptions;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import java.io.IOException;
import java.net.URISyntaxException;
import java.security.KeyManagementException;
import java.security.NoSuchAlgorithmException;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import javax.net.ssl.SSLContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns {@link ExchangeDeclaration}s into live {@link AmqpExchange}s: connect, run the
 * pre-channel setup, create the channel, assert the exchange, build the instance and apply its
 * bindings.
 *
 * <p>One connection is opened per broker URL and socket options, and shared by every exchange
 * declared with the same pair. A declaration whose socket options differ from an open
 * connection's gets a connection of its own. Closing the bootstrap closes those connections, and
 * with them every channel created here.
 */
public class ExchangeBootstrap implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(ExchangeBootstrap.class);

  private final Supplier<ConnectionFactory> connectionFactorySupplier;
  private final Map<ConnectionKey, Connection> connections = new ConcurrentHashMap<>();
  private volatile boolean closed = false;

  public ExchangeBootstrap() {
    this(ConnectionFactory::new);
  }

  public ExchangeBootstrap(Supplier<ConnectionFactory> connectionFactorySupplier) {
    this.connectionFactorySupplier = connectionFactorySupplier;
  }

  /**
   * Declare an exchange and return its instance.
   *
   * @throws ExchangeException.MissingDeclarationException if name, url or type is missing
   * @throws ExchangeException.InvalidEndpointException if the url cannot be parsed or TLS cannot
   *     be set up
   * @throws ExchangeException.SetupFailedException if {@code beforeCreateChannel} fails
   * @throws IOException as thrown by the client, unchanged
   * @throws TimeoutException as thrown by the client, unchanged
   */
  public <E extends AmqpExchange> E declare(ExchangeDeclaration<E> declaration)
      throws IOException, TimeoutException, ExchangeException {
    if (closed) {
      throw new IllegalStateException("Bootstrap has been closed");
    }

    String declarationName = declaration.getClass().getName();
    String name = declaration.name();
    if (name == null || name.isBlank()) {
      throw new ExchangeException.MissingDeclarationException(declarationName, "name");
    }
    String url = declaration.url();
    if (url == null || url.isBlank()) {
      throw new ExchangeException.MissingDeclarationException(declarationName, "url");
    }
    ExchangeType type = declaration.type();
    if (type == null) {
      throw new ExchangeException.MissingDeclarationException(declarationName, "type");
    }

    Connection connection = connect(name, url.trim(), declaration.socketOptions());
    awaitSetup(name, declaration.beforeCreateChannel(connection));

    Channel channel = connection.createChannel();
    if (channel == null) {
      throw new IOException("No channel available on connection " + connection);
    }

    ExchangeOptions options = declaration.options();
    if (options == null) {
      options = ExchangeOptions.defaults();
    }
    channel.exchangeDeclare(
        name,
        type.getBuiltinType(),
        options.isDurable(),
        options.isAutoDelete(),
        options.isInternal(),
        options.toArguments());
    logger.info("Exchange {} declared as {} with {}", name, type, options);

    E exchange = declaration.newExchange(channel, name);
    exchange.attachListeners();
    applyBindings(exchange);
    return exchange;
  }

  /** Number of connections currently held. */
  public int connectionCount() {
    return connections.size();
  }

  public boolean isClosed() {
    return closed;
  }

  private synchronized Connection connect(
      String exchangeName, String url, SocketOptions socketOptions)
      throws IOException, TimeoutException, ExchangeException {
    ConnectionKey key = new ConnectionKey(url, socketOptions);
    Connection existing = connections.get(key);
    if (existing != null && existing.isOpen()) {
      logger.debug("Reusing connection {} for exchange {}", existing, exchangeName);
      return existing;
    }

    ConnectionFactory factory = connectionFactorySupplier.get();
    boolean secure = url.regionMatches(true, 0, "amqps:", 0, 6);
    configure(factory, exchangeName, url, secure, key.socketOptions);
    AmqpEndpoint endpoint = AmqpEndpoint.fromFactory(factory, secure);

    try {
      Connection connection = factory.newConnection(exchangeName);
      connections.put(key, connection);
      logger.info("Established connection to {} for exchange {}", endpoint, exchangeName);
      return connection;
    } catch (IOException | TimeoutException e) {
      ConnectionDiagnostics.report(endpoint, e);
      throw e;
    }
  }

  /**
   * URL first, including its query parameters, then the socket options on top, then TLS for
   * {@code amqps}: explicit context, trust-all, or the JVM default with hostname verification.
   */
  private static void configure(
      ConnectionFactory factory,
      String exchangeName,
      String url,
      boolean secure,
      SocketOptions socketOptions)
      throws ExchangeException {
    try {
      factory.setUri(url);
      socketOptions.applyTo(factory);
      if (secure) {
        if (socketOptions.getSslContext() != null) {
          factory.useSslProtocol(socketOptions.getSslContext());
        } else if (socketOptions.isTrustAllCertificates()) {
          factory.useSslProtocol();
        } else {
          factory.useSslProtocol(SSLContext.getDefault());
          factory.enableHostnameVerification();
        }
      }
    } catch (URISyntaxException | IllegalArgumentException e) {
      throw new ExchangeException.InvalidEndpointException(
          "Invalid broker URL for exchange " + exchangeName + ": " + e.getMessage(), e);
    } catch (NoSuchAlgorithmException | KeyManagementException e) {
      throw new ExchangeException.InvalidEndpointException(
          "Cannot set up TLS for exchange " + exchangeName + ": " + e.getMessage(), e);
    }
  }

  private void awaitSetup(String exchangeName, CompletableFuture<Void> setup)
      throws IOException, ExchangeException {
    if (setup == null) {
      return;
    }
    try {
      setup.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ExchangeException.SetupFailedException(exchangeName, e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof IOException) {
        throw (IOException) cause;
      }
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      throw new ExchangeException.SetupFailedException(exchangeName, cause);
    }
  }

  private void applyBindings(AmqpExchange exchange) throws IOException {
    Channel channel = exchange.channel();
    for (ExchangeBinding binding : exchange.bindings()) {
      switch (binding.getTo()) {
        case QUEUE:
          channel.queueBind(
              binding.getSource(), exchange.name(), binding.getRoutingKey(), binding.getArgs());
          break;
        case EXCHANGE:
          channel.exchangeBind(
              exchange.name(), binding.getSource(), binding.getRoutingKey(), binding.getArgs());
          break;
        default:
          throw new IllegalStateException("Unknown binding target: " + binding.getTo());
      }
      logger.debug("Applied {} to exchange {}", binding, exchange.name());
    }
  }

  @Override
  public void close() {
    closed = true;
    logger.debug("Closing {} connection(s)", connections.size());
    for (Connection connection : connections.values()) {
      try {
        if (connection.isOpen()) {
          connection.close();
        }
      } catch (Exception e) {
        logger.warn("Error closing connection", e);
      }
    }
    connections.clear();
  }

  /** Broker URL plus a snapshot of the socket options the connection was opened with. */
  private static final class ConnectionKey {
    private final String url;
    private final SocketOptions socketOptions;

    ConnectionKey(String url, SocketOptions socketOptions) {
      this.url = url;
      this.socketOptions =
          socketOptions != null ? socketOptions.copy() : SocketOptions.socketOptions();
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof ConnectionKey)) {
        return false;
      }
      ConnectionKey that = (ConnectionKey) o;
      return url.equals(that.url) && socketOptions.equals(that.socketOptions);
    }

    @Override
    public int hashCode() {
      return Objects.hash(url, socketOptions);
    }
  }
}
