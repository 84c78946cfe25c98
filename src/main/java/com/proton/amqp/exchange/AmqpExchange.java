package com.proton.amqp.exchange;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Return;
import com.rabbitmq.client.ShutdownSignalException;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * Base class for application exchanges.
 *
 * <p>An instance wraps a channel on which the exchange has already been declared (see {@link
 * ExchangeBootstrap}). Every operation is forwarded to that channel and its result or exception is
 * returned unchanged. Subclasses override the hooks to react to channel events and {@link
 * #bindings()} to declare their bindings.
 *
 * <p>The channel is not owned by the exchange: it is only closed when {@link #closeChannel()} is
 * called.
 *
 * <p>Hooks fire only once {@link #attachListeners()} has run. {@link ExchangeBootstrap} does this
 * right after {@code newExchange}; code that constructs an exchange by hand calls it itself.
 */
public abstract class AmqpExchange {

  private final Channel channel;
  private final String name;
  private final ExchangeListeners listeners;

  /** No network I/O and no listener registration. */
  protected AmqpExchange(Channel channel, String name) {
    this.channel = Objects.requireNonNull(channel, "channel");
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Exchange name must not be empty");
    }
    this.name = name;
    this.listeners = new ExchangeListeners(this);
  }

  /** The underlying channel. */
  public final Channel channel() {
    return channel;
  }

  /** The exchange name. */
  public final String name() {
    return name;
  }

  public final ExchangeListeners listeners() {
    return listeners;
  }

  /**
   * Register the close, error, return and drain listeners on the channel and its connection.
   * Idempotent. On a channel that is already closed, {@link #onError} and {@link #onClose()} run
   * before this method returns.
   */
  public final void attachListeners() {
    listeners.attach();
  }

  /** Unregister the event listeners; the hooks stop firing afterwards. */
  public void detachListeners() {
    listeners.detach();
  }

  /**
   * Bindings to other exchanges or queues, applied in order by {@link ExchangeBootstrap}.
   *
   * @return empty by default
   */
  public List<ExchangeBinding> bindings() {
    return List.of();
  }

  /** Publish a message with no properties. */
  public void publish(byte[] content, String routingKey) throws IOException {
    channel.basicPublish(name, routingKey, false, null, content);
  }

  /** Publish a message. */
  public void publish(byte[] content, String routingKey, AMQP.BasicProperties properties)
      throws IOException {
    channel.basicPublish(name, routingKey, false, properties, content);
  }

  /**
   * Publish a message. With {@code mandatory} set, a message that cannot be routed comes back
   * through {@link #onReturn(Return)}.
   */
  public void publish(
      byte[] content, String routingKey, boolean mandatory, AMQP.BasicProperties properties)
      throws IOException {
    channel.basicPublish(name, routingKey, mandatory, properties, content);
  }

  /** Delete the exchange from the broker. */
  public AMQP.Exchange.DeleteOk destroy() throws IOException {
    return channel.exchangeDelete(name);
  }

  /**
   * Delete the exchange from the broker.
   *
   * @param ifUnused if true and the exchange has bindings, the broker refuses the deletion and
   *     closes the channel; the resulting IOException is thrown as is
   */
  public AMQP.Exchange.DeleteOk destroy(boolean ifUnused) throws IOException {
    return channel.exchangeDelete(name, ifUnused);
  }

  /** Remove the binding that routes messages from {@code exchangeName} to this exchange. */
  public AMQP.Exchange.UnbindOk unbindFrom(String exchangeName, String pattern)
      throws IOException {
    return channel.exchangeUnbind(name, exchangeName, pattern);
  }

  public AMQP.Exchange.UnbindOk unbindFrom(
      String exchangeName, String pattern, Map<String, Object> args) throws IOException {
    return channel.exchangeUnbind(name, exchangeName, pattern, args);
  }

  /**
   * Callback variant of {@link #unbindFrom(String, String, Map)}: the outcome goes to {@code
   * callback} instead of being returned or thrown.
   */
  public void unbindFrom(
      String exchangeName,
      String pattern,
      Map<String, Object> args,
      ChannelCallback<AMQP.Exchange.UnbindOk> callback) {
    Objects.requireNonNull(callback, "callback");
    AMQP.Exchange.UnbindOk result = null;
    Exception error = null;
    try {
      result = channel.exchangeUnbind(name, exchangeName, pattern, args);
    } catch (IOException | ShutdownSignalException e) {
      error = e;
    }
    callback.onComplete(result, error);
  }

  /** Close the channel. */
  public void closeChannel() throws IOException, TimeoutException {
    channel.close();
  }

  /** Callback variant of {@link #closeChannel()}. */
  public void closeChannel(ChannelCallback<Void> callback) {
    Objects.requireNonNull(callback, "callback");
    Exception error = null;
    try {
      channel.close();
    } catch (IOException | TimeoutException | ShutdownSignalException e) {
      error = e;
    }
    callback.onComplete(null, error);
  }

  /** Invoked when the channel has been closed, for any reason. */
  protected void onClose() {}

  /**
   * Invoked when the channel is closed by the broker or by a connection failure, before {@link
   * #onClose()}.
   */
  protected void onError(ShutdownSignalException error) {}

  /** Invoked when a mandatory message could not be routed. */
  protected void onReturn(Return message) {}

  /** Invoked when the broker accepts writes again after blocking the connection. */
  protected void onDrain() {}

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{name='" + name + "', channel=" + channel.getChannelNumber() + "}";
  }
}
