package com.proton.amqp.exchange;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.BlockedListener;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.Return;
import com.rabbitmq.client.ReturnListener;
import com.rabbitmq.client.ShutdownListener;
import com.rabbitmq.client.ShutdownSignalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The channel and connection listeners that forward events to the hooks of one
 * {@link AmqpExchange}. One listener is registered per event source: shutdown (close and error),
 * basic.return, and connection unblocked (drain).
 *
 * <p>Nothing is registered until {@link #attach()} runs, which happens once the exchange is fully
 * constructed. A channel shutdown detaches everything, so the shared connection does not keep
 * listeners of dead exchanges.
 */
public final class ExchangeListeners {
  private static final Logger logger = LoggerFactory.getLogger(ExchangeListeners.class);

  private final AmqpExchange exchange;
  private final ShutdownListener shutdownListener;
  private final ReturnListener returnListener;
  private final BlockedListener blockedListener;
  private boolean attached = false;

  ExchangeListeners(AmqpExchange exchange) {
    this.exchange = exchange;
    this.shutdownListener = this::handleShutdown;
    this.returnListener = this::handleReturn;
    this.blockedListener =
        new BlockedListener() {
          @Override
          public void handleBlocked(String reason) {
            logger.warn("Connection of exchange {} blocked by the broker: {}", exchange.name(), reason);
          }

          @Override
          public void handleUnblocked() {
            if (!isAttached()) {
              return;
            }
            logger.debug("Connection of exchange {} unblocked", exchange.name());
            exchange.onDrain();
          }
        };
  }

  /**
   * Register the listeners on the channel and its connection. Idempotent.
   *
   * <p>The shutdown listener goes last: the client invokes it immediately when the channel is
   * already closed, and the resulting detach must see the other two registered.
   */
  synchronized void attach() {
    if (attached) {
      return;
    }
    Channel channel = exchange.channel();
    channel.getConnection().addBlockedListener(blockedListener);
    channel.addReturnListener(returnListener);
    attached = true;
    logger.debug("Listening for channel events of exchange {}", exchange.name());
    channel.addShutdownListener(shutdownListener);
  }

  /** Remove every listener registered by {@link #attach()}. Idempotent. */
  synchronized void detach() {
    if (!attached) {
      return;
    }
    Channel channel = exchange.channel();
    channel.removeShutdownListener(shutdownListener);
    channel.removeReturnListener(returnListener);
    Connection connection = channel.getConnection();
    connection.removeBlockedListener(blockedListener);
    attached = false;
    logger.debug("Stopped listening for channel events of exchange {}", exchange.name());
  }

  public synchronized boolean isAttached() {
    return attached;
  }

  public ShutdownListener getShutdownListener() {
    return shutdownListener;
  }

  public ReturnListener getReturnListener() {
    return returnListener;
  }

  public BlockedListener getBlockedListener() {
    return blockedListener;
  }

  private void handleShutdown(ShutdownSignalException cause) {
    try {
      if (!cause.isInitiatedByApplication()) {
        logger.debug("Channel of exchange {} closed with error: {}", exchange.name(), cause.getMessage());
        exchange.onError(cause);
      }
    } finally {
      logger.debug("Channel of exchange {} closed", exchange.name());
      try {
        exchange.onClose();
      } finally {
        detach();
      }
    }
  }

  private void handleReturn(
      int replyCode,
      String replyText,
      String exchangeName,
      String routingKey,
      AMQP.BasicProperties properties,
      byte[] body) {
    logger.debug(
        "Message returned by exchange {} with routing key {}: {} {}",
        exchangeName,
        routingKey,
        replyCode,
        replyText);
    exchange.onReturn(new Return(replyCode, replyText, exchangeName, routingKey, properties, body));
  }
}
