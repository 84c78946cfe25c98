package com.proton.amqp.exchange;

/**
 * Completion callback for channel operations. Exactly one of {@code result} and {@code error}
 * is meaningful: {@code error} is null on success.
 */
@FunctionalInterface
public interface ChannelCallback<T> {
    void onComplete(T result, Exception error);
}
