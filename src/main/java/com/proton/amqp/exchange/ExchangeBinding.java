package com.proton.amqp.exchange;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A binding between an exchange and a peer queue or exchange named by {@code source}.
 *
 * <p>For {@link Target#QUEUE} the queue receives messages routed by the exchange. For
 * {@link Target#EXCHANGE} the exchange receives messages routed by {@code source}, which is the
 * binding {@link AmqpExchange#unbindFrom(String, String, Map)} removes.
 */
public final class ExchangeBinding {

    public enum Target {
        QUEUE,
        EXCHANGE;

        @Override
        public String toString() {
            return name().toLowerCase();
        }
    }

    private final String routingKey;
    private final String source;
    private final Map<String, Object> args;
    private final Target to;

    public ExchangeBinding(String routingKey, String source, Map<String, Object> args, Target to) {
        this.routingKey = Objects.requireNonNull(routingKey, "routingKey");
        this.source = Objects.requireNonNull(source, "source");
        this.to = Objects.requireNonNull(to, "to");
        this.args = args == null ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(args));
    }

    public static ExchangeBinding queue(String source, String routingKey) {
        return new ExchangeBinding(routingKey, source, null, Target.QUEUE);
    }

    public static ExchangeBinding exchange(String source, String routingKey) {
        return new ExchangeBinding(routingKey, source, null, Target.EXCHANGE);
    }

    public String getRoutingKey() {
        return routingKey;
    }

    public String getSource() {
        return source;
    }

    public Map<String, Object> getArgs() {
        return args;
    }

    public Target getTo() {
        return to;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ExchangeBinding that = (ExchangeBinding) o;
        return routingKey.equals(that.routingKey)
            && source.equals(that.source)
            && args.equals(that.args)
            && to == that.to;
    }

    @Override
    public int hashCode() {
        return Objects.hash(routingKey, source, args, to);
    }

    @Override
    public String toString() {
        return String.format("ExchangeBinding{routingKey='%s', source='%s', to=%s, args=%s}",
            routingKey, source, to, args);
    }
}
