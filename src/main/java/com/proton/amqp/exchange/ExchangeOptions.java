package com.proton.amqp.exchange;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Options used when the exchange is asserted on the broker.
 */
public class ExchangeOptions {
    static final String ALTERNATE_EXCHANGE_ARGUMENT = "alternate-exchange";

    private boolean durable = true;
    private boolean autoDelete = false;
    private boolean internal = false;
    private String alternateExchange;
    private final Map<String, Object> arguments = new LinkedHashMap<>();

    /** Durable, not auto-deleted, not internal, no arguments. */
    public static ExchangeOptions defaults() {
        return new ExchangeOptions();
    }

    public ExchangeOptions durable(boolean durable) {
        this.durable = durable;
        return this;
    }

    public ExchangeOptions autoDelete(boolean autoDelete) {
        this.autoDelete = autoDelete;
        return this;
    }

    public ExchangeOptions internal(boolean internal) {
        this.internal = internal;
        return this;
    }

    /** Exchange that receives messages this exchange cannot route. */
    public ExchangeOptions alternateExchange(String alternateExchange) {
        this.alternateExchange = alternateExchange;
        return this;
    }

    public ExchangeOptions argument(String key, Object value) {
        this.arguments.put(key, value);
        return this;
    }

    public ExchangeOptions arguments(Map<String, Object> arguments) {
        if (arguments != null) {
            this.arguments.putAll(arguments);
        }
        return this;
    }

    public boolean isDurable() {
        return durable;
    }

    public boolean isAutoDelete() {
        return autoDelete;
    }

    public boolean isInternal() {
        return internal;
    }

    public String getAlternateExchange() {
        return alternateExchange;
    }

    public Map<String, Object> getArguments() {
        return Collections.unmodifiableMap(arguments);
    }

    /**
     * The argument table sent with exchange.declare, including the alternate exchange if set.
     */
    public Map<String, Object> toArguments() {
        Map<String, Object> effective = new LinkedHashMap<>(arguments);
        if (alternateExchange != null) {
            effective.put(ALTERNATE_EXCHANGE_ARGUMENT, alternateExchange);
        }
        return effective;
    }

    @Override
    public String toString() {
        return String.format("ExchangeOptions{durable=%s, autoDelete=%s, internal=%s, arguments=%s}",
            durable, autoDelete, internal, toArguments());
    }
}
