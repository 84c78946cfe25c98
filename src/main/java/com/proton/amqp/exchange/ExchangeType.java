package com.proton.amqp.exchange;

import com.rabbitmq.client.BuiltinExchangeType;

/**
 * Exchange types an {@link AmqpExchange} can be declared with.
 */
public enum ExchangeType {
    DIRECT(BuiltinExchangeType.DIRECT),
    FANOUT(BuiltinExchangeType.FANOUT),
    TOPIC(BuiltinExchangeType.TOPIC);

    private final BuiltinExchangeType builtinType;

    ExchangeType(BuiltinExchangeType builtinType) {
        this.builtinType = builtinType;
    }

    public BuiltinExchangeType getBuiltinType() {
        return builtinType;
    }

    /**
     * @return the type name as sent on the wire
     */
    public String getValue() {
        return builtinType.getType();
    }

    public static ExchangeType fromValue(String value) {
        if (value != null) {
            for (ExchangeType type : values()) {
                if (type.getValue().equalsIgnoreCase(value.trim())) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unsupported exchange type: " + value);
    }

    @Override
    public String toString() {
        return getValue();
    }
}
