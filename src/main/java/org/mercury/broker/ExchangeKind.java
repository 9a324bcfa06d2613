package org.mercury.broker;

import org.springframework.amqp.core.ExchangeTypes;

/**
 * 交换机类型
 */
public enum ExchangeKind {

    DIRECT(ExchangeTypes.DIRECT),
    FANOUT(ExchangeTypes.FANOUT),
    TOPIC(ExchangeTypes.TOPIC);

    private final String amqpType;

    ExchangeKind(String amqpType) {
        this.amqpType = amqpType;
    }

    public String getAmqpType() {
        return amqpType;
    }
}
