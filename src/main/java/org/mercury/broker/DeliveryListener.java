package org.mercury.broker;

import org.springframework.amqp.core.Message;

/**
 * 原始投递回调
 * - 由 broker 消费线程调用，每次一条消息
 */
@FunctionalInterface
public interface DeliveryListener {

    void onDelivery(Message delivery);
}
