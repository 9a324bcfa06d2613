package org.mercury.broker;

import org.springframework.amqp.core.Message;

import java.util.Map;

/**
 * Broker 通道能力
 *
 * 消息总线核心只通过该接口访问 broker：
 * - 声明交换机、队列与绑定（declare 语义：相同声明幂等，冲突声明失败）
 * - 消费、发布
 * - 确认（ack）与拒绝（nack，不原地重入队）
 *
 * 所有声明均为 durable 且非 auto-delete。
 * 实现方负责对同一通道的并发访问加锁。
 */
public interface BrokerChannel {

    void declareExchange(String name, ExchangeKind kind);

    /**
     * 声明队列
     *
     * @param name 队列名
     * @param deadLetterExchange 死信交换机，可为 null
     * @param arguments 额外参数（如 x-message-ttl），可为空
     */
    void declareQueue(String name, String deadLetterExchange, Map<String, Object> arguments);

    void bindExchange(String destination, String source, String routingKey);

    void bindQueue(String queue, String exchange, String routingKey);

    /**
     * 开始消费队列，返回消费者标签
     */
    String consume(String queue, DeliveryListener listener);

    void publish(String exchange, String routingKey, Message message);

    void ack(Message delivery);

    /**
     * 拒绝消息且不重新入队，由死信路由接管
     */
    void nack(Message delivery);

    boolean isOpen();

    void close();
}
