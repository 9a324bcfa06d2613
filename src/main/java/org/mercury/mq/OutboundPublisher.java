package org.mercury.mq;

import lombok.extern.slf4j.Slf4j;
import org.mercury.broker.BrokerChannel;
import org.mercury.domain.BusMessage;
import org.mercury.domain.BusTopology;
import org.mercury.exception.PublishException;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageDeliveryMode;
import org.springframework.amqp.core.MessageProperties;

import java.time.Clock;
import java.util.Date;

/**
 * 消息发布器
 * - 默认发布到全局广播交换机，可指定其他交换机
 * - 消息持久化，带应用标识、新时间戳、消息ID和父消息ID头
 * - 发布失败同步抛出 PublishException，不重试
 */
@Slf4j
public class OutboundPublisher {

    /**
     * 父消息ID头
     */
    public static final String PARENT_MESSAGE_HEADER = "parentMessage";

    private static final byte[] EMPTY_BODY = new byte[0];

    private final BrokerChannel channel;
    private final String appName;
    private final Clock clock;

    public OutboundPublisher(BrokerChannel channel, String appName, Clock clock) {
        this.channel = channel;
        this.appName = appName;
        this.clock = clock;
    }

    public void publish(BusMessage message) {
        publish(message, null);
    }

    /**
     * 发布消息
     *
     * @param message 应用消息
     * @param alternativeExchange 目标交换机，为空时使用全局广播交换机
     */
    public void publish(BusMessage message, String alternativeExchange) {
        String exchange = alternativeExchange == null || alternativeExchange.isBlank()
                ? BusTopology.MAIN_BUS_EXCHANGE
                : alternativeExchange;

        MessageProperties properties = new MessageProperties();
        properties.setDeliveryMode(MessageDeliveryMode.PERSISTENT);
        properties.setAppId(appName);
        properties.setMessageId(message.getMessageId());
        properties.setTimestamp(Date.from(clock.instant()));
        if (message.getParentMessageId() != null) {
            properties.setHeader(PARENT_MESSAGE_HEADER, message.getParentMessageId());
        }
        Message amqpMessage = new Message(message.getBody() == null ? EMPTY_BODY : message.getBody(), properties);

        try {
            channel.publish(exchange, message.getDescriptor(), amqpMessage);
        } catch (AmqpException e) {
            log.error("[消息发布失败] exchange={}, descriptor={}, messageId={}, errorMsg={}",
                      exchange, message.getDescriptor(), message.getMessageId(), e.getMessage());
            throw new PublishException(exchange, message.getMessageId(), e);
        }
        log.debug("[消息已发布] exchange={}, descriptor={}, messageId={}, parentMessageId={}",
                  exchange, message.getDescriptor(), message.getMessageId(), message.getParentMessageId());
    }
}
