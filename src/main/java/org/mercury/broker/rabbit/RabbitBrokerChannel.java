package org.mercury.broker.rabbit;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;
import lombok.extern.slf4j.Slf4j;
import org.mercury.broker.BrokerChannel;
import org.mercury.broker.DeliveryListener;
import org.mercury.broker.ExchangeKind;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.support.DefaultMessagePropertiesConverter;
import org.springframework.amqp.rabbit.support.MessagePropertiesConverter;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.rabbit.connection.RabbitUtils;
import org.springframework.amqp.rabbit.support.RabbitExceptionTranslator;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;

/**
 * RabbitMQ 通道实现
 * - RabbitMQ 通道不能被多线程并发使用，所有操作在同一把锁下串行执行
 * - 客户端异常统一经 RabbitExceptionTranslator 转换为 AmqpException
 * - 关闭时先取消消费者，再物理关闭通道；缓存通道的普通 close 只会归还缓存，消费者仍然挂着
 */
@Slf4j
public class RabbitBrokerChannel implements BrokerChannel {

    static final String DEAD_LETTER_EXCHANGE_ARGUMENT = "x-dead-letter-exchange";

    private static final String CHARSET = StandardCharsets.UTF_8.name();

    private final Channel channel;
    private final MessagePropertiesConverter propertiesConverter;
    private final Object lock = new Object();
    private final List<String> consumerTags = new CopyOnWriteArrayList<>();

    public RabbitBrokerChannel(Channel channel) {
        this(channel, new DefaultMessagePropertiesConverter());
    }

    RabbitBrokerChannel(Channel channel, MessagePropertiesConverter propertiesConverter) {
        this.channel = channel;
        this.propertiesConverter = propertiesConverter;
    }

    @Override
    public void declareExchange(String name, ExchangeKind kind) {
        execute(ch -> ch.exchangeDeclare(name, kind.getAmqpType(), true, false, null));
    }

    @Override
    public void declareQueue(String name, String deadLetterExchange, Map<String, Object> arguments) {
        Map<String, Object> queueArguments = new HashMap<>();
        if (arguments != null) {
            queueArguments.putAll(arguments);
        }
        if (deadLetterExchange != null) {
            queueArguments.put(DEAD_LETTER_EXCHANGE_ARGUMENT, deadLetterExchange);
        }
        execute(ch -> ch.queueDeclare(name, true, false, false, queueArguments));
    }

    @Override
    public void bindExchange(String destination, String source, String routingKey) {
        execute(ch -> ch.exchangeBind(destination, source, routingKey));
    }

    @Override
    public void bindQueue(String queue, String exchange, String routingKey) {
        execute(ch -> ch.queueBind(queue, exchange, routingKey));
    }

    @Override
    public String consume(String queue, DeliveryListener listener) {
        DefaultConsumer consumer = new DefaultConsumer(channel) {
            @Override
            public void handleDelivery(String consumerTag, Envelope envelope,
                                       AMQP.BasicProperties properties, byte[] body) {
                MessageProperties messageProperties =
                        propertiesConverter.toMessageProperties(properties, envelope, CHARSET);
                try {
                    listener.onDelivery(new Message(body, messageProperties));
                } catch (RuntimeException e) {
                    // 异常若抛给客户端会导致通道关闭，消费必须继续
                    log.error("[投递回调异常] queue={}, deliveryTag={}, routingKey={}, errorMsg={}",
                              queue, envelope.getDeliveryTag(), envelope.getRoutingKey(), e.getMessage(), e);
                }
            }
        };
        String consumerTag = execute(ch -> ch.basicConsume(queue, false, consumer));
        consumerTags.add(consumerTag);
        log.info("[开始消费] queue={}, consumerTag={}", queue, consumerTag);
        return consumerTag;
    }

    @Override
    public void publish(String exchange, String routingKey, Message message) {
        AMQP.BasicProperties properties =
                propertiesConverter.fromMessageProperties(message.getMessageProperties(), CHARSET);
        run(ch -> ch.basicPublish(exchange, routingKey, false, properties, message.getBody()));
    }

    @Override
    public void ack(Message delivery) {
        long deliveryTag = delivery.getMessageProperties().getDeliveryTag();
        run(ch -> ch.basicAck(deliveryTag, false));
    }

    @Override
    public void nack(Message delivery) {
        long deliveryTag = delivery.getMessageProperties().getDeliveryTag();
        run(ch -> ch.basicNack(deliveryTag, false, false));
    }

    @Override
    public boolean isOpen() {
        return channel.isOpen();
    }

    @Override
    public void close() {
        synchronized (lock) {
            cancelConsumers();
            RabbitUtils.setPhysicalCloseRequired(channel, true);
            try {
                channel.close();
            } catch (AlreadyClosedException e) {
                log.debug("[通道已关闭] channel={}", channel.getChannelNumber());
            } catch (IOException | TimeoutException e) {
                throw RabbitExceptionTranslator.convertRabbitAccessException(e);
            }
        }
    }

    private void cancelConsumers() {
        if (consumerTags.isEmpty() || !channel.isOpen()) {
            consumerTags.clear();
            return;
        }
        try {
            RabbitUtils.closeMessageConsumer(channel, consumerTags, false);
            log.info("[取消消费] consumerTags={}", consumerTags);
        } catch (AmqpException e) {
            // 取消失败不阻止关闭，通道物理关闭后 broker 同样会移除消费者
            log.warn("[取消消费失败] consumerTags={}, errorMsg={}", consumerTags, e.getMessage());
        } finally {
            consumerTags.clear();
        }
    }

    private <T> T execute(ChannelAction<T> action) {
        synchronized (lock) {
            try {
                return action.doWith(channel);
            } catch (IOException | ShutdownSignalException e) {
                throw RabbitExceptionTranslator.convertRabbitAccessException(e);
            }
        }
    }

    private void run(VoidChannelAction action) {
        execute(ch -> {
            action.doWith(ch);
            return null;
        });
    }

    @FunctionalInterface
    private interface ChannelAction<T> {
        T doWith(Channel channel) throws IOException;
    }

    @FunctionalInterface
    private interface VoidChannelAction {
        void doWith(Channel channel) throws IOException;
    }
}
