package org.mercury.support;

import org.mercury.broker.BrokerChannel;
import org.mercury.broker.DeliveryListener;
import org.mercury.broker.ExchangeKind;
import org.mercury.domain.BusTopology;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 内存版 broker 通道
 * - 记录声明、绑定、发布、确认和拒绝
 * - 声明语义与 broker 一致：相同声明幂等，冲突声明抛出 AmqpException
 * - 发布到全局广播交换机的消息按订阅路由回主队列消费者，用于端到端测试
 */
public class InMemoryBrokerChannel implements BrokerChannel {

    private final Map<String, ExchangeKind> exchanges = new LinkedHashMap<>();
    private final Map<String, Map<String, Object>> queues = new LinkedHashMap<>();
    private final Set<String> bindings = new LinkedHashSet<>();
    private final List<String> operations = new CopyOnWriteArrayList<>();
    private final List<Published> published = new CopyOnWriteArrayList<>();
    private final List<Long> acked = new CopyOnWriteArrayList<>();
    private final List<Long> nacked = new CopyOnWriteArrayList<>();
    private final Map<String, DeliveryListener> consumers = new HashMap<>();
    private final AtomicLong deliveryTags = new AtomicLong();

    private volatile boolean open = true;
    private volatile AmqpException publishFailure;

    @Override
    public synchronized void declareExchange(String name, ExchangeKind kind) {
        ensureOpen();
        ExchangeKind existing = exchanges.get(name);
        if (existing != null && existing != kind) {
            throw new AmqpException("PRECONDITION_FAILED - inequivalent arg 'type' for exchange '" + name + "'");
        }
        exchanges.put(name, kind);
        operations.add("exchange:" + name);
    }

    @Override
    public synchronized void declareQueue(String name, String deadLetterExchange, Map<String, Object> arguments) {
        ensureOpen();
        Map<String, Object> queueArguments = new HashMap<>(arguments == null ? Map.of() : arguments);
        if (deadLetterExchange != null) {
            queueArguments.put("x-dead-letter-exchange", deadLetterExchange);
        }
        Map<String, Object> existing = queues.get(name);
        if (existing != null && !existing.equals(queueArguments)) {
            throw new AmqpException("PRECONDITION_FAILED - inequivalent arg for queue '" + name + "'");
        }
        queues.put(name, queueArguments);
        operations.add("queue:" + name);
    }

    @Override
    public synchronized void bindExchange(String destination, String source, String routingKey) {
        ensureOpen();
        bindings.add(source + "->" + destination + ":" + routingKey);
        operations.add("bindExchange:" + source + "->" + destination);
    }

    @Override
    public synchronized void bindQueue(String queue, String exchange, String routingKey) {
        ensureOpen();
        bindings.add(exchange + "->" + queue + ":" + routingKey);
        operations.add("bindQueue:" + exchange + "->" + queue + ":" + routingKey);
    }

    @Override
    public synchronized String consume(String queue, DeliveryListener listener) {
        ensureOpen();
        consumers.put(queue, listener);
        operations.add("consume:" + queue);
        return "ctag-" + queue;
    }

    @Override
    public void publish(String exchange, String routingKey, Message message) {
        ensureOpen();
        if (publishFailure != null) {
            throw publishFailure;
        }
        published.add(new Published(exchange, routingKey, message));
    }

    @Override
    public void ack(Message delivery) {
        ensureOpen();
        acked.add(delivery.getMessageProperties().getDeliveryTag());
    }

    @Override
    public void nack(Message delivery) {
        ensureOpen();
        nacked.add(delivery.getMessageProperties().getDeliveryTag());
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() {
        if (!open) {
            throw new AmqpException("channel already closed");
        }
        open = false;
        operations.add("close");
    }

    /**
     * 把广播消息按订阅路由到服务主队列的消费者
     *
     * @return 是否投递成功
     */
    public boolean route(Published message, BusTopology topology) {
        boolean reachesService = BusTopology.MAIN_BUS_EXCHANGE.equals(message.getExchange())
                ? bindings.contains(topology.getMainBusExchange() + "->" + topology.getServiceExchange() + ":")
                : topology.getServiceExchange().equals(message.getExchange());
        boolean bound = bindings.contains(topology.getServiceExchange() + "->" + topology.getPrimaryQueue()
                                          + ":" + message.getRoutingKey());
        DeliveryListener listener = consumers.get(topology.getPrimaryQueue());
        if (!reachesService || !bound || listener == null) {
            return false;
        }
        MessageProperties source = message.getMessage().getMessageProperties();
        MessageProperties properties = new MessageProperties();
        properties.setReceivedRoutingKey(message.getRoutingKey());
        properties.setDeliveryTag(deliveryTags.incrementAndGet());
        properties.setAppId(source.getAppId());
        properties.setMessageId(source.getMessageId());
        properties.setTimestamp(source.getTimestamp());
        source.getHeaders().forEach(properties::setHeader);
        listener.onDelivery(new Message(message.getMessage().getBody(), properties));
        return true;
    }

    /**
     * 直接向队列消费者推送一条原始投递
     */
    public void deliver(String queue, Message delivery) {
        DeliveryListener listener = consumers.get(queue);
        Objects.requireNonNull(listener, "no consumer on " + queue);
        listener.onDelivery(delivery);
    }

    public void failPublishesWith(AmqpException failure) {
        this.publishFailure = failure;
    }

    public void forceClosed() {
        this.open = false;
    }

    public synchronized Map<String, ExchangeKind> getExchanges() {
        return new LinkedHashMap<>(exchanges);
    }

    public synchronized Map<String, Map<String, Object>> getQueues() {
        return new LinkedHashMap<>(queues);
    }

    public synchronized Set<String> getBindings() {
        return new LinkedHashSet<>(bindings);
    }

    public List<String> getOperations() {
        return new ArrayList<>(operations);
    }

    public List<Published> getPublished() {
        return new ArrayList<>(published);
    }

    public List<Long> getAcked() {
        return new ArrayList<>(acked);
    }

    public List<Long> getNacked() {
        return new ArrayList<>(nacked);
    }

    private void ensureOpen() {
        if (!open) {
            throw new AmqpException("channel is closed");
        }
    }

    /**
     * 已发布消息
     */
    public static class Published {

        private final String exchange;
        private final String routingKey;
        private final Message message;

        Published(String exchange, String routingKey, Message message) {
            this.exchange = exchange;
            this.routingKey = routingKey;
            this.message = message;
        }

        public String getExchange() {
            return exchange;
        }

        public String getRoutingKey() {
            return routingKey;
        }

        public Message getMessage() {
            return message;
        }
    }
}
