package org.mercury.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.mercury.broker.BrokerChannel;
import org.mercury.broker.BrokerConnection;
import org.mercury.broker.BrokerConnector;
import org.mercury.config.MercuryBusProperties;
import org.mercury.domain.BusMessage;
import org.mercury.domain.BusTopology;
import org.mercury.handler.MessageHandlerRegistry;
import org.mercury.mq.InFlightDeliveryTable;
import org.mercury.mq.InboundDispatcher;
import org.mercury.mq.OutboundPublisher;
import org.mercury.mq.OutcomeResolver;
import org.mercury.mq.OutcomeSignals;
import org.mercury.mq.SubscriptionManager;
import org.mercury.mq.TopologyProvisioner;
import org.mercury.service.IMessageBusService;

import java.time.Clock;
import java.util.Collection;

/**
 * 消息总线服务实现
 *
 * 生命周期：
 * 1. connect：建立连接和通道 -> 声明拓扑 -> 订阅注册表中的主题 -> 开始消费主队列
 * 2. disconnect：关闭通道 -> 关闭连接，未决投递由 broker 在通道关闭后重投
 *
 * 处理中表随每次连接新建，旧连接上迟到的结果信号只作用于旧表，不会影响重连后的重投。
 *
 * 不提供自动重连。
 */
@Slf4j
public class MessageBusServiceImpl implements IMessageBusService {

    private final MercuryBusProperties properties;
    private final BrokerConnector connector;
    private final MessageHandlerRegistry registry;
    private final Clock clock;
    private final BusTopology topology;

    private volatile Session session;

    public MessageBusServiceImpl(MercuryBusProperties properties,
                                 BrokerConnector connector,
                                 MessageHandlerRegistry registry,
                                 Clock clock) {
        this.properties = properties;
        this.connector = connector;
        this.registry = registry;
        this.clock = clock;
        this.topology = BusTopology.forService(properties.getServiceName(), properties.getRetryDelaySeconds());
    }

    @Override
    public synchronized void connect() {
        if (session != null) {
            log.warn("[重复连接，忽略] serviceName={}", properties.getServiceName());
            return;
        }

        BrokerConnection connection = connector.connect(
                properties.getBrokerHost(),
                properties.getBrokerPort(),
                properties.getBrokerUser(),
                properties.getBrokerPassword());
        BrokerChannel channel = null;
        InFlightDeliveryTable inFlight = new InFlightDeliveryTable();
        try {
            channel = connection.createChannel();
            new TopologyProvisioner(channel).provision(topology);

            OutboundPublisher publisher = new OutboundPublisher(channel, properties.getAppName(), clock);
            OutcomeResolver resolver = new OutcomeResolver(channel, inFlight, publisher, properties.getMaxRetries());
            OutcomeSignals outcomes = new OutcomeSignals(resolver);
            SubscriptionManager subscriptions = new SubscriptionManager(channel, topology);

            subscriptions.subscribeAll(registry.topics());

            InboundDispatcher dispatcher = new InboundDispatcher(
                    channel, inFlight, registry, outcomes,
                    properties.getAppName(), properties.isFilterMessages());
            session = new Session(connection, channel, inFlight, publisher, subscriptions, outcomes);
            channel.consume(topology.getPrimaryQueue(), dispatcher);
        } catch (RuntimeException e) {
            log.error("[消息总线启动失败] serviceName={}, errorMsg={}", properties.getServiceName(), e.getMessage());
            session = null;
            closeQuietly(channel, connection, e);
            throw e;
        }

        log.info("[消息总线已启动] appName={}, serviceName={}, queue={}, topics={}",
                 properties.getAppName(), properties.getServiceName(), topology.getPrimaryQueue(), registry.topics());
    }

    @Override
    public synchronized void disconnect() {
        Session current = session;
        if (current == null) {
            return;
        }
        session = null;

        RuntimeException failure = null;
        try {
            if (current.channel.isOpen()) {
                current.channel.close();
            }
        } catch (RuntimeException e) {
            failure = e;
        }
        try {
            if (current.connection.isOpen()) {
                current.connection.close();
            }
        } catch (RuntimeException e) {
            if (failure == null) {
                failure = e;
            } else {
                failure.addSuppressed(e);
            }
        }

        int pending = current.inFlight.size();
        if (pending > 0) {
            log.warn("[断开时仍有未决投递，将由broker重投] count={}", pending);
        }
        current.inFlight.clear();

        if (failure != null) {
            log.error("[消息总线断开失败] errorMsg={}", failure.getMessage());
            throw failure;
        }
        log.info("[消息总线已断开] serviceName={}", properties.getServiceName());
    }

    @Override
    public boolean isConnected() {
        Session current = session;
        return current != null && current.connection.isOpen();
    }

    @Override
    public void publish(BusMessage message) {
        requireSession().publisher.publish(message);
    }

    @Override
    public void publish(BusMessage message, String alternativeExchange) {
        requireSession().publisher.publish(message, alternativeExchange);
    }

    @Override
    public void subscribe(String topic) {
        requireSession().subscriptions.subscribe(topic);
    }

    @Override
    public void subscribeAll(Collection<String> topics) {
        requireSession().subscriptions.subscribeAll(topics);
    }

    @Override
    public OutcomeSignals outcomes() {
        return requireSession().outcomes;
    }

    @Override
    public int inFlightCount() {
        Session current = session;
        return current == null ? 0 : current.inFlight.size();
    }

    @Override
    public BusTopology topology() {
        return topology;
    }

    private Session requireSession() {
        Session current = session;
        if (current == null) {
            throw new IllegalStateException("Message bus is not connected");
        }
        return current;
    }

    private void closeQuietly(BrokerChannel channel, BrokerConnection connection, RuntimeException original) {
        if (channel != null) {
            try {
                if (channel.isOpen()) {
                    channel.close();
                }
            } catch (RuntimeException e) {
                original.addSuppressed(e);
            }
        }
        try {
            if (connection.isOpen()) {
                connection.close();
            }
        } catch (RuntimeException e) {
            original.addSuppressed(e);
        }
    }

    private static final class Session {

        private final BrokerConnection connection;
        private final BrokerChannel channel;
        private final InFlightDeliveryTable inFlight;
        private final OutboundPublisher publisher;
        private final SubscriptionManager subscriptions;
        private final OutcomeSignals outcomes;

        private Session(BrokerConnection connection, BrokerChannel channel, InFlightDeliveryTable inFlight,
                        OutboundPublisher publisher, SubscriptionManager subscriptions, OutcomeSignals outcomes) {
            this.connection = connection;
            this.channel = channel;
            this.inFlight = inFlight;
            this.publisher = publisher;
            this.subscriptions = subscriptions;
            this.outcomes = outcomes;
        }
    }
}
