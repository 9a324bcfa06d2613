package org.mercury.mq;

import lombok.extern.slf4j.Slf4j;
import org.mercury.broker.BrokerChannel;
import org.mercury.broker.DeliveryListener;
import org.mercury.domain.BusMessage;
import org.mercury.handler.MessageHandler;
import org.mercury.handler.MessageHandlerRegistry;
import org.slf4j.MDC;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;

import java.util.List;
import java.util.Objects;

/**
 * 投递分发
 *
 * 对每条原始投递：
 * 1. appId 与本应用不符：直接确认丢弃（同一队列由多个应用副本共享，各自过滤）
 * 2. 缺少 messageId：直接确认丢弃，结果信号以 messageId 为键，无法追踪
 * 3. 否则登记到处理中表，构造应用消息，分发给该主题的全部处理器
 *
 * 分发不等待处理结果，处理器稍后通过 OutcomeSignals 回报。
 */
@Slf4j
public class InboundDispatcher implements DeliveryListener {

    static final String MDC_MESSAGE_ID = "messageId";

    private final BrokerChannel channel;
    private final InFlightDeliveryTable inFlight;
    private final MessageHandlerRegistry registry;
    private final OutcomeSignals outcomes;
    private final String appName;
    private final boolean filterMessages;

    public InboundDispatcher(BrokerChannel channel,
                             InFlightDeliveryTable inFlight,
                             MessageHandlerRegistry registry,
                             OutcomeSignals outcomes,
                             String appName,
                             boolean filterMessages) {
        this.channel = channel;
        this.inFlight = inFlight;
        this.registry = registry;
        this.outcomes = outcomes;
        this.appName = appName;
        this.filterMessages = filterMessages;
    }

    @Override
    public void onDelivery(Message delivery) {
        MessageProperties properties = delivery.getMessageProperties();
        String routingKey = properties.getReceivedRoutingKey();

        // ==================== 1. 应用归属过滤 ====================
        if (filterMessages && !Objects.equals(appName, properties.getAppId())) {
            log.debug("[非本应用消息，直接确认] appId={}, expectedAppId={}, routingKey={}",
                      properties.getAppId(), appName, routingKey);
            channel.ack(delivery);
            return;
        }

        // ==================== 2. 追踪ID检查 ====================
        String messageId = properties.getMessageId();
        if (messageId == null || messageId.isEmpty()) {
            log.warn("[消息缺少messageId，无法追踪，直接确认] routingKey={}, deliveryTag={}",
                     routingKey, properties.getDeliveryTag());
            channel.ack(delivery);
            return;
        }

        List<MessageHandler> handlers = registry.handlersFor(routingKey);
        if (handlers.isEmpty()) {
            log.warn("[主题没有本地处理器，直接确认] routingKey={}, messageId={}", routingKey, messageId);
            channel.ack(delivery);
            return;
        }

        // ==================== 3. 登记并分发 ====================
        inFlight.track(messageId, delivery);
        BusMessage message = toBusMessage(delivery);

        MDC.put(MDC_MESSAGE_ID, messageId);
        try {
            log.debug("[分发消息] routingKey={}, messageId={}, parentMessageId={}, handlers={}",
                      routingKey, messageId, message.getParentMessageId(), handlers.size());
            for (MessageHandler handler : handlers) {
                dispatch(handler, message);
            }
        } finally {
            MDC.remove(MDC_MESSAGE_ID);
        }
    }

    private void dispatch(MessageHandler handler, BusMessage message) {
        try {
            handler.onMessage(message, outcomes);
        } catch (RuntimeException e) {
            log.error("[处理器异常] descriptor={}, messageId={}, errorMsg={}",
                      message.getDescriptor(), message.getMessageId(), e.getMessage(), e);
            outcomes.error(message.getMessageId(), e);
        }
    }

    static BusMessage toBusMessage(Message delivery) {
        MessageProperties properties = delivery.getMessageProperties();
        Object parent = properties.getHeaders().get(OutboundPublisher.PARENT_MESSAGE_HEADER);
        return BusMessage.builder()
                .descriptor(properties.getReceivedRoutingKey())
                .body(delivery.getBody())
                .messageId(properties.getMessageId())
                .timestamp(properties.getTimestamp() == null ? null : properties.getTimestamp().getTime())
                .parentMessageId(parent == null ? null : parent.toString())
                .build();
    }
}
