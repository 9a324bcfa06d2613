package org.mercury.mq;

import lombok.extern.slf4j.Slf4j;
import org.mercury.broker.BrokerChannel;
import org.mercury.domain.BusMessage;
import org.mercury.domain.InFlightDelivery;
import org.mercury.event.BroadcastSuccessSignal;
import org.mercury.event.OutcomeSignal;
import org.mercury.event.ProcessErrorSignal;
import org.mercury.event.ProcessSuccessSignal;
import org.mercury.exception.PublishException;
import org.springframework.amqp.AmqpException;

import java.util.List;
import java.util.Optional;

/**
 * 结果信号处理
 *
 * 每条处理中投递的状态：Pending -> Acked / Requeued（终态）
 * - 成功：移除并确认，随后发布处理产生的后续消息
 * - 失败：移除，已死信次数 < 上限时 nack（不原地重入队，经死信交换机进入重试队列，
 *   TTL 到期后带着 +1 的计数回到主队列）；否则确认并永久丢弃
 * - 广播成功：没有投递需要确认，只发布后续消息
 *
 * 比较使用失败前的死信次数：count 为 0..limit-1 时重试，count == limit 时丢弃。
 * 未知投递（不存在或已处理）只记日志，不抛出。
 * ack/nack 失败同样只记日志，返回 ACK_FAILED，此时不发布后续消息。
 */
@Slf4j
public class OutcomeResolver {

    /**
     * 默认最大重试次数
     */
    public static final int DEFAULT_MAX_RETRIES = 60;

    private final BrokerChannel channel;
    private final InFlightDeliveryTable inFlight;
    private final OutboundPublisher publisher;
    private final int defaultMaxRetries;

    public OutcomeResolver(BrokerChannel channel, InFlightDeliveryTable inFlight,
                           OutboundPublisher publisher, int defaultMaxRetries) {
        this.channel = channel;
        this.inFlight = inFlight;
        this.publisher = publisher;
        this.defaultMaxRetries = defaultMaxRetries > 0 ? defaultMaxRetries : DEFAULT_MAX_RETRIES;
    }

    public AckDecision resolve(OutcomeSignal signal) {
        if (signal instanceof ProcessSuccessSignal) {
            return onSuccess((ProcessSuccessSignal) signal);
        }
        if (signal instanceof ProcessErrorSignal) {
            return onError((ProcessErrorSignal) signal);
        }
        if (signal instanceof BroadcastSuccessSignal) {
            publishAll(((BroadcastSuccessSignal) signal).getResultingMessages(), null);
            return AckDecision.NO_DELIVERY;
        }
        throw new IllegalArgumentException("Unsupported outcome signal: " + signal);
    }

    private AckDecision onSuccess(ProcessSuccessSignal signal) {
        Optional<InFlightDelivery> tracked = inFlight.release(signal.getDeliveryId());
        if (tracked.isEmpty()) {
            log.warn("[未知投递] 成功信号对应的投递不存在或已处理, deliveryId={}", signal.getDeliveryId());
            return AckDecision.UNKNOWN_DELIVERY;
        }

        if (!acknowledge(tracked.get(), false)) {
            return AckDecision.ACK_FAILED;
        }
        log.debug("[消息已确认] deliveryId={}, resultingMessages={}",
                  signal.getDeliveryId(), signal.getResultingMessages().size());

        publishAll(signal.getResultingMessages(), signal.getDeliveryId());
        return AckDecision.ACKNOWLEDGED;
    }

    private AckDecision onError(ProcessErrorSignal signal) {
        Optional<InFlightDelivery> tracked = inFlight.release(signal.getDeliveryId());
        if (tracked.isEmpty()) {
            log.warn("[未知投递] 失败信号对应的投递不存在或已处理, deliveryId={}", signal.getDeliveryId());
            return AckDecision.UNKNOWN_DELIVERY;
        }

        InFlightDelivery delivery = tracked.get();
        int limit = retryLimit(signal.getMaxRetries());
        long count = delivery.getRetryCountSoFar();
        String errorMsg = signal.getCause() == null ? null : signal.getCause().getMessage();

        if (count < limit) {
            if (!acknowledge(delivery, true)) {
                return AckDecision.ACK_FAILED;
            }
            log.warn("[消息处理失败，进入重试队列] deliveryId={}, retryCount={}/{}, errorMsg={}",
                     delivery.getDeliveryId(), count, limit, errorMsg);
            return AckDecision.REQUEUED_FOR_RETRY;
        }

        if (!acknowledge(delivery, false)) {
            return AckDecision.ACK_FAILED;
        }
        log.error("[消息重试次数耗尽，已永久丢弃] deliveryId={}, routingKey={}, retryCount={}, maxRetries={}, errorMsg={}",
                  delivery.getDeliveryId(), delivery.getRawDelivery().getMessageProperties().getReceivedRoutingKey(),
                  count, limit, errorMsg, signal.getCause());
        return AckDecision.DROPPED_RETRIES_EXHAUSTED;
    }

    /**
     * 向 broker 确认或拒绝投递
     *
     * @return 是否成功送达 broker
     */
    private boolean acknowledge(InFlightDelivery delivery, boolean retry) {
        try {
            if (retry) {
                channel.nack(delivery.getRawDelivery());
            } else {
                channel.ack(delivery.getRawDelivery());
            }
            return true;
        } catch (AmqpException e) {
            log.error("[投递{}失败，等待broker重投] deliveryId={}, deliveryTag={}, errorMsg={}",
                      retry ? "拒绝" : "确认", delivery.getDeliveryId(),
                      delivery.getRawDelivery().getMessageProperties().getDeliveryTag(), e.getMessage());
            return false;
        }
    }

    int retryLimit(Integer maxRetries) {
        return maxRetries != null && maxRetries > 0 ? maxRetries : defaultMaxRetries;
    }

    /**
     * 逐条发布后续消息，单条失败不影响其余消息，也不影响已做出的确认
     */
    private void publishAll(List<BusMessage> messages, String deliveryId) {
        for (BusMessage message : messages) {
            try {
                publisher.publish(message);
            } catch (PublishException e) {
                log.error("[后续消息发布失败] deliveryId={}, descriptor={}, messageId={}, errorMsg={}",
                          deliveryId, message.getDescriptor(), message.getMessageId(), e.getMessage(), e);
            }
        }
    }
}
