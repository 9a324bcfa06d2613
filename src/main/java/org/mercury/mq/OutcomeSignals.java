package org.mercury.mq;

import org.mercury.domain.BusMessage;
import org.mercury.event.BroadcastSuccessSignal;
import org.mercury.event.OutcomeSignal;
import org.mercury.event.ProcessErrorSignal;
import org.mercury.event.ProcessSuccessSignal;

import java.util.Arrays;
import java.util.List;

/**
 * 结果信号通道
 * - 每个总线实例持有一个，处理器通过它回报处理结果
 * - 可在任意线程调用
 */
public class OutcomeSignals {

    private final OutcomeResolver resolver;

    public OutcomeSignals(OutcomeResolver resolver) {
        this.resolver = resolver;
    }

    public AckDecision success(String deliveryId, BusMessage... resultingMessages) {
        return success(deliveryId, Arrays.asList(resultingMessages));
    }

    public AckDecision success(String deliveryId, List<BusMessage> resultingMessages) {
        return signal(new ProcessSuccessSignal(deliveryId, resultingMessages));
    }

    public AckDecision error(String deliveryId, Throwable cause) {
        return error(deliveryId, cause, null);
    }

    /**
     * @param maxRetries 本条消息的重试上限，为空或不大于 0 时使用默认上限
     */
    public AckDecision error(String deliveryId, Throwable cause, Integer maxRetries) {
        return signal(new ProcessErrorSignal(deliveryId, cause, maxRetries));
    }

    public AckDecision broadcastSuccess(BusMessage... resultingMessages) {
        return broadcastSuccess(Arrays.asList(resultingMessages));
    }

    public AckDecision broadcastSuccess(List<BusMessage> resultingMessages) {
        return signal(new BroadcastSuccessSignal(resultingMessages));
    }

    public AckDecision signal(OutcomeSignal signal) {
        return resolver.resolve(signal);
    }
}
