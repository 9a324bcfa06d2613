package org.mercury.mq;

import lombok.extern.slf4j.Slf4j;
import org.mercury.domain.InFlightDelivery;
import org.mercury.util.DeathCountUtil;
import org.springframework.amqp.core.Message;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 处理中投递表
 * - 写入方：InboundDispatcher（消费线程）
 * - 读取并移除方：OutcomeResolver（任意处理线程）
 * - remove 是原子的，同一投递只会有一个结果信号生效
 *
 * 表的大小只在每条登记的投递最终收到结果信号时才有界。
 */
@Slf4j
public class InFlightDeliveryTable {

    private final ConcurrentHashMap<String, InFlightDelivery> deliveries = new ConcurrentHashMap<>();

    /**
     * 登记投递
     *
     * @param deliveryId 投递ID（消息ID）
     * @param rawDelivery 原始投递
     * @return 登记记录
     */
    public InFlightDelivery track(String deliveryId, Message rawDelivery) {
        InFlightDelivery delivery = new InFlightDelivery(
                deliveryId,
                rawDelivery,
                DeathCountUtil.deathCount(rawDelivery.getMessageProperties()));
        InFlightDelivery previous = deliveries.put(deliveryId, delivery);
        if (previous != null) {
            // 同一messageId重复投递，旧投递不会再被确认，关闭通道后由broker重投
            log.warn("[重复messageId覆盖处理中投递] deliveryId={}, previousDeliveryTag={}",
                     deliveryId, previous.getRawDelivery().getMessageProperties().getDeliveryTag());
        }
        return delivery;
    }

    /**
     * 取出并移除投递
     *
     * @param deliveryId 投递ID
     * @return 登记记录，不存在（未知或已处理）时为空
     */
    public Optional<InFlightDelivery> release(String deliveryId) {
        if (deliveryId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(deliveries.remove(deliveryId));
    }

    public boolean contains(String deliveryId) {
        return deliveryId != null && deliveries.containsKey(deliveryId);
    }

    public int size() {
        return deliveries.size();
    }

    public void clear() {
        deliveries.clear();
    }
}
