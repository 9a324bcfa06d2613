package org.mercury.domain;

import lombok.Value;
import org.springframework.amqp.core.Message;

/**
 * 处理中的投递
 * - 由 InboundDispatcher 登记，等待唯一一次结果信号后销毁
 * - 只保留原始投递，不保留解析后的应用消息
 */
@Value
public class InFlightDelivery {

    String deliveryId;

    Message rawDelivery;

    /**
     * 已发生的死信次数（x-death 首条记录的 count），无记录为 0
     */
    long retryCountSoFar;
}
