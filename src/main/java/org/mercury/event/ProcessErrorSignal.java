package org.mercury.event;

import lombok.Value;

/**
 * 消息处理失败
 * - maxRetries 为空或不大于 0 时使用配置的默认上限
 */
@Value
public class ProcessErrorSignal implements OutcomeSignal {

    String deliveryId;

    Throwable cause;

    Integer maxRetries;
}
