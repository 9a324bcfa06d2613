package org.mercury.domain;

import lombok.Builder;
import lombok.Value;

/**
 * 服务拓扑描述
 *
 * 命名规则必须与已部署的服务保持一致：
 * - 服务交换机：serviceName（direct）
 * - 死信交换机：serviceName_dlx（fanout）
 * - 主队列：serviceName_queue，死信指向死信交换机
 * - 重试队列：serviceName_queue_retry，死信指向服务交换机，TTL = retryDelaySeconds
 * - 全局广播交换机：mercury_bus（fanout），所有服务共享
 */
@Value
@Builder
public class BusTopology {

    /**
     * 全局广播交换机名
     */
    public static final String MAIN_BUS_EXCHANGE = "mercury_bus";

    /**
     * x-message-ttl 为 32 位毫秒值，延迟秒数不能超过该上限
     */
    public static final int MAX_RETRY_DELAY_SECONDS = Integer.MAX_VALUE / 1000;

    String serviceExchange;

    String deadLetterExchange;

    String mainBusExchange;

    String primaryQueue;

    String retryQueue;

    int retryDelaySeconds;

    public static BusTopology forService(String serviceName, int retryDelaySeconds) {
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName cannot be null or blank");
        }
        if (retryDelaySeconds < 0) {
            throw new IllegalArgumentException("retryDelaySeconds must be non-negative (current: " + retryDelaySeconds + ")");
        }
        if (retryDelaySeconds > MAX_RETRY_DELAY_SECONDS) {
            throw new IllegalArgumentException("retryDelaySeconds must not exceed " + MAX_RETRY_DELAY_SECONDS
                                               + " (current: " + retryDelaySeconds + ")");
        }
        String primaryQueue = serviceName + "_queue";
        return BusTopology.builder()
                .serviceExchange(serviceName)
                .deadLetterExchange(serviceName + "_dlx")
                .mainBusExchange(MAIN_BUS_EXCHANGE)
                .primaryQueue(primaryQueue)
                .retryQueue(primaryQueue + "_retry")
                .retryDelaySeconds(retryDelaySeconds)
                .build();
    }

    /**
     * 重试队列的 x-message-ttl（毫秒）
     */
    public int retryDelayMillis() {
        return Math.multiplyExact(retryDelaySeconds, 1000);
    }
}
