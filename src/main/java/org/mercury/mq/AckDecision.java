package org.mercury.mq;

/**
 * 结果信号处理后的确认决定
 */
public enum AckDecision {

    /**
     * 已确认
     */
    ACKNOWLEDGED,

    /**
     * 已拒绝，经死信交换机进入重试队列
     */
    REQUEUED_FOR_RETRY,

    /**
     * 重试次数耗尽，已确认并永久丢弃
     */
    DROPPED_RETRIES_EXHAUSTED,

    /**
     * 投递不存在或已处理，忽略
     */
    UNKNOWN_DELIVERY,

    /**
     * 确认或拒绝未送达 broker（通道已失效），投递已移出处理中表，通道关闭后由 broker 重投
     */
    ACK_FAILED,

    /**
     * 广播成功信号，没有需要确认的投递
     */
    NO_DELIVERY
}
