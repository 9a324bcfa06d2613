package org.mercury.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 应用消息
 * - descriptor 即主题，也是发布时的 routing key
 * - body 为已序列化的消息体
 * - parentMessageId 记录派生关系，仅用于追踪
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BusMessage {

    /**
     * 主题
     */
    private String descriptor;

    /**
     * 序列化后的消息体
     */
    private byte[] body;

    /**
     * 消息ID（唯一）
     */
    private String messageId;

    /**
     * 时间戳（毫秒），接收时由 broker 属性填充
     */
    private Long timestamp;

    /**
     * 父消息ID
     */
    private String parentMessageId;
}
