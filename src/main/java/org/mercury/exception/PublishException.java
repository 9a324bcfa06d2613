package org.mercury.exception;

import lombok.Getter;

/**
 * 消息发布失败，同步抛给调用方，不重试
 */
@Getter
public class PublishException extends MessageBusException {

    private final String exchange;
    private final String messageId;

    public PublishException(String exchange, String messageId, Throwable cause) {
        super("发布消息失败: exchange=" + exchange + ", messageId=" + messageId, cause);
        this.exchange = exchange;
        this.messageId = messageId;
    }
}
