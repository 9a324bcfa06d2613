package org.mercury.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.mercury.domain.BusMessage;
import org.mercury.exception.MessageBusException;

import java.io.IOException;
import java.util.UUID;

/**
 * JSON 消息编解码
 * - 使用 Jackson 序列化消息体
 * - 新消息生成 UUID 作为消息ID
 * - 派生消息自动记录父消息ID
 */
public class MessageJsonCodec {

    private final ObjectMapper objectMapper;

    public MessageJsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * 创建新消息
     *
     * @param descriptor 主题
     * @param payload 消息内容
     * @return 应用消息
     */
    public BusMessage create(String descriptor, Object payload) {
        return create(descriptor, payload, null);
    }

    /**
     * 创建由 parent 派生的消息
     */
    public BusMessage createChild(BusMessage parent, String descriptor, Object payload) {
        return create(descriptor, payload, parent.getMessageId());
    }

    public BusMessage create(String descriptor, Object payload, String parentMessageId) {
        try {
            return BusMessage.builder()
                    .descriptor(descriptor)
                    .body(objectMapper.writeValueAsBytes(payload))
                    .messageId(UUID.randomUUID().toString())
                    .timestamp(System.currentTimeMillis())
                    .parentMessageId(parentMessageId)
                    .build();
        } catch (JsonProcessingException e) {
            throw new MessageBusException("消息序列化失败: descriptor=" + descriptor, e);
        }
    }

    /**
     * 反序列化消息体
     */
    public <T> T read(BusMessage message, Class<T> type) {
        try {
            return objectMapper.readValue(message.getBody(), type);
        } catch (IOException e) {
            throw new MessageBusException("消息反序列化失败: messageId=" + message.getMessageId(), e);
        }
    }
}
