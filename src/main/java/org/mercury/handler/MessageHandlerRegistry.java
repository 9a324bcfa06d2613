package org.mercury.handler;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 主题处理器注册表
 * - 在配置阶段显式提供 (主题, 处理器) 映射
 * - 同一主题可注册多个处理器，投递时全部调用
 * - 按实例持有，多个总线实例之间互不影响
 */
public class MessageHandlerRegistry {

    private final Map<String, List<MessageHandler>> handlers = Collections.synchronizedMap(new LinkedHashMap<>());

    public MessageHandlerRegistry register(String topic, MessageHandler handler) {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("topic cannot be null or blank");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        handlers.computeIfAbsent(topic, key -> new CopyOnWriteArrayList<>()).add(handler);
        return this;
    }

    public List<MessageHandler> handlersFor(String topic) {
        List<MessageHandler> registered = handlers.get(topic);
        return registered == null ? List.of() : List.copyOf(registered);
    }

    /**
     * 已注册的主题，按注册顺序
     */
    public List<String> topics() {
        synchronized (handlers) {
            return List.copyOf(handlers.keySet());
        }
    }
}
