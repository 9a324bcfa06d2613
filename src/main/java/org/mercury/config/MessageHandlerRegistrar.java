package org.mercury.config;

import org.mercury.handler.MessageHandlerRegistry;

/**
 * 处理器注册回调，应用以 Bean 形式提供 (主题, 处理器) 映射
 */
@FunctionalInterface
public interface MessageHandlerRegistrar {

    void register(MessageHandlerRegistry registry);
}
