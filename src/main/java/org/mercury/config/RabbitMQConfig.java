package org.mercury.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.mercury.broker.BrokerConnector;
import org.mercury.broker.rabbit.RabbitBrokerConnector;
import org.mercury.handler.MessageHandlerRegistry;
import org.mercury.service.IMessageBusService;
import org.mercury.service.impl.MessageBusServiceImpl;
import org.mercury.util.MessageJsonCodec;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * RabbitMQ 消息总线配置
 * - 启动时连接 broker、声明拓扑、订阅已注册主题并开始消费
 * - 关闭时先关通道再关连接
 * - 仅在 mercury.bus.enabled=true 时启用
 */
@Configuration
@EnableConfigurationProperties(MercuryBusProperties.class)
@ConditionalOnProperty(name = "mercury.bus.enabled", havingValue = "true", matchIfMissing = false)
public class RabbitMQConfig {

    @Bean
    @ConditionalOnMissingBean
    public BrokerConnector brokerConnector() {
        return new RabbitBrokerConnector();
    }

    /**
     * 汇总所有 MessageHandlerRegistrar 提供的主题处理器
     */
    @Bean
    @ConditionalOnMissingBean
    public MessageHandlerRegistry messageHandlerRegistry(ObjectProvider<MessageHandlerRegistrar> registrars) {
        MessageHandlerRegistry registry = new MessageHandlerRegistry();
        registrars.orderedStream().forEach(registrar -> registrar.register(registry));
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public MessageJsonCodec messageJsonCodec(ObjectProvider<ObjectMapper> objectMapper) {
        return new MessageJsonCodec(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean(initMethod = "connect", destroyMethod = "disconnect")
    @ConditionalOnMissingBean
    public IMessageBusService messageBusService(MercuryBusProperties properties,
                                                BrokerConnector brokerConnector,
                                                MessageHandlerRegistry messageHandlerRegistry) {
        return new MessageBusServiceImpl(properties, brokerConnector, messageHandlerRegistry, Clock.systemUTC());
    }
}
