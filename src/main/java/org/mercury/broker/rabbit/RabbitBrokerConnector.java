package org.mercury.broker.rabbit;

import lombok.extern.slf4j.Slf4j;
import org.mercury.broker.BrokerConnection;
import org.mercury.broker.BrokerConnector;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory;
import org.springframework.amqp.rabbit.connection.Connection;

/**
 * 基于 Spring AMQP CachingConnectionFactory 的 RabbitMQ 连接器
 * - 每次 connect 创建独立的连接工厂，断开时一并销毁
 * - 不提供自动重连，重连策略由部署层决定
 */
@Slf4j
public class RabbitBrokerConnector implements BrokerConnector {

    @Override
    public BrokerConnection connect(String host, int port, String username, String password) {
        CachingConnectionFactory connectionFactory = new CachingConnectionFactory(host, port);
        connectionFactory.setUsername(username);
        connectionFactory.setPassword(password);
        try {
            Connection connection = connectionFactory.createConnection();
            log.info("[Broker已连接] host={}, port={}, user={}", host, port, username);
            return new RabbitBrokerConnection(connectionFactory, connection);
        } catch (AmqpException e) {
            log.error("[Broker连接失败] host={}, port={}, errorMsg={}", host, port, e.getMessage());
            connectionFactory.destroy();
            throw e;
        }
    }
}
