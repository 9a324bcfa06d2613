package org.mercury.broker.rabbit;

import org.mercury.broker.BrokerChannel;
import org.mercury.broker.BrokerConnection;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory;
import org.springframework.amqp.rabbit.connection.Connection;

/**
 * RabbitMQ 连接
 */
public class RabbitBrokerConnection implements BrokerConnection {

    private final CachingConnectionFactory connectionFactory;
    private final Connection connection;

    public RabbitBrokerConnection(CachingConnectionFactory connectionFactory, Connection connection) {
        this.connectionFactory = connectionFactory;
        this.connection = connection;
    }

    @Override
    public BrokerChannel createChannel() {
        return new RabbitBrokerChannel(connection.createChannel(false));
    }

    @Override
    public boolean isOpen() {
        return connection.isOpen();
    }

    /**
     * 共享连接的 close 只归还缓存，物理关闭由 destroy 完成
     */
    @Override
    public void close() {
        try {
            connection.close();
        } finally {
            connectionFactory.destroy();
        }
    }
}
