package org.mercury.broker.rabbit;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Consumer;
import com.rabbitmq.client.ConnectionFactory;
import org.junit.jupiter.api.Test;
import org.mercury.broker.BrokerChannel;
import org.mockito.InOrder;
import org.springframework.amqp.AmqpConnectException;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory;
import org.springframework.amqp.rabbit.connection.Connection;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RabbitBrokerConnectionTest {

    private final CachingConnectionFactory connectionFactory = mock(CachingConnectionFactory.class);
    private final Connection connection = mock(Connection.class);
    private final RabbitBrokerConnection brokerConnection = new RabbitBrokerConnection(connectionFactory, connection);

    @Test
    void createsNonTransactionalChannel() {
        Channel rabbitChannel = mock(Channel.class);
        when(connection.createChannel(false)).thenReturn(rabbitChannel);
        when(rabbitChannel.isOpen()).thenReturn(true);

        BrokerChannel channel = brokerConnection.createChannel();

        assertThat(channel).isInstanceOf(RabbitBrokerChannel.class);
        assertThat(channel.isOpen()).isTrue();
    }

    @Test
    void closeReleasesConnectionThenDestroysFactory() {
        brokerConnection.close();

        InOrder order = inOrder(connection, connectionFactory);
        order.verify(connection).close();
        order.verify(connectionFactory).destroy();
    }

    @Test
    void factoryIsDestroyedEvenWhenCloseFails() {
        doThrow(new AmqpException("close failed")).when(connection).close();

        assertThatThrownBy(brokerConnection::close).isInstanceOf(AmqpException.class);

        verify(connectionFactory).destroy();
    }

    /**
     * 缓存连接工厂上的通道关闭必须取消消费者并物理关闭，而不是归还缓存
     */
    @Test
    void closingCachedChannelDetachesConsumerPhysically() throws Exception {
        ConnectionFactory rabbitFactory = mock(ConnectionFactory.class);
        com.rabbitmq.client.Connection physicalConnection = mock(com.rabbitmq.client.Connection.class);
        Channel physicalChannel = mock(Channel.class);
        AtomicBoolean channelOpen = new AtomicBoolean(true);

        when(rabbitFactory.newConnection((ExecutorService) any(), (String) any())).thenReturn(physicalConnection);
        when(physicalConnection.isOpen()).thenReturn(true);
        when(physicalConnection.createChannel()).thenReturn(physicalChannel);
        when(physicalChannel.isOpen()).thenAnswer(invocation -> channelOpen.get());
        when(physicalChannel.basicConsume(anyString(), anyBoolean(), any(Consumer.class))).thenReturn("ctag-1");
        doAnswer(invocation -> {
            channelOpen.set(false);
            return null;
        }).when(physicalChannel).close();

        CachingConnectionFactory cachingFactory = new CachingConnectionFactory(rabbitFactory);
        RabbitBrokerConnection cached = new RabbitBrokerConnection(cachingFactory, cachingFactory.createConnection());
        BrokerChannel channel = cached.createChannel();
        channel.consume("orders_queue", delivery -> { });

        channel.close();

        InOrder order = inOrder(physicalChannel);
        order.verify(physicalChannel).basicCancel("ctag-1");
        order.verify(physicalChannel).close();
        assertThat(channel.isOpen()).isFalse();

        cached.close();
    }

    @Test
    void unreachableBrokerFailsToConnect() {
        RabbitBrokerConnector connector = new RabbitBrokerConnector();

        assertThatThrownBy(() -> connector.connect("127.0.0.1", 1, "guest", "guest"))
                .isInstanceOf(AmqpConnectException.class);
    }
}
