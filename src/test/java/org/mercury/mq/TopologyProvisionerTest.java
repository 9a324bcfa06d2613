package org.mercury.mq;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;
import org.mercury.broker.BrokerChannel;
import org.mercury.broker.ExchangeKind;
import org.mercury.domain.BusTopology;
import org.mercury.exception.TopologyException;
import org.mercury.support.InMemoryBrokerChannel;
import org.mockito.InOrder;
import org.springframework.amqp.AmqpException;

import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * 拓扑声明测试
 * - 声明顺序
 * - 重复声明幂等
 * - 冲突声明失败且不继续
 */
@Slf4j
class TopologyProvisionerTest {

    private final BusTopology topology = BusTopology.forService("orders", 30);

    @Test
    void declaresExchangesQueuesThenBindings() {
        BrokerChannel channel = mock(BrokerChannel.class);

        new TopologyProvisioner(channel).provision(topology);

        InOrder order = inOrder(channel);
        order.verify(channel).declareExchange("mercury_bus", ExchangeKind.FANOUT);
        order.verify(channel).declareExchange("orders", ExchangeKind.DIRECT);
        order.verify(channel).declareExchange("orders_dlx", ExchangeKind.FANOUT);
        order.verify(channel).declareQueue("orders_queue", "orders_dlx", Map.of());
        order.verify(channel).declareQueue("orders_queue_retry", "orders", Map.of("x-message-ttl", 30_000));
        order.verify(channel).bindExchange("orders", "mercury_bus", "");
        order.verify(channel).bindQueue("orders_queue_retry", "orders_dlx", "");
        order.verifyNoMoreInteractions();
    }

    @Test
    void provisioningTwiceIsIdempotent() {
        InMemoryBrokerChannel channel = new InMemoryBrokerChannel();
        TopologyProvisioner provisioner = new TopologyProvisioner(channel);

        provisioner.provision(topology);
        channel.bindQueue("orders_queue", "orders", "order.created");
        Set<String> bindingsAfterFirst = channel.getBindings();
        Map<String, Map<String, Object>> queuesAfterFirst = channel.getQueues();

        log.info("====== 重复声明拓扑 ======");
        assertThatCode(() -> provisioner.provision(topology)).doesNotThrowAnyException();

        assertThat(channel.getBindings()).isEqualTo(bindingsAfterFirst);
        assertThat(channel.getQueues()).isEqualTo(queuesAfterFirst);
        assertThat(channel.getQueues().get("orders_queue_retry"))
                .containsEntry("x-dead-letter-exchange", "orders")
                .containsEntry("x-message-ttl", 30_000);
        assertThat(channel.getQueues().get("orders_queue"))
                .containsEntry("x-dead-letter-exchange", "orders_dlx");
    }

    @Test
    void conflictingDeclarationSurfacesTopologyException() {
        InMemoryBrokerChannel channel = new InMemoryBrokerChannel();
        new TopologyProvisioner(channel).provision(topology);

        BusTopology changedDelay = BusTopology.forService("orders", 60);

        assertThatThrownBy(() -> new TopologyProvisioner(channel).provision(changedDelay))
                .isInstanceOf(TopologyException.class)
                .hasMessageContaining("orders_queue_retry")
                .hasCauseInstanceOf(AmqpException.class);
    }

    @Test
    void stopsAtFirstFailedStep() {
        BrokerChannel channel = mock(BrokerChannel.class);
        doThrow(new AmqpException("PRECONDITION_FAILED"))
                .when(channel).declareExchange("orders", ExchangeKind.DIRECT);

        assertThatThrownBy(() -> new TopologyProvisioner(channel).provision(topology))
                .isInstanceOf(TopologyException.class);

        verify(channel, never()).declareQueue(any(), any(), any());
        verify(channel, never()).bindExchange(any(), any(), any());
    }
}
