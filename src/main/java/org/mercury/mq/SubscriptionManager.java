package org.mercury.mq;

import lombok.extern.slf4j.Slf4j;
import org.mercury.broker.BrokerChannel;
import org.mercury.domain.BusTopology;
import org.mercury.exception.TopologyException;
import org.springframework.amqp.AmqpException;

import java.util.Collection;

/**
 * 主题订阅
 * - 订阅即把主队列以主题为 routing key 绑定到服务交换机
 * - 重复绑定在 broker 侧是幂等的
 */
@Slf4j
public class SubscriptionManager {

    private final BrokerChannel channel;
    private final BusTopology topology;

    public SubscriptionManager(BrokerChannel channel, BusTopology topology) {
        this.channel = channel;
        this.topology = topology;
    }

    public void subscribe(String topic) {
        try {
            channel.bindQueue(topology.getPrimaryQueue(), topology.getServiceExchange(), topic);
        } catch (AmqpException e) {
            throw new TopologyException("订阅主题 " + topic + " 失败", e);
        }
        log.info("[订阅主题] topic={}, queue={}, exchange={}",
                 topic, topology.getPrimaryQueue(), topology.getServiceExchange());
    }

    /**
     * 依次订阅，topics 为 null 或为空时什么也不做
     */
    public void subscribeAll(Collection<String> topics) {
        if (topics == null) {
            return;
        }
        for (String topic : topics) {
            subscribe(topic);
        }
    }
}
