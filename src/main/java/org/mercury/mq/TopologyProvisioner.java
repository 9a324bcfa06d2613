package org.mercury.mq;

import lombok.extern.slf4j.Slf4j;
import org.mercury.broker.BrokerChannel;
import org.mercury.broker.ExchangeKind;
import org.mercury.domain.BusTopology;
import org.mercury.exception.TopologyException;
import org.springframework.amqp.AmqpException;

import java.util.Map;

/**
 * 拓扑声明
 *
 * 声明顺序：
 * 1. 交换机：全局广播（fanout）、服务（direct）、死信（fanout）
 * 2. 主队列：死信 -> 死信交换机
 * 3. 重试队列：死信 -> 服务交换机，TTL 到期后回到主队列
 * 4. 绑定：全局广播 -> 服务交换机，死信交换机 -> 重试队列
 *
 * 重复声明相同拓扑是幂等的；与已存在拓扑冲突时抛出 TopologyException，不重试。
 */
@Slf4j
public class TopologyProvisioner {

    static final String MESSAGE_TTL_ARGUMENT = "x-message-ttl";

    private final BrokerChannel channel;

    public TopologyProvisioner(BrokerChannel channel) {
        this.channel = channel;
    }

    public void provision(BusTopology topology) {
        log.info("[开始声明拓扑] serviceExchange={}, primaryQueue={}, retryQueue={}, retryDelaySeconds={}",
                 topology.getServiceExchange(), topology.getPrimaryQueue(),
                 topology.getRetryQueue(), topology.getRetryDelaySeconds());

        // ==================== 1. 交换机 ====================
        step("声明交换机 " + topology.getMainBusExchange(),
             () -> channel.declareExchange(topology.getMainBusExchange(), ExchangeKind.FANOUT));
        step("声明交换机 " + topology.getServiceExchange(),
             () -> channel.declareExchange(topology.getServiceExchange(), ExchangeKind.DIRECT));
        step("声明交换机 " + topology.getDeadLetterExchange(),
             () -> channel.declareExchange(topology.getDeadLetterExchange(), ExchangeKind.FANOUT));

        // ==================== 2. 队列 ====================
        step("声明队列 " + topology.getPrimaryQueue(),
             () -> channel.declareQueue(topology.getPrimaryQueue(), topology.getDeadLetterExchange(), Map.of()));
        // 重试队列的死信目标是服务交换机，必须在其之后声明
        step("声明队列 " + topology.getRetryQueue(),
             () -> channel.declareQueue(topology.getRetryQueue(), topology.getServiceExchange(),
                                        Map.of(MESSAGE_TTL_ARGUMENT, topology.retryDelayMillis())));

        // ==================== 3. 绑定 ====================
        step("绑定 " + topology.getServiceExchange() + " <- " + topology.getMainBusExchange(),
             () -> channel.bindExchange(topology.getServiceExchange(), topology.getMainBusExchange(), ""));
        step("绑定 " + topology.getRetryQueue() + " <- " + topology.getDeadLetterExchange(),
             () -> channel.bindQueue(topology.getRetryQueue(), topology.getDeadLetterExchange(), ""));

        log.info("[拓扑声明完成] serviceExchange={}", topology.getServiceExchange());
    }

    private void step(String description, Runnable action) {
        try {
            action.run();
        } catch (AmqpException e) {
            log.error("[拓扑声明失败] step={}, errorMsg={}", description, e.getMessage());
            throw new TopologyException(description + " 失败", e);
        }
    }
}
