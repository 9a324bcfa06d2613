package org.mercury.service;

import org.mercury.domain.BusMessage;
import org.mercury.domain.BusTopology;
import org.mercury.mq.OutcomeSignals;

import java.util.Collection;

/**
 * 消息总线服务接口
 */
public interface IMessageBusService {

    /**
     * 连接 broker，声明拓扑，订阅已注册主题并开始消费
     */
    void connect();

    /**
     * 先关闭通道再关闭连接，已关闭的资源会被跳过
     */
    void disconnect();

    boolean isConnected();

    /**
     * 发布到全局广播交换机
     *
     * @param message 应用消息
     */
    void publish(BusMessage message);

    /**
     * 发布到指定交换机
     *
     * @param message 应用消息
     * @param alternativeExchange 目标交换机，为空时使用全局广播交换机
     */
    void publish(BusMessage message, String alternativeExchange);

    void subscribe(String topic);

    /**
     * 依次订阅，null 或空集合不做任何事
     */
    void subscribeAll(Collection<String> topics);

    /**
     * 本实例的结果信号通道
     */
    OutcomeSignals outcomes();

    /**
     * 当前处理中的投递数
     */
    int inFlightCount();

    BusTopology topology();
}
