package org.mercury.handler;

import org.mercury.domain.BusMessage;
import org.mercury.mq.OutcomeSignals;

/**
 * 主题消息处理器
 *
 * 处理器必须为每条收到的消息最终发出且仅发出一个结果信号
 * （outcomes.success / outcomes.error），信号可以在任意线程异步发出。
 * 从不发出信号的处理器会让该投递一直留在处理中表里，既不确认也不重试。
 */
@FunctionalInterface
public interface MessageHandler {

    void onMessage(BusMessage message, OutcomeSignals outcomes);
}
