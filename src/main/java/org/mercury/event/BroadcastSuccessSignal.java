package org.mercury.event;

import lombok.Value;
import org.mercury.domain.BusMessage;

import java.util.List;

/**
 * 非消息驱动的处理成功（定时任务、内部触发等），没有需要确认的投递
 */
@Value
public class BroadcastSuccessSignal implements OutcomeSignal {

    List<BusMessage> resultingMessages;

    public BroadcastSuccessSignal(List<BusMessage> resultingMessages) {
        this.resultingMessages = resultingMessages == null ? List.of() : List.copyOf(resultingMessages);
    }
}
