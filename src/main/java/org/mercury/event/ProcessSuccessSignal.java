package org.mercury.event;

import lombok.Value;
import org.mercury.domain.BusMessage;

import java.util.List;

/**
 * 消息处理成功
 * - 确认原始投递
 * - resultingMessages 为处理过程中产生的后续消息，逐条发布
 */
@Value
public class ProcessSuccessSignal implements OutcomeSignal {

    String deliveryId;

    List<BusMessage> resultingMessages;

    public ProcessSuccessSignal(String deliveryId, List<BusMessage> resultingMessages) {
        this.deliveryId = deliveryId;
        this.resultingMessages = resultingMessages == null ? List.of() : List.copyOf(resultingMessages);
    }
}
