package org.mercury.exception;

/**
 * 拓扑声明失败
 * - 通常是与已部署拓扑的配置冲突，不重试
 */
public class TopologyException extends MessageBusException {

    public TopologyException(String message, Throwable cause) {
        super(message, cause);
    }
}
