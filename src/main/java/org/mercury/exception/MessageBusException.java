package org.mercury.exception;

/**
 * 消息总线异常基类
 */
public class MessageBusException extends RuntimeException {

    public MessageBusException(String message) {
        super(message);
    }

    public MessageBusException(String message, Throwable cause) {
        super(message, cause);
    }
}
