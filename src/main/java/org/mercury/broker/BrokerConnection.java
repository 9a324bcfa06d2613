package org.mercury.broker;

/**
 * Broker 连接
 */
public interface BrokerConnection {

    BrokerChannel createChannel();

    boolean isOpen();

    void close();
}
