package org.mercury.broker;

/**
 * Broker 连接器
 */
public interface BrokerConnector {

    /**
     * 建立到 broker 的连接
     *
     * @param host 主机
     * @param port 端口
     * @param username 用户名
     * @param password 密码
     * @return 已打开的连接
     */
    BrokerConnection connect(String host, int port, String username, String password);
}
