package org.mercury.config;

import lombok.Data;
import org.mercury.mq.OutcomeResolver;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 消息总线配置
 */
@Data
@ConfigurationProperties(prefix = "mercury.bus")
public class MercuryBusProperties {

    /**
     * 是否启用消息总线
     */
    private boolean enabled;

    private String brokerHost = "localhost";

    private int brokerPort = 5672;

    private String brokerUser;

    private String brokerPassword;

    /**
     * 应用标识，写入发布消息的 appId，并用于过滤共享队列上的消息
     */
    private String appName;

    /**
     * 服务名，决定交换机与队列命名
     */
    private String serviceName;

    /**
     * 重试延迟（秒）
     */
    private int retryDelaySeconds;

    /**
     * 默认最大重试次数
     */
    private int maxRetries = OutcomeResolver.DEFAULT_MAX_RETRIES;

    /**
     * 是否按 appId 过滤消息
     */
    private boolean filterMessages = true;
}
