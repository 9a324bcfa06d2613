package org.mercury;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.amqp.RabbitAutoConfiguration;

/**
 * 连接工厂由 RabbitBrokerConnector 按 mercury.bus 配置自行创建
 */
@SpringBootApplication(exclude = RabbitAutoConfiguration.class)
public class MercuryBusApplication {

    public static void main(String[] args) {
        SpringApplication.run(MercuryBusApplication.class, args);
    }
}
