package com.quasar.relayservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * relay-service 启动入口。
 * 通过 @ConfigurationPropertiesScan 启用 quasar.* 配置绑定。
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class RelayServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(RelayServiceApplication.class, args);
    }
}
