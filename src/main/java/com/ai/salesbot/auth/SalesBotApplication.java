package com.ai.salesbot.auth;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@SpringBootApplication(scanBasePackages = "com.ai.salesbot")
@EnableJpaRepositories(basePackages = "com.ai.salesbot.repository")
@EntityScan(basePackages = "com.ai.salesbot.entity")
public class SalesBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(SalesBotApplication.class, args);
    }
}
