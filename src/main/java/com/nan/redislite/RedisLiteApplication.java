package com.nan.redislite;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

import com.nan.redislite.config.RedisLiteProperties;

@SpringBootApplication
@EnableConfigurationProperties(RedisLiteProperties.class)
public class RedisLiteApplication {

    public static void main(String[] args) {
        SpringApplication.run(RedisLiteApplication.class, args);
    }
}
