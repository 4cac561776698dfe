package com.techStack.geoVault.config.integration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.connection.ReactiveRedisConnectionFactory;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;

import java.util.List;

/**
 * Redis Configuration
 *
 * Only active when the security state lives in Redis. The connection factory itself
 * comes from Spring Boot's {@code spring.data.redis.*} auto-configuration.
 */
@Configuration
@Slf4j
@ConditionalOnProperty(name = "security.state-store.type", havingValue = "redis")
public class RedisConfig {

    @Bean
    public ReactiveStringRedisTemplate reactiveStringRedisTemplate(ReactiveRedisConnectionFactory connectionFactory) {
        log.info("⚡ Configuring reactive Redis template for security state");
        return new ReactiveStringRedisTemplate(connectionFactory);
    }

    @Bean
    @SuppressWarnings("rawtypes")
    public RedisScript<List> slidingWindowScript() {
        log.info("📜 Loading sliding window rate limit script");
        return RedisScript.of(new ClassPathResource("scripts/sliding_window.lua"), List.class);
    }
}
