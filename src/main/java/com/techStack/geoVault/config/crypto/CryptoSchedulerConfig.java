package com.techStack.geoVault.config.crypto;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Dedicated scheduler for CPU-bound cipher, KEM and KDF work.
 */
@Slf4j
@Configuration
public class CryptoSchedulerConfig {

    @Bean(destroyMethod = "dispose")
    public Scheduler cryptoScheduler(CryptoProperties properties) {
        log.info("🔐 Crypto scheduler: {} threads, queue {}",
                properties.getSchedulerThreads(), properties.getSchedulerQueueSize());
        return Schedulers.newBoundedElastic(
                properties.getSchedulerThreads(),
                properties.getSchedulerQueueSize(),
                "crypto");
    }
}
