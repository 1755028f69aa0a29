package com.fractionax.propertyEngine.config;

import com.fractionax.propertyEngine.cache.ResponseCache;
import com.fractionax.propertyEngine.orchestrator.concurrent.MdcAwareExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared engine state: clock, response cache and the provider-call executor.
 */
@Slf4j
@Configuration
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdown")
    public ResponseCache responseCache(@Value("${engine.cache.maximum-size:10000}") long maximumSize, Clock clock) {
        log.info("Response cache created - maximumSize: {}", maximumSize);
        return new ResponseCache(maximumSize, clock);
    }

    @Bean(name = "providerExecutor", destroyMethod = "shutdown")
    public MdcAwareExecutor providerExecutor(@Value("${engine.executor.pool-size:16}") int poolSize) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "provider-call-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        log.info("Provider executor created - poolSize: {}", poolSize);
        return new MdcAwareExecutor(Executors.newFixedThreadPool(poolSize, threadFactory));
    }
}
