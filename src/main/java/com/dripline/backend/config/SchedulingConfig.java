package com.dripline.backend.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Processor scheduling, the send executor and the engine clock.
 */
@Configuration
@EnableScheduling
@EnableConfigurationProperties(DripEngineProperties.class)
public class SchedulingConfig {

    // Scheduling, claiming and reconciliation all read "now" from here, in UTC
    @Bean
    public Clock dripClock() {
        return Clock.systemUTC();
    }

    /**
     * Executor that runs provider send calls so the processor can bound each one with a timeout.
     * A full executor rejects the send and the processor retries the message on a later run.
     */
    @Bean(name = "channelSendExecutor")
    public ThreadPoolTaskExecutor channelSendExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(5);
        executor.setMaxPoolSize(20);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("drip-send-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
