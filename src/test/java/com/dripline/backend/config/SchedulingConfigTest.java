package com.dripline.backend.config;

import org.junit.jupiter.api.Test;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.concurrent.ThreadPoolExecutor;

import static org.assertj.core.api.Assertions.*;

class SchedulingConfigTest {

    private final SchedulingConfig config = new SchedulingConfig();

    @Test
    void dripClock_ShouldBeUtc() {
        Clock clock = config.dripClock();

        assertThat(clock.getZone()).isEqualTo(ZoneOffset.UTC);
    }

    @Test
    void channelSendExecutor_ShouldRejectInsteadOfRunningOnCaller() {
        // Given
        ThreadPoolTaskExecutor executor = config.channelSendExecutor();
        try {
            // Then
            assertThat(executor.getThreadPoolExecutor().getRejectedExecutionHandler())
                    .isInstanceOf(ThreadPoolExecutor.AbortPolicy.class);
            assertThat(executor.getMaxPoolSize()).isEqualTo(20);
            assertThat(executor.getThreadNamePrefix()).isEqualTo("drip-send-");

            executor.shutdown();
            assertThatThrownBy(() -> executor.submit(() -> "late"))
                    .isInstanceOf(TaskRejectedException.class);
        } finally {
            executor.shutdown();
        }
    }
}
