package com.dripline.backend.support;

import com.dripline.backend.config.DripEngineProperties;
import com.dripline.backend.config.JacksonConfig;
import com.dripline.backend.enums.Channel;
import com.dripline.backend.services.channel.ChannelAdapterRegistry;
import com.dripline.backend.services.drip.DripCampaignService;
import com.dripline.backend.services.drip.DripMessageProcessor;
import com.dripline.backend.services.drip.DripSchedulerService;
import com.dripline.backend.services.drip.DripTemplateRenderer;
import com.dripline.backend.services.drip.ExponentialBackoffPolicy;
import com.dripline.backend.services.webhook.DripWebhookReconciler;
import com.dripline.backend.services.webhook.SendGridWebhookHandler;
import com.dripline.backend.services.webhook.TwilioWebhookHandler;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.support.TaskExecutorAdapter;

import java.time.Duration;
import java.time.Instant;
import java.util.regex.Pattern;

/**
 * Wires the drip engine on top of a JPA slice with a hand-driven clock and fake channel adapters.
 */
@TestConfiguration
@Import({
        JacksonConfig.class,
        DripTemplateRenderer.class,
        DripSchedulerService.class,
        DripMessageProcessor.class,
        DripCampaignService.class,
        ExponentialBackoffPolicy.class,
        ChannelAdapterRegistry.class,
        DripWebhookReconciler.class,
        TwilioWebhookHandler.class,
        SendGridWebhookHandler.class
})
public class TestDripConfig {

    public static final Instant START = Instant.parse("2026-03-02T09:00:00Z");

    private static final Pattern E164 = Pattern.compile("^\\+[1-9]\\d{1,14}$");
    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");

    @Bean
    public MutableClock testClock() {
        return new MutableClock(START);
    }

    @Bean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public DripEngineProperties dripEngineProperties() {
        return new DripEngineProperties(
                new DripEngineProperties.Processor(50, 3, Duration.ofSeconds(5), Duration.ZERO),
                new DripEngineProperties.Backoff(Duration.ofMinutes(1), Duration.ofHours(1)),
                new DripEngineProperties.Webhook(true, EventWebhookSigner.shared().publicKey(), ""));
    }

    // Sends run on the calling thread so fake adapters see the processor's transaction state
    @Bean(name = "channelSendExecutor")
    public AsyncTaskExecutor channelSendExecutor() {
        return new TaskExecutorAdapter(Runnable::run);
    }

    @Bean
    public FakeChannelAdapter fakeSmsAdapter() {
        return new FakeChannelAdapter(Channel.SMS, address -> address != null && E164.matcher(address).matches(), "SM");
    }

    @Bean
    public FakeChannelAdapter fakeEmailAdapter() {
        return new FakeChannelAdapter(Channel.EMAIL, address -> address != null && EMAIL.matcher(address).matches(), "sg-");
    }
}
