package com.dripline.backend.services.drip;

import com.dripline.backend.config.DripEngineProperties;
import com.dripline.backend.enums.Channel;
import com.dripline.backend.enums.JourneyStatus;
import com.dripline.backend.enums.MessageStatus;
import com.dripline.backend.models.drip.DripCampaign;
import com.dripline.backend.models.drip.DripMessage;
import com.dripline.backend.models.drip.LeadJourney;
import com.dripline.backend.repositories.drip.DripCampaignRepository;
import com.dripline.backend.repositories.drip.DripMessageRepository;
import com.dripline.backend.repositories.drip.LeadJourneyRepository;
import com.dripline.backend.util.CorrelationIds;
import com.dripline.backend.services.channel.ChannelAdapter;
import com.dripline.backend.services.channel.ChannelAdapterRegistry;
import com.dripline.backend.services.channel.OutboundMessage;
import com.dripline.backend.services.channel.SendResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static com.dripline.backend.util.ContactMasking.mask;

/**
 * DripMessageProcessor
 *
 * Batch job that sends due drip messages. Each run walks the channels in turn; for each channel it
 * selects due pending messages of active journeys, claims them one by one with a conditional
 * PENDING -> QUEUED update, sends through the channel adapter and records the result.
 * <p>
 * A message whose claim affects no row belongs to a concurrent run and is skipped. Failures of a
 * single message are recorded on that message and its journey only; a {@link DataAccessException}
 * aborts the whole run.
 */
@Service
@Slf4j
public class DripMessageProcessor {

    private final DripMessageRepository messageRepository;
    private final LeadJourneyRepository journeyRepository;
    private final DripCampaignRepository campaignRepository;
    private final ChannelAdapterRegistry adapterRegistry;
    private final DripSchedulerService schedulerService;
    private final BackoffPolicy backoffPolicy;
    private final DripEngineProperties properties;
    private final AsyncTaskExecutor sendExecutor;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public DripMessageProcessor(DripMessageRepository messageRepository,
                                LeadJourneyRepository journeyRepository,
                                DripCampaignRepository campaignRepository,
                                ChannelAdapterRegistry adapterRegistry,
                                DripSchedulerService schedulerService,
                                BackoffPolicy backoffPolicy,
                                DripEngineProperties properties,
                                @Qualifier("channelSendExecutor") AsyncTaskExecutor sendExecutor,
                                MeterRegistry meterRegistry,
                                Clock clock) {
        this.messageRepository = messageRepository;
        this.journeyRepository = journeyRepository;
        this.campaignRepository = campaignRepository;
        this.adapterRegistry = adapterRegistry;
        this.schedulerService = schedulerService;
        this.backoffPolicy = backoffPolicy;
        this.properties = properties;
        this.sendExecutor = sendExecutor;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    enum MessageOutcome {
        SENT, FAILED, RETRIED, SKIPPED
    }

    // =========================
    // RUN
    // =========================

    @Scheduled(cron = "${drip.processor.cron:0 * * * * *}")
    public void runScheduled() {
        try {
            processPendingMessages();
        } catch (DataAccessException e) {
            log.error("Drip processor run aborted, persistence unavailable: {}", e.getMessage(), e);
            Counter.builder("drip.processor.runs.aborted")
                    .description("Processor runs aborted by persistence errors")
                    .register(meterRegistry)
                    .increment();
        }
    }

    /**
     * Process one batch of due messages per channel.
     *
     * @throws DataAccessException if persistence becomes unavailable mid-run
     */
    public ProcessorRunSummary processPendingMessages() {
        Timer.Sample sample = Timer.start(meterRegistry);
        long startNanos = System.nanoTime();
        Map<Channel, ProcessorRunSummary.ChannelCounts> counts = new EnumMap<>(Channel.class);

        Channel[] channels = Channel.values();
        for (int i = 0; i < channels.length; i++) {
            counts.put(channels[i], processChannel(channels[i]));

            if (i < channels.length - 1 && !pauseBetweenBatches()) {
                log.warn("Drip processor interrupted between channel batches, ending run early");
                break;
            }
        }

        sample.stop(Timer.builder("drip.processor.run.duration")
                .description("Duration of a drip processor run")
                .register(meterRegistry));

        ProcessorRunSummary summary = new ProcessorRunSummary(counts, Duration.ofNanos(System.nanoTime() - startNanos));
        if (summary.totalSent() + summary.totalFailed() + summary.totalRetried() + summary.totalSkipped() > 0) {
            log.info("Drip processor run: sent={}, failed={}, retried={}, skipped={} in {}ms",
                    summary.totalSent(), summary.totalFailed(), summary.totalRetried(), summary.totalSkipped(),
                    summary.duration().toMillis());
        } else {
            log.debug("Drip processor run found no due messages");
        }
        return summary;
    }

    private ProcessorRunSummary.ChannelCounts processChannel(Channel channel) {
        ChannelAdapter adapter = adapterRegistry.forChannel(channel);
        List<DripMessage> due = messageRepository.findDueMessages(channel, MessageStatus.PENDING, JourneyStatus.ACTIVE,
                now(), PageRequest.of(0, properties.processor().batchSize()));

        int sent = 0;
        int failed = 0;
        int retried = 0;
        int skipped = 0;

        for (DripMessage message : due) {
            MessageOutcome outcome;
            try {
                outcome = processMessage(message, adapter);
            } catch (DataAccessException e) {
                throw e;
            } catch (RuntimeException e) {
                log.error("Unexpected error processing drip message {}: {}", message.getId(), e.getMessage(), e);
                outcome = MessageOutcome.FAILED;
            }

            switch (outcome) {
                case SENT -> sent++;
                case FAILED -> failed++;
                case RETRIED -> retried++;
                case SKIPPED -> skipped++;
            }

            Counter.builder("drip.processor.messages")
                    .description("Drip messages handled by the processor")
                    .tag("channel", channel.name())
                    .tag("outcome", outcome.name().toLowerCase())
                    .register(meterRegistry)
                    .increment();
        }

        return new ProcessorRunSummary.ChannelCounts(due.size(), sent, failed, retried, skipped);
    }

    private boolean pauseBetweenBatches() {
        Duration batchDelay = properties.processor().batchDelay();
        if (batchDelay == null || batchDelay.isZero() || batchDelay.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(batchDelay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    // =========================
    // MESSAGE
    // =========================

    MessageOutcome processMessage(DripMessage message, ChannelAdapter adapter) {
        Long messageId = message.getId();

        if (messageRepository.claim(messageId, MessageStatus.PENDING, MessageStatus.QUEUED, JourneyStatus.ACTIVE, now()) == 0) {
            log.debug("Drip message {} already claimed or its journey is no longer active", messageId);
            return MessageOutcome.SKIPPED;
        }

        if (!adapter.validate(message.getRecipient())) {
            String error = "Invalid " + message.getChannel().getDisplayName() + " recipient address";
            log.warn("Drip message {} has an invalid recipient {}, failing without retry",
                    messageId, mask(message.getChannel(), message.getRecipient()));
            failTerminally(message, message.getAttemptCount(), error);
            return MessageOutcome.FAILED;
        }

        SendResult result = sendWithTimeout(adapter, message);

        if (result.success()) {
            recordSent(message, result.providerMessageId());
            return MessageOutcome.SENT;
        }

        int attempts = message.getAttemptCount();
        int maxRetries = properties.processor().maxRetries();

        if (result.retryable() && attempts < maxRetries) {
            int attempt = attempts + 1;
            OffsetDateTime now = now();
            OffsetDateTime retryAt = now.plus(backoffPolicy.delayForAttempt(attempt));
            messageRepository.requeue(messageId, attempt, retryAt, result.error(),
                    MessageStatus.QUEUED, MessageStatus.PENDING, now);
            log.warn("Drip message {} failed (attempt {} of {}), retrying at {}: {}",
                    messageId, attempt, maxRetries, retryAt, result.error());
            return MessageOutcome.RETRIED;
        }

        log.warn("Drip message {} failed permanently after {} attempt(s): {}", messageId, attempts + 1, result.error());
        failTerminally(message, attempts + 1, result.error());
        return MessageOutcome.FAILED;
    }

    private SendResult sendWithTimeout(ChannelAdapter adapter, DripMessage message) {
        OutboundMessage outbound = new OutboundMessage(message.getRecipient(), message.getSubject(),
                message.getContent(), CorrelationIds.forMessage(message.getId()),
                message.getTemplateId(), message.getTemplateData());
        Duration timeout = properties.processor().sendTimeout();

        Future<SendResult> future;
        try {
            future = sendExecutor.submit(() -> adapter.send(outbound));
        } catch (RejectedExecutionException e) {
            log.warn("Send executor saturated, deferring drip message {}", message.getId());
            return SendResult.retryableFailure("Send executor saturated");
        }

        try {
            SendResult result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return result != null ? result : SendResult.retryableFailure("Channel adapter returned no result");
        } catch (TimeoutException e) {
            // Interrupts the worker thread blocked in the provider call
            future.cancel(true);
            log.warn("Send of drip message {} timed out after {}ms", message.getId(), timeout.toMillis());
            return SendResult.retryableFailure("Send timed out after " + timeout.toMillis() + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Channel adapter threw sending drip message {}: {}", message.getId(), cause.getMessage());
            return SendResult.retryableFailure("Channel adapter error: " + cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return SendResult.retryableFailure("Send interrupted");
        }
    }

    // =========================
    // OUTCOMES
    // =========================

    private void recordSent(DripMessage message, String providerMessageId) {
        OffsetDateTime sentAt = now();
        if (messageRepository.markSent(message.getId(), providerMessageId, MessageStatus.QUEUED, MessageStatus.SENT, sentAt) == 0) {
            if (messageRepository.recordAcceptance(message.getId(), providerMessageId,
                    MessageStatus.callbackStatuses(), sentAt) == 0) {
                log.warn("Drip message {} was no longer queued when its send completed", message.getId());
                return;
            }
            log.info("Drip message {} already reported by a delivery callback, recording provider id {}",
                    message.getId(), providerMessageId);
        }

        if (message.getChannel().isSms()) {
            journeyRepository.incrementSmsSent(message.getJourneyId(), sentAt);
        } else {
            journeyRepository.incrementEmailsSent(message.getJourneyId(), sentAt);
        }

        log.info("Drip message {} (journey {}, step {}) sent to {}",
                message.getId(), message.getJourneyId(), message.getStepNumber(),
                mask(message.getChannel(), message.getRecipient()));

        advanceJourney(message, sentAt);
    }

    private void failTerminally(DripMessage message, int attemptCount, String error) {
        OffsetDateTime now = now();
        MessageStatus terminalStatus = message.getChannel().terminalFailureStatus();

        if (messageRepository.markFailed(message.getId(), terminalStatus, attemptCount, error, MessageStatus.QUEUED, now) == 0) {
            log.warn("Drip message {} was no longer queued when marking it {}", message.getId(), terminalStatus);
            return;
        }

        Long journeyId = message.getJourneyId();
        LeadJourney journey = journeyRepository.findById(journeyId).orElse(null);
        if (journey == null) {
            log.warn("Journey {} of failed drip message {} no longer exists", journeyId, message.getId());
            return;
        }

        DripCampaign campaign = campaignRepository.findById(journey.getCampaignId()).orElse(null);
        if (campaign != null && campaign.skipsFailedSteps()) {
            log.info("Skipping failed step {} of journey {}", message.getStepNumber(), journeyId);
            advanceJourney(message, now);
            return;
        }

        int updated = journeyRepository.transitionStatus(journeyId,
                EnumSet.of(JourneyStatus.ACTIVE, JourneyStatus.PAUSED), JourneyStatus.FAILED, now);
        if (updated > 0) {
            log.warn("Journey {} failed at step {}: {}", journeyId, message.getStepNumber(), error);
        }
    }

    private void advanceJourney(DripMessage message, OffsetDateTime stepCompletedAt) {
        Long journeyId = message.getJourneyId();
        int stepNumber = message.getStepNumber();

        if (journeyRepository.advanceStep(journeyId, stepNumber - 1, stepNumber, now()) == 0) {
            log.warn("Journey {} was not at step {} when completing step {}, leaving it as is",
                    journeyId, stepNumber - 1, stepNumber);
            return;
        }

        LeadJourney journey = journeyRepository.findById(journeyId).orElse(null);
        if (journey == null || journey.getStatus().isFinished()) {
            return;
        }

        ScheduleOutcome outcome = schedulerService.scheduleNextStep(journey, stepCompletedAt);
        if (outcome.isJourneyCompleted()) {
            log.info("Journey {} finished after step {}", journeyId, stepNumber);
        }
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}
