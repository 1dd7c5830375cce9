package com.dripline.backend.services.webhook;

import com.dripline.backend.enums.Channel;
import com.dripline.backend.enums.DeliveryEventType;
import com.dripline.backend.enums.JourneyStatus;
import com.dripline.backend.enums.MessageStatus;
import com.dripline.backend.exceptions.WebhookVerificationException;
import com.dripline.backend.models.drip.DripCampaign;
import com.dripline.backend.models.drip.DripMessage;
import com.dripline.backend.models.drip.LeadJourney;
import com.dripline.backend.repositories.drip.DripCampaignRepository;
import com.dripline.backend.repositories.drip.DripMessageRepository;
import com.dripline.backend.repositories.drip.LeadJourneyRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.persistence.EntityNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * DripWebhookReconciler
 *
 * Applies provider delivery callbacks to drip messages. Status only moves forward
 * (SENT -> DELIVERED -> OPENED -> CLICKED, or SENT -> FAILED/BOUNCED), so duplicate and
 * out-of-order callbacks are no-ops. Messages are found by provider id, or by our own id echoed
 * back by the provider when the callback arrives before the send response was recorded. A failure reported here is recorded on the message only and
 * never sends it back through the processor's retry path.
 */
@Service
@Slf4j
public class DripWebhookReconciler {

    private final Map<Channel, ProviderWebhookHandler> handlers = new EnumMap<>(Channel.class);
    private final DripMessageRepository messageRepository;
    private final LeadJourneyRepository journeyRepository;
    private final DripCampaignRepository campaignRepository;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public DripWebhookReconciler(List<ProviderWebhookHandler> webhookHandlers,
                                 DripMessageRepository messageRepository,
                                 LeadJourneyRepository journeyRepository,
                                 DripCampaignRepository campaignRepository,
                                 MeterRegistry meterRegistry,
                                 Clock clock) {
        for (ProviderWebhookHandler handler : webhookHandlers) {
            handlers.put(handler.channel(), handler);
        }
        this.messageRepository = messageRepository;
        this.journeyRepository = journeyRepository;
        this.campaignRepository = campaignRepository;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    /**
     * Verify, parse and apply one provider callback.
     *
     * @throws WebhookVerificationException if the callback fails its authenticity check
     * @throws com.dripline.backend.exceptions.InvalidWebhookPayloadException if the payload cannot be parsed
     */
    public ReconcileReport ingest(ProviderWebhook webhook) {
        Channel channel = webhook.channel();
        ProviderWebhookHandler handler = handlers.get(channel);
        if (handler == null) {
            throw new IllegalStateException("No webhook handler registered for " + channel);
        }

        if (!handler.verify(webhook)) {
            Counter.builder("drip.webhook.rejected")
                    .description("Provider callbacks rejected by signature verification")
                    .tag("channel", channel.name())
                    .register(meterRegistry)
                    .increment();
            throw new WebhookVerificationException(channel, "Invalid " + channel.getDisplayName() + " webhook signature");
        }

        List<DeliveryEvent> events = handler.parse(webhook);
        List<ReconcileOutcome> outcomes = new ArrayList<>(events.size());
        for (DeliveryEvent event : events) {
            outcomes.add(apply(event));
        }

        ReconcileReport report = new ReconcileReport(channel, outcomes);
        log.info("{} webhook reconciled {} event(s): {}", channel, events.size(), report.counts());
        return report;
    }

    /**
     * Apply one normalized event to the message it names.
     */
    public ReconcileOutcome apply(DeliveryEvent event) {
        ReconcileOutcome outcome = doApply(event);
        Counter.builder("drip.webhook.events")
                .description("Provider delivery events by outcome")
                .tag("channel", event.channel().name())
                .tag("type", event.type().name())
                .tag("outcome", outcome.name().toLowerCase(Locale.ROOT))
                .register(meterRegistry)
                .increment();
        return outcome;
    }

    private ReconcileOutcome doApply(DeliveryEvent event) {
        DeliveryEventType type = event.type();
        if (type == DeliveryEventType.IGNORED) {
            log.debug("Ignoring {} event '{}' for {}", event.channel(), event.rawType(), event.providerMessageId());
            return ReconcileOutcome.UNSUPPORTED;
        }

        Optional<DripMessage> found = findMessage(event);
        if (found.isEmpty()) {
            log.info("No drip message for {} provider id {} / drip id {} (event '{}')",
                    event.channel(), event.providerMessageId(), event.dripMessageId(), event.rawType());
            return ReconcileOutcome.UNKNOWN_MESSAGE;
        }

        DripMessage message = found.get();

        // The processor already recorded SENT from the synchronous provider response
        if (type == DeliveryEventType.SENT) {
            return ReconcileOutcome.IGNORED_STALE;
        }

        MessageStatus target = type.getTargetStatus();
        Set<MessageStatus> from = target.reconcilableFrom();
        OffsetDateTime at = event.occurredAt() != null ? event.occurredAt() : now();

        int updated = switch (type) {
            case DELIVERED -> messageRepository.reconcileDelivered(message.getId(), from, target, at);
            case OPENED -> messageRepository.reconcileOpened(message.getId(), from, target, at);
            case CLICKED -> messageRepository.reconcileClicked(message.getId(), from, target, at);
            case FAILED, BOUNCED -> messageRepository.reconcileFailure(message.getId(), from, target, event.error(), at);
            default -> 0;
        };

        if (updated == 0) {
            log.debug("Drip message {} not moved to {} by '{}' event", message.getId(), target, event.rawType());
            return ReconcileOutcome.IGNORED_STALE;
        }

        log.info("Drip message {} -> {} ({} event '{}')", message.getId(), target, event.channel(), event.rawType());

        if (type.isEngagement()) {
            recordEngagement(message.getJourneyId(), type, at);
            checkConversion(message.getJourneyId(), type, at);
        }
        return ReconcileOutcome.APPLIED;
    }

    private Optional<DripMessage> findMessage(DeliveryEvent event) {
        if (StringUtils.hasText(event.providerMessageId())) {
            Optional<DripMessage> byProviderId = messageRepository.findByProviderMessageId(event.providerMessageId());
            if (byProviderId.isPresent()) {
                return byProviderId;
            }
        }
        if (event.dripMessageId() == null) {
            return Optional.empty();
        }
        return messageRepository.findById(event.dripMessageId())
                .filter(message -> message.getChannel() == event.channel());
    }

    private void recordEngagement(Long journeyId, DeliveryEventType type, OffsetDateTime at) {
        switch (type) {
            case DELIVERED -> journeyRepository.recordDelivery(journeyId, at);
            case OPENED -> journeyRepository.recordOpen(journeyId, at);
            case CLICKED -> journeyRepository.recordClick(journeyId, at);
            default -> {
            }
        }
    }

    private void checkConversion(Long journeyId, DeliveryEventType type, OffsetDateTime at) {
        LeadJourney journey = journeyRepository.findById(journeyId).orElse(null);
        if (journey == null || journey.isConverted()) {
            return;
        }
        DripCampaign campaign = campaignRepository.findById(journey.getCampaignId()).orElse(null);
        if (campaign != null && campaign.getConversionTrigger() == type) {
            markConverted(journeyId, type.name().toLowerCase(Locale.ROOT), at);
        }
    }

    // =========================
    // CONVERSIONS
    // =========================

    /**
     * Record an externally reported conversion (a booking, a reply) for a journey. Only the first
     * conversion of a journey is kept.
     *
     * @return whether this call recorded the conversion
     * @throws EntityNotFoundException if the journey does not exist
     */
    public boolean recordConversion(Long journeyId, String eventName) {
        if (!journeyRepository.existsById(journeyId)) {
            throw new EntityNotFoundException("Journey not found: " + journeyId);
        }
        return markConverted(journeyId, eventName, now());
    }

    private boolean markConverted(Long journeyId, String eventName, OffsetDateTime at) {
        boolean converted = journeyRepository.recordConversion(journeyId, eventName, JourneyStatus.COMPLETED, at) > 0;
        if (converted) {
            log.info("Journey {} converted on '{}'", journeyId, eventName);
            Counter.builder("drip.journeys.converted")
                    .description("Drip journeys converted")
                    .register(meterRegistry)
                    .increment();
        }
        return converted;
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}
