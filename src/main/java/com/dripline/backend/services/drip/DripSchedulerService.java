package com.dripline.backend.services.drip;

import com.dripline.backend.enums.JourneyStatus;
import com.dripline.backend.enums.MessageStatus;
import com.dripline.backend.enums.TriggerType;
import com.dripline.backend.models.Lead;
import com.dripline.backend.models.drip.DripCampaign;
import com.dripline.backend.models.drip.DripMessage;
import com.dripline.backend.models.drip.DripStep;
import com.dripline.backend.models.drip.LeadJourney;
import com.dripline.backend.repositories.LeadRepository;
import com.dripline.backend.repositories.drip.DripCampaignRepository;
import com.dripline.backend.repositories.drip.DripMessageRepository;
import com.dripline.backend.repositories.drip.LeadJourneyRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

/**
 * DripSchedulerService
 *
 * Starts lead journeys and creates the message for each journey's next step. Scheduling is
 * idempotent per (journey, step number): asking twice for the same step yields the same message.
 * <p>
 * Every write is a single-row statement. A lost insert race resolves to the row the other writer created.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DripSchedulerService {

    private final LeadRepository leadRepository;
    private final DripCampaignRepository campaignRepository;
    private final LeadJourneyRepository journeyRepository;
    private final DripMessageRepository messageRepository;
    private final DripTemplateRenderer templateRenderer;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    // =========================
    // JOURNEY START
    // =========================

    /**
     * Start a lead on a campaign at step 0 and schedule step 1 relative to now.
     * Returns the existing journey when the lead is already on the campaign.
     *
     * @throws EntityNotFoundException if the lead or campaign does not exist
     * @throws IllegalStateException   if the campaign is inactive
     */
    public LeadJourney startJourney(Long leadId, Long campaignId) {
        leadRepository.findById(leadId)
                .orElseThrow(() -> new EntityNotFoundException("Lead not found: " + leadId));
        DripCampaign campaign = campaignRepository.findById(campaignId)
                .orElseThrow(() -> new EntityNotFoundException("Drip campaign not found: " + campaignId));

        Optional<LeadJourney> existing = journeyRepository.findByLeadIdAndCampaignId(leadId, campaignId);
        if (existing.isPresent()) {
            LeadJourney journey = existing.get();
            log.info("Lead {} already on drip campaign {} (journey {}, status {})",
                    leadId, campaignId, journey.getId(), journey.getStatus());
            // A start that crashed between the insert and scheduling step 1 is completed here
            if (journey.getStatus() == JourneyStatus.ACTIVE && journey.getCurrentStep() == 0) {
                scheduleNextStep(journey);
            }
            return journey;
        }

        if (!campaign.isActive()) {
            throw new IllegalStateException("Drip campaign " + campaignId + " is not active");
        }

        OffsetDateTime startedAt = now();
        LeadJourney journey = LeadJourney.builder()
                .leadId(leadId)
                .campaignId(campaignId)
                .startedAt(startedAt)
                .build();

        try {
            journey = journeyRepository.saveAndFlush(journey);
        } catch (DataIntegrityViolationException e) {
            log.info("Concurrent start of lead {} on drip campaign {}, using the existing journey", leadId, campaignId);
            return journeyRepository.findByLeadIdAndCampaignId(leadId, campaignId)
                    .orElseThrow(() -> e);
        }

        log.info("Started journey {} for lead {} on drip campaign '{}'", journey.getId(), leadId, campaign.getName());
        Counter.builder("drip.journeys.started")
                .description("Number of drip journeys started")
                .tag("trigger", campaign.getTriggerType().name())
                .register(meterRegistry)
                .increment();

        scheduleNextStep(journey, startedAt);

        Long journeyId = journey.getId();
        return journeyRepository.findById(journeyId).orElse(journey);
    }

    /**
     * Lead-captured trigger: start the lead on every active campaign triggered by lead capture.
     * A campaign that cannot be started is logged and skipped.
     */
    public List<LeadJourney> startJourneysForCapturedLead(Long leadId) {
        leadRepository.findById(leadId)
                .orElseThrow(() -> new EntityNotFoundException("Lead not found: " + leadId));

        List<DripCampaign> campaigns = campaignRepository.findActiveByTriggerType(TriggerType.LEAD_CAPTURED);
        List<LeadJourney> journeys = new ArrayList<>();

        for (DripCampaign campaign : campaigns) {
            try {
                journeys.add(startJourney(leadId, campaign.getId()));
            } catch (IllegalStateException e) {
                log.warn("Could not start lead {} on drip campaign {}: {}", leadId, campaign.getId(), e.getMessage());
            }
        }

        log.info("Lead {} captured, on {} of {} lead-capture drip campaigns", leadId, journeys.size(), campaigns.size());
        return journeys;
    }

    // =========================
    // STEP SCHEDULING
    // =========================

    /**
     * Schedule the journey's next step, timing it from when the current step completed: the journey
     * start for step 0, otherwise the current step's send time.
     */
    public ScheduleOutcome scheduleNextStep(LeadJourney journey) {
        int currentStep = journey.getCurrentStep();
        if (currentStep == 0) {
            return scheduleNextStep(journey, journey.getStartedAt());
        }

        OffsetDateTime completedAt = messageRepository.findByJourneyIdAndStepNumber(journey.getId(), currentStep)
                .map(message -> message.getSentAt() != null ? message.getSentAt() : message.getFailedAt())
                .orElse(null);
        return scheduleNextStep(journey, completedAt != null ? completedAt : now());
    }

    /**
     * Create the message for step {@code currentStep + 1}, due at {@code stepCompletedAt + delay}, or
     * complete the journey when the campaign has no such step.
     *
     * @throws IllegalStateException if the campaign's step numbers are not contiguous from 1
     */
    public ScheduleOutcome scheduleNextStep(LeadJourney journey, OffsetDateTime stepCompletedAt) {
        Long journeyId = journey.getId();
        DripCampaign campaign = campaignRepository.findWithStepsById(journey.getCampaignId())
                .orElseThrow(() -> new EntityNotFoundException("Drip campaign not found: " + journey.getCampaignId()));
        campaign.requireContiguousSteps();

        int nextStepNumber = journey.getCurrentStep() + 1;
        Optional<DripStep> nextStep = campaign.findStep(nextStepNumber);

        if (nextStep.isEmpty()) {
            int updated = journeyRepository.markCompleted(journeyId,
                    EnumSet.of(JourneyStatus.ACTIVE, JourneyStatus.PAUSED), JourneyStatus.COMPLETED, now());
            if (updated > 0) {
                log.info("Journey {} completed all {} steps of drip campaign {}",
                        journeyId, campaign.getStepCount(), campaign.getId());
            }
            return ScheduleOutcome.journeyCompleted(journeyId);
        }

        Optional<DripMessage> existing = messageRepository.findByJourneyIdAndStepNumber(journeyId, nextStepNumber);
        if (existing.isPresent()) {
            log.debug("Step {} of journey {} already scheduled as message {}",
                    nextStepNumber, journeyId, existing.get().getId());
            return ScheduleOutcome.scheduled(journeyId, existing.get());
        }

        Lead lead = leadRepository.findById(journey.getLeadId())
                .orElseThrow(() -> new EntityNotFoundException("Lead not found: " + journey.getLeadId()));
        DripStep step = nextStep.get();

        String recipient = step.getChannel().isSms() ? lead.getPhone() : lead.getEmail();
        DripMessage message = DripMessage.builder()
                .journeyId(journeyId)
                .stepId(step.getId())
                .stepNumber(nextStepNumber)
                .channel(step.getChannel())
                .recipient(recipient != null ? recipient : "")
                .subject(step.isEmailStep() ? templateRenderer.render(step.getSubjectTemplate(), lead) : null)
                .content(templateRenderer.render(step.getBodyTemplate(), lead))
                .templateId(step.usesSendgridTemplate() ? step.getSendgridTemplateId() : null)
                .templateData(step.usesSendgridTemplate() ? templateRenderer.variablesFor(lead) : null)
                .status(MessageStatus.PENDING)
                .scheduledAt(stepCompletedAt.plus(step.getDelay()))
                .build();

        try {
            message = messageRepository.saveAndFlush(message);
        } catch (DataIntegrityViolationException e) {
            log.info("Step {} of journey {} scheduled concurrently, using the existing message", nextStepNumber, journeyId);
            return ScheduleOutcome.scheduled(journeyId,
                    messageRepository.findByJourneyIdAndStepNumber(journeyId, nextStepNumber).orElseThrow(() -> e));
        }

        log.info("Scheduled {} step {} of journey {} for {}",
                step.getChannel(), nextStepNumber, journeyId, message.getScheduledAt());
        return ScheduleOutcome.scheduled(journeyId, message);
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}
