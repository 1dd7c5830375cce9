package com.dripline.backend.services.drip;

import com.dripline.backend.enums.Channel;
import com.dripline.backend.enums.JourneyStatus;
import com.dripline.backend.enums.MessageStatus;
import com.dripline.backend.enums.StepFailurePolicy;
import com.dripline.backend.models.Lead;
import com.dripline.backend.models.drip.DripCampaign;
import com.dripline.backend.models.drip.DripMessage;
import com.dripline.backend.models.drip.LeadJourney;
import com.dripline.backend.services.channel.SendResult;
import com.dripline.backend.support.DripJpaTestSupport;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.time.OffsetDateTime;

import static org.assertj.core.api.Assertions.*;

class DripEngineScenarioTest extends DripJpaTestSupport {

    @Autowired
    private DripSchedulerService schedulerService;

    @Autowired
    private DripMessageProcessor processor;

    @Autowired
    private DripCampaignService campaignService;

    @Test
    void twoStepCampaign_ShouldSendBothStepsAndCompleteJourney() {
        // Given
        Lead lead = saveLead();
        DripCampaign campaign = saveCampaign(StepFailurePolicy.FAIL_JOURNEY,
                smsStep(1, 0, "Hi {{first_name}}, thanks for reaching out!"),
                emailStep(2, 60, "Next steps for {{company}}", "Hello {{full_name}}"));
        OffsetDateTime triggeredAt = now();

        // When
        LeadJourney journey = schedulerService.startJourney(lead.getId(), campaign.getId());
        ProcessorRunSummary firstRun = processor.processPendingMessages();

        // Then
        assertThat(firstRun.forChannel(Channel.SMS).sent()).isEqualTo(1);
        assertThat(smsAdapter.lastSent().content()).isEqualTo("Hi Dana, thanks for reaching out!");

        DripMessage sms = messageForStep(journey.getId(), 1);
        assertThat(sms.getStatus()).isEqualTo(MessageStatus.SENT);
        assertThat(sms.getProviderMessageId()).startsWith("SM");
        assertThat(sms.getSentAt()).isAtSameInstantAs(triggeredAt);

        DripMessage email = messageForStep(journey.getId(), 2);
        assertThat(email.getStatus()).isEqualTo(MessageStatus.PENDING);
        assertThat(email.getScheduledAt()).isAtSameInstantAs(triggeredAt.plusMinutes(60));
        assertThat(email.getSubject()).isEqualTo("Next steps for Reyes Plumbing");
        assertThat(email.getRecipient()).isEqualTo("dana@example.com");
        assertThat(reloadJourney(journey.getId()).getCurrentStep()).isEqualTo(1);

        // Not due yet
        ProcessorRunSummary earlyRun = processor.processPendingMessages();
        assertThat(earlyRun.totalSent()).isZero();
        assertThat(emailAdapter.getSent()).isEmpty();

        // When
        clock.advance(Duration.ofMinutes(60));
        ProcessorRunSummary secondRun = processor.processPendingMessages();

        // Then
        assertThat(secondRun.forChannel(Channel.EMAIL).sent()).isEqualTo(1);
        assertThat(emailAdapter.lastSent().content()).isEqualTo("Hello Dana Reyes");

        LeadJourney finished = reloadJourney(journey.getId());
        assertThat(finished.getStatus()).isEqualTo(JourneyStatus.COMPLETED);
        assertThat(finished.getCurrentStep()).isEqualTo(2);
        assertThat(finished.getCompletedAt()).isNotNull();
        assertThat(finished.getTotalSmsSent()).isEqualTo(1);
        assertThat(finished.getTotalEmailsSent()).isEqualTo(1);
        assertThat(messageRepository.findByJourneyIdOrderByStepNumberAsc(journey.getId())).hasSize(2);
    }

    @Test
    void emailThenSmsNextDay_ShouldSendSmsExactlyWhenDueAndNotBefore() {
        // Given
        OffsetDateTime t = now();
        Lead lead = saveLead();
        DripCampaign campaign = saveCampaign(StepFailurePolicy.FAIL_JOURNEY,
                emailStep(1, 0, "Welcome {{first_name}}", "Thanks for getting in touch"),
                smsStep(2, 1440, "Hi {{first_name}}, any questions?"));
        LeadJourney journey = schedulerService.startJourney(lead.getId(), campaign.getId());

        // When - the processor first runs a minute after the trigger
        clock.advance(Duration.ofMinutes(1));
        ProcessorRunSummary firstRun = processor.processPendingMessages();

        // Then
        assertThat(firstRun.forChannel(Channel.EMAIL).sent()).isEqualTo(1);
        DripMessage email = messageForStep(journey.getId(), 1);
        assertThat(email.getStatus()).isEqualTo(MessageStatus.SENT);
        assertThat(email.getSentAt()).isAtSameInstantAs(t.plusMinutes(1));

        DripMessage sms = messageForStep(journey.getId(), 2);
        assertThat(sms.getStatus()).isEqualTo(MessageStatus.PENDING);
        assertThat(sms.getScheduledAt()).isAtSameInstantAs(email.getSentAt().plusMinutes(1440));
        OffsetDateTime smsDueAt = sms.getScheduledAt();

        // When - one minute before the SMS is due
        clock.setInstant(smsDueAt.minusMinutes(1).toInstant());
        ProcessorRunSummary earlyRun = processor.processPendingMessages();

        // Then
        assertThat(earlyRun.forChannel(Channel.SMS).selected()).isZero();
        assertThat(smsAdapter.getSent()).isEmpty();
        DripMessage untouched = messageForStep(journey.getId(), 2);
        assertThat(untouched.getStatus()).isEqualTo(MessageStatus.PENDING);
        assertThat(untouched.getAttemptCount()).isZero();
        assertThat(reloadJourney(journey.getId()).getCurrentStep()).isEqualTo(1);

        // When - exactly at the scheduled time
        clock.setInstant(smsDueAt.toInstant());
        ProcessorRunSummary dueRun = processor.processPendingMessages();

        // Then
        assertThat(dueRun.forChannel(Channel.SMS).sent()).isEqualTo(1);
        assertThat(smsAdapter.lastSent().content()).isEqualTo("Hi Dana, any questions?");
        DripMessage sentSms = messageForStep(journey.getId(), 2);
        assertThat(sentSms.getStatus()).isEqualTo(MessageStatus.SENT);
        assertThat(sentSms.getSentAt()).isAtSameInstantAs(smsDueAt);

        LeadJourney finished = reloadJourney(journey.getId());
        assertThat(finished.getStatus()).isEqualTo(JourneyStatus.COMPLETED);
        assertThat(finished.getCurrentStep()).isEqualTo(2);
        assertThat(finished.getTotalEmailsSent()).isEqualTo(1);
        assertThat(finished.getTotalSmsSent()).isEqualTo(1);
    }

    @Test
    void invalidPhoneInStepTwo_ShouldFailMessageAndJourneyWithoutRetry() {
        // Given
        Lead lead = saveLead("555-1234", "dana@example.com");
        DripCampaign campaign = saveCampaign(StepFailurePolicy.FAIL_JOURNEY,
                emailStep(1, 0, "Welcome", "Welcome {{first_name}}"),
                smsStep(2, 0, "Quick question, {{first_name}}"));
        LeadJourney journey = schedulerService.startJourney(lead.getId(), campaign.getId());

        // When
        processor.processPendingMessages();
        ProcessorRunSummary run = processor.processPendingMessages();

        // Then
        assertThat(run.forChannel(Channel.SMS).failed()).isEqualTo(1);
        assertThat(smsAdapter.getSent()).isEmpty();

        DripMessage sms = messageForStep(journey.getId(), 2);
        assertThat(sms.getStatus()).isEqualTo(MessageStatus.FAILED);
        assertThat(sms.getAttemptCount()).isZero();
        assertThat(sms.getLastError()).contains("Invalid");
        assertThat(sms.getFailedAt()).isNotNull();

        LeadJourney failed = reloadJourney(journey.getId());
        assertThat(failed.getStatus()).isEqualTo(JourneyStatus.FAILED);
        assertThat(failed.getCurrentStep()).isEqualTo(1);
    }

    @Test
    void invalidEmail_ShouldBounceMessage() {
        // Given
        Lead lead = saveLead("+15551234567", "not-an-email");
        DripCampaign campaign = saveCampaign(StepFailurePolicy.FAIL_JOURNEY,
                emailStep(1, 0, "Welcome", "Welcome"));
        LeadJourney journey = schedulerService.startJourney(lead.getId(), campaign.getId());

        // When
        processor.processPendingMessages();

        // Then
        assertThat(messageForStep(journey.getId(), 1).getStatus()).isEqualTo(MessageStatus.BOUNCED);
        assertThat(reloadJourney(journey.getId()).getStatus()).isEqualTo(JourneyStatus.FAILED);
    }

    @Test
    void skipStepPolicy_ShouldAdvancePastFailedStepAndScheduleNext() {
        // Given
        Lead lead = saveLead("555-1234", "dana@example.com");
        DripCampaign campaign = saveCampaign(StepFailurePolicy.SKIP_STEP,
                smsStep(1, 0, "Text first"),
                emailStep(2, 30, "Follow up", "Email second"));
        LeadJourney journey = schedulerService.startJourney(lead.getId(), campaign.getId());

        // When
        processor.processPendingMessages();

        // Then
        assertThat(messageForStep(journey.getId(), 1).getStatus()).isEqualTo(MessageStatus.FAILED);
        LeadJourney skipped = reloadJourney(journey.getId());
        assertThat(skipped.getStatus()).isEqualTo(JourneyStatus.ACTIVE);
        assertThat(skipped.getCurrentStep()).isEqualTo(1);

        DripMessage email = messageForStep(journey.getId(), 2);
        assertThat(email.getStatus()).isEqualTo(MessageStatus.PENDING);
        assertThat(email.getScheduledAt()).isAtSameInstantAs(now().plusMinutes(30));
    }

    @Test
    void transientFailures_ShouldRequeueThreeTimesThenFailOnFourthAttempt() {
        // Given
        smsAdapter.alwaysFail(true, "503 Service Unavailable");
        Lead lead = saveLead();
        DripCampaign campaign = saveCampaign(StepFailurePolicy.FAIL_JOURNEY, smsStep(1, 0, "Hello"));
        LeadJourney journey = schedulerService.startJourney(lead.getId(), campaign.getId());
        OffsetDateTime previousScheduledAt = messageForStep(journey.getId(), 1).getScheduledAt();

        // When / Then: three requeues with growing delays
        for (int attempt = 1; attempt <= 3; attempt++) {
            ProcessorRunSummary run = processor.processPendingMessages();
            assertThat(run.forChannel(Channel.SMS).retried()).isEqualTo(1);

            DripMessage message = messageForStep(journey.getId(), 1);
            assertThat(message.getStatus()).isEqualTo(MessageStatus.PENDING);
            assertThat(message.getAttemptCount()).isEqualTo(attempt);
            assertThat(message.getLastError()).isEqualTo("503 Service Unavailable");
            assertThat(message.getScheduledAt()).isAfter(previousScheduledAt);
            assertThat(Duration.between(now(), message.getScheduledAt()))
                    .isEqualTo(Duration.ofMinutes(1L << (attempt - 1)));

            // Not due again until the backoff has elapsed
            assertThat(processor.processPendingMessages().totalRetried()).isZero();

            previousScheduledAt = message.getScheduledAt();
            clock.setInstant(message.getScheduledAt().toInstant());
        }

        ProcessorRunSummary finalRun = processor.processPendingMessages();

        // Then
        assertThat(finalRun.forChannel(Channel.SMS).failed()).isEqualTo(1);
        DripMessage message = messageForStep(journey.getId(), 1);
        assertThat(message.getStatus()).isEqualTo(MessageStatus.FAILED);
        assertThat(message.getAttemptCount()).isEqualTo(4);
        assertThat(smsAdapter.getSent()).hasSize(4);
        assertThat(reloadJourney(journey.getId()).getStatus()).isEqualTo(JourneyStatus.FAILED);
    }

    @Test
    void permanentProviderFailure_ShouldFailImmediately() {
        // Given
        smsAdapter.alwaysFail(false, "21610 Unsubscribed recipient");
        Lead lead = saveLead();
        DripCampaign campaign = saveCampaign(StepFailurePolicy.FAIL_JOURNEY, smsStep(1, 0, "Hello"));
        LeadJourney journey = schedulerService.startJourney(lead.getId(), campaign.getId());

        // When
        processor.processPendingMessages();

        // Then
        DripMessage message = messageForStep(journey.getId(), 1);
        assertThat(message.getStatus()).isEqualTo(MessageStatus.FAILED);
        assertThat(message.getAttemptCount()).isEqualTo(1);
        assertThat(message.getLastError()).contains("21610");
    }

    @Test
    void retryThenSuccess_ShouldSendAndAdvance() {
        // Given
        smsAdapter.alwaysFail(true, "429 Too Many Requests");
        Lead lead = saveLead();
        DripCampaign campaign = saveCampaign(StepFailurePolicy.FAIL_JOURNEY, smsStep(1, 0, "Hello"));
        LeadJourney journey = schedulerService.startJourney(lead.getId(), campaign.getId());
        processor.processPendingMessages();

        // When
        smsAdapter.respondWith(address -> SendResult.success("SM-ok"));
        clock.advance(Duration.ofMinutes(1));
        processor.processPendingMessages();

        // Then
        DripMessage message = messageForStep(journey.getId(), 1);
        assertThat(message.getStatus()).isEqualTo(MessageStatus.SENT);
        assertThat(message.getAttemptCount()).isEqualTo(1);
        assertThat(message.getProviderMessageId()).isEqualTo("SM-ok");
        assertThat(message.getLastError()).isNull();
        assertThat(reloadJourney(journey.getId()).getStatus()).isEqualTo(JourneyStatus.COMPLETED);
    }

    @Test
    void pausedJourney_ShouldBeSkippedUntilResumed() {
        // Given
        Lead lead = saveLead();
        DripCampaign campaign = saveCampaign(StepFailurePolicy.FAIL_JOURNEY, smsStep(1, 0, "Hello"));
        LeadJourney journey = schedulerService.startJourney(lead.getId(), campaign.getId());
        campaignService.pauseJourney(journey.getId());

        // When
        ProcessorRunSummary pausedRun = processor.processPendingMessages();

        // Then
        assertThat(pausedRun.totalSent()).isZero();
        assertThat(messageForStep(journey.getId(), 1).getStatus()).isEqualTo(MessageStatus.PENDING);

        // When
        campaignService.resumeJourney(journey.getId());
        processor.processPendingMessages();

        // Then
        assertThat(messageForStep(journey.getId(), 1).getStatus()).isEqualTo(MessageStatus.SENT);
    }

    @Test
    void inactiveCampaign_ShouldHoldMessagesUntilReactivated() {
        // Given
        Lead lead = saveLead();
        DripCampaign campaign = saveCampaign(StepFailurePolicy.FAIL_JOURNEY, smsStep(1, 0, "Hello"));
        LeadJourney journey = schedulerService.startJourney(lead.getId(), campaign.getId());
        campaignService.setCampaignActive(campaign.getId(), false);

        // When
        processor.processPendingMessages();

        // Then
        assertThat(smsAdapter.getSent()).isEmpty();

        // When
        campaignService.setCampaignActive(campaign.getId(), true);
        processor.processPendingMessages();

        // Then
        assertThat(messageForStep(journey.getId(), 1).getStatus()).isEqualTo(MessageStatus.SENT);
    }

    @Test
    void sentMessage_ShouldNotBeSentAgainByLaterRuns() {
        // Given
        Lead lead = saveLead();
        DripCampaign campaign = saveCampaign(StepFailurePolicy.FAIL_JOURNEY,
                smsStep(1, 0, "One"), smsStep(2, 10, "Two"));
        LeadJourney journey = schedulerService.startJourney(lead.getId(), campaign.getId());

        // When
        processor.processPendingMessages();
        clock.advance(Duration.ofMinutes(10));
        processor.processPendingMessages();
        clock.advance(Duration.ofMinutes(10));
        processor.processPendingMessages();

        // Then
        assertThat(smsAdapter.getSent()).extracting(sent -> sent.content()).containsExactly("One", "Two");
        assertThat(smsAdapter.getSendsByCorrelationId().values()).allSatisfy(count -> assertThat(count.get()).isEqualTo(1));
        assertThat(reloadJourney(journey.getId()).getCurrentStep()).isEqualTo(2);
    }

    @Test
    void adapterThrowing_ShouldBeTreatedAsRetryable() {
        // Given
        smsAdapter.respondWith(address -> {
            throw new IllegalStateException("socket closed");
        });
        Lead lead = saveLead();
        DripCampaign campaign = saveCampaign(StepFailurePolicy.FAIL_JOURNEY, smsStep(1, 0, "Hello"));
        LeadJourney journey = schedulerService.startJourney(lead.getId(), campaign.getId());

        // When
        ProcessorRunSummary run = processor.processPendingMessages();

        // Then
        assertThat(run.forChannel(Channel.SMS).retried()).isEqualTo(1);
        DripMessage message = messageForStep(journey.getId(), 1);
        assertThat(message.getStatus()).isEqualTo(MessageStatus.PENDING);
        assertThat(message.getLastError()).contains("socket closed");
    }
}
