package com.dripline.backend.services.drip;

import com.dripline.backend.models.drip.DripMessage;

import java.util.Optional;

/**
 * Result of asking the scheduler for a journey's next step: either the message that now exists for
 * it, or the fact that the journey has no further steps and was completed.
 */
public record ScheduleOutcome(Long journeyId, DripMessage message) {

    public static ScheduleOutcome scheduled(Long journeyId, DripMessage message) {
        return new ScheduleOutcome(journeyId, message);
    }

    public static ScheduleOutcome journeyCompleted(Long journeyId) {
        return new ScheduleOutcome(journeyId, null);
    }

    public boolean isJourneyCompleted() {
        return message == null;
    }

    public Optional<DripMessage> scheduledMessage() {
        return Optional.ofNullable(message);
    }
}
