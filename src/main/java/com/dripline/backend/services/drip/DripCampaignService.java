package com.dripline.backend.services.drip;

import com.dripline.backend.enums.JourneyStatus;
import com.dripline.backend.models.drip.DripMessage;
import com.dripline.backend.models.drip.LeadJourney;
import com.dripline.backend.repositories.drip.DripCampaignRepository;
import com.dripline.backend.repositories.drip.DripMessageRepository;
import com.dripline.backend.repositories.drip.LeadJourneyRepository;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.EnumSet;
import java.util.List;

/**
 * Operator actions on campaigns and journeys: campaign pause/resume and journey pause/resume.
 * Paused journeys and inactive campaigns are skipped by the processor until resumed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DripCampaignService {

    private final DripCampaignRepository campaignRepository;
    private final LeadJourneyRepository journeyRepository;
    private final DripMessageRepository messageRepository;
    private final Clock clock;

    public void setCampaignActive(Long campaignId, boolean active) {
        if (campaignRepository.updateActive(campaignId, active, OffsetDateTime.now(clock)) == 0) {
            throw new EntityNotFoundException("Drip campaign not found: " + campaignId);
        }
        log.info("Drip campaign {} {}", campaignId, active ? "activated" : "paused");
    }

    public LeadJourney pauseJourney(Long journeyId) {
        return transition(journeyId, JourneyStatus.ACTIVE, JourneyStatus.PAUSED);
    }

    public LeadJourney resumeJourney(Long journeyId) {
        return transition(journeyId, JourneyStatus.PAUSED, JourneyStatus.ACTIVE);
    }

    public LeadJourney getJourney(Long journeyId) {
        return journeyRepository.findById(journeyId)
                .orElseThrow(() -> new EntityNotFoundException("Journey not found: " + journeyId));
    }

    public List<DripMessage> getJourneyMessages(Long journeyId) {
        getJourney(journeyId);
        return messageRepository.findByJourneyIdOrderByStepNumberAsc(journeyId);
    }

    private LeadJourney transition(Long journeyId, JourneyStatus from, JourneyStatus to) {
        LeadJourney journey = getJourney(journeyId);
        int updated = journeyRepository.transitionStatus(journeyId, EnumSet.of(from), to, OffsetDateTime.now(clock));
        if (updated == 0) {
            throw new IllegalStateException("Journey " + journeyId + " is " + journey.getStatus().getDisplayName().toLowerCase()
                    + ", expected " + from.getDisplayName().toLowerCase());
        }
        log.info("Journey {} {} -> {}", journeyId, from, to);
        return getJourney(journeyId);
    }
}
