package com.dripline.backend.controllers.drip;

import com.dripline.backend.dto.drip.DripMessageDto;
import com.dripline.backend.dto.drip.LeadJourneyDto;
import com.dripline.backend.dto.drip.request.ActivateCampaignRequest;
import com.dripline.backend.dto.drip.request.ConversionRequest;
import com.dripline.backend.dto.drip.request.StartJourneyRequest;
import com.dripline.backend.models.drip.DripMessage;
import com.dripline.backend.models.drip.LeadJourney;
import com.dripline.backend.services.drip.DripCampaignService;
import com.dripline.backend.services.drip.DripMessageProcessor;
import com.dripline.backend.services.drip.DripSchedulerService;
import com.dripline.backend.services.drip.ProcessorRunSummary;
import com.dripline.backend.services.webhook.DripWebhookReconciler;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/drip")
@RequiredArgsConstructor
@Slf4j
public class DripJourneyController {

    private final DripSchedulerService schedulerService;
    private final DripCampaignService campaignService;
    private final DripMessageProcessor messageProcessor;
    private final DripWebhookReconciler reconciler;

    // ================================
    // JOURNEYS
    // ================================

    @PostMapping("/journeys")
    public ResponseEntity<LeadJourneyDto> startJourney(@Valid @RequestBody StartJourneyRequest request) {
        LeadJourney journey = schedulerService.startJourney(request.getLeadId(), request.getCampaignId());
        return ResponseEntity.status(HttpStatus.CREATED).body(convertJourneyToDto(journey, null));
    }

    @PostMapping("/leads/{leadId}/captured")
    public ResponseEntity<List<LeadJourneyDto>> leadCaptured(@PathVariable Long leadId) {
        List<LeadJourneyDto> journeys = schedulerService.startJourneysForCapturedLead(leadId).stream()
                .map(journey -> convertJourneyToDto(journey, null))
                .collect(Collectors.toList());
        return ResponseEntity.ok(journeys);
    }

    @GetMapping("/journeys/{journeyId}")
    public ResponseEntity<LeadJourneyDto> getJourney(@PathVariable Long journeyId) {
        LeadJourney journey = campaignService.getJourney(journeyId);
        List<DripMessage> messages = campaignService.getJourneyMessages(journeyId);
        return ResponseEntity.ok(convertJourneyToDto(journey, messages));
    }

    @GetMapping("/journeys/{journeyId}/messages")
    public ResponseEntity<List<DripMessageDto>> getJourneyMessages(@PathVariable Long journeyId) {
        List<DripMessageDto> messages = campaignService.getJourneyMessages(journeyId).stream()
                .map(this::convertMessageToDto)
                .collect(Collectors.toList());
        return ResponseEntity.ok(messages);
    }

    @PostMapping("/journeys/{journeyId}/pause")
    public ResponseEntity<LeadJourneyDto> pauseJourney(@PathVariable Long journeyId) {
        return ResponseEntity.ok(convertJourneyToDto(campaignService.pauseJourney(journeyId), null));
    }

    @PostMapping("/journeys/{journeyId}/resume")
    public ResponseEntity<LeadJourneyDto> resumeJourney(@PathVariable Long journeyId) {
        return ResponseEntity.ok(convertJourneyToDto(campaignService.resumeJourney(journeyId), null));
    }

    @PostMapping("/journeys/{journeyId}/conversion")
    public ResponseEntity<Map<String, Object>> recordConversion(
            @PathVariable Long journeyId,
            @Valid @RequestBody ConversionRequest request) {
        boolean recorded = reconciler.recordConversion(journeyId, request.getEvent());

        Map<String, Object> response = new HashMap<>();
        response.put("journeyId", journeyId);
        response.put("event", request.getEvent());
        response.put("recorded", recorded);
        return ResponseEntity.ok(response);
    }

    // ================================
    // CAMPAIGNS
    // ================================

    @PostMapping("/campaigns/{campaignId}/activate")
    public ResponseEntity<Map<String, Object>> setCampaignActive(
            @PathVariable Long campaignId,
            @Valid @RequestBody ActivateCampaignRequest request) {
        campaignService.setCampaignActive(campaignId, request.getActive());

        Map<String, Object> response = new HashMap<>();
        response.put("campaignId", campaignId);
        response.put("active", request.getActive());
        return ResponseEntity.ok(response);
    }

    // ================================
    // PROCESSOR
    // ================================

    @PostMapping("/processor/run")
    public ResponseEntity<ProcessorRunSummary> runProcessor() {
        log.info("Manual drip processor run requested");
        return ResponseEntity.ok(messageProcessor.processPendingMessages());
    }

    // ================================
    // HELPER METHODS
    // ================================

    private LeadJourneyDto convertJourneyToDto(LeadJourney journey, List<DripMessage> messages) {
        return LeadJourneyDto.builder()
                .id(journey.getId())
                .leadId(journey.getLeadId())
                .campaignId(journey.getCampaignId())
                .currentStep(journey.getCurrentStep())
                .status(journey.getStatus())
                .startedAt(journey.getStartedAt())
                .completedAt(journey.getCompletedAt())
                .lastInteractionAt(journey.getLastInteractionAt())
                .totalSmsSent(journey.getTotalSmsSent())
                .totalEmailsSent(journey.getTotalEmailsSent())
                .totalDelivered(journey.getTotalDelivered())
                .totalOpens(journey.getTotalOpens())
                .totalClicks(journey.getTotalClicks())
                .conversionEvent(journey.getConversionEvent())
                .convertedAt(journey.getConvertedAt())
                .messages(messages != null
                        ? messages.stream().map(this::convertMessageToDto).collect(Collectors.toList())
                        : null)
                .build();
    }

    private DripMessageDto convertMessageToDto(DripMessage message) {
        return DripMessageDto.builder()
                .id(message.getId())
                .journeyId(message.getJourneyId())
                .stepNumber(message.getStepNumber())
                .channel(message.getChannel())
                .subject(message.getSubject())
                .status(message.getStatus())
                .scheduledAt(message.getScheduledAt())
                .attemptCount(message.getAttemptCount())
                .lastError(message.getLastError())
                .providerMessageId(message.getProviderMessageId())
                .sentAt(message.getSentAt())
                .deliveredAt(message.getDeliveredAt())
                .openedAt(message.getOpenedAt())
                .clickedAt(message.getClickedAt())
                .failedAt(message.getFailedAt())
                .build();
    }
}
