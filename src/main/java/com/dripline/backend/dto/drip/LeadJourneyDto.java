package com.dripline.backend.dto.drip;

import com.dripline.backend.enums.JourneyStatus;
import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;
import java.util.List;

@Data
@Builder
public class LeadJourneyDto {
    private Long id;
    private Long leadId;
    private Long campaignId;
    private Integer currentStep;
    private JourneyStatus status;
    private OffsetDateTime startedAt;
    private OffsetDateTime completedAt;
    private OffsetDateTime lastInteractionAt;

    // Counters
    private Integer totalSmsSent;
    private Integer totalEmailsSent;
    private Integer totalDelivered;
    private Integer totalOpens;
    private Integer totalClicks;

    private String conversionEvent;
    private OffsetDateTime convertedAt;

    private List<DripMessageDto> messages;
}
