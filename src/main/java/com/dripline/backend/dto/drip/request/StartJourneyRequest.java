package com.dripline.backend.dto.drip.request;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class StartJourneyRequest {
    @NotNull(message = "Lead ID is required")
    private Long leadId;

    @NotNull(message = "Campaign ID is required")
    private Long campaignId;
}
