package com.dripline.backend.dto.drip.request;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class ActivateCampaignRequest {
    @NotNull(message = "Active flag is required")
    private Boolean active;
}
