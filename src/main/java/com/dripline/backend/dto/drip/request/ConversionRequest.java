package com.dripline.backend.dto.drip.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class ConversionRequest {
    @NotBlank(message = "Conversion event is required")
    @Size(max = 100)
    private String event; // e.g. "booked", "replied"
}
