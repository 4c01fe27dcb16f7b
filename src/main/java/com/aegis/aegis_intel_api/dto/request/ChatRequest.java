package com.aegis.aegis_intel_api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ChatRequest(
        @NotBlank(message = "scanId is required") String scanId,
        @NotBlank(message = "message is required") @Size(max = 2000) String message
) {}
