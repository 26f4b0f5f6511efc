package com.discussboard.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ConsentRequest(
        @NotBlank(message = "policyType is required") @Size(max = 64) String policyType,
        @NotBlank(message = "policyVersion is required") @Size(max = 32) String policyVersion,
        @NotBlank(message = "consentAction is required") String consentAction
) {
}
