package com.makrcave.backend.modules.accesscontrol.presentation.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record LoginAttemptRequest(
        @NotNull Boolean success,
        @Size(max = 45) String ipAddress,
        String userAgent,
        @Size(max = 500) String failureReason
) {
}
