package com.makrcave.backend.modules.accesscontrol.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record PasswordValidationRequest(
        @NotNull @Size(max = 1024) String password,
        UUID makerspaceId
) {
}
