package com.makrcave.backend.modules.accesscontrol.presentation.dto;

import java.util.List;
import java.util.UUID;

public record DefaultSetupResponse(
        UUID makerspaceId,
        List<String> createdPermissions,
        List<String> createdRoles
) {
}
