package com.makrcave.backend.modules.accesscontrol.presentation.dto;

import java.util.List;

public record BulkRoleAssignmentResponse(
        List<BulkRoleAssignmentResult> results,
        int successCount,
        int failureCount
) {

    public static BulkRoleAssignmentResponse of(List<BulkRoleAssignmentResult> results) {
        int succeeded = (int) results.stream().filter(BulkRoleAssignmentResult::success).count();
        return new BulkRoleAssignmentResponse(List.copyOf(results), succeeded, results.size() - succeeded);
    }
}
