package com.makrcave.backend.modules.accesscontrol.application;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;

import com.makrcave.backend.global.error.ProblemException;
import com.makrcave.backend.global.security.JwtAuthenticationPrincipal;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.BulkRoleAssignmentRequest;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.BulkRoleAssignmentResponse;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.BulkRoleAssignmentResult;

/**
 * Applies an assign or revoke to every (user, role) pair. Each pair runs in its own transaction
 * and a failing pair leaves the others untouched; this service must not open a transaction around
 * the loop.
 */
@Service
public class BulkRoleAssignmentService {

    private static final Logger log = LoggerFactory.getLogger(BulkRoleAssignmentService.class);

    static final String ACTION_ASSIGN = "assign";
    static final String ACTION_REVOKE = "revoke";

    private final RoleAssignmentService roleAssignmentService;

    public BulkRoleAssignmentService(RoleAssignmentService roleAssignmentService) {
        this.roleAssignmentService = roleAssignmentService;
    }

    public BulkRoleAssignmentResponse apply(@NonNull BulkRoleAssignmentRequest request, @NonNull JwtAuthenticationPrincipal actor) {
        List<BulkRoleAssignmentResult> results = new ArrayList<>();
        for (UUID userId : request.userIds()) {
            for (UUID roleId : request.roleIds()) {
                results.add(applyPair(request, userId, roleId, actor));
            }
        }
        return BulkRoleAssignmentResponse.of(results);
    }

    private BulkRoleAssignmentResult applyPair(
            BulkRoleAssignmentRequest request,
            UUID userId,
            UUID roleId,
            JwtAuthenticationPrincipal actor
    ) {
        String action = request.action();
        try {
            if (ACTION_ASSIGN.equals(action)) {
                roleAssignmentService.assign(new RoleAssignmentService.AssignRoleCommand(
                        userId, roleId, actor.userId(), actor.isSuperAdmin(),
                        request.reason(), request.effectiveDate(), request.expiryDate()));
            } else if (ACTION_REVOKE.equals(action)) {
                roleAssignmentService.revoke(userId, roleId, actor.userId(), request.reason());
            } else {
                return new BulkRoleAssignmentResult(userId, roleId, action, false, "Unsupported action: " + action);
            }
            return new BulkRoleAssignmentResult(userId, roleId, action, true, null);
        } catch (ProblemException ex) {
            log.warn("Bulk {} failed for user {} role {}: {}", action, userId, roleId, ex.getDetailMessage());
            return new BulkRoleAssignmentResult(userId, roleId, action, false, ex.getDetailMessage());
        } catch (RuntimeException ex) {
            log.warn("Bulk {} failed for user {} role {}", action, userId, roleId, ex);
            return new BulkRoleAssignmentResult(userId, roleId, action, false, ex.getMessage());
        }
    }
}
