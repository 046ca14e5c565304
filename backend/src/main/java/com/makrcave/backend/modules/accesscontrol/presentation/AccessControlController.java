package com.makrcave.backend.modules.accesscontrol.presentation;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.makrcave.backend.global.security.JwtAuthenticationPrincipal;
import com.makrcave.backend.global.security.SecurityUtils;
import com.makrcave.backend.modules.accesscontrol.application.AccessControlReadService;
import com.makrcave.backend.modules.accesscontrol.application.AccessGuard;
import com.makrcave.backend.modules.accesscontrol.application.AccountLockoutService;
import com.makrcave.backend.modules.accesscontrol.application.DefaultAccessSetupService;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.AccessControlStatsResponse;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.AuditLogResponse;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.DefaultSetupResponse;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.LoginAttemptRequest;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.MemberAccessResponse;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.PagedResponse;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.SecurityAlertResponse;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.UserAccessSummaryResponse;
import com.makrcave.backend.modules.audit.infrastructure.AuditLogSearchCondition;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import org.springframework.data.domain.PageRequest;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/access-control")
public class AccessControlController {

    private final AccessControlReadService accessControlReadService;
    private final AccountLockoutService accountLockoutService;
    private final DefaultAccessSetupService defaultAccessSetupService;
    private final AccessGuard accessGuard;

    public AccessControlController(
            AccessControlReadService accessControlReadService,
            AccountLockoutService accountLockoutService,
            DefaultAccessSetupService defaultAccessSetupService,
            AccessGuard accessGuard
    ) {
        this.accessControlReadService = accessControlReadService;
        this.accountLockoutService = accountLockoutService;
        this.defaultAccessSetupService = defaultAccessSetupService;
        this.accessGuard = accessGuard;
    }

    @GetMapping("/users")
    public ResponseEntity<PagedResponse<MemberAccessResponse>> listUsers(
            @RequestParam(name = "makerspaceId", required = false) UUID makerspaceId,
            @RequestParam(name = "active", required = false) Boolean active,
            @RequestParam(name = "hasActiveSession", required = false) Boolean hasActiveSession,
            @RequestParam(name = "roleId", required = false) UUID roleId,
            @RequestParam(name = "search", required = false) String search,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "50") int size
    ) {
        JwtAuthenticationPrincipal principal = SecurityUtils.getCurrentPrincipal();
        accessGuard.require(principal, AccessGuard.VIEW_MEMBERS);
        PageRequest pageable = PageRequest.of(Math.max(page, 0), Math.min(Math.max(size, 1), 500));
        return ResponseEntity.ok(accessControlReadService.listMembers(
                accessGuard.scopeMakerspace(principal, makerspaceId),
                active, hasActiveSession, roleId, search, pageable));
    }

    @Operation(
            summary = "Access summary of a user",
            description = """
                    Roles, effective permissions, live sessions and lock state, plus feature flags, dashboard \
                    configuration and menu restrictions merged across the user's roles.
                    """
    )
    @GetMapping("/users/{userId}/access")
    public ResponseEntity<UserAccessSummaryResponse> userAccess(@PathVariable("userId") UUID userId) {
        return ResponseEntity.ok(accessControlReadService.userAccessSummary(userId, SecurityUtils.getCurrentPrincipal()));
    }

    @PostMapping("/users/{userId}/unlock")
    public ResponseEntity<Void> unlockUser(@PathVariable("userId") UUID userId) {
        JwtAuthenticationPrincipal principal = SecurityUtils.getCurrentPrincipal();
        accessGuard.require(principal, AccessGuard.MANAGE_SESSIONS);
        accessControlReadService.requireMemberInScope(principal, userId);
        accountLockoutService.unlock(userId, principal.userId());
        return ResponseEntity.noContent().build();
    }

    @Operation(
            summary = "Record a login attempt",
            description = """
                    Failed attempts count towards the lockout threshold of the effective password policy. \
                    A successful attempt on a locked account is rejected.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Attempt recorded"),
            @ApiResponse(responseCode = "400", description = "Account is locked")
    })
    @PostMapping("/users/{userId}/login-attempts")
    public ResponseEntity<Void> recordLoginAttempt(
            @PathVariable("userId") UUID userId,
            @Valid @RequestBody LoginAttemptRequest request
    ) {
        JwtAuthenticationPrincipal principal = SecurityUtils.getCurrentPrincipal();
        accessGuard.require(principal, AccessGuard.MANAGE_SESSIONS);
        accessControlReadService.requireMemberInScope(principal, userId);
        if (Boolean.TRUE.equals(request.success())) {
            accountLockoutService.recordSuccessfulLogin(userId, request.ipAddress(), request.userAgent());
        } else {
            accountLockoutService.recordFailedLogin(userId, request.ipAddress(), request.userAgent(),
                    request.failureReason());
        }
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/audit-logs")
    public ResponseEntity<PagedResponse<AuditLogResponse>> auditLogs(
            @RequestParam(name = "userId", required = false) UUID userId,
            @RequestParam(name = "makerspaceId", required = false) UUID makerspaceId,
            @RequestParam(name = "action", required = false) String action,
            @RequestParam(name = "resource", required = false) String resource,
            @RequestParam(name = "from", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime from,
            @RequestParam(name = "to", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime to,
            @RequestParam(name = "successOnly", defaultValue = "false") boolean successOnly,
            @RequestParam(name = "ipAddress", required = false) String ipAddress,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "100") int size
    ) {
        JwtAuthenticationPrincipal principal = SecurityUtils.getCurrentPrincipal();
        accessGuard.require(principal, AccessGuard.VIEW_AUDIT_LOGS);
        AuditLogSearchCondition condition = new AuditLogSearchCondition(
                userId,
                accessGuard.scopeMakerspace(principal, makerspaceId),
                action,
                resource,
                from,
                to,
                successOnly ? Boolean.TRUE : null,
                ipAddress
        );
        PageRequest pageable = PageRequest.of(Math.max(page, 0), Math.min(Math.max(size, 1), 1000));
        return ResponseEntity.ok(accessControlReadService.auditLogs(condition, pageable));
    }

    @Operation(summary = "Security alerts", description = "IP addresses with repeated failed logins inside the alert window.")
    @GetMapping("/security-alerts")
    public ResponseEntity<List<SecurityAlertResponse>> securityAlerts(
            @RequestParam(name = "resolved", required = false) Boolean resolved,
            @RequestParam(name = "severity", required = false) String severity,
            @RequestParam(name = "skip", defaultValue = "0") int skip,
            @RequestParam(name = "limit", defaultValue = "50") int limit
    ) {
        accessGuard.require(SecurityUtils.getCurrentPrincipal(), AccessGuard.VIEW_SECURITY_ALERTS);
        return ResponseEntity.ok(accessControlReadService.securityAlerts(resolved, severity, skip, Math.min(limit, 500)));
    }

    @GetMapping("/analytics/access-control")
    public ResponseEntity<AccessControlStatsResponse> analytics(
            @RequestParam(name = "makerspaceId", required = false) UUID makerspaceId
    ) {
        JwtAuthenticationPrincipal principal = SecurityUtils.getCurrentPrincipal();
        accessGuard.require(principal, AccessGuard.VIEW_ANALYTICS);
        return ResponseEntity.ok(accessControlReadService.stats(accessGuard.scopeMakerspace(principal, makerspaceId)));
    }

    @Operation(
            summary = "Seed default permissions and roles",
            description = "Creates the missing system permissions and the makerspace's system roles. Safe to repeat."
    )
    @PostMapping("/setup/default-roles")
    public ResponseEntity<DefaultSetupResponse> setupDefaultRoles(@RequestParam(name = "makerspaceId") UUID makerspaceId) {
        JwtAuthenticationPrincipal principal = SecurityUtils.getCurrentPrincipal();
        accessGuard.requireSuperAdmin(principal);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(defaultAccessSetupService.setupDefaults(makerspaceId, principal.userId()));
    }
}
