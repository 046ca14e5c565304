package com.makrcave.backend.modules.accesscontrol.presentation;

import java.util.List;
import java.util.UUID;

import com.makrcave.backend.global.security.JwtAuthenticationPrincipal;
import com.makrcave.backend.global.security.SecurityUtils;
import com.makrcave.backend.modules.accesscontrol.application.AccessControlReadService;
import com.makrcave.backend.modules.accesscontrol.application.AccessGuard;
import com.makrcave.backend.modules.accesscontrol.application.SessionService;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.CreateSessionRequest;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.UserSessionResponse;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/access-control")
public class SessionController {

    private final SessionService sessionService;
    private final AccessControlReadService accessControlReadService;
    private final AccessGuard accessGuard;

    public SessionController(
            SessionService sessionService,
            AccessControlReadService accessControlReadService,
            AccessGuard accessGuard
    ) {
        this.sessionService = sessionService;
        this.accessControlReadService = accessControlReadService;
        this.accessGuard = accessGuard;
    }

    @Operation(
            summary = "Open a session",
            description = """
                    Registers a new session for the user. Fails when the account is locked or inactive, \
                    or when the user already has as many live sessions as the strictest applicable cap allows.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Session opened"),
            @ApiResponse(responseCode = "400", description = "Account locked, inactive or at its session limit"),
            @ApiResponse(responseCode = "409", description = "Session token already in use")
    })
    @PostMapping("/sessions")
    public ResponseEntity<UserSessionResponse> openSession(@Valid @RequestBody CreateSessionRequest request) {
        JwtAuthenticationPrincipal principal = SecurityUtils.getCurrentPrincipal();
        accessGuard.require(principal, AccessGuard.MANAGE_SESSIONS);
        accessControlReadService.requireMemberInScope(principal, request.userId());
        return ResponseEntity.status(HttpStatus.CREATED).body(sessionService.openSession(request, principal.userId()));
    }

    @Operation(summary = "List sessions", description = "Without `userId` the caller's own sessions are listed.")
    @GetMapping("/sessions")
    public ResponseEntity<List<UserSessionResponse>> listSessions(
            @RequestParam(name = "userId", required = false) UUID userId,
            @RequestParam(name = "activeOnly", defaultValue = "true") boolean activeOnly
    ) {
        JwtAuthenticationPrincipal principal = SecurityUtils.getCurrentPrincipal();
        UUID target = userId != null ? userId : principal.userId();
        accessGuard.requireSelfOr(principal, target, AccessGuard.VIEW_SESSIONS);
        accessControlReadService.requireMemberInScope(principal, target);
        return ResponseEntity.ok(sessionService.listSessions(target, activeOnly));
    }

    @DeleteMapping("/sessions/{sessionId}")
    public ResponseEntity<Void> terminateSession(
            @PathVariable("sessionId") UUID sessionId,
            @RequestParam(name = "reason", required = false) String reason
    ) {
        sessionService.terminateSession(sessionId, reason, SecurityUtils.getCurrentPrincipal());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/sessions/{sessionId}/extend")
    public ResponseEntity<UserSessionResponse> extendSession(
            @PathVariable("sessionId") UUID sessionId,
            @RequestParam(name = "minutes", defaultValue = "60") int minutes
    ) {
        return ResponseEntity.ok(sessionService.extendSession(sessionId, minutes, SecurityUtils.getCurrentPrincipal()));
    }

    @Operation(summary = "Terminate every live session of a user")
    @DeleteMapping("/users/{userId}/sessions")
    public ResponseEntity<Void> terminateAllSessions(
            @PathVariable("userId") UUID userId,
            @RequestParam(name = "reason", required = false) String reason
    ) {
        JwtAuthenticationPrincipal principal = SecurityUtils.getCurrentPrincipal();
        accessGuard.require(principal, AccessGuard.MANAGE_SESSIONS);
        accessControlReadService.requireMemberInScope(principal, userId);
        sessionService.terminateAllSessions(userId, reason, principal.userId());
        return ResponseEntity.noContent().build();
    }
}
