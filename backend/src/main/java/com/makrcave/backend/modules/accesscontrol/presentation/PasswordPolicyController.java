package com.makrcave.backend.modules.accesscontrol.presentation;

import java.util.List;
import java.util.UUID;

import com.makrcave.backend.global.security.JwtAuthenticationPrincipal;
import com.makrcave.backend.global.security.SecurityUtils;
import com.makrcave.backend.modules.accesscontrol.application.AccessGuard;
import com.makrcave.backend.modules.accesscontrol.application.PasswordPolicyService;
import com.makrcave.backend.modules.accesscontrol.domain.PasswordValidationResult;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.CreatePasswordPolicyRequest;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.EffectivePasswordPolicyResponse;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.PasswordPolicyResponse;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.PasswordValidationRequest;
import com.makrcave.backend.modules.accesscontrol.presentation.dto.UpdatePasswordPolicyRequest;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/access-control/password-policies")
public class PasswordPolicyController {

    private final PasswordPolicyService passwordPolicyService;
    private final AccessGuard accessGuard;

    public PasswordPolicyController(PasswordPolicyService passwordPolicyService, AccessGuard accessGuard) {
        this.passwordPolicyService = passwordPolicyService;
        this.accessGuard = accessGuard;
    }

    @Operation(summary = "Create a password policy", description = "A makerspace, and the global scope, hold at most one active policy.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Policy created"),
            @ApiResponse(responseCode = "409", description = "An active policy already exists for the scope")
    })
    @PostMapping
    public ResponseEntity<PasswordPolicyResponse> createPolicy(@Valid @RequestBody CreatePasswordPolicyRequest request) {
        JwtAuthenticationPrincipal principal = SecurityUtils.getCurrentPrincipal();
        accessGuard.require(principal, AccessGuard.MANAGE_SETTINGS);
        return ResponseEntity.status(HttpStatus.CREATED).body(passwordPolicyService.createPolicy(request, principal));
    }

    @GetMapping
    public ResponseEntity<List<PasswordPolicyResponse>> listPolicies(
            @RequestParam(name = "makerspaceId", required = false) UUID makerspaceId
    ) {
        JwtAuthenticationPrincipal principal = SecurityUtils.getCurrentPrincipal();
        accessGuard.require(principal, AccessGuard.VIEW_SETTINGS);
        return ResponseEntity.ok(passwordPolicyService.listPolicies(accessGuard.scopeMakerspace(principal, makerspaceId)));
    }

    @PutMapping("/{policyId}")
    public ResponseEntity<PasswordPolicyResponse> updatePolicy(
            @PathVariable("policyId") UUID policyId,
            @Valid @RequestBody UpdatePasswordPolicyRequest request
    ) {
        JwtAuthenticationPrincipal principal = SecurityUtils.getCurrentPrincipal();
        accessGuard.require(principal, AccessGuard.MANAGE_SETTINGS);
        return ResponseEntity.ok(passwordPolicyService.updatePolicy(policyId, request, principal));
    }

    @Operation(
            summary = "Effective password policy",
            description = "The makerspace policy, else the global policy, else the built-in minimum length of 8."
    )
    @GetMapping("/effective")
    public ResponseEntity<EffectivePasswordPolicyResponse> effectivePolicy(
            @RequestParam(name = "makerspaceId", required = false) UUID makerspaceId
    ) {
        JwtAuthenticationPrincipal principal = SecurityUtils.getCurrentPrincipal();
        return ResponseEntity.ok(passwordPolicyService.describeEffectivePolicy(
                accessGuard.scopeMakerspace(principal, makerspaceId)));
    }

    @Operation(summary = "Check a password against the effective policy")
    @PostMapping("/validate")
    public ResponseEntity<PasswordValidationResult> validatePassword(@Valid @RequestBody PasswordValidationRequest request) {
        JwtAuthenticationPrincipal principal = SecurityUtils.getCurrentPrincipal();
        return ResponseEntity.ok(passwordPolicyService.validatePassword(request.password(),
                accessGuard.scopeMakerspace(principal, request.makerspaceId())));
    }
}
