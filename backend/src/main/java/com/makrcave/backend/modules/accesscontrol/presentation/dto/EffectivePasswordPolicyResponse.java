package com.makrcave.backend.modules.accesscontrol.presentation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * @param source {@code makerspace}, {@code global} or {@code built_in}
 * @param policy stored policy in force, absent for the built-in minimum
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EffectivePasswordPolicyResponse(
        String source,
        int minLength,
        PasswordPolicyResponse policy
) {
}
