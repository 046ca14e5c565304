package com.makrcave.backend.modules.accesscontrol.domain;

import java.util.List;

/**
 * Outcome of checking a candidate password. {@code strengthScore} (0..100) is advisory and never
 * affects {@code valid}.
 */
public record PasswordValidationResult(boolean valid, List<String> errors, int strengthScore, List<String> suggestions) {

    public PasswordValidationResult {
        errors = List.copyOf(errors);
        suggestions = List.copyOf(suggestions);
    }
}
