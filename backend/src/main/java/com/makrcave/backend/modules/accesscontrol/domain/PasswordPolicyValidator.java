package com.makrcave.backend.modules.accesscontrol.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Pure password checks against a {@link PasswordPolicy}, or against the built-in minimum when a
 * makerspace has no policy at all.
 */
public final class PasswordPolicyValidator {

    public static final int BUILT_IN_MIN_LENGTH = 8;

    private static final Set<String> COMMON_PASSWORDS = Set.of("password", "123456", "qwerty", "admin");

    private PasswordPolicyValidator() {
    }

    public static PasswordValidationResult validate(String password, PasswordPolicy policy) {
        if (policy == null) {
            return validateWithoutPolicy(password);
        }
        String candidate = password == null ? "" : password;
        int length = candidate.codePointCount(0, candidate.length());
        String specials = policy.getAllowedSpecialChars() == null ? "" : policy.getAllowedSpecialChars();

        boolean hasUpper = candidate.codePoints().anyMatch(Character::isUpperCase);
        boolean hasLower = candidate.codePoints().anyMatch(Character::isLowerCase);
        boolean hasDigit = candidate.codePoints().anyMatch(Character::isDigit);
        boolean hasSpecial = candidate.codePoints().anyMatch(cp -> specials.indexOf(cp) >= 0);

        List<String> errors = new ArrayList<>();
        List<String> suggestions = new ArrayList<>();
        if (length < policy.getMinLength()) {
            errors.add("Password must be at least " + policy.getMinLength() + " characters long");
            suggestions.add("Use a longer passphrase");
        }
        if (length > policy.getMaxLength()) {
            errors.add("Password must be no more than " + policy.getMaxLength() + " characters long");
        }
        if (policy.isRequireUppercase() && !hasUpper) {
            errors.add("Password must contain at least one uppercase letter");
            suggestions.add("Add an uppercase letter (A-Z)");
        }
        if (policy.isRequireLowercase() && !hasLower) {
            errors.add("Password must contain at least one lowercase letter");
            suggestions.add("Add a lowercase letter (a-z)");
        }
        if (policy.isRequireNumbers() && !hasDigit) {
            errors.add("Password must contain at least one number");
            suggestions.add("Add a digit (0-9)");
        }
        if (policy.isRequireSpecialChars() && !hasSpecial) {
            errors.add("Password must contain at least one special character: " + specials);
            suggestions.add("Add one of " + specials);
        }

        // advisory only; a short password still earns its length points
        int score = Math.min(25, length * 2);
        if (hasUpper) {
            score += 15;
        }
        if (hasLower) {
            score += 15;
        }
        if (hasDigit) {
            score += 15;
        }
        if (hasSpecial) {
            score += 20;
        }
        if (isCommonPassword(candidate)) {
            score = Math.max(0, score - 50);
            suggestions.add("Avoid commonly used passwords");
        }
        score = Math.max(0, Math.min(100, score));

        return new PasswordValidationResult(errors.isEmpty(), errors, score, suggestions);
    }

    /**
     * Built-in rule used when neither the makerspace nor the platform defines a policy.
     */
    public static PasswordValidationResult validateWithoutPolicy(String password) {
        String candidate = password == null ? "" : password;
        int length = candidate.codePointCount(0, candidate.length());
        boolean valid = length >= BUILT_IN_MIN_LENGTH;
        List<String> errors = valid
                ? List.of()
                : List.of("Password must be at least " + BUILT_IN_MIN_LENGTH + " characters long");
        List<String> suggestions = valid ? List.of() : List.of("Use a longer passphrase");
        return new PasswordValidationResult(valid, errors, Math.min(100, length * 5), suggestions);
    }

    private static boolean isCommonPassword(String candidate) {
        return COMMON_PASSWORDS.contains(candidate.toLowerCase(Locale.ROOT));
    }
}
