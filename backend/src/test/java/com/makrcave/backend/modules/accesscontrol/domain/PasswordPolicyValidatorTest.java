package com.makrcave.backend.modules.accesscontrol.domain;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class PasswordPolicyValidatorTest {

    @Test
    void compliantPasswordPassesFullPolicy() {
        PasswordPolicy policy = new PasswordPolicy(null);

        PasswordValidationResult result = PasswordPolicyValidator.validate("Ab1!defg", policy);

        assertThat(result.valid()).isTrue();
        assertThat(result.errors()).isEmpty();
    }

    @Test
    void shortPasswordReportsLength() {
        PasswordPolicy policy = new PasswordPolicy(null);
        policy.setRequireUppercase(false);
        policy.setRequireNumbers(false);
        policy.setRequireSpecialChars(false);

        PasswordValidationResult result = PasswordPolicyValidator.validate("abc", policy);

        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).singleElement().asString().contains("at least 8 characters");
        assertThat(result.strengthScore()).isEqualTo(21);
    }

    @Test
    void everyMissingClassIsReported() {
        PasswordPolicy policy = new PasswordPolicy(null);

        PasswordValidationResult result = PasswordPolicyValidator.validate("abcdefgh", policy);

        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).hasSize(3);
        assertThat(result.suggestions()).hasSize(3);
    }

    @Test
    void specialCharacterMustComeFromAllowedSet() {
        PasswordPolicy policy = new PasswordPolicy(null);
        policy.setAllowedSpecialChars("#");

        assertThat(PasswordPolicyValidator.validate("Abcdefg1!", policy).valid()).isFalse();
        assertThat(PasswordPolicyValidator.validate("Abcdefg1#", policy).valid()).isTrue();
    }

    @Test
    void tooLongPasswordIsRejected() {
        PasswordPolicy policy = new PasswordPolicy(null);
        policy.setMaxLength(10);

        assertThat(PasswordPolicyValidator.validate("Abcdefghij1!", policy).valid()).isFalse();
    }

    @Test
    void commonPasswordLowersScoreOnly() {
        PasswordPolicy policy = new PasswordPolicy(null);
        policy.setRequireUppercase(false);
        policy.setRequireNumbers(false);
        policy.setRequireSpecialChars(false);

        PasswordValidationResult result = PasswordPolicyValidator.validate("password", policy);

        assertThat(result.valid()).isTrue();
        assertThat(result.strengthScore()).isLessThan(20);
        assertThat(result.suggestions()).contains("Avoid commonly used passwords");
    }

    @Test
    void withoutPolicyOnlyLengthIsChecked() {
        assertThat(PasswordPolicyValidator.validate("abcdefgh", null).valid()).isTrue();
        PasswordValidationResult shortOne = PasswordPolicyValidator.validate("abc", null);
        assertThat(shortOne.valid()).isFalse();
        assertThat(shortOne.errors()).singleElement().asString().contains("8");
    }

    @Test
    void nullPasswordIsInvalid() {
        assertThat(PasswordPolicyValidator.validate(null, new PasswordPolicy(null)).valid()).isFalse();
        assertThat(PasswordPolicyValidator.validate(null, null).valid()).isFalse();
    }
}
