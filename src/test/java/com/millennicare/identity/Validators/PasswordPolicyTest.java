package com.millennicare.identity.Validators;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class PasswordPolicyTest {

    private final StrongPasswordValidator validator = new StrongPasswordValidator();

    @ParameterizedTest
    @ValueSource(strings = {"Password1!", "ABCDEFG#", "aaaaaaaaaaaaA&"})
    void acceptsCompliantPasswords(String password) {
        assertThat(PasswordPolicy.isSatisfiedBy(password)).isTrue();
        assertThat(validator.isValid(password, null)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"short1!", "password1!", "Password123", ""})
    void rejectsNonCompliantPasswords(String password) {
        assertThat(PasswordPolicy.isSatisfiedBy(password)).isFalse();
        assertThat(validator.isValid(password, null)).isFalse();
    }

    @Test
    void rejectsPasswordsLongerThanSixtyFour() {
        String tooLong = "A!" + "a".repeat(63);

        assertThat(PasswordPolicy.isSatisfiedBy(tooLong)).isFalse();
        assertThat(PasswordPolicy.isSatisfiedBy(tooLong.substring(0, 64))).isTrue();
    }

    @Test
    void nullIsLeftToNotBlank() {
        assertThat(PasswordPolicy.isSatisfiedBy(null)).isFalse();
        assertThat(validator.isValid(null, null)).isTrue();
    }
}
