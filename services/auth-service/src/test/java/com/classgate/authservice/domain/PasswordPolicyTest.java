package com.classgate.authservice.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("PasswordPolicy")
class PasswordPolicyTest {

    private final PasswordPolicy defaults = PasswordPolicy.defaults();

    @Test
    @DisplayName("accepts a password with letters and digits at the minimum length")
    void acceptsValid() {
        assertThat(defaults.violations("Passw0rd")).isEmpty();
    }

    @Test
    @DisplayName("flags length, missing letter and missing digit separately")
    void flagsEachRule() {
        assertThat(defaults.violations("Pa55")).containsExactly("password must be at least 8 characters");
        assertThat(defaults.violations("12345678")).containsExactly("password must contain at least one letter");
        assertThat(defaults.violations("Password")).containsExactly("password must contain at least one digit");
    }

    @Test
    @DisplayName("flags passwords over 72 bytes")
    void flagsOversized() {
        assertThat(defaults.violations("a1".repeat(37))).containsExactly("password must be at most 72 bytes");
    }

    @Test
    @DisplayName("empty and null passwords get a single error")
    void empty() {
        assertThat(defaults.violations("")).containsExactly("password must not be empty");
        assertThat(defaults.violations(null)).containsExactly("password must not be empty");
    }

    @Test
    @DisplayName("complexity rules can be switched off")
    void relaxed() {
        var relaxed = new PasswordPolicy(4, false, false);

        assertThat(relaxed.violations("abcd")).isEmpty();
        assertThat(relaxed.violations("1234")).isEmpty();
    }

    @Test
    @DisplayName("rejects a minimum length outside 1..72")
    void rejectsBadMinimum() {
        assertThatThrownBy(() -> new PasswordPolicy(0, true, true))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PasswordPolicy(73, true, true))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
