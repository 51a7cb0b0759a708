package com.authcore.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class CredentialRulesTest {

    @Test
    void normalizeTrimsAndLowerCases() {
        assertThat(CredentialRules.normalizeEmail("  Alice@Example.COM\t")).isEqualTo("alice@example.com");
        assertThat(CredentialRules.normalizeEmail(null)).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(strings = {"alice@example.com", "a.b+tag@sub.example.io", "x_y%z@host-name.org"})
    void acceptsWellFormedEmails(String email) {
        assertThat(CredentialRules.isValidEmail(email)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "alice", "alice@", "@example.com", "alice@example", "alice@example.c", "a b@example.com"})
    void rejectsMalformedEmails(String email) {
        assertThat(CredentialRules.isValidEmail(email)).isFalse();
    }

    @Test
    void passwordNeedsLengthAndAllThreeCharacterClasses() {
        assertThat(CredentialRules.isValidPassword("Passw0rd")).isTrue();
        assertThat(CredentialRules.isValidPassword("Pass0rd")).isFalse();
        assertThat(CredentialRules.isValidPassword("password1")).isFalse();
        assertThat(CredentialRules.isValidPassword("PASSWORD1")).isFalse();
        assertThat(CredentialRules.isValidPassword("Password")).isFalse();
        assertThat(CredentialRules.isValidPassword(null)).isFalse();
    }

    @Test
    void passwordLongerThanBcryptInputIsRejected() {
        String seventyTwo = "Aa1" + "x".repeat(69);
        assertThat(CredentialRules.isValidPassword(seventyTwo)).isTrue();
        assertThat(CredentialRules.isValidPassword(seventyTwo + "x")).isFalse();
        // two bytes per character in UTF-8
        assertThat(CredentialRules.isValidPassword("Aa1" + "é".repeat(35))).isFalse();
    }
}
