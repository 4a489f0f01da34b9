package com.ecommerce.user.modules.account.application;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class PasswordPolicyTest {

    private final PasswordPolicy policy = new PasswordPolicy();

    @Test
    void acceptsReasonablePassword() {
        assertThat(policy.check("Str0ng-Passphrase", "alice@example.com", "alice")).isEmpty();
    }

    @Test
    void rejectsShortPassword() {
        assertThat(policy.check("Ab1-x", "alice@example.com", null)).contains(AccountError.PASSWORD_TOO_SHORT);
    }

    @Test
    void rejectsCommonPasswordIgnoringCase() {
        assertThat(policy.check("PassWord123", "alice@example.com", null)).contains(AccountError.PASSWORD_TOO_COMMON);
    }

    @Test
    void rejectsPasswordEqualToEmailLocalPartOrUsername() {
        assertThat(policy.check("alice.wonder", "alice.wonder@example.com", null))
                .contains(AccountError.PASSWORD_TOO_SIMILAR);
        assertThat(policy.check("WonderlandQueen", "alice@example.com", "wonderlandqueen"))
                .contains(AccountError.PASSWORD_TOO_SIMILAR);
    }
}
