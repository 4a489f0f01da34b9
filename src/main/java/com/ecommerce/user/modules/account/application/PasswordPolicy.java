package com.ecommerce.user.modules.account.application;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import org.springframework.stereotype.Component;

@Component
public class PasswordPolicy {

    static final int MIN_LENGTH = 8;

    private static final Set<String> COMMON_PASSWORDS = Set.of(
            "password", "password1", "password123", "passw0rd", "12345678", "123456789", "1234567890",
            "qwerty123", "qwertyuiop", "iloveyou", "sunshine", "princess", "football", "baseball",
            "welcome1", "letmein1", "admin123", "abc12345", "trustno1", "superman", "11111111", "00000000"
    );

    public Optional<AccountError> check(String password, String email, String username) {
        if (password == null || password.length() < MIN_LENGTH) {
            return Optional.of(AccountError.PASSWORD_TOO_SHORT);
        }
        if (password.chars().allMatch(Character::isDigit)) {
            return Optional.of(AccountError.PASSWORD_ENTIRELY_NUMERIC);
        }
        String lowered = password.toLowerCase(Locale.ROOT);
        if (COMMON_PASSWORDS.contains(lowered)) {
            return Optional.of(AccountError.PASSWORD_TOO_COMMON);
        }
        if (isSimilar(lowered, email) || isSimilar(lowered, localPart(email)) || isSimilar(lowered, username)) {
            return Optional.of(AccountError.PASSWORD_TOO_SIMILAR);
        }
        return Optional.empty();
    }

    private boolean isSimilar(String loweredPassword, String attribute) {
        if (attribute == null || attribute.isBlank()) {
            return false;
        }
        return loweredPassword.equals(attribute.trim().toLowerCase(Locale.ROOT));
    }

    private String localPart(String email) {
        if (email == null) {
            return null;
        }
        int at = email.indexOf('@');
        return at > 0 ? email.substring(0, at) : email;
    }
}
