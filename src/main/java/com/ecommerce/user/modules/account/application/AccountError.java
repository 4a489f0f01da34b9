package com.ecommerce.user.modules.account.application;

/**
 * Expected, caller-correctable account failures. Each carries the request field it concerns.
 */
public enum AccountError {

    EMAIL_ALREADY_EXISTS("email", "A user with this email already exists."),
    PASSWORD_MISMATCH("password_confirm", "Passwords do not match."),
    NEW_PASSWORD_MISMATCH("new_password_confirm", "New passwords do not match."),
    PASSWORD_TOO_SHORT("password", "This password is too short. It must contain at least 8 characters."),
    PASSWORD_ENTIRELY_NUMERIC("password", "This password is entirely numeric."),
    PASSWORD_TOO_COMMON("password", "This password is too common."),
    PASSWORD_TOO_SIMILAR("password", "The password is too similar to the email or username."),
    OLD_PASSWORD_INCORRECT("old_password", "Old password is incorrect."),
    USERNAME_TAKEN("username", "This username is already taken.");

    private final String field;
    private final String message;

    AccountError(String field, String message) {
        this.field = field;
        this.message = message;
    }

    public String field() {
        return field;
    }

    public String message() {
        return message;
    }
}
