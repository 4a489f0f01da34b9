package com.ecommerce.user.modules.account.application;

import java.util.Objects;

/**
 * Outcome of an account mutation: either a value or an {@link AccountError}.
 */
public final class AccountResult<T> {

    private final T value;
    private final AccountError error;

    private AccountResult(T value, AccountError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> AccountResult<T> ok(T value) {
        return new AccountResult<>(value, null);
    }

    public static <T> AccountResult<T> error(AccountError error) {
        return new AccountResult<>(null, Objects.requireNonNull(error, "error must not be null"));
    }

    public boolean isOk() {
        return error == null;
    }

    public T value() {
        if (error != null) {
            throw new IllegalStateException("No value present, failed with " + error);
        }
        return value;
    }

    public AccountError error() {
        return error;
    }
}
