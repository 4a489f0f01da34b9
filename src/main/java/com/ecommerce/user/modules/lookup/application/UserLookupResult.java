package com.ecommerce.user.modules.lookup.application;

import com.ecommerce.user.modules.account.domain.UserAccount;

public record UserLookupResult(LookupStatus status, String message, UserAccount user) {

    static final String FOUND = "User found.";
    static final String NOT_FOUND = "User not found.";

    static UserLookupResult found(UserAccount user) {
        return new UserLookupResult(LookupStatus.OK, FOUND, user);
    }

    static UserLookupResult notFound() {
        return new UserLookupResult(LookupStatus.NOT_FOUND, NOT_FOUND, null);
    }

    static UserLookupResult failed(String message) {
        return new UserLookupResult(LookupStatus.INTERNAL, message, null);
    }

    public boolean success() {
        return status == LookupStatus.OK;
    }
}
