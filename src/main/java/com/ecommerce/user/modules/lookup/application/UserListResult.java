package com.ecommerce.user.modules.lookup.application;

import java.util.List;

import com.ecommerce.user.modules.account.domain.UserAccount;

public record UserListResult(LookupStatus status, List<UserAccount> users, long total) {

    static UserListResult failed() {
        return new UserListResult(LookupStatus.INTERNAL, List.of(), 0L);
    }

    public boolean success() {
        return status == LookupStatus.OK;
    }
}
