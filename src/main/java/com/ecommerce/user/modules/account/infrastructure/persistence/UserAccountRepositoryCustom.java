package com.ecommerce.user.modules.account.infrastructure.persistence;

import java.util.List;

import com.ecommerce.user.modules.account.domain.UserAccount;

public interface UserAccountRepositoryCustom {

    /**
     * Active accounts, newest first, windowed by a raw row offset.
     */
    List<UserAccount> findActiveWindow(long offset, int limit);
}
