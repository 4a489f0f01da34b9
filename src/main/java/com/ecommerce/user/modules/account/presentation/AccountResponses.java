package com.ecommerce.user.modules.account.presentation;

import com.ecommerce.user.global.error.ProblemException;
import com.ecommerce.user.modules.account.application.AccountError;
import com.ecommerce.user.modules.account.application.AccountResult;

import org.springframework.http.HttpStatus;

final class AccountResponses {

    private AccountResponses() {
    }

    /**
     * Returns the value or raises a 400 problem named after the {@link AccountError}.
     */
    static <T> T unwrap(AccountResult<T> result) {
        if (result.isOk()) {
            return result.value();
        }
        AccountError error = result.error();
        throw new ProblemException(HttpStatus.BAD_REQUEST, error.name(), error.field() + ": " + error.message());
    }
}
