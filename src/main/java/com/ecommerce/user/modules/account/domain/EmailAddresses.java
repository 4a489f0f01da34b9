package com.ecommerce.user.modules.account.domain;

import java.util.Locale;

public final class EmailAddresses {

    private EmailAddresses() {
    }

    /**
     * Stored and looked-up form of an email: trimmed and lower-cased.
     */
    public static String normalize(String email) {
        if (email == null) {
            return null;
        }
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
