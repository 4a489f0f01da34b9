package com.ecommerce.user.modules.lookup.application;

import java.util.UUID;

/**
 * Result of validating an access token. Only {@link LookupStatus#INTERNAL} is a transport-level failure;
 * rejected tokens are ordinary answers with {@code valid == false}.
 */
public record TokenValidationResult(LookupStatus status, boolean valid, String message, UUID userId, String email) {

    static TokenValidationResult valid(UUID userId, String email) {
        return new TokenValidationResult(LookupStatus.OK, true, "Token is valid.", userId, email);
    }

    static TokenValidationResult rejected(String message) {
        return new TokenValidationResult(LookupStatus.OK, false, message, null, null);
    }

    static TokenValidationResult failed(String message) {
        return new TokenValidationResult(LookupStatus.INTERNAL, false, message, null, null);
    }
}
