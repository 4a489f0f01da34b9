package com.ecommerce.user.modules.account.presentation.dto;

import java.time.OffsetDateTime;

public record TokenPairResponse(
        String access,
        String refresh,
        String tokenType,
        long expiresIn,
        long refreshExpiresIn,
        OffsetDateTime issuedAt
) {
    public static final String DEFAULT_TOKEN_TYPE = "Bearer";
}
