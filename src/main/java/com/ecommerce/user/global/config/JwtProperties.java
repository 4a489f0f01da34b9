package com.ecommerce.user.global.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Token signing settings. TTLs are in milliseconds.
 */
@Validated
@ConfigurationProperties(prefix = "jwt")
public record JwtProperties(
        @NotBlank String secret,
        @DefaultValue("300000") @Positive long expiration,
        @DefaultValue("86400000") @Positive long refreshExpiration
) {
}
