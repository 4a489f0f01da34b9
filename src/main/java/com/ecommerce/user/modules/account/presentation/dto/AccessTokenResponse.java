package com.ecommerce.user.modules.account.presentation.dto;

public record AccessTokenResponse(String access, String tokenType, long expiresIn) {
}
