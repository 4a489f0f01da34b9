package com.ecommerce.user.modules.account.presentation.dto;

public record AuthResponse(String message, UserResponse user, TokenPairResponse tokens) {
}
