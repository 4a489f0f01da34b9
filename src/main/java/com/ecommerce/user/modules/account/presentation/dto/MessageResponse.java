package com.ecommerce.user.modules.account.presentation.dto;

public record MessageResponse(String message) {
}
