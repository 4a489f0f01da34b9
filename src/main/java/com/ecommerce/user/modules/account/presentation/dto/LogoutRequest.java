package com.ecommerce.user.modules.account.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record LogoutRequest(@NotBlank(message = "refresh is required") String refresh) {
}
