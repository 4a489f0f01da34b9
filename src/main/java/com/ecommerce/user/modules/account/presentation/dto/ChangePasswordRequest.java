package com.ecommerce.user.modules.account.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record ChangePasswordRequest(
        @NotBlank(message = "old_password is required") String oldPassword,
        @NotBlank(message = "new_password is required") String newPassword,
        @NotBlank(message = "new_password_confirm is required") String newPasswordConfirm
) {
}
