package com.ecommerce.user.modules.account.presentation.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RegisterRequest(
        @NotBlank(message = "email is required") @Email(message = "Enter a valid email address.") @Size(max = 255) String email,
        @NotBlank(message = "password is required") String password,
        @NotBlank(message = "password_confirm is required") String passwordConfirm,
        @Size(max = 150) String username,
        @Size(max = 150) String firstName,
        @Size(max = 150) String lastName,
        @Size(max = 20) String phoneNumber
) {
}
