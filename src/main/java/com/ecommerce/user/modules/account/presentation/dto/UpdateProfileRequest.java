package com.ecommerce.user.modules.account.presentation.dto;

import jakarta.validation.constraints.Size;

/**
 * Profile fields a user may change. {@code null} leaves the stored value untouched.
 */
public record UpdateProfileRequest(
        @Size(max = 150) String username,
        @Size(max = 150) String firstName,
        @Size(max = 150) String lastName,
        @Size(max = 20) String phoneNumber
) {
}
