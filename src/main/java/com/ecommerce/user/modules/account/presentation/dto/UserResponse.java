package com.ecommerce.user.modules.account.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.ecommerce.user.modules.account.domain.UserAccount;
import com.fasterxml.jackson.annotation.JsonProperty;

public record UserResponse(
        UUID id,
        String email,
        String username,
        String firstName,
        String lastName,
        String phoneNumber,
        @JsonProperty("is_active") boolean isActive,
        @JsonProperty("is_verified") boolean isVerified,
        OffsetDateTime dateJoined,
        OffsetDateTime updatedAt
) {

    public static UserResponse from(UserAccount user) {
        return new UserResponse(
                user.getId(),
                user.getEmail(),
                user.getUsername(),
                user.getFirstName(),
                user.getLastName(),
                user.getPhoneNumber(),
                user.isActive(),
                user.isVerified(),
                user.getCreatedAt(),
                user.getUpdatedAt()
        );
    }
}
