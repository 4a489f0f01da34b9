package com.ecommerce.user.global.security;

import java.util.UUID;

public record JwtAuthenticationPrincipal(UUID userId, String email, boolean staff) {
}
