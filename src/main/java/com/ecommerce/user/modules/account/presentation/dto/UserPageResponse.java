package com.ecommerce.user.modules.account.presentation.dto;

import java.util.List;

public record UserPageResponse(
        List<UserResponse> results,
        int page,
        int pageSize,
        long count
) {
}
