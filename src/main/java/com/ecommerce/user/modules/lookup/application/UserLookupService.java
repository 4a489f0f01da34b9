package com.ecommerce.user.modules.lookup.application;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.ecommerce.user.modules.account.application.JwtTokenService;
import com.ecommerce.user.modules.account.application.JwtTokenService.AccessClaims;
import com.ecommerce.user.modules.account.application.JwtTokenService.InvalidTokenException;
import com.ecommerce.user.modules.account.application.PageWindow;
import com.ecommerce.user.modules.account.application.UserDirectory;
import com.ecommerce.user.modules.account.domain.UserAccount;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Read-only queries served to other services.
 *
 * <p>Every call resolves to a result value. Missing records and rejected tokens are expected answers;
 * anything thrown by the store or the token layer is logged and reported as {@link LookupStatus#INTERNAL}
 * carrying the exception text.</p>
 *
 * <p>Must stay non-transactional. Each {@link UserDirectory} read opens its own read-only transaction;
 * a failed read inside an outer transaction would mark that one rollback-only.</p>
 */
@Service
public class UserLookupService {

    private static final Logger log = LoggerFactory.getLogger(UserLookupService.class);

    private final UserDirectory userDirectory;
    private final JwtTokenService jwtTokenService;

    public UserLookupService(UserDirectory userDirectory, JwtTokenService jwtTokenService) {
        this.userDirectory = userDirectory;
        this.jwtTokenService = jwtTokenService;
    }

    /**
     * Looks a user up by id, active or not. An id that is not a UUID cannot match any record.
     */
    public UserLookupResult getUser(String userId) {
        Optional<UUID> id = parseUuid(userId);
        if (id.isEmpty()) {
            return UserLookupResult.notFound();
        }
        try {
            return userDirectory.findById(id.get())
                    .map(UserLookupResult::found)
                    .orElseGet(UserLookupResult::notFound);
        } catch (RuntimeException ex) {
            log.error("Error getting user {}", userId, ex);
            return UserLookupResult.failed(describe(ex));
        }
    }

    public UserLookupResult getUserByEmail(String email) {
        try {
            return userDirectory.findByEmail(email)
                    .map(UserLookupResult::found)
                    .orElseGet(UserLookupResult::notFound);
        } catch (RuntimeException ex) {
            log.error("Error getting user by email", ex);
            return UserLookupResult.failed(describe(ex));
        }
    }

    public TokenValidationResult validateToken(String token) {
        try {
            AccessClaims claims = jwtTokenService.verify(token);
            Optional<UserAccount> user = userDirectory.findById(claims.userId());
            if (user.isEmpty()) {
                return TokenValidationResult.rejected(UserLookupResult.NOT_FOUND);
            }
            if (!user.get().isActive()) {
                return TokenValidationResult.rejected("User account is disabled.");
            }
            return TokenValidationResult.valid(user.get().getId(), user.get().getEmail());
        } catch (InvalidTokenException ex) {
            return TokenValidationResult.rejected(ex.getMessage());
        } catch (RuntimeException ex) {
            log.error("Error validating token", ex);
            return TokenValidationResult.failed(describe(ex));
        }
    }

    /**
     * Lists active users, newest first. Out-of-range paging arguments are normalized by {@link PageWindow}.
     */
    public UserListResult listUsers(int page, int pageSize) {
        PageWindow window = PageWindow.of(page, pageSize);
        try {
            List<UserAccount> users = userDirectory.listActive(window.offset(), window.pageSize());
            long total = userDirectory.countActive();
            return new UserListResult(LookupStatus.OK, users, total);
        } catch (RuntimeException ex) {
            log.error("Error listing users (page={}, pageSize={})", page, pageSize, ex);
            return UserListResult.failed();
        }
    }

    private Optional<UUID> parseUuid(String raw) {
        if (!StringUtils.hasText(raw)) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(raw.trim()));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }

    private String describe(RuntimeException ex) {
        return ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
    }
}
