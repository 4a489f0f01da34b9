package com.ecommerce.user.modules.account.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.ecommerce.user.global.error.ProblemException;
import com.ecommerce.user.modules.account.application.JwtTokenService.InvalidTokenException;
import com.ecommerce.user.modules.account.application.JwtTokenService.RefreshClaims;
import com.ecommerce.user.modules.account.domain.EmailAddresses;
import com.ecommerce.user.modules.account.domain.UserAccount;
import com.ecommerce.user.modules.account.infrastructure.persistence.UserAccountRepository;
import com.ecommerce.user.modules.account.presentation.dto.AccessTokenResponse;
import com.ecommerce.user.modules.account.presentation.dto.AuthResponse;
import com.ecommerce.user.modules.account.presentation.dto.ChangePasswordRequest;
import com.ecommerce.user.modules.account.presentation.dto.LoginRequest;
import com.ecommerce.user.modules.account.presentation.dto.LogoutRequest;
import com.ecommerce.user.modules.account.presentation.dto.RefreshRequest;
import com.ecommerce.user.modules.account.presentation.dto.RegisterRequest;
import com.ecommerce.user.modules.account.presentation.dto.TokenPairResponse;
import com.ecommerce.user.modules.account.presentation.dto.UpdateProfileRequest;
import com.ecommerce.user.modules.account.presentation.dto.UserPageResponse;
import com.ecommerce.user.modules.account.presentation.dto.UserResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Service
@Transactional
public class AccountService {

    private static final Logger log = LoggerFactory.getLogger(AccountService.class);

    private final UserAccountRepository userAccountRepository;
    private final UserDirectory userDirectory;
    private final PasswordEncoder passwordEncoder;
    private final PasswordPolicy passwordPolicy;
    private final JwtTokenService jwtTokenService;
    private final Clock clock;

    public AccountService(
            UserAccountRepository userAccountRepository,
            UserDirectory userDirectory,
            PasswordEncoder passwordEncoder,
            PasswordPolicy passwordPolicy,
            JwtTokenService jwtTokenService,
            Clock clock
    ) {
        this.userAccountRepository = userAccountRepository;
        this.userDirectory = userDirectory;
        this.passwordEncoder = passwordEncoder;
        this.passwordPolicy = passwordPolicy;
        this.jwtTokenService = jwtTokenService;
        this.clock = clock;
    }

    public AccountResult<AuthResponse> register(RegisterRequest request) {
        String email = EmailAddresses.normalize(request.email());
        if (userAccountRepository.existsByEmail(email)) {
            return AccountResult.error(AccountError.EMAIL_ALREADY_EXISTS);
        }
        String username = trimToNull(request.username());
        if (username != null && userAccountRepository.existsByUsername(username)) {
            return AccountResult.error(AccountError.USERNAME_TAKEN);
        }
        if (!request.password().equals(request.passwordConfirm())) {
            return AccountResult.error(AccountError.PASSWORD_MISMATCH);
        }
        Optional<AccountError> weakness = passwordPolicy.check(request.password(), email, username);
        if (weakness.isPresent()) {
            return AccountResult.error(weakness.get());
        }

        UserAccount user = new UserAccount();
        user.setEmail(email);
        user.setPasswordHash(passwordEncoder.encode(request.password()));
        user.setUsername(username);
        user.setFirstName(trimToNull(request.firstName()));
        user.setLastName(trimToNull(request.lastName()));
        user.setPhoneNumber(trimToNull(request.phoneNumber()));
        user.setActive(true);
        UserAccount saved = userAccountRepository.saveAndFlush(user);

        TokenPairResponse tokens = jwtTokenService.issuePair(saved);
        log.info("User registered: {}", saved.getEmail());
        return AccountResult.ok(new AuthResponse("User registered successfully.", UserResponse.from(saved), tokens));
    }

    public AuthResponse login(LoginRequest request) {
        UserAccount user = userDirectory.findByEmail(request.email())
                .orElseThrow(() -> invalidCredentials());

        if (!passwordEncoder.matches(request.password(), user.getPasswordHash())) {
            throw invalidCredentials();
        }
        if (!user.isActive()) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "USER_INACTIVE", "User account is disabled.");
        }

        user.setLastLoginAt(OffsetDateTime.now(clock));
        userAccountRepository.save(user);

        TokenPairResponse tokens = jwtTokenService.issuePair(user);
        log.info("User logged in: {}", user.getEmail());
        return new AuthResponse("Login successful.", UserResponse.from(user), tokens);
    }

    public void logout(UUID currentUserId, LogoutRequest request) {
        try {
            jwtTokenService.revoke(request.refresh());
        } catch (InvalidTokenException ex) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_REFRESH_TOKEN", "Invalid or expired token.");
        }
        log.info("User logged out: {}", currentUserId);
    }

    @Transactional(readOnly = true)
    public AccessTokenResponse refresh(RefreshRequest request) {
        RefreshClaims claims;
        try {
            claims = jwtTokenService.verifyRefresh(request.refresh());
        } catch (InvalidTokenException ex) {
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_REFRESH_TOKEN", "Token is invalid or expired");
        }

        UserAccount user = userDirectory.findById(claims.userId())
                .filter(UserAccount::isActive)
                .orElseThrow(() -> new ProblemException(HttpStatus.UNAUTHORIZED, "USER_INACTIVE", "User not found or inactive."));

        String access = jwtTokenService.issueAccessToken(user);
        return new AccessTokenResponse(access, TokenPairResponse.DEFAULT_TOKEN_TYPE, jwtTokenService.getAccessTokenTtlMillis() / 1000L);
    }

    @Transactional(readOnly = true)
    public UserResponse loadProfile(UUID userId) {
        return UserResponse.from(loadActiveUser(userId));
    }

    public AccountResult<UserResponse> updateProfile(UUID userId, UpdateProfileRequest request) {
        UserAccount user = loadActiveUser(userId);

        if (request.username() != null) {
            String username = trimToNull(request.username());
            if (username != null && userAccountRepository.existsByUsernameExcluding(username, user.getId())) {
                return AccountResult.error(AccountError.USERNAME_TAKEN);
            }
            user.setUsername(username);
        }
        if (request.firstName() != null) {
            user.setFirstName(trimToNull(request.firstName()));
        }
        if (request.lastName() != null) {
            user.setLastName(trimToNull(request.lastName()));
        }
        if (request.phoneNumber() != null) {
            user.setPhoneNumber(trimToNull(request.phoneNumber()));
        }

        UserAccount saved = userAccountRepository.saveAndFlush(user);
        return AccountResult.ok(UserResponse.from(saved));
    }

    public void deactivate(UUID userId) {
        UserAccount user = loadActiveUser(userId);
        user.setActive(false);
        userAccountRepository.save(user);
        log.info("User deactivated: {}", user.getEmail());
    }

    public AccountResult<UserResponse> changePassword(UUID userId, ChangePasswordRequest request) {
        UserAccount user = loadActiveUser(userId);

        if (!passwordEncoder.matches(request.oldPassword(), user.getPasswordHash())) {
            return AccountResult.error(AccountError.OLD_PASSWORD_INCORRECT);
        }
        if (!request.newPassword().equals(request.newPasswordConfirm())) {
            return AccountResult.error(AccountError.NEW_PASSWORD_MISMATCH);
        }
        Optional<AccountError> weakness = passwordPolicy.check(request.newPassword(), user.getEmail(), user.getUsername());
        if (weakness.isPresent()) {
            return AccountResult.error(weakness.get());
        }

        user.setPasswordHash(passwordEncoder.encode(request.newPassword()));
        UserAccount saved = userAccountRepository.save(user);
        log.info("Password changed for user: {}", saved.getEmail());
        return AccountResult.ok(UserResponse.from(saved));
    }

    @Transactional(readOnly = true)
    public UserPageResponse listActiveUsers(Integer page, Integer pageSize) {
        PageWindow window = PageWindow.of(page, pageSize);
        List<UserResponse> results = userDirectory.listActive(window.offset(), window.pageSize()).stream()
                .map(UserResponse::from)
                .toList();
        return new UserPageResponse(results, window.page(), window.pageSize(), userDirectory.countActive());
    }

    @Transactional(readOnly = true)
    public UserResponse getUser(UUID userId) {
        return userDirectory.findById(userId)
                .map(UserResponse::from)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "USER_NOT_FOUND", "User not found."));
    }

    private UserAccount loadActiveUser(UUID userId) {
        UserAccount user = userDirectory.findById(userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.UNAUTHORIZED, "USER_NOT_FOUND", "User not found."));
        if (!user.isActive()) {
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "USER_INACTIVE", "User account is disabled.");
        }
        return user;
    }

    private ProblemException invalidCredentials() {
        return new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS", "Invalid email or password.");
    }

    private String trimToNull(String value) {
        return StringUtils.hasText(value) ? value.trim() : null;
    }
}
