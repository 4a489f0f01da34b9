package com.ecommerce.user.modules.account.presentation;

import com.ecommerce.user.global.security.SecurityUtils;
import com.ecommerce.user.modules.account.application.AccountService;
import com.ecommerce.user.modules.account.presentation.dto.AccessTokenResponse;
import com.ecommerce.user.modules.account.presentation.dto.AuthResponse;
import com.ecommerce.user.modules.account.presentation.dto.LoginRequest;
import com.ecommerce.user.modules.account.presentation.dto.LogoutRequest;
import com.ecommerce.user.modules.account.presentation.dto.MessageResponse;
import com.ecommerce.user.modules.account.presentation.dto.RefreshRequest;
import com.ecommerce.user.modules.account.presentation.dto.RegisterRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/auth")
@Tag(name = "Auth")
public class AuthController {

    private final AccountService accountService;

    public AuthController(AccountService accountService) {
        this.accountService = accountService;
    }

    @PostMapping("/register")
    @Operation(summary = "Register", description = "Creates an account and returns an access/refresh token pair.")
    public ResponseEntity<AuthResponse> register(@Valid @RequestBody RegisterRequest request) {
        AuthResponse response = AccountResponses.unwrap(accountService.register(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PostMapping("/login")
    @Operation(summary = "Login", description = "Authenticates by email and password.")
    public ResponseEntity<AuthResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(accountService.login(request));
    }

    @PostMapping("/logout")
    @Operation(summary = "Logout", description = "Revokes the given refresh token.")
    public ResponseEntity<MessageResponse> logout(@Valid @RequestBody LogoutRequest request) {
        accountService.logout(SecurityUtils.getCurrentUserId(), request);
        return ResponseEntity.ok(new MessageResponse("Logout successful."));
    }

    @PostMapping("/refresh")
    @Operation(summary = "Refresh access token")
    public ResponseEntity<AccessTokenResponse> refresh(@Valid @RequestBody RefreshRequest request) {
        return ResponseEntity.ok(accountService.refresh(request));
    }
}
