package com.ecommerce.user.modules.account.presentation;

import com.ecommerce.user.global.security.SecurityUtils;
import com.ecommerce.user.modules.account.application.AccountService;
import com.ecommerce.user.modules.account.presentation.dto.ChangePasswordRequest;
import com.ecommerce.user.modules.account.presentation.dto.MessageResponse;
import com.ecommerce.user.modules.account.presentation.dto.UpdateProfileRequest;
import com.ecommerce.user.modules.account.presentation.dto.UserResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/users/me")
@Tag(name = "Profile")
public class ProfileController {

    private final AccountService accountService;

    public ProfileController(AccountService accountService) {
        this.accountService = accountService;
    }

    @GetMapping
    public ResponseEntity<UserResponse> currentUser() {
        return ResponseEntity.ok(accountService.loadProfile(SecurityUtils.getCurrentUserId()));
    }

    @PutMapping
    @Operation(summary = "Update profile")
    public ResponseEntity<UserResponse> replaceProfile(@Valid @RequestBody UpdateProfileRequest request) {
        return ResponseEntity.ok(AccountResponses.unwrap(accountService.updateProfile(SecurityUtils.getCurrentUserId(), request)));
    }

    @PatchMapping
    @Operation(summary = "Partially update profile")
    public ResponseEntity<UserResponse> patchProfile(@Valid @RequestBody UpdateProfileRequest request) {
        return ResponseEntity.ok(AccountResponses.unwrap(accountService.updateProfile(SecurityUtils.getCurrentUserId(), request)));
    }

    @DeleteMapping
    @Operation(summary = "Deactivate account", description = "Soft delete: the account is disabled, never removed.")
    public ResponseEntity<MessageResponse> deactivate() {
        accountService.deactivate(SecurityUtils.getCurrentUserId());
        return ResponseEntity.ok(new MessageResponse("Account deactivated successfully."));
    }

    @PostMapping("/password")
    @Operation(summary = "Change password")
    public ResponseEntity<MessageResponse> changePassword(@Valid @RequestBody ChangePasswordRequest request) {
        AccountResponses.unwrap(accountService.changePassword(SecurityUtils.getCurrentUserId(), request));
        return ResponseEntity.ok(new MessageResponse("Password changed successfully."));
    }
}
