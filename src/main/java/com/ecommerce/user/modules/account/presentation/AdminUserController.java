package com.ecommerce.user.modules.account.presentation;

import java.util.UUID;

import com.ecommerce.user.modules.account.application.AccountService;
import com.ecommerce.user.modules.account.presentation.dto.UserPageResponse;
import com.ecommerce.user.modules.account.presentation.dto.UserResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Staff-only user browsing. Access is enforced in the security filter chain.
 */
@RestController
@RequestMapping("/api/users")
@Tag(name = "Admin users")
public class AdminUserController {

    private final AccountService accountService;

    public AdminUserController(AccountService accountService) {
        this.accountService = accountService;
    }

    @GetMapping
    @Operation(summary = "List active users", description = "Newest first; page_size defaults to 20 and is capped at 100.")
    public ResponseEntity<UserPageResponse> listUsers(
            @RequestParam(name = "page", required = false) Integer page,
            @RequestParam(name = "page_size", required = false) Integer pageSize
    ) {
        return ResponseEntity.ok(accountService.listActiveUsers(page, pageSize));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get any user by id", description = "Includes deactivated accounts.")
    public ResponseEntity<UserResponse> getUser(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(accountService.getUser(id));
    }
}
