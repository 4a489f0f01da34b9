package com.ecommerce.user.modules.lookup.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.ecommerce.user.modules.account.application.JwtTokenService;
import com.ecommerce.user.modules.account.application.JwtTokenService.AccessClaims;
import com.ecommerce.user.modules.account.application.JwtTokenService.InvalidTokenException;
import com.ecommerce.user.modules.account.application.UserDirectory;
import com.ecommerce.user.modules.account.domain.UserAccount;
import com.ecommerce.user.support.TestAccounts;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class UserLookupServiceTest {

    private static final UUID USER_ID = UUID.fromString("00000000-0000-0000-0000-000000000101");

    @Mock
    private UserDirectory userDirectory;

    @Mock
    private JwtTokenService jwtTokenService;

    @InjectMocks
    private UserLookupService lookupService;

    @Test
    void getUserReturnsDeactivatedAccountsToo() {
        UserAccount inactive = TestAccounts.account(USER_ID, "alice@example.com", false);
        when(userDirectory.findById(USER_ID)).thenReturn(Optional.of(inactive));

        UserLookupResult result = lookupService.getUser(USER_ID.toString());

        assertThat(result.success()).isTrue();
        assertThat(result.message()).isEqualTo("User found.");
        assertThat(result.user()).isSameAs(inactive);
    }

    @Test
    void getUserForUnknownIdIsNotFound() {
        when(userDirectory.findById(USER_ID)).thenReturn(Optional.empty());

        UserLookupResult result = lookupService.getUser(USER_ID.toString());

        assertThat(result.status()).isEqualTo(LookupStatus.NOT_FOUND);
        assertThat(result.success()).isFalse();
        assertThat(result.message()).isEqualTo("User not found.");
        assertThat(result.user()).isNull();
    }

    @Test
    void malformedIdIsNotFoundWithoutTouchingTheStore() {
        UserLookupResult result = lookupService.getUser("not-a-uuid");

        assertThat(result.status()).isEqualTo(LookupStatus.NOT_FOUND);
        verify(userDirectory, never()).findById(any());
    }

    @Test
    void storeFailureIsReportedAsInternal() {
        when(userDirectory.findById(USER_ID)).thenThrow(new DataAccessResourceFailureException("connection refused"));

        UserLookupResult result = lookupService.getUser(USER_ID.toString());

        assertThat(result.status()).isEqualTo(LookupStatus.INTERNAL);
        assertThat(result.message()).isEqualTo("connection refused");
    }

    @Test
    void unknownEmailIsNotFound() {
        when(userDirectory.findByEmail("ghost@x.com")).thenReturn(Optional.empty());

        UserLookupResult result = lookupService.getUserByEmail("ghost@x.com");

        assertThat(result.status()).isEqualTo(LookupStatus.NOT_FOUND);
        assertThat(result.message()).isEqualTo("User not found.");
    }

    @Test
    void validTokenOfActiveUserResolvesIdentity() {
        UserAccount user = TestAccounts.account(USER_ID, "alice@example.com", true);
        when(jwtTokenService.verify("token")).thenReturn(claims());
        when(userDirectory.findById(USER_ID)).thenReturn(Optional.of(user));

        TokenValidationResult result = lookupService.validateToken("token");

        assertThat(result.valid()).isTrue();
        assertThat(result.status()).isEqualTo(LookupStatus.OK);
        assertThat(result.message()).isEqualTo("Token is valid.");
        assertThat(result.userId()).isEqualTo(USER_ID);
        assertThat(result.email()).isEqualTo("alice@example.com");
    }

    @Test
    void tokenOfDeactivatedUserIsRejected() {
        UserAccount user = TestAccounts.account(USER_ID, "alice@example.com", false);
        when(jwtTokenService.verify("token")).thenReturn(claims());
        when(userDirectory.findById(USER_ID)).thenReturn(Optional.of(user));

        TokenValidationResult result = lookupService.validateToken("token");

        assertThat(result.valid()).isFalse();
        assertThat(result.status()).isEqualTo(LookupStatus.OK);
        assertThat(result.message()).isEqualTo("User account is disabled.");
        assertThat(result.userId()).isNull();
    }

    @Test
    void tokenOfMissingUserIsRejected() {
        when(jwtTokenService.verify("token")).thenReturn(claims());
        when(userDirectory.findById(USER_ID)).thenReturn(Optional.empty());

        TokenValidationResult result = lookupService.validateToken("token");

        assertThat(result.valid()).isFalse();
        assertThat(result.message()).isEqualTo("User not found.");
    }

    @Test
    void expiredTokenIsRejectedWithoutIdentity() {
        when(jwtTokenService.verify("expired")).thenThrow(new InvalidTokenException("Token is expired"));

        TokenValidationResult result = lookupService.validateToken("expired");

        assertThat(result.valid()).isFalse();
        assertThat(result.status()).isEqualTo(LookupStatus.OK);
        assertThat(result.message()).isEqualTo("Invalid token: Token is expired");
        assertThat(result.userId()).isNull();
        assertThat(result.email()).isNull();
        verify(userDirectory, never()).findById(any());
    }

    @Test
    void listUsersNormalizesPagingArguments() {
        when(userDirectory.listActive(0L, 100)).thenReturn(List.of());
        when(userDirectory.countActive()).thenReturn(0L);

        UserListResult result = lookupService.listUsers(0, 500);

        assertThat(result.success()).isTrue();
        verify(userDirectory).listActive(0L, 100);
    }

    @Test
    void listUsersPagesOverActiveAccounts() {
        UserAccount first = TestAccounts.account(UUID.randomUUID(), "a@example.com", true);
        UserAccount second = TestAccounts.account(UUID.randomUUID(), "b@example.com", true);
        UserAccount third = TestAccounts.account(UUID.randomUUID(), "c@example.com", true);
        when(userDirectory.listActive(0L, 2)).thenReturn(List.of(first, second));
        when(userDirectory.listActive(2L, 2)).thenReturn(List.of(third));
        when(userDirectory.countActive()).thenReturn(3L);

        UserListResult firstPage = lookupService.listUsers(1, 2);
        UserListResult secondPage = lookupService.listUsers(2, 2);

        assertThat(firstPage.users()).containsExactly(first, second);
        assertThat(firstPage.total()).isEqualTo(3L);
        assertThat(secondPage.users()).containsExactly(third);
        assertThat(secondPage.total()).isEqualTo(3L);
    }

    @Test
    void listUsersFailureIsEmptyAndInternal() {
        when(userDirectory.listActive(anyLong(), anyInt())).thenThrow(new IllegalStateException("boom"));

        UserListResult result = lookupService.listUsers(1, 20);

        assertThat(result.status()).isEqualTo(LookupStatus.INTERNAL);
        assertThat(result.users()).isEmpty();
        assertThat(result.total()).isZero();
    }

    private AccessClaims claims() {
        return new AccessClaims(USER_ID, "alice@example.com", false, OffsetDateTime.parse("2025-01-01T00:05:00Z"));
    }
}
