package com.ecommerce.user.modules.lookup.grpc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.UUID;

import com.ecommerce.user.modules.account.domain.UserAccount;
import com.ecommerce.user.modules.lookup.application.LookupStatus;
import com.ecommerce.user.modules.lookup.application.TokenValidationResult;
import com.ecommerce.user.modules.lookup.application.UserListResult;
import com.ecommerce.user.modules.lookup.application.UserLookupResult;
import com.ecommerce.user.modules.lookup.application.UserLookupService;
import com.ecommerce.user.proto.EmailRequest;
import com.ecommerce.user.proto.ListUsersRequest;
import com.ecommerce.user.proto.ListUsersResponse;
import com.ecommerce.user.proto.TokenRequest;
import com.ecommerce.user.proto.TokenResponse;
import com.ecommerce.user.proto.UserRequest;
import com.ecommerce.user.proto.UserResponse;
import com.ecommerce.user.proto.UserServiceGrpc;
import com.ecommerce.user.support.TestAccounts;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.rpc.Status;

import io.grpc.ManagedChannel;
import io.grpc.Server;
import io.grpc.ServerInterceptors;
import io.grpc.StatusRuntimeException;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import io.grpc.protobuf.StatusProto;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class UserGrpcServiceTest {

    private static final UUID USER_ID = UUID.fromString("00000000-0000-0000-0000-000000000101");

    private final UserLookupService lookupService = mock(UserLookupService.class);

    private Server server;
    private ManagedChannel channel;
    private UserServiceGrpc.UserServiceBlockingStub stub;

    @BeforeEach
    void setUp() throws Exception {
        String name = InProcessServerBuilder.generateName();
        server = InProcessServerBuilder.forName(name)
                .directExecutor()
                .addService(ServerInterceptors.intercept(
                        new UserGrpcService(lookupService), new RequestIdServerInterceptor()))
                .build()
                .start();
        channel = InProcessChannelBuilder.forName(name).directExecutor().build();
        stub = UserServiceGrpc.newBlockingStub(channel);
    }

    @AfterEach
    void tearDown() {
        channel.shutdownNow();
        server.shutdownNow();
    }

    @Test
    void getUserReturnsMappedUser() {
        UserAccount user = TestAccounts.account(USER_ID, "alice@example.com", true);
        user.setFirstName("Alice");
        when(lookupService.getUser(USER_ID.toString()))
                .thenReturn(new UserLookupResult(LookupStatus.OK, "User found.", user));

        UserResponse response = stub.getUser(UserRequest.newBuilder().setUserId(USER_ID.toString()).build());

        assertThat(response.getSuccess()).isTrue();
        assertThat(response.getMessage()).isEqualTo("User found.");
        assertThat(response.getUser().getId()).isEqualTo(USER_ID.toString());
        assertThat(response.getUser().getEmail()).isEqualTo("alice@example.com");
        assertThat(response.getUser().getFirstName()).isEqualTo("Alice");
        assertThat(response.getUser().getLastName()).isEmpty();
        assertThat(response.getUser().getIsActive()).isTrue();
        assertThat(response.getUser().getDateJoined()).isEqualTo("2025-01-01T00:00:00Z");
    }

    @Test
    void notFoundCarriesResponseAsStatusDetail() throws InvalidProtocolBufferException {
        when(lookupService.getUserByEmail("ghost@x.com"))
                .thenReturn(new UserLookupResult(LookupStatus.NOT_FOUND, "User not found.", null));

        StatusRuntimeException error = catchThrowableOfType(
                () -> stub.getUserByEmail(EmailRequest.newBuilder().setEmail("ghost@x.com").build()),
                StatusRuntimeException.class);

        assertThat(error.getStatus().getCode()).isEqualTo(io.grpc.Status.Code.NOT_FOUND);
        Status status = StatusProto.fromThrowable(error);
        assertThat(status).isNotNull();
        assertThat(status.getMessage()).isEqualTo("User not found.");
        UserResponse body = status.getDetails(0).unpack(UserResponse.class);
        assertThat(body.getSuccess()).isFalse();
        assertThat(body.getMessage()).isEqualTo("User not found.");
        assertThat(body.hasUser()).isFalse();
    }

    @Test
    void rejectedTokenIsAnOrdinaryAnswer() {
        when(lookupService.validateToken("expired"))
                .thenReturn(new TokenValidationResult(LookupStatus.OK, false, "Invalid token: Token is expired", null, null));

        TokenResponse response = stub.validateToken(TokenRequest.newBuilder().setToken("expired").build());

        assertThat(response.getValid()).isFalse();
        assertThat(response.getMessage()).isEqualTo("Invalid token: Token is expired");
        assertThat(response.getUserId()).isEmpty();
        assertThat(response.getEmail()).isEmpty();
    }

    @Test
    void validTokenCarriesIdentity() {
        when(lookupService.validateToken("good"))
                .thenReturn(new TokenValidationResult(LookupStatus.OK, true, "Token is valid.", USER_ID, "alice@example.com"));

        TokenResponse response = stub.validateToken(TokenRequest.newBuilder().setToken("good").build());

        assertThat(response.getValid()).isTrue();
        assertThat(response.getUserId()).isEqualTo(USER_ID.toString());
        assertThat(response.getEmail()).isEqualTo("alice@example.com");
    }

    @Test
    void listUsersReturnsPageAndTotal() {
        UserAccount user = TestAccounts.account(USER_ID, "alice@example.com", true);
        when(lookupService.listUsers(1, 2)).thenReturn(new UserListResult(LookupStatus.OK, List.of(user), 3L));

        ListUsersResponse response = stub.listUsers(ListUsersRequest.newBuilder().setPage(1).setPageSize(2).build());

        assertThat(response.getSuccess()).isTrue();
        assertThat(response.getUsersList()).hasSize(1);
        assertThat(response.getTotal()).isEqualTo(3);
    }

    @Test
    void listUsersFailureIsInternal() throws InvalidProtocolBufferException {
        when(lookupService.listUsers(1, 20)).thenReturn(new UserListResult(LookupStatus.INTERNAL, List.of(), 0L));

        StatusRuntimeException error = catchThrowableOfType(
                () -> stub.listUsers(ListUsersRequest.newBuilder().setPage(1).setPageSize(20).build()),
                StatusRuntimeException.class);

        assertThat(error.getStatus().getCode()).isEqualTo(io.grpc.Status.Code.INTERNAL);
        ListUsersResponse body = StatusProto.fromThrowable(error).getDetails(0).unpack(ListUsersResponse.class);
        assertThat(body.getSuccess()).isFalse();
        assertThat(body.getUsersList()).isEmpty();
        assertThat(body.getTotal()).isZero();
    }
}
