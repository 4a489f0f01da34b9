package com.ecommerce.user.modules.lookup.grpc;

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
import com.google.protobuf.Any;
import com.google.protobuf.Message;
import com.google.rpc.Code;
import com.google.rpc.Status;

import io.grpc.protobuf.StatusProto;
import io.grpc.stub.StreamObserver;

import org.springframework.stereotype.Component;

/**
 * gRPC adapter for {@link UserLookupService}.
 *
 * <p>OK results are sent as the response message. NOT_FOUND and INTERNAL results end the call with that status,
 * and the response message travels as a packed detail of the {@code google.rpc.Status} so callers can still read
 * {@code success}/{@code valid} and the message.</p>
 */
@Component
public class UserGrpcService extends UserServiceGrpc.UserServiceImplBase {

    private final UserLookupService lookupService;

    public UserGrpcService(UserLookupService lookupService) {
        this.lookupService = lookupService;
    }

    @Override
    public void getUser(UserRequest request, StreamObserver<UserResponse> responseObserver) {
        UserLookupResult result = lookupService.getUser(request.getUserId());
        reply(result.status(), result.message(), toResponse(result), responseObserver);
    }

    @Override
    public void getUserByEmail(EmailRequest request, StreamObserver<UserResponse> responseObserver) {
        UserLookupResult result = lookupService.getUserByEmail(request.getEmail());
        reply(result.status(), result.message(), toResponse(result), responseObserver);
    }

    @Override
    public void validateToken(TokenRequest request, StreamObserver<TokenResponse> responseObserver) {
        TokenValidationResult result = lookupService.validateToken(request.getToken());
        TokenResponse.Builder response = TokenResponse.newBuilder()
                .setValid(result.valid())
                .setMessage(result.message());
        if (result.valid()) {
            response.setUserId(result.userId().toString()).setEmail(result.email());
        }
        reply(result.status(), result.message(), response.build(), responseObserver);
    }

    @Override
    public void listUsers(ListUsersRequest request, StreamObserver<ListUsersResponse> responseObserver) {
        UserListResult result = lookupService.listUsers(request.getPage(), request.getPageSize());
        ListUsersResponse.Builder response = ListUsersResponse.newBuilder()
                .setSuccess(result.success())
                .setTotal((int) Math.min(result.total(), Integer.MAX_VALUE));
        result.users().forEach(user -> response.addUsers(UserDataMapper.toProto(user)));
        reply(result.status(), "Error listing users.", response.build(), responseObserver);
    }

    private UserResponse toResponse(UserLookupResult result) {
        UserResponse.Builder response = UserResponse.newBuilder()
                .setSuccess(result.success())
                .setMessage(result.message());
        if (result.user() != null) {
            response.setUser(UserDataMapper.toProto(result.user()));
        }
        return response.build();
    }

    private <T extends Message> void reply(LookupStatus status, String failureMessage, T response,
                                           StreamObserver<T> responseObserver) {
        if (status == LookupStatus.OK) {
            responseObserver.onNext(response);
            responseObserver.onCompleted();
            return;
        }
        Status rpcStatus = Status.newBuilder()
                .setCode(status == LookupStatus.NOT_FOUND ? Code.NOT_FOUND_VALUE : Code.INTERNAL_VALUE)
                .setMessage(failureMessage)
                .addDetails(Any.pack(response))
                .build();
        responseObserver.onError(StatusProto.toStatusRuntimeException(rpcStatus));
    }
}
