package com.ecommerce.user.modules.lookup.grpc;

import com.ecommerce.user.global.web.RequestIds;

import io.grpc.ForwardingServerCall.SimpleForwardingServerCall;
import io.grpc.ForwardingServerCallListener.SimpleForwardingServerCallListener;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;

import org.slf4j.MDC;
import org.springframework.stereotype.Component;

/**
 * gRPC counterpart of {@code RequestIdFilter}. Listener callbacks may run on different executor threads,
 * so the MDC entry is set and cleared around each one.
 */
@Component
public class RequestIdServerInterceptor implements ServerInterceptor {

    static final Metadata.Key<String> REQUEST_ID_KEY =
            Metadata.Key.of("x-request-id", Metadata.ASCII_STRING_MARSHALLER);

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
            ServerCall<ReqT, RespT> call,
            Metadata headers,
            ServerCallHandler<ReqT, RespT> next
    ) {
        String requestId = RequestIds.resolve(headers.get(REQUEST_ID_KEY));

        ServerCall<ReqT, RespT> tagged = new SimpleForwardingServerCall<>(call) {
            @Override
            public void sendHeaders(Metadata responseHeaders) {
                responseHeaders.put(REQUEST_ID_KEY, requestId);
                super.sendHeaders(responseHeaders);
            }
        };

        ServerCall.Listener<ReqT> delegate;
        MDC.put(RequestIds.MDC_KEY, requestId);
        try {
            delegate = next.startCall(tagged, headers);
        } finally {
            MDC.remove(RequestIds.MDC_KEY);
        }

        return new SimpleForwardingServerCallListener<>(delegate) {
            @Override
            public void onMessage(ReqT message) {
                withRequestId(requestId, () -> super.onMessage(message));
            }

            @Override
            public void onHalfClose() {
                withRequestId(requestId, super::onHalfClose);
            }

            @Override
            public void onCancel() {
                withRequestId(requestId, super::onCancel);
            }

            @Override
            public void onComplete() {
                withRequestId(requestId, super::onComplete);
            }

            @Override
            public void onReady() {
                withRequestId(requestId, super::onReady);
            }
        };
    }

    private static void withRequestId(String requestId, Runnable callback) {
        MDC.put(RequestIds.MDC_KEY, requestId);
        try {
            callback.run();
        } finally {
            MDC.remove(RequestIds.MDC_KEY);
        }
    }
}
