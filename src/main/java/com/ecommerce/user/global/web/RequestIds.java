package com.ecommerce.user.global.web;

import java.util.UUID;
import java.util.regex.Pattern;

import org.springframework.util.StringUtils;

/**
 * Request id conventions shared by the HTTP filter and the gRPC interceptor.
 */
public final class RequestIds {

    public static final String HEADER = "X-Request-Id";
    public static final String MDC_KEY = "requestId";

    private static final int MAX_LENGTH = 64;
    private static final Pattern SAFE = Pattern.compile("[A-Za-z0-9._:\\-]+");

    private RequestIds() {
    }

    /**
     * Returns the caller's id when it is short and log-safe, otherwise a fresh UUID.
     */
    public static String resolve(String incoming) {
        if (StringUtils.hasText(incoming)) {
            String trimmed = incoming.trim();
            if (trimmed.length() <= MAX_LENGTH && SAFE.matcher(trimmed).matches()) {
                return trimmed;
            }
        }
        return UUID.randomUUID().toString();
    }
}
