package com.ecommerce.user.global.web;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.UUID;

import org.junit.jupiter.api.Test;

class RequestIdsTest {

    @Test
    void keepsSafeIncomingId() {
        assertThat(RequestIds.resolve(" req-42.a:b ")).isEqualTo("req-42.a:b");
    }

    @Test
    void replacesMissingOrUnsafeIdWithUuid() {
        assertThat(UUID.fromString(RequestIds.resolve(null))).isNotNull();
        assertThat(UUID.fromString(RequestIds.resolve("bad id\nwith newline"))).isNotNull();
        assertThat(UUID.fromString(RequestIds.resolve("x".repeat(65)))).isNotNull();
    }
}
