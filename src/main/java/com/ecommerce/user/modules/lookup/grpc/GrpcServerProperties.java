package com.ecommerce.user.modules.lookup.grpc;

import java.time.Duration;

import jakarta.validation.constraints.Min;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Listener settings for the lookup server. Port 0 binds an ephemeral port.
 */
@Validated
@ConfigurationProperties(prefix = "grpc.server")
public record GrpcServerProperties(
        @DefaultValue("50051") @Min(0) int port,
        @DefaultValue("10") @Min(1) int maxWorkers,
        @DefaultValue("5s") Duration shutdownGracePeriod
) {
}
