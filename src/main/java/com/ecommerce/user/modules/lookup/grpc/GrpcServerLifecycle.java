package com.ecommerce.user.modules.lookup.grpc;

import java.io.IOException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import com.ecommerce.user.proto.UserServiceGrpc;

import io.grpc.Server;
import io.grpc.ServerInterceptors;
import io.grpc.health.v1.HealthCheckResponse.ServingStatus;
import io.grpc.netty.shaded.io.grpc.netty.NettyServerBuilder;
import io.grpc.protobuf.services.HealthStatusManager;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Runs the plaintext gRPC listener alongside the servlet container.
 *
 * <p>Calls are executed on a bounded pool of {@code grpc.server.max-workers} threads. The standard
 * {@code grpc.health.v1.Health} service reports SERVING while the listener is up.</p>
 */
@Component
public class GrpcServerLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(GrpcServerLifecycle.class);

    private final GrpcServerProperties properties;
    private final UserGrpcService userGrpcService;
    private final RequestIdServerInterceptor requestIdInterceptor;
    private final HealthStatusManager healthStatusManager = new HealthStatusManager();

    private volatile Server server;
    private volatile ThreadPoolExecutor executor;

    public GrpcServerLifecycle(
            GrpcServerProperties properties,
            UserGrpcService userGrpcService,
            RequestIdServerInterceptor requestIdInterceptor
    ) {
        this.properties = properties;
        this.userGrpcService = userGrpcService;
        this.requestIdInterceptor = requestIdInterceptor;
    }

    @Override
    public void start() {
        executor = newExecutor(properties.maxWorkers());
        try {
            server = NettyServerBuilder.forPort(properties.port())
                    .executor(executor)
                    .addService(ServerInterceptors.intercept(userGrpcService, requestIdInterceptor))
                    .addService(healthStatusManager.getHealthService())
                    .build()
                    .start();
        } catch (IOException ex) {
            executor.shutdownNow();
            throw new IllegalStateException("Failed to start gRPC server on port " + properties.port(), ex);
        }
        healthStatusManager.setStatus(UserServiceGrpc.SERVICE_NAME, ServingStatus.SERVING);
        log.info("gRPC server started on port {} (max workers {})", server.getPort(), properties.maxWorkers());
    }

    @Override
    public void stop() {
        Server running = server;
        if (running == null) {
            return;
        }
        healthStatusManager.enterTerminalState();
        running.shutdown();
        try {
            long graceMillis = properties.shutdownGracePeriod().toMillis();
            if (!running.awaitTermination(graceMillis, TimeUnit.MILLISECONDS)) {
                log.warn("gRPC server did not terminate within {} ms, forcing shutdown", graceMillis);
                running.shutdownNow();
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            running.shutdownNow();
        } finally {
            executor.shutdownNow();
            server = null;
            log.info("gRPC server stopped");
        }
    }

    @Override
    public boolean isRunning() {
        Server running = server;
        return running != null && !running.isShutdown();
    }

    /**
     * Bound port; differs from the configured one when port 0 was requested.
     */
    public int getPort() {
        Server running = server;
        if (running == null) {
            throw new IllegalStateException("gRPC server is not running");
        }
        return running.getPort();
    }

    private static ThreadPoolExecutor newExecutor(int maxWorkers) {
        AtomicInteger sequence = new AtomicInteger();
        ThreadPoolExecutor pool = new ThreadPoolExecutor(
                maxWorkers,
                maxWorkers,
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                runnable -> {
                    Thread thread = new Thread(runnable, "grpc-worker-" + sequence.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                }
        );
        pool.allowCoreThreadTimeOut(true);
        return pool;
    }
}
