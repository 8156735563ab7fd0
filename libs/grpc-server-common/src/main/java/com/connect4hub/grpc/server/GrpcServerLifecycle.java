package com.connect4hub.grpc.server;

import com.connect4hub.grpc.config.GrpcServerProperties;
import io.grpc.BindableService;
import io.grpc.Grpc;
import io.grpc.InsecureServerCredentials;
import io.grpc.Server;
import io.grpc.ServerBuilder;
import io.grpc.ServerInterceptor;
import io.grpc.ServerInterceptors;
import io.grpc.health.v1.HealthCheckResponse.ServingStatus;
import io.grpc.protobuf.services.HealthStatusManager;
import io.grpc.protobuf.services.ProtoReflectionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * gRPC 服务端生命周期管理
 * ---------------------------------------
 * 随 Spring 容器启动/关闭 gRPC 服务端：
 *  - start：绑定端口，注册所有业务服务（统一套上拦截器链）、健康检查与反射服务；
 *  - stop：健康状态切为 NOT_SERVING，停止接收新调用，在宽限期内等待在途调用完成，超时强制关闭。
 */
@Slf4j
public class GrpcServerLifecycle implements SmartLifecycle {

    private final GrpcServerProperties properties;
    private final List<BindableService> services;
    /** 由外到内排列；注册时需要倒序交给 ServerInterceptors */
    private final List<ServerInterceptor> interceptors;
    private final Executor executor;
    private final HealthStatusManager health;

    private volatile Server server;
    /** 当前已注册到健康检查的服务名（含 "" 整体状态） */
    private List<String> healthNames = List.of();

    /**
     * @param properties   服务端配置
     * @param services     业务服务
     * @param interceptors 拦截器，按"由外到内"顺序排列
     * @param executor     业务回调线程池
     * @param health       健康检查管理器，未启用时为 null
     */
    public GrpcServerLifecycle(GrpcServerProperties properties,
                               List<BindableService> services,
                               List<ServerInterceptor> interceptors,
                               Executor executor,
                               HealthStatusManager health) {
        this.properties = properties;
        this.services = List.copyOf(services);
        this.interceptors = List.copyOf(interceptors);
        this.executor = executor;
        this.health = health;
    }

    @Override
    public synchronized void start() {
        if (server != null) {
            return;
        }
        ServerBuilder<?> builder = Grpc.newServerBuilderForPort(properties.getPort(), InsecureServerCredentials.create())
                .executor(executor)
                .maxInboundMessageSize(properties.getMaxInboundMessageSize());

        // ServerInterceptors.intercept：列表中最后一个最先执行
        List<ServerInterceptor> innerFirst = new ArrayList<>(interceptors);
        Collections.reverse(innerFirst);
        List<String> serviceNames = new ArrayList<>();
        for (BindableService service : services) {
            builder.addService(ServerInterceptors.intercept(service, innerFirst));
            serviceNames.add(service.bindService().getServiceDescriptor().getName());
        }
        if (health != null) {
            builder.addService(health.getHealthService());
        }
        if (properties.isReflectionEnabled()) {
            builder.addService(ProtoReflectionService.newInstance());
        }

        Server built = builder.build();
        try {
            built.start();
        } catch (IOException e) {
            throw new IllegalStateException("gRPC 服务端启动失败, port=" + properties.getPort(), e);
        }
        server = built;
        startAwaitThread(built);

        if (health != null) {
            List<String> names = new ArrayList<>();
            names.add(HealthStatusManager.SERVICE_NAME_ALL_SERVICES);
            names.addAll(serviceNames);
            names.forEach(name -> health.setStatus(name, ServingStatus.SERVING));
            healthNames = List.copyOf(names);
        }
        log.info("[gRPC] ▶▶ 服务端已启动: port={}, services={}, health={}, reflection={}",
                built.getPort(), serviceNames, health != null, properties.isReflectionEnabled());
    }

    /**
     * Netty 的线程都是守护线程；非 Web 应用需要一个非守护线程把 JVM 挂住，直到服务端关闭
     */
    private static void startAwaitThread(Server built) {
        Thread awaitThread = new Thread(() -> {
            try {
                built.awaitTermination();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "grpc-server-await-" + built.getPort());
        awaitThread.setDaemon(false);
        awaitThread.start();
    }

    @Override
    public synchronized void stop() {
        Server current = server;
        if (current == null) {
            return;
        }
        // 不用 enterTerminalState：终态之后 setStatus 全部失效，stop 后再 start 将无法恢复 SERVING
        if (health != null) {
            healthNames.forEach(name -> health.setStatus(name, ServingStatus.NOT_SERVING));
        }
        long graceMs = properties.getShutdownGracePeriod().toMillis();
        log.info("[gRPC] 开始优雅停机: port={}, gracePeriod={}ms", current.getPort(), graceMs);
        current.shutdown();
        try {
            if (!current.awaitTermination(graceMs, TimeUnit.MILLISECONDS)) {
                log.warn("[gRPC] 宽限期内仍有在途调用，强制关闭");
                current.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            current.shutdownNow();
        } finally {
            server = null;
        }
        log.info("[gRPC] 服务端已关闭");
    }

    @Override
    public boolean isRunning() {
        Server current = server;
        return current != null && !current.isShutdown();
    }

    /**
     * 实际监听端口（配置为 0 时由系统分配）
     * @return 端口；未启动时返回 -1
     */
    public int getPort() {
        Server current = server;
        return current != null ? current.getPort() : -1;
    }
}
