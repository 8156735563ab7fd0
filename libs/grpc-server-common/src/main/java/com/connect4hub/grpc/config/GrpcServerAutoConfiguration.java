package com.connect4hub.grpc.config;

import com.connect4hub.grpc.advice.ExceptionTranslatingServerInterceptor;
import com.connect4hub.grpc.advice.GrpcExceptionAdvice;
import com.connect4hub.grpc.logging.CallLoggingServerInterceptor;
import com.connect4hub.grpc.server.GrpcServerLifecycle;
import io.grpc.BindableService;
import io.grpc.ServerInterceptor;
import io.grpc.protobuf.services.HealthStatusManager;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;

import java.util.List;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * gRPC 服务端自动配置入口类。
 *
 * 作为 grpc-server-common 模块的"入口开关"，负责：
 * - 条件加载（@ConditionalOnProperty）：grpc.server.enabled=false 时整体不加载
 * - 装配线程池、异常映射、调用日志、健康检查与服务端生命周期
 *
 * 业务模块只需把服务实现声明为 Spring Bean（实现 BindableService），即会被自动注册到服务端。
 *
 * 拦截器顺序约定：@Order 越小越靠外层。调用日志在最外层，异常映射紧随其后。
 */
@AutoConfiguration
@ConditionalOnProperty(prefix = "grpc.server", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(GrpcServerProperties.class)
@Import(GrpcExecutorConfig.class)
public class GrpcServerAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public GrpcExceptionAdvice grpcExceptionAdvice() {
        return new GrpcExceptionAdvice();
    }

    @Bean
    @Order(Ordered.HIGHEST_PRECEDENCE)
    public CallLoggingServerInterceptor callLoggingServerInterceptor(GrpcServerProperties properties) {
        return new CallLoggingServerInterceptor(properties.isLogPayloads());
    }

    @Bean
    @Order(Ordered.HIGHEST_PRECEDENCE + 10)
    public ExceptionTranslatingServerInterceptor exceptionTranslatingServerInterceptor(GrpcExceptionAdvice advice) {
        return new ExceptionTranslatingServerInterceptor(advice);
    }

    @Bean
    @ConditionalOnProperty(prefix = "grpc.server", name = "health-enabled", havingValue = "true", matchIfMissing = true)
    public HealthStatusManager grpcHealthStatusManager() {
        return new HealthStatusManager();
    }

    /**
     * 注册服务端生命周期。
     * @param properties   服务端配置
     * @param services     所有 BindableService Bean
     * @param interceptors 所有 ServerInterceptor Bean（按 @Order 排序）
     * @param executor     业务回调线程池
     * @param health       健康检查（可选）
     * @return GrpcServerLifecycle 实例
     */
    @Bean
    public GrpcServerLifecycle grpcServerLifecycle(GrpcServerProperties properties,
                                                   ObjectProvider<BindableService> services,
                                                   ObjectProvider<ServerInterceptor> interceptors,
                                                   @Qualifier("grpcWorkerExecutor") ThreadPoolExecutor executor,
                                                   ObjectProvider<HealthStatusManager> health) {
        List<BindableService> serviceList = services.orderedStream().toList();
        List<ServerInterceptor> interceptorList = interceptors.orderedStream().toList();
        return new GrpcServerLifecycle(properties, serviceList, interceptorList, executor, health.getIfAvailable());
    }
}
