package com.connect4hub.grpc.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * gRPC 服务端相关配置。
 *
 * 支持通过 application.yml 或环境变量覆盖，例如 GRPC_SERVER_PORT=50052。
 */
@Data
@Validated
@ConfigurationProperties(prefix = "grpc.server")
public class GrpcServerProperties {

    /**
     * 是否启动 gRPC 服务端（关闭后不注册任何 gRPC 相关 Bean）
     */
    private boolean enabled = true;

    /**
     * 监听端口，0 表示由系统分配随机端口（测试用）
     */
    @Min(0)
    @Max(65535)
    private int port = 50051;

    /**
     * 业务回调线程池大小
     */
    @Min(1)
    private int workerThreads = 8;

    /**
     * 单条入站消息最大字节数
     */
    @Min(1024)
    private int maxInboundMessageSize = 4 * 1024 * 1024;

    /**
     * 优雅停机时等待在途调用完成的最长时间，超时后强制关闭
     */
    @NotNull
    private Duration shutdownGracePeriod = Duration.ofSeconds(30);

    /** 是否注册 grpc.health.v1.Health */
    private boolean healthEnabled = true;

    /** 是否注册服务反射（grpcurl 等调试工具使用），生产环境默认关闭 */
    private boolean reflectionEnabled = false;

    /** 是否在 DEBUG 级别以 JSON 形式打印请求/响应报文 */
    private boolean logPayloads = false;
}
