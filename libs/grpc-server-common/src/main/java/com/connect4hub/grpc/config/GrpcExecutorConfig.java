package com.connect4hub.grpc.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * gRPC 业务回调线程池配置。
 *
 * 功能说明：
 * 1. 固定大小线程池，大小取 grpc.server.worker-threads；
 * 2. 自定义线程工厂，线程命名为 grpc-worker-N，便于排查日志；
 * 3. 容器关闭时随 Bean 销毁一并 shutdown。
 *
 * Netty 的 IO 线程只负责收发字节，服务实现的回调全部在这个池子里执行。
 */
@Configuration(proxyBeanMethods = false)
public class GrpcExecutorConfig {

    @Bean(name = "grpcWorkerExecutor", destroyMethod = "shutdown")
    public ThreadPoolExecutor grpcWorkerExecutor(GrpcServerProperties properties) {
        ThreadFactory tf = new ThreadFactory() {
            private final AtomicInteger seq = new AtomicInteger(1);
            @Override
            public Thread newThread(Runnable r) {
                return new Thread(r, "grpc-worker-" + seq.getAndIncrement());
            }
        };
        int size = properties.getWorkerThreads();
        return new ThreadPoolExecutor(size, size, 60L, TimeUnit.SECONDS, new LinkedBlockingQueue<>(), tf);
    }
}
