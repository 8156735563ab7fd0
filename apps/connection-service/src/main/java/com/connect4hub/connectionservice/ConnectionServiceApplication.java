package com.connect4hub.connectionservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * connection-service 启动入口。
 * gRPC 服务端由 grpc-server-common 自动装配，本模块只提供 Connect4Service 的实现。
 */
@SpringBootApplication
public class ConnectionServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(ConnectionServiceApplication.class, args);
    }
}
