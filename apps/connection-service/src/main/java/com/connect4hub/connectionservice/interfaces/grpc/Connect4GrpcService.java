package com.connect4hub.connectionservice.interfaces.grpc;

import com.connect4hub.connectionservice.domain.constants.ConnectionMessages;
import com.connect4hub.connectionservice.domain.model.ConnectCommand;
import com.connect4hub.connectionservice.domain.model.ConnectionAccepted;
import com.connect4hub.connectionservice.service.ConnectionService;
import com.connect4hub.proto.service.v1.Connect4ServiceGrpc;
import com.connect4hub.proto.service.v1.ConnectionRequest;
import com.connect4hub.proto.service.v1.ConnectionResponse;
import io.grpc.Context;
import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Connect4Service 的 gRPC 入口
 *
 * 只做三件事：校验并转换请求 -> 调用应用层 -> 写回响应。
 * 校验失败直接抛出 InvalidConnectionRequestException，由全局异常映射转为 INVALID_ARGUMENT。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class Connect4GrpcService extends Connect4ServiceGrpc.Connect4ServiceImplBase {

    private final ConnectionService connectionService;

    @Override
    public void connect(ConnectionRequest request, StreamObserver<ConnectionResponse> responseObserver) {
        ConnectCommand command = ConnectionRequestConverter.toCommand(request);
        ConnectionAccepted accepted = connectionService.connect(command);

        // 客户端已取消或 deadline 已过，不再写响应
        if (Context.current().isCancelled()) {
            log.info("连接已受理但调用方已取消: clientId={}", accepted.identity().clientId());
            responseObserver.onError(Status.CANCELLED
                    .withDescription(ConnectionMessages.CALL_CANCELLED)
                    .asRuntimeException());
            return;
        }

        responseObserver.onNext(ConnectionRequestConverter.toResponse());
        responseObserver.onCompleted();
    }
}
