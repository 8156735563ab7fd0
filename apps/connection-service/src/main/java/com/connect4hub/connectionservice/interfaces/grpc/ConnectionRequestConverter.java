package com.connect4hub.connectionservice.interfaces.grpc;

import com.connect4hub.connectionservice.domain.enums.ConnectionErrorCode;
import com.connect4hub.connectionservice.domain.exception.InvalidConnectionRequestException;
import com.connect4hub.connectionservice.domain.model.ConnectCommand;
import com.connect4hub.connectionservice.domain.model.ConnectionIdentity;
import com.connect4hub.connectionservice.domain.model.ConnectionPayload;
import com.connect4hub.connectionservice.domain.model.ConnectionSettings;
import com.connect4hub.proto.service.v1.ConnectionRequest;
import com.connect4hub.proto.service.v1.ConnectionRequestBody;
import com.connect4hub.proto.service.v1.ConnectionResponse;
import com.connect4hub.proto.service.v1.ConnectionResponseBody;
import com.connect4hub.proto.service.v1.RequestMetadata;
import com.connect4hub.proto.service.v1.RequestSettings;

/**
 * 线协议消息 与 领域对象 之间的转换器
 *
 * 协议里 metadata / client_id / account_id 全部是 optional，
 * "必填"语义在这里收到请求后立即校验，按 metadata -> client_id -> account_id 的固定顺序，
 * 第一个不满足的条件决定错误码，保证相同请求总是得到相同的拒绝结果。
 */
public final class ConnectionRequestConverter {

    private ConnectionRequestConverter() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * 校验并转换为连接命令
     * @param request 原始请求
     * @return 连接命令
     * @throws InvalidConnectionRequestException 必填字段缺失或为空白
     */
    public static ConnectCommand toCommand(ConnectionRequest request) {
        if (request == null || !request.hasMetadata()) {
            throw new InvalidConnectionRequestException(ConnectionErrorCode.METADATA_MISSING);
        }
        RequestMetadata metadata = request.getMetadata();
        if (!metadata.hasClientId() || metadata.getClientId().isBlank()) {
            throw new InvalidConnectionRequestException(ConnectionErrorCode.CLIENT_ID_MISSING);
        }
        if (!metadata.hasAccountId() || metadata.getAccountId().isBlank()) {
            throw new InvalidConnectionRequestException(ConnectionErrorCode.ACCOUNT_ID_MISSING);
        }

        ConnectionIdentity identity = new ConnectionIdentity(metadata.getClientId(), metadata.getAccountId());
        return new ConnectCommand(identity, toSettings(request.getSettings()), toPayload(request.getRequest()));
    }

    /**
     * settings 缺省时 getSettings() 返回默认实例，等同于空配置。
     * RequestSettings 目前没有字段，协议新增字段后在这里读取并映射到 ConnectionSettings。
     */
    static ConnectionSettings toSettings(RequestSettings settings) {
        return ConnectionSettings.DEFAULT;
    }

    /**
     * ConnectionRequestBody 目前没有字段，协议新增字段后在这里映射到 ConnectionPayload。
     */
    static ConnectionPayload toPayload(ConnectionRequestBody body) {
        return ConnectionPayload.EMPTY;
    }

    /**
     * 构造响应：response 字段总是显式设置。
     * ConnectionResponseBody 目前没有字段，响应体固定为空消息。
     * @return 响应消息
     */
    public static ConnectionResponse toResponse() {
        return ConnectionResponse.newBuilder()
                .setResponse(ConnectionResponseBody.getDefaultInstance())
                .build();
    }
}
