package com.connect4hub.connectionservice.domain.exception;

import com.connect4hub.connectionservice.domain.enums.ConnectionErrorCode;
import com.connect4hub.grpc.advice.ErrorCoded;

/**
 * 连接请求不合法（客户端错误）。
 * 继承 IllegalArgumentException，由全局异常映射转换为 INVALID_ARGUMENT，错误码写入 trailer。
 */
public class InvalidConnectionRequestException extends IllegalArgumentException implements ErrorCoded {

    private final ConnectionErrorCode code;

    public InvalidConnectionRequestException(ConnectionErrorCode code) {
        super(code.message());
        this.code = code;
    }

    public ConnectionErrorCode getCode() {
        return code;
    }

    @Override
    public String errorCode() {
        return code.name();
    }
}
