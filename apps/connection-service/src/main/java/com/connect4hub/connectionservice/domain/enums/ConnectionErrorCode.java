package com.connect4hub.connectionservice.domain.enums;

import com.connect4hub.connectionservice.domain.constants.ConnectionMessages;

/**
 * 连接请求被拒绝的原因（客户端错误）。
 * 枚举名即对外错误码，通过 x-error-code trailer 返回，不要随意改名。
 */
public enum ConnectionErrorCode {
    /** 缺少 metadata */
    METADATA_MISSING(ConnectionMessages.METADATA_MISSING),
    /** 缺少 client_id 或为空白 */
    CLIENT_ID_MISSING(ConnectionMessages.CLIENT_ID_MISSING),
    /** 缺少 account_id 或为空白 */
    ACCOUNT_ID_MISSING(ConnectionMessages.ACCOUNT_ID_MISSING);

    private final String message;

    ConnectionErrorCode(String message) {
        this.message = message;
    }

    /** 对外描述 */
    public String message() {
        return message;
    }
}
