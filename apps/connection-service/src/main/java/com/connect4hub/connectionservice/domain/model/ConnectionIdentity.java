package com.connect4hub.connectionservice.domain.model;

import java.util.Objects;

/**
 * 调用方身份：客户端 ID + 账号 ID。
 * 只能由校验通过的请求构造，两个字段均非空白。
 */
public record ConnectionIdentity(String clientId, String accountId) {

    public ConnectionIdentity {
        Objects.requireNonNull(clientId, "clientId");
        Objects.requireNonNull(accountId, "accountId");
        if (clientId.isBlank() || accountId.isBlank()) {
            throw new IllegalArgumentException("clientId / accountId 不能为空白");
        }
    }
}
