package com.connect4hub.connectionservice.domain.model;

/**
 * 连接请求载荷（对应 ConnectionRequestBody），目前为空。
 */
public record ConnectionPayload() {

    public static final ConnectionPayload EMPTY = new ConnectionPayload();
}
