package com.connect4hub.connectionservice.domain.model;

import java.util.Objects;

/**
 * 校验通过后的连接命令
 * 作用：把线协议上"全部可选"的请求，收敛成应用层可以直接信任的强类型参数。
 */
public record ConnectCommand(ConnectionIdentity identity, ConnectionSettings settings, ConnectionPayload payload) {

    public ConnectCommand {
        Objects.requireNonNull(identity, "identity");
        settings = settings == null ? ConnectionSettings.DEFAULT : settings;
        payload = payload == null ? ConnectionPayload.EMPTY : payload;
    }
}
