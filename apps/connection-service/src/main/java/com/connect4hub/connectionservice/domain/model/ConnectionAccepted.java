package com.connect4hub.connectionservice.domain.model;

import java.time.Instant;

/** 连接受理结果：谁、在什么时间被受理 */
public record ConnectionAccepted(ConnectionIdentity identity, Instant acceptedAt) {
}
