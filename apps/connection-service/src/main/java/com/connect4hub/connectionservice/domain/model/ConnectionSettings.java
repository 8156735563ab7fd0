package com.connect4hub.connectionservice.domain.model;

/**
 * 请求级配置（对应 RequestSettings）。
 * 目前没有任何字段，保留为独立类型，后续新增配置项时不需要改动 ConnectCommand 的结构。
 */
public record ConnectionSettings() {

    public static final ConnectionSettings DEFAULT = new ConnectionSettings();
}
