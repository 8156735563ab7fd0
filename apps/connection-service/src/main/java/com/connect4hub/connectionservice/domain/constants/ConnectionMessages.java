package com.connect4hub.connectionservice.domain.constants;

/**
 * 连接相关的提示消息常量
 * 统一管理所有返回给调用方的描述文本，避免硬编码
 */
public final class ConnectionMessages {

    private ConnectionMessages() {
        // 工具类，禁止实例化
    }

    // ========== 请求校验 ==========

    /** 缺少 metadata */
    public static final String METADATA_MISSING = "metadata 为必填项，需携带 client_id 与 account_id";

    /** 缺少 client_id */
    public static final String CLIENT_ID_MISSING = "metadata.client_id 为必填项且不能为空白";

    /** 缺少 account_id */
    public static final String ACCOUNT_ID_MISSING = "metadata.account_id 为必填项且不能为空白";

    // ========== 调用状态 ==========

    /** 调用方已取消或超时 */
    public static final String CALL_CANCELLED = "调用已被客户端取消或超时";
}
