package com.connect4hub.grpc.json;

import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.Message;
import com.google.protobuf.MessageOrBuilder;
import com.google.protobuf.util.JsonFormat;

/**
 * protobuf 消息与 JSON 互转工具类
 *
 * - 输出使用 proto 原始字段名（client_id 而不是 clientId），未设置的字段不输出；
 * - 解析分严格 / 宽松两种模式：严格模式遇到未知字段直接报错，宽松模式忽略未知字段；
 * - 所有解析失败统一抛出 IllegalArgumentException，交给全局异常映射处理。
 */
public final class ProtoJson {

    private static final JsonFormat.Printer PRINTER = JsonFormat.printer()
            .preservingProtoFieldNames()
            .omittingInsignificantWhitespace();

    private static final JsonFormat.Parser STRICT_PARSER = JsonFormat.parser();

    private static final JsonFormat.Parser LENIENT_PARSER = JsonFormat.parser().ignoringUnknownFields();

    private ProtoJson() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * 转成紧凑 JSON
     * @param message protobuf 消息
     * @return JSON 字符串；message 为 null 时返回 "null"
     */
    public static String toJson(MessageOrBuilder message) {
        if (message == null) {
            return "null";
        }
        try {
            return PRINTER.print(message);
        } catch (InvalidProtocolBufferException e) {
            // 只在消息包含无法解析的 Any 类型时出现
            throw new IllegalArgumentException("无法将 " + message.getDescriptorForType().getFullName()
                    + " 转换为 JSON: " + e.getMessage(), e);
        }
    }

    /**
     * 从 JSON 构建消息
     * @param json JSON 文本
     * @param builder 目标消息的 builder（会被合并写入）
     * @param strict true 时未知字段报错
     * @return 构建完成的消息
     */
    @SuppressWarnings("unchecked")
    public static <M extends Message> M fromJson(String json, Message.Builder builder, boolean strict) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("JSON 内容为空");
        }
        try {
            (strict ? STRICT_PARSER : LENIENT_PARSER).merge(json, builder);
        } catch (InvalidProtocolBufferException e) {
            throw new IllegalArgumentException("JSON 无法解析为 "
                    + builder.getDescriptorForType().getFullName() + ": " + e.getMessage(), e);
        }
        return (M) builder.build();
    }
}
