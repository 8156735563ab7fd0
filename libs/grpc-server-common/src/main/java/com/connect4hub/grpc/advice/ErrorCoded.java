package com.connect4hub.grpc.advice;

/**
 * 携带业务错误码的异常。
 * 全局异常映射时，错误码会以 {@link GrpcExceptionAdvice#ERROR_CODE_KEY} trailer 返回给调用方，
 * 便于客户端按码分支处理，而不是解析 description 文本。
 */
public interface ErrorCoded {

    /** 稳定的机器可读错误码，例如 METADATA_MISSING */
    String errorCode();
}
