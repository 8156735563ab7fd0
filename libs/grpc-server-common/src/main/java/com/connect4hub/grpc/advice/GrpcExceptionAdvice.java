package com.connect4hub.grpc.advice;

import io.grpc.Metadata;
import io.grpc.Status;
import io.grpc.StatusException;
import io.grpc.StatusRuntimeException;
import lombok.extern.slf4j.Slf4j;

/**
 * 全局异常映射处理器（gRPC 版）。
 *
 * 映射规则：
 * - StatusRuntimeException / StatusException：业务代码已自行决定状态码，原样透传；
 * - IllegalArgumentException：参数校验失败，映射为 INVALID_ARGUMENT（客户端错误）；
 * - IllegalStateException：业务状态不符合预期，映射为 FAILED_PRECONDITION；
 * - 其他异常：映射为 INTERNAL，对外只返回通用描述，完整堆栈写入日志。
 */
@Slf4j
public class GrpcExceptionAdvice {

    /** 业务错误码 trailer */
    public static final Metadata.Key<String> ERROR_CODE_KEY =
            Metadata.Key.of("x-error-code", Metadata.ASCII_STRING_MARSHALLER);

    static final String INTERNAL_DESCRIPTION = "internal error";

    /**
     * 将异常翻译为 gRPC 状态与 trailer。
     * @param method 全限定方法名，仅用于日志
     * @param e 业务代码抛出的异常
     * @return 需要关闭调用的状态与 trailer
     */
    public Translation translate(String method, Throwable e) {
        if (e instanceof StatusRuntimeException sre) {
            return new Translation(sre.getStatus(), copyOf(sre.getTrailers()));
        }
        if (e instanceof StatusException se) {
            return new Translation(se.getStatus(), copyOf(se.getTrailers()));
        }

        Metadata trailers = new Metadata();
        if (e instanceof ErrorCoded coded && coded.errorCode() != null) {
            trailers.put(ERROR_CODE_KEY, coded.errorCode());
        }

        if (e instanceof IllegalArgumentException) {
            log.warn("请求参数不合法: method={}, reason={}", method, e.getMessage());
            return new Translation(Status.INVALID_ARGUMENT.withDescription(e.getMessage()), trailers);
        }
        if (e instanceof IllegalStateException) {
            log.warn("业务状态冲突: method={}, reason={}", method, e.getMessage());
            return new Translation(Status.FAILED_PRECONDITION.withDescription(e.getMessage()), trailers);
        }

        log.error("gRPC 调用出现未处理异常: method={}", method, e);
        return new Translation(Status.INTERNAL.withDescription(INTERNAL_DESCRIPTION), trailers);
    }

    private static Metadata copyOf(Metadata trailers) {
        Metadata copy = new Metadata();
        if (trailers != null) {
            copy.merge(trailers);
        }
        return copy;
    }

    /**
     * 翻译结果：关闭调用所用的状态与 trailer
     */
    public record Translation(Status status, Metadata trailers) {
    }
}
