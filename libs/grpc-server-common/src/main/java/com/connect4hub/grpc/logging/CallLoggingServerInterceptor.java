package com.connect4hub.grpc.logging;

import com.connect4hub.grpc.json.ProtoJson;
import com.google.protobuf.MessageOrBuilder;
import io.grpc.ForwardingServerCall;
import io.grpc.ForwardingServerCallListener;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.Status;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumSet;
import java.util.Set;

/**
 * gRPC 调用日志拦截器
 *
 * 每次调用结束时输出：方法名、最终状态码、耗时（ms）。
 * 日志级别随状态码变化：OK 为 INFO，客户端错误为 WARN，服务端错误为 ERROR。
 * 打开 logPayloads 后，请求/响应报文会以 JSON 形式输出到 DEBUG。
 *
 * 注册时需放在拦截器链最外层，才能看到异常映射后的最终状态。
 */
@Slf4j
public class CallLoggingServerInterceptor implements ServerInterceptor {

    /** 归为"调用方问题"的状态码 */
    private static final Set<Status.Code> CLIENT_ERRORS = EnumSet.of(
            Status.Code.CANCELLED,
            Status.Code.INVALID_ARGUMENT,
            Status.Code.NOT_FOUND,
            Status.Code.ALREADY_EXISTS,
            Status.Code.PERMISSION_DENIED,
            Status.Code.FAILED_PRECONDITION,
            Status.Code.OUT_OF_RANGE,
            Status.Code.UNAUTHENTICATED,
            Status.Code.DEADLINE_EXCEEDED
    );

    private final boolean logPayloads;

    public CallLoggingServerInterceptor(boolean logPayloads) {
        this.logPayloads = logPayloads;
    }

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(ServerCall<ReqT, RespT> call,
                                                                 Metadata headers,
                                                                 ServerCallHandler<ReqT, RespT> next) {
        String method = call.getMethodDescriptor().getFullMethodName();
        long startNanos = System.nanoTime();

        ServerCall<ReqT, RespT> loggingCall = new ForwardingServerCall.SimpleForwardingServerCall<>(call) {
            @Override
            public void sendMessage(RespT message) {
                if (logPayloads && log.isDebugEnabled()) {
                    log.debug("gRPC 响应报文: method={}, body={}", method, render(message));
                }
                super.sendMessage(message);
            }

            @Override
            public void close(Status status, Metadata trailers) {
                logCompletion(method, status, (System.nanoTime() - startNanos) / 1_000_000L);
                super.close(status, trailers);
            }
        };

        ServerCall.Listener<ReqT> delegate = next.startCall(loggingCall, headers);
        if (!logPayloads) {
            return delegate;
        }
        return new ForwardingServerCallListener.SimpleForwardingServerCallListener<>(delegate) {
            @Override
            public void onMessage(ReqT message) {
                if (log.isDebugEnabled()) {
                    log.debug("gRPC 请求报文: method={}, body={}", method, render(message));
                }
                super.onMessage(message);
            }
        };
    }

    static void logCompletion(String method, Status status, long costMs) {
        Status.Code code = status.getCode();
        if (code == Status.Code.OK) {
            log.info("gRPC 调用完成: method={}, status={}, cost={}ms", method, code, costMs);
        } else if (CLIENT_ERRORS.contains(code)) {
            log.warn("gRPC 调用被拒绝: method={}, status={}, description={}, cost={}ms",
                    method, code, status.getDescription(), costMs);
        } else {
            log.error("gRPC 调用失败: method={}, status={}, description={}, cost={}ms",
                    method, code, status.getDescription(), costMs);
        }
    }

    private static String render(Object message) {
        if (message instanceof MessageOrBuilder proto) {
            return ProtoJson.toJson(proto);
        }
        return String.valueOf(message);
    }
}
