package com.connect4hub.grpc.advice;

import io.grpc.ForwardingServerCall;
import io.grpc.ForwardingServerCallListener;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.Status;
import lombok.extern.slf4j.Slf4j;

/**
 * 异常翻译拦截器
 *
 * 捕获服务实现在回调中直接抛出的运行时异常，交给 {@link GrpcExceptionAdvice} 翻译成状态码后关闭调用，
 * 避免 gRPC 默认行为把所有异常都变成 UNKNOWN。
 * 服务实现无需自己 try/catch 再调用 onError。
 */
@Slf4j
public class ExceptionTranslatingServerInterceptor implements ServerInterceptor {

    private final GrpcExceptionAdvice advice;

    public ExceptionTranslatingServerInterceptor(GrpcExceptionAdvice advice) {
        this.advice = advice;
    }

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(ServerCall<ReqT, RespT> call,
                                                                 Metadata headers,
                                                                 ServerCallHandler<ReqT, RespT> next) {
        GuardedCall<ReqT, RespT> guarded = new GuardedCall<>(call);
        ServerCall.Listener<ReqT> delegate;
        try {
            delegate = next.startCall(guarded, headers);
        } catch (RuntimeException e) {
            guarded.closeWith(advice.translate(methodOf(call), e));
            return new ServerCall.Listener<>() {
            };
        }

        return new ForwardingServerCallListener.SimpleForwardingServerCallListener<>(delegate) {
            @Override
            public void onMessage(ReqT message) {
                try {
                    super.onMessage(message);
                } catch (RuntimeException e) {
                    guarded.closeWith(advice.translate(methodOf(call), e));
                }
            }

            @Override
            public void onHalfClose() {
                try {
                    super.onHalfClose();
                } catch (RuntimeException e) {
                    guarded.closeWith(advice.translate(methodOf(call), e));
                }
            }

            @Override
            public void onReady() {
                try {
                    super.onReady();
                } catch (RuntimeException e) {
                    guarded.closeWith(advice.translate(methodOf(call), e));
                }
            }
        };
    }

    private static String methodOf(ServerCall<?, ?> call) {
        return call.getMethodDescriptor().getFullMethodName();
    }

    /**
     * 记录调用是否已关闭，防止实现已经 onError 之后再次 close
     */
    private static final class GuardedCall<ReqT, RespT>
            extends ForwardingServerCall.SimpleForwardingServerCall<ReqT, RespT> {

        private volatile boolean closed;

        GuardedCall(ServerCall<ReqT, RespT> delegate) {
            super(delegate);
        }

        @Override
        public void close(Status status, Metadata trailers) {
            closed = true;
            super.close(status, trailers);
        }

        void closeWith(GrpcExceptionAdvice.Translation translation) {
            if (closed) {
                log.warn("调用已关闭，忽略后续异常映射: method={}, status={}",
                        getMethodDescriptor().getFullMethodName(), translation.status().getCode());
                return;
            }
            close(translation.status(), translation.trailers());
        }
    }
}
