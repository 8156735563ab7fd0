package com.connect4hub.grpc.advice;

import io.grpc.Metadata;
import io.grpc.Status;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class GrpcExceptionAdviceTest {

    private static final String METHOD = "test.Service/Call";

    private final GrpcExceptionAdvice advice = new GrpcExceptionAdvice();

    @Test
    void illegalArgumentBecomesInvalidArgument() {
        GrpcExceptionAdvice.Translation t = advice.translate(METHOD, new IllegalArgumentException("bad input"));

        assertThat(t.status().getCode()).isEqualTo(Status.Code.INVALID_ARGUMENT);
        assertThat(t.status().getDescription()).isEqualTo("bad input");
        assertThat(t.trailers().get(GrpcExceptionAdvice.ERROR_CODE_KEY)).isNull();
    }

    @Test
    void errorCodeIsCopiedIntoTrailers() {
        GrpcExceptionAdvice.Translation t = advice.translate(METHOD, new CodedArgumentException("NAME_MISSING"));

        assertThat(t.status().getCode()).isEqualTo(Status.Code.INVALID_ARGUMENT);
        assertThat(t.trailers().get(GrpcExceptionAdvice.ERROR_CODE_KEY)).isEqualTo("NAME_MISSING");
    }

    @Test
    void illegalStateBecomesFailedPrecondition() {
        GrpcExceptionAdvice.Translation t = advice.translate(METHOD, new IllegalStateException("already closed"));

        assertThat(t.status().getCode()).isEqualTo(Status.Code.FAILED_PRECONDITION);
        assertThat(t.status().getDescription()).isEqualTo("already closed");
    }

    @Test
    void unexpectedExceptionHidesDetails() {
        GrpcExceptionAdvice.Translation t = advice.translate(METHOD, new NullPointerException("secret.field"));

        assertThat(t.status().getCode()).isEqualTo(Status.Code.INTERNAL);
        assertThat(t.status().getDescription()).isEqualTo(GrpcExceptionAdvice.INTERNAL_DESCRIPTION);
    }

    @Test
    void statusExceptionsPassThrough() {
        Metadata trailers = new Metadata();
        trailers.put(GrpcExceptionAdvice.ERROR_CODE_KEY, "QUOTA");

        GrpcExceptionAdvice.Translation t = advice.translate(METHOD,
                Status.RESOURCE_EXHAUSTED.withDescription("slow down").asRuntimeException(trailers));

        assertThat(t.status().getCode()).isEqualTo(Status.Code.RESOURCE_EXHAUSTED);
        assertThat(t.status().getDescription()).isEqualTo("slow down");
        assertThat(t.trailers().get(GrpcExceptionAdvice.ERROR_CODE_KEY)).isEqualTo("QUOTA");

        GrpcExceptionAdvice.Translation checked = advice.translate(METHOD, Status.NOT_FOUND.asException());
        assertThat(checked.status().getCode()).isEqualTo(Status.Code.NOT_FOUND);
    }

    static final class CodedArgumentException extends IllegalArgumentException implements ErrorCoded {
        private final String code;

        CodedArgumentException(String code) {
            super("coded: " + code);
            this.code = code;
        }

        @Override
        public String errorCode() {
            return code;
        }
    }
}
