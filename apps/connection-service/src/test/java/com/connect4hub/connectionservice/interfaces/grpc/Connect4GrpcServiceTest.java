package com.connect4hub.connectionservice.interfaces.grpc;

import com.connect4hub.connectionservice.domain.enums.ConnectionErrorCode;
import com.connect4hub.connectionservice.service.ConnectionService;
import com.connect4hub.connectionservice.service.impl.ConnectionServiceImpl;
import com.connect4hub.grpc.advice.ExceptionTranslatingServerInterceptor;
import com.connect4hub.grpc.advice.GrpcExceptionAdvice;
import com.connect4hub.grpc.logging.CallLoggingServerInterceptor;
import com.connect4hub.proto.service.v1.Connect4ServiceGrpc;
import com.connect4hub.proto.service.v1.ConnectionRequest;
import com.connect4hub.proto.service.v1.ConnectionResponse;
import com.connect4hub.proto.service.v1.ConnectionResponseBody;
import com.connect4hub.proto.service.v1.RequestMetadata;
import io.grpc.Context;
import io.grpc.ManagedChannel;
import io.grpc.Server;
import io.grpc.ServerInterceptors;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import io.grpc.stub.StreamObserver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * 端到端：客户端 stub -> 进程内传输 -> 拦截器链 -> Connect4GrpcService。
 */
class Connect4GrpcServiceTest {

    private Server server;
    private ManagedChannel channel;
    private Connect4ServiceGrpc.Connect4ServiceBlockingStub stub;

    @BeforeEach
    void setUp() throws IOException {
        start(new ConnectionServiceImpl(Clock.systemUTC()));
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        channel.shutdownNow().awaitTermination(5, TimeUnit.SECONDS);
        server.shutdownNow().awaitTermination(5, TimeUnit.SECONDS);
    }

    @Test
    void identifiedClientGetsEmptyResponseBody() {
        ConnectionResponse response = stub.connect(ConnectionRequest.newBuilder()
                .setMetadata(RequestMetadata.newBuilder().setClientId("c1").setAccountId("a1"))
                .build());

        assertThat(response.hasResponse()).isTrue();
        assertThat(response.getResponse()).isEqualTo(ConnectionResponseBody.getDefaultInstance());
    }

    @Test
    void requestWithoutMetadataIsRejectedTheSameWayEveryTime() {
        for (int i = 0; i < 3; i++) {
            assertThatThrownBy(() -> stub.connect(ConnectionRequest.getDefaultInstance()))
                    .isInstanceOfSatisfying(StatusRuntimeException.class, e -> {
                        assertThat(e.getStatus().getCode()).isEqualTo(Status.Code.INVALID_ARGUMENT);
                        assertThat(e.getTrailers().get(GrpcExceptionAdvice.ERROR_CODE_KEY))
                                .isEqualTo(ConnectionErrorCode.METADATA_MISSING.name());
                    });
        }
    }

    @Test
    void blankAccountIdIsAClientError() {
        assertThatThrownBy(() -> stub.connect(ConnectionRequest.newBuilder()
                .setMetadata(RequestMetadata.newBuilder().setClientId("c1").setAccountId(""))
                .build()))
                .isInstanceOfSatisfying(StatusRuntimeException.class, e -> {
                    assertThat(e.getStatus().getCode()).isEqualTo(Status.Code.INVALID_ARGUMENT);
                    assertThat(e.getStatus().getDescription()).isEqualTo(ConnectionErrorCode.ACCOUNT_ID_MISSING.message());
                    assertThat(e.getTrailers().get(GrpcExceptionAdvice.ERROR_CODE_KEY))
                            .isEqualTo(ConnectionErrorCode.ACCOUNT_ID_MISSING.name());
                });
    }

    @Test
    void unexpectedFailureSurfacesAsInternal() throws Exception {
        tearDown();
        ConnectionService broken = mock(ConnectionService.class);
        when(broken.connect(any())).thenThrow(new NullPointerException("downstream"));
        start(broken);

        assertThatThrownBy(() -> stub.connect(ConnectionRequest.newBuilder()
                .setMetadata(RequestMetadata.newBuilder().setClientId("c1").setAccountId("a1"))
                .build()))
                .isInstanceOfSatisfying(StatusRuntimeException.class, e -> {
                    assertThat(e.getStatus().getCode()).isEqualTo(Status.Code.INTERNAL);
                    assertThat(e.getStatus().getDescription()).doesNotContain("downstream");
                });
    }

    @Test
    void invalidRequestNeverReachesApplicationService() throws Exception {
        tearDown();
        ConnectionService spyTarget = mock(ConnectionService.class);
        start(spyTarget);

        assertThatThrownBy(() -> stub.connect(ConnectionRequest.getDefaultInstance()))
                .isInstanceOf(StatusRuntimeException.class);
        verify(spyTarget, never()).connect(any());
    }

    @Test
    void cancelledCallGetsNoResponse() {
        Connect4GrpcService service = new Connect4GrpcService(new ConnectionServiceImpl(Clock.systemUTC()));
        RecordingObserver observer = new RecordingObserver();

        Context.CancellableContext context = Context.current().withCancellation();
        context.cancel(null);
        context.run(() -> service.connect(ConnectionRequest.newBuilder()
                .setMetadata(RequestMetadata.newBuilder().setClientId("c1").setAccountId("a1"))
                .build(), observer));

        assertThat(observer.values).isEmpty();
        assertThat(observer.completed).isFalse();
        assertThat(Status.fromThrowable(observer.error).getCode()).isEqualTo(Status.Code.CANCELLED);
    }

    private void start(ConnectionService connectionService) throws IOException {
        String name = InProcessServerBuilder.generateName();
        server = InProcessServerBuilder.forName(name)
                .directExecutor()
                // 与自动装配一致：日志在最外层
                .addService(ServerInterceptors.intercept(new Connect4GrpcService(connectionService),
                        new ExceptionTranslatingServerInterceptor(new GrpcExceptionAdvice()),
                        new CallLoggingServerInterceptor(true)))
                .build()
                .start();
        channel = InProcessChannelBuilder.forName(name).directExecutor().build();
        stub = Connect4ServiceGrpc.newBlockingStub(channel);
    }

    private static final class RecordingObserver implements StreamObserver<ConnectionResponse> {
        private final List<ConnectionResponse> values = new ArrayList<>();
        private Throwable error;
        private boolean completed;

        @Override
        public void onNext(ConnectionResponse value) {
            values.add(value);
        }

        @Override
        public void onError(Throwable t) {
            error = t;
        }

        @Override
        public void onCompleted() {
            completed = true;
        }
    }
}
