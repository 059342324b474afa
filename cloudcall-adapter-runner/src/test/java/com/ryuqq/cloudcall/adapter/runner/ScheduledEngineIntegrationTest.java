package com.ryuqq.cloudcall.adapter.runner;

import com.ryuqq.cloudcall.application.engine.CloudCallEngine;
import com.ryuqq.cloudcall.core.model.CallFamily;
import com.ryuqq.cloudcall.core.model.CallRequest;
import com.ryuqq.cloudcall.core.model.CallType;
import com.ryuqq.cloudcall.core.model.CancellationHandle;
import com.ryuqq.cloudcall.core.outcome.CallOutcome;
import com.ryuqq.cloudcall.core.outcome.Fail;
import com.ryuqq.cloudcall.core.outcome.Ok;
import com.ryuqq.cloudcall.core.spi.AppStateSink;
import com.ryuqq.cloudcall.core.spi.LoadingIndicator;
import com.ryuqq.cloudcall.core.spi.Transport;
import com.ryuqq.cloudcall.core.spinner.SpinnerMode;
import com.ryuqq.cloudcall.core.timeout.TimeoutSettings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * ScheduledTickScheduler 위에서 CloudCallEngine 전체 흐름을 검증하는 통합 테스트.
 *
 * <p>10ms 틱, 스피너 50ms / 팝업 50ms 설정으로 실제 시간 기반 타임아웃과
 * 복구 후 재시도가 동작하는지 확인합니다.</p>
 *
 * @author CloudCall Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ScheduledEngineIntegrationTest {

    private static final long TIMEOUT_SECONDS = 5;
    private static final CallType<String> PROFILE = CallType.of(CallFamily.of("PROFILE"), String.class);

    @Mock
    private LoadingIndicator indicator;

    @Mock
    private AppStateSink appStateSink;

    private ScheduledTickScheduler scheduler;
    private AtomicInteger invocations;
    private AtomicInteger recoveries;
    private CloudCallEngine engine;

    @BeforeEach
    void setUp() {
        scheduler = new ScheduledTickScheduler(new TickSchedulerConfig().withTickIntervalMs(10));
        scheduler.start();
        invocations = new AtomicInteger();
        recoveries = new AtomicInteger();

        engine = new CloudCallEngine(
            scheduler,
            new FirstAttemptHangsTransport(),
            listener -> () -> { },
            blocking -> {
                recoveries.incrementAndGet();
                return CompletableFuture.completedFuture(null);
            },
            indicator,
            appStateSink,
            () -> TimeoutSettings.ofMillis(50, 50)
        );
        engine.start();
    }

    @AfterEach
    void tearDown() throws Exception {
        engine.shutdown().get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        scheduler.shutdown();
    }

    @Test
    void 첫_시도가_멈추면_타임아웃_후_복구하고_재시도로_성공() throws Exception {
        // when
        CallOutcome<String> outcome = engine.callResilient(CallRequest.of(PROFILE), SpinnerMode.INVISIBLE)
            .get(TIMEOUT_SECONDS, TimeUnit.SECONDS);

        // then
        assertThat(outcome).isInstanceOf(Ok.class);
        assertThat(outcome.value()).contains("profile");
        assertThat(((Ok<String>) outcome).attempts()).isEqualTo(2);
        assertThat(recoveries.get()).isEqualTo(1);
        assertThat(invocations.get()).isEqualTo(2);
    }

    @Test
    void 종료하면_대기_중인_호출은_ENGINE_SHUTDOWN으로_완료() throws Exception {
        // given
        CompletableFuture<CallOutcome<String>> pending =
            engine.callResilient(CallRequest.of(PROFILE), SpinnerMode.INVISIBLE);

        // when
        engine.shutdown().get(TIMEOUT_SECONDS, TimeUnit.SECONDS);

        // then
        CallOutcome<String> outcome = pending.get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        assertThat(outcome).isInstanceOf(Fail.class);
        assertThat(((Fail<String>) outcome).errorCode()).isEqualTo(Fail.ENGINE_SHUTDOWN);
        assertThat(engine.isRunning()).isFalse();
    }

    private final class FirstAttemptHangsTransport implements Transport {

        @Override
        public <T> CompletableFuture<T> invoke(CallRequest<T> request, CancellationHandle handle) {
            if (invocations.incrementAndGet() == 1) {
                CompletableFuture<T> hanging = new CompletableFuture<>();
                handle.onCancel(() -> hanging.cancel(false));
                return hanging;
            }
            return CompletableFuture.completedFuture(request.type().responseType().cast("profile"));
        }
    }
}
