package com.ryuqq.cloudcall.application.engine;

import com.ryuqq.cloudcall.core.model.BasePayload;
import com.ryuqq.cloudcall.core.spi.AppStateSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.mockito.Mockito.*;

/**
 * BasePayloadReactor 유닛 테스트.
 *
 * @author CloudCall Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class BasePayloadReactorTest {

    @Mock
    private AppStateSink sink;

    private BasePayloadReactor reactor;

    @BeforeEach
    void setUp() {
        reactor = new BasePayloadReactor(sink);
    }

    @Test
    void react_사용자_데이터와_리소스가_있으면_모두_전달() {
        // given
        Payload payload = new Payload("{\"gold\":10}", "{\"gems\":3}");

        // when
        reactor.react(payload);

        // then
        verify(sink).applyUserDataUpdate(payload);
        verify(sink).applyResourceUpdate(payload);
    }

    @Test
    void react_빈_필드는_전달하지_않음() {
        // given
        Payload payload = new Payload("", "{\"gems\":3}");

        // when
        reactor.react(payload);

        // then
        verify(sink, never()).applyUserDataUpdate(any());
        verify(sink).applyResourceUpdate(payload);
    }

    @Test
    void react_BasePayload가_아니면_무시() {
        reactor.react("plain response");
        reactor.react(null);

        verifyNoInteractions(sink);
    }

    @Test
    void react_사용자_데이터_반영이_실패해도_리소스는_반영() {
        // given
        Payload payload = new Payload("{\"gold\":10}", "{\"gems\":3}");
        doThrow(new IllegalStateException("store locked")).when(sink).applyUserDataUpdate(payload);

        // when
        reactor.react(payload);

        // then
        verify(sink).applyResourceUpdate(payload);
    }

    private record Payload(String userData, String resources) implements BasePayload {
    }
}
