package com.ryuqq.cloudcall.application.engine;

import com.ryuqq.cloudcall.core.model.CallId;
import com.ryuqq.cloudcall.core.model.CancellationHandle;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 진행 중인 논리적 호출과 살아 있는 취소 핸들의 보관소.
 *
 * <p><strong>구성:</strong></p>
 * <ul>
 *   <li>Envelope 맵: CallId → CallEnvelope (등록 순서 유지)</li>
 *   <li>Cancellation Set: 실행 중인 모든 원격 호출 시도의 취소 핸들</li>
 * </ul>
 *
 * <p>등록 순서가 유지되므로 복구 후 재시도는 먼저 등록된 호출부터 실행됩니다.
 * 스케줄러 스레드에서만 접근하므로 동기화하지 않습니다.</p>
 *
 * @author CloudCall Team
 * @since 1.0.0
 */
public final class CallRegistry {

    private final Map<CallId, CallEnvelope<?>> envelopes = new LinkedHashMap<>();
    private final Set<CancellationHandle> cancellations = new LinkedHashSet<>();
    private CallId nextId = CallId.of(0);

    /**
     * 다음 CallId 발급.
     *
     * @return 단조 증가하는 CallId
     */
    public CallId nextCallId() {
        CallId issued = nextId;
        nextId = nextId.next();
        return issued;
    }

    /**
     * Envelope 등록.
     *
     * @param envelope 등록할 Envelope
     * @throws IllegalStateException 같은 ID가 이미 등록된 경우
     */
    public void register(CallEnvelope<?> envelope) {
        if (envelopes.putIfAbsent(envelope.id(), envelope) != null) {
            throw new IllegalStateException("Call already registered: " + envelope.id());
        }
    }

    public boolean remove(CallId id) {
        return envelopes.remove(id) != null;
    }

    public boolean contains(CallId id) {
        return envelopes.containsKey(id);
    }

    public boolean isEmpty() {
        return envelopes.isEmpty();
    }

    public int size() {
        return envelopes.size();
    }

    /**
     * 등록 순서대로 Envelope 스냅샷 조회.
     *
     * @return 등록된 Envelope 목록 (복사본)
     */
    public List<CallEnvelope<?>> envelopes() {
        return new ArrayList<>(envelopes.values());
    }

    public void addCancellation(CancellationHandle handle) {
        cancellations.add(handle);
    }

    public void removeCancellation(CancellationHandle handle) {
        cancellations.remove(handle);
    }

    public int cancellationCount() {
        return cancellations.size();
    }

    /**
     * 모든 취소 핸들을 취소하고 Cancellation Set을 비움.
     *
     * @return 취소한 핸들 수
     */
    public int cancelAll() {
        List<CancellationHandle> snapshot = new ArrayList<>(cancellations);
        cancellations.clear();
        snapshot.forEach(CancellationHandle::cancel);
        return snapshot.size();
    }

    /**
     * Cancellation Set만 비움 (취소하지 않음).
     */
    public void clearCancellations() {
        cancellations.clear();
    }

    /**
     * ID 순번 초기화 (엔진 시작 시).
     */
    public void resetSequence() {
        nextId = CallId.of(0);
    }
}
