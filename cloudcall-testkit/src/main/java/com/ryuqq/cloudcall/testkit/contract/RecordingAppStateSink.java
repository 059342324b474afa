package com.ryuqq.cloudcall.testkit.contract;

import com.ryuqq.cloudcall.core.model.BasePayload;
import com.ryuqq.cloudcall.core.spi.AppStateSink;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link AppStateSink} that records every update it receives.
 *
 * @author CloudCall Team
 * @since 1.0.0
 */
public class RecordingAppStateSink implements AppStateSink {

    private final List<BasePayload> userDataUpdates = new CopyOnWriteArrayList<>();
    private final List<BasePayload> resourceUpdates = new CopyOnWriteArrayList<>();

    @Override
    public void applyUserDataUpdate(BasePayload payload) {
        userDataUpdates.add(payload);
    }

    @Override
    public void applyResourceUpdate(BasePayload payload) {
        resourceUpdates.add(payload);
    }

    public List<BasePayload> userDataUpdates() {
        return List.copyOf(userDataUpdates);
    }

    public List<BasePayload> resourceUpdates() {
        return List.copyOf(resourceUpdates);
    }

    public void clear() {
        userDataUpdates.clear();
        resourceUpdates.clear();
    }
}
