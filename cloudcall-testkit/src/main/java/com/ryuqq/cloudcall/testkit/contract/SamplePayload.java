package com.ryuqq.cloudcall.testkit.contract;

import com.ryuqq.cloudcall.core.model.BasePayload;

/**
 * Response type used by contract tests.
 *
 * @param value response value
 * @param userData embedded user data update (may be null or empty)
 * @param resources embedded resource delta (may be null or empty)
 *
 * @author CloudCall Team
 * @since 1.0.0
 */
public record SamplePayload(String value, String userData, String resources) implements BasePayload {

    /**
     * Creates a payload without embedded app-state updates.
     *
     * @param value response value
     * @return payload
     */
    public static SamplePayload of(String value) {
        return new SamplePayload(value, null, null);
    }
}
