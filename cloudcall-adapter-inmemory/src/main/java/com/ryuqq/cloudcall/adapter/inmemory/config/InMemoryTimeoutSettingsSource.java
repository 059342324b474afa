package com.ryuqq.cloudcall.adapter.inmemory.config;

import com.ryuqq.cloudcall.core.spi.TimeoutSettingsSource;
import com.ryuqq.cloudcall.core.timeout.TimeoutSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Mutable in-memory {@link TimeoutSettingsSource}.
 *
 * <p>Hosts that receive server-side configuration push new deadlines through
 * {@link #update(TimeoutSettings)}. The engine picks them up at the next cycle start or
 * the next call arriving mid-cycle.</p>
 *
 * @author CloudCall Team
 * @since 1.0.0
 */
public class InMemoryTimeoutSettingsSource implements TimeoutSettingsSource {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTimeoutSettingsSource.class);

    private final AtomicReference<TimeoutSettings> settings;

    /**
     * Creates a source holding the default settings (3s / 7s).
     */
    public InMemoryTimeoutSettingsSource() {
        this(new TimeoutSettings());
    }

    /**
     * Creates a source holding the given settings.
     *
     * @param initial initial settings
     * @throws IllegalArgumentException if initial is null
     */
    public InMemoryTimeoutSettingsSource(TimeoutSettings initial) {
        if (initial == null) {
            throw new IllegalArgumentException("initial cannot be null");
        }
        this.settings = new AtomicReference<>(initial);
    }

    @Override
    public TimeoutSettings current() {
        return settings.get();
    }

    /**
     * Replaces the settings.
     *
     * @param updated new settings
     * @return the previous settings
     * @throws IllegalArgumentException if updated is null
     */
    public TimeoutSettings update(TimeoutSettings updated) {
        if (updated == null) {
            throw new IllegalArgumentException("updated cannot be null");
        }
        TimeoutSettings previous = settings.getAndSet(updated);
        log.info("Timeout settings updated: spinner {}ms → {}ms, popup {}ms → {}ms",
            previous.spinnerDeadline().toMillis(), updated.spinnerDeadline().toMillis(),
            previous.popupDeadline().toMillis(), updated.popupDeadline().toMillis());
        return previous;
    }
}
