package com.newsboard.collectors.api;

import com.newsboard.collectors.page.PageDriverFactory;
import com.newsboard.core.bus.EventBus;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

public record CollectorContext(
        PageDriverFactory driverFactory,
        EventBus eventBus,
        StateStore stateStore,
        RunRecorder recorder,
        Clock clock,
        Duration navigationTimeout,
        Duration waitTimeout,
        Map<String, Object> config
) {
    public CollectorContext {
        Objects.requireNonNull(driverFactory, "driverFactory is required");
        Objects.requireNonNull(eventBus, "eventBus is required");
        Objects.requireNonNull(stateStore, "stateStore is required");
        Objects.requireNonNull(recorder, "recorder is required");
        Objects.requireNonNull(clock, "clock is required");
        Objects.requireNonNull(navigationTimeout, "navigationTimeout is required");
        Objects.requireNonNull(waitTimeout, "waitTimeout is required");
        Objects.requireNonNull(config, "config is required");
    }

    public <T> T requiredConfig(String key, Class<T> type) {
        Object value = config.get(key);
        if (value == null) {
            throw new IllegalArgumentException("Missing required config key: " + key);
        }
        if (!type.isInstance(value)) {
            throw new IllegalArgumentException("Config key '" + key + "' must be " + type.getSimpleName());
        }
        return type.cast(value);
    }
}
