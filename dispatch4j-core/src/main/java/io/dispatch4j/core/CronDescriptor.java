package io.dispatch4j.core;

import java.util.Objects;

/**
 * A recurring trigger definition: fire a callback carrying {@code id} whenever
 * {@code scheduleExpression} matches the wall clock.
 */
public record CronDescriptor(String id, String scheduleExpression) {
    public CronDescriptor {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(scheduleExpression, "scheduleExpression must not be null");
    }
}
