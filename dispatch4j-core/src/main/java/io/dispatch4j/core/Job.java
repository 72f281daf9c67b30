package io.dispatch4j.core;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * A persisted one-shot job.
 *
 * @param id           store-assigned identifier
 * @param createdAt    insertion time
 * @param scheduledFor earliest instant the job may fire
 * @param body         opaque payload forwarded verbatim; {@code null} when the job has none.
 *                     The array is not copied; callers must not modify it.
 */
public record Job(
        String id,
        Instant createdAt,
        Instant scheduledFor,
        byte[] body
) {
    public Job {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(scheduledFor, "scheduledFor must not be null");
    }

    public boolean hasBody() {
        return body != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Job other)) {
            return false;
        }
        return id.equals(other.id)
                && Objects.equals(createdAt, other.createdAt)
                && scheduledFor.equals(other.scheduledFor)
                && Arrays.equals(body, other.body);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(id, createdAt, scheduledFor) + Arrays.hashCode(body);
    }

    @Override
    public String toString() {
        return "Job[id=" + id + ", createdAt=" + createdAt + ", scheduledFor=" + scheduledFor
                + ", body=" + (body == null ? "none" : body.length + " bytes") + "]";
    }
}
