package io.dispatch4j.core;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable table of pending one-shot jobs.
 *
 * <p>Every method throws {@link StoreException} when the backing store fails.
 */
public interface JobStore {

    /**
     * Persist a new job and return it with its assigned id.
     */
    Job insert(Instant scheduledFor, byte[] body);

    /**
     * Hard delete a job.
     *
     * @return {@code false} if no job with that id exists
     */
    boolean deleteById(String id);

    /**
     * Jobs whose {@code scheduledFor <= now}, earliest first.
     */
    List<Job> findDue(Instant now);

    /**
     * Due time of the earliest pending job, if any.
     */
    Optional<Instant> findNextScheduledFor();
}
