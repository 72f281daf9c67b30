package io.dispatch4j.internal.mongo;

import com.mongodb.MongoException;
import io.dispatch4j.core.Job;
import io.dispatch4j.core.JobStore;
import io.dispatch4j.core.StoreException;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * MongoDB persistence layer for one-shot jobs.
 *
 * <p>Mongo dates carry millisecond precision, so due times with a sub-millisecond part are
 * rounded up to the next millisecond on insert. A job never fires before its requested time.
 */
public class MongoJobStore implements JobStore {

    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    public MongoJobStore(MongoTemplate mongoTemplate) {
        this(mongoTemplate, Clock.systemUTC());
    }

    public MongoJobStore(MongoTemplate mongoTemplate, Clock clock) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public Job insert(Instant scheduledFor, byte[] body) {
        Objects.requireNonNull(scheduledFor, "scheduledFor must not be null");

        JobDocument doc = new JobDocument();
        doc.setCreatedAt(clock.instant().truncatedTo(ChronoUnit.MILLIS));
        doc.setScheduledFor(roundUpToMillis(scheduledFor));
        doc.setBody(body);

        JobDocument saved = execute("insert job", () -> mongoTemplate.insert(doc));
        return toJob(saved);
    }

    @Override
    public boolean deleteById(String id) {
        Objects.requireNonNull(id, "id must not be null");
        Query q = new Query(Criteria.where("_id").is(id));
        return execute("delete job " + id, () -> mongoTemplate.remove(q, JobDocument.class).getDeletedCount()) > 0;
    }

    @Override
    public List<Job> findDue(Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        Query q = new Query(Criteria.where("scheduledFor").lte(now));
        q.with(Sort.by(Sort.Order.asc("scheduledFor")));

        List<JobDocument> docs = execute("find due jobs", () -> mongoTemplate.find(q, JobDocument.class));
        List<Job> jobs = new ArrayList<>(docs.size());
        for (JobDocument d : docs) {
            jobs.add(toJob(d));
        }
        return jobs;
    }

    @Override
    public Optional<Instant> findNextScheduledFor() {
        Query q = new Query();
        q.with(Sort.by(Sort.Order.asc("scheduledFor")));
        q.limit(1);
        q.fields().include("scheduledFor");

        JobDocument next = execute("find next job", () -> mongoTemplate.findOne(q, JobDocument.class));
        return next == null ? Optional.empty() : Optional.ofNullable(next.getScheduledFor());
    }

    static Instant roundUpToMillis(Instant t) {
        Instant truncated = t.truncatedTo(ChronoUnit.MILLIS);
        return truncated.equals(t) ? t : truncated.plusMillis(1);
    }

    private static Job toJob(JobDocument doc) {
        return new Job(doc.getId(), doc.getCreatedAt(), doc.getScheduledFor(), doc.getBody());
    }

    static <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException | MongoException e) {
            throw new StoreException("Failed to " + operation + ": " + e.getMessage(), e);
        }
    }
}
