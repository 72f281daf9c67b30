package io.dispatch4j.config;

import io.dispatch4j.internal.mongo.JobDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

import java.util.Objects;

/**
 * MongoDB index definitions for the dispatcher.
 *
 * <h3>Required indexes (collection: {@code jobs})</h3>
 * <ul>
 *   <li><b>idx_scheduled_for</b>: { scheduledFor: 1 }
 *       <br/>Used by the due-job sweep and the next-wake lookup.</li>
 * </ul>
 *
 * <p>The {@code crons} collection is keyed by the caller's id and needs no extra index.
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.jobs.createIndex({ scheduledFor: 1 }, { name: "idx_scheduled_for" });
 * </pre>
 */
public class DispatchMongoIndexConfig {

    public static final String IDX_SCHEDULED_FOR = "idx_scheduled_for";

    private final MongoTemplate mongoTemplate;

    public DispatchMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    /**
     * Create the required indexes. Existing indexes with the same definition are left alone.
     */
    public void ensureIndexes() {
        mongoTemplate.indexOps(JobDocument.class).ensureIndex(scheduledForIndex());
    }

    /**
     * Keys: scheduledFor ASC
     */
    public static Index scheduledForIndex() {
        return new Index()
                .on("scheduledFor", Sort.Direction.ASC)
                .named(IDX_SCHEDULED_FOR);
    }
}
