package io.dispatch4j.internal.mongo;

import io.dispatch4j.core.CronDescriptor;
import io.dispatch4j.core.CronStore;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static io.dispatch4j.internal.mongo.MongoJobStore.execute;

/**
 * MongoDB persistence layer for recurring job descriptors.
 */
public class MongoCronStore implements CronStore {

    private final MongoTemplate mongoTemplate;

    public MongoCronStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public List<CronDescriptor> findAll() {
        List<CronDocument> docs = execute("load crons", () -> mongoTemplate.findAll(CronDocument.class));
        List<CronDescriptor> out = new ArrayList<>(docs.size());
        for (CronDocument d : docs) {
            out.add(new CronDescriptor(d.getId(), d.getSpecification()));
        }
        return out;
    }

    @Override
    public void deleteAll() {
        execute("clear crons", () -> mongoTemplate.remove(new Query(), CronDocument.class));
    }

    @Override
    public void insert(CronDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor must not be null");
        execute("insert cron " + descriptor.id(),
                () -> mongoTemplate.insert(new CronDocument(descriptor.id(), descriptor.scheduleExpression())));
    }
}
