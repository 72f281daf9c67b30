package io.dispatch4j.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Mongo document model for recurring job descriptors. The caller-supplied id is the key.
 */
@Document(collection = "crons")
public class CronDocument {

    @Id
    private String id;

    private String specification;

    public CronDocument() {
    }

    public CronDocument(String id, String specification) {
        this.id = id;
        this.specification = specification;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getSpecification() {
        return specification;
    }

    public void setSpecification(String specification) {
        this.specification = specification;
    }
}
