package io.usbjobs.internal.mongo;

import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.util.Objects;

/**
 * Allocates strictly increasing ids from a counter document (upsert + $inc in one findAndModify).
 */
public class MongoSequenceGenerator {
    public static final String JOB_SEQUENCE = "processing_jobs";

    private final MongoTemplate mongoTemplate;

    public MongoSequenceGenerator(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    public long next(String sequence) {
        Objects.requireNonNull(sequence, "sequence must not be null");

        Query q = new Query(Criteria.where("_id").is(sequence));
        Update u = new Update().inc("value", 1L);

        SequenceDocument doc = mongoTemplate.findAndModify(
                q,
                u,
                FindAndModifyOptions.options().returnNew(true).upsert(true),
                SequenceDocument.class
        );
        if (doc == null) {
            throw new IllegalStateException("sequence upsert returned no document: " + sequence);
        }
        return doc.getValue();
    }
}
