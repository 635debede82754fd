package io.usbjobs.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Named counter used to hand out numeric job ids.
 */
@Document(collection = "usbjobs_sequences")
public class SequenceDocument {

    @Id
    private String id;

    private long value;

    public SequenceDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public long getValue() {
        return value;
    }

    public void setValue(long value) {
        this.value = value;
    }
}
