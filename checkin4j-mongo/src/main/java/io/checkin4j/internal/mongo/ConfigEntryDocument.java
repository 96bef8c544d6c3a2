package io.checkin4j.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * One key/value configuration entry; the key is the document id.
 */
@Document(collection = "configs")
public class ConfigEntryDocument {

    @Id
    private String key;

    private String value;

    public ConfigEntryDocument() {
    }

    public ConfigEntryDocument(String key, String value) {
        this.key = key;
        this.value = value;
    }

    public String getKey() {
        return key;
    }

    public void setKey(String key) {
        this.key = key;
    }

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
    }
}
