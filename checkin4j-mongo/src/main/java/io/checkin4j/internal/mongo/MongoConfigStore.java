package io.checkin4j.internal.mongo;

import io.checkin4j.core.PersistenceException;
import io.checkin4j.store.ConfigStore;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.util.Objects;
import java.util.Optional;

/**
 * Key/value configuration stored in the {@code configs} collection. Nothing is cached.
 */
public class MongoConfigStore implements ConfigStore {

    private final MongoTemplate mongoTemplate;

    public MongoConfigStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public Optional<String> get(String key) {
        Objects.requireNonNull(key, "key must not be null");
        try {
            ConfigEntryDocument doc = mongoTemplate.findById(key, ConfigEntryDocument.class);
            return doc == null ? Optional.empty() : Optional.ofNullable(doc.getValue());
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to read config " + key, e);
        }
    }

    @Override
    public void put(String key, String value) {
        Objects.requireNonNull(key, "key must not be null");
        Query q = new Query(Criteria.where("_id").is(key));
        try {
            mongoTemplate.upsert(q, new Update().set("value", value), ConfigEntryDocument.class);
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to write config " + key, e);
        }
    }
}
