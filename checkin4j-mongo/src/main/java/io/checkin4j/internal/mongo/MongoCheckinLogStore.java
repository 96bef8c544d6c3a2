package io.checkin4j.internal.mongo;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.checkin4j.core.AuditLogEntry;
import io.checkin4j.core.ExecutionStatus;
import io.checkin4j.core.PersistenceException;
import io.checkin4j.store.CheckinLogStore;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.MongoTransactionManager;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * MongoDB persistence layer for the audit log (collection {@code checkin_logs}).
 *
 * <p>{@link #trimToMostRecent(int)} counts, selects and deletes inside one multi-document
 * transaction, so the deployment must be a replica set.
 */
public class MongoCheckinLogStore implements CheckinLogStore {

    private static final TypeReference<LinkedHashMap<String, String>> STRING_MAP = new TypeReference<>() {
    };

    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate transactionTemplate;

    public MongoCheckinLogStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        this(mongoTemplate, objectMapper,
                new TransactionTemplate(new MongoTransactionManager(
                        Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null").getMongoDatabaseFactory())));
    }

    public MongoCheckinLogStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper,
                                TransactionTemplate transactionTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.transactionTemplate = Objects.requireNonNull(transactionTemplate, "transactionTemplate must not be null");
    }

    @Override
    public String append(AuditLogEntry entry) {
        Objects.requireNonNull(entry, "entry must not be null");
        CheckinLogDocument doc = toDocument(entry);
        return execute("append audit row for account " + entry.accountId(),
                () -> mongoTemplate.insert(doc).getId());
    }

    @Override
    public long count() {
        return execute("count audit rows", () -> mongoTemplate.count(new Query(), CheckinLogDocument.class));
    }

    @Override
    public long trimToMostRecent(int maxRows) {
        if (maxRows < 0) {
            throw new IllegalArgumentException("maxRows must not be negative");
        }
        Long deleted = execute("trim audit log", () -> transactionTemplate.execute(status -> {
            long total = mongoTemplate.count(new Query(), CheckinLogDocument.class);
            long excess = total - maxRows;
            if (excess <= 0) {
                return 0L;
            }

            Query oldest = new Query()
                    .with(Sort.by(Sort.Order.asc("executedAt"), Sort.Order.asc("_id")))
                    .limit((int) Math.min(excess, Integer.MAX_VALUE));
            oldest.fields().include("_id");

            List<String> ids = new ArrayList<>();
            for (CheckinLogDocument d : mongoTemplate.find(oldest, CheckinLogDocument.class)) {
                ids.add(d.getId());
            }
            return mongoTemplate.remove(new Query(Criteria.where("_id").in(ids)), CheckinLogDocument.class)
                    .getDeletedCount();
        }));
        return deleted == null ? 0 : deleted;
    }

    @Override
    public long deleteByAccountId(String accountId) {
        Objects.requireNonNull(accountId, "accountId must not be null");
        Query q = new Query(Criteria.where("accountId").is(accountId));
        return execute("delete audit rows of account " + accountId,
                () -> mongoTemplate.remove(q, CheckinLogDocument.class).getDeletedCount());
    }

    @Override
    public long deleteExecutedBefore(Instant cutoff) {
        Objects.requireNonNull(cutoff, "cutoff must not be null");
        Query q = new Query(Criteria.where("executedAt").lt(cutoff));
        return execute("delete audit rows before " + cutoff,
                () -> mongoTemplate.remove(q, CheckinLogDocument.class).getDeletedCount());
    }

    @Override
    public List<AuditLogEntry> findRecent(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        Query q = new Query()
                .with(Sort.by(Sort.Order.desc("executedAt"), Sort.Order.desc("_id")))
                .limit(limit);
        List<CheckinLogDocument> docs = execute("read recent audit rows",
                () -> mongoTemplate.find(q, CheckinLogDocument.class));

        List<AuditLogEntry> entries = new ArrayList<>(docs.size());
        for (CheckinLogDocument d : docs) {
            entries.add(toEntry(d));
        }
        return entries;
    }

    private CheckinLogDocument toDocument(AuditLogEntry entry) {
        CheckinLogDocument doc = new CheckinLogDocument();
        doc.setAccountId(entry.accountId());
        doc.setStatus(entry.status().value());
        doc.setResponseCode(entry.responseCode());
        doc.setResponseBody(entry.responseBody());
        doc.setErrorMessage(entry.errorMessage());
        doc.setExecutedAt(entry.executedAt());
        doc.setRequestMethod(entry.requestMethod());
        doc.setRequestUrl(entry.requestUrl());
        doc.setRequestHeaders(writeMap(entry.requestHeaders()));
        doc.setRequestCookies(writeMap(entry.requestCookies()));
        doc.setRequestData(entry.requestData());
        return doc;
    }

    private AuditLogEntry toEntry(CheckinLogDocument doc) {
        return new AuditLogEntry(
                doc.getId(),
                doc.getAccountId(),
                ExecutionStatus.fromValue(doc.getStatus()),
                doc.getResponseCode(),
                doc.getResponseBody(),
                doc.getErrorMessage(),
                doc.getExecutedAt(),
                doc.getRequestMethod(),
                doc.getRequestUrl(),
                readMap(doc.getRequestHeaders()),
                readMap(doc.getRequestCookies()),
                doc.getRequestData()
        );
    }

    private String writeMap(Map<String, String> map) {
        if (map == null || map.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(map);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialize audit map", e);
        }
    }

    private Map<String, String> readMap(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, STRING_MAP);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to read audit map", e);
        }
    }

    private static <T> T execute(String action, Supplier<T> work) {
        try {
            return work.get();
        } catch (DataAccessException | TransactionException e) {
            throw new PersistenceException("Failed to " + action, e);
        }
    }
}
