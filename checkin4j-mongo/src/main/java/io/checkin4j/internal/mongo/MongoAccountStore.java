package io.checkin4j.internal.mongo;

import io.checkin4j.core.AccountSpec;
import io.checkin4j.core.PersistenceException;
import io.checkin4j.store.AccountStore;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * MongoDB persistence layer for accounts (collection {@code accounts}).
 */
public class MongoAccountStore implements AccountStore {

    private final MongoTemplate mongoTemplate;

    public MongoAccountStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public Optional<AccountSpec> findById(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return execute("find account " + id,
                () -> Optional.ofNullable(mongoTemplate.findById(id, AccountDocument.class)).map(this::toSpec));
    }

    @Override
    public List<AccountSpec> findAllEnabled() {
        Query q = new Query(Criteria.where("enabled").is(true)).with(Sort.by(Sort.Order.asc("_id")));
        List<AccountDocument> docs = execute("find enabled accounts", () -> mongoTemplate.find(q, AccountDocument.class));

        List<AccountSpec> accounts = new ArrayList<>(docs.size());
        for (AccountDocument d : docs) {
            accounts.add(toSpec(d));
        }
        return accounts;
    }

    /**
     * New accounts (null id) are inserted and get a Mongo-generated id; otherwise the document with
     * that id is upserted.
     */
    @Override
    public AccountSpec save(AccountSpec account) {
        Objects.requireNonNull(account, "account must not be null");
        Instant now = Instant.now();

        if (account.id() == null) {
            AccountDocument doc = toDocument(account);
            doc.setCreatedAt(now);
            doc.setUpdatedAt(now);
            AccountDocument inserted = execute("insert account", () -> mongoTemplate.insert(doc));
            return account.withId(inserted.getId());
        }

        Query q = new Query(Criteria.where("_id").is(account.id()));
        Update u = new Update()
                .set("name", account.name())
                .set("rawSpec", account.rawSpec())
                .set("scheduleExpr", account.scheduleExpr())
                .set("retryCount", account.retryCount())
                .set("retryIntervalSeconds", account.retryIntervalSeconds())
                .set("enabled", account.enabled())
                .set("updatedAt", now)
                .setOnInsert("createdAt", now);

        AccountDocument saved = execute("save account " + account.id(), () -> mongoTemplate.findAndModify(
                q, u, FindAndModifyOptions.options().upsert(true).returnNew(true), AccountDocument.class));
        return saved == null ? account : toSpec(saved);
    }

    @Override
    public boolean deleteById(String id) {
        Objects.requireNonNull(id, "id must not be null");
        Query q = new Query(Criteria.where("_id").is(id));
        long deleted = execute("delete account " + id,
                () -> mongoTemplate.remove(q, AccountDocument.class).getDeletedCount());
        return deleted > 0;
    }

    private AccountDocument toDocument(AccountSpec account) {
        AccountDocument doc = new AccountDocument();
        doc.setId(account.id());
        doc.setName(account.name());
        doc.setRawSpec(account.rawSpec());
        doc.setScheduleExpr(account.scheduleExpr());
        doc.setRetryCount(account.retryCount());
        doc.setRetryIntervalSeconds(account.retryIntervalSeconds());
        doc.setEnabled(account.enabled());
        return doc;
    }

    private AccountSpec toSpec(AccountDocument doc) {
        return new AccountSpec(
                doc.getId(),
                doc.getName(),
                doc.getRawSpec(),
                doc.getScheduleExpr(),
                doc.getRetryCount(),
                doc.getRetryIntervalSeconds(),
                doc.isEnabled()
        );
    }

    private static <T> T execute(String action, Supplier<T> work) {
        try {
            return work.get();
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to " + action, e);
        }
    }
}
