package io.checkin4j.config;

import io.checkin4j.internal.mongo.AccountDocument;
import io.checkin4j.internal.mongo.CheckinLogDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

/**
 * MongoDB index definitions for checkin4j.
 *
 * <p>Indexes are only created at startup when {@code checkin.ensure-indexes-on-startup=true};
 * otherwise manage them with your usual migration tooling.
 *
 * <h3>Required indexes</h3>
 * <ul>
 *   <li><b>idx_executed_at</b> on {@code checkin_logs}: { executedAt: 1 }
 *       <br/>Used by retention trimming and the recent-rows listing.</li>
 *   <li><b>idx_account_executed_at</b> on {@code checkin_logs}: { accountId: 1, executedAt: -1 }
 *       <br/>Used by per-account history and the delete cascade.</li>
 *   <li><b>idx_enabled</b> on {@code accounts}: { enabled: 1 }
 *       <br/>Used when reloading every enabled account.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.checkin_logs.createIndex({ executedAt: 1 }, { name: "idx_executed_at" });
 * db.checkin_logs.createIndex({ accountId: 1, executedAt: -1 }, { name: "idx_account_executed_at" });
 * db.accounts.createIndex({ enabled: 1 }, { name: "idx_enabled" });
 * </pre>
 */
public class CheckinMongoIndexConfig {

    public static final String IDX_EXECUTED_AT = "idx_executed_at";
    public static final String IDX_ACCOUNT_EXECUTED_AT = "idx_account_executed_at";
    public static final String IDX_ENABLED = "idx_enabled";

    private final MongoTemplate mongoTemplate;

    public CheckinMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    public void ensureIndexes() {
        mongoTemplate.indexOps(CheckinLogDocument.class).ensureIndex(executedAtIndex());
        mongoTemplate.indexOps(CheckinLogDocument.class).ensureIndex(accountExecutedAtIndex());
        mongoTemplate.indexOps(AccountDocument.class).ensureIndex(enabledIndex());
    }

    public static Index executedAtIndex() {
        return new Index()
                .on("executedAt", Sort.Direction.ASC)
                .named(IDX_EXECUTED_AT);
    }

    public static Index accountExecutedAtIndex() {
        return new Index()
                .on("accountId", Sort.Direction.ASC)
                .on("executedAt", Sort.Direction.DESC)
                .named(IDX_ACCOUNT_EXECUTED_AT);
    }

    public static Index enabledIndex() {
        return new Index()
                .on("enabled", Sort.Direction.ASC)
                .named(IDX_ENABLED);
    }
}
