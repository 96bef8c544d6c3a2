package io.checkin4j.internal.mongo;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.MongoClients;
import io.checkin4j.core.AccountSpec;
import io.checkin4j.core.AuditLogEntry;
import io.checkin4j.core.ExecutionStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Testcontainers(disabledWithoutDocker = true)
class MongoStoresIntegrationTest {

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

    private static final Instant BASE = Instant.parse("2026-03-01T08:00:00Z");

    private MongoTemplate mongoTemplate;
    private MongoAccountStore accountStore;
    private MongoCheckinLogStore logStore;
    private MongoConfigStore configStore;

    @BeforeEach
    void setUp() {
        mongoTemplate = new MongoTemplate(MongoClients.create(MONGO.getReplicaSetUrl()), "checkin4j_test");
        dropAll();
        // collections must exist before they are touched inside a transaction
        mongoTemplate.createCollection(CheckinLogDocument.class);
        accountStore = new MongoAccountStore(mongoTemplate);
        logStore = new MongoCheckinLogStore(mongoTemplate, new ObjectMapper());
        configStore = new MongoConfigStore(mongoTemplate);
    }

    @AfterEach
    void tearDown() {
        dropAll();
    }

    private void dropAll() {
        mongoTemplate.dropCollection(AccountDocument.class);
        mongoTemplate.dropCollection(CheckinLogDocument.class);
        mongoTemplate.dropCollection(ConfigEntryDocument.class);
    }

    @Test
    void newAccountShouldGetGeneratedIdAndUpdateInPlace() {
        AccountSpec saved = accountStore.save(AccountSpec.of(null, "Forum", "curl https://forum.example/sign", "0 8 * * *"));
        assertNotNull(saved.id());

        accountStore.save(saved.withRetry(5, 10).withEnabled(false));

        AccountSpec loaded = accountStore.findById(saved.id()).orElseThrow();
        assertEquals("Forum", loaded.name());
        assertEquals(5, loaded.retryCount());
        assertEquals(10, loaded.retryIntervalSeconds());
        assertFalse(loaded.enabled());
        assertEquals(1, mongoTemplate.count(new Query(), AccountDocument.class));
    }

    @Test
    void findAllEnabledShouldSkipDisabledAccounts() {
        AccountSpec a = accountStore.save(AccountSpec.of(null, "a", "curl https://a.example", "0 8 * * *"));
        accountStore.save(AccountSpec.of(null, "b", "curl https://b.example", "0 8 * * *").withEnabled(false));

        List<AccountSpec> enabled = accountStore.findAllEnabled();

        assertEquals(1, enabled.size());
        assertEquals(a.id(), enabled.get(0).id());
    }

    @Test
    void deleteAccountShouldReportWhetherItExisted() {
        AccountSpec a = accountStore.save(AccountSpec.of(null, "a", "curl https://a.example", "0 8 * * *"));

        assertTrue(accountStore.deleteById(a.id()));
        assertFalse(accountStore.deleteById(a.id()));
        assertTrue(accountStore.findById(a.id()).isEmpty());
    }

    @Test
    void appendedRowShouldReadBackWithMaps() {
        String id = logStore.append(new AuditLogEntry(null, "acc-1", ExecutionStatus.FAILED, 500, "boom", "HTTP 500",
                BASE, "POST", "https://example.com/checkin",
                Map.of("Authorization", "***REDACTED***"), Map.of("session.id", "abcd***"), "a=1"));

        List<AuditLogEntry> recent = logStore.findRecent(10);

        assertEquals(1, recent.size());
        AuditLogEntry row = recent.get(0);
        assertEquals(id, row.id());
        assertEquals(ExecutionStatus.FAILED, row.status());
        assertEquals(500, row.responseCode());
        assertEquals("***REDACTED***", row.requestHeaders().get("Authorization"));
        assertEquals("abcd***", row.requestCookies().get("session.id"));
        assertEquals("a=1", row.requestData());
    }

    @Test
    void trimShouldKeepNewestRows() {
        for (int i = 0; i < 530; i++) {
            logStore.append(row("acc-" + (i % 3), BASE.plusSeconds(i)));
        }

        long deleted = logStore.trimToMostRecent(500);

        assertEquals(30, deleted);
        assertEquals(500, logStore.count());
        List<AuditLogEntry> all = logStore.findRecent(1000);
        assertEquals(BASE.plusSeconds(529), all.get(0).executedAt());
        assertEquals(BASE.plusSeconds(30), all.get(all.size() - 1).executedAt());
    }

    @Test
    void trimUnderLimitShouldDeleteNothing() {
        logStore.append(row("acc-1", BASE));
        assertEquals(0, logStore.trimToMostRecent(10));
        assertEquals(1, logStore.count());
    }

    @Test
    void deletesShouldMatchAccountAndCutoff() {
        List<String> ids = new ArrayList<>();
        ids.add(logStore.append(row("acc-1", BASE)));
        ids.add(logStore.append(row("acc-1", BASE.plusSeconds(60))));
        ids.add(logStore.append(row("acc-2", BASE.plusSeconds(120))));
        assertEquals(3, ids.size());

        assertEquals(1, logStore.deleteExecutedBefore(BASE.plusSeconds(30)));
        assertEquals(1, logStore.deleteByAccountId("acc-1"));
        assertEquals(1, logStore.count());
        assertEquals("acc-2", logStore.findRecent(5).get(0).accountId());
    }

    @Test
    void configShouldUpsertAndReadFresh() {
        assertTrue(configStore.get("auto_clean_logs").isEmpty());
        assertFalse(configStore.isTrue("auto_clean_logs"));

        configStore.put("auto_clean_logs", "true");
        assertTrue(configStore.isTrue("auto_clean_logs"));

        configStore.put("auto_clean_logs", "false");
        assertEquals("false", configStore.get("auto_clean_logs").orElseThrow());
    }

    private static AuditLogEntry row(String accountId, Instant at) {
        return new AuditLogEntry(null, accountId, ExecutionStatus.SUCCESS, 200, "ok", null,
                at, "GET", "https://example.com", null, null, null);
    }
}
