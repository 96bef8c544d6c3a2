package io.checkin4j.internal;

import io.checkin4j.ExecutionEngine;
import io.checkin4j.JobScheduler;
import io.checkin4j.core.AccountSpec;
import io.checkin4j.core.ExecutionOutcome;
import io.checkin4j.core.ReloadResult;
import io.checkin4j.core.ScheduleTrigger;
import io.checkin4j.utils.CronSchedule;
import io.checkin4j.utils.CronSupport;
import io.checkin4j.utils.ScheduleResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.Delayed;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process cron scheduler.
 *
 * <p>Core capabilities:
 * <ul>
 *   <li>One trigger per account, keyed {@code account_<id>}; installing again replaces</li>
 *   <li>Random-window triggers wait a uniform random delay before running</li>
 *   <li>A daily retention trigger that account reloads never touch</li>
 * </ul>
 *
 * <p>A dispatcher thread takes due fires from a {@link DelayQueue}, queues the trigger's next fire
 * and hands the work to an unbounded daemon pool, so a sleeping or retrying account never holds
 * up another. A fire whose trigger was replaced or removed in the meantime is dropped.
 *
 * <p>Typical usage:
 * <pre>{@code
 * scheduler.start();
 * scheduler.reloadAll(accountStore.findAllEnabled());
 * scheduler.install("42", "R(09:00-09:30) * * *");
 * scheduler.stop();
 * }</pre>
 */
public class SimpleJobScheduler implements JobScheduler {
    private static final Logger log = LoggerFactory.getLogger(SimpleJobScheduler.class);

    static final String ACCOUNT_KEY_PREFIX = "account_";
    static final String RETENTION_KEY = "auto_clean_logs";

    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(5);

    private final ExecutionEngine engine;
    private final Runnable retentionTask;
    private final String retentionCron;
    private final ZoneId zone;
    private final Clock clock;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final ConcurrentHashMap<String, InstalledTrigger> triggers = new ConcurrentHashMap<>();
    private final DelayQueue<PendingFire> queue = new DelayQueue<>();

    private volatile ExecutorService workerPool;
    private Thread dispatcherThread;

    private static final class InstalledTrigger {
        private final String key;
        private final ScheduleTrigger trigger;
        private final CronSchedule cron;
        private final Runnable action;

        private InstalledTrigger(String key, ScheduleTrigger trigger, CronSchedule cron, Runnable action) {
            this.key = key;
            this.trigger = trigger;
            this.cron = cron;
            this.action = action;
        }

        private Instant nextAfter(Instant instant) {
            return cron.nextAfter(instant);
        }
    }

    private static final class PendingFire implements Delayed {
        private final InstalledTrigger trigger;
        private final Instant fireAt;
        private final Clock clock;

        private PendingFire(InstalledTrigger trigger, Instant fireAt, Clock clock) {
            this.trigger = trigger;
            this.fireAt = fireAt;
            this.clock = clock;
        }

        @Override
        public long getDelay(TimeUnit unit) {
            long ms = Duration.between(clock.instant(), fireAt).toMillis();
            return unit.convert(ms, TimeUnit.MILLISECONDS);
        }

        @Override
        public int compareTo(Delayed other) {
            if (other == this) return 0;
            if (other instanceof PendingFire o) {
                return this.fireAt.compareTo(o.fireAt);
            }
            return Long.compare(getDelay(TimeUnit.MILLISECONDS), other.getDelay(TimeUnit.MILLISECONDS));
        }
    }

    public SimpleJobScheduler(ExecutionEngine engine, Runnable retentionTask, String retentionCron, ZoneId zone, Clock clock) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.retentionTask = Objects.requireNonNull(retentionTask, "retentionTask must not be null");
        this.retentionCron = Objects.requireNonNull(retentionCron, "retentionCron must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Install the retention trigger and start firing. Idempotent.
     */
    @Override
    public synchronized void start() {
        if (started.get()) {
            return;
        }

        // a bad retention cron fails here and leaves the scheduler stopped
        ScheduleTrigger retention = ScheduleResolver.resolve(retentionCron);
        CronSchedule retentionSchedule = CronSupport.requireFires(retention, zone, clock.instant());
        started.set(true);

        log.info("Checkin scheduler starting with zone={}, retentionCron={}, accounts={}",
                zone, retentionCron, installedAccountIds().size());

        triggers.put(RETENTION_KEY, new InstalledTrigger(RETENTION_KEY, retention, retentionSchedule, retentionTask));

        if (workerPool == null) {
            AtomicInteger counter = new AtomicInteger();
            workerPool = Executors.newCachedThreadPool(r -> {
                Thread t = new Thread(r);
                t.setName("checkin.worker-" + counter.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
        }

        Instant now = clock.instant();
        triggers.values().forEach(it -> enqueueNext(it, now));

        if (dispatcherThread == null) {
            dispatcherThread = new Thread(this::dispatchLoop);
            dispatcherThread.setName("checkin.dispatcher");
            dispatcherThread.setDaemon(true);
            dispatcherThread.start();
        }
        log.info("Checkin scheduler started successfully.");
    }

    /**
     * Stop firing. Installed triggers are kept and resume on the next {@link #start()}. Idempotent.
     */
    @Override
    public synchronized void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        log.info("Checkin scheduler stopping...");

        if (dispatcherThread != null) {
            dispatcherThread.interrupt();
            dispatcherThread = null;
        }

        if (workerPool != null) {
            workerPool.shutdown();
            try {
                if (!workerPool.awaitTermination(SHUTDOWN_GRACE.toSeconds(), TimeUnit.SECONDS)) {
                    workerPool.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                workerPool.shutdownNow();
            } finally {
                workerPool = null;
            }
        }

        queue.clear();
        log.info("Checkin scheduler stopped successfully.");
    }

    @Override
    public synchronized void install(String accountId, String scheduleExpr) {
        Objects.requireNonNull(accountId, "accountId must not be null");

        // resolve and build first: a bad expression must leave the current trigger alone
        ScheduleTrigger trigger = ScheduleResolver.resolve(scheduleExpr);
        Instant now = clock.instant();
        CronSchedule cron = CronSupport.requireFires(trigger, zone, now);

        String key = accountKey(accountId);
        InstalledTrigger installed = new InstalledTrigger(key, trigger, cron, () -> fireAccount(accountId, trigger));
        InstalledTrigger previous = triggers.put(key, installed);
        if (started.get()) {
            enqueueNext(installed, now);
        }

        log.info("Checkin trigger {} account={} cron={} jitterSeconds={}",
                previous == null ? "installed" : "replaced", accountId, trigger.cronExpression(), trigger.jitterSeconds());
    }

    @Override
    public synchronized void remove(String accountId) {
        Objects.requireNonNull(accountId, "accountId must not be null");
        if (triggers.remove(accountKey(accountId)) != null) {
            log.info("Checkin trigger removed account={}", accountId);
        }
    }

    @Override
    public synchronized ReloadResult reloadAll(Collection<AccountSpec> accounts) {
        Objects.requireNonNull(accounts, "accounts must not be null");

        triggers.keySet().removeIf(key -> key.startsWith(ACCOUNT_KEY_PREFIX));

        int installed = 0;
        List<String> failed = new ArrayList<>();
        for (AccountSpec account : accounts) {
            if (!account.enabled() || account.id() == null) {
                continue;
            }
            try {
                install(account.id(), account.scheduleExpr());
                installed++;
            } catch (RuntimeException e) {
                failed.add(account.id());
                log.error("Checkin trigger install failed account={} name={} schedule={} msg={}",
                        account.id(), account.name(), account.scheduleExpr(), e.getMessage());
            }
        }

        log.info("Checkin triggers reloaded installed={} failed={}", installed, failed.size());
        return new ReloadResult(installed, failed);
    }

    @Override
    public boolean isInstalled(String accountId) {
        return triggers.containsKey(accountKey(accountId));
    }

    @Override
    public Set<String> installedAccountIds() {
        Set<String> ids = new TreeSet<>();
        for (String key : triggers.keySet()) {
            if (key.startsWith(ACCOUNT_KEY_PREFIX)) {
                ids.add(key.substring(ACCOUNT_KEY_PREFIX.length()));
            }
        }
        return ids;
    }

    @Override
    public Optional<ScheduleTrigger> triggerFor(String accountId) {
        return Optional.ofNullable(triggers.get(accountKey(accountId))).map(it -> it.trigger);
    }

    @Override
    public Optional<Instant> nextFireTime(String accountId) {
        return Optional.ofNullable(triggers.get(accountKey(accountId)))
                .map(it -> it.nextAfter(clock.instant()));
    }

    public boolean isRetentionInstalled() {
        return triggers.containsKey(RETENTION_KEY);
    }

    public boolean isStarted() {
        return started.get();
    }

    /**
     * Blocking random-window delay (overridable for tests).
     */
    protected void sleep(Duration duration) throws InterruptedException {
        Thread.sleep(duration.toMillis());
    }

    void fireAccount(String accountId, ScheduleTrigger trigger) {
        if (trigger.hasJitter()) {
            long delaySeconds = ThreadLocalRandom.current().nextLong(trigger.jitterSeconds() + 1L);
            log.info("Checkin delayed by random window account={} delaySeconds={}", accountId, delaySeconds);
            try {
                sleep(Duration.ofSeconds(delaySeconds));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Checkin random delay interrupted account={}", accountId);
                return;
            }
        }

        ExecutionOutcome outcome = engine.run(accountId, false);
        log.debug("Checkin fire finished account={} status={} attempts={}",
                accountId, outcome.status(), outcome.attempts());
    }

    private void enqueueNext(InstalledTrigger it, Instant after) {
        Instant next = it.nextAfter(after);
        if (next != null) {
            queue.offer(new PendingFire(it, next, clock));
        } else {
            log.warn("Checkin trigger has no next fire time key={} cron={}", it.key, it.trigger.cronExpression());
        }
    }

    private void dispatchLoop() {
        while (started.get()) {
            try {
                PendingFire fire = queue.take();
                InstalledTrigger it = fire.trigger;

                // replaced or removed since this fire was queued
                if (triggers.get(it.key) != it) {
                    continue;
                }

                // missed fires are not replayed
                Instant now = clock.instant();
                enqueueNext(it, now.isAfter(fire.fireAt) ? now : fire.fireAt);
                submitToWorker(it);

            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.error("checkin dispatcher failed msg={}", e.getMessage(), e);
            }
        }
    }

    private void submitToWorker(InstalledTrigger it) {
        ExecutorService pool = workerPool;
        if (pool == null) {
            return;
        }
        pool.submit(() -> {
            try {
                log.debug("Checkin trigger fired key={}", it.key);
                it.action.run();
            } catch (Exception e) {
                log.error("checkin scheduled run failed key={} msg={}", it.key, e.getMessage(), e);
            }
        });
    }

    private static String accountKey(String accountId) {
        return ACCOUNT_KEY_PREFIX + accountId;
    }
}
