package io.checkin4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.checkin4j.ExecutionEngine;
import io.checkin4j.JobScheduler;
import io.checkin4j.internal.AccountManager;
import io.checkin4j.internal.DefaultExecutionEngine;
import io.checkin4j.internal.RetentionJob;
import io.checkin4j.internal.SimpleJobScheduler;
import io.checkin4j.internal.mongo.MongoAccountStore;
import io.checkin4j.internal.mongo.MongoCheckinLogStore;
import io.checkin4j.internal.mongo.MongoConfigStore;
import io.checkin4j.notify.NotificationDispatcher;
import io.checkin4j.store.AccountStore;
import io.checkin4j.store.CheckinLogStore;
import io.checkin4j.store.ConfigStore;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.time.Duration;

/**
 * Spring Boot auto-configuration entrypoint for checkin4j components.
 */
@AutoConfiguration(afterName = {
        "org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration",
        "org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration"
})
@ConditionalOnClass({JobScheduler.class, MongoTemplate.class, RestClient.class})
@EnableConfigurationProperties(CheckinProperties.class)
@ConditionalOnProperty(prefix = "checkin", name = "enabled", havingValue = "true", matchIfMissing = true)
public class CheckinConfig {

    @Bean
    @ConditionalOnMissingBean
    public AccountStore accountStore(MongoTemplate mongoTemplate) {
        return new MongoAccountStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public CheckinLogStore checkinLogStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        return new MongoCheckinLogStore(mongoTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public ConfigStore configStore(MongoTemplate mongoTemplate) {
        return new MongoConfigStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    protected CheckinMongoIndexConfig checkinMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new CheckinMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public NotificationDispatcher notificationDispatcher(CheckinProperties props, ConfigStore configStore,
                                                         ObjectMapper objectMapper) {
        RestClient restClient = restClient(props.getNotificationTimeout());
        return new NotificationDispatcher(
                NotificationDispatcher.defaultChannels(restClient, Clock.system(props.zoneId())),
                configStore,
                objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public ExecutionEngine executionEngine(CheckinProperties props, AccountStore accountStore,
                                           CheckinLogStore logStore, NotificationDispatcher dispatcher) {
        return new DefaultExecutionEngine(accountStore, logStore, dispatcher,
                restClient(props.getRequestTimeout()), Clock.system(props.zoneId()));
    }

    @Bean
    @ConditionalOnMissingBean
    public RetentionJob retentionJob(ConfigStore configStore, CheckinLogStore logStore) {
        return new RetentionJob(configStore, logStore);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobScheduler jobScheduler(CheckinProperties props, ExecutionEngine engine, RetentionJob retentionJob) {
        return new SimpleJobScheduler(engine, retentionJob, props.getRetentionCron(), props.zoneId(),
                Clock.system(props.zoneId()));
    }

    @Bean
    @ConditionalOnMissingBean
    public AccountManager accountManager(CheckinProperties props, AccountStore accountStore, CheckinLogStore logStore,
                                         JobScheduler scheduler, ExecutionEngine engine) {
        return new AccountManager(accountStore, logStore, scheduler, engine, props.zoneId());
    }

    @Bean
    @ConditionalOnMissingBean
    public CheckinLifecycle checkinLifecycle(JobScheduler scheduler, AccountManager accountManager) {
        return new CheckinLifecycle(scheduler, accountManager);
    }

    @Bean
    @ConditionalOnProperty(prefix = "checkin", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton checkinIndexesInitializer(CheckinMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }

    private static RestClient restClient(Duration timeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeout);
        factory.setReadTimeout(timeout);
        return RestClient.builder().requestFactory(factory).build();
    }
}
