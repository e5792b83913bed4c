package io.relay4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.relay4j.BrokerGateway;
import io.relay4j.ExpiredJobListener;
import io.relay4j.JobStore;
import io.relay4j.Relay;
import io.relay4j.core.JobDefaults;
import io.relay4j.core.PeriodicDefinition;
import io.relay4j.internal.DefaultRelay;
import io.relay4j.internal.JobExecutor;
import io.relay4j.internal.PeriodicChecker;
import io.relay4j.internal.ResultConsumer;
import io.relay4j.internal.SchedulerCore;
import io.relay4j.internal.amqp.BrokerSettings;
import io.relay4j.internal.amqp.RabbitBrokerGateway;
import io.relay4j.internal.amqp.RelayMessageCodec;
import io.relay4j.internal.mongo.MongoJobStore;
import io.relay4j.utils.Triggers;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitAdmin;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;

/**
 * Spring Boot auto-configuration entrypoint for Relay components.
 */
@AutoConfiguration(afterName = {
        "org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration",
        "org.springframework.boot.autoconfigure.amqp.RabbitAutoConfiguration"
})
@ConditionalOnClass({Relay.class, MongoTemplate.class, RabbitTemplate.class})
@EnableConfigurationProperties(RelayProperties.class)
@ConditionalOnProperty(prefix = "relay", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RelayConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock relayClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public JobStore relayJobStore(MongoTemplate mongoTemplate, Clock clock, RelayProperties props) {
        return new MongoJobStore(mongoTemplate, clock, props.getPublishLease());
    }

    @Bean
    @ConditionalOnMissingBean
    protected RelayMongoIndexConfig relayMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new RelayMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public RelayMessageCodec relayMessageCodec(ObjectProvider<ObjectMapper> objectMapper) {
        return new RelayMessageCodec(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public BrokerGateway relayBrokerGateway(ConnectionFactory connectionFactory,
                                            RabbitTemplate rabbitTemplate,
                                            ObjectProvider<AmqpAdmin> amqpAdmin,
                                            RelayMessageCodec codec,
                                            RelayProperties props) {
        AmqpAdmin admin = amqpAdmin.getIfAvailable(() -> new RabbitAdmin(connectionFactory));
        return new RabbitBrokerGateway(connectionFactory, rabbitTemplate, admin, codec, brokerSettings(props.getBroker()));
    }

    @Bean
    @ConditionalOnMissingBean
    public ExpiredJobListener expiredJobListener() {
        return ExpiredJobListener.logging();
    }

    @Bean
    @ConditionalOnMissingBean
    public JobExecutor relayJobExecutor(JobStore jobStore, BrokerGateway broker, Clock clock) {
        return new JobExecutor(jobStore, broker, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public ResultConsumer relayResultConsumer(JobStore jobStore, Clock clock, RelayProperties props) {
        return new ResultConsumer(jobStore, clock, props.getFailureRetryDelay());
    }

    @Bean
    @ConditionalOnMissingBean
    public PeriodicChecker relayPeriodicChecker(JobStore jobStore,
                                                JobExecutor executor,
                                                ExpiredJobListener expiredListener,
                                                Clock clock,
                                                RelayProperties props) {
        return new PeriodicChecker(jobStore, executor, expiredListener, clock, props.getSweepBatchSize());
    }

    @Bean
    @ConditionalOnMissingBean
    public SchedulerCore relaySchedulerCore(JobExecutor executor,
                                            PeriodicChecker checker,
                                            Clock clock,
                                            RelayProperties props) {
        return new SchedulerCore(executor, checker, clock, props.getTickInterval(), props.getCheckInterval());
    }

    @Bean
    @ConditionalOnMissingBean
    public Relay relay(SchedulerCore scheduler,
                       JobExecutor executor,
                       BrokerGateway broker,
                       JobStore jobStore,
                       ResultConsumer resultConsumer,
                       RelayProperties props,
                       ObjectProvider<PeriodicDefinition> definitions) {
        JobDefaults defaults = new JobDefaults(props.getDefaultMaxAttempts(), props.getDefaultTimeout());
        Relay relay = new DefaultRelay(scheduler, executor, broker, jobStore, resultConsumer, defaults);

        definitions.orderedStream().forEach(relay::every);
        for (RelayProperties.Periodic periodic : props.getPeriodic()) {
            relay.every(periodicDefinition(periodic, defaults));
        }
        return relay;
    }

    @Bean
    @ConditionalOnMissingBean
    public RelayLifecycle relayLifecycle(Relay relay, RelayProperties props) {
        return new RelayLifecycle(relay, props.isAutoStartup());
    }

    @Bean
    @ConditionalOnProperty(prefix = "relay", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton relayIndexesInitializer(RelayMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }

    static BrokerSettings brokerSettings(RelayProperties.Broker broker) {
        return new BrokerSettings(
                broker.getExchange(),
                broker.getResultQueue(),
                broker.getResultRoutingKeys(),
                broker.getDispatchRoutingPrefix(),
                broker.getPrefetch(),
                broker.getRecoveryInitialInterval(),
                broker.getRecoveryMaxInterval(),
                broker.getConfirmTimeout()
        );
    }

    static PeriodicDefinition periodicDefinition(RelayProperties.Periodic periodic, JobDefaults defaults) {
        if (periodic.getJobType() == null || periodic.getJobType().isBlank()) {
            throw new IllegalArgumentException("relay.periodic[" + periodic.getName() + "].job-type must be set");
        }
        return new PeriodicDefinition(
                periodic.getName(),
                Triggers.parse(periodic.getTrigger(), periodic.getTimezone()),
                fireTime -> defaults.request(
                        periodic.getJobType(),
                        periodic.getPayload(),
                        periodic.getMaxAttempts(),
                        periodic.getTimeout()
                )
        );
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(name = "org.springframework.boot.actuate.health.HealthIndicator")
    static class RelayHealthConfig {

        @Bean
        @ConditionalOnMissingBean(name = "relayHealthIndicator")
        public RelayHealthIndicator relayHealthIndicator(BrokerGateway broker, JobStore jobStore) {
            return new RelayHealthIndicator(broker, jobStore);
        }
    }
}
