package io.relay4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.relay4j.BrokerGateway;
import io.relay4j.JobStore;
import io.relay4j.Relay;
import io.relay4j.core.JobDefaults;
import io.relay4j.core.PeriodicDefinition;
import io.relay4j.internal.SchedulerCore;
import io.relay4j.internal.memory.InMemoryJobStore;
import io.relay4j.internal.mongo.MongoJobStore;
import io.relay4j.utils.Triggers;
import org.junit.jupiter.api.Test;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class RelayAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(RelayConfig.class))
            .withBean(MongoTemplate.class, () -> mock(MongoTemplate.class))
            .withBean(ConnectionFactory.class, () -> mock(ConnectionFactory.class))
            .withBean(RabbitTemplate.class, () -> mock(RabbitTemplate.class))
            .withBean(ObjectMapper.class, ObjectMapper::new)
            .withPropertyValues(
                    "relay.auto-startup=false",
                    "relay.check-interval=2s",
                    "relay.default-max-attempts=4"
            );

    @Test
    void shouldAutoConfigureRelayBeans() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(Relay.class);
            assertThat(context).hasSingleBean(RelayLifecycle.class);
            assertThat(context).hasSingleBean(RelayProperties.class);
            assertThat(context).hasSingleBean(SchedulerCore.class);
            assertThat(context).hasSingleBean(BrokerGateway.class);
            assertThat(context).hasSingleBean(RelayMongoIndexConfig.class);
            assertThat(context.getBean(JobStore.class)).isInstanceOf(MongoJobStore.class);
            assertThat(context.getBean(RelayLifecycle.class).isAutoStartup()).isFalse();
            assertThat(context.getBean(RelayProperties.class).getCheckInterval()).isEqualTo(Duration.ofSeconds(2));
        });
    }

    @Test
    void disabledPropertyTurnsEverythingOff() {
        contextRunner.withPropertyValues("relay.enabled=false").run(context -> {
            assertThat(context).doesNotHaveBean(Relay.class);
            assertThat(context).doesNotHaveBean(RelayLifecycle.class);
        });
    }

    @Test
    void periodicJobsFromPropertiesAreRegistered() {
        contextRunner.withPropertyValues(
                "relay.periodic[0].name=nightly-report",
                "relay.periodic[0].trigger=0 2 * * *",
                "relay.periodic[0].timezone=Europe/Berlin",
                "relay.periodic[0].job-type=report",
                "relay.periodic[0].payload.region=eu",
                "relay.periodic[1].name=cleanup",
                "relay.periodic[1].trigger=5 minutes",
                "relay.periodic[1].job-type=cleanup"
        ).run(context -> {
            Map<String, ?> next = context.getBean(SchedulerCore.class).nextFireTimes();
            assertThat(next).containsOnlyKeys("nightly-report", "cleanup");

            RelayProperties.Periodic report = context.getBean(RelayProperties.class).getPeriodic().get(0);
            assertThat(report.getPayload()).containsEntry("region", "eu");
        });
    }

    @Test
    void periodicDefinitionBeansAreRegistered() {
        contextRunner
                .withBean("heartbeat", PeriodicDefinition.class, () -> new PeriodicDefinition(
                        "heartbeat",
                        Triggers.parse("30 seconds"),
                        fireTime -> JobDefaults.defaults().request("heartbeat", Map.of())
                ))
                .run(context -> assertThat(context.getBean(SchedulerCore.class).nextFireTimes())
                        .containsOnlyKeys("heartbeat"));
    }

    @Test
    void periodicEntryWithoutJobTypeFailsStartup() {
        contextRunner.withPropertyValues(
                "relay.periodic[0].name=broken",
                "relay.periodic[0].trigger=1 minute"
        ).run(context -> assertThat(context).hasFailed());
    }

    @Test
    void customJobStoreBacksOffMongoStore() {
        contextRunner
                .withBean(JobStore.class, () -> new InMemoryJobStore(Clock.systemUTC(), Duration.ofSeconds(30)))
                .run(context -> {
                    assertThat(context).hasSingleBean(JobStore.class);
                    assertThat(context.getBean(JobStore.class)).isInstanceOf(InMemoryJobStore.class);
                });
    }

    @Test
    void healthIsDownWhileBrokerIsDisconnected() {
        contextRunner.run(context -> {
            RelayHealthIndicator health = context.getBean(RelayHealthIndicator.class);
            assertThat(health.health().getStatus()).isEqualTo(Status.DOWN);
            assertThat(health.health().getDetails()).containsEntry("broker", "disconnected");
        });
    }

    @Test
    void indexInitializerOnlyWhenRequested() {
        contextRunner.run(context -> assertThat(context).doesNotHaveBean("relayIndexesInitializer"));
    }
}
