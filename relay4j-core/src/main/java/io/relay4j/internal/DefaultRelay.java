package io.relay4j.internal;

import io.relay4j.BrokerGateway;
import io.relay4j.JobFactory;
import io.relay4j.JobStore;
import io.relay4j.Relay;
import io.relay4j.TriggerRule;
import io.relay4j.core.Job;
import io.relay4j.core.JobDefaults;
import io.relay4j.core.JobRequest;
import io.relay4j.core.PeriodicDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

public class DefaultRelay implements Relay {
    private static final Logger log = LoggerFactory.getLogger(DefaultRelay.class);

    private final SchedulerCore scheduler;
    private final JobExecutor executor;
    private final BrokerGateway broker;
    private final JobStore jobStore;
    private final ResultConsumer resultConsumer;
    private final JobDefaults defaults;

    private final AtomicBoolean started = new AtomicBoolean(false);

    public DefaultRelay(SchedulerCore scheduler,
                        JobExecutor executor,
                        BrokerGateway broker,
                        JobStore jobStore,
                        ResultConsumer resultConsumer,
                        JobDefaults defaults) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.broker = Objects.requireNonNull(broker, "broker must not be null");
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.resultConsumer = Objects.requireNonNull(resultConsumer, "resultConsumer must not be null");
        this.defaults = Objects.requireNonNull(defaults, "defaults must not be null");
    }

    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        log.info("relay starting defaults={}", defaults);
        broker.consume(resultConsumer);
        scheduler.start();
    }

    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        log.info("relay stopping...");
        scheduler.stop();
        broker.stop();
        log.info("relay stopped");
    }

    @Override
    public Job dispatch(String jobType, Map<String, Object> payload) {
        return dispatch(defaults.request(jobType, payload));
    }

    @Override
    public Job dispatch(JobRequest request) {
        return executor.dispatch(request);
    }

    @Override
    public Job schedule(JobRequest request, Instant at) {
        Objects.requireNonNull(at, "at must not be null");
        return executor.schedule(request, at);
    }

    @Override
    public void every(PeriodicDefinition definition) {
        scheduler.register(definition);
    }

    @Override
    public void every(String name, TriggerRule trigger, JobFactory factory) {
        every(new PeriodicDefinition(name, trigger, factory));
    }

    @Override
    public boolean cancel(String name) {
        return scheduler.unregister(name);
    }

    @Override
    public boolean isLive() {
        return broker.isConnected() && jobStore.isReachable();
    }

    public boolean isStarted() {
        return started.get();
    }
}
