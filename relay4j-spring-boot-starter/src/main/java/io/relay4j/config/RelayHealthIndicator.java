package io.relay4j.config;

import io.relay4j.BrokerGateway;
import io.relay4j.JobStore;
import org.springframework.boot.actuate.health.AbstractHealthIndicator;
import org.springframework.boot.actuate.health.Health;

/**
 * Liveness of the dispatch engine: UP only when the broker is connected and the store answers.
 */
public class RelayHealthIndicator extends AbstractHealthIndicator {

    private final BrokerGateway broker;
    private final JobStore jobStore;

    public RelayHealthIndicator(BrokerGateway broker, JobStore jobStore) {
        super("relay health check failed");
        this.broker = broker;
        this.jobStore = jobStore;
    }

    @Override
    protected void doHealthCheck(Health.Builder builder) {
        boolean brokerUp = broker.isConnected();
        boolean storeUp = jobStore.isReachable();

        if (brokerUp && storeUp) {
            builder.up();
        } else {
            builder.down();
        }
        builder.withDetail("broker", brokerUp ? "connected" : "disconnected")
                .withDetail("store", storeUp ? "reachable" : "unreachable");
    }
}
