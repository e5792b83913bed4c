package io.relay4j.config;

import io.relay4j.Relay;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges Relay start/stop lifecycle with the Spring container lifecycle.
 */
public class RelayLifecycle implements SmartLifecycle {
    private final Relay relay;
    private final boolean autoStartup;
    private volatile boolean running = false;

    public RelayLifecycle(Relay relay, boolean autoStartup) {
        this.relay = relay;
        this.autoStartup = autoStartup;
    }

    @Override
    public void start() {
        relay.start();
        running = true;
    }

    @Override
    public void stop() {
        relay.stop();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return autoStartup;
    }
}
