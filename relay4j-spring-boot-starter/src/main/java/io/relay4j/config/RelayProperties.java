package io.relay4j.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runtime configuration for job dispatch, timeout checking and the broker topology.
 */
@ConfigurationProperties(prefix = "relay")
public class RelayProperties {
    private boolean enabled = true;
    private boolean autoStartup = true;
    private Duration defaultTimeout = Duration.ofMinutes(5);
    private int defaultMaxAttempts = 3;
    private Duration checkInterval = Duration.ofSeconds(10);
    private Duration tickInterval = Duration.ofSeconds(1);
    private Duration publishLease = Duration.ofSeconds(30);
    private int sweepBatchSize = 100;
    private Duration failureRetryDelay = Duration.ofSeconds(30);
    private boolean ensureIndexesOnStartup = false;

    private final Broker broker = new Broker();
    private List<Periodic> periodic = new ArrayList<>();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isAutoStartup() {
        return autoStartup;
    }

    public void setAutoStartup(boolean autoStartup) {
        this.autoStartup = autoStartup;
    }

    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    public void setDefaultTimeout(Duration defaultTimeout) {
        this.defaultTimeout = defaultTimeout;
    }

    public int getDefaultMaxAttempts() {
        return defaultMaxAttempts;
    }

    public void setDefaultMaxAttempts(int defaultMaxAttempts) {
        this.defaultMaxAttempts = defaultMaxAttempts;
    }

    public Duration getCheckInterval() {
        return checkInterval;
    }

    public void setCheckInterval(Duration checkInterval) {
        this.checkInterval = checkInterval;
    }

    public Duration getTickInterval() {
        return tickInterval;
    }

    public void setTickInterval(Duration tickInterval) {
        this.tickInterval = tickInterval;
    }

    public Duration getPublishLease() {
        return publishLease;
    }

    public void setPublishLease(Duration publishLease) {
        this.publishLease = publishLease;
    }

    public int getSweepBatchSize() {
        return sweepBatchSize;
    }

    public void setSweepBatchSize(int sweepBatchSize) {
        this.sweepBatchSize = sweepBatchSize;
    }

    public Duration getFailureRetryDelay() {
        return failureRetryDelay;
    }

    public void setFailureRetryDelay(Duration failureRetryDelay) {
        this.failureRetryDelay = failureRetryDelay;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    public Broker getBroker() {
        return broker;
    }

    public List<Periodic> getPeriodic() {
        return periodic;
    }

    public void setPeriodic(List<Periodic> periodic) {
        this.periodic = periodic;
    }

    public static class Broker {
        private String exchange = "jobs";
        private String resultQueue = "job_scheduler.results";
        private List<String> resultRoutingKeys = new ArrayList<>(List.of("jobs.completed", "jobs.failed", "jobs.result"));
        private String dispatchRoutingPrefix = "jobs.execute.";
        private int prefetch = 10;
        private Duration recoveryInitialInterval = Duration.ofSeconds(1);
        private Duration recoveryMaxInterval = Duration.ofSeconds(60);
        private Duration confirmTimeout = Duration.ofSeconds(5); // zero disables confirms

        public String getExchange() {
            return exchange;
        }

        public void setExchange(String exchange) {
            this.exchange = exchange;
        }

        public String getResultQueue() {
            return resultQueue;
        }

        public void setResultQueue(String resultQueue) {
            this.resultQueue = resultQueue;
        }

        public List<String> getResultRoutingKeys() {
            return resultRoutingKeys;
        }

        public void setResultRoutingKeys(List<String> resultRoutingKeys) {
            this.resultRoutingKeys = resultRoutingKeys;
        }

        public String getDispatchRoutingPrefix() {
            return dispatchRoutingPrefix;
        }

        public void setDispatchRoutingPrefix(String dispatchRoutingPrefix) {
            this.dispatchRoutingPrefix = dispatchRoutingPrefix;
        }

        public int getPrefetch() {
            return prefetch;
        }

        public void setPrefetch(int prefetch) {
            this.prefetch = prefetch;
        }

        public Duration getRecoveryInitialInterval() {
            return recoveryInitialInterval;
        }

        public void setRecoveryInitialInterval(Duration recoveryInitialInterval) {
            this.recoveryInitialInterval = recoveryInitialInterval;
        }

        public Duration getRecoveryMaxInterval() {
            return recoveryMaxInterval;
        }

        public void setRecoveryMaxInterval(Duration recoveryMaxInterval) {
            this.recoveryMaxInterval = recoveryMaxInterval;
        }

        public Duration getConfirmTimeout() {
            return confirmTimeout;
        }

        public void setConfirmTimeout(Duration confirmTimeout) {
            this.confirmTimeout = confirmTimeout;
        }
    }

    /**
     * A periodic definition declared in configuration.
     */
    public static class Periodic {
        private String name;
        private String trigger;
        private String timezone;
        private String jobType;
        private Map<String, Object> payload = new LinkedHashMap<>();
        private Integer maxAttempts;
        private Duration timeout;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getTrigger() {
            return trigger;
        }

        public void setTrigger(String trigger) {
            this.trigger = trigger;
        }

        public String getTimezone() {
            return timezone;
        }

        public void setTimezone(String timezone) {
            this.timezone = timezone;
        }

        public String getJobType() {
            return jobType;
        }

        public void setJobType(String jobType) {
            this.jobType = jobType;
        }

        public Map<String, Object> getPayload() {
            return payload;
        }

        public void setPayload(Map<String, Object> payload) {
            this.payload = payload;
        }

        public Integer getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(Integer maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }
}
