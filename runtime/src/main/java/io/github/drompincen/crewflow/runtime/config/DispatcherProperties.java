package io.github.drompincen.crewflow.runtime.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "crewflow.dispatcher")
public class DispatcherProperties {

    /** Delay between queue polls; read by the poller's {@code @Scheduled} placeholder. */
    private long pollIntervalMs = 1000;

    private int batchSize = 50;

    private Duration leaseDuration = Duration.ofSeconds(90);

    private Duration leaseRenewInterval = Duration.ofSeconds(30);

    /** Extra time past lease expiry before a RUNNING run is considered abandoned. */
    private Duration staleLeaseGrace = Duration.ofSeconds(30);

    private Duration retryBackoff = Duration.ofSeconds(5);

    private Duration maxRetryBackoff = Duration.ofMinutes(5);

    /** Register cron-triggered functions at start-up. */
    private boolean cronEnabled = true;

    public long getPollIntervalMs() { return pollIntervalMs; }
    public void setPollIntervalMs(long pollIntervalMs) { this.pollIntervalMs = pollIntervalMs; }

    public int getBatchSize() { return batchSize; }
    public void setBatchSize(int batchSize) { this.batchSize = batchSize; }

    public Duration getLeaseDuration() { return leaseDuration; }
    public void setLeaseDuration(Duration leaseDuration) { this.leaseDuration = leaseDuration; }

    public Duration getLeaseRenewInterval() { return leaseRenewInterval; }
    public void setLeaseRenewInterval(Duration leaseRenewInterval) { this.leaseRenewInterval = leaseRenewInterval; }

    public Duration getStaleLeaseGrace() { return staleLeaseGrace; }
    public void setStaleLeaseGrace(Duration staleLeaseGrace) { this.staleLeaseGrace = staleLeaseGrace; }

    public Duration getRetryBackoff() { return retryBackoff; }
    public void setRetryBackoff(Duration retryBackoff) { this.retryBackoff = retryBackoff; }

    public Duration getMaxRetryBackoff() { return maxRetryBackoff; }
    public void setMaxRetryBackoff(Duration maxRetryBackoff) { this.maxRetryBackoff = maxRetryBackoff; }

    public boolean isCronEnabled() { return cronEnabled; }
    public void setCronEnabled(boolean cronEnabled) { this.cronEnabled = cronEnabled; }
}
