package io.github.drompincen.crewflow.runtime.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "crewflow.agents")
public class AgentCycleProperties {

    /** Messages older than this are no longer delivered and are removed by cleanup. */
    private Duration messageTtl = Duration.ofHours(48);

    /** An agent is due for a scheduled think once its last run is older than this. */
    private Duration heartbeatInterval = Duration.ofMinutes(10);

    private int heartbeatBatchSize = 50;

    private String heartbeatCron = "0 */10 * * * *";

    private Duration thinkThrottle = Duration.ofSeconds(30);

    private Duration planningThrottle = Duration.ofMinutes(2);

    /** Longest chain of message-driven wake-ups started by one trigger. */
    private int maxFanOutHops = 8;

    private int pendingMessageLimit = 20;

    private int recentDecisionLimit = 10;

    public Duration getMessageTtl() { return messageTtl; }
    public void setMessageTtl(Duration messageTtl) { this.messageTtl = messageTtl; }

    public Duration getHeartbeatInterval() { return heartbeatInterval; }
    public void setHeartbeatInterval(Duration heartbeatInterval) { this.heartbeatInterval = heartbeatInterval; }

    public int getHeartbeatBatchSize() { return heartbeatBatchSize; }
    public void setHeartbeatBatchSize(int heartbeatBatchSize) { this.heartbeatBatchSize = heartbeatBatchSize; }

    public String getHeartbeatCron() { return heartbeatCron; }
    public void setHeartbeatCron(String heartbeatCron) { this.heartbeatCron = heartbeatCron; }

    public Duration getThinkThrottle() { return thinkThrottle; }
    public void setThinkThrottle(Duration thinkThrottle) { this.thinkThrottle = thinkThrottle; }

    public Duration getPlanningThrottle() { return planningThrottle; }
    public void setPlanningThrottle(Duration planningThrottle) { this.planningThrottle = planningThrottle; }

    public int getMaxFanOutHops() { return maxFanOutHops; }
    public void setMaxFanOutHops(int maxFanOutHops) { this.maxFanOutHops = maxFanOutHops; }

    public int getPendingMessageLimit() { return pendingMessageLimit; }
    public void setPendingMessageLimit(int pendingMessageLimit) { this.pendingMessageLimit = pendingMessageLimit; }

    public int getRecentDecisionLimit() { return recentDecisionLimit; }
    public void setRecentDecisionLimit(int recentDecisionLimit) { this.recentDecisionLimit = recentDecisionLimit; }
}
