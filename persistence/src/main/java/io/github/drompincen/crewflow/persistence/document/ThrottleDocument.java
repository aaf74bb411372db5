package io.github.drompincen.crewflow.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Fixed rate-limit window for one function and throttle key.
 */
@Document(collection = "engine_throttles")
public class ThrottleDocument {

    @Id
    private String throttleId;
    private String functionId;
    private String throttleKey;
    private Instant windowStartedAt;
    private int startsInWindow;
    @Version
    private Long version;

    public ThrottleDocument() {}

    public static String idFor(String functionId, String throttleKey) {
        return functionId + ":" + throttleKey;
    }

    public String getThrottleId() { return throttleId; }
    public void setThrottleId(String throttleId) { this.throttleId = throttleId; }

    public String getFunctionId() { return functionId; }
    public void setFunctionId(String functionId) { this.functionId = functionId; }

    public String getThrottleKey() { return throttleKey; }
    public void setThrottleKey(String throttleKey) { this.throttleKey = throttleKey; }

    public Instant getWindowStartedAt() { return windowStartedAt; }
    public void setWindowStartedAt(Instant windowStartedAt) { this.windowStartedAt = windowStartedAt; }

    public int getStartsInWindow() { return startsInWindow; }
    public void setStartsInWindow(int startsInWindow) { this.startsInWindow = startsInWindow; }

    public Long getVersion() { return version; }
    public void setVersion(Long version) { this.version = version; }
}
