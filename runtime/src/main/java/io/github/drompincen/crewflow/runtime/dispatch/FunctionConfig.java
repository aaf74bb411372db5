package io.github.drompincen.crewflow.runtime.dispatch;

public record FunctionConfig(String id, String name, String eventName, String cron, int retries, Throttle throttle) {

    public static FunctionConfig onEvent(String id, String name, String eventName, int retries, Throttle throttle) {
        return new FunctionConfig(id, name, eventName, null, retries, throttle);
    }

    public static FunctionConfig onCron(String id, String name, String cron, int retries) {
        return new FunctionConfig(id, name, null, cron, retries, null);
    }

    public int maxAttempts() {
        return retries + 1;
    }

    public boolean isCron() {
        return cron != null && !cron.isBlank();
    }
}
