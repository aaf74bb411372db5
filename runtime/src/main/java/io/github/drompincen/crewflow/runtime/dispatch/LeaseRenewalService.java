package io.github.drompincen.crewflow.runtime.dispatch;

import io.github.drompincen.crewflow.persistence.repository.RunRepository;
import io.github.drompincen.crewflow.runtime.config.DispatcherProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

@Service
public class LeaseRenewalService {

    private static final Logger log = LoggerFactory.getLogger(LeaseRenewalService.class);

    private final RunRepository runRepository;
    private final DispatcherProperties properties;
    private final Clock clock;
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "run-lease-renewal");
        t.setDaemon(true);
        return t;
    });
    private final Map<String, ScheduledFuture<?>> active = new ConcurrentHashMap<>();

    public LeaseRenewalService(RunRepository runRepository, DispatcherProperties properties, Clock clock) {
        this.runRepository = runRepository;
        this.properties = properties;
        this.clock = clock;
    }

    public void start(String runId, String owner) {
        long intervalMs = properties.getLeaseRenewInterval().toMillis();
        ScheduledFuture<?> future = scheduler.scheduleAtFixedRate(() -> renew(runId, owner),
                intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        ScheduledFuture<?> previous = active.put(runId, future);
        if (previous != null) previous.cancel(false);
        log.debug("Started lease renewal for run {}", runId);
    }

    public void stop(String runId) {
        ScheduledFuture<?> future = active.remove(runId);
        if (future != null) {
            future.cancel(false);
            log.debug("Stopped lease renewal for run {}", runId);
        }
    }

    boolean renew(String runId, String owner) {
        try {
            boolean extended = runRepository.extendLease(runId, owner,
                    clock.instant().plus(properties.getLeaseDuration()));
            if (!extended) {
                log.warn("Lease for run {} is no longer held by {}", runId, owner);
                stop(runId);
            }
            return extended;
        } catch (RuntimeException e) {
            log.warn("Lease renewal failed for run {}: {}", runId, e.getMessage());
            return false;
        }
    }

    @PreDestroy
    public void shutdown() {
        active.values().forEach(f -> f.cancel(false));
        active.clear();
        scheduler.shutdown();
    }
}
