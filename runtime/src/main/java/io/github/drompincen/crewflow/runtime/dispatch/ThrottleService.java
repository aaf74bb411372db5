package io.github.drompincen.crewflow.runtime.dispatch;

import io.github.drompincen.crewflow.persistence.document.ThrottleDocument;
import io.github.drompincen.crewflow.persistence.repository.ThrottleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Fixed-window start limiter keyed by {@code functionId:key}.
 */
@Service
public class ThrottleService {

    private static final Logger log = LoggerFactory.getLogger(ThrottleService.class);

    private final ThrottleRepository throttleRepository;

    public ThrottleService(ThrottleRepository throttleRepository) {
        this.throttleRepository = throttleRepository;
    }

    public ThrottleDecision tryAcquire(String functionId, String key, Throttle throttle, Instant now) {
        String id = ThrottleDocument.idFor(functionId, key);
        ThrottleDocument window = throttleRepository.findById(id).orElseGet(() -> {
            ThrottleDocument doc = new ThrottleDocument();
            doc.setThrottleId(id);
            doc.setFunctionId(functionId);
            doc.setThrottleKey(key);
            return doc;
        });

        if (window.getWindowStartedAt() == null
                || !now.isBefore(window.getWindowStartedAt().plus(throttle.period()))) {
            window.setWindowStartedAt(now);
            window.setStartsInWindow(0);
        }

        if (window.getStartsInWindow() >= throttle.limit()) {
            return ThrottleDecision.deny(window.getWindowStartedAt().plus(throttle.period()));
        }

        window.setStartsInWindow(window.getStartsInWindow() + 1);
        try {
            throttleRepository.save(window);
            return ThrottleDecision.admit();
        } catch (OptimisticLockingFailureException | DuplicateKeyException e) {
            log.debug("Concurrent start for throttle {}, deferring", id);
            return ThrottleDecision.deny(now.plusSeconds(1));
        }
    }

    public record ThrottleDecision(boolean admitted, Instant retryAt) {

        static ThrottleDecision admit() {
            return new ThrottleDecision(true, null);
        }

        static ThrottleDecision deny(Instant retryAt) {
            return new ThrottleDecision(false, retryAt);
        }
    }
}
