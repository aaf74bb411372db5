package io.github.drompincen.crewflow.runtime.dispatch;

import io.github.drompincen.crewflow.runtime.config.DispatcherProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

/**
 * Schedules every cron-configured function on the task scheduler once the application is ready.
 */
@Component
public class CronTriggerRegistrar {

    private static final Logger log = LoggerFactory.getLogger(CronTriggerRegistrar.class);

    private final FunctionRegistry functionRegistry;
    private final EventDispatcher dispatcher;
    private final TaskScheduler taskScheduler;
    private final DispatcherProperties properties;
    private final List<ScheduledFuture<?>> scheduled = new ArrayList<>();

    public CronTriggerRegistrar(FunctionRegistry functionRegistry,
                                EventDispatcher dispatcher,
                                TaskScheduler taskScheduler,
                                DispatcherProperties properties) {
        this.functionRegistry = functionRegistry;
        this.dispatcher = dispatcher;
        this.taskScheduler = taskScheduler;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void registerCronTriggers() {
        if (!properties.isCronEnabled()) {
            log.info("Cron triggers disabled");
            return;
        }
        for (EngineFunction<?> function : functionRegistry.all()) {
            FunctionConfig config = function.config();
            if (!config.isCron()) continue;
            CronTrigger trigger = new CronTrigger(config.cron(), ZoneOffset.UTC);
            scheduled.add(taskScheduler.schedule(() -> fire(config.id()), trigger));
            log.info("Registered cron {} for {}", config.cron(), config.id());
        }
    }

    int registeredCount() {
        return scheduled.size();
    }

    private void fire(String functionId) {
        try {
            dispatcher.invoke(functionId);
        } catch (RuntimeException e) {
            log.error("Cron trigger for {} failed: {}", functionId, e.getMessage(), e);
        }
    }

    @PreDestroy
    public void cancelAll() {
        scheduled.forEach(f -> f.cancel(false));
        scheduled.clear();
    }
}
