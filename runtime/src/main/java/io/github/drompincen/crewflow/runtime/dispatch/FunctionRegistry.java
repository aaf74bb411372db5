package io.github.drompincen.crewflow.runtime.dispatch;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
public class FunctionRegistry {

    private final Map<String, EngineFunction<?>> byId = new LinkedHashMap<>();
    private final Map<String, List<EngineFunction<?>>> byEvent = new LinkedHashMap<>();

    public FunctionRegistry(List<EngineFunction<?>> functions) {
        for (EngineFunction<?> function : functions) {
            FunctionConfig config = function.config();
            if (byId.putIfAbsent(config.id(), function) != null) {
                throw new IllegalStateException("Duplicate engine function id: " + config.id());
            }
            if (config.eventName() != null) {
                byEvent.computeIfAbsent(config.eventName(), k -> new ArrayList<>()).add(function);
            }
        }
    }

    public Optional<EngineFunction<?>> find(String functionId) {
        return Optional.ofNullable(byId.get(functionId));
    }

    public EngineFunction<?> require(String functionId) {
        return find(functionId).orElseThrow(() -> new EngineException("Unknown engine function: " + functionId));
    }

    public List<EngineFunction<?>> forEvent(String eventName) {
        return byEvent.getOrDefault(eventName, Collections.emptyList());
    }

    public Collection<EngineFunction<?>> all() {
        return Collections.unmodifiableCollection(byId.values());
    }
}
