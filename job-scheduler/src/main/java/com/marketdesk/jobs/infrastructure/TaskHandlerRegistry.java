package com.marketdesk.jobs.infrastructure;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Maps task function names to the handlers able to run them in this process.
 */
@Component
@Slf4j
public class TaskHandlerRegistry {

    private final Map<String, TaskHandler> handlersByName;

    public TaskHandlerRegistry(List<TaskHandler> handlers) {
        this.handlersByName = handlers.stream()
                .collect(Collectors.toUnmodifiableMap(
                        TaskHandler::name,
                        Function.identity(),
                        (a, b) -> {
                            throw new IllegalStateException("Duplicate TaskHandler name: " + a.name());
                        }));
        log.info("Registered task handlers: {}", handlersByName.keySet());
    }

    public Optional<TaskHandler> find(String name) {
        return Optional.ofNullable(handlersByName.get(name));
    }

    public TaskHandler getRequired(String name) {
        return find(name).orElseThrow(
                () -> new IllegalStateException("No TaskHandler registered for name: " + name));
    }

    public Set<String> names() {
        return handlersByName.keySet();
    }
}
