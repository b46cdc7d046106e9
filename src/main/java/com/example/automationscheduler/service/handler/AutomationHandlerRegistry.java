package com.example.automationscheduler.service.handler;

import com.example.automationscheduler.domain.enums.AutomationType;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registry for automation handlers.
 * <p>
 * Discovers all AutomationHandler beans and provides lookup by automation type.
 */
@Slf4j
@Component
public class AutomationHandlerRegistry {

    private final Map<AutomationType, AutomationHandler> handlers = new EnumMap<>(AutomationType.class);
    private final List<AutomationHandler> handlerBeans;

    public AutomationHandlerRegistry(List<AutomationHandler> handlerBeans) {
        this.handlerBeans = handlerBeans;
    }

    @PostConstruct
    public void initialize() {
        for (var handler : handlerBeans) {
            var type = handler.getAutomationType();
            if (handlers.containsKey(type)) {
                log.warn("Duplicate handler for automation type {}: {} will override {}",
                        type, handler.getClass().getSimpleName(),
                        handlers.get(type).getClass().getSimpleName());
            }
            handlers.put(type, handler);
            log.info("Registered handler for automation type {}: {}", type, handler.getClass().getSimpleName());
        }

        for (var type : AutomationType.values()) {
            if (!handlers.containsKey(type)) {
                log.warn("No handler registered for automation type {}, its jobs will be skipped", type);
            }
        }
    }

    public Optional<AutomationHandler> getHandler(AutomationType type) {
        if (type == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(handlers.get(type));
    }

    public boolean hasHandler(AutomationType type) {
        return type != null && handlers.containsKey(type);
    }

    public Set<AutomationType> getRegisteredTypes() {
        return handlers.keySet();
    }
}
