package com.phillippitts.scriberelay.testutil;

import org.springframework.context.ApplicationEventPublisher;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Collects published application events for assertions.
 */
public final class EventCapturingPublisher implements ApplicationEventPublisher {

    private final List<Object> events = new CopyOnWriteArrayList<>();

    @Override
    public void publishEvent(Object event) {
        events.add(event);
    }

    public List<Object> events() {
        return events;
    }

    public <T> List<T> eventsOfType(Class<T> type) {
        return events.stream().filter(type::isInstance).map(type::cast).toList();
    }
}
