package com.streamfirst.pathtable.adapters;

import com.streamfirst.pathtable.domain.DataEvent;
import com.streamfirst.pathtable.ports.EventSinkPort;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of EventSinkPort for testing and development.
 * Keeps every published event in publication order.
 */
@Slf4j
public class InMemoryEventSinkAdapter implements EventSinkPort {

    private final List<DataEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void publish(DataEvent event) {
        log.trace("Recorded event {} for {}", event.getType(), event.getPath());
        events.add(event);
    }

    public List<DataEvent> events() {
        return List.copyOf(events);
    }

    public List<DataEvent> events(DataEvent.Type type) {
        return events.stream().filter(event -> event.getType() == type).toList();
    }

    public long count(DataEvent.Type type, String path) {
        return events.stream()
            .filter(event -> event.getType() == type && event.getPath().equals(path))
            .count();
    }

    /**
     * Clears all recorded events. Useful for testing.
     */
    public void clear() {
        events.clear();
    }
}
