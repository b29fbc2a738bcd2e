package com.streamfirst.pathtable.ports;

import com.streamfirst.pathtable.domain.DataEvent;

/**
 * Port receiving read and write notifications. Called synchronously on the thread
 * performing the operation, before and after each file is read or written.
 */
public interface EventSinkPort {

    /**
     * Receives one event. Implementations must not throw.
     *
     * @param event the event
     */
    void publish(DataEvent event);

    /**
     * A sink that discards every event.
     */
    static EventSinkPort discarding() {
        return event -> { };
    }
}
