package com.streamfirst.pathtable.adapters;

import com.streamfirst.pathtable.domain.DataEvent;
import com.streamfirst.pathtable.ports.EventSinkPort;
import lombok.extern.slf4j.Slf4j;

/**
 * Event sink that logs every event. Completed writes and deletes are logged at debug,
 * everything else at trace.
 */
@Slf4j
public class Slf4jEventSinkAdapter implements EventSinkPort {

    @Override
    public void publish(DataEvent event) {
        switch (event.getType()) {
            case POST_WRITE, DELETE -> log.debug("{} {} ({} records)",
                event.getType(), event.getPath(), event.getRecordCount());
            default -> log.trace("{} {} ({} records)",
                event.getType(), event.getPath(), event.getRecordCount());
        }
    }
}
