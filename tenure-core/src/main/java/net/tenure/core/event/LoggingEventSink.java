package net.tenure.core.event;

import net.tenure.core.spi.EventSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Writes events to the log; lease refreshes go to DEBUG so a steady leader does not flood INFO. */
public final class LoggingEventSink implements EventSink {
    private static final Logger log = LoggerFactory.getLogger(LoggingEventSink.class);

    @Override
    public void emit(ElectionEvent event) {
        if (event instanceof ElectionEvent.NodeUpdate u) {
            log.debug("[{}] {} -> {} (lease={})", u.type(), u.nodeId(), u.status().code(), u.lease());
        } else {
            log.info("[{}] {}", event.type(), event);
        }
    }
}
