package net.tenure.core.spi;

import net.tenure.core.event.ElectionEvent;

import java.util.List;

/**
 * Push contract for engine events. Fire-and-forget: no acknowledgement, no retry, no queuing.
 * Called on the engine loop thread in causal order per node.
 */
@FunctionalInterface
public interface EventSink {
    void emit(ElectionEvent event);

    /** Fans out to every sink; one failing sink does not starve the others. */
    static EventSink composite(EventSink... sinks) {
        List<EventSink> all = List.of(sinks);
        return event -> {
            RuntimeException first = null;
            for (EventSink s : all) {
                try {
                    s.emit(event);
                } catch (RuntimeException e) {
                    if (first == null) first = e; else first.addSuppressed(e);
                }
            }
            if (first != null) throw first;
        };
    }
}
