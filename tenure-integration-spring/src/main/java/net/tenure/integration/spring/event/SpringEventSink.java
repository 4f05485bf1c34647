package net.tenure.integration.spring.event;

import net.tenure.core.event.ElectionEvent;
import net.tenure.core.spi.EventSink;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Republishes election events on the application context.
 * Listeners take the event record directly: {@code @EventListener void on(ElectionEvent.LeaderElected e)}.
 * They run synchronously on the election loop thread unless the context uses an async multicaster.
 */
public final class SpringEventSink implements EventSink {
    private final ApplicationEventPublisher publisher;

    public SpringEventSink(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
    }

    @Override
    public void emit(ElectionEvent event) {
        publisher.publishEvent(event);
    }
}
