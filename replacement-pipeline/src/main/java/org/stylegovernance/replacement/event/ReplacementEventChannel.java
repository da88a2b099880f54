package org.stylegovernance.replacement.event;

import java.util.concurrent.atomic.AtomicLong;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.util.concurrent.Queues;

/**
 * Ordered event stream of one engine. Subscribers see events emitted after they subscribed; the first
 * subscriber also receives anything buffered before it arrived. The channel stays open when subscribers
 * leave so later operations can still be observed.
 */
@Slf4j
public class ReplacementEventChannel {
    private final Sinks.Many<ReplacementEvent> sink =
        Sinks.many().multicast().onBackpressureBuffer(Queues.SMALL_BUFFER_SIZE, false);

    public Flux<ReplacementEvent> events() {
        return sink.asFlux();
    }

    private final AtomicLong droppedEvents = new AtomicLong();

    /**
     * Emit an event. Events are emitted from one operation flow at a time, so emissions do not race. When
     * nobody consumes the stream the buffer eventually fills; the first drop is logged as a warning and the
     * rest at debug.
     */
    public synchronized void emit(ReplacementEvent event) {
        var result = sink.tryEmitNext(event);
        if (result.isFailure()) {
            if (droppedEvents.getAndIncrement() == 0) {
                log.warn("Dropped {} event ({}); further dropped events are logged at debug level",
                    event.type(), result);
            } else {
                log.debug("Dropped {} event: {}", event.type(), result);
            }
        }
    }

    /** Events that could not be delivered or buffered since the channel was created. */
    public long getDroppedEventCount() {
        return droppedEvents.get();
    }

    public void close() {
        sink.tryEmitComplete();
    }
}
