package com.prfactory.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * In-process distribution of {@link WorkflowEvent}s.
 * <p>
 * Consumers pick what they receive by event variant ({@link #subscribe(Class, Consumer)}),
 * by ticket ({@link #subscribe(String, Consumer)}) or take everything
 * ({@link #subscribeAll(Consumer)}). Subscribers run on the publishing thread in
 * registration order.
 * <p>
 * A ticket subscription follows one workflow run: it receives the run's
 * {@link WorkflowEvent.Terminal} event and is then dropped, so ticket listeners do not
 * accumulate across finished workflows. A subscriber that throws is logged and skipped.
 */
@Service
public class EventBus implements EventPublisher {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final CopyOnWriteArrayList<Registration> registrations = new CopyOnWriteArrayList<>();

    @Override
    public void publish(WorkflowEvent event) {
        log.debug("Publishing {} for ticket {} ({})", event.eventType(), event.ticketId(), event.graphId());

        for (Registration registration : registrations) {
            if (registration.accepts(event)) {
                deliverSafely(registration, event);
            }
        }

        if (event instanceof WorkflowEvent.Terminal) {
            if (registrations.removeIf(registration -> registration.endsWith(event))) {
                log.debug("Released subscriptions of ticket {} after {}", event.ticketId(), event.eventType());
            }
        }
    }

    /**
     * Subscribe to one workflow variant, or to {@link WorkflowEvent.Terminal} for every
     * way a workflow can end.
     */
    public <E extends WorkflowEvent> Subscription subscribe(Class<E> type, Consumer<? super E> consumer) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(consumer, "consumer");
        log.debug("Subscribed to {} events", type.getSimpleName());
        return register(new Registration(type::isInstance, event -> consumer.accept(type.cast(event)), null));
    }

    /**
     * Subscribe to the events of a ticket's current or next workflow run.
     *
     * @param ticketId the ticket to follow
     * @param consumer callback invoked for each event, including the terminal one
     * @return a {@link Subscription} handle; released automatically once the run ends
     */
    public Subscription subscribe(String ticketId, Consumer<WorkflowEvent> consumer) {
        Objects.requireNonNull(ticketId, "ticketId");
        Objects.requireNonNull(consumer, "consumer");
        log.debug("Subscribed to ticket {}", ticketId);
        return register(new Registration(event -> ticketId.equals(event.ticketId()), consumer, ticketId));
    }

    /**
     * Subscribe to events from all tickets.
     */
    public Subscription subscribeAll(Consumer<WorkflowEvent> consumer) {
        Objects.requireNonNull(consumer, "consumer");
        log.debug("Subscribed to all events");
        return register(new Registration(event -> true, consumer, null));
    }

    int subscriberCount() {
        return registrations.size();
    }

    private Subscription register(Registration registration) {
        registrations.add(registration);
        return () -> registrations.remove(registration);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Registration registration, WorkflowEvent event) {
        try {
            registration.consumer.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber failed on {} for ticket {}: {}",
                    event.eventType(), event.ticketId(), e.getMessage(), e);
        }
    }

    /** Identity-compared so that equal filters registered twice unsubscribe independently. */
    private static final class Registration {

        private final Predicate<WorkflowEvent> filter;
        private final Consumer<WorkflowEvent> consumer;
        /** Ticket whose terminal event ends this registration; null for lasting ones. */
        private final String boundTicket;

        Registration(Predicate<WorkflowEvent> filter, Consumer<WorkflowEvent> consumer, String boundTicket) {
            this.filter = filter;
            this.consumer = consumer;
            this.boundTicket = boundTicket;
        }

        boolean accepts(WorkflowEvent event) {
            return filter.test(event);
        }

        boolean endsWith(WorkflowEvent terminal) {
            return boundTicket != null && boundTicket.equals(terminal.ticketId());
        }
    }
}
