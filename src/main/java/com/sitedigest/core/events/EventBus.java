package com.sitedigest.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * In-memory pub/sub for pipeline and job lifecycle events.
 * <p>
 * Delivery is synchronous on the publishing thread. Subscriptions scoped to a
 * job are released automatically once that job publishes one of
 * {@link #TERMINAL_JOB_EVENTS}.
 */
@Component
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Event types after which nothing more is published for a job. */
    public static final Set<String> TERMINAL_JOB_EVENTS = Set.of("job.completed", "job.failed");

    private record Registration(String jobId, Predicate<PipelineEvent> filter, Consumer<PipelineEvent> consumer) {

        boolean accepts(PipelineEvent event) {
            return (jobId == null || jobId.equals(event.jobId())) && filter.test(event);
        }
    }

    private final CopyOnWriteArrayList<Registration> registrations = new CopyOnWriteArrayList<>();

    public void publish(PipelineEvent event) {
        log.debug("Publishing {} for job {}", event.eventType(), event.jobId());
        for (Registration registration : registrations) {
            if (registration.accepts(event)) {
                deliverSafely(registration.consumer(), event);
            }
        }
        if (event.jobId() != null && TERMINAL_JOB_EVENTS.contains(event.eventType())) {
            registrations.removeIf(r -> event.jobId().equals(r.jobId()));
        }
    }

    /**
     * Receive the events of one job until it finishes or the subscription is
     * cancelled.
     */
    public Subscription subscribe(String jobId, Consumer<PipelineEvent> consumer) {
        return register(new Registration(jobId, e -> true, consumer));
    }

    /** Receive every event of every job. */
    public Subscription subscribeAll(Consumer<PipelineEvent> consumer) {
        return register(new Registration(null, e -> true, consumer));
    }

    /** Receive events of every job whose type starts with {@code typePrefix} ("step.", "job."). */
    public Subscription subscribeToType(String typePrefix, Consumer<PipelineEvent> consumer) {
        return register(new Registration(null, e -> e.eventType().startsWith(typePrefix), consumer));
    }

    int subscriberCount() {
        return registrations.size();
    }

    private Subscription register(Registration registration) {
        registrations.add(registration);
        return () -> registrations.remove(registration);
    }

    private void deliverSafely(Consumer<PipelineEvent> subscriber, PipelineEvent event) {
        try {
            subscriber.accept(event);
        } catch (RuntimeException e) {
            log.warn("Event subscriber failed on {}: {}", event.eventType(), e.getMessage());
        }
    }

    /** Handle for cancelling a subscription. */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }
}
