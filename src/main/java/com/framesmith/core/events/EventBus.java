package com.framesmith.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for job progress events.
 * <p>
 * Supports per-job subscriptions and global subscriptions that receive all events.
 * Thread-safe for concurrent publish and subscribe operations; screen workers publish from pool threads.
 * Per-job subscriptions end with the job: {@link #closeJob(String)} drops them once the job is released.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-job subscribers keyed by jobId. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<FramesmithEvent>>> jobSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<FramesmithEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    /**
     * Publish an event to all matching subscribers (job-specific and global).
     */
    public void publish(FramesmithEvent event) {
        log.debug("Publishing event: {} for job {}", event.eventType(), event.jobId());

        List<Consumer<FramesmithEvent>> jobSubs = jobSubscribers.get(event.jobId());
        if (jobSubs != null) {
            for (Consumer<FramesmithEvent> subscriber : jobSubs) {
                deliverSafely(subscriber, event);
            }
        }

        for (Consumer<FramesmithEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events for a specific job.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String jobId, Consumer<FramesmithEvent> consumer) {
        jobSubscribers.computeIfAbsent(jobId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to job {}", jobId);
        return () -> {
            CopyOnWriteArrayList<Consumer<FramesmithEvent>> subs = jobSubscribers.get(jobId);
            if (subs != null) {
                subs.remove(consumer);
                if (subs.isEmpty()) {
                    jobSubscribers.remove(jobId, subs);
                }
            }
        };
    }

    /**
     * Drops every subscriber of a finished job. Events published for it afterwards reach global
     * subscribers only.
     *
     * @return how many job subscribers were dropped
     */
    public int closeJob(String jobId) {
        CopyOnWriteArrayList<Consumer<FramesmithEvent>> subs = jobSubscribers.remove(jobId);
        int dropped = subs == null ? 0 : subs.size();
        if (dropped > 0) {
            log.debug("Closed job {}: dropped {} subscribers", jobId, dropped);
        }
        return dropped;
    }

    int subscribedJobCount() {
        return jobSubscribers.size();
    }

    public Subscription subscribeAll(Consumer<FramesmithEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all events (global)");
        return () -> globalSubscribers.remove(consumer);
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<FramesmithEvent> subscriber, FramesmithEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
