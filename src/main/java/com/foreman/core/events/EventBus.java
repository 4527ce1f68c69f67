package com.foreman.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for auto mode events.
 * <p>
 * Supports per-project subscriptions and global subscriptions that receive all events.
 * Thread-safe for concurrent publish and subscribe operations.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-project subscribers keyed by projectPath. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<AutoModeEvent>>> projectSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<AutoModeEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    /**
     * Publish an event to all matching subscribers (project-specific and global).
     *
     * @param event the event to publish
     */
    public void publish(AutoModeEvent event) {
        log.debug("Publishing event: {} for project {} feature {}",
                event.eventType(), event.projectPath(), event.featureId());

        if (event.projectPath() != null) {
            List<Consumer<AutoModeEvent>> projectSubs = projectSubscribers.get(event.projectPath());
            if (projectSubs != null) {
                for (Consumer<AutoModeEvent> subscriber : projectSubs) {
                    deliverSafely(subscriber, event);
                }
            }
        }

        for (Consumer<AutoModeEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events for a specific project.
     *
     * @param projectPath the project to subscribe to
     * @param consumer    callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String projectPath, Consumer<AutoModeEvent> consumer) {
        projectSubscribers.computeIfAbsent(projectPath, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to project {}", projectPath);
        return () -> {
            CopyOnWriteArrayList<Consumer<AutoModeEvent>> subs = projectSubscribers.get(projectPath);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    /**
     * Subscribe to events from all projects.
     *
     * @param consumer callback invoked for each event regardless of project
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribeAll(Consumer<AutoModeEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all events (global)");
        return () -> globalSubscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<AutoModeEvent> subscriber, AutoModeEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
