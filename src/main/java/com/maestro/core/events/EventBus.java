package com.maestro.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for workflow lifecycle events.
 * <p>
 * Subscribers either follow one workflow or receive every event. A workflow's entry exists
 * only while it has subscribers: the last unsubscribe, or {@link #clear(String)} when the
 * workflow is discarded, removes it. Subscriber failures are logged and discarded.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, List<Consumer<WorkflowEvent>>> byWorkflow = new ConcurrentHashMap<>();
    private final List<Consumer<WorkflowEvent>> global = new CopyOnWriteArrayList<>();

    public void publish(WorkflowEvent event) {
        List<Consumer<WorkflowEvent>> followers = byWorkflow.get(event.workflowId());
        int delivered = 0;
        if (followers != null) {
            for (Consumer<WorkflowEvent> subscriber : followers) {
                delivered += deliver(subscriber, event);
            }
        }
        for (Consumer<WorkflowEvent> subscriber : global) {
            delivered += deliver(subscriber, event);
        }
        log.debug("Event {} for workflow {} delivered to {} subscribers",
                event.eventType(), event.workflowId(), delivered);
    }

    /**
     * Follows the events of one workflow.
     *
     * @return a handle that stops delivery; the workflow's entry goes away with its last subscriber
     */
    public Subscription subscribe(String workflowId, Consumer<WorkflowEvent> consumer) {
        byWorkflow.compute(workflowId, (id, followers) -> {
            var list = followers != null ? followers : new CopyOnWriteArrayList<Consumer<WorkflowEvent>>();
            list.add(consumer);
            return list;
        });
        return () -> byWorkflow.computeIfPresent(workflowId, (id, followers) -> {
            followers.remove(consumer);
            return followers.isEmpty() ? null : followers;
        });
    }

    public Subscription subscribeAll(Consumer<WorkflowEvent> consumer) {
        global.add(consumer);
        return () -> global.remove(consumer);
    }

    /**
     * Drops every subscriber that follows the given workflow.
     */
    public void clear(String workflowId) {
        if (byWorkflow.remove(workflowId) != null) {
            log.debug("Dropped subscribers of workflow {}", workflowId);
        }
    }

    /**
     * True if an event of the workflow would reach anyone: a follower of that workflow or a
     * global subscriber.
     */
    public boolean hasSubscribers(String workflowId) {
        return byWorkflow.containsKey(workflowId) || !global.isEmpty();
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private int deliver(Consumer<WorkflowEvent> subscriber, WorkflowEvent event) {
        try {
            subscriber.accept(event);
            return 1;
        } catch (Exception e) {
            log.warn("Subscriber failed on {} for workflow {}: {}",
                    event.eventType(), event.workflowId(), e.getMessage(), e);
            return 0;
        }
    }
}
