package com.maestro.core.agent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Catalog of available agents, shared by every workflow driver in the process.
 * <p>
 * Profiles are kept in registration order so that {@link #findBest(String)} breaks
 * score ties in favour of the first-registered agent. All catalog access goes through
 * a single lock; inboxes are concurrent queues and can be drained without it.
 */
public class AgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);

    private final CapabilityScorer scorer;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, AgentProfile> profiles = new LinkedHashMap<>();
    private final Map<String, Queue<AgentMessage>> inboxes = new LinkedHashMap<>();

    public AgentRegistry() {
        this(new KeywordCapabilityScorer());
    }

    public AgentRegistry(CapabilityScorer scorer) {
        this.scorer = scorer;
    }

    /**
     * Registers a profile, replacing any existing profile with the same name.
     * A replaced profile keeps its position and its inbox.
     */
    public void register(AgentProfile profile) {
        lock.lock();
        try {
            AgentProfile previous = profiles.put(profile.name(), profile);
            inboxes.computeIfAbsent(profile.name(), k -> new ConcurrentLinkedQueue<>());
            if (previous != null) {
                log.debug("Replaced agent profile {}", profile.name());
            } else {
                log.debug("Registered agent {} [{}] with capabilities {}",
                        profile.name(), profile.role(), profile.capabilities());
            }
        } finally {
            lock.unlock();
        }
    }

    public boolean unregister(String name) {
        lock.lock();
        try {
            inboxes.remove(name);
            return profiles.remove(name) != null;
        } finally {
            lock.unlock();
        }
    }

    public Optional<AgentProfile> get(String name) {
        if (name == null) return Optional.empty();
        lock.lock();
        try {
            return Optional.ofNullable(profiles.get(name));
        } finally {
            lock.unlock();
        }
    }

    /**
     * All registered profiles in registration order.
     */
    public List<AgentProfile> getAll() {
        lock.lock();
        try {
            return List.copyOf(profiles.values());
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return profiles.size();
        } finally {
            lock.unlock();
        }
    }

    public double score(AgentProfile profile, String taskText) {
        return scorer.score(profile.capabilities(), taskText);
    }

    /**
     * Finds the agent whose capabilities best match the task text.
     *
     * @param taskText free-text task description
     * @return the strictly highest scoring profile (first registered on ties), or empty
     *         when the registry is empty or no profile scores above zero
     */
    public Optional<AgentProfile> findBest(String taskText) {
        AgentProfile best = null;
        double bestScore = 0.0;
        for (AgentProfile profile : getAll()) {
            double score = score(profile, taskText);
            if (score > bestScore) {
                bestScore = score;
                best = profile;
            }
        }
        if (best != null) {
            log.debug("Best agent for '{}' is {} (score {})", abbreviate(taskText), best.name(), bestScore);
        }
        return Optional.ofNullable(best);
    }

    /**
     * Delivers a message to its recipient's inbox. Unknown recipients are ignored.
     */
    public void send(AgentMessage message) {
        Queue<AgentMessage> inbox;
        lock.lock();
        try {
            inbox = inboxes.get(message.toAgent());
        } finally {
            lock.unlock();
        }
        if (inbox == null) {
            log.debug("Dropping message from {} to unknown agent {}", message.fromAgent(), message.toAgent());
            return;
        }
        inbox.add(message);
    }

    /**
     * Delivers a message to every registered agent except its sender.
     *
     * @return number of inboxes the message was delivered to
     */
    public int broadcast(AgentMessage message) {
        List<Queue<AgentMessage>> targets = new ArrayList<>();
        lock.lock();
        try {
            for (var entry : inboxes.entrySet()) {
                if (!entry.getKey().equals(message.fromAgent())) {
                    targets.add(entry.getValue());
                }
            }
        } finally {
            lock.unlock();
        }
        targets.forEach(inbox -> inbox.add(message));
        return targets.size();
    }

    /**
     * Drains and returns the pending messages of an agent, oldest first.
     */
    public List<AgentMessage> pendingMessages(String name) {
        Queue<AgentMessage> inbox;
        lock.lock();
        try {
            inbox = inboxes.get(name);
        } finally {
            lock.unlock();
        }
        if (inbox == null) return List.of();

        var drained = new ArrayList<AgentMessage>();
        AgentMessage message;
        while ((message = inbox.poll()) != null) {
            drained.add(message);
        }
        return drained;
    }

    private static String abbreviate(String text) {
        if (text == null) return "";
        return text.length() <= 60 ? text : text.substring(0, 60) + "...";
    }
}
