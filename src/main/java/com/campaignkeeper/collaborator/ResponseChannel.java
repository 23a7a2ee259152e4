package com.campaignkeeper.collaborator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Delivery surface for asynchronous media results. A UI either subscribes or polls
 * {@link #latest(String)}.
 *
 * <p>Results arrive tagged with their turn sequence. The channel delivers them all; deciding that
 * a result is stale because the player already moved on is up to the subscriber, using
 * {@link #isCurrent(MediaResult)}.</p>
 */
public class ResponseChannel {

    private static final Logger log = LoggerFactory.getLogger(ResponseChannel.class);

    private final List<Consumer<MediaResult>> subscribers = new CopyOnWriteArrayList<>();
    private final Map<String, MediaResult> latestByRenderer = new ConcurrentHashMap<>();
    private final AtomicLong currentTurn = new AtomicLong();

    /**
     * @return a handle that removes the subscription
     */
    public Runnable subscribe(Consumer<MediaResult> subscriber) {
        subscribers.add(subscriber);
        return () -> subscribers.remove(subscriber);
    }

    public void publish(MediaResult result) {
        latestByRenderer.merge(result.renderer(), result,
            (existing, incoming) -> incoming.turnSequence() >= existing.turnSequence() ? incoming : existing);
        for (Consumer<MediaResult> subscriber : subscribers) {
            try {
                subscriber.accept(result);
            } catch (RuntimeException e) {
                log.warn("Media subscriber failed on {} result for turn {}", result.renderer(),
                    result.turnSequence(), e);
            }
        }
    }

    public Optional<MediaResult> latest(String renderer) {
        return Optional.ofNullable(latestByRenderer.get(renderer));
    }

    public void advanceTo(long turnSequence) {
        currentTurn.accumulateAndGet(turnSequence, Math::max);
    }

    public long currentTurn() {
        return currentTurn.get();
    }

    public boolean isCurrent(MediaResult result) {
        return result.turnSequence() >= currentTurn.get();
    }
}
