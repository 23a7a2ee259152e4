package com.campaignkeeper.collaborator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Fires every media renderer for a piece of narration and publishes results as they complete.
 * Nothing here blocks the turn loop.
 */
public class MediaDispatcher {

    private static final Logger log = LoggerFactory.getLogger(MediaDispatcher.class);

    private final List<MediaRenderer> renderers;
    private final ResponseChannel channel;

    public MediaDispatcher(List<MediaRenderer> renderers, ResponseChannel channel) {
        this.renderers = List.copyOf(renderers);
        this.channel = channel;
    }

    public ResponseChannel getChannel() {
        return channel;
    }

    public boolean hasRenderers() {
        return !renderers.isEmpty();
    }

    /**
     * Starts rendering and returns immediately.
     *
     * @return completes when every renderer has published; callers are not expected to wait on it
     */
    public CompletableFuture<Void> dispatch(long turnSequence, String text) {
        channel.advanceTo(turnSequence);
        if (text == null || text.isBlank()) {
            return CompletableFuture.completedFuture(null);
        }
        List<CompletableFuture<?>> pending = new ArrayList<>();
        for (MediaRenderer renderer : renderers) {
            CompletableFuture<MediaPayload> render;
            try {
                render = renderer.render(text);
            } catch (RuntimeException e) {
                render = CompletableFuture.failedFuture(e);
            }
            pending.add(render.handle((payload, error) -> {
                if (error != null) {
                    Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause() : error;
                    CollaboratorFailure failure = CollaboratorFailure.classify(cause);
                    log.warn("{} failed for turn {} ({}): {}", renderer.name(), turnSequence, failure,
                        cause.getMessage());
                    channel.publish(new MediaResult(turnSequence, renderer.name(), null, failure));
                } else {
                    channel.publish(new MediaResult(turnSequence, renderer.name(), payload, null));
                }
                return null;
            }));
        }
        return CompletableFuture.allOf(pending.toArray(new CompletableFuture<?>[0]));
    }
}
