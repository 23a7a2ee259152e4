package com.campaignkeeper.collaborator;

import java.util.concurrent.CompletableFuture;

/**
 * Speech synthesis or image generation. Rendering is asynchronous and the core never waits on it.
 */
public interface MediaRenderer {

    String name();

    CompletableFuture<MediaPayload> render(String text);
}
