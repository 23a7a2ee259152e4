package com.campaignkeeper.collaborator;

import dev.langchain4j.exception.HttpException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MediaDispatcher")
class MediaDispatcherTest {

    private ResponseChannel channel;
    private List<MediaResult> received;

    @BeforeEach
    void setUp() {
        channel = new ResponseChannel();
        received = new CopyOnWriteArrayList<>();
        channel.subscribe(received::add);
    }

    private static MediaRenderer renderer(String name, CompletableFuture<MediaPayload> result) {
        return new MediaRenderer() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public CompletableFuture<MediaPayload> render(String text) {
                return result;
            }
        };
    }

    @Test
    @DisplayName("Should publish successes and classified failures independently")
    void shouldPublishEachRenderer() throws Exception {
        MediaPayload picture = new MediaPayload("image", "image/png", "https://img.example/1.png");
        MediaDispatcher dispatcher = new MediaDispatcher(List.of(
            renderer("image", CompletableFuture.completedFuture(picture)),
            renderer("voice", CompletableFuture.failedFuture(new HttpException(503, "overloaded")))), channel);

        dispatcher.dispatch(1, "A dark cave.").get(5, TimeUnit.SECONDS);

        assertEquals(2, received.size());
        MediaResult image = channel.latest("image").orElseThrow();
        assertTrue(image.succeeded());
        assertEquals(picture, image.payload());
        MediaResult voice = channel.latest("voice").orElseThrow();
        assertEquals(CollaboratorFailure.UNAVAILABLE, voice.failure());
    }

    @Test
    @DisplayName("Should not block on slow renderers")
    void shouldReturnBeforeRenderingCompletes() {
        CompletableFuture<MediaPayload> slow = new CompletableFuture<>();
        MediaDispatcher dispatcher = new MediaDispatcher(List.of(renderer("image", slow)), channel);

        CompletableFuture<Void> done = dispatcher.dispatch(1, "A dark cave.");

        assertFalse(done.isDone());
        assertTrue(received.isEmpty());
        slow.complete(new MediaPayload("image", "image/png", "x"));
        assertTrue(done.isDone());
        assertEquals(1, received.size());
    }

    @Test
    @DisplayName("Should let subscribers recognise results for an earlier turn")
    void shouldFlagStaleResults() {
        CompletableFuture<MediaPayload> first = new CompletableFuture<>();
        List<CompletableFuture<MediaPayload>> renders = new ArrayList<>(List.of(first,
            CompletableFuture.completedFuture(new MediaPayload("image", "image/png", "second"))));
        MediaRenderer image = new MediaRenderer() {
            @Override
            public String name() {
                return "image";
            }

            @Override
            public CompletableFuture<MediaPayload> render(String text) {
                return renders.remove(0);
            }
        };
        MediaDispatcher dispatcher = new MediaDispatcher(List.of(image), channel);

        dispatcher.dispatch(1, "First room.");
        dispatcher.dispatch(2, "Second room.");
        first.complete(new MediaPayload("image", "image/png", "first"));

        assertEquals(2, channel.currentTurn());
        MediaResult late = received.get(received.size() - 1);
        assertEquals(1, late.turnSequence());
        assertFalse(channel.isCurrent(late));
        assertEquals("second", channel.latest("image").orElseThrow().payload().location());
    }

    @Test
    @DisplayName("Should turn a renderer that throws into a failed result")
    void shouldCatchSynchronousFailure() {
        MediaRenderer broken = new MediaRenderer() {
            @Override
            public String name() {
                return "image";
            }

            @Override
            public CompletableFuture<MediaPayload> render(String text) {
                throw new IllegalStateException("request timed out");
            }
        };

        new MediaDispatcher(List.of(broken), channel).dispatch(3, "A bridge.");

        assertEquals(CollaboratorFailure.TIMEOUT, received.get(0).failure());
    }

    @Test
    @DisplayName("Should skip rendering for empty text and keep working after a subscriber fails")
    void shouldSkipEmptyTextAndIsolateSubscribers() {
        channel.subscribe(result -> {
            throw new IllegalStateException("ui closed");
        });
        MediaDispatcher dispatcher = new MediaDispatcher(List.of(
            renderer("image", CompletableFuture.completedFuture(new MediaPayload("image", "image/png", "x")))),
            channel);

        assertTrue(dispatcher.dispatch(1, " ").isDone());
        assertTrue(received.isEmpty());

        dispatcher.dispatch(2, "A tower.");
        assertEquals(1, received.size());
    }
}
