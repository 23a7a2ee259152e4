package com.campaignkeeper.repository;

import com.campaignkeeper.exception.CampaignErrorCode;
import com.campaignkeeper.exception.CampaignException;
import com.campaignkeeper.model.Turn;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JsonTranscriptStore")
class JsonTranscriptStoreTest {

    private static final Instant START = Instant.parse("2026-03-01T18:00:00Z");

    @TempDir
    Path savesDir;

    private JsonTranscriptStore store;

    @BeforeEach
    void setUp() {
        store = new JsonTranscriptStore(savesDir);
    }

    @Test
    @DisplayName("Should archive turns under the campaign and read them back verbatim")
    void shouldWriteAndRead() {
        List<Turn> turns = List.of(
            Turn.player("We open the door.", START, "scene-0001"),
            Turn.narrator("It creaks.\nSomething stirs.", START.plusNanos(1), "scene-0001"),
            Turn.npc("\"Who goes there?\"", START.plusSeconds(2), "scene-0001"));

        String ref = store.write("lost-mines", "scene-0001", turns);

        assertEquals("transcripts/lost-mines/scene-0001.json", ref);
        assertTrue(Files.exists(savesDir.resolve(ref)));
        assertEquals(turns, store.read(ref));
    }

    @Test
    @DisplayName("Should keep the first campaign's transcript when a second campaign shares its slug")
    void shouldNotOverwriteExistingTranscript() {
        List<Turn> first = List.of(Turn.player("First campaign line.", START, "scene-0001"));
        List<Turn> second = List.of(Turn.player("Second campaign line.", START.plusSeconds(60), "scene-0001"));

        String firstRef = store.write("untitled-campaign", "scene-0001", first);
        String secondRef = store.write("untitled-campaign", "scene-0001", second);

        assertEquals("transcripts/untitled-campaign/scene-0001.json", firstRef);
        assertEquals("transcripts/untitled-campaign/scene-0001-2.json", secondRef);
        assertEquals(first, store.read(firstRef));
        assertEquals(second, store.read(secondRef));
    }

    @Test
    @DisplayName("Should return an empty transcript for a missing file")
    void shouldReadMissingAsEmpty() {
        assertTrue(store.read("transcripts/none/scene-0009.json").isEmpty());
    }

    @Test
    @DisplayName("Should report a corrupt transcript")
    void shouldRejectCorruptFile() throws Exception {
        Path file = savesDir.resolve("transcripts/lost-mines/scene-0002.json");
        Files.createDirectories(file.getParent());
        Files.writeString(file, "{not json");

        CampaignException error = assertThrows(CampaignException.class,
            () -> store.read("transcripts/lost-mines/scene-0002.json"));
        assertEquals(CampaignErrorCode.PERSISTENCE_FAILED, error.getErrorCode());
    }

    @Test
    @DisplayName("Should delete an archived transcript")
    void shouldDelete() {
        String ref = store.write("lost-mines", "scene-0003", List.of(Turn.player("Hi", START, "scene-0003")));

        store.delete(ref);

        assertFalse(Files.exists(savesDir.resolve(ref)));
        store.delete(ref);
    }
}
