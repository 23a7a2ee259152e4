package com.campaignkeeper.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CampaignState")
class CampaignStateTest {

    private static final Instant NOW = Instant.parse("2026-03-01T18:00:00Z");

    private SceneRecord scene(String id) {
        Summary summary = new Summary(id, 1, 2, "Things happened.", NOW, false);
        return new SceneRecord(id, "The Inn", NOW, NOW.plusSeconds(60), summary, "transcripts/x/" + id + ".json");
    }

    @Test
    @DisplayName("Should start at the current schema version with empty collections")
    void shouldCreateEmptyCampaign() {
        CampaignState state = CampaignState.create("Lost Mines", NOW);

        assertEquals(CampaignState.CURRENT_VERSION, state.getVersion());
        assertEquals(NOW, state.getLastPlayedAt());
        assertTrue(state.getWorldState().isEmpty());
        assertTrue(state.getSceneHistory().isEmpty());
    }

    @Test
    @DisplayName("Should refuse a duplicate scene id")
    void shouldRejectDuplicateScene() {
        CampaignState state = CampaignState.create("Lost Mines", NOW);
        state.appendScene(scene("scene-0001"));

        assertThrows(IllegalArgumentException.class, () -> state.appendScene(scene("scene-0001")));
        assertEquals(1, state.getSceneHistory().size());
    }

    @Test
    @DisplayName("Should resolve threads by text ignoring case and keep them listed")
    void shouldResolveThreadByText() {
        CampaignState state = CampaignState.create("Lost Mines", NOW);
        state.addThread(OpenThread.open("Who poisoned the well?", NOW));

        assertTrue(state.resolveThread("who poisoned the  well?"));
        assertFalse(state.resolveThread("Who poisoned the well?"));
        assertEquals(1, state.getOpenThreads().size());
        assertTrue(state.getOpenThreads().get(0).resolved());
    }

    @Test
    @DisplayName("Should produce independent copies")
    void shouldCopyIndependently() {
        CampaignState state = CampaignState.create("Lost Mines", NOW);
        CampaignState copy = state.copy();
        assertEquals(state, copy);

        copy.appendScene(scene("scene-0001"));
        copy.getStoryPlan().addBeat("Begin");
        copy.setLastPlayedAt(NOW.plusSeconds(5));

        assertTrue(state.getSceneHistory().isEmpty());
        assertEquals(0, state.getStoryPlan().size());
        assertEquals(NOW, state.getLastPlayedAt());
    }
}
