package com.campaignkeeper.memory;

import com.campaignkeeper.config.MemoryConfig;
import com.campaignkeeper.model.Turn;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BreakDetector")
class BreakDetectorTest {

    private static final Instant START = Instant.parse("2026-03-01T18:00:00Z");

    private BreakDetector detector;
    private HistoryBuffer buffer;
    private int seconds;

    @BeforeEach
    void setUp() {
        detector = new BreakDetector(3, MemoryConfig.DEFAULT_MARKERS);
        buffer = new HistoryBuffer("scene-0001", new CharacterCountEstimator());
        seconds = 0;
    }

    private void player(String content) {
        buffer.append(Turn.player(content, START.plusSeconds(seconds++), "scene-0001"));
    }

    private void npc(String content) {
        buffer.append(Turn.npc(content, START.plusSeconds(seconds++), "scene-0001"));
    }

    @Test
    @DisplayName("Should find nothing in an empty buffer")
    void shouldIgnoreEmptyBuffer() {
        assertEquals(Optional.empty(), detector.detect(buffer, Set.of()));
    }

    @Test
    @DisplayName("Should detect an encounter-end marker regardless of case")
    void shouldDetectMarker() {
        npc("The goblin flees.");
        player("We let it go. [End Encounter]");

        assertEquals(Optional.of(BreakReason.ENCOUNTER_END), detector.detect(buffer, Set.of()));
    }

    @Test
    @DisplayName("Should not count an idle stretch shorter than the threshold")
    void shouldRequireFullIdleWindow() {
        player("we rest.");
        player("we rest some more.");

        assertTrue(detector.detect(buffer, Set.of()).isEmpty());
    }

    @Test
    @DisplayName("Should detect an idle stretch without NPCs or new names")
    void shouldDetectIdleStretch() {
        player("we walk along the river.");
        player("we keep walking.");
        player("we make camp for the night.");

        assertEquals(Optional.of(BreakReason.IDLE), detector.detect(buffer, Set.of()));
    }

    @Test
    @DisplayName("Should not treat a stretch with an NPC turn as idle")
    void shouldRejectNpcActivity() {
        player("we walk along the river.");
        npc("A ferryman waves.");
        player("we wave back.");

        assertTrue(detector.detect(buffer, Set.of()).isEmpty());
    }

    @Test
    @DisplayName("Should treat names from world state and earlier turns as known")
    void shouldAcceptKnownNames() {
        player("we travel with Mira to the gate.");
        player("we walk on past the wall.");
        player("we ask Mira about Thornwall.");
        player("we thank Mira again.");

        assertEquals(Optional.of(BreakReason.IDLE), detector.detect(buffer, Set.of("Thornwall")));
        assertTrue(detector.detect(buffer, Set.of()).isEmpty());
    }
}
