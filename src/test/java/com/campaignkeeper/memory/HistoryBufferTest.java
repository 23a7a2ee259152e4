package com.campaignkeeper.memory;

import com.campaignkeeper.exception.CampaignErrorCode;
import com.campaignkeeper.exception.CampaignException;
import com.campaignkeeper.model.Summary;
import com.campaignkeeper.model.Turn;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("HistoryBuffer")
class HistoryBufferTest {

    private static final Instant START = Instant.parse("2026-03-01T18:00:00Z");

    private HistoryBuffer buffer;

    @BeforeEach
    void setUp() {
        buffer = new HistoryBuffer("scene-0001", new CharacterCountEstimator());
    }

    @Test
    @DisplayName("Should return turns in append order, unchanged")
    void shouldKeepAppendOrder() {
        List<Turn> appended = new ArrayList<>();
        for (int i = 0; i < 25; i++) {
            Turn turn = i % 2 == 0
                ? Turn.player("Player line " + i, START.plusSeconds(i), "scene-0001")
                : Turn.narrator("Narrator line " + i, START.plusSeconds(i), "scene-0001");
            buffer.append(turn);
            appended.add(turn);
        }

        assertEquals(appended, buffer.snapshot());
        assertEquals(25, buffer.turnCount());
    }

    @Test
    @DisplayName("Should reject a turn that is not strictly after the previous one")
    void shouldRejectOutOfOrderTurn() {
        buffer.append(Turn.player("I open the door.", START, "scene-0001"));

        CampaignException sameInstant = assertThrows(CampaignException.class,
            () -> buffer.append(Turn.narrator("It creaks.", START, "scene-0001")));
        CampaignException earlier = assertThrows(CampaignException.class,
            () -> buffer.append(Turn.narrator("It creaks.", START.minusSeconds(1), "scene-0001")));

        assertEquals(CampaignErrorCode.INVALID_TURN_ORDER, sameInstant.getErrorCode());
        assertEquals(CampaignErrorCode.INVALID_TURN_ORDER, earlier.getErrorCode());
        assertEquals(1, buffer.turnCount());
    }

    @Test
    @DisplayName("Should not expose a mutable view of its turns")
    void shouldReturnReadOnlySnapshot() {
        buffer.append(Turn.player("Hello there.", START, "scene-0001"));

        assertThrows(UnsupportedOperationException.class,
            () -> buffer.snapshot().add(Turn.player("Sneaky.", START.plusSeconds(1), "scene-0001")));
    }

    @Test
    @DisplayName("Should estimate size from summary plus uncompacted turns only")
    void shouldSizeActiveContext() {
        buffer.append(Turn.player("a".repeat(40), START, "scene-0001"));
        buffer.append(Turn.narrator("b".repeat(80), START.plusSeconds(1), "scene-0001"));
        assertEquals(30, buffer.size());

        buffer.compact(2, new Summary("scene-0001", 1, 2, "c".repeat(20), START.plusSeconds(2), false));
        buffer.append(Turn.player("d".repeat(40), START.plusSeconds(3), "scene-0001"));

        assertEquals(15, buffer.size());
        assertEquals(3, buffer.snapshot().size());
        assertEquals(1, buffer.activeTurns().size());
    }

    @Test
    @DisplayName("Should drop everything on discard")
    void shouldDiscard() {
        buffer.append(Turn.player("We leave.", START, "scene-0001"));
        buffer.discard();

        assertTrue(buffer.isEmpty());
        assertEquals(0, buffer.size());
        assertTrue(buffer.latestSummary().isEmpty());
    }
}
