package com.campaignkeeper.planning;

import com.campaignkeeper.agent.MasterAgent;
import com.campaignkeeper.config.MemoryConfig;
import com.campaignkeeper.memory.CharacterCountEstimator;
import com.campaignkeeper.memory.Compressor;
import com.campaignkeeper.memory.ExtractiveSummarizer;
import com.campaignkeeper.model.CampaignPhase;
import com.campaignkeeper.model.CampaignState;
import com.campaignkeeper.repository.CampaignRepository;
import com.campaignkeeper.repository.JsonTranscriptStore;
import com.campaignkeeper.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("PlanningSession")
class PlanningSessionTest {

    @Mock
    private CampaignRepository repository;

    @TempDir
    Path savesDir;

    private MasterAgent master;
    private PlanningSession session;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.at("2026-03-01T18:00:00Z");
        lenient().when(repository.saveAsync(any()))
            .thenReturn(CompletableFuture.completedFuture(savesDir.resolve("saved.dnd-save.md")));
        master = new MasterAgent(repository, new JsonTranscriptStore(savesDir),
            new Compressor(new ExtractiveSummarizer(), MemoryConfig.defaults(), clock),
            new CharacterCountEstimator(), clock);
        session = new PlanningSession(new QuestionnaireCampaignDesigner(), master);
    }

    @Test
    @DisplayName("Should ask questions until done and then seed and save the campaign")
    void shouldPlanAndSeed() {
        String first = session.start("Lost Mines");
        assertEquals(CampaignPhase.PLANNING, master.phase());
        assertFalse(first.isBlank());

        Optional<String> next = session.reply("Frontier fantasy.");
        assertTrue(next.isPresent());
        session.reply("Phandalin: frontier town");
        session.reply("Sildar: a knight");
        session.reply("Reach Phandalin; Clear the hideout");

        assertEquals(Optional.empty(), session.reply("  DONE "));

        assertTrue(session.isComplete());
        assertEquals(CampaignPhase.ACTIVE, master.phase());
        CampaignState state = master.snapshot();
        assertEquals(2, state.getStoryPlan().size());
        assertEquals(2, state.getWorldState().size());
        assertTrue(session.initialSave().isDone());
        verify(repository).saveAsync(any());
    }

    @Test
    @DisplayName("Should refuse replies after planning finished")
    void shouldRejectLateReply() {
        session.start("Lost Mines");
        session.reply("done");

        assertThrows(IllegalStateException.class, () -> session.reply("one more thing"));
    }
}
