package com.campaignkeeper.agent;

import com.campaignkeeper.config.MemoryConfig;
import com.campaignkeeper.exception.CampaignErrorCode;
import com.campaignkeeper.exception.CampaignException;
import com.campaignkeeper.memory.CharacterCountEstimator;
import com.campaignkeeper.memory.CompressionOutcome;
import com.campaignkeeper.memory.Compressor;
import com.campaignkeeper.model.BeatStatus;
import com.campaignkeeper.model.BeatTransition;
import com.campaignkeeper.model.EntityKind;
import com.campaignkeeper.model.Summary;
import com.campaignkeeper.model.Turn;
import com.campaignkeeper.model.TurnRole;
import com.campaignkeeper.model.WorldEntity;
import com.campaignkeeper.planning.CampaignPlan;
import com.campaignkeeper.repository.CampaignRepository;
import com.campaignkeeper.repository.JsonTranscriptStore;
import com.campaignkeeper.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("SceneAgent")
class SceneAgentTest {

    // 40 characters, 10 estimated tokens
    private static final String LINE = "the torches gutter in the damp corridor.";

    @TempDir
    Path savesDir;

    private MutableClock clock;
    private JsonTranscriptStore transcripts;
    private MasterAgent master;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-01T18:00:00Z");
        transcripts = new JsonTranscriptStore(savesDir);
        CampaignRepository repository = mock(CampaignRepository.class);
        when(repository.saveAsync(any())).thenReturn(CompletableFuture.completedFuture(savesDir.resolve("x")));
        MemoryConfig config = new MemoryConfig(100, 100_000, 50, 2, 200, MemoryConfig.DEFAULT_MARKERS);
        Compressor compressor = new Compressor(
            (previous, turns, maxChars) -> "Summary of turns 1-" + turns.size() + ".", config, clock);
        master = new MasterAgent(repository, transcripts, compressor, new CharacterCountEstimator(), clock);
        master.beginPlanning("Sunless Citadel");
        master.completePlanning(new CampaignPlan("Sunless Citadel", "", List.of("Descend", "Find the tree"),
            List.of(), List.of(), ""));
    }

    @Nested
    @DisplayName("lifecycle")
    class LifecycleTest {

        @Test
        @DisplayName("Should move from spawned through active and concluding to terminated")
        void shouldFollowLifecycle() {
            SceneAgent scene = master.spawnScene("The Ravine");
            assertEquals(SceneStatus.SPAWNED, scene.status());

            scene.append(TurnRole.PLAYER, "We climb down the rope.");
            assertEquals(SceneStatus.ACTIVE, scene.status());

            SceneDelta delta = scene.conclude();
            assertEquals(SceneStatus.CONCLUDING, scene.status());

            master.merge(delta);
            assertEquals(SceneStatus.TERMINATED, scene.status());
            CampaignException error = assertThrows(CampaignException.class,
                () -> scene.append(TurnRole.PLAYER, "Hello?"));
            assertEquals(CampaignErrorCode.SCENE_ALREADY_TERMINATED, error.getErrorCode());
        }

        @Test
        @DisplayName("Should refuse turns while concluding and hand back the same delta on retry")
        void shouldRejectTurnsWhileConcluding() {
            SceneAgent scene = master.spawnScene("The Ravine");
            scene.append(TurnRole.PLAYER, "We climb down the rope.");
            SceneDelta delta = scene.conclude();

            CampaignException error = assertThrows(CampaignException.class,
                () -> scene.append(TurnRole.NARRATOR, "Late reply."));

            assertEquals(CampaignErrorCode.INVALID_STATE, error.getErrorCode());
            assertSame(delta, scene.conclude());
        }

        @Test
        @DisplayName("Should conclude an empty scene with a placeholder summary")
        void shouldConcludeEmptyScene() {
            SceneDelta delta = master.spawnScene("Quiet Watch").conclude();

            assertEquals("Scene 'Quiet Watch' concluded.", delta.record().summary().text());
            assertEquals("none", delta.record().summary().describeCoverage());
        }

        @Test
        @DisplayName("Should refuse turns stamped for another scene")
        void shouldRejectForeignTurn() {
            SceneAgent scene = master.spawnScene("The Ravine");

            assertThrows(IllegalArgumentException.class,
                () -> scene.acceptTurn(Turn.player("Wrong scene", clock.instant(), "scene-0042")));
            assertTrue(scene.transcript().isEmpty());
        }

        @Test
        @DisplayName("Should stamp its own scene id on turns that carry none")
        void shouldStampSceneId() {
            SceneAgent scene = master.spawnScene("The Ravine");
            scene.acceptTurn(Turn.player("We light a torch.", clock.instant().plusSeconds(1), null));

            assertEquals(scene.id(), scene.transcript().get(0).sceneId());
            assertEquals(scene.id(), scene.conclude().record().summary().sceneId());
        }

        @Test
        @DisplayName("Should discard the transcript when aborted after concluding")
        void shouldDeleteTranscriptOnAbort() {
            SceneAgent scene = master.spawnScene("The Ravine");
            scene.append(TurnRole.PLAYER, "We climb down the rope.");
            SceneDelta delta = scene.conclude();
            Path transcript = savesDir.resolve(delta.record().transcriptRef());
            assertTrue(Files.exists(transcript));

            scene.abort();

            assertFalse(Files.exists(transcript));
            assertNull(master.liveScene());
            assertEquals(CampaignErrorCode.MERGE_CONFLICT,
                assertThrows(CampaignException.class, () -> master.merge(delta)).getErrorCode());
        }
    }

    @Nested
    @DisplayName("deltas")
    class DeltaTest {

        @Test
        @DisplayName("Should keep world changes local until merged")
        void shouldIsolateWorldChanges() {
            SceneAgent scene = master.spawnScene("The Ravine");
            scene.recordEntity(EntityKind.NPC, new WorldEntity("Meepo", "kobold keeper of dragons"));

            assertTrue(master.snapshot().getWorldState().find(EntityKind.NPC, "Meepo").isEmpty());
            assertTrue(scene.contextWindow().worldExcerpt().contains("Meepo"));

            master.merge(scene.conclude());
            assertTrue(master.snapshot().getWorldState().find(EntityKind.NPC, "Meepo").isPresent());
        }

        @Test
        @DisplayName("Should refuse blank thread text so the scene can still be merged")
        void shouldRejectBlankThread() {
            SceneAgent scene = master.spawnScene("The Ravine");

            assertEquals(CampaignErrorCode.INVALID_THREAD,
                assertThrows(CampaignException.class, () -> scene.openThread("  ")).getErrorCode());
            assertEquals(CampaignErrorCode.INVALID_THREAD,
                assertThrows(CampaignException.class, () -> scene.resolveThread("")).getErrorCode());
            scene.openThread("Who  cut the\nrope?");

            master.merge(scene.conclude());

            assertEquals(SceneStatus.TERMINATED, scene.status());
            assertEquals("Who cut the rope?", master.snapshot().getOpenThreads().get(0).text());
        }

        @Test
        @DisplayName("Should allow a single beat transition per scene")
        void shouldAllowOneTransition() {
            SceneAgent scene = master.spawnScene("The Ravine");
            scene.proposeBeatTransition(new BeatTransition(1, BeatStatus.DONE));

            CampaignException error = assertThrows(CampaignException.class,
                () -> scene.proposeBeatTransition(new BeatTransition(2, BeatStatus.ACTIVE)));

            assertEquals(CampaignErrorCode.INVALID_BEAT_TRANSITION, error.getErrorCode());
            assertEquals(new BeatTransition(1, BeatStatus.DONE), scene.conclude().beatTransition());
        }

        @Test
        @DisplayName("Should validate a transition against the scene's plan")
        void shouldValidateTransition() {
            SceneAgent scene = master.spawnScene("The Ravine");

            assertThrows(CampaignException.class,
                () -> scene.proposeBeatTransition(new BeatTransition(2, BeatStatus.ACTIVE)));
            assertNull(scene.conclude().beatTransition());
        }
    }

    @Test
    @DisplayName("Should compress a long encounter once at its end and archive every turn")
    void shouldCompressLongEncounterAtItsEnd() {
        SceneAgent scene = master.spawnScene("Goblin Warrens");
        CompressionOutcome outcome = null;
        for (int i = 1; i <= 40; i++) {
            TurnRole role = i % 2 == 1 ? TurnRole.PLAYER : TurnRole.NARRATOR;
            String content = i == 40 ? "the last goblin falls. [end encounter]" : LINE;
            outcome = scene.append(role, content);
            if (i <= 10) {
                assertEquals(CompressionOutcome.Status.WITHIN_BUDGET, outcome.status(), "turn " + i);
            } else if (i < 40) {
                assertEquals(CompressionOutcome.Status.DEFERRED, outcome.status(), "turn " + i);
            }
        }

        assertEquals(CompressionOutcome.Status.COMPRESSED, outcome.status());
        assertEquals(1, outcome.summary().firstTurn());
        assertEquals(40, outcome.summary().lastTurn());

        SceneDelta delta = scene.conclude();
        Summary summary = delta.record().summary();
        assertEquals(1, scene.summaries().size());
        assertEquals("1-40", summary.describeCoverage());
        assertFalse(summary.forced());

        List<Turn> archived = transcripts.read(delta.record().transcriptRef());
        assertEquals(40, archived.size());
        assertEquals(scene.transcript(), archived);
    }
}
