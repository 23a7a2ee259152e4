package com.campaignkeeper.agent;

import com.campaignkeeper.exception.CampaignErrorCode;
import com.campaignkeeper.exception.CampaignException;
import com.campaignkeeper.memory.CompressionOutcome;
import com.campaignkeeper.memory.Compressor;
import com.campaignkeeper.memory.ContextWindow;
import com.campaignkeeper.memory.HistoryBuffer;
import com.campaignkeeper.model.BeatTransition;
import com.campaignkeeper.model.EntityKind;
import com.campaignkeeper.model.EntityUpsert;
import com.campaignkeeper.model.SceneRecord;
import com.campaignkeeper.model.StoryPlan;
import com.campaignkeeper.model.Summary;
import com.campaignkeeper.model.Texts;
import com.campaignkeeper.model.Turn;
import com.campaignkeeper.model.TurnRole;
import com.campaignkeeper.model.WorldEntity;
import com.campaignkeeper.model.WorldState;
import com.campaignkeeper.repository.TranscriptStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Short-lived agent for one interaction segment (dialogue, combat, exploration).
 *
 * <p>It works on copies of the master's world state and story plan taken at spawn time and keeps
 * its own history buffer. Nothing reaches the campaign except through the {@link SceneDelta}
 * returned by {@link #conclude()} and merged by the master agent.</p>
 */
public final class SceneAgent implements Agent {

    private static final Logger log = LoggerFactory.getLogger(SceneAgent.class);
    private static final int WORLD_EXCERPT_CHARS = 1500;
    private static final int PLAN_OUTLINE_BEATS = 10;

    private final String sceneId;
    private final String title;
    private final String campaignSlug;
    private final Instant startedAt;
    private final WorldState world;
    private final StoryPlan plan;
    private final List<String> recentScenes;
    private final Set<String> knownNames;
    private final HistoryBuffer buffer;
    private final Compressor compressor;
    private final TranscriptStore transcripts;
    private final Clock clock;

    private final List<EntityUpsert> upserts = new ArrayList<>();
    private final List<String> newThreads = new ArrayList<>();
    private final List<String> resolvedThreads = new ArrayList<>();
    private BeatTransition beatTransition;
    private SceneStatus status = SceneStatus.SPAWNED;
    private SceneDelta pendingDelta;

    SceneAgent(
        String sceneId,
        String title,
        String campaignSlug,
        WorldState worldSnapshot,
        StoryPlan planSnapshot,
        List<String> recentScenes,
        HistoryBuffer buffer,
        Compressor compressor,
        TranscriptStore transcripts,
        Clock clock
    ) {
        this.sceneId = sceneId;
        this.title = title;
        this.campaignSlug = campaignSlug;
        this.world = worldSnapshot;
        this.plan = planSnapshot;
        this.recentScenes = List.copyOf(recentScenes);
        this.knownNames = new HashSet<>(MasterAgent.namesOf(worldSnapshot));
        this.buffer = buffer;
        this.compressor = compressor;
        this.transcripts = transcripts;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    @Override
    public String id() {
        return sceneId;
    }

    public String getTitle() {
        return title;
    }

    public SceneStatus status() {
        return status;
    }

    public boolean isTerminated() {
        return status == SceneStatus.TERMINATED;
    }

    @Override
    public CompressionOutcome acceptTurn(Turn turn) {
        requireAcceptingTurns();
        if (turn.sceneId() != null && !turn.sceneId().equals(sceneId)) {
            throw new IllegalArgumentException("Turn belongs to scene " + turn.sceneId() + ", not " + sceneId);
        }
        buffer.append(turn.sceneId() == null ? turn.inScene(sceneId) : turn);
        status = SceneStatus.ACTIVE;
        try {
            return compressor.onTurnAppended(buffer, knownNames);
        } catch (CampaignException e) {
            if (e.getErrorCode() != CampaignErrorCode.COMPRESSION_FAILED) {
                throw e;
            }
            log.warn("Compression failed in scene {}, keeping uncompressed history: {}", sceneId, e.getMessage());
            return CompressionOutcome.failed(buffer.size());
        }
    }

    /**
     * Appends a turn stamped with the next timestamp of this scene.
     */
    public CompressionOutcome append(TurnRole role, String content) {
        return acceptTurn(new Turn(role, content, nextTimestamp(), sceneId));
    }

    public void recordEntity(EntityKind kind, WorldEntity entity) {
        requireAcceptingTurns();
        EntityUpsert upsert = new EntityUpsert(kind, entity);
        upserts.add(upsert);
        world.upsert(upsert);
        knownNames.addAll(MasterAgent.namesOf(entity.name()));
    }

    /**
     * Proposes this scene's single beat transition, validated against the scene's copy of the plan.
     */
    public void proposeBeatTransition(BeatTransition transition) {
        requireAcceptingTurns();
        if (beatTransition != null) {
            throw new CampaignException(CampaignErrorCode.INVALID_BEAT_TRANSITION,
                "Scene " + sceneId + " already proposed a transition for beat " + beatTransition.order());
        }
        plan.apply(transition);
        beatTransition = transition;
    }

    public void openThread(String text) {
        requireAcceptingTurns();
        newThreads.add(threadText(text));
    }

    public void resolveThread(String text) {
        requireAcceptingTurns();
        resolvedThreads.add(threadText(text));
    }

    private String threadText(String text) {
        String normalized = Texts.singleLine(text);
        if (normalized.isEmpty()) {
            throw new CampaignException(CampaignErrorCode.INVALID_THREAD,
                "Scene " + sceneId + ": thread text is blank");
        }
        return normalized;
    }

    public ContextWindow contextWindow() {
        return new ContextWindow(
            title,
            buffer.latestSummary().map(Summary::text).orElse(null),
            buffer.activeTurns(),
            world.excerpt(WORLD_EXCERPT_CHARS),
            plan.outline(PLAN_OUTLINE_BEATS),
            recentScenes
        );
    }

    @Override
    public Summary produceSummary() {
        return compressor.compressForConclusion(buffer, "Scene '" + title + "' concluded.");
    }

    /**
     * Ends the segment: summarizes the whole scene, archives the transcript and returns the delta
     * to merge. If summarization or archiving fails the scene returns to {@link SceneStatus#ACTIVE}
     * with its buffer intact so the caller may retry.
     */
    public SceneDelta conclude() {
        if (status == SceneStatus.CONCLUDING && pendingDelta != null) {
            return pendingDelta;
        }
        requireAcceptingTurns();
        SceneStatus previous = status;
        status = SceneStatus.CONCLUDING;
        String transcriptRef = null;
        try {
            Summary summary = produceSummary();
            transcriptRef = transcripts.write(campaignSlug, sceneId, buffer.snapshot());
            SceneRecord record = new SceneRecord(sceneId, title, startedAt, clock.instant(), summary, transcriptRef);
            pendingDelta = new SceneDelta(sceneId, upserts, beatTransition, newThreads, resolvedThreads, record);
        } catch (RuntimeException e) {
            status = previous;
            if (transcriptRef != null) {
                transcripts.delete(transcriptRef);
            }
            throw e;
        }
        log.info("Scene {} ('{}') concluding after {} turns", sceneId, title, buffer.turnCount());
        return pendingDelta;
    }

    /**
     * Discards the scene without merging. World state writes recorded by the scene are lost.
     */
    public void abort() {
        if (status == SceneStatus.TERMINATED) {
            return;
        }
        if (pendingDelta != null && !pendingDelta.record().transcriptRef().isEmpty()) {
            transcripts.delete(pendingDelta.record().transcriptRef());
        }
        buffer.discard();
        pendingDelta = null;
        status = SceneStatus.TERMINATED;
        log.info("Scene {} aborted, nothing merged", sceneId);
    }

    public List<Turn> transcript() {
        return buffer.snapshot();
    }

    public List<Summary> summaries() {
        return buffer.summaries();
    }

    public int contextCost() {
        return buffer.size();
    }

    SceneDelta pendingDelta() {
        return pendingDelta;
    }

    void markTerminated() {
        status = SceneStatus.TERMINATED;
    }

    private Instant nextTimestamp() {
        Instant now = clock.instant();
        return buffer.lastTurn()
            .map(Turn::timestamp)
            .filter(last -> !now.isAfter(last))
            .map(last -> last.plusNanos(1))
            .orElse(now);
    }

    private void requireAcceptingTurns() {
        if (status == SceneStatus.TERMINATED) {
            throw new CampaignException(CampaignErrorCode.SCENE_ALREADY_TERMINATED,
                "Scene " + sceneId + " has terminated");
        }
        if (status == SceneStatus.CONCLUDING) {
            throw new CampaignException(CampaignErrorCode.INVALID_STATE, "Scene " + sceneId + " is concluding");
        }
    }
}
