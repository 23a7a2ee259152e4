package com.campaignkeeper.agent;

import com.campaignkeeper.exception.CampaignErrorCode;
import com.campaignkeeper.exception.CampaignException;
import com.campaignkeeper.memory.CompressionOutcome;
import com.campaignkeeper.memory.Compressor;
import com.campaignkeeper.memory.HistoryBuffer;
import com.campaignkeeper.model.BeatStatus;
import com.campaignkeeper.model.BeatTransition;
import com.campaignkeeper.model.CampaignPhase;
import com.campaignkeeper.model.CampaignState;
import com.campaignkeeper.model.EntityKind;
import com.campaignkeeper.model.EntityUpsert;
import com.campaignkeeper.model.OpenThread;
import com.campaignkeeper.model.SceneRecord;
import com.campaignkeeper.model.StoryPlan;
import com.campaignkeeper.model.Summary;
import com.campaignkeeper.model.Turn;
import com.campaignkeeper.model.WorldEntity;
import com.campaignkeeper.model.WorldState;
import com.campaignkeeper.planning.CampaignPlan;
import com.campaignkeeper.repository.CampaignRepository;
import com.campaignkeeper.repository.SaveFileNames;
import com.campaignkeeper.repository.SaveSections;
import com.campaignkeeper.repository.TranscriptStore;
import dev.langchain4j.model.TokenCountEstimator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Sole owner of the campaign state. Spawns scene agents, merges what they return and hands
 * every merged snapshot to the repository.
 *
 * <p>Phases move {@code UNINITIALIZED -> PLANNING -> ACTIVE <-> PAUSED -> ARCHIVED}. All mutation
 * of the campaign state happens under a single-writer lock and is applied to a copy that replaces
 * the live state only when every step succeeded.</p>
 */
public final class MasterAgent implements Agent {

    private static final Logger log = LoggerFactory.getLogger(MasterAgent.class);
    private static final String CAMPAIGN_BUFFER_ID = "campaign";
    static final int RECENT_SCENES = 3;

    private final CampaignRepository repository;
    private final TranscriptStore transcripts;
    private final Compressor compressor;
    private final TokenCountEstimator estimator;
    private final Clock clock;
    private final ReentrantLock writeLock = new ReentrantLock();
    private final HistoryBuffer campaignBuffer;

    private CampaignPhase phase = CampaignPhase.UNINITIALIZED;
    private CampaignState state;
    private SceneAgent liveScene;
    private int sceneCounter;

    public MasterAgent(
        CampaignRepository repository,
        TranscriptStore transcripts,
        Compressor compressor,
        TokenCountEstimator estimator,
        Clock clock
    ) {
        this.repository = repository;
        this.transcripts = transcripts;
        this.compressor = compressor;
        this.estimator = estimator;
        this.clock = clock;
        this.campaignBuffer = new HistoryBuffer(CAMPAIGN_BUFFER_ID, estimator);
    }

    @Override
    public String id() {
        return state == null ? CAMPAIGN_BUFFER_ID : SaveFileNames.slug(state.getName());
    }

    public CampaignPhase phase() {
        return phase;
    }

    /**
     * Starts the planning phase with an empty campaign of the given name.
     */
    public void beginPlanning(String campaignName) {
        requirePhase(CampaignPhase.UNINITIALIZED);
        state = CampaignState.create(campaignName, clock.instant());
        phase = CampaignPhase.PLANNING;
        log.info("Planning campaign '{}'", state.getName());
    }

    /**
     * Seeds the campaign from the finished plan, persists it and enters the active loop.
     * The first beat of the plan becomes the active one.
     */
    public CompletableFuture<Path> completePlanning(CampaignPlan plan) {
        requirePhase(CampaignPhase.PLANNING);
        writeLock.lock();
        try {
            Map<String, List<String>> preserved = plan.worldStateNotes().isEmpty()
                ? Map.of()
                : Map.of(SaveSections.WORLD_STATE, plan.worldStateNotes());
            CampaignState seeded = new CampaignState(CampaignState.CURRENT_VERSION, plan.title(),
                state.getCreatedAt(), clock.instant(), new WorldState(), new StoryPlan(),
                List.of(), List.of(), preserved);
            plan.seeds().forEach(seeded.getWorldState()::upsert);
            plan.acts().forEach(seeded.getStoryPlan()::addBeat);
            if (seeded.getStoryPlan().size() > 0) {
                seeded.getStoryPlan().apply(new BeatTransition(1, BeatStatus.ACTIVE));
            }
            plan.openingThreads().forEach(text -> seeded.addThread(OpenThread.open(text, clock.instant())));
            state = seeded;
            phase = CampaignPhase.ACTIVE;
            log.info("Campaign '{}' planned: {} beats, {} entities", state.getName(),
                state.getStoryPlan().size(), state.getWorldState().size());
            return repository.saveAsync(state.copy());
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Re-enters the active loop from a restored save.
     */
    public void restore(CampaignState restored) {
        if (phase != CampaignPhase.UNINITIALIZED && phase != CampaignPhase.PAUSED) {
            throw wrongPhase("restore");
        }
        writeLock.lock();
        try {
            state = restored.copy();
            sceneCounter = state.getSceneHistory().size();
            if (campaignBuffer.isEmpty()) {
                state.getSceneHistory().forEach(this::recordSceneSummary);
            }
            phase = CampaignPhase.ACTIVE;
            log.info("Restored campaign '{}' with {} scenes", state.getName(), state.getSceneHistory().size());
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Spawns the scene agent for the next interaction segment, seeded from copies of the
     * current world state and story plan.
     */
    public SceneAgent spawnScene(String title) {
        requirePhase(CampaignPhase.ACTIVE);
        if (liveScene != null && !liveScene.isTerminated()) {
            throw new CampaignException(CampaignErrorCode.INVALID_STATE,
                "Scene " + liveScene.id() + " is still live");
        }
        String sceneId = nextSceneId();
        List<SceneRecord> history = state.getSceneHistory();
        List<String> recent = history.subList(Math.max(0, history.size() - RECENT_SCENES), history.size())
            .stream()
            .map(record -> record.title() + ": " + record.summary().text())
            .toList();
        liveScene = new SceneAgent(sceneId, title, SaveFileNames.slug(state.getName()),
            state.getWorldState().copy(), state.getStoryPlan().copy(), recent,
            new HistoryBuffer(sceneId, estimator), compressor, transcripts, clock);
        log.info("Spawned scene {} '{}'", sceneId, liveScene.getTitle());
        return liveScene;
    }

    public SceneAgent liveScene() {
        return liveScene == null || liveScene.isTerminated() ? null : liveScene;
    }

    /**
     * Applies a concluded scene's delta to the campaign and queues a save of the result.
     *
     * <p>Merges are serialized. A delta that does not belong to the live concluding scene, for
     * example one that was already merged, is rejected with {@link CampaignErrorCode#MERGE_CONFLICT}.
     * Any failure leaves the campaign state exactly as it was.</p>
     *
     * @return the pending save of the merged snapshot
     */
    public CompletableFuture<Path> merge(SceneDelta delta) {
        writeLock.lock();
        try {
            requirePhase(CampaignPhase.ACTIVE);
            if (liveScene == null || liveScene.status() != SceneStatus.CONCLUDING
                || !liveScene.id().equals(delta.sceneId())) {
                throw new CampaignException(CampaignErrorCode.MERGE_CONFLICT,
                    "Scene " + delta.sceneId() + " is not the live concluding scene");
            }
            CampaignState merged = state.copy();
            applyDelta(merged, delta);
            merged.setLastPlayedAt(clock.instant());

            state = merged;
            liveScene.markTerminated();
            recordSceneSummary(delta.record());
            log.info("Merged scene {}: {} upserts, {} new threads, transition {}", delta.sceneId(),
                delta.upserts().size(), delta.newThreads().size(), delta.transition().orElse(null));
            return repository.saveAsync(state.copy());
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Aborts the live scene if any, persists the campaign and pauses it.
     */
    public CompletableFuture<Path> pause() {
        requirePhase(CampaignPhase.ACTIVE);
        writeLock.lock();
        try {
            abortLiveScene();
            phase = CampaignPhase.PAUSED;
            log.info("Campaign '{}' paused", state.getName());
            return repository.saveAsync(state.copy());
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Marks the campaign complete. Every later mutation fails with
     * {@link CampaignErrorCode#CAMPAIGN_ARCHIVED}.
     */
    public CompletableFuture<Path> archive() {
        if (phase != CampaignPhase.ACTIVE && phase != CampaignPhase.PAUSED) {
            throw wrongPhase("archive");
        }
        writeLock.lock();
        try {
            abortLiveScene();
            phase = CampaignPhase.ARCHIVED;
            log.info("Campaign '{}' archived", state.getName());
            return repository.saveAsync(state.copy());
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Deep copy of the campaign state for read access.
     */
    public CampaignState snapshot() {
        writeLock.lock();
        try {
            return state == null ? null : state.copy();
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public CompressionOutcome acceptTurn(Turn turn) {
        requireNotArchived();
        campaignBuffer.append(turn);
        Set<String> knownNames = namesOf(state == null ? new WorldState() : state.getWorldState());
        try {
            return compressor.onTurnAppended(campaignBuffer, knownNames);
        } catch (CampaignException e) {
            if (e.getErrorCode() != CampaignErrorCode.COMPRESSION_FAILED) {
                throw e;
            }
            log.warn("Compression of campaign history failed, keeping it uncompressed: {}", e.getMessage());
            return CompressionOutcome.failed(campaignBuffer.size());
        }
    }

    @Override
    public Summary produceSummary() {
        String fallback = state == null || state.getSceneHistory().isEmpty()
            ? "No scenes played yet."
            : state.getSceneHistory().get(state.getSceneHistory().size() - 1).summary().text();
        return compressor.compressForConclusion(campaignBuffer, fallback);
    }

    // concluded scenes reach the campaign history as one narrator turn each
    private void recordSceneSummary(SceneRecord record) {
        Instant at = record.endedAt();
        Optional<Turn> last = campaignBuffer.lastTurn();
        if (last.isPresent() && !at.isAfter(last.get().timestamp())) {
            at = last.get().timestamp().plusNanos(1);
        }
        String text = "Scene '" + record.title() + "': " + record.summary().text();
        acceptTurn(Turn.narrator(text, at, record.sceneId()));
    }

    private void applyDelta(CampaignState target, SceneDelta delta) {
        for (EntityUpsert upsert : delta.upserts()) {
            target.getWorldState().upsert(upsert);
        }
        delta.transition().ifPresent(target.getStoryPlan()::apply);
        for (String text : delta.newThreads()) {
            target.addThread(OpenThread.open(text, delta.record().endedAt()));
        }
        for (String text : delta.resolvedThreads()) {
            if (!target.resolveThread(text)) {
                log.warn("Scene {} resolved unknown thread '{}', ignoring", delta.sceneId(), text);
            }
        }
        try {
            target.appendScene(delta.record());
        } catch (IllegalArgumentException e) {
            throw new CampaignException(CampaignErrorCode.MERGE_CONFLICT, e.getMessage(), e);
        }
    }

    private void abortLiveScene() {
        if (liveScene != null && !liveScene.isTerminated()) {
            liveScene.abort();
        }
        liveScene = null;
    }

    private String nextSceneId() {
        String candidate;
        do {
            sceneCounter++;
            candidate = String.format(Locale.ROOT, "scene-%04d", sceneCounter);
        } while (sceneIdTaken(candidate));
        return candidate;
    }

    private boolean sceneIdTaken(String sceneId) {
        return state.getSceneHistory().stream().anyMatch(record -> record.sceneId().equals(sceneId));
    }

    private void requirePhase(CampaignPhase expected) {
        if (phase != expected) {
            throw wrongPhase("expected " + expected);
        }
    }

    private void requireNotArchived() {
        if (phase == CampaignPhase.ARCHIVED) {
            throw new CampaignException(CampaignErrorCode.CAMPAIGN_ARCHIVED,
                "Campaign '" + state.getName() + "' is archived");
        }
    }

    private CampaignException wrongPhase(String operation) {
        requireNotArchived();
        return new CampaignException(CampaignErrorCode.INVALID_STATE,
            "Campaign is " + phase + " (" + operation + ")");
    }

    /**
     * Lowercased words of every entity name, used as the set of already established names.
     */
    static Set<String> namesOf(WorldState world) {
        Set<String> names = new LinkedHashSet<>();
        for (EntityKind kind : EntityKind.values()) {
            for (WorldEntity entity : world.entities(kind)) {
                names.addAll(namesOf(entity.name()));
            }
        }
        return names;
    }

    static Set<String> namesOf(String entityName) {
        Set<String> names = new LinkedHashSet<>();
        Arrays.stream(entityName.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}'-]+"))
            .filter(word -> !word.isEmpty())
            .forEach(names::add);
        return names;
    }
}
