package com.campaignkeeper.session;

import com.campaignkeeper.agent.MasterAgent;
import com.campaignkeeper.agent.SceneAgent;
import com.campaignkeeper.agent.SceneDelta;
import com.campaignkeeper.collaborator.MediaDispatcher;
import com.campaignkeeper.collaborator.Narration;
import com.campaignkeeper.collaborator.NarrationGenerator;
import com.campaignkeeper.collaborator.SpeechToText;
import com.campaignkeeper.collaborator.TurnCandidate;
import com.campaignkeeper.exception.CampaignErrorCode;
import com.campaignkeeper.exception.CampaignException;
import com.campaignkeeper.exception.CollaboratorException;
import com.campaignkeeper.memory.CompressionOutcome;
import com.campaignkeeper.model.EntityUpsert;
import com.campaignkeeper.model.SceneRecord;
import com.campaignkeeper.model.TurnRole;
import com.campaignkeeper.repository.CampaignRepository;
import com.campaignkeeper.repository.ResumeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * The active play loop: routes player input to the live scene, asks the narrator for a reply,
 * records the narrator's proposed changes and merges the scene back into the campaign when it ends.
 */
public class CampaignSession {

    private static final Logger log = LoggerFactory.getLogger(CampaignSession.class);

    private final MasterAgent master;
    private final CampaignRepository repository;
    private NarrationGenerator narrator;
    private final MediaDispatcher media;
    private long turnSequence;
    private CompletableFuture<Path> lastSave = CompletableFuture.completedFuture(null);

    public CampaignSession(MasterAgent master, CampaignRepository repository, NarrationGenerator narrator,
                           MediaDispatcher media) {
        this.master = master;
        this.repository = repository;
        this.narrator = narrator;
        this.media = media;
    }

    public MasterAgent getMaster() {
        return master;
    }

    /**
     * Restores the most recent save, unless {@code ignoreSaves} is set.
     * A save that cannot be read is reported and left on disk; the caller then plans a new campaign.
     */
    public StartupOutcome resumeLatest(boolean ignoreSaves) {
        if (ignoreSaves) {
            return StartupOutcome.planning(null);
        }
        try {
            ResumeResult result = repository.resumeLatest();
            if (result.isNoSaveFound()) {
                return StartupOutcome.planning(null);
            }
            master.restore(result.state());
            return StartupOutcome.resumed(result.path());
        } catch (CampaignException e) {
            if (!e.isResumeFailure()) {
                throw e;
            }
            log.warn("Could not resume campaign: {}", e.getMessage());
            return StartupOutcome.planning("Could not resume the latest save (" + e.getMessage()
                + "). The file was left untouched; starting a new campaign.");
        }
    }

    /**
     * Replaces the narrator, e.g. after switching models. The scene and its history are kept.
     */
    public void setNarrator(NarrationGenerator narrator) {
        this.narrator = narrator;
    }

    public SceneAgent startScene(String title) {
        return master.spawnScene(title);
    }

    /**
     * Plays one player turn. The narrator is asked first: if it fails, nothing is recorded and the
     * returned result says whether the turn may be retried.
     */
    public TurnResult playerTurn(String input) {
        SceneAgent scene = master.liveScene();
        if (scene == null) {
            scene = master.spawnScene("Scene " + (master.snapshot().getSceneHistory().size() + 1));
        }

        Narration narration;
        try {
            narration = narrator.generate(scene.contextWindow(), input);
        } catch (CollaboratorException e) {
            log.warn("Narrator failed for turn in {}: {}", scene.id(), e.getMessage());
            return TurnResult.failed(e.getFailure(), e.getMessage());
        }

        List<String> warnings = new ArrayList<>();
        CompressionOutcome first = scene.append(TurnRole.PLAYER, input);
        CompressionOutcome outcome = scene.append(TurnRole.NARRATOR, narration.text());
        if (first.status() == CompressionOutcome.Status.FAILED
            || outcome.status() == CompressionOutcome.Status.FAILED) {
            warnings.add("History compression failed; the full history was kept.");
        }
        applyChanges(scene, narration, warnings);

        long sequence = ++turnSequence;
        if (media != null && media.hasRenderers()) {
            String description = narration.sceneDescription().isEmpty()
                ? narration.text() : narration.sceneDescription();
            media.dispatch(sequence, description);
        }

        SceneRecord concluded = null;
        if (narration.sceneEnded()) {
            try {
                concluded = concludeScene();
            } catch (CampaignException e) {
                log.warn("Scene {} could not be concluded: {}", scene.id(), e.getMessage());
                warnings.add("The scene could not be concluded yet: " + e.getMessage());
            }
        }
        return TurnResult.narrated(sequence, narration.text(), outcome, warnings, concluded);
    }

    /**
     * Feeds every utterance of one recording session through {@link #playerTurn(String)}.
     */
    public List<TurnResult> ingest(SpeechToText speechToText, Consumer<TurnResult> onTurn) {
        List<TurnResult> results = new ArrayList<>();
        Iterator<TurnCandidate> candidates = speechToText.transcribe();
        while (candidates.hasNext()) {
            TurnCandidate candidate = candidates.next();
            if (candidate.isBlank()) {
                continue;
            }
            TurnResult result = playerTurn(candidate.text());
            results.add(result);
            onTurn.accept(result);
        }
        return results;
    }

    /**
     * Concludes the live scene and merges it into the campaign.
     *
     * @return the record appended to the scene history
     */
    public SceneRecord concludeScene() {
        SceneAgent scene = master.liveScene();
        if (scene == null) {
            throw new CampaignException(CampaignErrorCode.INVALID_STATE, "No scene is being played");
        }
        SceneDelta delta = scene.conclude();
        lastSave = master.merge(delta);
        return delta.record();
    }

    public void abortScene() {
        SceneAgent scene = master.liveScene();
        if (scene != null) {
            scene.abort();
        }
    }

    /**
     * The most recent background save, for callers that want to wait before exiting.
     */
    public CompletableFuture<Path> lastSave() {
        return lastSave;
    }

    public void trackSave(CompletableFuture<Path> save) {
        this.lastSave = save;
    }

    private void applyChanges(SceneAgent scene, Narration narration, List<String> warnings) {
        for (EntityUpsert upsert : narration.entityUpdates()) {
            scene.recordEntity(upsert.kind(), upsert.entity());
        }
        narration.transition().ifPresent(transition -> {
            try {
                scene.proposeBeatTransition(transition);
            } catch (CampaignException e) {
                log.warn("Ignoring beat transition from narrator: {}", e.getMessage());
                warnings.add("Story plan unchanged: " + e.getMessage());
            }
        });
        for (String thread : narration.newThreads()) {
            recordThread(() -> scene.openThread(thread), warnings);
        }
        for (String thread : narration.resolvedThreads()) {
            recordThread(() -> scene.resolveThread(thread), warnings);
        }
    }

    private void recordThread(Runnable change, List<String> warnings) {
        try {
            change.run();
        } catch (CampaignException e) {
            log.warn("Ignoring thread change from narrator: {}", e.getMessage());
            warnings.add("Thread ignored: " + e.getMessage());
        }
    }

    /**
     * Result of the startup resume attempt.
     *
     * @param warning shown to the player when a save existed but could not be loaded
     */
    public record StartupOutcome(boolean resumed, Path save, String warning) {

        static StartupOutcome resumed(Path save) {
            return new StartupOutcome(true, save, null);
        }

        static StartupOutcome planning(String warning) {
            return new StartupOutcome(false, null, warning);
        }
    }
}
