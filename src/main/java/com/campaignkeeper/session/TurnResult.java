package com.campaignkeeper.session;

import com.campaignkeeper.collaborator.CollaboratorFailure;
import com.campaignkeeper.memory.CompressionOutcome;
import com.campaignkeeper.model.SceneRecord;

import java.util.List;
import java.util.Optional;

/**
 * What happened to one player turn.
 *
 * @param sequence turn sequence number, used to tag media results; 0 when the turn failed
 * @param failure set when the narrator failed; the scene is then unchanged
 * @param concludedScene set when this turn ended the scene and it was merged
 */
public record TurnResult(
    long sequence,
    String narration,
    CompressionOutcome compression,
    List<String> warnings,
    CollaboratorFailure failure,
    String error,
    SceneRecord concludedScene
) {

    public TurnResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    static TurnResult narrated(long sequence, String narration, CompressionOutcome compression,
                               List<String> warnings, SceneRecord concludedScene) {
        return new TurnResult(sequence, narration, compression, warnings, null, null, concludedScene);
    }

    static TurnResult failed(CollaboratorFailure failure, String error) {
        return new TurnResult(0, null, null, List.of(), failure, error, null);
    }

    public boolean succeeded() {
        return failure == null;
    }

    /**
     * A failed turn may be offered again when the failure class is transient.
     */
    public boolean isRetryable() {
        return failure != null && failure.isRetryable();
    }

    public Optional<SceneRecord> sceneConcluded() {
        return Optional.ofNullable(concludedScene);
    }
}
