package com.campaignkeeper.collaborator;

import com.campaignkeeper.model.BeatTransition;
import com.campaignkeeper.model.EntityUpsert;

import java.util.List;
import java.util.Optional;

/**
 * Output of the language-generation collaborator: the narration and any structured changes it
 * proposes for the scene.
 *
 * @param sceneDescription short visual description for media renderers, may be empty
 */
public record Narration(
    String text,
    List<EntityUpsert> entityUpdates,
    BeatTransition beatTransition,
    List<String> newThreads,
    List<String> resolvedThreads,
    boolean sceneEnded,
    String sceneDescription
) {

    public Narration {
        entityUpdates = entityUpdates == null ? List.of() : List.copyOf(entityUpdates);
        newThreads = newThreads == null ? List.of() : List.copyOf(newThreads);
        resolvedThreads = resolvedThreads == null ? List.of() : List.copyOf(resolvedThreads);
        sceneDescription = sceneDescription == null ? "" : sceneDescription.strip();
    }

    public static Narration text(String text) {
        return new Narration(text, List.of(), null, List.of(), List.of(), false, "");
    }

    public Optional<BeatTransition> transition() {
        return Optional.ofNullable(beatTransition);
    }
}
