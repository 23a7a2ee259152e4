package com.campaignkeeper.agent;

import com.campaignkeeper.model.BeatTransition;
import com.campaignkeeper.model.EntityUpsert;
import com.campaignkeeper.model.SceneRecord;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything a concluded scene hands back to the master agent. Applied atomically by
 * {@link MasterAgent#merge(SceneDelta)}.
 *
 * @param beatTransition at most one beat transition, or {@code null}
 */
public record SceneDelta(
    String sceneId,
    List<EntityUpsert> upserts,
    BeatTransition beatTransition,
    List<String> newThreads,
    List<String> resolvedThreads,
    SceneRecord record
) {

    public SceneDelta {
        Objects.requireNonNull(sceneId, "sceneId");
        Objects.requireNonNull(record, "record");
        upserts = List.copyOf(upserts);
        newThreads = List.copyOf(newThreads);
        resolvedThreads = List.copyOf(resolvedThreads);
    }

    public Optional<BeatTransition> transition() {
        return Optional.ofNullable(beatTransition);
    }
}
