package com.campaignkeeper.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A concluded scene as stored in the campaign's scene history.
 *
 * @param transcriptRef location of the archived turn transcript, relative to the save directory
 */
public record SceneRecord(
    String sceneId,
    String title,
    Instant startedAt,
    Instant endedAt,
    Summary summary,
    String transcriptRef
) {

    public SceneRecord {
        Objects.requireNonNull(startedAt, "startedAt");
        Objects.requireNonNull(endedAt, "endedAt");
        Objects.requireNonNull(summary, "summary");
        sceneId = Texts.requireName(sceneId, "Scene id");
        title = Texts.requireName(title, "Scene title");
        transcriptRef = Texts.singleLine(transcriptRef);
    }
}
