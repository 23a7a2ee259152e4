package com.campaignkeeper.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A single conversational turn. Immutable once appended to a history buffer.
 *
 * @param role who produced the turn
 * @param content the turn text, kept verbatim
 * @param timestamp strictly increasing within a buffer
 * @param sceneId scene the turn belongs to, or {@code null} for campaign-level turns
 */
public record Turn(TurnRole role, String content, Instant timestamp, String sceneId) {

    public Turn {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public static Turn player(String content, Instant timestamp, String sceneId) {
        return new Turn(TurnRole.PLAYER, content, timestamp, sceneId);
    }

    public static Turn narrator(String content, Instant timestamp, String sceneId) {
        return new Turn(TurnRole.NARRATOR, content, timestamp, sceneId);
    }

    public static Turn npc(String content, Instant timestamp, String sceneId) {
        return new Turn(TurnRole.NPC, content, timestamp, sceneId);
    }

    public Turn inScene(String scene) {
        return new Turn(role, content, timestamp, scene);
    }
}
