package com.campaignkeeper.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Condensed prose standing in for a run of turns in the active context view.
 * The covered turns themselves stay in the archival transcript.
 *
 * @param sceneId scene the summary belongs to, or {@code null} for campaign-level history
 * @param firstTurn first covered turn, 1-based
 * @param lastTurn last covered turn, 1-based inclusive
 * @param text summary prose
 * @param createdAt when the summary was produced
 * @param forced true when the hard ceiling forced compression without a narrative break
 */
public record Summary(String sceneId, int firstTurn, int lastTurn, String text, Instant createdAt, boolean forced) {

    public Summary {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(createdAt, "createdAt");
        text = text.strip();
        if (firstTurn < 0 || lastTurn < firstTurn) {
            throw new IllegalArgumentException("Invalid turn range " + firstTurn + "-" + lastTurn);
        }
    }

    public int coveredTurns() {
        return firstTurn == 0 ? 0 : lastTurn - firstTurn + 1;
    }

    public String describeCoverage() {
        if (firstTurn == 0) {
            return "none";
        }
        return firstTurn + "-" + lastTurn;
    }
}
