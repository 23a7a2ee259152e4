package com.campaignkeeper.memory;

import com.campaignkeeper.exception.CampaignErrorCode;
import com.campaignkeeper.exception.CampaignException;
import com.campaignkeeper.model.Summary;
import com.campaignkeeper.model.Turn;
import dev.langchain4j.model.TokenCountEstimator;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Append-only turn log owned by a single agent.
 *
 * <p>Every appended turn is kept for the archival transcript. Compression only moves the
 * {@code compactedCount} boundary: turns before it are represented in the active context view
 * by the latest rolling {@link Summary}, turns after it are shown verbatim.</p>
 */
public class HistoryBuffer {

    private final String ownerId;
    private final TokenCountEstimator estimator;
    private final List<Turn> turns = new ArrayList<>();
    private final List<Integer> turnCosts = new ArrayList<>();
    private final List<Summary> summaries = new ArrayList<>();
    private int compactedCount;

    public HistoryBuffer(String ownerId, TokenCountEstimator estimator) {
        this.ownerId = ownerId;
        this.estimator = estimator;
    }

    public String getOwnerId() {
        return ownerId;
    }

    /**
     * Appends a turn.
     *
     * @throws CampaignException with {@link CampaignErrorCode#INVALID_TURN_ORDER} when the timestamp
     *     is not strictly after the previous turn's; the buffer is unchanged
     */
    public void append(Turn turn) {
        if (!turns.isEmpty()) {
            Turn last = turns.get(turns.size() - 1);
            if (!turn.timestamp().isAfter(last.timestamp())) {
                throw new CampaignException(CampaignErrorCode.INVALID_TURN_ORDER,
                    "Turn at " + turn.timestamp() + " is not after " + last.timestamp() + " in " + ownerId);
            }
        }
        turns.add(turn);
        turnCosts.add(estimator.estimateTokenCountInText(turn.content()));
    }

    /**
     * Estimated token cost of the active context view: the rolling summary plus uncompacted turns.
     */
    public int size() {
        int cost = latestSummary().map(s -> estimator.estimateTokenCountInText(s.text())).orElse(0);
        for (int i = compactedCount; i < turnCosts.size(); i++) {
            cost += turnCosts.get(i);
        }
        return cost;
    }

    /**
     * All appended turns in append order, read-only.
     */
    public List<Turn> snapshot() {
        return List.copyOf(turns);
    }

    public List<Turn> activeTurns() {
        return List.copyOf(turns.subList(compactedCount, turns.size()));
    }

    public Optional<Summary> latestSummary() {
        return summaries.isEmpty() ? Optional.empty() : Optional.of(summaries.get(summaries.size() - 1));
    }

    public List<Summary> summaries() {
        return List.copyOf(summaries);
    }

    public int compactedCount() {
        return compactedCount;
    }

    public int turnCount() {
        return turns.size();
    }

    public boolean isEmpty() {
        return turns.isEmpty();
    }

    public Optional<Turn> lastTurn() {
        return turns.isEmpty() ? Optional.empty() : Optional.of(turns.get(turns.size() - 1));
    }

    /**
     * Discards every turn and summary. Used when a scene is aborted.
     */
    public void discard() {
        turns.clear();
        turnCosts.clear();
        summaries.clear();
        compactedCount = 0;
    }

    void compact(int throughCount, Summary summary) {
        if (throughCount <= compactedCount || throughCount > turns.size()) {
            throw new IllegalArgumentException("Cannot compact through " + throughCount
                + " (compacted=" + compactedCount + ", turns=" + turns.size() + ")");
        }
        summaries.add(summary);
        compactedCount = throughCount;
    }

    void recordSummary(Summary summary) {
        summaries.add(summary);
        compactedCount = turns.size();
    }
}
