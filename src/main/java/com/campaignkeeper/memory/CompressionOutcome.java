package com.campaignkeeper.memory;

import com.campaignkeeper.model.Summary;

import java.util.Optional;

/**
 * Result of a compression check after a turn was appended.
 */
public record CompressionOutcome(Status status, BreakReason breakReason, Summary summary, int costBefore, int costAfter) {

    public enum Status {
        /** Cost within budget. */
        WITHIN_BUDGET,
        /** Over budget but no natural break yet. */
        DEFERRED,
        /** Compressed at a natural break. */
        COMPRESSED,
        /** Hard ceiling crossed; compressed without a break (policy fallback). */
        FORCED,
        /** Summarization failed; the buffer was left uncompressed. */
        FAILED
    }

    static CompressionOutcome withinBudget(int cost) {
        return new CompressionOutcome(Status.WITHIN_BUDGET, null, null, cost, cost);
    }

    static CompressionOutcome deferred(int cost) {
        return new CompressionOutcome(Status.DEFERRED, null, null, cost, cost);
    }

    public static CompressionOutcome failed(int cost) {
        return new CompressionOutcome(Status.FAILED, null, null, cost, cost);
    }

    public boolean compressed() {
        return status == Status.COMPRESSED || status == Status.FORCED;
    }

    public Optional<Summary> summaryIfAny() {
        return Optional.ofNullable(summary);
    }
}
