package com.campaignkeeper.agent;

import com.campaignkeeper.memory.CompressionOutcome;
import com.campaignkeeper.model.Summary;
import com.campaignkeeper.model.Turn;

/**
 * Capabilities shared by the two agent variants. Callers dispatch on the concrete variant
 * explicitly; there is no behaviour inherited between them.
 */
public sealed interface Agent permits MasterAgent, SceneAgent {

    String id();

    /**
     * Appends a turn to this agent's history buffer and applies the compression policy.
     */
    CompressionOutcome acceptTurn(Turn turn);

    /**
     * Summarizes everything this agent's buffer has seen so far.
     */
    Summary produceSummary();
}
