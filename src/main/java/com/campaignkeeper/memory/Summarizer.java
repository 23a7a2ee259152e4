package com.campaignkeeper.memory;

import com.campaignkeeper.model.Turn;

import java.util.List;

/**
 * Condenses turns into prose that keeps plot facts, relationship changes, new names and
 * location transitions while dropping verbatim dialogue.
 */
public interface Summarizer {

    /**
     * @param previousSummary the rolling summary the new one must fold in, or {@code null}
     * @param turns turns being compacted, possibly empty
     * @param maxChars target length of the result
     * @return summary prose; blank output is treated as a failure by the caller
     */
    String summarize(String previousSummary, List<Turn> turns, int maxChars);
}
