package com.campaignkeeper.collaborator;

/**
 * One transcribed utterance. The core turns each candidate into exactly one player turn.
 */
public record TurnCandidate(String text) {

    public boolean isBlank() {
        return text == null || text.isBlank();
    }
}
