package com.campaignkeeper.collaborator;

import com.campaignkeeper.memory.ContextWindow;

/**
 * Language-generation collaborator.
 */
public interface NarrationGenerator {

    /**
     * Generates the narrator's reply to the player's input.
     *
     * @throws com.campaignkeeper.exception.CollaboratorException on any failure; never retried here
     */
    Narration generate(ContextWindow context, String playerInput);
}
