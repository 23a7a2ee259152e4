package com.campaignkeeper.collaborator;

import java.util.Iterator;

/**
 * Speech-to-text collaborator. One call covers one recording session.
 */
public interface SpeechToText {

    /**
     * Lazily yields the utterances of the current recording session. The sequence is finite.
     */
    Iterator<TurnCandidate> transcribe();
}
