package com.campaignkeeper.repository;

import com.campaignkeeper.model.Turn;

import java.util.List;

/**
 * Archive of full scene transcripts. Compression never touches these.
 */
public interface TranscriptStore {

    /**
     * Writes the transcript and returns a reference relative to the save directory.
     */
    String write(String campaignSlug, String sceneId, List<Turn> turns);

    List<Turn> read(String transcriptRef);

    void delete(String transcriptRef);
}
