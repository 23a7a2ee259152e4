package com.campaignkeeper.repository;

import com.campaignkeeper.model.CampaignState;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Durable storage of campaign state.
 * Separates the canonical save document from the per-scene transcript archive.
 */
public interface CampaignRepository {

    /**
     * Writes a save file atomically: no partially written file is ever visible under its final name.
     */
    Path save(CampaignState state);

    /**
     * Queues a save of an immutable snapshot. Saves complete in submission order and never overlap.
     */
    CompletableFuture<Path> saveAsync(CampaignState snapshot);

    CampaignState load(Path path);

    /**
     * Loads the most recently modified save of the given campaign.
     */
    ResumeResult resume(String campaignSlug);

    /**
     * Loads the most recently modified save of any campaign.
     */
    ResumeResult resumeLatest();

    List<Path> listSaves();
}
