package com.campaignkeeper.repository;

import com.campaignkeeper.model.CampaignState;

import java.nio.file.Path;

/**
 * Outcome of a resume lookup. A missing save is a normal signal, not an error.
 */
public record ResumeResult(Status status, CampaignState state, Path path) {

    public enum Status {
        RESTORED,
        NO_SAVE_FOUND
    }

    public static ResumeResult restored(CampaignState state, Path path) {
        return new ResumeResult(Status.RESTORED, state, path);
    }

    public static ResumeResult noSaveFound() {
        return new ResumeResult(Status.NO_SAVE_FOUND, null, null);
    }

    public boolean isNoSaveFound() {
        return status == Status.NO_SAVE_FOUND;
    }
}
