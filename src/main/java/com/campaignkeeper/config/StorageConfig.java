package com.campaignkeeper.config;

import java.nio.file.Path;

/**
 * Location of save files and scene transcripts.
 */
public final class StorageConfig {

    private static final String DEFAULT_SAVES_DIR = "saves";

    private StorageConfig() {
    }

    public static Path getSavesDirectory() {
        String dir = System.getenv("CAMPAIGN_SAVES_DIR");
        if (dir != null && !dir.isBlank()) {
            return Path.of(dir);
        }
        return Path.of(DEFAULT_SAVES_DIR);
    }
}
