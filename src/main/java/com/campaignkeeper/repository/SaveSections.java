package com.campaignkeeper.repository;

import java.util.List;

/**
 * Top-level section names of a save document, in their required order.
 */
public final class SaveSections {

    public static final String METADATA = "Metadata";
    public static final String WORLD_STATE = "World State";
    public static final String STORY_PLAN = "Story Plan";
    public static final String SCENE_HISTORY = "Scene History";
    public static final String OPEN_THREADS = "Open Threads";

    public static final List<String> ORDER = List.of(METADATA, WORLD_STATE, STORY_PLAN, SCENE_HISTORY, OPEN_THREADS);

    public static final String DELIMITER = "---";

    private SaveSections() {
    }
}
