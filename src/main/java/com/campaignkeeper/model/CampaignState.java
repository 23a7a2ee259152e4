package com.campaignkeeper.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The complete campaign: metadata, world state, story plan, scene history and open threads.
 * Owned by a single master agent and the unit of persistence.
 */
public class CampaignState {

    public static final int CURRENT_VERSION = 1;

    private final int version;
    private final String name;
    private final Instant createdAt;
    private Instant lastPlayedAt;
    private final WorldState worldState;
    private final StoryPlan storyPlan;
    private final List<SceneRecord> sceneHistory;
    private final List<OpenThread> openThreads;
    // save-file section name -> free-form lines found inside that section
    private final Map<String, List<String>> preservedContent;

    public CampaignState(
        int version,
        String name,
        Instant createdAt,
        Instant lastPlayedAt,
        WorldState worldState,
        StoryPlan storyPlan,
        List<SceneRecord> sceneHistory,
        List<OpenThread> openThreads,
        Map<String, List<String>> preservedContent
    ) {
        this.version = version;
        this.name = Texts.requireName(name, "Campaign name");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.lastPlayedAt = Objects.requireNonNull(lastPlayedAt, "lastPlayedAt");
        this.worldState = Objects.requireNonNull(worldState, "worldState");
        this.storyPlan = Objects.requireNonNull(storyPlan, "storyPlan");
        this.sceneHistory = new ArrayList<>(sceneHistory);
        this.openThreads = new ArrayList<>(openThreads);
        this.preservedContent = new LinkedHashMap<>();
        preservedContent.forEach((section, lines) -> this.preservedContent.put(section, List.copyOf(lines)));
    }

    public static CampaignState create(String name, Instant now) {
        return new CampaignState(CURRENT_VERSION, name, now, now, new WorldState(), new StoryPlan(),
            List.of(), List.of(), Map.of());
    }

    public int getVersion() {
        return version;
    }

    public String getName() {
        return name;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastPlayedAt() {
        return lastPlayedAt;
    }

    public void setLastPlayedAt(Instant lastPlayedAt) {
        this.lastPlayedAt = Objects.requireNonNull(lastPlayedAt, "lastPlayedAt");
    }

    public WorldState getWorldState() {
        return worldState;
    }

    public StoryPlan getStoryPlan() {
        return storyPlan;
    }

    public List<SceneRecord> getSceneHistory() {
        return Collections.unmodifiableList(sceneHistory);
    }

    /**
     * Appends a concluded scene. Scene history is append-only and scene ids are unique.
     */
    public void appendScene(SceneRecord scene) {
        boolean duplicate = sceneHistory.stream().anyMatch(s -> s.sceneId().equals(scene.sceneId()));
        if (duplicate) {
            throw new IllegalArgumentException("Scene already recorded: " + scene.sceneId());
        }
        sceneHistory.add(scene);
    }

    public List<OpenThread> getOpenThreads() {
        return Collections.unmodifiableList(openThreads);
    }

    public void addThread(OpenThread thread) {
        openThreads.add(thread);
    }

    /**
     * Marks the thread at the given 0-based position resolved.
     */
    public void resolveThread(int index) {
        if (index < 0 || index >= openThreads.size()) {
            throw new IllegalArgumentException("No open thread at position " + (index + 1));
        }
        openThreads.set(index, openThreads.get(index).resolve());
    }

    /**
     * Resolves the first unresolved thread whose text matches, ignoring case.
     *
     * @return false when no unresolved thread matched
     */
    public boolean resolveThread(String text) {
        String wanted = Texts.singleLine(text);
        for (int i = 0; i < openThreads.size(); i++) {
            OpenThread thread = openThreads.get(i);
            if (!thread.resolved() && thread.text().equalsIgnoreCase(wanted)) {
                openThreads.set(i, thread.resolve());
                return true;
            }
        }
        return false;
    }

    public Map<String, List<String>> getPreservedContent() {
        return Collections.unmodifiableMap(preservedContent);
    }

    public List<String> preservedLines(String section) {
        return preservedContent.getOrDefault(section, List.of());
    }

    public CampaignState copy() {
        return new CampaignState(version, name, createdAt, lastPlayedAt, worldState.copy(), storyPlan.copy(),
            sceneHistory, openThreads, preservedContent);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CampaignState other)) {
            return false;
        }
        return version == other.version
            && name.equals(other.name)
            && createdAt.equals(other.createdAt)
            && lastPlayedAt.equals(other.lastPlayedAt)
            && worldState.equals(other.worldState)
            && storyPlan.equals(other.storyPlan)
            && sceneHistory.equals(other.sceneHistory)
            && openThreads.equals(other.openThreads)
            && preservedContent.equals(other.preservedContent);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, name, createdAt, worldState, storyPlan, sceneHistory, openThreads);
    }

    @Override
    public String toString() {
        return "CampaignState{name=" + name + ", scenes=" + sceneHistory.size()
            + ", beats=" + storyPlan.size() + ", entities=" + worldState.size() + "}";
    }
}
