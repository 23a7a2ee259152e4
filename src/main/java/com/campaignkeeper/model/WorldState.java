package com.campaignkeeper.model;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Canonical world facts, independent of conversation text.
 * Names are unique per collection ignoring case; upserts are last-write-wins.
 */
public class WorldState {

    private final Map<EntityKind, LinkedHashMap<String, WorldEntity>> collections = new EnumMap<>(EntityKind.class);

    public WorldState() {
        for (EntityKind kind : EntityKind.values()) {
            collections.put(kind, new LinkedHashMap<>());
        }
    }

    public void upsert(EntityKind kind, WorldEntity entity) {
        collections.get(kind).put(entity.key(), entity);
    }

    public void upsert(EntityUpsert upsert) {
        upsert(upsert.kind(), upsert.entity());
    }

    public Optional<WorldEntity> find(EntityKind kind, String name) {
        return Optional.ofNullable(collections.get(kind).get(WorldEntity.key(name)));
    }

    public List<WorldEntity> entities(EntityKind kind) {
        return List.copyOf(collections.get(kind).values());
    }

    public int size() {
        return collections.values().stream().mapToInt(Map::size).sum();
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Compact one-paragraph rendering used as the world excerpt of a context window.
     */
    public String excerpt(int maxChars) {
        List<String> parts = new ArrayList<>();
        for (EntityKind kind : EntityKind.values()) {
            List<WorldEntity> entities = entities(kind);
            if (entities.isEmpty()) {
                continue;
            }
            List<String> rendered = new ArrayList<>();
            for (WorldEntity entity : entities) {
                rendered.add(entity.description().isEmpty()
                    ? entity.name()
                    : entity.name() + " (" + entity.description() + ")");
            }
            parts.add(kind.heading() + ": " + String.join("; ", rendered));
        }
        String text = String.join("\n", parts);
        return text.length() <= maxChars ? text : text.substring(0, Math.max(0, maxChars - 3)) + "...";
    }

    public WorldState copy() {
        WorldState copy = new WorldState();
        collections.forEach((kind, entities) -> copy.collections.get(kind).putAll(entities));
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WorldState other)) {
            return false;
        }
        for (EntityKind kind : EntityKind.values()) {
            if (!entities(kind).equals(other.entities(kind))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        return collections.hashCode();
    }
}
